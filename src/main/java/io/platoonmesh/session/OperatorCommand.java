package io.platoonmesh.session;

public record OperatorCommand(Kind kind, double value) {
    public enum Kind {
        JOIN,
        LEAVE,
        SET_GAP,
        SET_SPEED,
        RUN_SCRIPT,
        STOP_SCRIPT
    }

    public static OperatorCommand join() {
        return new OperatorCommand(Kind.JOIN, 0.0);
    }

    public static OperatorCommand leave() {
        return new OperatorCommand(Kind.LEAVE, 0.0);
    }

    public static OperatorCommand setGap(double meters) {
        return new OperatorCommand(Kind.SET_GAP, meters);
    }

    public static OperatorCommand setSpeed(double metersPerSecond) {
        return new OperatorCommand(Kind.SET_SPEED, metersPerSecond);
    }

    /**
     * Starts built-in lead script {@code number}; only honored while leading.
     */
    public static OperatorCommand runScript(int number) {
        return new OperatorCommand(Kind.RUN_SCRIPT, number);
    }

    public static OperatorCommand stopScript() {
        return new OperatorCommand(Kind.STOP_SCRIPT, 0.0);
    }
}
