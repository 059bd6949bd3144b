package io.platoonmesh.session;

public enum SessionOutcome {
    LEFT(0),
    CONNECTION_LOST(2),
    VEHICLE_FAILURE(3),
    INTERRUPTED(130);

    private final int exitCode;

    SessionOutcome(int exitCode) {
        this.exitCode = exitCode;
    }

    public int exitCode() {
        return exitCode;
    }
}
