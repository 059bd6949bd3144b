package io.platoonmesh.model;

/**
 * Actuator command for one tick. Throttle and brake are mutually exclusive.
 */
public record ControlCommand(double throttle, double brake, double steer) {
    public static final ControlCommand COAST = new ControlCommand(0.0, 0.0, 0.0);

    public ControlCommand {
        if (Double.isNaN(throttle) || throttle < 0.0 || throttle > 1.0) {
            throw new IllegalArgumentException("throttle out of range [0,1]: " + throttle);
        }
        if (Double.isNaN(brake) || brake < 0.0 || brake > 1.0) {
            throw new IllegalArgumentException("brake out of range [0,1]: " + brake);
        }
        if (Double.isNaN(steer) || steer < -1.0 || steer > 1.0) {
            throw new IllegalArgumentException("steer out of range [-1,1]: " + steer);
        }
        if (throttle > 0.0 && brake > 0.0) {
            throw new IllegalArgumentException("throttle and brake must not both be applied");
        }
    }

    public static ControlCommand throttle(double throttle, double steer) {
        return new ControlCommand(throttle, 0.0, steer);
    }

    public static ControlCommand brake(double brake, double steer) {
        return new ControlCommand(0.0, brake, steer);
    }
}
