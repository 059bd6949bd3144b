package io.platoonmesh.control;

import io.platoonmesh.model.ControlCommand;
import io.platoonmesh.model.Vector3;
import io.platoonmesh.model.VehicleState;
import io.platoonmesh.protocol.PredecessorTrack;
import io.platoonmesh.protocol.Role;

/**
 * Proportional-derivative longitudinal law plus proportional lateral law, evaluated once per tick.
 *
 * <p>Followers: {@code a = kp * (gap - targetGap) + kd * dv}, where gap is the distance to the
 * predecessor along the own heading and dv the predecessor's speed minus the own speed. Leaders
 * use the same law with zero gap error against the target speed. Positive acceleration maps to
 * throttle, negative to brake, never both.
 */
public final class GapKeepingController {
    private static final double DEADBAND = 1e-3;

    private final ControllerSettings settings;
    private volatile double targetGapMeters;
    private volatile double targetSpeedMps;
    private double smoothedRelativeSpeed;
    private boolean hasHistory;
    private ControlMode mode = ControlMode.IDLE;

    public GapKeepingController(ControllerSettings settings, double targetGapMeters, double targetSpeedMps) {
        this.settings = settings;
        setTargetGap(targetGapMeters);
        setTargetSpeed(targetSpeedMps);
    }

    public void setTargetGap(double meters) {
        if (!Double.isFinite(meters) || meters <= 0.0) {
            throw new IllegalArgumentException("target gap must be a positive number of meters: " + meters);
        }
        this.targetGapMeters = meters;
    }

    public void setTargetSpeed(double metersPerSecond) {
        if (!Double.isFinite(metersPerSecond) || metersPerSecond < 0.0) {
            throw new IllegalArgumentException("target speed must be a non-negative number of m/s: " + metersPerSecond);
        }
        this.targetSpeedMps = metersPerSecond;
    }

    public double targetGapMeters() {
        return targetGapMeters;
    }

    public double targetSpeedMps() {
        return targetSpeedMps;
    }

    public ControlMode mode() {
        return mode;
    }

    /**
     * Forgets filtered measurements so a new predecessor starts from a clean slate.
     */
    public void reset() {
        hasHistory = false;
        smoothedRelativeSpeed = 0.0;
    }

    /**
     * @param track    latest predecessor data, or {@code null} if none is available
     * @param failSafe forces the fixed deceleration profile regardless of any other input
     */
    public ControlCommand compute(Role role, PredecessorTrack track, VehicleState own, boolean failSafe) {
        if (failSafe || (role.isFollower() && track == null)) {
            mode = ControlMode.FAIL_SAFE;
            return ControlCommand.brake(settings.failSafeBrake(), 0.0);
        }
        return switch (role.kind()) {
            case DETACHED -> {
                mode = ControlMode.IDLE;
                yield ControlCommand.COAST;
            }
            case LEADER -> {
                mode = ControlMode.CRUISE;
                double dv = targetSpeedMps - own.speedAlong(own.heading());
                yield toCommand(settings.kd() * dv, 0.0);
            }
            case FOLLOWER -> {
                mode = ControlMode.GAP_KEEPING;
                yield follow(track.state(), own);
            }
        };
    }

    private ControlCommand follow(VehicleState predecessor, VehicleState own) {
        Vector3 heading = Vector3.headingUnit(own.heading());
        Vector3 offset = predecessor.position().minus(own.position());
        // Overlap (predecessor at or behind us) counts as zero gap, which bounds the error.
        double gap = Math.max(0.0, offset.dot(heading));
        double error = gap - targetGapMeters;

        double rawRelativeSpeed = predecessor.speedAlong(own.heading()) - own.speedAlong(own.heading());
        double relativeSpeed = hasHistory
                ? settings.relativeSpeedSmoothing() * rawRelativeSpeed
                + (1.0 - settings.relativeSpeedSmoothing()) * smoothedRelativeSpeed
                : rawRelativeSpeed;
        smoothedRelativeSpeed = relativeSpeed;
        hasHistory = true;

        double acceleration = settings.kp() * error + settings.kd() * relativeSpeed;

        double lateralOffset = offset.y() * heading.x() - offset.x() * heading.y();
        double headingError = normalizeDegrees(predecessor.heading() - own.heading());
        double steer = settings.headingGain() * headingError + settings.lateralGain() * lateralOffset;
        return toCommand(acceleration, steer);
    }

    private ControlCommand toCommand(double acceleration, double steer) {
        double a = clamp(acceleration, -settings.maxDeceleration(), settings.maxAcceleration());
        double s = clamp(steer, -1.0, 1.0);
        if (a > DEADBAND) {
            return ControlCommand.throttle(Math.min(1.0, a / settings.maxAcceleration()), s);
        }
        if (a < -DEADBAND) {
            return ControlCommand.brake(Math.min(1.0, -a / settings.maxDeceleration()), s);
        }
        return new ControlCommand(0.0, 0.0, s);
    }

    static double normalizeDegrees(double degrees) {
        double d = degrees % 360.0;
        if (d > 180.0) {
            d -= 360.0;
        } else if (d <= -180.0) {
            d += 360.0;
        }
        return d;
    }

    private static double clamp(double value, double min, double max) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(min, Math.min(max, value));
    }
}
