package io.platoonmesh.control;

import io.platoonmesh.config.PlatoonSettings;

/**
 * Gains and limits of the gap-keeping law.
 *
 * @param kp                     acceleration per meter of gap error
 * @param kd                     acceleration per m/s of relative speed
 * @param maxAcceleration        upper clamp of the commanded acceleration, maps to full throttle
 * @param maxDeceleration        magnitude of the lower clamp, maps to full brake
 * @param headingGain            steer per degree of heading error
 * @param lateralGain            steer per meter of lateral offset to the predecessor
 * @param failSafeBrake          brake applied in fail-safe mode
 * @param relativeSpeedSmoothing weight of the newest relative speed sample, in (0, 1]
 */
public record ControllerSettings(
        double kp,
        double kd,
        double maxAcceleration,
        double maxDeceleration,
        double headingGain,
        double lateralGain,
        double failSafeBrake,
        double relativeSpeedSmoothing
) {
    public ControllerSettings {
        if (maxAcceleration <= 0.0 || maxDeceleration <= 0.0) {
            throw new IllegalArgumentException("acceleration limits must be positive");
        }
        if (failSafeBrake <= 0.0 || failSafeBrake > 1.0) {
            throw new IllegalArgumentException("failSafeBrake must be in (0,1]: " + failSafeBrake);
        }
        if (relativeSpeedSmoothing <= 0.0 || relativeSpeedSmoothing > 1.0) {
            throw new IllegalArgumentException("relativeSpeedSmoothing must be in (0,1]: " + relativeSpeedSmoothing);
        }
    }

    public static ControllerSettings from(PlatoonSettings settings) {
        return new ControllerSettings(
                settings.kp(),
                settings.kd(),
                settings.maxAcceleration(),
                settings.maxDeceleration(),
                settings.headingGain(),
                settings.lateralGain(),
                settings.failSafeBrake(),
                settings.relativeSpeedSmoothing()
        );
    }
}
