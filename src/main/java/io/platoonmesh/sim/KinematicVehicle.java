package io.platoonmesh.sim;

import io.platoonmesh.model.Vector3;
import io.platoonmesh.session.VehicleHandle;
import io.platoonmesh.session.VehicleHandleException;
import io.platoonmesh.session.VehicleReading;

import java.util.function.LongSupplier;

/**
 * Point-mass vehicle on a flat plane. Throttle and brake map linearly to acceleration, steer to
 * yaw rate; the vehicle never reverses.
 */
public final class KinematicVehicle implements VehicleHandle {
    static final double MAX_ACCELERATION = 3.5;
    static final double MAX_BRAKING = 8.0;
    static final double ROLLING_RESISTANCE = 0.1;
    static final double DRAG_COEFFICIENT = 0.01;
    static final double MAX_YAW_RATE_DEGREES = 30.0;

    private final String id;
    private final String blueprint;
    private final LongSupplier clock;
    private Vector3 position;
    private double heading;
    private double speed;
    private double throttle;
    private double brake;
    private double steer;
    private boolean destroyed;

    public KinematicVehicle(String id, String blueprint, Vector3 position, double heading, LongSupplier clock) {
        this.id = id;
        this.blueprint = blueprint;
        this.position = position;
        this.heading = heading;
        this.clock = clock;
    }

    public String id() {
        return id;
    }

    public String blueprint() {
        return blueprint;
    }

    @Override
    public synchronized VehicleReading getState() {
        ensureAlive();
        Vector3 velocity = Vector3.headingUnit(heading).scale(speed);
        return new VehicleReading(position, velocity, heading, clock.getAsLong());
    }

    @Override
    public synchronized void applyControl(double throttle, double brake, double steer) {
        ensureAlive();
        this.throttle = clamp(throttle, 0.0, 1.0);
        this.brake = clamp(brake, 0.0, 1.0);
        this.steer = clamp(steer, -1.0, 1.0);
    }

    /**
     * Advances the vehicle by {@code dtSeconds} of simulated time.
     */
    public synchronized void step(double dtSeconds) {
        if (destroyed || dtSeconds <= 0.0) {
            return;
        }
        double acceleration = throttle * MAX_ACCELERATION - brake * MAX_BRAKING;
        if (speed > 0.0) {
            acceleration -= ROLLING_RESISTANCE + DRAG_COEFFICIENT * speed * speed;
        }
        double nextSpeed = Math.max(0.0, speed + acceleration * dtSeconds);
        double averageSpeed = (speed + nextSpeed) / 2.0;
        if (averageSpeed > 0.0) {
            heading = normalize(heading + steer * MAX_YAW_RATE_DEGREES * dtSeconds);
        }
        position = position.plus(Vector3.headingUnit(heading).scale(averageSpeed * dtSeconds));
        speed = nextSpeed;
    }

    public synchronized double speed() {
        return speed;
    }

    public synchronized Vector3 position() {
        return position;
    }

    public synchronized void destroy() {
        destroyed = true;
    }

    public synchronized boolean isDestroyed() {
        return destroyed;
    }

    private void ensureAlive() {
        if (destroyed) {
            throw new VehicleHandleException("vehicle " + id + " was destroyed");
        }
    }

    private static double normalize(double degrees) {
        double d = degrees % 360.0;
        return d < 0.0 ? d + 360.0 : d;
    }

    private static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }
}
