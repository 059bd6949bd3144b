package io.platoonmesh.session;

/**
 * A vehicle owned by the simulation. Both methods throw {@link VehicleHandleException} once the
 * vehicle no longer exists.
 */
public interface VehicleHandle {
    VehicleReading getState();

    void applyControl(double throttle, double brake, double steer);
}
