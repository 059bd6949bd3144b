package io.platoonmesh.session;

/**
 * The simulation can no longer drive the vehicle, for example because it was destroyed. Fatal to
 * the owning session.
 */
public class VehicleHandleException extends RuntimeException {
    public VehicleHandleException(String message) {
        super(message);
    }

    public VehicleHandleException(String message, Throwable cause) {
        super(message, cause);
    }
}
