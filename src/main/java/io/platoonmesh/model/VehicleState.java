package io.platoonmesh.model;

import java.util.Objects;

/**
 * State a vehicle reports about itself once per control tick. Heading is a yaw angle in degrees.
 */
public record VehicleState(
        PeerId peerId,
        Vector3 position,
        Vector3 velocity,
        double heading,
        long sequence,
        long timestampMs
) implements PlatoonMessage {
    public VehicleState {
        Objects.requireNonNull(peerId, "peerId");
        position = position == null ? Vector3.ZERO : position;
        velocity = velocity == null ? Vector3.ZERO : velocity;
    }

    @Override
    public MessageKind kind() {
        return MessageKind.STATE;
    }

    @Override
    public PeerId sender() {
        return peerId;
    }

    public double speed() {
        return velocity.horizontalLength();
    }

    /**
     * Signed speed along the given heading; negative when moving against it.
     */
    public double speedAlong(double headingDegrees) {
        return velocity.dot(Vector3.headingUnit(headingDegrees));
    }
}
