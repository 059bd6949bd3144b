package io.platoonmesh.protocol;

import io.platoonmesh.model.VehicleState;

/**
 * Latest state received from the current predecessor and when it arrived locally.
 */
public record PredecessorTrack(VehicleState state, long receivedAtMs) {
}
