package io.platoonmesh.session;

import io.platoonmesh.model.Vector3;

/**
 * What the simulation reports about a vehicle at one instant. Heading is a yaw angle in degrees.
 */
public record VehicleReading(Vector3 position, Vector3 velocity, double heading, long timestampMs) {
}
