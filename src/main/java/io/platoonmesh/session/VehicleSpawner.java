package io.platoonmesh.session;

import io.platoonmesh.model.Vector3;

public interface VehicleSpawner {
    VehicleHandle spawn(String blueprint, Vector3 location);
}
