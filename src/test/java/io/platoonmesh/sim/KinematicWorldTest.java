package io.platoonmesh.sim;

import io.platoonmesh.model.Vector3;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class KinematicWorldTest {
    @Test
    void formationSlotsLineUpBehindTheLead() {
        assertEquals(new Vector3(-20.0, -15.0, 0.1), KinematicWorld.formationSlot(0));
        assertEquals(new Vector3(-34.0, -15.0, 0.1), KinematicWorld.formationSlot(2));
        assertThrows(IllegalArgumentException.class, () -> KinematicWorld.formationSlot(-1));
    }

    @Test
    void occupiedSpawnLocationIsRejected() {
        KinematicWorld world = new KinematicWorld(() -> 0L);
        world.spawn("vehicle.test", KinematicWorld.formationSlot(0));
        world.spawn("vehicle.test", KinematicWorld.formationSlot(1));
        assertThrows(IllegalStateException.class, () -> world.spawn("vehicle.test", KinematicWorld.formationSlot(1)));
        assertEquals(2, world.vehicles().size());
    }

    @Test
    void nonPositiveStepPeriodIsRejected() {
        try (KinematicWorld world = new KinematicWorld()) {
            assertThrows(IllegalArgumentException.class, () -> world.start(0L));
            assertThrows(IllegalArgumentException.class, () -> world.start(-5L));
        }
    }

    @Test
    void stepAdvancesEveryVehicle() throws Exception {
        try (KinematicWorld world = new KinematicWorld()) {
            KinematicVehicle first = world.spawn("vehicle.test", KinematicWorld.formationSlot(0));
            KinematicVehicle second = world.spawn("vehicle.test", KinematicWorld.formationSlot(1));
            first.applyControl(1.0, 0.0, 0.0);
            second.applyControl(1.0, 0.0, 0.0);
            world.step(0.5);
            assertEquals(1.75, first.speed(), 1e-9);
            assertEquals(1.75, second.speed(), 1e-9);

            world.start(5L);
            double before = first.position().x();
            Thread.sleep(100L);
            assertTrue(first.position().x() > before);
        }
    }
}
