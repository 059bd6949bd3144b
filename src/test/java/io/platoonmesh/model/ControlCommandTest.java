package io.platoonmesh.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ControlCommandTest {
    @Test
    void rejectsThrottleAndBrakeTogether() {
        assertThrows(IllegalArgumentException.class, () -> new ControlCommand(0.2, 0.1, 0.0));
    }

    @Test
    void rejectsOutOfRangeValues() {
        assertThrows(IllegalArgumentException.class, () -> new ControlCommand(1.1, 0.0, 0.0));
        assertThrows(IllegalArgumentException.class, () -> new ControlCommand(0.0, -0.1, 0.0));
        assertThrows(IllegalArgumentException.class, () -> new ControlCommand(0.0, 0.0, 1.5));
        assertThrows(IllegalArgumentException.class, () -> new ControlCommand(Double.NaN, 0.0, 0.0));
    }

    @Test
    void factoriesLeaveTheOtherPedalReleased() {
        ControlCommand throttle = ControlCommand.throttle(0.4, -0.2);
        assertEquals(0.0, throttle.brake());
        assertEquals(-0.2, throttle.steer());

        ControlCommand brake = ControlCommand.brake(1.0, 0.0);
        assertEquals(0.0, brake.throttle());
        assertEquals(1.0, brake.brake());
    }
}
