package io.platoonmesh.client;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ReconnectPolicyTest {
    @Test
    void backoffDoublesUpToTheCap() {
        ReconnectPolicy policy = new ReconnectPolicy(500L, 8_000L, 6);
        assertEquals(500L, policy.delayMs(1));
        assertEquals(1_000L, policy.delayMs(2));
        assertEquals(2_000L, policy.delayMs(3));
        assertEquals(4_000L, policy.delayMs(4));
        assertEquals(8_000L, policy.delayMs(5));
        assertEquals(8_000L, policy.delayMs(6));
        assertEquals(8_000L, policy.delayMs(60));
    }

    @Test
    void exhaustedAfterMaxAttempts() {
        ReconnectPolicy policy = new ReconnectPolicy(500L, 8_000L, 3);
        assertFalse(policy.exhausted(3));
        assertTrue(policy.exhausted(4));
        assertTrue(new ReconnectPolicy(10L, 10L, 0).exhausted(1));
    }

    @Test
    void rejectsInvalidBounds() {
        assertThrows(IllegalArgumentException.class, () -> new ReconnectPolicy(0L, 10L, 1));
        assertThrows(IllegalArgumentException.class, () -> new ReconnectPolicy(100L, 10L, 1));
        assertThrows(IllegalArgumentException.class, () -> new ReconnectPolicy(10L, 100L, -1));
    }
}
