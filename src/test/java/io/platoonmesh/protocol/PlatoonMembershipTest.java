package io.platoonmesh.protocol;

import io.platoonmesh.model.PeerId;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PlatoonMembershipTest {
    private static final PeerId L = PeerId.of("veh-l");
    private static final PeerId A = PeerId.of("veh-a");
    private static final PeerId B = PeerId.of("veh-b");

    @Test
    void appendIsIdempotent() {
        PlatoonMembership membership = new PlatoonMembership();
        assertTrue(membership.append(L));
        assertTrue(membership.append(A));
        assertFalse(membership.append(L));
        assertEquals(List.of(L, A), membership.members());
        assertEquals(Optional.of(L), membership.leader());
    }

    @Test
    void removalContractsTheChain() {
        PlatoonMembership membership = new PlatoonMembership();
        membership.append(L);
        membership.append(A);
        membership.append(B);
        assertEquals(Optional.of(A), membership.predecessorOf(B));

        assertTrue(membership.remove(A));
        assertFalse(membership.remove(A));
        assertEquals(Optional.of(L), membership.predecessorOf(B));
        assertEquals(Optional.empty(), membership.predecessorOf(L));
        assertEquals(Optional.empty(), membership.predecessorOf(A));
    }

    @Test
    void replaceWithDropsDuplicates() {
        PlatoonMembership membership = new PlatoonMembership();
        membership.append(B);
        assertTrue(membership.replaceWith(List.of(L, A, L, B)));
        assertEquals(List.of(L, A, B), membership.members());
        assertFalse(membership.replaceWith(List.of(L, A, B)));
        assertEquals(3, membership.size());
    }
}
