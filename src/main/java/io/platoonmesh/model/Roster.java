package io.platoonmesh.model;

import java.util.List;
import java.util.Objects;

/**
 * Membership snapshot the leader broadcasts after accepting a join, so the joiner learns who is ahead.
 */
public record Roster(PeerId senderPeerId, List<PeerId> members) implements PlatoonMessage {
    public Roster {
        Objects.requireNonNull(senderPeerId, "senderPeerId");
        members = members == null ? List.of() : List.copyOf(members);
    }

    @Override
    public MessageKind kind() {
        return MessageKind.ROSTER;
    }

    @Override
    public PeerId sender() {
        return senderPeerId;
    }
}
