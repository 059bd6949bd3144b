package io.platoonmesh.model;

import java.util.Objects;

public record LeaveNotice(PeerId peerId) implements PlatoonMessage {
    public LeaveNotice {
        Objects.requireNonNull(peerId, "peerId");
    }

    @Override
    public MessageKind kind() {
        return MessageKind.LEAVE;
    }

    @Override
    public PeerId sender() {
        return peerId;
    }
}
