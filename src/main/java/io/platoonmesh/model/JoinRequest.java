package io.platoonmesh.model;

import java.util.Objects;

public record JoinRequest(PeerId requestingPeerId, long timestampMs) implements PlatoonMessage {
    public JoinRequest {
        Objects.requireNonNull(requestingPeerId, "requestingPeerId");
    }

    @Override
    public MessageKind kind() {
        return MessageKind.JOIN;
    }

    @Override
    public PeerId sender() {
        return requestingPeerId;
    }
}
