package io.platoonmesh.client;

import io.platoonmesh.model.PlatoonMessage;

import java.util.Objects;

/**
 * A decoded message with the time its frame was read off the socket.
 */
public record ReceivedMessage(PlatoonMessage message, long receivedAtMs) {
    public ReceivedMessage {
        Objects.requireNonNull(message, "message");
    }
}
