package io.platoonmesh.model;

/**
 * A message exchanged between vehicles through the relay.
 */
public interface PlatoonMessage {
    MessageKind kind();

    PeerId sender();
}
