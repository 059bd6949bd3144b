package io.platoonmesh.client;

public enum ConnectionState {
    IDLE,
    CONNECTED,
    RECONNECTING,
    DISCONNECTED,
    CLOSED
}
