package io.platoonmesh.client;

public interface PeerClientListener {
    /**
     * A new connection replaced a failed one; {@link PeerClient#receive()} now returns a new stream.
     */
    void onReconnected();

    /**
     * Reconnect attempts are exhausted. The client stays down until connected explicitly.
     */
    void onDisconnected(String reason);
}
