package io.platoonmesh.client;

import io.platoonmesh.model.PeerId;
import io.platoonmesh.model.PlatoonMessage;
import io.platoonmesh.util.NamedThreadFactory;
import io.platoonmesh.wire.MessageCodec;
import io.platoonmesh.wire.MessageFormatException;
import io.platoonmesh.wire.RelayHandshake;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.DataInputStream;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;

/**
 * Per-vehicle connection to the relay. Sending never blocks the caller; received messages are
 * exposed as an {@link InboundStream}. A transport failure triggers automatic reconnection with
 * bounded exponential backoff; the listener learns about success or exhaustion.
 */
public final class PeerClient implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(PeerClient.class);

    private final PeerId owner;
    private final long handshakeTimeoutMs;
    private final int maxFrameBytes;
    private final int outboundCapacity;
    private final ReconnectPolicy reconnectPolicy;
    private final PeerClientListener listener;
    private final LongSupplier clock;
    private final ScheduledExecutorService reconnector;
    private final Object lock = new Object();
    private InetSocketAddress address;
    private volatile ClientConnection current;
    private volatile ConnectionState state = ConnectionState.IDLE;
    private long generation;

    public PeerClient(
            PeerId owner,
            long handshakeTimeoutMs,
            int maxFrameBytes,
            int outboundCapacity,
            ReconnectPolicy reconnectPolicy,
            PeerClientListener listener
    ) {
        this(owner, handshakeTimeoutMs, maxFrameBytes, outboundCapacity, reconnectPolicy, listener,
                System::currentTimeMillis);
    }

    /**
     * @param clock stamps every received message with its arrival time
     */
    public PeerClient(
            PeerId owner,
            long handshakeTimeoutMs,
            int maxFrameBytes,
            int outboundCapacity,
            ReconnectPolicy reconnectPolicy,
            PeerClientListener listener,
            LongSupplier clock
    ) {
        this.owner = owner;
        this.handshakeTimeoutMs = handshakeTimeoutMs;
        this.maxFrameBytes = maxFrameBytes;
        this.outboundCapacity = outboundCapacity;
        this.reconnectPolicy = reconnectPolicy;
        this.listener = listener;
        this.clock = clock;
        this.reconnector = Executors.newSingleThreadScheduledExecutor(
                new NamedThreadFactory("peer-reconnect-" + owner, true));
    }

    public void connect(InetSocketAddress relayAddress) throws ConnectionException {
        synchronized (lock) {
            if (state == ConnectionState.CLOSED) {
                throw new IllegalStateException("Peer client is closed");
            }
            ClientConnection previous = current;
            if (previous != null) {
                previous.close();
            }
            address = relayAddress;
            current = open(relayAddress);
            state = ConnectionState.CONNECTED;
        }
        log.info("{} connected to relay at {}", owner, relayAddress);
    }

    /**
     * Like {@link #connect(InetSocketAddress)}, retrying an unreachable relay with the reconnect
     * backoff. The last failure is rethrown once the attempts are exhausted.
     */
    public void connectWithRetry(InetSocketAddress relayAddress) throws ConnectionException, InterruptedException {
        int attempt = 0;
        while (true) {
            try {
                connect(relayAddress);
                return;
            } catch (ConnectionException e) {
                attempt++;
                if (reconnectPolicy.exhausted(attempt)) {
                    throw e;
                }
                long delayMs = reconnectPolicy.delayMs(attempt);
                log.warn("{} connect attempt {} failed, retrying in {} ms: {}", owner, attempt, delayMs, e.getMessage());
                Thread.sleep(delayMs);
            }
        }
    }

    public ConnectionState state() {
        return state;
    }

    public boolean isConnected() {
        return state == ConnectionState.CONNECTED;
    }

    /**
     * Enqueues a message for transmission and returns immediately. Returns false when there is no
     * live connection or the outbound queue is full.
     */
    public boolean send(PlatoonMessage message) {
        ClientConnection connection = current;
        if (connection == null || state != ConnectionState.CONNECTED) {
            return false;
        }
        return connection.enqueue(MessageCodec.encode(message));
    }

    /**
     * The inbound stream of the current connection.
     */
    public InboundStream receive() {
        ClientConnection connection = current;
        if (connection == null) {
            throw new IllegalStateException("Peer client is not connected");
        }
        return connection.inbound();
    }

    public boolean flush(long timeoutMs) {
        ClientConnection connection = current;
        return connection == null || connection.flush(timeoutMs);
    }

    private ClientConnection open(InetSocketAddress relayAddress) throws ConnectionException {
        Socket socket = new Socket();
        try {
            int timeout = (int) Math.min(Integer.MAX_VALUE, Math.max(1L, handshakeTimeoutMs));
            socket.connect(relayAddress, timeout);
            socket.setSoTimeout(timeout);
            DataInputStream in = ClientConnection.inputOf(socket);
            RelayHandshake.readGreeting(in);
            socket.setSoTimeout(0);
            socket.setTcpNoDelay(true);
            ClientConnection connection = new ClientConnection(
                    ++generation,
                    socket,
                    in,
                    maxFrameBytes,
                    outboundCapacity,
                    clock,
                    this::onTransportFailure
            );
            connection.start();
            return connection;
        } catch (IOException | MessageFormatException e) {
            try {
                socket.close();
            } catch (IOException closeError) {
                e.addSuppressed(closeError);
            }
            throw new ConnectionException("Relay unreachable at " + relayAddress + ": " + e.getMessage(), e);
        }
    }

    private void onTransportFailure(ClientConnection failed, Exception cause) {
        synchronized (lock) {
            if (failed != current || state != ConnectionState.CONNECTED) {
                return;
            }
            state = ConnectionState.RECONNECTING;
        }
        log.warn("{} lost relay connection: {}", owner, cause.getMessage());
        scheduleReconnect(1, cause.getMessage());
    }

    private void scheduleReconnect(int attempt, String lastError) {
        if (reconnectPolicy.exhausted(attempt)) {
            synchronized (lock) {
                if (state != ConnectionState.RECONNECTING) {
                    return;
                }
                state = ConnectionState.DISCONNECTED;
            }
            String reason = "reconnect attempts exhausted after " + reconnectPolicy.maxAttempts() + " tries: " + lastError;
            log.error("{} {}", owner, reason);
            listener.onDisconnected(reason);
            return;
        }
        long delayMs = reconnectPolicy.delayMs(attempt);
        log.info("{} reconnect attempt {} in {} ms", owner, attempt, delayMs);
        reconnector.schedule(() -> attemptReconnect(attempt), delayMs, TimeUnit.MILLISECONDS);
    }

    private void attemptReconnect(int attempt) {
        synchronized (lock) {
            if (state != ConnectionState.RECONNECTING) {
                return;
            }
            try {
                current = open(address);
                state = ConnectionState.CONNECTED;
            } catch (ConnectionException e) {
                log.warn("{} reconnect attempt {} failed: {}", owner, attempt, e.getMessage());
                reconnector.execute(() -> scheduleReconnect(attempt + 1, e.getMessage()));
                return;
            }
        }
        log.info("{} reconnected to relay at {}", owner, address);
        listener.onReconnected();
    }

    /**
     * Flushes pending sends (bounded by the handshake timeout) and closes without reconnecting.
     */
    @Override
    public void close() {
        ClientConnection connection;
        synchronized (lock) {
            if (state == ConnectionState.CLOSED) {
                return;
            }
            state = ConnectionState.CLOSED;
            connection = current;
        }
        if (connection != null) {
            if (!connection.flush(handshakeTimeoutMs)) {
                log.warn("{} closed with unsent messages", owner);
            }
            connection.close();
        }
        reconnector.shutdownNow();
        log.info("{} disconnected from relay", owner);
    }
}
