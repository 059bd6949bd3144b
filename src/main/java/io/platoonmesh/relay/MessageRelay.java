package io.platoonmesh.relay;

import io.platoonmesh.util.NamedThreadFactory;
import io.platoonmesh.wire.Frames;
import io.platoonmesh.wire.MessageFormatException;
import io.platoonmesh.wire.RelayHandshake;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketException;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Broadcast hub. Every frame received from one peer is forwarded unchanged to every other
 * connected peer; payloads are never interpreted.
 */
public final class MessageRelay implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(MessageRelay.class);

    private final String bindHost;
    private final int bindPort;
    private final int maxFrameBytes;
    private final int outboundCapacity;
    private final Set<RelayConnection> peers = ConcurrentHashMap.newKeySet();
    private final AtomicLong connectionIds = new AtomicLong();
    private final ExecutorService readers = Executors.newCachedThreadPool(new NamedThreadFactory("relay-reader", true));
    private ServerSocket serverSocket;
    private Thread acceptThread;
    private volatile boolean running;

    public MessageRelay(String bindHost, int bindPort, int maxFrameBytes, int outboundCapacity) {
        this.bindHost = bindHost;
        this.bindPort = bindPort;
        this.maxFrameBytes = maxFrameBytes;
        this.outboundCapacity = outboundCapacity;
    }

    public synchronized void start() throws IOException {
        if (running) {
            throw new IllegalStateException("Relay already started");
        }
        ServerSocket socket = new ServerSocket();
        socket.setReuseAddress(true);
        socket.bind(new InetSocketAddress(bindHost, bindPort));
        serverSocket = socket;
        running = true;
        acceptThread = new Thread(this::acceptLoop, "relay-accept");
        acceptThread.setDaemon(true);
        acceptThread.start();
        log.info("Relay listening on {}:{}", bindHost, socket.getLocalPort());
    }

    public int localPort() {
        ServerSocket socket = serverSocket;
        return socket == null ? -1 : socket.getLocalPort();
    }

    public int peerCount() {
        return peers.size();
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Blocks until the relay is closed from another thread.
     */
    public void awaitTermination() throws InterruptedException {
        Thread thread = acceptThread;
        if (thread != null) {
            thread.join();
        }
    }

    private void acceptLoop() {
        while (running) {
            Socket socket;
            try {
                socket = serverSocket.accept();
            } catch (SocketException e) {
                if (running) {
                    log.error("Relay accept loop failed", e);
                }
                break;
            } catch (IOException e) {
                log.warn("Failed to accept peer connection: {}", e.getMessage());
                continue;
            }
            register(socket);
        }
    }

    private void register(Socket socket) {
        RelayConnection connection;
        try {
            socket.setTcpNoDelay(true);
            connection = new RelayConnection(connectionIds.incrementAndGet(), socket, outboundCapacity, this::drop);
            RelayHandshake.writeGreeting(connection.output());
        } catch (IOException e) {
            log.warn("Handshake with {} failed: {}", socket.getRemoteSocketAddress(), e.getMessage());
            closeQuietly(socket);
            return;
        }
        peers.add(connection);
        log.info("Peer {} connected from {} ({} connected)", connection.id(), connection.remote(), peers.size());
        readers.execute(() -> readLoop(connection));
    }

    private void readLoop(RelayConnection connection) {
        try {
            while (running && !connection.isClosed()) {
                byte[] frame = Frames.read(connection.input(), maxFrameBytes);
                if (frame == null) {
                    break;
                }
                fanOut(connection, frame);
            }
        } catch (MessageFormatException e) {
            log.warn("Peer {} sent an invalid frame: {}", connection.id(), e.getMessage());
        } catch (IOException e) {
            if (!connection.isClosed()) {
                log.debug("Read from peer {} failed: {}", connection.id(), e.getMessage());
            }
        } finally {
            drop(connection);
        }
    }

    // Enqueue on every destination before the sender's next frame is read; per-destination order follows.
    private void fanOut(RelayConnection from, byte[] frame) {
        for (RelayConnection to : peers) {
            if (to != from) {
                to.enqueue(frame);
            }
        }
    }

    private void drop(RelayConnection connection) {
        if (peers.remove(connection)) {
            log.info("Peer {} disconnected ({} connected)", connection.id(), peers.size());
        }
        connection.close();
    }

    @Override
    public synchronized void close() {
        if (!running) {
            return;
        }
        running = false;
        closeQuietly(serverSocket);
        for (RelayConnection connection : List.copyOf(peers)) {
            drop(connection);
        }
        readers.shutdownNow();
        try {
            if (!readers.awaitTermination(2, TimeUnit.SECONDS)) {
                log.warn("Relay reader threads did not stop in time");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.info("Relay stopped");
    }

    private static void closeQuietly(AutoCloseable closeable) {
        if (closeable == null) {
            return;
        }
        try {
            closeable.close();
        } catch (Exception e) {
            log.debug("Error while closing relay resource: {}", e.getMessage());
        }
    }
}
