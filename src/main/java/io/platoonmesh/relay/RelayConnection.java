package io.platoonmesh.relay;

import io.platoonmesh.util.NamedThreadFactory;
import io.platoonmesh.wire.Frames;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.net.Socket;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * One peer attached to the relay. Outbound frames go through a single writer thread, so frames to
 * this peer are written in the order they were enqueued.
 */
final class RelayConnection {
    private static final Logger log = LoggerFactory.getLogger(RelayConnection.class);

    private final long id;
    private final Socket socket;
    private final DataInputStream in;
    private final DataOutputStream out;
    private final ThreadPoolExecutor writer;
    private final Consumer<RelayConnection> onFailure;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    RelayConnection(long id, Socket socket, int outboundCapacity, Consumer<RelayConnection> onFailure) throws IOException {
        this.id = id;
        this.socket = socket;
        this.in = new DataInputStream(new BufferedInputStream(socket.getInputStream()));
        this.out = new DataOutputStream(new BufferedOutputStream(socket.getOutputStream()));
        this.onFailure = onFailure;
        this.writer = new ThreadPoolExecutor(
                1,
                1,
                0L,
                TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(Math.max(1, outboundCapacity)),
                new NamedThreadFactory("relay-writer-" + id, true)
        );
    }

    long id() {
        return id;
    }

    String remote() {
        return String.valueOf(socket.getRemoteSocketAddress());
    }

    DataInputStream input() {
        return in;
    }

    DataOutputStream output() {
        return out;
    }

    void enqueue(byte[] frame) {
        if (closed.get()) {
            return;
        }
        try {
            writer.execute(() -> write(frame));
        } catch (RejectedExecutionException e) {
            if (!closed.get()) {
                log.warn("Outbound queue full for peer {} ({}), dropping connection", id, remote());
                onFailure.accept(this);
            }
        }
    }

    private void write(byte[] frame) {
        if (closed.get()) {
            return;
        }
        try {
            Frames.write(out, frame);
        } catch (IOException e) {
            log.warn("Write to peer {} ({}) failed: {}", id, remote(), e.getMessage());
            onFailure.accept(this);
        }
    }

    boolean isClosed() {
        return closed.get();
    }

    void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        writer.shutdownNow();
        try {
            socket.close();
        } catch (IOException e) {
            log.debug("Error closing peer {} socket: {}", id, e.getMessage());
        }
    }
}
