package io.platoonmesh.client;

import io.platoonmesh.model.PlatoonMessage;
import io.platoonmesh.wire.Frames;
import io.platoonmesh.wire.MessageCodec;
import io.platoonmesh.wire.MessageFormatException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.net.Socket;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BiConsumer;
import java.util.function.LongSupplier;

/**
 * A single established connection to the relay with independent send and receive threads.
 */
final class ClientConnection {
    private static final Logger log = LoggerFactory.getLogger(ClientConnection.class);

    private final long generation;
    private final Socket socket;
    private final DataInputStream in;
    private final DataOutputStream out;
    private final int maxFrameBytes;
    private final LinkedBlockingQueue<byte[]> outbound;
    private final AtomicInteger pending = new AtomicInteger();
    private final InboundStream inbound = new InboundStream();
    private final BiConsumer<ClientConnection, Exception> onFailure;
    private final LongSupplier clock;
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final Thread sender;
    private final Thread receiver;

    ClientConnection(
            long generation,
            Socket socket,
            DataInputStream in,
            int maxFrameBytes,
            int outboundCapacity,
            LongSupplier clock,
            BiConsumer<ClientConnection, Exception> onFailure
    ) throws IOException {
        this.generation = generation;
        this.socket = socket;
        this.in = in;
        this.out = new DataOutputStream(new BufferedOutputStream(socket.getOutputStream()));
        this.maxFrameBytes = maxFrameBytes;
        this.outbound = new LinkedBlockingQueue<>(Math.max(1, outboundCapacity));
        this.clock = clock;
        this.onFailure = onFailure;
        this.sender = new Thread(this::sendLoop, "peer-send-" + generation);
        this.receiver = new Thread(this::receiveLoop, "peer-receive-" + generation);
        this.sender.setDaemon(true);
        this.receiver.setDaemon(true);
    }

    static DataInputStream inputOf(Socket socket) throws IOException {
        return new DataInputStream(new BufferedInputStream(socket.getInputStream()));
    }

    void start() {
        sender.start();
        receiver.start();
    }

    long generation() {
        return generation;
    }

    InboundStream inbound() {
        return inbound;
    }

    boolean enqueue(byte[] frame) {
        if (closed.get()) {
            return false;
        }
        pending.incrementAndGet();
        if (!outbound.offer(frame)) {
            pending.decrementAndGet();
            log.warn("Outbound queue full on connection {}, message dropped", generation);
            return false;
        }
        return true;
    }

    /**
     * Waits until every enqueued frame has been written, the connection closed, or the timeout passed.
     */
    boolean flush(long timeoutMs) {
        long deadline = System.currentTimeMillis() + Math.max(0L, timeoutMs);
        while (pending.get() > 0 && !closed.get()) {
            if (System.currentTimeMillis() >= deadline) {
                return false;
            }
            try {
                Thread.sleep(5L);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        }
        return pending.get() == 0;
    }

    private void sendLoop() {
        try {
            while (!closed.get()) {
                byte[] frame = outbound.take();
                try {
                    Frames.write(out, frame);
                } finally {
                    pending.decrementAndGet();
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (IOException e) {
            fail(e);
        }
    }

    private void receiveLoop() {
        try {
            while (!closed.get()) {
                byte[] body = Frames.read(in, maxFrameBytes);
                long receivedAtMs = clock.getAsLong();
                if (body == null) {
                    fail(new EOFException("relay closed the connection"));
                    return;
                }
                PlatoonMessage message;
                try {
                    message = MessageCodec.decode(body);
                } catch (MessageFormatException e) {
                    log.warn("Skipping undecodable message on connection {}: {}", generation, e.getMessage());
                    continue;
                }
                inbound.offer(message, receivedAtMs);
            }
        } catch (IOException | MessageFormatException e) {
            fail(e);
        }
    }

    private void fail(Exception cause) {
        if (shutdown()) {
            onFailure.accept(this, cause);
        }
    }

    void close() {
        shutdown();
    }

    private boolean shutdown() {
        if (!closed.compareAndSet(false, true)) {
            return false;
        }
        sender.interrupt();
        try {
            socket.close();
        } catch (IOException e) {
            log.debug("Error closing connection {}: {}", generation, e.getMessage());
        }
        inbound.end();
        return true;
    }
}
