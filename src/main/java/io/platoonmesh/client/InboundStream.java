package io.platoonmesh.client;

import io.platoonmesh.model.PlatoonMessage;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * Messages received on one connection, in relay-forwarded order. Iteration blocks until the next
 * message arrives and ends once the connection has closed and every buffered message was consumed.
 * A stream cannot be restarted; a new connection produces a new stream. Every message keeps the
 * time it was read off the socket, see {@link #drainReceivedTo(Collection)}.
 */
public final class InboundStream implements Iterator<PlatoonMessage> {
    private static final Object END = new Object();

    private final LinkedBlockingQueue<Object> queue = new LinkedBlockingQueue<>();
    private volatile boolean ended;
    private Object peeked;

    void offer(PlatoonMessage message, long receivedAtMs) {
        if (!ended) {
            queue.offer(new ReceivedMessage(message, receivedAtMs));
        }
    }

    void end() {
        if (!ended) {
            ended = true;
            queue.offer(END);
        }
    }

    /**
     * True once the connection closed; buffered messages may still be drained.
     */
    public boolean isEnded() {
        return ended;
    }

    @Override
    public synchronized boolean hasNext() {
        if (peeked == null) {
            try {
                peeked = queue.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        }
        return peeked != END;
    }

    @Override
    public synchronized PlatoonMessage next() {
        if (!hasNext()) {
            throw new NoSuchElementException("inbound stream ended");
        }
        ReceivedMessage received = (ReceivedMessage) peeked;
        peeked = null;
        return received.message();
    }

    /**
     * Moves every message already received into {@code sink} without blocking.
     */
    public int drainTo(Collection<? super PlatoonMessage> sink) {
        List<ReceivedMessage> received = new ArrayList<>();
        int count = drainReceivedTo(received);
        for (ReceivedMessage item : received) {
            sink.add(item.message());
        }
        return count;
    }

    /**
     * Same as {@link #drainTo(Collection)} but keeps the arrival time of each message.
     */
    public synchronized int drainReceivedTo(Collection<? super ReceivedMessage> sink) {
        int count = 0;
        if (peeked != null && peeked != END) {
            sink.add((ReceivedMessage) peeked);
            peeked = null;
            count++;
        }
        Object item;
        while ((item = queue.peek()) != null && item != END) {
            queue.poll();
            sink.add((ReceivedMessage) item);
            count++;
        }
        return count;
    }
}
