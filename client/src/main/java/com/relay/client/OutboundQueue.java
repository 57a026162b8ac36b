package com.relay.client;

import com.relay.common.model.Envelope;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * FIFO buffer of envelopes waiting for an open connection.
 *
 * <p>Each entry carries the future handed back to the caller of {@code send};
 * it completes when the envelope is written during a flush. Mutated only from
 * the session thread; reads from other threads see a consistent snapshot.</p>
 */
public class OutboundQueue {

    /**
     * A queued envelope and its delivery future
     */
    public static final class Entry {
        private final Envelope envelope;
        private final CompletableFuture<Void> delivery;

        Entry(Envelope envelope, CompletableFuture<Void> delivery) {
            this.envelope = envelope;
            this.delivery = delivery;
        }

        public Envelope getEnvelope() {
            return envelope;
        }

        public CompletableFuture<Void> getDelivery() {
            return delivery;
        }
    }

    private final Deque<Entry> entries = new ArrayDeque<>();

    /**
     * @return Future completed by whoever delivers or discards the envelope
     */
    public synchronized CompletableFuture<Void> enqueue(Envelope envelope) {
        CompletableFuture<Void> delivery = new CompletableFuture<>();
        entries.addLast(new Entry(envelope, delivery));
        return delivery;
    }

    /**
     * @return Oldest entry, or null when empty
     */
    public synchronized Entry poll() {
        return entries.pollFirst();
    }

    /**
     * True when a subscribe envelope for the topic is already waiting
     */
    public synchronized boolean containsSubscription(String topic) {
        for (Entry entry : entries) {
            Envelope envelope = entry.getEnvelope();
            if (envelope.isSubscribe() && topic.equals(envelope.getTopic())) {
                return true;
            }
        }
        return false;
    }

    /**
     * Remove every entry without completing its future
     * @return Removed entries in queue order
     */
    public synchronized List<Entry> clear() {
        List<Entry> removed = new ArrayList<>(entries);
        entries.clear();
        return removed;
    }

    public synchronized int size() {
        return entries.size();
    }

    public synchronized boolean isEmpty() {
        return entries.isEmpty();
    }
}
