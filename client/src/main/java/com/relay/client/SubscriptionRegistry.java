package com.relay.client;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Topics the caller wants to receive. Each topic is held once, in first-subscribe order.
 */
public class SubscriptionRegistry {

    private final Set<String> topics = new LinkedHashSet<>();

    /**
     * @return true if the topic was not already registered
     */
    public synchronized boolean add(String topic) {
        return topics.add(topic);
    }

    public synchronized List<String> topics() {
        return new ArrayList<>(topics);
    }

    /**
     * @return The topics that were registered
     */
    public synchronized List<String> clear() {
        List<String> removed = new ArrayList<>(topics);
        topics.clear();
        return removed;
    }

    public synchronized int size() {
        return topics.size();
    }
}
