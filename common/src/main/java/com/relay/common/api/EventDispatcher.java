package com.relay.common.api;

import com.relay.common.model.Envelope;

import java.util.function.Consumer;

/**
 * Typed per-topic event dispatch, keyed by topic string
 */
public interface EventDispatcher {

    /**
     * Bind a callback that receives payloads of the given type published on the topic
     */
    <T> void listenFor(String topic, Class<T> payloadType, Consumer<T> callback);

    /**
     * Drop every binding for the topic
     */
    void unsubscribeTopic(String topic);

    /**
     * Route a received envelope to the callbacks bound to its topic
     */
    void dispatch(Envelope envelope);
}
