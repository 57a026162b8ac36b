package com.relay.client.dispatch;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.relay.common.api.EventDispatcher;
import com.relay.common.exception.ErrorCode;
import com.relay.common.exception.ExceptionLogger;
import com.relay.common.exception.TransportException;
import com.relay.common.model.Envelope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Routes received envelopes to typed callbacks bound per topic.
 * Payloads are deserialized with Jackson into the bound type; a binding for
 * {@code String} receives the raw payload text. Silent control envelopes are never dispatched.
 */
public class TopicEventDispatcher implements EventDispatcher {
    private static final Logger log = LoggerFactory.getLogger(TopicEventDispatcher.class);

    private final ObjectMapper objectMapper;
    private final Map<String, List<Binding<?>>> bindings = new ConcurrentHashMap<>();

    public TopicEventDispatcher() {
        this(new ObjectMapper());
    }

    public TopicEventDispatcher(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public <T> void listenFor(String topic, Class<T> payloadType, Consumer<T> callback) {
        Objects.requireNonNull(topic, "topic");
        Objects.requireNonNull(payloadType, "payloadType");
        Objects.requireNonNull(callback, "callback");
        bindings.computeIfAbsent(topic, t -> new CopyOnWriteArrayList<>())
                .add(new Binding<>(payloadType, callback));
        log.debug("Bound {} callback to topic {}", payloadType.getSimpleName(), topic);
    }

    @Override
    public void unsubscribeTopic(String topic) {
        List<Binding<?>> removed = bindings.remove(topic);
        if (removed != null) {
            log.debug("Unbound {} callbacks from topic {}", removed.size(), topic);
        }
    }

    @Override
    public void dispatch(Envelope envelope) {
        if (envelope.isSilent()) {
            return;
        }
        List<Binding<?>> topicBindings = bindings.get(envelope.getTopic());
        if (topicBindings == null) {
            log.trace("No bindings for topic {}", envelope.getTopic());
            return;
        }
        for (Binding<?> binding : topicBindings) {
            binding.deliver(envelope);
        }
    }

    public List<String> getBoundTopics() {
        return new ArrayList<>(bindings.keySet());
    }

    public int getBindingCount(String topic) {
        List<Binding<?>> topicBindings = bindings.get(topic);
        return topicBindings == null ? 0 : topicBindings.size();
    }

    private final class Binding<T> {
        private final Class<T> payloadType;
        private final Consumer<T> callback;

        Binding(Class<T> payloadType, Consumer<T> callback) {
            this.payloadType = payloadType;
            this.callback = callback;
        }

        void deliver(Envelope envelope) {
            T value;
            try {
                value = convert(envelope.getPayload());
            } catch (JsonProcessingException e) {
                TransportException ex = new TransportException(ErrorCode.DISPATCH_PAYLOAD_MISMATCH,
                        "Payload on topic " + envelope.getTopic() + " is not a " + payloadType.getSimpleName(), e);
                ex.withContext("topic", envelope.getTopic());
                ExceptionLogger.logWarn(log, ex);
                return;
            }

            try {
                callback.accept(value);
            } catch (RuntimeException e) {
                TransportException ex = new TransportException(ErrorCode.DISPATCH_CALLBACK_FAILED,
                        "Callback for topic " + envelope.getTopic() + " failed", e);
                ex.withContext("topic", envelope.getTopic());
                ExceptionLogger.logError(log, ex);
            }
        }

        private T convert(String payload) throws JsonProcessingException {
            if (payloadType == String.class) {
                return payloadType.cast(payload);
            }
            return objectMapper.readValue(payload, payloadType);
        }
    }
}
