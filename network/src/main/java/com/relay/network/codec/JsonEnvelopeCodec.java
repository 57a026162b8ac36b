package com.relay.network.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.relay.common.exception.NetworkException;
import com.relay.common.model.Envelope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;

/**
 * Encodes envelopes to JSON text and decodes them back.
 * Format: {"topic":"t","type":"data","payload":"{...}","silent":false}
 */
public class JsonEnvelopeCodec {
    private static final Logger log = LoggerFactory.getLogger(JsonEnvelopeCodec.class);
    public static final int DEFAULT_MAX_MESSAGE_SIZE = 10 * 1024 * 1024; // 10MB

    private final ObjectMapper mapper;
    private final int maxMessageSize;

    public JsonEnvelopeCodec() {
        this(new ObjectMapper(), DEFAULT_MAX_MESSAGE_SIZE);
    }

    public JsonEnvelopeCodec(ObjectMapper mapper, int maxMessageSize) {
        this.mapper = mapper;
        this.maxMessageSize = maxMessageSize;
    }

    public String encode(Envelope envelope) throws NetworkException {
        if (envelope == null) {
            throw NetworkException.encodingError(null, new IllegalArgumentException("Envelope cannot be null"));
        }
        if (envelope.getTopic() == null || envelope.getType() == null) {
            log.error("Attempted to encode envelope without topic or type: {}", envelope);
            throw NetworkException.encodingError(envelope.getTopic(),
                    new IllegalArgumentException("Envelope topic and type are required"));
        }

        try {
            String json = mapper.writeValueAsString(envelope);
            log.debug("Encoded envelope: topic={}, type={}, length={}",
                    envelope.getTopic(), envelope.getType(), json.length());
            return json;
        } catch (JsonProcessingException e) {
            throw NetworkException.encodingError(envelope.getTopic(), e);
        }
    }

    public Envelope decode(byte[] data) throws NetworkException {
        if (data == null) {
            throw NetworkException.decodingError("no data", null);
        }
        if (data.length > maxMessageSize) {
            throw NetworkException.decodingError(
                    String.format("message of %d bytes exceeds limit of %d bytes", data.length, maxMessageSize), null);
        }
        return decode(new String(data, StandardCharsets.UTF_8));
    }

    public Envelope decode(String json) throws NetworkException {
        JsonNode node;
        try {
            node = mapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw NetworkException.decodingError("malformed JSON: " + abbreviate(json), e);
        }

        if (node == null || !node.isObject()) {
            throw NetworkException.decodingError("not a JSON object: " + abbreviate(json), null);
        }

        String topic = requiredText(node, "topic", json);
        String type = requiredText(node, "type", json);

        JsonNode payloadNode = node.get("payload");
        String payload;
        if (payloadNode == null || payloadNode.isNull()) {
            payload = "";
        } else if (payloadNode.isTextual()) {
            payload = payloadNode.asText();
        } else {
            throw NetworkException.decodingError("payload is not a string: " + abbreviate(json), null);
        }

        JsonNode silentNode = node.get("silent");
        boolean silent = silentNode != null && silentNode.asBoolean(false);

        Envelope envelope = new Envelope(topic, type, payload, silent);
        log.debug("Decoded envelope: topic={}, type={}, silent={}", topic, type, silent);
        return envelope;
    }

    private static String requiredText(JsonNode node, String field, String json) throws NetworkException {
        JsonNode value = node.get(field);
        if (value == null || !value.isTextual() || value.asText().isBlank()) {
            throw NetworkException.decodingError("missing '" + field + "' in " + abbreviate(json), null);
        }
        return value.asText();
    }

    private static String abbreviate(String json) {
        if (json == null) {
            return "null";
        }
        return json.length() > 200 ? json.substring(0, 200) + "..." : json;
    }
}
