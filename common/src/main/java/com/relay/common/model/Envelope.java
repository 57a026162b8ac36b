package com.relay.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Topic-addressed message exchanged over the transport.
 * Wire form: {"topic":"...","type":"sub|ack|data|...","payload":"...","silent":false}
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class Envelope {
    private final String topic;
    private final String type;
    private final String payload;
    private final boolean silent;

    @JsonCreator
    public Envelope(@JsonProperty("topic") String topic,
                    @JsonProperty("type") String type,
                    @JsonProperty("payload") String payload,
                    @JsonProperty("silent") boolean silent) {
        this.topic = topic;
        this.type = type;
        this.payload = payload != null ? payload : "";
        this.silent = silent;
    }

    public static Envelope subscribe(String topic) {
        return new Envelope(topic, EnvelopeType.SUB.getWireName(), "", true);
    }

    public static Envelope ack(String topic) {
        return new Envelope(topic, EnvelopeType.ACK.getWireName(), "", true);
    }

    public static Envelope data(String topic, String payload) {
        return new Envelope(topic, EnvelopeType.DATA.getWireName(), payload, false);
    }

    @JsonProperty("topic")
    public String getTopic() {
        return topic;
    }

    @JsonProperty("type")
    public String getType() {
        return type;
    }

    @JsonProperty("payload")
    public String getPayload() {
        return payload;
    }

    @JsonProperty("silent")
    public boolean isSilent() {
        return silent;
    }

    /**
     * True when the type field names the given well-known type
     */
    public boolean is(EnvelopeType envelopeType) {
        return envelopeType.getWireName().equals(type);
    }

    @JsonIgnore
    public boolean isSubscribe() {
        return is(EnvelopeType.SUB);
    }

    @JsonIgnore
    public boolean isAck() {
        return is(EnvelopeType.ACK);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Envelope)) {
            return false;
        }
        Envelope other = (Envelope) o;
        return silent == other.silent
                && Objects.equals(topic, other.topic)
                && Objects.equals(type, other.type)
                && Objects.equals(payload, other.payload);
    }

    @Override
    public int hashCode() {
        return Objects.hash(topic, type, payload, silent);
    }

    @Override
    public String toString() {
        return "Envelope{topic=" + topic + ", type=" + type
                + ", payloadLength=" + payload.length() + ", silent=" + silent + "}";
    }
}
