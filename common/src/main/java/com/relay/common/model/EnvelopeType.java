package com.relay.common.model;

/**
 * Well-known envelope types. The wire field is an open string, so peers may
 * send types that are not listed here.
 */
public enum EnvelopeType {
    /**
     * Subscribe to a topic
     */
    SUB("sub"),

    /**
     * Acknowledge receipt of an envelope on a topic
     */
    ACK("ack"),

    /**
     * Application payload
     */
    DATA("data");

    private final String wireName;

    EnvelopeType(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }

}
