package com.relay.common.model;

/**
 * Lifecycle of a single connection handle
 */
public enum ConnectionState {
    IDLE,
    CONNECTING,
    OPEN,
    CLOSING,
    CLOSED;

    /**
     * CLOSED is the only terminal state
     */
    public boolean isTerminal() {
        return this == CLOSED;
    }
}
