package com.relay.common.model;

/**
 * Session-level view of connectivity, independent of which handle is active
 */
public enum SessionState {
    DISCONNECTED,
    CONNECTING,
    OPEN
}
