package com.relay.common.exception;

/**
 * Error codes for the relay transport.
 * Organized by category with structured codes for monitoring and alerting.
 */
public enum ErrorCode {

    // ==================== NETWORK ERRORS (2xxx) ====================
    NETWORK_CONNECTION_FAILED(2001, "NETWORK", "Failed to establish connection", true),
    NETWORK_CONNECTION_LOST(2002, "NETWORK", "Connection lost unexpectedly", true),
    NETWORK_SEND_FAILED(2003, "NETWORK", "Failed to send envelope", true),
    NETWORK_NOT_CONNECTED(2004, "NETWORK", "Connection is not open", false),
    NETWORK_CLOSE_FAILED(2005, "NETWORK", "Failed to close connection", true),
    NETWORK_CLOSE_TIMEOUT(2006, "NETWORK", "Connection close timed out", true),
    NETWORK_ENCODING_ERROR(2007, "NETWORK", "Envelope encoding failed", false),
    NETWORK_DECODING_ERROR(2008, "NETWORK", "Envelope decoding failed", false),
    NETWORK_INVALID_URL(2009, "NETWORK", "Invalid connection URL", false),
    NETWORK_HANDSHAKE_FAILED(2010, "NETWORK", "WebSocket handshake failed", true),

    // ==================== SESSION ERRORS (3xxx) ====================
    SESSION_CLOSED(3001, "SESSION", "Session closed before the connection opened", true),
    SESSION_DISPOSED(3002, "SESSION", "Session has been disposed", false),
    SESSION_QUEUE_DISCARDED(3003, "SESSION", "Queued envelope discarded before delivery", false),
    SESSION_NO_URL(3004, "SESSION", "Session has no target URL", false),

    // ==================== DISPATCH ERRORS (4xxx) ====================
    DISPATCH_PAYLOAD_MISMATCH(4001, "DISPATCH", "Payload does not match the bound type", false),
    DISPATCH_CALLBACK_FAILED(4002, "DISPATCH", "Topic callback threw an exception", false),

    // ==================== VALIDATION ERRORS (8xxx) ====================
    VALIDATION_INVALID_TOPIC(8001, "VALIDATION", "Invalid topic name", false),

    // ==================== UNKNOWN/GENERIC ERRORS (9999) ====================
    UNKNOWN_ERROR(9999, "UNKNOWN", "Unknown error occurred", true);

    private final int code;
    private final String category;
    private final String description;
    private final boolean retriable;

    ErrorCode(int code, String category, String description, boolean retriable) {
        this.code = code;
        this.category = category;
        this.description = description;
        this.retriable = retriable;
    }

    public int getCode() {
        return code;
    }

    public String getCategory() {
        return category;
    }

    public String getDescription() {
        return description;
    }

    public boolean isRetriable() {
        return retriable;
    }

    /**
     * Get ErrorCode by numeric code
     */
    public static ErrorCode fromCode(int code) {
        for (ErrorCode errorCode : values()) {
            if (errorCode.code == code) {
                return errorCode;
            }
        }
        return UNKNOWN_ERROR;
    }

    public boolean isCategory(String category) {
        return this.category.equalsIgnoreCase(category);
    }
}
