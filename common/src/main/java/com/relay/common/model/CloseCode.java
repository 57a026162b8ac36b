package com.relay.common.model;

/**
 * WebSocket close status codes (RFC 6455, section 7.4.1)
 */
public enum CloseCode {
    NORMAL(1000),
    GOING_AWAY(1001),
    PROTOCOL_ERROR(1002),
    UNSUPPORTED_DATA(1003),
    NO_STATUS(1005),
    ABNORMAL(1006),       // No close frame received: dropped socket or failed connect
    INVALID_PAYLOAD(1007),
    POLICY_VIOLATION(1008),
    MESSAGE_TOO_BIG(1009),
    MANDATORY_EXTENSION(1010),
    SERVER_ERROR(1011),
    TLS_HANDSHAKE_FAILURE(1015),
    UNDEFINED(-1);

    private final int code;

    CloseCode(int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }

    /**
     * Only {@link #ABNORMAL} is treated as an unexpected termination that warrants a backoff.
     */
    public boolean isAbnormal() {
        return this == ABNORMAL;
    }

    public static CloseCode fromCode(int code) {
        for (CloseCode closeCode : values()) {
            if (closeCode.code == code) {
                return closeCode;
            }
        }
        return UNDEFINED;
    }
}
