package com.relay.common.exception;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base exception for all relay transport errors.
 * Carries an {@link ErrorCode} and a context map so failures can be logged
 * as a single structured line.
 */
public class TransportException extends Exception {

    private final ErrorCode errorCode;
    private final Instant timestamp;
    private final Map<String, Object> context = new LinkedHashMap<>();

    public TransportException(ErrorCode errorCode, String message) {
        this(errorCode, message, null);
    }

    public TransportException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.timestamp = Instant.now();
    }

    public TransportException withContext(String key, Object value) {
        context.put(key, value);
        return this;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public Map<String, Object> getContext() {
        return new LinkedHashMap<>(context);
    }

    public boolean isRetriable() {
        return errorCode.isRetriable();
    }

    public String getCategory() {
        return errorCode.getCategory();
    }

    /**
     * Single-line description: code, category, retriability, message and context.
     */
    public String getStructuredMessage() {
        StringBuilder sb = new StringBuilder();
        sb.append("[").append(errorCode.name()).append("]");
        sb.append(" category=").append(errorCode.getCategory());
        sb.append(", code=").append(errorCode.getCode());
        sb.append(", retriable=").append(errorCode.isRetriable());
        sb.append(", message=").append(getMessage());

        if (!context.isEmpty()) {
            sb.append(", context={");
            String separator = "";
            for (Map.Entry<String, Object> entry : context.entrySet()) {
                sb.append(separator).append(entry.getKey()).append("=").append(entry.getValue());
                separator = ", ";
            }
            sb.append("}");
        }

        return sb.toString();
    }

    @Override
    public String toString() {
        return getStructuredMessage();
    }
}
