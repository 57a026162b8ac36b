package com.relay.common.exception;

/**
 * Exception for session lifecycle errors
 */
public class SessionException extends TransportException {

    public SessionException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }

    public SessionException(ErrorCode errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }

    public static SessionException closed(String url) {
        SessionException ex = new SessionException(
                ErrorCode.SESSION_CLOSED,
                "Session closed before a connection to " + url + " was established");
        ex.withContext("url", url);
        return ex;
    }

    public static SessionException disposed() {
        return new SessionException(ErrorCode.SESSION_DISPOSED, "Session has been disposed");
    }

    public static SessionException queueDiscarded(String topic, String type) {
        SessionException ex = new SessionException(
                ErrorCode.SESSION_QUEUE_DISCARDED,
                String.format("Queued envelope discarded: topic=%s type=%s", topic, type));
        ex.withContext("topic", topic);
        ex.withContext("type", type);
        return ex;
    }

    public static SessionException noUrl() {
        return new SessionException(
                ErrorCode.SESSION_NO_URL,
                "No URL has been supplied to open()");
    }
}
