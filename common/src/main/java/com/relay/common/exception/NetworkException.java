package com.relay.common.exception;

/**
 * Exception for connection-level errors (connect, send, close, wire codec)
 */
public class NetworkException extends TransportException {

    public NetworkException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }

    public NetworkException(ErrorCode errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }

    public NetworkException withUrl(String url) {
        withContext("url", url);
        return this;
    }

    public static NetworkException connectionFailed(String url, Throwable cause) {
        return new NetworkException(
                ErrorCode.NETWORK_CONNECTION_FAILED,
                "Failed to connect to " + url,
                cause)
                .withUrl(url);
    }

    public static NetworkException handshakeFailed(String url, Throwable cause) {
        return new NetworkException(
                ErrorCode.NETWORK_HANDSHAKE_FAILED,
                "WebSocket handshake with " + url + " failed",
                cause)
                .withUrl(url);
    }

    public static NetworkException sendFailed(String url, Throwable cause) {
        return new NetworkException(
                ErrorCode.NETWORK_SEND_FAILED,
                "Failed to send frame to " + url,
                cause)
                .withUrl(url);
    }

    /**
     * Raised when a send or close targets a connection that is not open.
     * Close paths treat this as the benign "already closed" case.
     */
    public static NetworkException notConnected(String url) {
        return new NetworkException(
                ErrorCode.NETWORK_NOT_CONNECTED,
                "WebSocket is not connected")
                .withUrl(url);
    }

    public static NetworkException invalidUrl(String url, Throwable cause) {
        return new NetworkException(
                ErrorCode.NETWORK_INVALID_URL,
                "Invalid WebSocket URL: " + url,
                cause)
                .withUrl(url);
    }

    public static NetworkException closeTimeout(String url, long timeoutMs) {
        NetworkException ex = new NetworkException(
                ErrorCode.NETWORK_CLOSE_TIMEOUT,
                String.format("Close of %s did not complete within %dms", url, timeoutMs))
                .withUrl(url);
        ex.withContext("timeoutMs", timeoutMs);
        return ex;
    }

    public static NetworkException encodingError(String topic, Throwable cause) {
        NetworkException ex = new NetworkException(
                ErrorCode.NETWORK_ENCODING_ERROR,
                "Failed to encode envelope for topic: " + topic,
                cause);
        ex.withContext("topic", topic);
        return ex;
    }

    public static NetworkException decodingError(String details, Throwable cause) {
        return new NetworkException(
                ErrorCode.NETWORK_DECODING_ERROR,
                "Failed to decode envelope: " + details,
                cause);
    }
}
