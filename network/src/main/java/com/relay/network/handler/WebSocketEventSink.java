package com.relay.network.handler;

/**
 * Receives the events a {@link WebSocketClientHandler} observes on its channel
 */
public interface WebSocketEventSink {

    void onHandshakeComplete();

    void onHandshakeFailed(Throwable cause);

    void onFrame(byte[] data);

    /**
     * @param statusCode Status from the peer's close frame, -1 when it carried none
     */
    void onCloseFrame(int statusCode);

    void onException(Throwable cause);
}
