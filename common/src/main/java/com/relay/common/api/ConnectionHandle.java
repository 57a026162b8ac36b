package com.relay.common.api;

import com.relay.common.model.ConnectionState;

import java.net.URI;
import java.util.concurrent.CompletableFuture;

/**
 * One underlying bidirectional socket connection.
 * Implementations: NettyWebSocketConnection
 *
 * <p>A handle is single-use: once it reaches {@link ConnectionState#CLOSED} a new
 * handle must be created. It never retries or queues on its own.</p>
 */
public interface ConnectionHandle {

    /**
     * Start connecting.
     * @return Future that completes when the connection is open
     */
    CompletableFuture<Void> connect();

    /**
     * Send a text frame
     * @param text Encoded envelope
     * @return Future that completes when the frame has been written
     */
    CompletableFuture<Void> send(String text);

    /**
     * Gracefully close the connection.
     * Fails with a NETWORK_NOT_CONNECTED {@code NetworkException} if the handle is not connecting or open.
     * @return Future that completes when the socket is closed
     */
    CompletableFuture<Void> close();

    /**
     * Abort the connection without a close handshake. Safe to call in any state.
     */
    void cancel();

    ConnectionState getState();

    URI getUri();

    void addListener(ConnectionListener listener);

    void removeListener(ConnectionListener listener);
}
