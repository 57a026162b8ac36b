package com.relay.common.api;

import com.relay.common.model.Envelope;
import com.relay.common.model.JsonRpcRequest;
import com.relay.common.model.JsonRpcResponse;

import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * Topic-based publish/subscribe transport that survives connection churn.
 * Implementations: SessionController
 */
public interface Transport {

    /**
     * Open a session against the given URL (http/https are mapped to ws/wss).
     * On a session that is already open this starts a replacement connection,
     * and the current one is closed only after the replacement opens. It is
     * not a no-op.
     * @param url Target URL
     * @param clearSubscriptions Drop the subscription registry and outbound queue first
     * @return Future that completes once a connection is open
     */
    CompletableFuture<Void> open(String url, boolean clearSubscriptions);

    default CompletableFuture<Void> open(String url) {
        return open(url, true);
    }

    /**
     * Send an envelope now, or queue it until the next connection opens
     * @return Future that completes when the envelope has been written to a socket
     */
    CompletableFuture<Void> send(Envelope envelope);

    /**
     * Send a subscribe envelope and remember the topic for replay after reconnects
     */
    CompletableFuture<Void> subscribe(String topic);

    /**
     * Subscribe and bind a typed callback for JSON-RPC responses on the topic
     */
    <T extends JsonRpcResponse> CompletableFuture<Void> subscribeResponses(String topic, Class<T> responseType,
                                                                           Consumer<T> callback);

    /**
     * Subscribe and bind a typed callback for JSON-RPC requests on the topic
     */
    <T extends JsonRpcRequest> CompletableFuture<Void> subscribeRequests(String topic, Class<T> requestType,
                                                                         Consumer<T> callback);

    /**
     * Forget every subscription and abandon queued envelopes
     */
    CompletableFuture<Void> clearSubscriptions();

    /**
     * Close the active connection without triggering a reconnect
     */
    CompletableFuture<Void> close();

    boolean isConnected();

    void addListener(TransportListener listener);

    void removeListener(TransportListener listener);
}
