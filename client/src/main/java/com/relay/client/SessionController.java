package com.relay.client;

import com.relay.common.api.ConnectionFactory;
import com.relay.common.api.ConnectionHandle;
import com.relay.common.api.ConnectionListener;
import com.relay.common.api.ErrorHandler;
import com.relay.common.api.EventDispatcher;
import com.relay.common.api.NoOpErrorHandler;
import com.relay.common.api.Transport;
import com.relay.common.api.TransportListener;
import com.relay.common.exception.ErrorCode;
import com.relay.common.exception.ExceptionLogger;
import com.relay.common.exception.NetworkException;
import com.relay.common.exception.SessionException;
import com.relay.common.exception.TransportException;
import com.relay.common.model.CloseCode;
import com.relay.common.model.ConnectionState;
import com.relay.common.model.Envelope;
import com.relay.common.model.JsonRpcRequest;
import com.relay.common.model.JsonRpcResponse;
import com.relay.common.model.SessionState;
import com.relay.network.codec.JsonEnvelopeCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Resilient session over a sequence of WebSocket connections.
 *
 * <p>Features:</p>
 * <ul>
 *   <li>Queues envelopes while no connection is open and flushes them in order once one is</li>
 *   <li>Replays one subscribe envelope per registered topic after every reconnect</li>
 *   <li>Reconnects after any unexpected close, waiting {@code reconnectDelay} after abnormal ones (1006)</li>
 *   <li>Collapses concurrent open requests into one in-flight attempt</li>
 *   <li>Acknowledges every received envelope with a silent ack</li>
 * </ul>
 *
 * <p>At most two connections exist: the active one and a candidate being
 * opened. The candidate is promoted only after the previous active connection
 * has been closed. All state transitions run on a single session thread;
 * connection events from I/O threads are re-posted onto it, and so are
 * listener and dispatcher callbacks, which therefore must not block.</p>
 */
public class SessionController implements Transport {
    private static final Logger log = LoggerFactory.getLogger(SessionController.class);

    public static final Duration DEFAULT_RECONNECT_DELAY = Duration.ofSeconds(2);
    public static final Duration DEFAULT_CLOSE_TIMEOUT = Duration.ofSeconds(5);

    private final ConnectionFactory connectionFactory;
    private final JsonEnvelopeCodec codec;
    private final ErrorHandler errorHandler;
    private final ScheduledExecutorService sessionExecutor;
    private final long reconnectDelayMs;
    private final long closeTimeoutMs;

    private final OutboundQueue outboundQueue = new OutboundQueue();
    private final SubscriptionRegistry subscriptions = new SubscriptionRegistry();
    private final List<TransportListener> listeners = new CopyOnWriteArrayList<>();
    private final AtomicInteger reconnectAttempts = new AtomicInteger(0);

    // Written on the session thread only
    private volatile ConnectionSlot active;
    private volatile ConnectionSlot candidate;
    private volatile SessionState state = SessionState.DISCONNECTED;
    private CompletableFuture<Void> pendingOpen;
    private ScheduledFuture<?> reconnectTask;

    private volatile String url;
    private volatile boolean paused;
    private volatile boolean disposed;
    private volatile EventDispatcher eventDispatcher;

    public SessionController(ConnectionFactory connectionFactory) {
        this(connectionFactory, new JsonEnvelopeCodec(), new NoOpErrorHandler(),
                DEFAULT_RECONNECT_DELAY, DEFAULT_CLOSE_TIMEOUT);
    }

    public SessionController(ConnectionFactory connectionFactory, JsonEnvelopeCodec codec, ErrorHandler errorHandler,
                             Duration reconnectDelay, Duration closeTimeout) {
        this(connectionFactory, codec, errorHandler, reconnectDelay, closeTimeout,
                Executors.newSingleThreadScheduledExecutor(r -> {
                    Thread thread = new Thread(r, "relay-session");
                    thread.setDaemon(true);
                    return thread;
                }));
    }

    public SessionController(ConnectionFactory connectionFactory, JsonEnvelopeCodec codec, ErrorHandler errorHandler,
                             Duration reconnectDelay, Duration closeTimeout,
                             ScheduledExecutorService sessionExecutor) {
        this.connectionFactory = Objects.requireNonNull(connectionFactory, "connectionFactory");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.errorHandler = Objects.requireNonNull(errorHandler, "errorHandler");
        this.reconnectDelayMs = reconnectDelay.toMillis();
        this.closeTimeoutMs = closeTimeout.toMillis();
        this.sessionExecutor = Objects.requireNonNull(sessionExecutor, "sessionExecutor");
        log.info("Initialized SessionController (reconnectDelay={}ms, closeTimeout={}ms)",
                reconnectDelayMs, closeTimeoutMs);
    }

    /**
     * Attach the typed dispatch facility that receives topic bindings and inbound envelopes
     */
    public void attachEventDispatcher(EventDispatcher eventDispatcher) {
        this.eventDispatcher = eventDispatcher;
    }

    // ---------------------------------------------------------------------
    // Transport operations
    // ---------------------------------------------------------------------

    @Override
    public CompletableFuture<Void> open(String url, boolean clearSubscriptions) {
        Objects.requireNonNull(url, "url");
        return onSessionThread(() -> {
            boolean targetChanged = this.url != null && !url.equals(this.url);
            if (targetChanged || clearSubscriptions) {
                clearSubscriptionsInternal();
            }
            this.url = url;
            return socketOpen();
        });
    }

    @Override
    public CompletableFuture<Void> send(Envelope envelope) {
        Objects.requireNonNull(envelope, "envelope");
        return onSessionThread(() -> sendInternal(envelope));
    }

    @Override
    public CompletableFuture<Void> subscribe(String topic) {
        if (topic == null || topic.isBlank()) {
            return CompletableFuture.failedFuture(
                    new TransportException(ErrorCode.VALIDATION_INVALID_TOPIC, "Topic must not be blank"));
        }
        return onSessionThread(() -> subscribeInternal(topic));
    }

    @Override
    public <T extends JsonRpcResponse> CompletableFuture<Void> subscribeResponses(String topic, Class<T> responseType,
                                                                                  Consumer<T> callback) {
        return subscribeTyped(topic, responseType, callback);
    }

    @Override
    public <T extends JsonRpcRequest> CompletableFuture<Void> subscribeRequests(String topic, Class<T> requestType,
                                                                                Consumer<T> callback) {
        return subscribeTyped(topic, requestType, callback);
    }

    private <T> CompletableFuture<Void> subscribeTyped(String topic, Class<T> payloadType, Consumer<T> callback) {
        EventDispatcher dispatcher = eventDispatcher;
        if (dispatcher == null) {
            return CompletableFuture.failedFuture(
                    new IllegalStateException("No event dispatcher attached for typed subscriptions"));
        }
        if (topic == null || topic.isBlank()) {
            return CompletableFuture.failedFuture(
                    new TransportException(ErrorCode.VALIDATION_INVALID_TOPIC, "Topic must not be blank"));
        }
        return onSessionThread(() -> {
            dispatcher.listenFor(topic, payloadType, callback);
            return subscribeInternal(topic);
        });
    }

    @Override
    public CompletableFuture<Void> clearSubscriptions() {
        return onSessionThread(() -> {
            clearSubscriptionsInternal();
            return CompletableFuture.completedFuture(null);
        });
    }

    @Override
    public CompletableFuture<Void> close() {
        return onSessionThread(this::closeInternal);
    }

    /**
     * Close the session, abandon queued envelopes and stop the session thread.
     * Every later operation fails with SESSION_DISPOSED.
     */
    public CompletableFuture<Void> dispose() {
        if (disposed) {
            return CompletableFuture.completedFuture(null);
        }
        log.info("Disposing session for {}", url);
        CompletableFuture<Void> closed = close();
        disposed = true;

        CompletableFuture<Void> result = new CompletableFuture<>();
        closed.whenComplete((v, ex) -> {
            try {
                sessionExecutor.execute(() -> {
                    discardQueue();
                    subscriptions.clear();
                });
            } catch (RejectedExecutionException e) {
                log.debug("Session thread already stopped");
            }
            sessionExecutor.shutdown();
            log.info("Session disposed");
            result.complete(null);
        });
        return result;
    }

    /**
     * Blocking disposal bounded by the close timeout, for container shutdown hooks
     */
    public void shutdown() {
        try {
            dispose().get(closeTimeoutMs + 1000, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            sessionExecutor.shutdownNow();
        } catch (Exception e) {
            log.warn("Session did not shut down cleanly: {}", e.getMessage());
            sessionExecutor.shutdownNow();
        }
    }

    @Override
    public boolean isConnected() {
        ConnectionSlot current = active;
        return state == SessionState.OPEN && current != null
                && current.handle.getState() == ConnectionState.OPEN;
    }

    @Override
    public void addListener(TransportListener listener) {
        listeners.add(listener);
    }

    @Override
    public void removeListener(TransportListener listener) {
        listeners.remove(listener);
    }

    public SessionState getState() {
        return state;
    }

    public String getUrl() {
        return url;
    }

    public boolean isPaused() {
        return paused;
    }

    public List<String> getSubscribedTopics() {
        return subscriptions.topics();
    }

    public int getQueuedCount() {
        return outboundQueue.size();
    }

    public int getReconnectAttempts() {
        return reconnectAttempts.get();
    }

    /**
     * Set before closing on pause so the resulting close does not reconnect
     */
    void setPaused(boolean paused) {
        this.paused = paused;
    }

    // ---------------------------------------------------------------------
    // Session-thread internals
    // ---------------------------------------------------------------------

    private CompletableFuture<Void> sendInternal(Envelope envelope) {
        if (isConnected()) {
            return transmit(active, envelope);
        }

        CompletableFuture<Void> delivery = outboundQueue.enqueue(envelope);
        log.debug("Queued envelope topic={} type={} (queue size {})",
                envelope.getTopic(), envelope.getType(), outboundQueue.size());

        if (paused) {
            log.debug("Session paused, envelope stays queued until resume");
        } else if (url == null) {
            log.warn("No URL known yet, envelope for topic {} queued until open() is called", envelope.getTopic());
        } else {
            socketOpen();
        }
        return delivery;
    }

    private CompletableFuture<Void> subscribeInternal(String topic) {
        log.info("Subscribe to {}", topic);
        CompletableFuture<Void> delivery = sendInternal(Envelope.subscribe(topic));
        if (subscriptions.add(topic)) {
            log.debug("Registered topic {} ({} total)", topic, subscriptions.size());
        }
        return delivery;
    }

    private void clearSubscriptionsInternal() {
        List<String> removed = subscriptions.clear();
        EventDispatcher dispatcher = eventDispatcher;
        if (dispatcher != null) {
            for (String topic : removed) {
                dispatcher.unsubscribeTopic(topic);
            }
        }
        int discarded = discardQueue();
        if (!removed.isEmpty() || discarded > 0) {
            log.info("Cleared {} subscriptions and {} queued envelopes", removed.size(), discarded);
        }
    }

    private int discardQueue() {
        List<OutboundQueue.Entry> dropped = outboundQueue.clear();
        for (OutboundQueue.Entry entry : dropped) {
            Envelope envelope = entry.getEnvelope();
            entry.getDelivery().completeExceptionally(
                    SessionException.queueDiscarded(envelope.getTopic(), envelope.getType()));
        }
        return dropped.size();
    }

    /**
     * Start a connection attempt unless one is already in flight.
     * @return The open signal shared by everyone waiting for this attempt
     */
    private CompletableFuture<Void> socketOpen() {
        if (url == null) {
            return CompletableFuture.failedFuture(SessionException.noUrl());
        }

        ConnectionSlot inFlight = candidate;
        if (inFlight != null) {
            ConnectionState candidateState = inFlight.handle.getState();
            if (candidateState.isTerminal()) {
                log.error("Candidate connection to {} was closed but not cleared, discarding it", inFlight.uri());
                inFlight.detachAll();
                candidate = null;
            } else {
                log.info("Will not open a new connection, attempt already in state {}", candidateState);
                return openSignal();
            }
        }

        cancelReconnect();
        CompletableFuture<Void> signal = openSignal();

        ConnectionHandle handle;
        try {
            URI target = WebSocketUrls.toWebSocketUri(url);
            handle = connectionFactory.create(target);
        } catch (NetworkException e) {
            errorHandler.onError("open", e);
            completeOpenSignal(e);
            return signal;
        }

        ConnectionSlot slot = new ConnectionSlot(handle);
        candidate = slot;
        if (active == null) {
            state = SessionState.CONNECTING;
        }
        slot.attach();

        log.info("Opening connection to {} (attempt {})", handle.getUri(), reconnectAttempts.get() + 1);
        handle.connect();
        return signal;
    }

    private CompletableFuture<Void> openSignal() {
        if (pendingOpen == null || pendingOpen.isDone()) {
            pendingOpen = new CompletableFuture<>();
        }
        return pendingOpen;
    }

    private void completeOpenSignal(Throwable error) {
        CompletableFuture<Void> signal = pendingOpen;
        pendingOpen = null;
        if (signal == null) {
            return;
        }
        if (error == null) {
            signal.complete(null);
        } else {
            signal.completeExceptionally(error);
        }
    }

    private void handleOpened(ConnectionSlot slot) {
        if (slot != candidate) {
            log.warn("Ignoring open event from superseded connection {}", slot.uri());
            slot.detachAll();
            slot.handle.cancel();
            return;
        }

        ConnectionSlot previous = active;
        if (previous == null) {
            promote(slot);
            return;
        }

        active = null;
        state = SessionState.CONNECTING;
        closeGracefully(previous).whenComplete((v, ex) -> {
            if (ex != null) {
                errorHandler.onError("close-previous", ex);
            }
            post(() -> promote(slot));
        });
    }

    private void promote(ConnectionSlot slot) {
        if (slot != candidate) {
            log.debug("Connection {} was superseded before promotion", slot.uri());
            slot.detachAll();
            slot.handle.cancel();
            return;
        }

        active = slot;
        candidate = null;
        reconnectAttempts.set(0);

        queueSubscriptions();
        state = SessionState.OPEN;
        flushQueue();

        log.info("Session opened to {}", slot.uri());
        fireOpened();
        completeOpenSignal(null);
    }

    private void queueSubscriptions() {
        int queued = 0;
        for (String topic : subscriptions.topics()) {
            if (outboundQueue.containsSubscription(topic)) {
                continue;
            }
            outboundQueue.enqueue(Envelope.subscribe(topic));
            queued++;
        }
        log.debug("Queued {} subscriptions for replay", queued);
    }

    private void flushQueue() {
        log.debug("Flushing queue. Count: {}", outboundQueue.size());
        OutboundQueue.Entry entry;
        while (isConnected() && (entry = outboundQueue.poll()) != null) {
            CompletableFuture<Void> delivery = entry.getDelivery();
            transmit(active, entry.getEnvelope()).whenComplete((v, ex) -> {
                if (ex != null) {
                    delivery.completeExceptionally(ExceptionLogger.unwrap(ex));
                } else {
                    delivery.complete(null);
                }
            });
        }
        log.debug("Queue flushed, {} left", outboundQueue.size());
    }

    private CompletableFuture<Void> transmit(ConnectionSlot slot, Envelope envelope) {
        String text;
        try {
            text = codec.encode(envelope);
        } catch (NetworkException e) {
            return CompletableFuture.failedFuture(e);
        }
        return slot.handle.send(text);
    }

    private void handleMessage(ConnectionSlot slot, byte[] data) {
        boolean fromActive = slot == active;
        boolean fromOpenCandidate = slot == candidate && slot.handle.getState() == ConnectionState.OPEN;
        if (!fromActive && !fromOpenCandidate) {
            log.debug("Dropping message from inactive connection {}", slot.uri());
            return;
        }

        Envelope envelope;
        try {
            envelope = codec.decode(data);
        } catch (NetworkException e) {
            log.warn("Dropping undecodable message: {}", e.getMessage());
            return;
        }

        // An open candidate is not promoted yet, so its ack goes out on its own socket
        Envelope ack = Envelope.ack(envelope.getTopic());
        CompletableFuture<Void> ackSent = fromActive ? sendInternal(ack) : transmit(slot, ack);
        ackSent.whenComplete((v, ex) -> {
            if (ex != null) {
                log.debug("Ack for topic {} not sent: {}", envelope.getTopic(), ex.getMessage());
            }
        });

        fireMessage(envelope);
    }

    private void handleClosed(ConnectionSlot slot, int code) {
        boolean wasActive = slot == active;
        boolean wasCandidate = slot == candidate;
        if (!wasActive && !wasCandidate) {
            log.debug("Ignoring close of detached connection {}", slot.uri());
            return;
        }

        if (wasActive) {
            active = null;
            state = candidate != null ? SessionState.CONNECTING : SessionState.DISCONNECTED;
        }

        if (paused) {
            log.info("Session paused, retry attempt aborted");
            return;
        }

        if (wasCandidate) {
            candidate = null;
            if (active == null) {
                state = SessionState.DISCONNECTED;
            }
        }

        CloseCode closeCode = CloseCode.fromCode(code);
        if (closeCode.isAbnormal()) {
            log.error("Abnormal close detected for {}. Waiting {}ms before reconnect", slot.uri(), reconnectDelayMs);
            scheduleReconnect(reconnectDelayMs);
        } else {
            log.info("Connection {} closed with code {} ({}), reconnecting", slot.uri(), code, closeCode);
            scheduleReconnect(0);
        }
    }

    private void scheduleReconnect(long delayMs) {
        if (reconnectTask != null && !reconnectTask.isDone()) {
            log.debug("Reconnect already scheduled, skipping duplicate");
            return;
        }
        int attempt = reconnectAttempts.incrementAndGet();
        log.info("Scheduling reconnect in {}ms (attempt {})", delayMs, attempt);
        reconnectTask = sessionExecutor.schedule(this::attemptReconnect, delayMs, TimeUnit.MILLISECONDS);
    }

    private void attemptReconnect() {
        reconnectTask = null;
        if (paused || disposed) {
            log.info("Reconnect skipped (paused={}, disposed={})", paused, disposed);
            return;
        }
        if (isConnected()) {
            log.debug("Already connected, reconnect not needed");
            return;
        }
        socketOpen();
    }

    private void cancelReconnect() {
        if (reconnectTask != null) {
            reconnectTask.cancel(false);
            reconnectTask = null;
        }
    }

    private CompletableFuture<Void> closeInternal() {
        log.info("Closing session to {}", url);
        cancelReconnect();

        ConnectionSlot inFlight = candidate;
        if (inFlight != null) {
            candidate = null;
            inFlight.detachAll();
            inFlight.handle.cancel();
        }

        ConnectionSlot current = active;
        active = null;
        state = SessionState.DISCONNECTED;

        CompletableFuture<Void> closing = current != null
                ? closeGracefully(current)
                : CompletableFuture.completedFuture(null);
        completeOpenSignal(SessionException.closed(url));

        CompletableFuture<Void> result = new CompletableFuture<>();
        closing.whenCompleteAsync((v, ex) -> {
            try {
                fireClosed();
            } finally {
                if (ex != null) {
                    result.completeExceptionally(ExceptionLogger.unwrap(ex));
                } else {
                    result.complete(null);
                }
            }
        }, sessionExecutor);
        return result;
    }

    /**
     * Close a connection that has been detached from reconnect handling.
     * "Not connected" failures and hung closes are absorbed; any other error propagates.
     */
    private CompletableFuture<Void> closeGracefully(ConnectionSlot slot) {
        slot.detachCloseWatcher();
        return slot.handle.close()
                .copy()
                .orTimeout(closeTimeoutMs, TimeUnit.MILLISECONDS)
                .handle((v, ex) -> {
                    if (ex == null) {
                        return null;
                    }
                    Throwable cause = ExceptionLogger.unwrap(ex);
                    if (isNotConnected(cause)) {
                        log.warn("Tried to close a connection that is already closed");
                        return null;
                    }
                    if (cause instanceof TimeoutException) {
                        ExceptionLogger.logWarn(log,
                                NetworkException.closeTimeout(slot.uri().toString(), closeTimeoutMs));
                        slot.handle.cancel();
                        return null;
                    }
                    throw new CompletionException(cause);
                });
    }

    private static boolean isNotConnected(Throwable error) {
        return error instanceof NetworkException
                && ((NetworkException) error).getErrorCode() == ErrorCode.NETWORK_NOT_CONNECTED;
    }

    // ---------------------------------------------------------------------
    // Event fan-out
    // ---------------------------------------------------------------------

    private void fireOpened() {
        for (TransportListener listener : listeners) {
            try {
                listener.onOpened();
            } catch (Exception e) {
                log.error("Error in opened listener", e);
            }
        }
    }

    private void fireClosed() {
        for (TransportListener listener : listeners) {
            try {
                listener.onClosed();
            } catch (Exception e) {
                log.error("Error in closed listener", e);
            }
        }
    }

    private void fireMessage(Envelope envelope) {
        for (TransportListener listener : listeners) {
            try {
                listener.onMessage(envelope);
            } catch (Exception e) {
                log.error("Error in message listener for topic {}", envelope.getTopic(), e);
            }
        }
        EventDispatcher dispatcher = eventDispatcher;
        if (dispatcher != null) {
            try {
                dispatcher.dispatch(envelope);
            } catch (Exception e) {
                log.error("Error dispatching envelope for topic {}", envelope.getTopic(), e);
            }
        }
    }

    // ---------------------------------------------------------------------
    // Session thread plumbing
    // ---------------------------------------------------------------------

    private <T> CompletableFuture<T> onSessionThread(Callable<CompletableFuture<T>> action) {
        if (disposed) {
            return CompletableFuture.failedFuture(SessionException.disposed());
        }
        CompletableFuture<T> result = new CompletableFuture<>();
        try {
            sessionExecutor.execute(() -> {
                try {
                    action.call().whenComplete((value, ex) -> {
                        if (ex != null) {
                            result.completeExceptionally(ExceptionLogger.unwrap(ex));
                        } else {
                            result.complete(value);
                        }
                    });
                } catch (Exception e) {
                    result.completeExceptionally(e);
                }
            });
        } catch (RejectedExecutionException e) {
            result.completeExceptionally(SessionException.disposed());
        }
        return result;
    }

    private void post(Runnable task) {
        try {
            sessionExecutor.execute(() -> {
                try {
                    task.run();
                } catch (Exception e) {
                    log.error("Unexpected error on session thread", e);
                }
            });
        } catch (RejectedExecutionException e) {
            log.debug("Session thread stopped, dropping connection event");
        }
    }

    /**
     * One of at most two connection slots: the active connection or the candidate being opened.
     * Holds the listeners registered on the handle so they can be detached individually.
     */
    private final class ConnectionSlot {
        private final ConnectionHandle handle;
        private final ConnectionListener inbound;
        private final ConnectionListener closeWatcher;

        ConnectionSlot(ConnectionHandle handle) {
            this.handle = handle;
            this.inbound = new ConnectionListener() {
                @Override
                public void onOpen() {
                    post(() -> handleOpened(ConnectionSlot.this));
                }

                @Override
                public void onMessage(byte[] data) {
                    post(() -> handleMessage(ConnectionSlot.this, data));
                }

                @Override
                public void onError(Throwable error) {
                    post(() -> errorHandler.onError(handle.getUri().toString(), error));
                }
            };
            this.closeWatcher = new ConnectionListener() {
                @Override
                public void onClose(int code) {
                    post(() -> handleClosed(ConnectionSlot.this, code));
                }
            };
        }

        void attach() {
            handle.addListener(inbound);
            handle.addListener(closeWatcher);
        }

        void detachCloseWatcher() {
            handle.removeListener(closeWatcher);
        }

        void detachAll() {
            handle.removeListener(inbound);
            handle.removeListener(closeWatcher);
        }

        URI uri() {
            return handle.getUri();
        }
    }
}
