package com.relay.network.websocket;

import com.relay.common.api.ConnectionHandle;
import com.relay.common.api.ConnectionListener;
import com.relay.common.exception.ErrorCode;
import com.relay.common.exception.NetworkException;
import com.relay.common.model.CloseCode;
import com.relay.common.model.ConnectionState;
import com.relay.network.handler.WebSocketClientHandler;
import com.relay.network.handler.WebSocketEventSink;
import io.netty.bootstrap.Bootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.http.DefaultHttpHeaders;
import io.netty.handler.codec.http.HttpClientCodec;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.websocketx.CloseWebSocketFrame;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketClientHandshaker;
import io.netty.handler.codec.http.websocketx.WebSocketClientHandshakerFactory;
import io.netty.handler.codec.http.websocketx.WebSocketFrameAggregator;
import io.netty.handler.codec.http.websocketx.WebSocketVersion;
import io.netty.handler.ssl.SslContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Single-use WebSocket connection on a shared Netty event loop group.
 *
 * <p>Every handle that starts connecting reports exactly one {@code onClose}:
 * with the peer's status code, 1000 after a local close, or 1006 when the
 * socket dropped or never opened.</p>
 */
public class NettyWebSocketConnection implements ConnectionHandle {
    private static final Logger log = LoggerFactory.getLogger(NettyWebSocketConnection.class);

    private final URI uri;
    private final EventLoopGroup workerGroup;
    private final SslContext sslContext;
    private final int connectTimeoutMs;
    private final int maxFramePayloadLength;

    private final List<ConnectionListener> listeners = new CopyOnWriteArrayList<>();
    private final AtomicReference<ConnectionState> state = new AtomicReference<>(ConnectionState.IDLE);
    private final CompletableFuture<Void> openFuture = new CompletableFuture<>();
    private final CompletableFuture<Void> closeFuture = new CompletableFuture<>();
    private final AtomicBoolean closeReported = new AtomicBoolean(false);

    private volatile Channel channel;
    private volatile int closeCode = CloseCode.ABNORMAL.getCode();

    NettyWebSocketConnection(URI uri, EventLoopGroup workerGroup, SslContext sslContext,
                             int connectTimeoutMs, int maxFramePayloadLength) {
        this.uri = uri;
        this.workerGroup = workerGroup;
        this.sslContext = sslContext;
        this.connectTimeoutMs = connectTimeoutMs;
        this.maxFramePayloadLength = maxFramePayloadLength;
    }

    @Override
    public CompletableFuture<Void> connect() {
        if (!state.compareAndSet(ConnectionState.IDLE, ConnectionState.CONNECTING)) {
            log.debug("connect() ignored for {} in state {}", uri, state.get());
            return openFuture;
        }

        String host = uri.getHost();
        int port = resolvePort();

        try {
            WebSocketClientHandshaker handshaker = WebSocketClientHandshakerFactory.newHandshaker(
                    uri, WebSocketVersion.V13, null, true, new DefaultHttpHeaders(), maxFramePayloadLength);
            WebSocketClientHandler handler = new WebSocketClientHandler(handshaker, new ChannelEvents());

            Bootstrap bootstrap = new Bootstrap();
            bootstrap.group(workerGroup)
                    .channel(NioSocketChannel.class)
                    .option(ChannelOption.SO_KEEPALIVE, true)
                    .option(ChannelOption.TCP_NODELAY, true)
                    .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, connectTimeoutMs)
                    .handler(new ChannelInitializer<SocketChannel>() {
                        @Override
                        protected void initChannel(SocketChannel ch) {
                            ChannelPipeline pipeline = ch.pipeline();
                            if (sslContext != null) {
                                pipeline.addLast("ssl", sslContext.newHandler(ch.alloc(), host, port));
                            }
                            pipeline.addLast("http", new HttpClientCodec());
                            pipeline.addLast("aggregator", new HttpObjectAggregator(8192));
                            pipeline.addLast("ws-aggregator", new WebSocketFrameAggregator(maxFramePayloadLength));
                            pipeline.addLast("handler", handler);
                        }
                    });

            ChannelFuture connectFuture = bootstrap.connect(host, port);
            channel = connectFuture.channel();
            channel.closeFuture().addListener(future -> handleChannelClosed());

            connectFuture.addListener((ChannelFutureListener) cf -> {
                if (cf.isSuccess()) {
                    log.debug("TCP connected to {}:{}, waiting for handshake", host, port);
                    cf.channel().eventLoop().schedule(this::checkHandshakeTimeout,
                            connectTimeoutMs, TimeUnit.MILLISECONDS);
                } else {
                    failOpen(NetworkException.connectionFailed(uri.toString(), cf.cause()));
                    cf.channel().close();
                }
            });
        } catch (Exception e) {
            failOpen(NetworkException.connectionFailed(uri.toString(), e));
            markClosed();
        }

        return openFuture;
    }

    @Override
    public CompletableFuture<Void> send(String text) {
        Channel ch = channel;
        if (state.get() != ConnectionState.OPEN || ch == null || !ch.isActive()) {
            return CompletableFuture.failedFuture(NetworkException.notConnected(uri.toString()));
        }

        CompletableFuture<Void> future = new CompletableFuture<>();
        ch.writeAndFlush(new TextWebSocketFrame(text)).addListener((ChannelFutureListener) cf -> {
            if (cf.isSuccess()) {
                future.complete(null);
            } else {
                future.completeExceptionally(NetworkException.sendFailed(uri.toString(), cf.cause()));
            }
        });
        return future;
    }

    @Override
    public CompletableFuture<Void> close() {
        ConnectionState current = state.get();
        if (current == ConnectionState.CLOSING) {
            return closeFuture;
        }
        if (current != ConnectionState.OPEN && current != ConnectionState.CONNECTING) {
            return CompletableFuture.failedFuture(NetworkException.notConnected(uri.toString()));
        }
        if (!state.compareAndSet(current, ConnectionState.CLOSING)) {
            return close();
        }

        log.info("Closing WebSocket {}", uri);
        closeCode = CloseCode.NORMAL.getCode();
        Channel ch = channel;
        if (ch == null) {
            markClosed();
        } else if (current == ConnectionState.OPEN && ch.isActive()) {
            ch.writeAndFlush(new CloseWebSocketFrame(CloseCode.NORMAL.getCode(), "closing"))
                    .addListener(ChannelFutureListener.CLOSE);
        } else {
            ch.close();
        }
        return closeFuture;
    }

    @Override
    public void cancel() {
        ConnectionState previous = state.getAndUpdate(s -> s == ConnectionState.CLOSED ? s : ConnectionState.CLOSING);
        if (previous == ConnectionState.CLOSED) {
            return;
        }
        if (previous == ConnectionState.IDLE) {
            markClosed();
            return;
        }
        log.debug("Cancelling WebSocket {} in state {}", uri, previous);
        Channel ch = channel;
        if (ch != null) {
            ch.close();
        } else {
            markClosed();
        }
    }

    @Override
    public ConnectionState getState() {
        return state.get();
    }

    @Override
    public URI getUri() {
        return uri;
    }

    @Override
    public void addListener(ConnectionListener listener) {
        listeners.add(listener);
    }

    @Override
    public void removeListener(ConnectionListener listener) {
        listeners.remove(listener);
    }

    private int resolvePort() {
        if (uri.getPort() != -1) {
            return uri.getPort();
        }
        return "wss".equalsIgnoreCase(uri.getScheme()) ? 443 : 80;
    }

    private void checkHandshakeTimeout() {
        if (state.get() == ConnectionState.CONNECTING) {
            failOpen(NetworkException.handshakeFailed(uri.toString(),
                    new IllegalStateException("No handshake response within " + connectTimeoutMs + "ms")));
            Channel ch = channel;
            if (ch != null) {
                ch.close();
            }
        }
    }

    private void failOpen(NetworkException error) {
        if (openFuture.completeExceptionally(error)) {
            log.warn("WebSocket {} failed to open: {}", uri, error.getMessage());
            fireError(error);
        }
    }

    private void handleChannelClosed() {
        if (!openFuture.isDone()) {
            failOpen(new NetworkException(ErrorCode.NETWORK_CONNECTION_LOST,
                    "Channel closed before the handshake completed"));
        }
        markClosed();
    }

    private void markClosed() {
        state.set(ConnectionState.CLOSED);
        closeFuture.complete(null);
        if (closeReported.compareAndSet(false, true)) {
            int code = closeCode;
            log.info("WebSocket {} closed with code {}", uri, code);
            for (ConnectionListener listener : listeners) {
                try {
                    listener.onClose(code);
                } catch (Exception e) {
                    log.error("Error in close listener", e);
                }
            }
        }
    }

    private void fireError(Throwable error) {
        for (ConnectionListener listener : listeners) {
            try {
                listener.onError(error);
            } catch (Exception e) {
                log.error("Error in error listener", e);
            }
        }
    }

    /**
     * Bridges handler callbacks into handle state and listener notifications
     */
    private class ChannelEvents implements WebSocketEventSink {

        @Override
        public void onHandshakeComplete() {
            if (!state.compareAndSet(ConnectionState.CONNECTING, ConnectionState.OPEN)) {
                return;
            }
            openFuture.complete(null);
            log.info("WebSocket opened: {}", uri);
            for (ConnectionListener listener : listeners) {
                try {
                    listener.onOpen();
                } catch (Exception e) {
                    log.error("Error in open listener", e);
                }
            }
        }

        @Override
        public void onHandshakeFailed(Throwable cause) {
            failOpen(NetworkException.handshakeFailed(uri.toString(), cause));
        }

        @Override
        public void onFrame(byte[] data) {
            for (ConnectionListener listener : listeners) {
                try {
                    listener.onMessage(data);
                } catch (Exception e) {
                    log.error("Error in message listener", e);
                }
            }
        }

        @Override
        public void onCloseFrame(int statusCode) {
            closeCode = statusCode == -1 ? CloseCode.NO_STATUS.getCode() : statusCode;
            state.compareAndSet(ConnectionState.OPEN, ConnectionState.CLOSING);
        }

        @Override
        public void onException(Throwable cause) {
            fireError(cause);
        }
    }
}
