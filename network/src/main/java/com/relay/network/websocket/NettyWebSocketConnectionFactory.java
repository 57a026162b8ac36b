package com.relay.network.websocket;

import com.relay.common.api.ConnectionFactory;
import com.relay.common.api.ConnectionHandle;
import com.relay.common.exception.NetworkException;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.net.ssl.SSLException;
import java.net.URI;

/**
 * Creates Netty-backed WebSocket handles that share one event loop group
 */
public class NettyWebSocketConnectionFactory implements ConnectionFactory {
    private static final Logger log = LoggerFactory.getLogger(NettyWebSocketConnectionFactory.class);

    public static final int DEFAULT_CONNECT_TIMEOUT_MS = 10000;
    public static final int DEFAULT_MAX_FRAME_PAYLOAD_LENGTH = 10 * 1024 * 1024;

    private final EventLoopGroup workerGroup;
    private final int connectTimeoutMs;
    private final int maxFramePayloadLength;
    private volatile SslContext sslContext;

    public NettyWebSocketConnectionFactory() {
        this(DEFAULT_CONNECT_TIMEOUT_MS, DEFAULT_MAX_FRAME_PAYLOAD_LENGTH);
    }

    public NettyWebSocketConnectionFactory(int connectTimeoutMs, int maxFramePayloadLength) {
        this.workerGroup = new NioEventLoopGroup();
        this.connectTimeoutMs = connectTimeoutMs;
        this.maxFramePayloadLength = maxFramePayloadLength;
        log.info("Initialized NettyWebSocketConnectionFactory (connectTimeout={}ms)", connectTimeoutMs);
    }

    @Override
    public ConnectionHandle create(URI uri) throws NetworkException {
        String scheme = uri.getScheme();
        if (scheme == null || !(scheme.equalsIgnoreCase("ws") || scheme.equalsIgnoreCase("wss"))) {
            throw NetworkException.invalidUrl(uri.toString(),
                    new IllegalArgumentException("Scheme must be ws or wss"));
        }
        if (uri.getHost() == null) {
            throw NetworkException.invalidUrl(uri.toString(),
                    new IllegalArgumentException("Missing host"));
        }

        SslContext ssl = scheme.equalsIgnoreCase("wss") ? clientSslContext(uri) : null;
        return new NettyWebSocketConnection(uri, workerGroup, ssl, connectTimeoutMs, maxFramePayloadLength);
    }

    private SslContext clientSslContext(URI uri) throws NetworkException {
        SslContext context = sslContext;
        if (context == null) {
            synchronized (this) {
                if (sslContext == null) {
                    try {
                        sslContext = SslContextBuilder.forClient().build();
                    } catch (SSLException e) {
                        throw NetworkException.connectionFailed(uri.toString(), e);
                    }
                }
                context = sslContext;
            }
        }
        return context;
    }

    public void shutdown() {
        if (workerGroup != null) {
            workerGroup.shutdownGracefully();
        }
        log.info("NettyWebSocketConnectionFactory shutdown complete");
    }
}
