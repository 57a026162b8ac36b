package com.relay.network.handler;

import io.netty.buffer.ByteBufUtil;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.websocketx.BinaryWebSocketFrame;
import io.netty.handler.codec.http.websocketx.CloseWebSocketFrame;
import io.netty.handler.codec.http.websocketx.PingWebSocketFrame;
import io.netty.handler.codec.http.websocketx.PongWebSocketFrame;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketClientHandshaker;
import io.netty.handler.codec.http.websocketx.WebSocketFrame;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Netty handler for the client side of a WebSocket: drives the opening
 * handshake, answers pings and forwards frames to a sink. Fragmented messages
 * arrive here already reassembled by a {@code WebSocketFrameAggregator}.
 */
public class WebSocketClientHandler extends SimpleChannelInboundHandler<Object> {
    private static final Logger log = LoggerFactory.getLogger(WebSocketClientHandler.class);

    private final WebSocketClientHandshaker handshaker;
    private final WebSocketEventSink sink;

    public WebSocketClientHandler(WebSocketClientHandshaker handshaker, WebSocketEventSink sink) {
        this.handshaker = handshaker;
        this.sink = sink;
    }

    @Override
    public void channelActive(ChannelHandlerContext ctx) {
        handshaker.handshake(ctx.channel());
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, Object msg) {
        Channel ch = ctx.channel();
        if (!handshaker.isHandshakeComplete()) {
            if (msg instanceof FullHttpResponse) {
                try {
                    handshaker.finishHandshake(ch, (FullHttpResponse) msg);
                    log.debug("Handshake complete with {}", handshaker.uri());
                    sink.onHandshakeComplete();
                } catch (Exception e) {
                    sink.onHandshakeFailed(e);
                    ch.close();
                }
            }
            return;
        }

        if (msg instanceof FullHttpResponse) {
            log.warn("Unexpected HTTP response after handshake: status={}", ((FullHttpResponse) msg).status());
            return;
        }

        WebSocketFrame frame = (WebSocketFrame) msg;
        if (frame instanceof TextWebSocketFrame || frame instanceof BinaryWebSocketFrame) {
            sink.onFrame(ByteBufUtil.getBytes(frame.content()));
        } else if (frame instanceof PingWebSocketFrame) {
            ch.writeAndFlush(new PongWebSocketFrame(frame.content().retain()));
        } else if (frame instanceof CloseWebSocketFrame) {
            CloseWebSocketFrame closeFrame = (CloseWebSocketFrame) frame;
            log.debug("Close frame received: status={}, reason={}", closeFrame.statusCode(), closeFrame.reasonText());
            sink.onCloseFrame(closeFrame.statusCode());
            ch.writeAndFlush(closeFrame.retainedDuplicate()).addListener(ChannelFutureListener.CLOSE);
        }
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.error("Exception in WebSocket channel", cause);
        if (!handshaker.isHandshakeComplete()) {
            sink.onHandshakeFailed(cause);
        } else {
            sink.onException(cause);
        }
        ctx.close();
    }
}
