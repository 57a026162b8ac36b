package com.relay.network.websocket;

import com.relay.common.api.ConnectionHandle;
import com.relay.common.api.ConnectionListener;
import com.relay.common.exception.ErrorCode;
import com.relay.common.exception.NetworkException;
import com.relay.common.model.ConnectionState;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.TooLongFrameException;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.codec.http.websocketx.CloseWebSocketFrame;
import io.netty.handler.codec.http.websocketx.ContinuationWebSocketFrame;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolHandler;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class NettyWebSocketConnectionTest {

    private EventLoopGroup serverGroup;
    private Channel serverChannel;
    private int port;
    private NettyWebSocketConnectionFactory factory;

    @BeforeEach
    void setUp() throws Exception {
        serverGroup = new NioEventLoopGroup(1);
        ServerBootstrap bootstrap = new ServerBootstrap();
        bootstrap.group(serverGroup)
                .channel(NioServerSocketChannel.class)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        ch.pipeline().addLast(new HttpServerCodec());
                        ch.pipeline().addLast(new HttpObjectAggregator(65536));
                        ch.pipeline().addLast(new WebSocketServerProtocolHandler("/ws"));
                        ch.pipeline().addLast(new ScriptedServerHandler());
                    }
                });
        serverChannel = bootstrap.bind("127.0.0.1", 0).sync().channel();
        port = ((InetSocketAddress) serverChannel.localAddress()).getPort();

        factory = new NettyWebSocketConnectionFactory(2000, 65536);
    }

    @AfterEach
    void tearDown() throws Exception {
        if (factory != null) {
            factory.shutdown();
        }
        if (serverChannel != null) {
            serverChannel.close().sync();
        }
        if (serverGroup != null) {
            serverGroup.shutdownGracefully(0, 1, TimeUnit.SECONDS).sync();
        }
    }

    @Test
    void testOpenEchoAndLocalClose() throws Exception {
        ConnectionHandle handle = factory.create(URI.create("ws://127.0.0.1:" + port + "/ws"));
        RecordingListener listener = new RecordingListener();
        handle.addListener(listener);

        handle.connect().get(5, TimeUnit.SECONDS);
        assertEquals(ConnectionState.OPEN, handle.getState());
        assertEquals("open", listener.events.poll(5, TimeUnit.SECONDS));

        handle.send("{\"topic\":\"t\",\"type\":\"data\"}").get(5, TimeUnit.SECONDS);
        assertEquals("message:{\"topic\":\"t\",\"type\":\"data\"}", listener.events.poll(5, TimeUnit.SECONDS));

        handle.close().get(5, TimeUnit.SECONDS);
        assertEquals("close:1000", listener.events.poll(5, TimeUnit.SECONDS));
        assertEquals(ConnectionState.CLOSED, handle.getState());
    }

    @Test
    void testPeerCloseReportsStatusCode() throws Exception {
        ConnectionHandle handle = factory.create(URI.create("ws://127.0.0.1:" + port + "/ws"));
        RecordingListener listener = new RecordingListener();
        handle.addListener(listener);
        handle.connect().get(5, TimeUnit.SECONDS);
        assertEquals("open", listener.events.poll(5, TimeUnit.SECONDS));

        handle.send("bye").get(5, TimeUnit.SECONDS);

        assertEquals("close:4000", listener.events.poll(5, TimeUnit.SECONDS));
        assertEquals(ConnectionState.CLOSED, handle.getState());
    }

    @Test
    void testDroppedSocketReportsAbnormalClose() throws Exception {
        ConnectionHandle handle = factory.create(URI.create("ws://127.0.0.1:" + port + "/ws"));
        RecordingListener listener = new RecordingListener();
        handle.addListener(listener);
        handle.connect().get(5, TimeUnit.SECONDS);
        assertEquals("open", listener.events.poll(5, TimeUnit.SECONDS));

        handle.send("drop").get(5, TimeUnit.SECONDS);

        assertEquals("close:1006", listener.events.poll(5, TimeUnit.SECONDS));
    }

    @Test
    void testRefusedConnectReportsErrorThenAbnormalClose() throws Exception {
        int unusedPort;
        try (ServerSocket socket = new ServerSocket(0)) {
            unusedPort = socket.getLocalPort();
        }
        ConnectionHandle handle = factory.create(URI.create("ws://127.0.0.1:" + unusedPort + "/ws"));
        RecordingListener listener = new RecordingListener();
        handle.addListener(listener);

        CompletableFuture<Void> connect = handle.connect();

        ExecutionException ex = assertThrows(ExecutionException.class, () -> connect.get(5, TimeUnit.SECONDS));
        assertTrue(ex.getCause() instanceof NetworkException);
        assertEquals("error", listener.events.poll(5, TimeUnit.SECONDS));
        assertEquals("close:1006", listener.events.poll(5, TimeUnit.SECONDS));
        assertEquals(ConnectionState.CLOSED, handle.getState());
    }

    @Test
    void testSendBeforeOpenFails() throws Exception {
        ConnectionHandle handle = factory.create(URI.create("ws://127.0.0.1:" + port + "/ws"));

        ExecutionException ex = assertThrows(ExecutionException.class,
                () -> handle.send("x").get(1, TimeUnit.SECONDS));

        NetworkException cause = (NetworkException) ex.getCause();
        assertEquals(ErrorCode.NETWORK_NOT_CONNECTED, cause.getErrorCode());
    }

    @Test
    void testCloseWhenIdleFailsWithNotConnected() throws Exception {
        ConnectionHandle handle = factory.create(URI.create("ws://127.0.0.1:" + port + "/ws"));

        ExecutionException ex = assertThrows(ExecutionException.class,
                () -> handle.close().get(1, TimeUnit.SECONDS));

        NetworkException cause = (NetworkException) ex.getCause();
        assertEquals(ErrorCode.NETWORK_NOT_CONNECTED, cause.getErrorCode());
        assertEquals("WebSocket is not connected", cause.getMessage());
    }

    @Test
    void testCancelIdleHandleReportsCloseOnce() throws Exception {
        ConnectionHandle handle = factory.create(URI.create("ws://127.0.0.1:" + port + "/ws"));
        RecordingListener listener = new RecordingListener();
        handle.addListener(listener);

        handle.cancel();
        handle.cancel();

        assertEquals(ConnectionState.CLOSED, handle.getState());
        assertEquals(List.of("close:1006"), listener.drain());
    }

    @Test
    void testFragmentedMessageIsDeliveredWhole() throws Exception {
        ConnectionHandle handle = factory.create(URI.create("ws://127.0.0.1:" + port + "/ws"));
        RecordingListener listener = new RecordingListener();
        handle.addListener(listener);
        handle.connect().get(5, TimeUnit.SECONDS);
        assertEquals("open", listener.events.poll(5, TimeUnit.SECONDS));

        handle.send("split").get(5, TimeUnit.SECONDS);

        assertEquals("message:{\"topic\":\"t\",\"type\":\"data\"}", listener.events.poll(5, TimeUnit.SECONDS));
        assertEquals(ConnectionState.OPEN, handle.getState());
    }

    @Test
    void testOversizedFragmentedMessageClosesConnection() throws Exception {
        ConnectionHandle handle = factory.create(URI.create("ws://127.0.0.1:" + port + "/ws"));
        RecordingListener listener = new RecordingListener();
        handle.addListener(listener);
        handle.connect().get(5, TimeUnit.SECONDS);
        assertEquals("open", listener.events.poll(5, TimeUnit.SECONDS));

        handle.send("flood").get(5, TimeUnit.SECONDS);

        assertEquals("error", listener.events.poll(5, TimeUnit.SECONDS));
        assertTrue(listener.errors.get(0) instanceof TooLongFrameException);
        assertEquals("close:1006", listener.events.poll(5, TimeUnit.SECONDS));
        assertEquals(ConnectionState.CLOSED, handle.getState());
    }

    @Test
    void testFactoryRejectsNonWebSocketScheme() {
        NetworkException ex = assertThrows(NetworkException.class,
                () -> factory.create(URI.create("ftp://127.0.0.1/ws")));

        assertEquals(ErrorCode.NETWORK_INVALID_URL, ex.getErrorCode());
    }

    /**
     * Echoes text frames. "bye" closes with status 4000, "drop" closes the socket without a frame,
     * "split" answers with a message in three fragments and "flood" starts a message that never ends.
     */
    private static class ScriptedServerHandler extends SimpleChannelInboundHandler<TextWebSocketFrame> {
        @Override
        protected void channelRead0(ChannelHandlerContext ctx, TextWebSocketFrame frame) {
            String text = frame.text();
            if ("bye".equals(text)) {
                ctx.writeAndFlush(new CloseWebSocketFrame(4000, "bye"));
            } else if ("drop".equals(text)) {
                ctx.channel().close();
            } else if ("split".equals(text)) {
                ctx.write(new TextWebSocketFrame(false, 0, "{\"topic\":"));
                ctx.write(new ContinuationWebSocketFrame(false, 0, "\"t\",\"type\""));
                ctx.writeAndFlush(new ContinuationWebSocketFrame(true, 0, ":\"data\"}"));
            } else if ("flood".equals(text)) {
                String chunk = "x".repeat(30000);
                ctx.write(new TextWebSocketFrame(false, 0, chunk));
                for (int i = 0; i < 3; i++) {
                    ctx.write(new ContinuationWebSocketFrame(false, 0, chunk));
                }
                ctx.flush();
            } else {
                ctx.writeAndFlush(new TextWebSocketFrame(text));
            }
        }
    }

    private static class RecordingListener implements ConnectionListener {
        private final BlockingQueue<String> events = new LinkedBlockingQueue<>();
        private final List<Throwable> errors = new CopyOnWriteArrayList<>();

        @Override
        public void onOpen() {
            events.add("open");
        }

        @Override
        public void onMessage(byte[] data) {
            events.add("message:" + new String(data, StandardCharsets.UTF_8));
        }

        @Override
        public void onClose(int code) {
            events.add("close:" + code);
        }

        @Override
        public void onError(Throwable error) {
            errors.add(error);
            events.add("error");
        }

        List<String> drain() {
            List<String> drained = new CopyOnWriteArrayList<>();
            events.drainTo(drained);
            return drained;
        }
    }
}
