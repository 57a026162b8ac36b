package com.relay.client.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.relay.client.PauseResumeController;
import com.relay.client.SessionController;
import com.relay.client.dispatch.TopicEventDispatcher;
import com.relay.common.api.ErrorHandler;
import com.relay.common.api.NoOpErrorHandler;
import com.relay.network.codec.JsonEnvelopeCodec;
import com.relay.network.websocket.NettyWebSocketConnectionFactory;
import io.micronaut.context.annotation.Bean;
import io.micronaut.context.annotation.Factory;
import io.micronaut.context.annotation.Secondary;
import jakarta.inject.Singleton;

/**
 * Wires the transport beans from {@link TransportConfiguration}.
 *
 * <p>The error sink is a secondary bean: define your own {@link ErrorHandler} to replace it.</p>
 */
@Factory
public class TransportBeanFactory {

    @Singleton
    @Bean(preDestroy = "shutdown")
    public NettyWebSocketConnectionFactory connectionFactory(TransportConfiguration config) {
        return new NettyWebSocketConnectionFactory(
                (int) config.getConnectTimeout().toMillis(),
                config.getMaxFrameSize());
    }

    @Singleton
    public JsonEnvelopeCodec envelopeCodec(TransportConfiguration config) {
        return new JsonEnvelopeCodec(new ObjectMapper(), config.getMaxFrameSize());
    }

    @Singleton
    @Secondary
    public ErrorHandler errorHandler() {
        return new NoOpErrorHandler();
    }

    @Singleton
    public TopicEventDispatcher eventDispatcher() {
        return new TopicEventDispatcher(new ObjectMapper());
    }

    @Singleton
    @Bean(preDestroy = "shutdown")
    public SessionController sessionController(NettyWebSocketConnectionFactory connectionFactory,
                                               JsonEnvelopeCodec codec,
                                               ErrorHandler errorHandler,
                                               TopicEventDispatcher eventDispatcher,
                                               TransportConfiguration config) {
        SessionController session = new SessionController(connectionFactory, codec, errorHandler,
                config.getReconnectDelay(), config.getCloseTimeout());
        session.attachEventDispatcher(eventDispatcher);
        return session;
    }

    @Singleton
    public PauseResumeController pauseResumeController(SessionController session) {
        return new PauseResumeController(session);
    }
}
