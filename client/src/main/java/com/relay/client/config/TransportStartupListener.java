package com.relay.client.config;

import com.relay.client.SessionController;
import com.relay.common.exception.ExceptionLogger;
import io.micronaut.context.annotation.Requires;
import io.micronaut.context.event.ApplicationEventListener;
import io.micronaut.context.event.StartupEvent;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Opens the session and subscribes the configured topics once the context has started.
 * Connection failures are left to the session's reconnect handling.
 */
@Singleton
@Requires(property = "relay.transport.url")
public class TransportStartupListener implements ApplicationEventListener<StartupEvent> {
    private static final Logger log = LoggerFactory.getLogger(TransportStartupListener.class);

    private final SessionController session;
    private final TransportConfiguration config;

    public TransportStartupListener(SessionController session, TransportConfiguration config) {
        this.session = session;
        this.config = config;
    }

    @Override
    public void onApplicationEvent(StartupEvent event) {
        String url = config.getUrl();
        List<String> topics = config.getTopics() != null ? config.getTopics() : List.of();
        log.info("Application started, opening transport to {} with topics {}", url, topics);

        session.open(url, true).whenComplete((v, ex) -> {
            if (ex != null) {
                ExceptionLogger.log(log, "Initial open of " + url + " failed", ex);
            }
        });
        for (String topic : topics) {
            session.subscribe(topic).whenComplete((v, ex) -> {
                if (ex != null) {
                    ExceptionLogger.log(log, "Subscribe to " + topic + " failed", ex);
                }
            });
        }
    }
}
