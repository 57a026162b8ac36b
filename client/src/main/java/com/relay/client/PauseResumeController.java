package com.relay.client;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Suspends the session while the host application is in the background.
 *
 * <p>Pausing closes the active connection without scheduling a reconnect; envelopes
 * sent while paused stay queued. Resuming reopens the last URL, keeping the
 * subscription registry, and re-subscribes every known topic.</p>
 */
public class PauseResumeController {
    private static final Logger log = LoggerFactory.getLogger(PauseResumeController.class);

    private final SessionController session;

    public PauseResumeController(SessionController session) {
        this.session = session;
    }

    /**
     * Host lifecycle hook
     * @param paused true when the host moved to the background
     */
    public CompletableFuture<Void> onHostLifecycleChanged(boolean paused) {
        return paused ? pause() : resume();
    }

    public CompletableFuture<Void> pause() {
        log.info("Pausing session");
        session.setPaused(true);
        return session.close();
    }

    public CompletableFuture<Void> resume() {
        if (!session.isPaused()) {
            log.debug("Resume ignored, session was not paused");
            return CompletableFuture.completedFuture(null);
        }
        session.setPaused(false);

        String url = session.getUrl();
        if (url == null) {
            log.info("Resumed without a known URL, nothing to reopen");
            return CompletableFuture.completedFuture(null);
        }

        List<String> topics = session.getSubscribedTopics();
        log.info("Resuming session to {} with {} topics", url, topics.size());
        return session.open(url, false).thenCompose(v -> {
            CompletableFuture<?>[] resubscribed = topics.stream()
                    .map(session::subscribe)
                    .toArray(CompletableFuture[]::new);
            return CompletableFuture.allOf(resubscribed);
        });
    }
}
