package com.relay.common.api;

import com.relay.common.model.Envelope;

/**
 * Lifecycle and message events raised by a {@link Transport}.
 * Handlers may fire any number of times across reconnects.
 */
public interface TransportListener {

    default void onMessage(Envelope envelope) {
    }

    default void onOpened() {
    }

    default void onClosed() {
    }
}
