package com.relay.common.api;

/**
 * Observer for raw connection events. A handle may carry several listeners;
 * each callback is invoked on the handle's I/O thread and must not block.
 */
public interface ConnectionListener {

    default void onOpen() {
    }

    default void onMessage(byte[] data) {
    }

    /**
     * @param code WebSocket close status, 1006 when no close frame was received
     */
    default void onClose(int code) {
    }

    default void onError(Throwable error) {
    }
}
