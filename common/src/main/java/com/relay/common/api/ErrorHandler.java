package com.relay.common.api;

/**
 * Sink for non-fatal transport errors (connect failures, socket errors)
 */
public interface ErrorHandler {

    /**
     * @param source Short description of where the error surfaced
     * @param error The error
     */
    void onError(String source, Throwable error);
}
