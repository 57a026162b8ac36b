package com.relay.common.exception;

import org.slf4j.Logger;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Structured exception logging shared by all transport components.
 */
public final class ExceptionLogger {

    private ExceptionLogger() {
    }

    public static void logError(Logger log, TransportException ex) {
        log.error(ex.getStructuredMessage(), ex.getCause() != null ? ex.getCause() : ex);
    }

    public static void logWarn(Logger log, TransportException ex) {
        log.warn(ex.getStructuredMessage(), ex.getCause() != null ? ex.getCause() : ex);
    }

    /**
     * Retriable errors are logged at WARN, everything else at ERROR.
     */
    public static void logConditional(Logger log, TransportException ex) {
        if (ex.isRetriable()) {
            logWarn(log, ex);
        } else {
            logError(log, ex);
        }
    }

    /**
     * Logs any throwable, unwrapping future wrappers first.
     * Non-transport errors are logged at ERROR with the supplied message.
     */
    public static void log(Logger log, String message, Throwable error) {
        Throwable cause = unwrap(error);
        if (cause instanceof TransportException) {
            logConditional(log, (TransportException) cause);
        } else {
            log.error(message, cause);
        }
    }

    /**
     * Strips {@link CompletionException} and {@link ExecutionException} layers.
     */
    public static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    public static String getMonitoringSummary(TransportException ex) {
        return String.format("error_code=%s category=%s retriable=%s timestamp=%s",
                ex.getErrorCode().name(),
                ex.getCategory(),
                ex.isRetriable(),
                ex.getTimestamp());
    }
}
