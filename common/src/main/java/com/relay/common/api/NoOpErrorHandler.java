package com.relay.common.api;

import com.relay.common.exception.ExceptionLogger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default error sink that only logs
 */
public class NoOpErrorHandler implements ErrorHandler {
    private static final Logger log = LoggerFactory.getLogger(NoOpErrorHandler.class);

    @Override
    public void onError(String source, Throwable error) {
        ExceptionLogger.log(log, "Transport error from " + source, error);
    }
}
