package com.viewstack.view;

import org.apache.maven.plugin.logging.Log;

/**
 * Error handler that logs the error and renders a short inline message instead of failing
 * the whole view.
 */
public class TolerantErrorHandler implements ViewErrorHandler {

    static final String PREFIX = "View error: ";

    private final Log log;

    public TolerantErrorHandler(Log log) {
        this.log = log;
    }

    @Override
    public String handleViewError(Exception error) {
        String message = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        log.warn(PREFIX + message);
        return PREFIX + message;
    }
}
