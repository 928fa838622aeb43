package com.viewstack.view;

/**
 * Base class for recoverable view errors. Render entry points resolve these at their own
 * boundary, either by returning empty output or by delegating to the {@link ViewErrorHandler}.
 */
public class ViewException extends RuntimeException {

    public ViewException(String message) {
        super(message);
    }

    public ViewException(String message, Throwable cause) {
        super(message, cause);
    }
}
