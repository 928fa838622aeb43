package com.viewstack.view;

/**
 * Last-resort renderer for recoverable view errors.
 */
public interface ViewErrorHandler {

    /**
     * Produces output standing in for a view that failed to render. Must not throw.
     *
     * @param error the error that stopped rendering
     * @return replacement output, possibly empty
     */
    String handleViewError(Exception error);
}
