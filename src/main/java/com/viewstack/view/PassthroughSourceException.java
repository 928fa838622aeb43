package com.viewstack.view;

/**
 * Signals that a source is not templated content and must be returned verbatim.
 * <p>
 * Not an error: the nearest render entry point catches it and returns {@link #getSource()}
 * as its output, after popping any frames it pushed.
 */
public class PassthroughSourceException extends RuntimeException {

    private final String source;

    public PassthroughSourceException(String identifier, String source) {
        super("Passthrough source: " + identifier, null, false, false);
        this.source = source;
    }

    public String getSource() {
        return source;
    }
}
