package com.viewstack.view;

/**
 * Thrown when {@link RenderSession#stopRendering()} is called without a matching
 * {@link RenderSession#startRendering}. Indicates a bug in the caller and is never caught.
 */
public class StackUnderflowException extends IllegalStateException {

    public StackUnderflowException() {
        super("stopRendering() called on an empty rendering stack");
    }
}
