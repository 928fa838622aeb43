package com.viewstack.view;

/**
 * Thrown when the sections of a template cannot be addressed, e.g. a section name is declared
 * twice or a section block is never closed.
 */
public class InvalidSectionException extends ViewException {

    public InvalidSectionException(String message) {
        super(message);
    }
}
