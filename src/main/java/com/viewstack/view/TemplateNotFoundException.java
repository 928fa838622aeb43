package com.viewstack.view;

/**
 * Thrown when no source can be located for a template, layout or partial name.
 */
public class TemplateNotFoundException extends ViewException {

    public TemplateNotFoundException(String message) {
        super(message);
    }
}
