package com.viewstack.view;

/**
 * Thrown by {@link ParsedTemplate#getNamedChild(String)} when the template declares no child
 * with the requested name.
 */
public class ChildNotFoundException extends ViewException {

    public ChildNotFoundException(String templateIdentifier, String childName) {
        super("Child '" + childName + "' not found in template " + templateIdentifier);
    }
}
