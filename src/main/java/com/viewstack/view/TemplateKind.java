package com.viewstack.view;

/**
 * What is being rendered at one level of the rendering stack.
 */
public enum TemplateKind {
    TEMPLATE,
    PARTIAL,
    LAYOUT
}
