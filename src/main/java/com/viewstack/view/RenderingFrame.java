package com.viewstack.view;

/**
 * One entry of the rendering stack.
 */
public final class RenderingFrame {

    private final TemplateKind kind;
    private final ParsedTemplate template;
    private final RenderingContext context;

    public RenderingFrame(TemplateKind kind, ParsedTemplate template, RenderingContext context) {
        this.kind = kind;
        this.template = template;
        this.context = context;
    }

    public TemplateKind getKind() {
        return kind;
    }

    public ParsedTemplate getTemplate() {
        return template;
    }

    public RenderingContext getContext() {
        return context;
    }

    @Override
    public String toString() {
        return kind + "(" + template.getIdentifier() + ")";
    }
}
