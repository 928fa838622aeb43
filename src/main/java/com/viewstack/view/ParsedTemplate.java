package com.viewstack.view;

/**
 * A parsed template tree as produced by a {@link TemplateParser}.
 * <p>
 * Instances are cached by the {@link TemplateResolver} and shared between render calls, so
 * implementations must not keep per-render state.
 */
public interface ParsedTemplate extends TemplateNode {

    /**
     * @return the identifier the template was parsed under
     */
    String getIdentifier();

    /**
     * Returns the child node declared under the given name, e.g. a section or the
     * {@code layoutName} declaration.
     *
     * @throws ChildNotFoundException if no such child exists
     */
    TemplateNode getNamedChild(String name);

    /**
     * Binds the template's declared arguments to the context that is about to render it.
     */
    void bindArguments(RenderingContext context);
}
