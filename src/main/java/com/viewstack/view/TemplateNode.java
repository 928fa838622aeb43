package com.viewstack.view;

/**
 * Anything the evaluation engine can render against a context: a whole template or one of its
 * named children.
 */
@FunctionalInterface
public interface TemplateNode {

    /**
     * Evaluates this node.
     *
     * @param context the context whose variables are visible during evaluation
     * @return the rendered output
     */
    String evaluate(RenderingContext context);
}
