package com.viewstack.view.mustache;

import com.github.mustachejava.Mustache;
import com.viewstack.view.RenderingContext;
import com.viewstack.view.TemplateNode;

/**
 * A named block of a Mustache template.
 */
class MustacheSection implements TemplateNode {

    private final Mustache mustache;

    MustacheSection(Mustache mustache) {
        this.mustache = mustache;
    }

    @Override
    public String evaluate(RenderingContext context) {
        return ViewHelpers.execute(mustache, context);
    }
}
