package com.viewstack.view.mustache;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import com.github.mustachejava.Mustache;
import com.viewstack.view.ChildNotFoundException;
import com.viewstack.view.ParsedTemplate;
import com.viewstack.view.RenderingContext;
import com.viewstack.view.TemplateNode;
import com.viewstack.view.VariableProvider;

/**
 * Compiled Mustache body plus its named sections and argument defaults. Immutable.
 */
class MustacheParsedTemplate implements ParsedTemplate {

    private final String identifier;
    private final Mustache body;
    private final Map<String, TemplateNode> children;
    private final Map<String, Object> argumentDefaults;

    MustacheParsedTemplate(String identifier, Mustache body, Map<String, TemplateNode> children,
            Map<String, Object> argumentDefaults) {
        this.identifier = identifier;
        this.body = body;
        this.children = Collections.unmodifiableMap(new LinkedHashMap<>(children));
        this.argumentDefaults = Collections.unmodifiableMap(new LinkedHashMap<>(argumentDefaults));
    }

    @Override
    public String getIdentifier() {
        return identifier;
    }

    @Override
    public TemplateNode getNamedChild(String name) {
        TemplateNode child = children.get(name);
        if (child == null) {
            throw new ChildNotFoundException(identifier, name);
        }
        return child;
    }

    /**
     * Adds each argument default the context does not already define.
     */
    @Override
    public void bindArguments(RenderingContext context) {
        VariableProvider variables = context.getVariableProvider();
        argumentDefaults.forEach((key, value) -> {
            if (!variables.exists(key)) {
                variables.add(key, value);
            }
        });
    }

    @Override
    public String evaluate(RenderingContext context) {
        return ViewHelpers.execute(body, context);
    }
}
