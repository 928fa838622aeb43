package com.viewstack.view.mustache;

import java.io.StringWriter;
import java.util.HashMap;
import java.util.Map;
import java.util.function.Function;

import com.github.mustachejava.Mustache;
import com.viewstack.view.RenderEngine;
import com.viewstack.view.RenderingContext;

/**
 * Builds the Mustache scope for a rendering context: its variables plus the {@code section}
 * and {@code partial} lambdas that call back into the {@link RenderEngine}.
 * <pre>
 * {{#section}}main{{/section}}          section "main"
 * {{#section}}sidebar?{{/section}}      section "sidebar", empty if missing
 * {{#partial}}Card{{/partial}}          partial "Card"
 * {{#partial}}Card#header{{/partial}}   section "header" of partial "Card"
 * </pre>
 */
final class ViewHelpers {

    static final String SECTION_HELPER = "section";
    static final String PARTIAL_HELPER = "partial";

    private static final String IGNORE_UNKNOWN_SUFFIX = "?";
    private static final String SECTION_SEPARATOR = "#";

    private ViewHelpers() {
    }

    static String execute(Mustache mustache, RenderingContext context) {
        StringWriter writer = new StringWriter();
        mustache.execute(writer, scopeFor(context));
        return writer.toString();
    }

    static Map<String, Object> scopeFor(RenderingContext context) {
        Map<String, Object> scope = new HashMap<>(context.getVariableProvider().getAll());
        RenderEngine view = context.getView();
        if (view != null) {
            scope.put(SECTION_HELPER, (Function<String, String>) text -> {
                String name = text.trim();
                boolean ignoreUnknown = name.endsWith(IGNORE_UNKNOWN_SUFFIX);
                if (ignoreUnknown) {
                    name = name.substring(0, name.length() - 1);
                }
                return view.renderSection(name, Map.of(), ignoreUnknown);
            });
            scope.put(PARTIAL_HELPER, (Function<String, String>) text -> {
                String name = text.trim();
                boolean ignoreUnknown = name.endsWith(IGNORE_UNKNOWN_SUFFIX);
                if (ignoreUnknown) {
                    name = name.substring(0, name.length() - 1);
                }
                String sectionName = null;
                int separator = name.indexOf(SECTION_SEPARATOR);
                if (separator >= 0) {
                    sectionName = name.substring(separator + 1);
                    name = name.substring(0, separator);
                }
                return view.renderPartial(name, sectionName, Map.of(), ignoreUnknown);
            });
        }
        return scope;
    }
}
