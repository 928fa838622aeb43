package com.viewstack.maven.config;

import java.util.HashMap;
import java.util.Map;

/**
 * Definition of a single view to render.
 */
public class ViewDefinition {
    private String controller;
    private String action;
    private String output;
    private Map<String, Object> variables;

    public ViewDefinition() {
        this.variables = new HashMap<>();
    }

    public String getController() {
        return controller;
    }

    public void setController(String controller) {
        this.controller = controller;
    }

    public String getAction() {
        return action;
    }

    public void setAction(String action) {
        this.action = action;
    }

    public String getOutput() {
        return output;
    }

    public void setOutput(String output) {
        this.output = output;
    }

    public Map<String, Object> getVariables() {
        return variables;
    }

    public void setVariables(Map<String, Object> variables) {
        this.variables = variables;
    }

    /**
     * Output path relative to the output directory; defaults to
     * {@code <Controller>/<Action>.<format>}.
     */
    public String resolveOutput(String format) {
        if (output != null && !output.isBlank()) {
            return output;
        }
        return controller + "/" + action + "." + format;
    }

    public static ViewDefinition fromMap(Map<String, Object> map) {
        ViewDefinition def = new ViewDefinition();
        def.setController(map.get("controller") != null ? String.valueOf(map.get("controller")) : "Default");
        def.setAction(map.get("action") != null ? String.valueOf(map.get("action")) : "Default");
        def.setOutput(map.get("output") != null ? String.valueOf(map.get("output")) : null);

        if (map.get("variables") instanceof Map) {
            def.setVariables(ViewConfig.variableMap((Map<?, ?>) map.get("variables")));
        }

        return def;
    }
}
