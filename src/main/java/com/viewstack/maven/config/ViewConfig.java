package com.viewstack.maven.config;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.viewstack.view.TemplatePaths;

/**
 * Configuration of a view rendering run: where sources live, shared variables, and the views to
 * render.
 */
public class ViewConfig {
    private String format;
    private List<String> templateRootPaths;
    private List<String> layoutRootPaths;
    private List<String> partialRootPaths;
    private Map<String, Object> variables;
    private List<ViewDefinition> views;

    public ViewConfig() {
        this.format = TemplatePaths.DEFAULT_FORMAT;
        this.templateRootPaths = new ArrayList<>();
        this.layoutRootPaths = new ArrayList<>();
        this.partialRootPaths = new ArrayList<>();
        this.variables = new HashMap<>();
        this.views = new ArrayList<>();
    }

    public String getFormat() {
        return format;
    }

    public void setFormat(String format) {
        this.format = format;
    }

    public List<String> getTemplateRootPaths() {
        return templateRootPaths;
    }

    public void setTemplateRootPaths(List<String> templateRootPaths) {
        this.templateRootPaths = templateRootPaths;
    }

    public List<String> getLayoutRootPaths() {
        return layoutRootPaths;
    }

    public void setLayoutRootPaths(List<String> layoutRootPaths) {
        this.layoutRootPaths = layoutRootPaths;
    }

    public List<String> getPartialRootPaths() {
        return partialRootPaths;
    }

    public void setPartialRootPaths(List<String> partialRootPaths) {
        this.partialRootPaths = partialRootPaths;
    }

    public Map<String, Object> getVariables() {
        return variables;
    }

    public void setVariables(Map<String, Object> variables) {
        this.variables = variables;
    }

    public List<ViewDefinition> getViews() {
        return views;
    }

    public void setViews(List<ViewDefinition> views) {
        this.views = views;
    }

    @SuppressWarnings("unchecked")
    public static ViewConfig fromMap(Map<String, Object> map) {
        ViewConfig config = new ViewConfig();
        if (map == null) {
            return config;
        }
        if (map.get("format") instanceof String) {
            config.setFormat((String) map.get("format"));
        }

        if (map.get("paths") instanceof Map) {
            Map<String, Object> paths = (Map<String, Object>) map.get("paths");
            config.setTemplateRootPaths(stringList(paths.get("templates")));
            config.setLayoutRootPaths(stringList(paths.get("layouts")));
            config.setPartialRootPaths(stringList(paths.get("partials")));
        }

        if (map.get("variables") instanceof Map) {
            config.setVariables(variableMap((Map<?, ?>) map.get("variables")));
        }

        if (map.get("views") instanceof List) {
            List<Object> viewList = (List<Object>) map.get("views");
            for (Object viewObj : viewList) {
                if (viewObj instanceof Map) {
                    config.getViews().add(ViewDefinition.fromMap((Map<String, Object>) viewObj));
                }
            }
        }

        return config;
    }

    /**
     * Copies a YAML mapping into variables. YAML allows keys of any scalar type, variables are
     * named by strings.
     */
    static Map<String, Object> variableMap(Map<?, ?> yamlMap) {
        Map<String, Object> variables = new LinkedHashMap<>();
        yamlMap.forEach((key, value) -> variables.put(String.valueOf(key), value));
        return variables;
    }

    private static List<String> stringList(Object value) {
        List<String> result = new ArrayList<>();
        if (value instanceof List) {
            for (Object item : (List<?>) value) {
                result.add(String.valueOf(item));
            }
        } else if (value != null) {
            result.add(String.valueOf(value));
        }
        return result;
    }
}
