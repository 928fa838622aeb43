package com.viewstack.view;

import java.util.Objects;

/**
 * Cache key of the {@link TemplateResolver}: the logical name, the action when resolving a
 * controller template, and the kind. A template key may have no name, for an action template
 * outside any controller folder.
 */
public final class ResolutionKey {

    private final String name;
    private final String action;
    private final TemplateKind kind;

    public ResolutionKey(String name, String action, TemplateKind kind) {
        this.name = name;
        this.action = action;
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public static ResolutionKey template(String controller, String action) {
        return new ResolutionKey(controller, action, TemplateKind.TEMPLATE);
    }

    public static ResolutionKey layout(String name) {
        return new ResolutionKey(name, null, TemplateKind.LAYOUT);
    }

    public static ResolutionKey partial(String name) {
        return new ResolutionKey(name, null, TemplateKind.PARTIAL);
    }

    public String getName() {
        return name;
    }

    public String getAction() {
        return action;
    }

    public TemplateKind getKind() {
        return kind;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ResolutionKey)) {
            return false;
        }
        ResolutionKey other = (ResolutionKey) o;
        return Objects.equals(name, other.name) && Objects.equals(action, other.action) && kind == other.kind;
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, action, kind);
    }

    @Override
    public String toString() {
        return kind + ":" + name + (action != null ? "/" + action : "");
    }
}
