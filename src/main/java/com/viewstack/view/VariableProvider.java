package com.viewstack.view;

import java.util.List;
import java.util.Map;

/**
 * Variable environment visible to template evaluation.
 */
public interface VariableProvider {

    void add(String identifier, Object value);

    Object get(String identifier);

    boolean exists(String identifier);

    void remove(String identifier);

    /**
     * @return an unmodifiable snapshot of all variables
     */
    Map<String, Object> getAll();

    List<String> getAllIdentifiers();

    /**
     * Returns an independent copy; adding or removing variables on the copy never affects this
     * provider.
     */
    VariableProvider copy();

    /**
     * Returns a new provider seeded from this one's variables, with {@code overlay} applied on
     * top. This provider is left untouched.
     */
    VariableProvider getScopeCopy(Map<String, ?> overlay);
}
