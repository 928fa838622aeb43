package com.viewstack.view;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Map-backed {@link VariableProvider}. Keeps insertion order.
 */
public class StandardVariableProvider implements VariableProvider {

    private final Map<String, Object> variables;

    public StandardVariableProvider() {
        this.variables = new LinkedHashMap<>();
    }

    public StandardVariableProvider(Map<String, ?> variables) {
        this.variables = new LinkedHashMap<>(variables);
    }

    @Override
    public void add(String identifier, Object value) {
        variables.put(identifier, value);
    }

    @Override
    public Object get(String identifier) {
        return variables.get(identifier);
    }

    @Override
    public boolean exists(String identifier) {
        return variables.containsKey(identifier);
    }

    @Override
    public void remove(String identifier) {
        variables.remove(identifier);
    }

    @Override
    public Map<String, Object> getAll() {
        return Collections.unmodifiableMap(variables);
    }

    @Override
    public List<String> getAllIdentifiers() {
        return new ArrayList<>(variables.keySet());
    }

    @Override
    public VariableProvider copy() {
        return new StandardVariableProvider(variables);
    }

    @Override
    public VariableProvider getScopeCopy(Map<String, ?> overlay) {
        StandardVariableProvider scopeCopy = new StandardVariableProvider(variables);
        if (overlay != null) {
            scopeCopy.variables.putAll(overlay);
        }
        return scopeCopy;
    }
}
