package com.vidnyan.grader.domain.variable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Variable name to resolved value, in order of first assignment.
 * Grows during its single construction pass; read-only afterwards.
 */
public final class VariableTable {

    private final Map<String, VariableValue> values = new LinkedHashMap<>();

    /**
     * Bind a name, overwriting an earlier binding of the same name.
     */
    public void bind(String name, VariableValue value) {
        values.put(name, value);
    }

    public Optional<VariableValue> get(String name) {
        return Optional.ofNullable(values.get(name));
    }

    public boolean contains(String name) {
        return values.containsKey(name);
    }

    /**
     * The value bound to {@code name}; unknown names are unresolvable.
     */
    public VariableValue valueOf(String name) {
        return values.getOrDefault(name, VariableValue.unresolvable());
    }

    public Map<String, VariableValue> asMap() {
        return Collections.unmodifiableMap(values);
    }

    public int size() {
        return values.size();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof VariableTable other && values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
