package com.vidnyan.grader.domain.verification;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Variable names known to a run: declared by the exercise up front (unassigned)
 * and recorded as assigned by passing call steps.
 */
public final class UserVariableTable {

    private final Map<String, String> names = new LinkedHashMap<>();

    public UserVariableTable(Collection<String> declared) {
        declared.forEach(name -> names.put(name, null));
    }

    public void record(String name) {
        names.put(name, name);
    }

    public boolean isAssigned(String name) {
        return names.get(name) != null;
    }

    public boolean isDeclared(String name) {
        return names.containsKey(name);
    }

    public Optional<String> lookup(String name) {
        return Optional.ofNullable(names.get(name));
    }

    public Map<String, String> asMap() {
        return Collections.unmodifiableMap(names);
    }
}
