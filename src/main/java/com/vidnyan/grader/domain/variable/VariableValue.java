package com.vidnyan.grader.domain.variable;

import java.util.Optional;

/**
 * Statically resolved value of a submission variable, or the {@link Unresolvable} sentinel.
 */
public sealed interface VariableValue permits VariableValue.Resolved, VariableValue.Unresolvable {

    static VariableValue of(Object value) {
        return new Resolved(value);
    }

    static VariableValue unresolvable() {
        return Unresolvable.INSTANCE;
    }

    default boolean isResolved() {
        return this instanceof Resolved;
    }

    /**
     * The resolved value; empty for {@link Unresolvable}. Python {@code None}
     * resolves to {@link PyNone#NONE}, never to an empty optional.
     */
    default Optional<Object> value() {
        return this instanceof Resolved r ? Optional.of(r.raw()) : Optional.empty();
    }

    record Resolved(Object raw) implements VariableValue {

        public Resolved {
            if (raw == null) {
                raw = PyNone.NONE;
            }
        }
    }

    enum Unresolvable implements VariableValue {
        INSTANCE;

        @Override
        public String toString() {
            return "Unresolvable dynamic value";
        }
    }
}
