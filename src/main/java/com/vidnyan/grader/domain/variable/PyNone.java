package com.vidnyan.grader.domain.variable;

/**
 * Python's {@code None}, kept distinct from Java {@code null} and from {@link VariableValue.Unresolvable}.
 */
public enum PyNone {
    NONE;

    @Override
    public String toString() {
        return "None";
    }
}
