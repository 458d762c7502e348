package com.vidnyan.grader.domain.statement;

import java.util.List;
import java.util.Optional;

/**
 * Assignment with flattened targets: {@code a, b = f()} has targets {@code [a, b]}
 * and a nested {@link FunctionCallStatement} as value.
 */
public record AssignStatement(
    List<String> targets,
    AssignedValue value
) implements Statement {

    public AssignStatement {
        if (targets == null || targets.isEmpty()) {
            throw new IllegalArgumentException("assignment needs at least one target");
        }
        targets = List.copyOf(targets);
    }

    public Optional<FunctionCallStatement> call() {
        return value instanceof FunctionCallStatement call ? Optional.of(call) : Optional.empty();
    }
}
