package com.vidnyan.grader.domain.step;

import java.util.List;

/**
 * A named exercise: the variable names it declares and its ordered steps.
 */
public record Exercise(
    String name,
    List<String> variables,
    List<ValidationStep> steps
) {

    public Exercise {
        variables = variables != null ? List.copyOf(variables) : List.of();
        steps = List.copyOf(steps);
    }
}
