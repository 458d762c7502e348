package com.vidnyan.grader.domain.statement;

import java.util.List;

/**
 * {@code import a, b as c}. The alias is the alias of the first name only.
 */
public record ImportStatement(
    List<String> names,
    String alias
) implements Statement {

    public ImportStatement {
        names = List.copyOf(names);
    }
}
