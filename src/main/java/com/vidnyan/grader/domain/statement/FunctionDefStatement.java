package com.vidnyan.grader.domain.statement;

import java.util.List;

/**
 * Function definition. Only the regular positional parameter names are kept;
 * positional-only, keyword-only and variadic parameters are not captured.
 */
public record FunctionDefStatement(
    String name,
    List<String> args,
    List<Statement> body
) implements Statement {

    public FunctionDefStatement {
        args = List.copyOf(args);
        body = List.copyOf(body);
    }
}
