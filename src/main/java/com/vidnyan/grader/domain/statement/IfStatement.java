package com.vidnyan.grader.domain.statement;

import java.util.List;

/**
 * {@code if} statement. An {@code elif} chain is a nested {@link IfStatement}
 * as the only element of {@code orelse}.
 */
public record IfStatement(
    String test,
    List<Statement> body,
    List<Statement> orelse
) implements Statement {

    public IfStatement {
        body = List.copyOf(body);
        orelse = orelse != null ? List.copyOf(orelse) : List.of();
    }
}
