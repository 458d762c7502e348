package com.vidnyan.grader.domain.statement;

import java.util.List;

public record ForStatement(
    String target,
    String iterable,
    List<Statement> body,
    List<Statement> orelse
) implements Statement {

    public ForStatement {
        body = List.copyOf(body);
        orelse = orelse != null ? List.copyOf(orelse) : List.of();
    }
}
