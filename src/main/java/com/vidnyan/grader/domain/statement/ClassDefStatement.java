package com.vidnyan.grader.domain.statement;

import java.util.List;

public record ClassDefStatement(
    String name,
    List<String> bases,
    List<Statement> body
) implements Statement {

    public ClassDefStatement {
        bases = List.copyOf(bases);
        body = List.copyOf(body);
    }
}
