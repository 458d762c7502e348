package com.vidnyan.grader.domain.statement;

import java.util.List;
import java.util.Optional;

public record WithStatement(
    List<WithItem> items,
    List<Statement> body
) implements Statement {

    public WithStatement {
        items = List.copyOf(items);
        body = List.copyOf(body);
    }

    /**
     * One {@code context as name} item; {@code boundName} is null without {@code as}.
     */
    public record WithItem(String contextExpression, String boundName) {

        public Optional<String> bound() {
            return Optional.ofNullable(boundName);
        }
    }
}
