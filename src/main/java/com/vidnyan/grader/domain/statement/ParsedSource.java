package com.vidnyan.grader.domain.statement;

import java.nio.file.Path;
import java.util.List;

/**
 * The statement forest of one submission file.
 * Immutable once built; queried read-only by every validation step.
 */
public record ParsedSource(
    Path path,
    String sourceText,
    List<Statement> statements
) {

    public ParsedSource {
        statements = List.copyOf(statements);
    }

    public int size() {
        return statements.size();
    }
}
