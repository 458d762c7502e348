package com.vidnyan.grader.domain.statement;

/**
 * Bare expression other than a call, such as a docstring.
 */
public record ExprStatement(String value) implements Statement {
}
