package com.vidnyan.grader.domain.statement;

/**
 * Any statement form without a dedicated variant, tagged with its syntax kind
 * ({@code While}, {@code Try}, {@code Return}, ...).
 */
public record GenericStatement(String kindName) implements Statement {
}
