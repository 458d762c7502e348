package com.vidnyan.grader.domain.statement;

/**
 * Right-hand side of an assignment: rendered text, or a call kept structurally.
 */
public sealed interface AssignedValue permits RenderedValue, FunctionCallStatement {
}
