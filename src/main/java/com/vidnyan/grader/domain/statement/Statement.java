package com.vidnyan.grader.domain.statement;

/**
 * A normalized top-level or nested statement of a submission.
 * Closed set of variants; anything the grammar has no dedicated variant for
 * becomes a {@link GenericStatement}.
 */
public sealed interface Statement permits
        ImportStatement,
        ImportFromStatement,
        ClassDefStatement,
        FunctionDefStatement,
        ForStatement,
        WithStatement,
        IfStatement,
        FunctionCallStatement,
        AssignStatement,
        ExprStatement,
        GenericStatement {
}
