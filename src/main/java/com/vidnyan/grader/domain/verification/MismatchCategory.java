package com.vidnyan.grader.domain.verification;

/**
 * Why a step failed.
 */
public enum MismatchCategory {
    NOT_CALLED,
    TOO_MANY_CALLS,
    NOT_ASSIGNED,
    WRONG_ARITY,
    MUST_NOT_ASSIGN,
    WRONG_PARAMETERS,
    /** A structural predicate (import, definition, variable value) did not hold. */
    NOT_FOUND,
    /** The check itself threw. */
    ERROR
}
