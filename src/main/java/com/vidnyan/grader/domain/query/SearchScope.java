package com.vidnyan.grader.domain.query;

/**
 * How deep a query looks into the statement forest.
 */
public enum SearchScope {
    /** Only the statements of the given forest. */
    TOP_LEVEL,
    /** The forest plus every nested body and else-clause, in pre-order. */
    RECURSIVE
}
