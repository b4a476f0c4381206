package com.jcomp;

/**
 * Translation-time failures. Each one is terminal: no loop runs once one is raised.
 */
public enum ErrorKind {
    /** No {@code for} clause anywhere in the comprehension. */
    MISSING_LOOP_CLAUSE,
    /** Clauses are present but nothing precedes them. */
    EMPTY_BODY,
    /** A {@code for} segment lacks the {@code pattern in expr} shape. */
    MALFORMED_FOR_CLAUSE,
    /** An {@code if} segment has no usable condition. */
    MALFORMED_IF_CLAUSE,
    /** A segment that is neither a {@code for} nor an {@code if}. */
    UNKNOWN_CLAUSE
}
