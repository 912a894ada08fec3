package com.brick.query.cypher;

/**
 * What the resolver does with a structured query whose root operation it does not know.
 */
public enum UnresolvedQueryPolicy {
    /** Answer with the generic node-count-by-label query and flag the result as a fallback. */
    DEFAULT_TEMPLATE,
    /** Raise {@link UnresolvedQueryException}. */
    FAIL
}
