package com.brick.query.cypher;

/**
 * Thrown when a structured query cannot be turned into a safe Cypher query,
 * for example because a sub-type filter is not a valid label.
 */
public class QueryResolutionException extends RuntimeException {

    public QueryResolutionException(String message) {
        super(message);
    }

    public QueryResolutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
