package com.brick.query.graph;

/**
 * Thrown when the graph engine rejects or fails to run a query.
 */
public class GraphExecutionException extends RuntimeException {

    public GraphExecutionException(String message) {
        super(message);
    }

    public GraphExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
