package com.brick.query.graph;

/**
 * Thrown when the graph engine cannot be reached at all.
 */
public class GraphConnectionException extends GraphExecutionException {

    public GraphConnectionException(String message) {
        super(message);
    }

    public GraphConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
