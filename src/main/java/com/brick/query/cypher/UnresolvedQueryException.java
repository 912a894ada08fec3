package com.brick.query.cypher;

/**
 * Thrown under {@link UnresolvedQueryPolicy#FAIL} when no resolver rule recognises
 * the root operation of a structured query.
 */
public class UnresolvedQueryException extends QueryResolutionException {

    private final String operation;

    public UnresolvedQueryException(String operation) {
        super("No resolver rule for root operation '" + operation + "'");
        this.operation = operation;
    }

    public String getOperation() {
        return operation;
    }
}
