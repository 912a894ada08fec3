package com.brick.query.core.model;

/**
 * Lifecycle of a single request.
 *
 * <pre>
 * RECEIVED -> INTENT_EXTRACTED -> LOW_CONFIDENCE
 *                              -> QUERY_GENERATED -> QUERY_RESOLVED    -> EXECUTION_FAILED
 *                                                                      -> RESULTS_FORMATTED
 *                                                 -> RESOLUTION_FAILED
 * </pre>
 *
 * A request ends in exactly one terminal state and only {@link #RESULTS_FORMATTED} counts as success.
 */
public enum PipelineState {
    RECEIVED,
    INTENT_EXTRACTED,
    LOW_CONFIDENCE,
    QUERY_GENERATED,
    QUERY_RESOLVED,
    RESOLUTION_FAILED,
    EXECUTION_FAILED,
    RESULTS_FORMATTED;

    public boolean canTransitionTo(PipelineState next) {
        return switch (this) {
            case RECEIVED -> next == INTENT_EXTRACTED;
            case INTENT_EXTRACTED -> next == LOW_CONFIDENCE || next == QUERY_GENERATED;
            case QUERY_GENERATED -> next == QUERY_RESOLVED || next == RESOLUTION_FAILED;
            case QUERY_RESOLVED -> next == EXECUTION_FAILED || next == RESULTS_FORMATTED;
            case LOW_CONFIDENCE, RESOLUTION_FAILED, EXECUTION_FAILED, RESULTS_FORMATTED -> false;
        };
    }

    public boolean isTerminal() {
        return this == LOW_CONFIDENCE || this == RESOLUTION_FAILED
                || this == EXECUTION_FAILED || this == RESULTS_FORMATTED;
    }

    public boolean isSuccess() {
        return this == RESULTS_FORMATTED;
    }
}
