package com.brick.query.core.model;

/**
 * The five stages of a question's journey, in execution order.
 * The trace name is the key used in the debug trail.
 */
public enum PipelineStage {
    INTENT_EXTRACTION("1_intent_extraction"),
    QUERY_GENERATION("2_graphql_generation"),
    QUERY_RESOLUTION("3_cypher_resolution"),
    EXECUTION("4_falkordb_execution"),
    FORMATTING("5_response_formatting");

    private final String traceName;

    PipelineStage(String traceName) {
        this.traceName = traceName;
    }

    public String getTraceName() {
        return traceName;
    }
}
