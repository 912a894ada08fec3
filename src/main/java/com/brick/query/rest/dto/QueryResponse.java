package com.brick.query.rest.dto;

import com.brick.query.api.PipelineResult;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;
import java.util.Map;

/**
 * Response DTO for an answered question.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record QueryResponse(
        boolean success,
        String question,
        String language,
        String state,
        String response,
        String intent,
        String entityType,
        Double confidence,
        String graphql,
        String cypher,
        int resultCount,
        List<Map<String, Object>> rows,
        Map<String, Map<String, Object>> debug
) {
    public static QueryResponse from(PipelineResult result, boolean includeDebug) {
        return new QueryResponse(
                result.success(),
                result.question(),
                result.locale().getCode(),
                result.state().name(),
                result.response(),
                result.intent() != null ? result.intent().kind().getCode() : null,
                result.intent() != null ? result.intent().entity().map(t -> t.getTypeName()).orElse(null) : null,
                result.intent() != null ? result.intent().confidence() : null,
                result.generatedQuery() != null ? result.generatedQuery().queryText() : null,
                result.resolvedQuery() != null ? result.resolvedQuery().cypher() : null,
                result.resultCount(),
                includeDebug ? result.rows() : null,
                includeDebug ? result.debug().asMap() : null
        );
    }
}
