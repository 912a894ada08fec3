package com.brick.query.rest.dto;

import com.brick.query.api.QueryExplanation;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Map;

/**
 * Response DTO for an explained question.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ExplainResponse(
        String question,
        String intent,
        String entityType,
        double confidence,
        String source,
        boolean lowConfidence,
        Map<String, Object> parameters,
        String graphqlOperation,
        String graphql,
        Map<String, Object> variables,
        String cypher,
        Map<String, Object> cypherParameters,
        String description,
        Boolean fallback,
        String error
) {
    public static ExplainResponse from(QueryExplanation explanation) {
        boolean resolved = explanation.resolvedQuery() != null;
        return new ExplainResponse(
                explanation.question(),
                explanation.intent().kind().getCode(),
                explanation.intent().entity().map(t -> t.getTypeName()).orElse(null),
                explanation.intent().confidence(),
                explanation.intent().source().name(),
                explanation.lowConfidence(),
                explanation.intent().parameters(),
                explanation.generatedQuery().operationName(),
                explanation.generatedQuery().queryText(),
                explanation.generatedQuery().variables(),
                resolved ? explanation.resolvedQuery().cypher() : null,
                resolved ? explanation.resolvedQuery().parameters() : null,
                resolved ? explanation.resolvedQuery().description() : null,
                resolved ? explanation.resolvedQuery().fallback() : null,
                explanation.error()
        );
    }
}
