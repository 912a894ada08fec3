package com.brick.query.api;

import com.brick.query.core.model.ExtractedIntent;
import com.brick.query.core.model.GeneratedQuery;
import com.brick.query.core.model.ResolvedQuery;

/**
 * The first three stages of a question, computed without touching the graph.
 *
 * @param question       the question as asked
 * @param intent         extracted intent
 * @param lowConfidence  true when {@code process} would stop after extraction
 * @param generatedQuery structured query
 * @param resolvedQuery  Cypher query, {@code null} when resolution failed
 * @param error          resolution error message, {@code null} on success
 */
public record QueryExplanation(
        String question,
        ExtractedIntent intent,
        boolean lowConfidence,
        GeneratedQuery generatedQuery,
        ResolvedQuery resolvedQuery,
        String error
) {
}
