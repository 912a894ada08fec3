package com.brick.query.api;

import com.brick.query.core.model.ExtractedIntent;
import com.brick.query.core.model.GeneratedQuery;
import com.brick.query.core.model.PipelineState;
import com.brick.query.core.model.QueryLocale;
import com.brick.query.core.model.ResolvedQuery;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of processing one question.
 *
 * @param success        true only when results were fetched and formatted
 * @param correlationId  id put into the logging context for this request
 * @param question       the question as asked
 * @param locale         language of {@code response}
 * @param state          terminal state reached
 * @param intent         extracted intent
 * @param generatedQuery structured query, {@code null} when stopped before generation
 * @param resolvedQuery  Cypher query, {@code null} when stopped before resolution
 * @param rows           raw result rows, {@code null} unless execution succeeded
 * @param response       the answer text, always present
 * @param error          raw error message of a failed stage, {@code null} otherwise
 * @param debug          per-stage diagnostics
 */
public record PipelineResult(
        boolean success,
        String correlationId,
        String question,
        QueryLocale locale,
        PipelineState state,
        ExtractedIntent intent,
        GeneratedQuery generatedQuery,
        ResolvedQuery resolvedQuery,
        List<Map<String, Object>> rows,
        String response,
        String error,
        DebugTrail debug
) {
    public PipelineResult {
        Objects.requireNonNull(state, "state is required");
        Objects.requireNonNull(response, "response is required");
        if (!state.isTerminal()) {
            throw new IllegalArgumentException("state must be terminal, got " + state);
        }
        if (success != state.isSuccess()) {
            throw new IllegalArgumentException("success must match state " + state);
        }
        rows = rows != null ? List.copyOf(rows) : null;
    }

    public Optional<String> errorMessage() {
        return Optional.ofNullable(error);
    }

    public int resultCount() {
        return rows != null ? rows.size() : 0;
    }
}
