package com.brick.query.rest.dto;

/**
 * Request DTO for answering or explaining a question.
 *
 * @param question the question, required
 * @param language answer language code ({@code no}/{@code en}), optional
 * @param debug    include the per-stage debug trail in the response
 */
public record QueryRequest(String question, String language, Boolean debug) {

    public QueryRequest {
        if (question == null || question.isBlank()) {
            throw new IllegalArgumentException("question is required");
        }
    }

    public boolean debugEnabled() {
        return Boolean.TRUE.equals(debug);
    }
}
