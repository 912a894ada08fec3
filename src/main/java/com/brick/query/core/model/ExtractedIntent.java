package com.brick.query.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Structured interpretation of a natural-language question.
 *
 * @param kind            what kind of question this is
 * @param entityType      primary entity the question is about, {@code null} when none was recognised
 * @param parameters      extracted filter values (id, name, building_name, ...), scalar values only
 * @param requestedFields structured-query field names to select; empty means the entity defaults
 * @param confidence      extraction confidence in [0, 1]
 * @param question        the original question text
 * @param traversalHint   name of a matching traversal pattern, {@code null} when none matched
 * @param source          which extraction path produced this intent
 */
public record ExtractedIntent(
        IntentKind kind,
        EntityType entityType,
        Map<String, Object> parameters,
        List<String> requestedFields,
        double confidence,
        String question,
        String traversalHint,
        Source source
) {

    public enum Source { LLM, RULE_BASED }

    public ExtractedIntent {
        Objects.requireNonNull(kind, "kind is required");
        Objects.requireNonNull(source, "source is required");
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be between 0.0 and 1.0, got " + confidence);
        }
        parameters = parameters != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(parameters)) : Map.of();
        requestedFields = requestedFields != null ? List.copyOf(requestedFields) : List.of();
        question = question != null ? question : "";
    }

    public Optional<EntityType> entity() {
        return Optional.ofNullable(entityType);
    }

    public Optional<String> traversal() {
        return Optional.ofNullable(traversalHint);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private IntentKind kind = IntentKind.UNKNOWN;
        private EntityType entityType;
        private Map<String, Object> parameters = Map.of();
        private List<String> requestedFields = List.of();
        private double confidence;
        private String question;
        private String traversalHint;
        private Source source = Source.RULE_BASED;

        public Builder kind(IntentKind kind) {
            this.kind = kind;
            return this;
        }

        public Builder entityType(EntityType entityType) {
            this.entityType = entityType;
            return this;
        }

        public Builder parameters(Map<String, Object> parameters) {
            this.parameters = parameters;
            return this;
        }

        public Builder requestedFields(List<String> requestedFields) {
            this.requestedFields = requestedFields;
            return this;
        }

        public Builder confidence(double confidence) {
            this.confidence = confidence;
            return this;
        }

        public Builder question(String question) {
            this.question = question;
            return this;
        }

        public Builder traversalHint(String traversalHint) {
            this.traversalHint = traversalHint;
            return this;
        }

        public Builder source(Source source) {
            this.source = source;
            return this;
        }

        public ExtractedIntent build() {
            return new ExtractedIntent(kind, entityType, parameters, requestedFields,
                    confidence, question, traversalHint, source);
        }
    }
}
