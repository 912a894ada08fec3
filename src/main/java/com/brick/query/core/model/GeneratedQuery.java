package com.brick.query.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * GraphQL-shaped intermediate query produced from an {@link ExtractedIntent}.
 * Only ever consumed by the Cypher resolver, never executed as GraphQL.
 *
 * @param queryText     the operation text
 * @param variables     variable values referenced by the operation
 * @param operationName e.g. {@code ListSensors}
 * @param description   short human-readable description of what the query asks for
 * @param fields        scalar fields selected on the root type
 */
public record GeneratedQuery(
        String queryText,
        Map<String, Object> variables,
        String operationName,
        String description,
        List<String> fields
) {
    public GeneratedQuery {
        Objects.requireNonNull(queryText, "queryText is required");
        Objects.requireNonNull(operationName, "operationName is required");
        variables = variables != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(variables)) : Map.of();
        description = description != null ? description : "";
        fields = fields != null ? List.copyOf(fields) : List.of();
    }
}
