package com.brick.query.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Executable Cypher query. Values travel only in {@link #parameters()}; the text itself
 * holds nothing but fixed template fragments and validated labels.
 *
 * @param cypher      the query text
 * @param parameters  flat scalar parameters bound by the engine
 * @param description what the query returns
 * @param operation   root operation of the structured query this was resolved from
 * @param fallback    true when the root operation was not recognised and the generic
 *                    label-count template was used instead
 */
public record ResolvedQuery(
        String cypher,
        Map<String, Object> parameters,
        String description,
        String operation,
        boolean fallback
) {
    public ResolvedQuery {
        Objects.requireNonNull(cypher, "cypher is required");
        parameters = parameters != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(parameters)) : Map.of();
        description = description != null ? description : "";
        operation = operation != null ? operation : "";
    }
}
