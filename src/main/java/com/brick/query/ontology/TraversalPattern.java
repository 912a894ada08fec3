package com.brick.query.ontology;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * A named multi-hop path through the building graph, with the keywords that suggest it.
 *
 * @param name         identifier, e.g. {@code ahu_zones}
 * @param description  human-readable description
 * @param path         the hops, e.g. {@code AHU -> HVAC Zone}
 * @param returnFields fields the pattern yields
 * @param keywords     lower-case trigger phrases, checked in order
 */
public record TraversalPattern(
        String name,
        String description,
        String path,
        List<String> returnFields,
        List<String> keywords
) {
    public TraversalPattern {
        Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(description, "description is required");
        path = path != null ? path : "";
        returnFields = returnFields != null ? List.copyOf(returnFields) : List.of();
        keywords = keywords != null
                ? keywords.stream().map(k -> k.toLowerCase(Locale.ROOT)).toList() : List.of();
    }

    public boolean matches(String lowerText) {
        for (String keyword : keywords) {
            if (lowerText.contains(keyword)) {
                return true;
            }
        }
        return false;
    }
}
