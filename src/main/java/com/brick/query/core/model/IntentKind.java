package com.brick.query.core.model;

import java.util.Optional;

/**
 * The kind of question being asked. The wire code is what the language model
 * is asked to emit in its {@code intent_type} field.
 */
public enum IntentKind {
    ENTITY("query_entity"),
    LIST("query_list"),
    TRAVERSE("query_traverse"),
    AGGREGATE("query_aggregate"),
    PATH("query_path"),
    UNKNOWN("unknown");

    private final String code;

    IntentKind(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public static Optional<IntentKind> fromCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        for (IntentKind kind : values()) {
            if (kind.code.equalsIgnoreCase(code.trim())) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
