package com.brick.query.core.model;

import java.util.Locale;

/**
 * Output language of a request. Always chosen by the caller, never inferred from the question.
 */
public enum QueryLocale {
    NO("no"),
    EN("en");

    private final String code;

    QueryLocale(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    /**
     * Parses a language code ({@code "no"}, {@code "en"}).
     *
     * @throws IllegalArgumentException for unsupported codes
     */
    public static QueryLocale fromCode(String code) {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("language must not be blank");
        }
        String normalized = code.trim().toLowerCase(Locale.ROOT);
        for (QueryLocale locale : values()) {
            if (locale.code.equals(normalized)) {
                return locale;
            }
        }
        throw new IllegalArgumentException("Unsupported language '" + code + "', expected 'no' or 'en'");
    }
}
