package com.brick.query.graph;

import java.util.regex.Pattern;

/**
 * Validation for everything that reaches the graph engine from outside.
 * Values always travel as parameters; only labels and identifiers are ever placed in
 * query text, and only after passing these checks.
 */
public final class InputSanitizer {

    /** Maximum allowed length of a question. */
    public static final int MAX_QUESTION_LENGTH = 1000;

    /** Maximum allowed length of a label or identifier. */
    public static final int MAX_LABEL_LENGTH = 128;

    private static final Pattern LABEL = Pattern.compile("^[A-Za-z][A-Za-z0-9_]*$");
    private static final Pattern IDENTIFIER = Pattern.compile("^[A-Za-z_][A-Za-z0-9_]*$");

    private InputSanitizer() {
        // utility class
    }

    /**
     * Validates a natural-language question.
     *
     * @throws IllegalArgumentException if the question is blank, too long or holds control characters
     */
    public static void validateQuestion(String question) {
        if (question == null || question.isBlank()) {
            throw new IllegalArgumentException("Question must not be null or blank");
        }
        if (question.length() > MAX_QUESTION_LENGTH) {
            throw new IllegalArgumentException(
                    "Question exceeds maximum length of " + MAX_QUESTION_LENGTH +
                            " characters (was " + question.length() + ")");
        }
        if (containsControlCharacters(question)) {
            throw new IllegalArgumentException("Question must not contain control characters");
        }
    }

    /**
     * Validates a graph label or label suffix such as {@code Temperature_Sensor}.
     *
     * @throws IllegalArgumentException if the label holds anything besides letters, digits and underscores
     */
    public static void validateLabel(String label) {
        if (label == null || label.isBlank()) {
            throw new IllegalArgumentException("Label must not be null or blank");
        }
        if (label.length() > MAX_LABEL_LENGTH || !LABEL.matcher(label).matches()) {
            throw new IllegalArgumentException(
                    "Label must start with a letter and contain only alphanumeric characters and underscores, " +
                            "got: '" + label + "'");
        }
    }

    /**
     * Validates a property or field identifier.
     */
    public static void validateIdentifier(String identifier) {
        if (identifier == null || identifier.isBlank()) {
            throw new IllegalArgumentException("Identifier must not be null or blank");
        }
        if (identifier.length() > MAX_LABEL_LENGTH || !IDENTIFIER.matcher(identifier).matches()) {
            throw new IllegalArgumentException("Invalid identifier: '" + identifier + "'");
        }
    }

    public static boolean isIdentifier(String identifier) {
        return identifier != null && identifier.length() <= MAX_LABEL_LENGTH
                && IDENTIFIER.matcher(identifier).matches();
    }

    /**
     * Checks for ASCII control characters (0x00-0x1F, 0x7F) other than tab, newline and carriage return.
     */
    private static boolean containsControlCharacters(String s) {
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c < 0x20 && c != '\t' && c != '\n' && c != '\r') {
                return true;
            }
            if (c == 0x7F) {
                return true;
            }
        }
        return false;
    }
}
