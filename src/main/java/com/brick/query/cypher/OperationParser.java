package com.brick.query.cypher;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Reads the root field, its arguments and its selection set out of a structured query.
 *
 * <p>Only the subset of the query language the generator emits is understood: one
 * operation, one root field, string, number, boolean and variable arguments, and nested
 * selections. Arguments of nested fields are skipped. Anything unreadable yields an empty
 * result, which the resolver treats as an unrecognised operation.</p>
 */
final class OperationParser {

    private final String text;
    private int pos;

    private OperationParser(String text) {
        this.text = text;
    }

    static Optional<ParsedOperation> parse(String queryText) {
        if (queryText == null || queryText.isBlank()) {
            return Optional.empty();
        }
        return new OperationParser(queryText).parseOperation();
    }

    private Optional<ParsedOperation> parseOperation() {
        int open = text.indexOf('{');
        if (open < 0) {
            return Optional.empty();
        }
        pos = open + 1;
        skipWhitespace();
        String root = readName();
        if (root == null) {
            return Optional.empty();
        }

        Map<String, Object> literals = new LinkedHashMap<>();
        Map<String, String> refs = new LinkedHashMap<>();
        skipWhitespace();
        if (peek() == '(') {
            if (!parseArguments(literals, refs)) {
                return Optional.empty();
            }
            skipWhitespace();
        }

        List<Selection> selection = List.of();
        if (peek() == '{') {
            pos++;
            selection = parseSelectionSet();
            if (selection == null) {
                return Optional.empty();
            }
        }
        return Optional.of(new ParsedOperation(root, literals, refs, selection));
    }

    // ========== Arguments ==========

    private boolean parseArguments(Map<String, Object> literals, Map<String, String> refs) {
        pos++; // (
        while (true) {
            skipSeparators();
            char c = peek();
            if (c == ')') {
                pos++;
                return true;
            }
            String name = readName();
            if (name == null) {
                return false;
            }
            skipWhitespace();
            if (peek() != ':') {
                return false;
            }
            pos++;
            skipWhitespace();
            c = peek();
            if (c == '"') {
                String value = readString();
                if (value == null) {
                    return false;
                }
                literals.put(name, value);
            } else if (c == '$') {
                pos++;
                String variable = readName();
                if (variable == null) {
                    return false;
                }
                refs.put(name, variable);
            } else {
                String token = readToken();
                if (token.isEmpty()) {
                    return false;
                }
                literals.put(name, literalValue(token));
            }
        }
    }

    private static Object literalValue(String token) {
        if ("true".equals(token) || "false".equals(token)) {
            return Boolean.valueOf(token);
        }
        try {
            return token.contains(".") ? (Object) Double.valueOf(token) : (Object) Long.valueOf(token);
        } catch (NumberFormatException e) {
            return token;
        }
    }

    private void skipNestedArguments() {
        int depth = 0;
        boolean inString = false;
        while (pos < text.length()) {
            char c = text.charAt(pos++);
            if (inString) {
                if (c == '\\') {
                    pos++;
                } else if (c == '"') {
                    inString = false;
                }
            } else if (c == '"') {
                inString = true;
            } else if (c == '(') {
                depth++;
            } else if (c == ')' && --depth == 0) {
                return;
            }
        }
    }

    // ========== Selections ==========

    /**
     * Parses fields up to and including the closing brace; {@code null} when unbalanced.
     */
    private List<Selection> parseSelectionSet() {
        List<Selection> fields = new ArrayList<>();
        while (true) {
            skipSeparators();
            if (pos >= text.length()) {
                return null;
            }
            char c = peek();
            if (c == '}') {
                pos++;
                return fields;
            }
            String name = readName();
            if (name == null) {
                return null;
            }
            skipWhitespace();
            if (peek() == '(') {
                skipNestedArguments();
                skipWhitespace();
            }
            List<Selection> children = List.of();
            if (peek() == '{') {
                pos++;
                children = parseSelectionSet();
                if (children == null) {
                    return null;
                }
            }
            fields.add(new Selection(name, children));
        }
    }

    // ========== Lexing ==========

    private char peek() {
        return pos < text.length() ? text.charAt(pos) : '\0';
    }

    private void skipWhitespace() {
        while (pos < text.length() && Character.isWhitespace(text.charAt(pos))) {
            pos++;
        }
    }

    private void skipSeparators() {
        while (pos < text.length() && (Character.isWhitespace(text.charAt(pos)) || text.charAt(pos) == ',')) {
            pos++;
        }
    }

    private String readName() {
        int start = pos;
        if (pos < text.length() && (Character.isLetter(text.charAt(pos)) || text.charAt(pos) == '_')) {
            pos++;
            while (pos < text.length() && (Character.isLetterOrDigit(text.charAt(pos)) || text.charAt(pos) == '_')) {
                pos++;
            }
            return text.substring(start, pos);
        }
        return null;
    }

    private String readString() {
        StringBuilder sb = new StringBuilder();
        pos++; // opening quote
        while (pos < text.length()) {
            char c = text.charAt(pos++);
            if (c == '\\' && pos < text.length()) {
                sb.append(text.charAt(pos++));
            } else if (c == '"') {
                return sb.toString();
            } else {
                sb.append(c);
            }
        }
        return null;
    }

    private String readToken() {
        int start = pos;
        while (pos < text.length()) {
            char c = text.charAt(pos);
            if (Character.isWhitespace(c) || c == ',' || c == ')') {
                break;
            }
            pos++;
        }
        return text.substring(start, pos);
    }
}
