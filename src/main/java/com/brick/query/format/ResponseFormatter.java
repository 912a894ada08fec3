package com.brick.query.format;

import com.brick.query.core.model.EntityType;
import com.brick.query.core.model.ExtractedIntent;
import com.brick.query.core.model.GeneratedQuery;
import com.brick.query.core.model.IntentKind;
import com.brick.query.core.model.QueryLocale;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Renders graph query results as a natural-language answer.
 *
 * <p>Rows are cleaned first. A question about one field ("Hva er adressen?") is answered
 * directly when that field is present. Otherwise the intent kind picks one of four
 * renderers: aggregate, list, entity and traversal. Every renderer answers an empty
 * result with the locale's "no results" sentence.</p>
 */
public class ResponseFormatter {

    private static final int MAX_SEARCH_DEPTH = 6;

    private final FormatterLimits limits;
    private final List<FieldAnswerRule> fieldAnswerRules;

    public ResponseFormatter() {
        this(FormatterLimits.DEFAULTS);
    }

    public ResponseFormatter(FormatterLimits limits) {
        this(limits, FieldAnswerRule.DEFAULT_RULES);
    }

    public ResponseFormatter(FormatterLimits limits, List<FieldAnswerRule> fieldAnswerRules) {
        this.limits = Objects.requireNonNull(limits, "limits is required");
        this.fieldAnswerRules = List.copyOf(fieldAnswerRules);
    }

    public String format(List<Map<String, Object>> rows, ExtractedIntent intent, GeneratedQuery query,
                         QueryLocale locale) {
        return format(rows, intent.kind(), intent.question(), query != null ? query.description() : null, locale);
    }

    /**
     * Renders rows.
     *
     * @param rows             raw result rows, may be {@code null}
     * @param kind             intent kind selecting the renderer
     * @param question         the original question, used for single-field answers
     * @param queryDescription header for traversal output, may be {@code null}
     * @param locale           output language
     */
    public String format(List<Map<String, Object>> rows, IntentKind kind, String question,
                         String queryDescription, QueryLocale locale) {
        ResponseMessages messages = ResponseMessages.forLocale(locale);
        List<Map<String, Object>> cleaned = ResultCleaner.cleanRows(rows);
        if (cleaned.isEmpty()) {
            return messages.noResults();
        }

        Optional<String> fieldAnswer = answerField(cleaned, question);
        if (fieldAnswer.isPresent()) {
            return fieldAnswer.get();
        }

        List<Map<String, Object>> unwrapped = cleaned.stream().map(ResponseFormatter::unwrap).toList();
        return switch (kind) {
            case AGGREGATE -> renderAggregate(unwrapped, messages);
            case ENTITY -> renderEntity(unwrapped, messages);
            case TRAVERSE, PATH -> renderTraversal(unwrapped, queryDescription, messages);
            case LIST, UNKNOWN -> renderList(unwrapped, messages);
        };
    }

    // ========== Error and short-circuit replies ==========

    public String lowConfidence(String question, QueryLocale locale) {
        ResponseMessages messages = ResponseMessages.forLocale(locale);
        return messages.format(messages.lowConfidence(), question != null ? question : "");
    }

    public String connectionError(String error, QueryLocale locale) {
        ResponseMessages messages = ResponseMessages.forLocale(locale);
        return messages.format(messages.connectionError(), error);
    }

    public String queryError(String error, QueryLocale locale) {
        ResponseMessages messages = ResponseMessages.forLocale(locale);
        return messages.format(messages.queryError(), error);
    }

    public String resolutionError(String error, QueryLocale locale) {
        ResponseMessages messages = ResponseMessages.forLocale(locale);
        return messages.format(messages.resolutionError(), error);
    }

    public FormatterLimits getLimits() {
        return limits;
    }

    // ========== Single-field answers ==========

    Optional<String> answerField(List<Map<String, Object>> rows, String question) {
        if (question == null || question.isBlank()) {
            return Optional.empty();
        }
        String lower = question.toLowerCase(Locale.ROOT);
        Map<String, Object> first = unwrap(rows.get(0));
        for (FieldAnswerRule rule : fieldAnswerRules) {
            if (!rule.appliesTo(lower)) {
                continue;
            }
            Object value = first.containsKey(rule.field())
                    ? first.get(rule.field())
                    : findField(first, rule.field(), 0);
            if (value != null && !(value instanceof Map) && !(value instanceof List)) {
                return Optional.of(rule.answer(display(value)));
            }
        }
        return Optional.empty();
    }

    private static Object findField(Object data, String field, int depth) {
        if (depth > MAX_SEARCH_DEPTH) {
            return null;
        }
        if (data instanceof Map<?, ?> map) {
            if (map.containsKey(field)) {
                return map.get(field);
            }
            for (Object value : map.values()) {
                Object found = findField(value, field, depth + 1);
                if (found != null) {
                    return found;
                }
            }
        } else if (data instanceof List<?> list) {
            for (Object item : list) {
                Object found = findField(item, field, depth + 1);
                if (found != null) {
                    return found;
                }
            }
        }
        return null;
    }

    // ========== Renderers ==========

    private String renderAggregate(List<Map<String, Object>> rows, ResponseMessages messages) {
        Object count = rows.get(0).get("count");
        if (count == null) {
            count = rows.size();
        }
        return messages.format(messages.count(), display(count));
    }

    private String renderList(List<Map<String, Object>> rows, ResponseMessages messages) {
        List<String> lines = new ArrayList<>();
        lines.add(messages.format(messages.found(), rows.size()));
        lines.add("");

        int shown = Math.min(rows.size(), limits.maxListRows());
        for (int i = 0; i < shown; i++) {
            Map<String, Object> row = rows.get(i);
            List<String> parts = new ArrayList<>();
            String name = extractName(row);
            if (name != null) {
                parts.add(name);
            }
            int fields = 0;
            for (Map.Entry<String, Object> entry : row.entrySet()) {
                if (fields >= limits.maxFieldsPerRow()) {
                    break;
                }
                String key = entry.getKey();
                Object value = entry.getValue();
                if (isNameOrId(key) || value instanceof Map) {
                    continue;
                }
                String rendered = value instanceof List<?> list ? inlineList(list, messages) : display(value);
                parts.add(messages.fieldLabel(key) + ": " + rendered);
                fields++;
            }
            lines.add("  " + (i + 1) + ". " + String.join(" | ", parts));
        }

        if (rows.size() > shown) {
            lines.add("");
            lines.add("  " + messages.format(messages.moreResults(), rows.size() - shown));
        }
        return String.join("\n", lines);
    }

    private String renderEntity(List<Map<String, Object>> rows, ResponseMessages messages) {
        Map<String, Object> entity = rows.get(0);
        List<String> lines = new ArrayList<>();

        String name = extractName(entity);
        if (name != null) {
            lines.add(name);
            lines.add("");
        }

        for (Map.Entry<String, Object> entry : entity.entrySet()) {
            String key = entry.getKey();
            Object value = entry.getValue();
            if (isNameOrId(key)) {
                continue;
            }
            String label = messages.fieldLabel(key);
            if (value instanceof Map<?, ?> nested) {
                lines.add("  " + label + ":");
                for (Map.Entry<?, ?> nestedEntry : nested.entrySet()) {
                    lines.add("    • " + messages.fieldLabel(String.valueOf(nestedEntry.getKey())) + ": "
                            + display(nestedEntry.getValue()));
                }
            } else if (value instanceof List<?> list) {
                lines.add("  " + label + ":");
                int shown = Math.min(list.size(), limits.maxNestedItems());
                for (int i = 0; i < shown; i++) {
                    lines.add("    • " + describeItem(list.get(i)));
                }
                if (list.size() > shown) {
                    lines.add("    " + messages.format(messages.moreItems(), list.size() - shown));
                }
            } else {
                lines.add("  " + label + ": " + display(value));
            }
        }

        if (rows.size() > 1) {
            lines.add("");
            lines.add(messages.format(messages.moreResults(), rows.size() - 1));
        }
        return String.join("\n", lines);
    }

    private String renderTraversal(List<Map<String, Object>> rows, String description, ResponseMessages messages) {
        List<String> lines = new ArrayList<>();
        lines.add(description != null && !description.isBlank() ? description : messages.resultsHeader());
        lines.add("");

        int shown = Math.min(rows.size(), limits.maxTraversalRows());
        for (int i = 0; i < shown; i++) {
            Map<String, Object> row = rows.get(i);
            String name = extractName(row);
            lines.add(name != null ? "  • " + name : "  •");

            for (Map.Entry<String, Object> entry : row.entrySet()) {
                String key = entry.getKey();
                Object value = entry.getValue();
                if (isNameOrId(key)) {
                    continue;
                }
                String label = messages.fieldLabel(key);
                if (value instanceof Map<?, ?> nested) {
                    List<String> pairs = new ArrayList<>();
                    nested.forEach((k, v) -> pairs.add(k + "=" + display(v)));
                    lines.add("      " + label + ": " + String.join(", ", pairs));
                } else if (value instanceof List<?> list) {
                    int shownItems = Math.min(list.size(), limits.maxNestedItems());
                    if (list.get(0) instanceof Map) {
                        lines.add("      " + label + ":");
                        for (int j = 0; j < shownItems; j++) {
                            lines.add("        - " + describeItem(list.get(j)));
                        }
                        if (list.size() > shownItems) {
                            lines.add("        " + messages.format(messages.moreItems(), list.size() - shownItems));
                        }
                    } else {
                        List<String> values = new ArrayList<>();
                        for (int j = 0; j < shownItems; j++) {
                            values.add(display(list.get(j)));
                        }
                        lines.add("      " + label + ": " + String.join(", ", values));
                    }
                } else {
                    lines.add("      " + label + ": " + display(value));
                }
            }
            lines.add("");
        }

        if (rows.size() > shown) {
            lines.add(messages.format(messages.moreResults(), rows.size() - shown));
        }
        return String.join("\n", lines).stripTrailing();
    }

    // ========== Helpers ==========

    /**
     * Rows of the form {@code {"sensor": {...}}} are rendered as the inner map.
     */
    @SuppressWarnings("unchecked")
    static Map<String, Object> unwrap(Map<String, Object> row) {
        if (row.size() == 1) {
            Object only = row.values().iterator().next();
            if (only instanceof Map<?, ?>) {
                return (Map<String, Object>) only;
            }
        }
        return row;
    }

    private String inlineList(List<?> list, ResponseMessages messages) {
        if (list.get(0) instanceof Map) {
            List<String> names = new ArrayList<>();
            int shown = Math.min(list.size(), limits.maxInlineItems());
            for (int i = 0; i < shown; i++) {
                names.add(describeItem(list.get(i)));
            }
            String joined = String.join(", ", names);
            return list.size() > shown
                    ? joined + " " + messages.format(messages.moreItems(), list.size() - shown)
                    : joined;
        }
        List<String> values = new ArrayList<>();
        int shown = Math.min(list.size(), limits.maxInlineItems());
        for (int i = 0; i < shown; i++) {
            values.add(display(list.get(i)));
        }
        String joined = String.join(", ", values);
        return list.size() > shown
                ? joined + " " + messages.format(messages.moreItems(), list.size() - shown)
                : joined;
    }

    private static String describeItem(Object item) {
        if (item instanceof Map<?, ?> map) {
            Object name = map.get("name");
            if (name == null) {
                name = map.get("id");
            }
            Object kind = firstPresent(map, "type", "sensorType", "equipmentType", "systemType", "meterType", "level");
            String label = name != null ? display(name) : display(map);
            return kind != null ? label + " (" + display(kind) + ")" : label;
        }
        return display(item);
    }

    private static Object firstPresent(Map<?, ?> map, String... keys) {
        for (String key : keys) {
            Object value = map.get(key);
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    static String extractName(Map<String, Object> row) {
        Object name = row.get("name");
        if (name != null && !(name instanceof Map) && !(name instanceof List)) {
            return display(name);
        }
        for (Map.Entry<String, Object> entry : row.entrySet()) {
            Object value = entry.getValue();
            if (entry.getKey().toLowerCase(Locale.ROOT).contains("name")
                    && !(value instanceof Map) && !(value instanceof List)) {
                return display(value);
            }
        }
        return null;
    }

    private static boolean isNameOrId(String key) {
        return "name".equals(key) || "id".equals(key);
    }

    /**
     * Graph labels are shown without their namespace ({@code brick_Temperature_Sensor}
     * becomes {@code Temperature Sensor}).
     */
    static String display(Object value) {
        if (value instanceof String s && s.startsWith(EntityType.LABEL_PREFIX)) {
            return s.substring(EntityType.LABEL_PREFIX.length()).replace('_', ' ');
        }
        if (value instanceof Double d && d == Math.rint(d) && !Double.isInfinite(d)) {
            return String.valueOf(d.longValue());
        }
        return String.valueOf(value);
    }
}
