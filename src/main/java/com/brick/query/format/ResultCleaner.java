package com.brick.query.format;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Strips nulls and empty containers from raw query results, recursively.
 * A map or list that becomes empty is itself removed, so a cleaned value never
 * contains a null or an empty container.
 */
public final class ResultCleaner {

    private ResultCleaner() {
        // utility class
    }

    /**
     * Cleans result rows, dropping rows that end up empty.
     */
    public static List<Map<String, Object>> cleanRows(List<Map<String, Object>> rows) {
        List<Map<String, Object>> cleaned = new ArrayList<>();
        if (rows == null) {
            return cleaned;
        }
        for (Map<String, Object> row : rows) {
            Object value = clean(row);
            if (value instanceof Map<?, ?> map) {
                cleaned.add(asStringMap(map));
            }
        }
        return cleaned;
    }

    /**
     * Cleans one value.
     *
     * @return the cleaned value, or {@code null} when nothing is left
     */
    public static Object clean(Object value) {
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> cleaned = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                Object cleanedValue = clean(entry.getValue());
                if (cleanedValue != null) {
                    cleaned.put(String.valueOf(entry.getKey()), cleanedValue);
                }
            }
            return cleaned.isEmpty() ? null : cleaned;
        }
        if (value instanceof Collection<?> collection) {
            List<Object> cleaned = new ArrayList<>();
            for (Object item : collection) {
                Object cleanedItem = clean(item);
                if (cleanedItem != null) {
                    cleaned.add(cleanedItem);
                }
            }
            return cleaned.isEmpty() ? null : cleaned;
        }
        return value;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asStringMap(Map<?, ?> map) {
        return (Map<String, Object>) map;
    }
}
