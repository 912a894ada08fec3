package com.brick.query.format;

/**
 * Truncation limits applied when rendering results.
 *
 * @param maxListRows      rows shown by the list renderer
 * @param maxTraversalRows rows shown by the traversal renderer
 * @param maxNestedItems   items shown of a nested list in entity and traversal output
 * @param maxFieldsPerRow  fields shown after the name on one list line
 * @param maxInlineItems   items shown of a list value on one list line
 */
public record FormatterLimits(
        int maxListRows,
        int maxTraversalRows,
        int maxNestedItems,
        int maxFieldsPerRow,
        int maxInlineItems
) {

    public static final FormatterLimits DEFAULTS = new FormatterLimits(15, 20, 5, 6, 3);

    public FormatterLimits {
        requirePositive("maxListRows", maxListRows);
        requirePositive("maxTraversalRows", maxTraversalRows);
        requirePositive("maxNestedItems", maxNestedItems);
        requirePositive("maxFieldsPerRow", maxFieldsPerRow);
        requirePositive("maxInlineItems", maxInlineItems);
    }

    private static void requirePositive(String name, int value) {
        if (value < 1) {
            throw new IllegalArgumentException(name + " must be at least 1, got " + value);
        }
    }
}
