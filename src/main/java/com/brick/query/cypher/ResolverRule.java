package com.brick.query.cypher;

import java.util.Locale;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Maps a root operation to the node family and result shape it resolves to.
 * Rules are checked in table order against the lower-cased root field name.
 *
 * @param name        rule name, used in logs
 * @param rootMatcher accepts the lower-cased root field
 * @param family      node family the query matches
 * @param shape       what the query returns
 */
record ResolverRule(String name, Predicate<String> rootMatcher, NodeFamily family, Shape shape) {

    enum Shape {
        /** First matching node with its projection. */
        SINGLE,
        /** Every matching node with its projection. */
        LIST,
        /** A single {@code count} column. */
        COUNT
    }

    boolean matches(String rootField) {
        return rootField != null && rootMatcher.test(rootField.toLowerCase(Locale.ROOT));
    }

    static ResolverRule of(String name, NodeFamily family, Shape shape, String... roots) {
        Set<String> accepted = Set.of(roots);
        return new ResolverRule(name, accepted::contains, family, shape);
    }
}
