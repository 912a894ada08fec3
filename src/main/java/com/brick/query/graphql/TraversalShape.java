package com.brick.query.graphql;

import com.brick.query.core.model.EntityType;
import com.brick.query.core.model.GeneratedQuery;

import java.util.Map;
import java.util.function.BiFunction;
import java.util.function.BiPredicate;

/**
 * A hand-authored nested query used for traversal questions.
 * Shapes are tried in table order; the first whose matcher accepts the intent builds the query.
 *
 * @param name    operation name of the built query
 * @param matcher accepts the entity type (nullable) and the extracted parameters
 * @param builder builds the query for an accepted intent
 */
record TraversalShape(
        String name,
        BiPredicate<EntityType, Map<String, Object>> matcher,
        BiFunction<EntityType, Map<String, Object>, GeneratedQuery> builder
) {
    boolean matches(EntityType entityType, Map<String, Object> parameters) {
        return matcher.test(entityType, parameters);
    }

    GeneratedQuery build(EntityType entityType, Map<String, Object> parameters) {
        return builder.apply(entityType, parameters);
    }
}
