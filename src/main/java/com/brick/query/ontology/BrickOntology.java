package com.brick.query.ontology;

import com.brick.query.core.model.EntityType;
import com.brick.query.core.model.IntentKind;
import com.brick.query.core.model.RelationType;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Static, read-only catalogue of the Brick vocabulary used by every pipeline stage:
 * entity definitions with bilingual synonyms, relations, traversal patterns and
 * intent keyword rules.
 *
 * <p>Matching is plain substring search over the lower-cased question, padded with a space
 * on each side and with sentence punctuation replaced by spaces. A term written with a
 * leading or trailing space ({@code " ahu "}) therefore only matches at a word edge.</p>
 *
 * <p>The ontology is built once and never mutated, so a single instance can be shared
 * between any number of concurrent requests.</p>
 *
 * <pre>
 * BrickOntology ontology = BrickOntology.defaultOntology();
 * ontology.findEntityByText("Vis alle temperatursensorer");   // Optional[TEMPERATURE_SENSOR]
 * ontology.detectIntentKeyword("hvor mange etasjer");         // AGGREGATE
 * </pre>
 */
public class BrickOntology {

    private static final Pattern PUNCTUATION = Pattern.compile("[?!.,;:()]");

    private final List<EntityDefinition> entities;
    private final Map<EntityType, EntityDefinition> entitiesByType;
    private final List<TraversalPattern> traversals;
    private final List<IntentKeywordRule> intentRules;

    private BrickOntology(Builder builder) {
        this.entities = List.copyOf(builder.entities);
        Map<EntityType, EntityDefinition> byType = new EnumMap<>(EntityType.class);
        for (EntityDefinition definition : entities) {
            if (byType.put(definition.getType(), definition) != null) {
                throw new IllegalArgumentException("Duplicate definition for " + definition.getType());
            }
        }
        this.entitiesByType = byType;
        this.traversals = List.copyOf(builder.traversals);
        List<IntentKeywordRule> rules = new ArrayList<>(builder.intentRules);
        rules.sort(Comparator.comparingInt(IntentKeywordRule::getPriority));
        this.intentRules = List.copyOf(rules);
    }

    /**
     * Returns the built-in Brick catalogue.
     */
    public static BrickOntology defaultOntology() {
        return DefaultBrickOntology.create();
    }

    // ========== Lookups ==========

    /**
     * Finds the first entity whose canonical name or synonym occurs in the text.
     * Definitions are checked in definition order.
     */
    public Optional<EntityType> findEntityByText(String text) {
        String lower = lower(text);
        if (lower.isEmpty()) {
            return Optional.empty();
        }
        for (EntityDefinition definition : entities) {
            if (definition.firstMatch(lower) != null) {
                return Optional.of(definition.getType());
            }
        }
        return Optional.empty();
    }

    /**
     * Finds the first traversal pattern with a keyword occurring in the text.
     */
    public Optional<TraversalPattern> findTraversalByKeyword(String text) {
        String lower = lower(text);
        if (lower.isEmpty()) {
            return Optional.empty();
        }
        for (TraversalPattern pattern : traversals) {
            if (pattern.matches(lower)) {
                return Optional.of(pattern);
            }
        }
        return Optional.empty();
    }

    /**
     * Detects the intent kind from keyword rules in priority order.
     *
     * @return the kind of the first matching rule, or {@link IntentKind#UNKNOWN}
     */
    public IntentKind detectIntentKeyword(String text) {
        String lower = lower(text);
        for (IntentKeywordRule rule : intentRules) {
            if (rule.matches(lower)) {
                return rule.getKind();
            }
        }
        return IntentKind.UNKNOWN;
    }

    // ========== Catalogue access ==========

    public List<EntityDefinition> getEntityDefinitions() {
        return entities;
    }

    public Optional<EntityDefinition> getDefinition(EntityType type) {
        return Optional.ofNullable(entitiesByType.get(type));
    }

    public List<TraversalPattern> getTraversals() {
        return traversals;
    }

    public Optional<TraversalPattern> getTraversal(String name) {
        return traversals.stream().filter(t -> t.name().equals(name)).findFirst();
    }

    public List<IntentKeywordRule> getIntentRules() {
        return intentRules;
    }

    /**
     * Returns every relation with its inverse, forward relations first in declaration order.
     */
    public Map<RelationType, RelationType> getRelations() {
        Map<RelationType, RelationType> relations = new LinkedHashMap<>();
        for (RelationType relation : RelationType.values()) {
            if (relation.isForward()) {
                relations.put(relation, relation.inverse());
            }
        }
        return relations;
    }

    /**
     * Lower-cases and pads the text so edge-anchored terms can match at the start or end.
     */
    static String lower(String text) {
        if (text == null || text.isBlank()) {
            return "";
        }
        return " " + PUNCTUATION.matcher(text.toLowerCase(Locale.ROOT)).replaceAll(" ") + " ";
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final List<EntityDefinition> entities = new ArrayList<>();
        private final List<TraversalPattern> traversals = new ArrayList<>();
        private final List<IntentKeywordRule> intentRules = new ArrayList<>();

        public Builder entity(EntityDefinition definition) {
            entities.add(Objects.requireNonNull(definition, "definition"));
            return this;
        }

        public Builder traversal(TraversalPattern pattern) {
            traversals.add(Objects.requireNonNull(pattern, "pattern"));
            return this;
        }

        public Builder intentRule(IntentKeywordRule rule) {
            intentRules.add(Objects.requireNonNull(rule, "rule"));
            return this;
        }

        public BrickOntology build() {
            return new BrickOntology(this);
        }
    }
}
