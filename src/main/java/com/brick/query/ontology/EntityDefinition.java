package com.brick.query.ontology;

import com.brick.query.core.model.EntityType;
import com.brick.query.core.model.FieldDefinition;
import com.brick.query.core.model.FieldType;
import com.brick.query.core.model.QueryLocale;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Describes one Brick class: its canonical name, fields, and the words people use for it.
 * Instances are immutable once built.
 */
public class EntityDefinition {
    private final EntityType type;
    private final String name;
    private final String description;
    private final List<FieldDefinition> fields;
    private final Map<QueryLocale, List<String>> synonyms;
    private final List<String> matchTerms;

    private EntityDefinition(Builder builder) {
        this.type = builder.type;
        this.name = builder.name;
        this.description = builder.description != null ? builder.description : "";
        this.fields = List.copyOf(builder.fields);

        Map<QueryLocale, List<String>> copy = new EnumMap<>(QueryLocale.class);
        for (QueryLocale locale : QueryLocale.values()) {
            copy.put(locale, List.copyOf(builder.synonyms.getOrDefault(locale, List.of())));
        }
        this.synonyms = Collections.unmodifiableMap(copy);

        List<String> terms = new ArrayList<>();
        terms.add(name.toLowerCase(Locale.ROOT));
        for (QueryLocale locale : QueryLocale.values()) {
            for (String synonym : synonyms.get(locale)) {
                terms.add(synonym.toLowerCase(Locale.ROOT));
            }
        }
        this.matchTerms = List.copyOf(terms);
    }

    public EntityType getType() {
        return type;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public List<FieldDefinition> getFields() {
        return fields;
    }

    /**
     * Returns only the non-relation fields, in declaration order.
     */
    public List<FieldDefinition> getScalarFields() {
        return fields.stream().filter(f -> !f.relation()).toList();
    }

    public List<FieldDefinition> getRelationFields() {
        return fields.stream().filter(FieldDefinition::relation).toList();
    }

    public List<String> getSynonyms(QueryLocale locale) {
        return synonyms.get(locale);
    }

    /**
     * Canonical name first, then Norwegian synonyms, then English synonyms, all lower-cased.
     */
    public List<String> getMatchTerms() {
        return matchTerms;
    }

    /**
     * Returns the first match term contained in the given lower-cased text, or {@code null}.
     */
    public String firstMatch(String lowerText) {
        for (String term : matchTerms) {
            if (lowerText.contains(term)) {
                return term;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return "EntityDefinition{type=" + type + ", name='" + name + "'}";
    }

    public static Builder builder(EntityType type, String name) {
        return new Builder(type, name);
    }

    public static class Builder {
        private final EntityType type;
        private final String name;
        private String description;
        private final List<FieldDefinition> fields = new ArrayList<>();
        private final Map<QueryLocale, List<String>> synonyms = new EnumMap<>(QueryLocale.class);

        private Builder(EntityType type, String name) {
            this.type = Objects.requireNonNull(type, "type is required");
            this.name = Objects.requireNonNull(name, "name is required");
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder field(String fieldName, FieldType fieldType, String fieldDescription) {
            fields.add(FieldDefinition.scalar(fieldName, fieldType, fieldDescription));
            return this;
        }

        public Builder relation(String fieldName, EntityType target, String fieldDescription) {
            fields.add(FieldDefinition.relation(fieldName, target, fieldDescription));
            return this;
        }

        public Builder synonyms(QueryLocale locale, String... words) {
            synonyms.put(locale, List.of(words));
            return this;
        }

        public EntityDefinition build() {
            return new EntityDefinition(this);
        }
    }
}
