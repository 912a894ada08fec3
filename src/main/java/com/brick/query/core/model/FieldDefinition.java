package com.brick.query.core.model;

import java.util.Objects;

/**
 * A property or relation of an entity as described by the ontology.
 *
 * @param name          graph property name (snake_case) or relation field name
 * @param type          semantic type
 * @param description   human-readable description, used in prompts and the schema endpoint
 * @param relation      whether the field is a relation to another entity
 * @param relatedEntity target of the relation, {@code null} for scalar fields
 */
public record FieldDefinition(
        String name,
        FieldType type,
        String description,
        boolean relation,
        EntityType relatedEntity
) {
    public FieldDefinition {
        Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(type, "type is required");
        description = description != null ? description : "";
        if (relation && relatedEntity == null) {
            throw new IllegalArgumentException("relation field '" + name + "' needs a related entity");
        }
    }

    public static FieldDefinition scalar(String name, FieldType type, String description) {
        return new FieldDefinition(name, type, description, false, null);
    }

    public static FieldDefinition relation(String name, EntityType target, String description) {
        return new FieldDefinition(name, FieldType.RELATION, description, true, target);
    }
}
