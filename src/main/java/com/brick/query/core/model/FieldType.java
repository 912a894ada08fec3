package com.brick.query.core.model;

/**
 * Semantic type of an entity field.
 */
public enum FieldType {
    STRING,
    INTEGER,
    DECIMAL,
    RELATION
}
