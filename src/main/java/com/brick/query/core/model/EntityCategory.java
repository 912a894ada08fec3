package com.brick.query.core.model;

/**
 * Broad grouping of Brick classes. Determines which structured-query type
 * and which sub-type filter argument an entity maps to.
 */
public enum EntityCategory {
    LOCATION,
    SYSTEM,
    EQUIPMENT,
    METER,
    SENSOR,
    TIMESERIES
}
