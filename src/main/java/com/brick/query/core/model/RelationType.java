package com.brick.query.core.model;

/**
 * Brick relationship kinds. Every forward relation has exactly one inverse.
 */
public enum RelationType {

    HAS_PART("hasPart", true),
    IS_PART_OF("isPartOf", false),
    HAS_LOCATION("hasLocation", true),
    IS_LOCATION_OF("isLocationOf", false),
    HAS_POINT("hasPoint", true),
    IS_POINT_OF("isPointOf", false),
    HAS_MEMBER("hasMember", true),
    IS_MEMBER_OF("isMemberOf", false),
    FEEDS("feeds", true),
    IS_FED_BY("isFedBy", false),
    METERS("meters", true),
    IS_METERED_BY("isMeteredBy", false),
    HAS_TIMESERIES("hasTimeseries", true),
    IS_TIMESERIES_OF("isTimeseriesOf", false);

    private final String relationName;
    private final boolean forward;

    RelationType(String relationName, boolean forward) {
        this.relationName = relationName;
        this.forward = forward;
    }

    public String getRelationName() {
        return relationName;
    }

    /**
     * Returns the edge label used in the graph, e.g. {@code brick_hasPart}.
     */
    public String getLabel() {
        return EntityType.LABEL_PREFIX + relationName;
    }

    public boolean isForward() {
        return forward;
    }

    /**
     * Forward and inverse constants are declared in adjacent pairs.
     */
    public RelationType inverse() {
        RelationType[] all = values();
        return forward ? all[ordinal() + 1] : all[ordinal() - 1];
    }
}
