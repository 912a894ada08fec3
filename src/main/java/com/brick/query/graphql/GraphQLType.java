package com.brick.query.graphql;

import com.brick.query.core.model.EntityType;

import java.util.Optional;

/**
 * Structured-query types exposed for the Brick graph, with their root fields.
 * Families of Brick classes (systems, equipment, sensors, meters) share one type and are
 * narrowed by a sub-type argument holding the concrete class's type name.
 */
public enum GraphQLType {
    BUILDING("Building", "building", "buildings", "Buildings", null),
    FLOOR("Floor", "floor", "floors", "Floors", null),
    HVAC_ZONE("HVACZone", "zone", "zones", "HVACZones", null),
    ROOM("Room", "room", "rooms", "Rooms", null),
    SYSTEM("System", "system", "systems", "Systems", "systemType"),
    EQUIPMENT("Equipment", "equipment", "equipment", "Equipment", "equipmentType"),
    SENSOR("Sensor", "sensor", "sensors", "Sensors", "sensorType"),
    METER("Meter", "meter", "meters", "Meters", "meterType"),
    TIMESERIES("Timeseries", "timeseries", "timeseries", "Timeseries", null);

    private final String typeName;
    private final String singularField;
    private final String pluralField;
    private final String pluralName;
    private final String subTypeArgument;

    GraphQLType(String typeName, String singularField, String pluralField, String pluralName,
                String subTypeArgument) {
        this.typeName = typeName;
        this.singularField = singularField;
        this.pluralField = pluralField;
        this.pluralName = pluralName;
        this.subTypeArgument = subTypeArgument;
    }

    public String getTypeName() {
        return typeName;
    }

    public String getSingularField() {
        return singularField;
    }

    public String getPluralField() {
        return pluralField;
    }

    /**
     * Plural used in operation names, e.g. {@code Sensors} in {@code ListSensors}.
     */
    public String getPluralName() {
        return pluralName;
    }

    /**
     * Name of the argument and field carrying the concrete Brick class, when the type is a family.
     */
    public Optional<String> getSubTypeArgument() {
        return Optional.ofNullable(subTypeArgument);
    }

    public static GraphQLType forEntity(EntityType entityType) {
        return switch (entityType) {
            case BUILDING -> BUILDING;
            case FLOOR -> FLOOR;
            case HVAC_ZONE -> HVAC_ZONE;
            case ROOM -> ROOM;
            case TIMESERIES -> TIMESERIES;
            default -> switch (entityType.getCategory()) {
                case SYSTEM -> SYSTEM;
                case EQUIPMENT -> EQUIPMENT;
                case SENSOR -> SENSOR;
                case METER -> METER;
                default -> throw new IllegalStateException("No structured type for " + entityType);
            };
        };
    }
}
