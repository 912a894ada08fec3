package com.brick.query.core.model;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Closed set of Brick Schema classes known to the query compiler.
 * Each variant carries the graph label it is stored under ({@code brick_<TypeName>}),
 * its {@link EntityCategory}, and short aliases accepted in sub-type filters.
 */
public enum EntityType {

    // Locations
    BUILDING("Building", EntityCategory.LOCATION),
    FLOOR("Floor", EntityCategory.LOCATION),
    HVAC_ZONE("HVAC_Zone", EntityCategory.LOCATION, "Zone"),
    ROOM("Room", EntityCategory.LOCATION),

    // Systems
    HVAC_SYSTEM("HVAC_System", EntityCategory.SYSTEM, "HVAC"),
    ELECTRICAL_SYSTEM("Electrical_System", EntityCategory.SYSTEM, "Electrical"),
    LIGHTING_SYSTEM("Lighting_System", EntityCategory.SYSTEM, "Lighting"),
    HOT_WATER_SYSTEM("Hot_Water_System", EntityCategory.SYSTEM, "Hot_Water"),

    // Equipment
    AIR_HANDLING_UNIT("Air_Handling_Unit", EntityCategory.EQUIPMENT, "AHU"),
    VAV("VAV", EntityCategory.EQUIPMENT),
    CHILLER("Chiller", EntityCategory.EQUIPMENT),
    BOILER("Boiler", EntityCategory.EQUIPMENT),
    PUMP("Pump", EntityCategory.EQUIPMENT),
    FAN("Fan", EntityCategory.EQUIPMENT),

    // Meters
    ELECTRICAL_METER("Electrical_Meter", EntityCategory.METER, "Electrical"),
    THERMAL_ENERGY_METER("Thermal_Energy_Meter", EntityCategory.METER, "Thermal"),
    WATER_METER("Water_Meter", EntityCategory.METER, "Water"),

    // Sensors
    TEMPERATURE_SENSOR("Temperature_Sensor", EntityCategory.SENSOR, "Temperature"),
    HUMIDITY_SENSOR("Humidity_Sensor", EntityCategory.SENSOR, "Humidity"),
    CO2_SENSOR("CO2_Sensor", EntityCategory.SENSOR, "CO2"),
    POWER_SENSOR("Power_Sensor", EntityCategory.SENSOR, "Power"),
    ENERGY_SENSOR("Energy_Sensor", EntityCategory.SENSOR, "Energy"),
    FLOW_SENSOR("Flow_Sensor", EntityCategory.SENSOR, "Flow"),
    PRESSURE_SENSOR("Pressure_Sensor", EntityCategory.SENSOR, "Pressure"),

    // Data
    TIMESERIES("Timeseries", EntityCategory.TIMESERIES);

    /** Prefix shared by every Brick label and relation stored in the graph. */
    public static final String LABEL_PREFIX = "brick_";

    private final String typeName;
    private final EntityCategory category;
    private final List<String> aliases;

    EntityType(String typeName, EntityCategory category, String... aliases) {
        this.typeName = typeName;
        this.category = category;
        this.aliases = List.of(aliases);
    }

    /**
     * Returns the Brick type name without the label prefix, e.g. {@code Temperature_Sensor}.
     */
    public String getTypeName() {
        return typeName;
    }

    /**
     * Returns the graph label, e.g. {@code brick_Temperature_Sensor}.
     */
    public String getLabel() {
        return LABEL_PREFIX + typeName;
    }

    public EntityCategory getCategory() {
        return category;
    }

    public List<String> getAliases() {
        return aliases;
    }

    public boolean isSensor() {
        return category == EntityCategory.SENSOR;
    }

    public boolean isEquipment() {
        return category == EntityCategory.EQUIPMENT;
    }

    /**
     * Looks up a type by its graph label ({@code brick_Chiller}).
     */
    public static Optional<EntityType> fromLabel(String label) {
        if (label == null || !label.startsWith(LABEL_PREFIX)) {
            return Optional.empty();
        }
        String typeName = label.substring(LABEL_PREFIX.length());
        for (EntityType type : values()) {
            if (type.typeName.equals(typeName)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    /**
     * Looks up a type by type name or alias, case-insensitively, restricted to one category.
     * Aliases are only unique within a category ({@code Electrical} is both a system and a meter).
     */
    public static Optional<EntityType> fromTypeName(String name, EntityCategory category) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        String wanted = name.trim().toLowerCase(Locale.ROOT);
        for (EntityType type : values()) {
            if (category != null && type.category != category) {
                continue;
            }
            if (type.typeName.toLowerCase(Locale.ROOT).equals(wanted)
                    || type.name().toLowerCase(Locale.ROOT).equals(wanted)) {
                return Optional.of(type);
            }
            for (String alias : type.aliases) {
                if (alias.toLowerCase(Locale.ROOT).equals(wanted)) {
                    return Optional.of(type);
                }
            }
        }
        return Optional.empty();
    }

    /**
     * Looks up a type by label, type name, enum constant name or alias across all categories.
     */
    public static Optional<EntityType> parse(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        Optional<EntityType> byLabel = fromLabel(value.trim());
        if (byLabel.isPresent()) {
            return byLabel;
        }
        return fromTypeName(value, null);
    }
}
