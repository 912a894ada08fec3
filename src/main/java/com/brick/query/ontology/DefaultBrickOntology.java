package com.brick.query.ontology;

import com.brick.query.core.model.EntityType;
import com.brick.query.core.model.IntentKind;

import java.util.List;

import static com.brick.query.core.model.FieldType.DECIMAL;
import static com.brick.query.core.model.FieldType.INTEGER;
import static com.brick.query.core.model.FieldType.STRING;
import static com.brick.query.core.model.QueryLocale.EN;
import static com.brick.query.core.model.QueryLocale.NO;

/**
 * The built-in Brick catalogue for Norwegian and English questions.
 *
 * <p>Entities are declared from most specific to least specific: sub-locations, systems,
 * equipment, meters, sensors, timeseries, and finally the building. Entity lookup returns
 * the first definition with a matching term, so a question mentioning both floors and the
 * building ("Hvor mange etasjer har bygningen?") resolves to the floor.</p>
 */
public final class DefaultBrickOntology {

    private static final BrickOntology INSTANCE = build();

    private DefaultBrickOntology() {
        // Utility class
    }

    /**
     * Returns the shared default ontology.
     */
    public static BrickOntology create() {
        return INSTANCE;
    }

    private static BrickOntology build() {
        BrickOntology.Builder builder = BrickOntology.builder();
        getEntityDefinitions().forEach(builder::entity);
        getTraversalPatterns().forEach(builder::traversal);
        getIntentRules().forEach(builder::intentRule);
        return builder.build();
    }

    // ========== Entities ==========

    public static List<EntityDefinition> getEntityDefinitions() {
        return List.of(
                // Locations below building level
                EntityDefinition.builder(EntityType.FLOOR, "Floor")
                        .description("A storey of a building")
                        .field("id", STRING, "Unique identifier")
                        .field("name", STRING, "Floor name")
                        .field("level", INTEGER, "Floor number, 1 is the ground floor")
                        .relation("zones", EntityType.HVAC_ZONE, "HVAC zones on the floor")
                        .synonyms(NO, "etasje", "plan", "nivå")
                        .synonyms(EN, "floor", "level", "storey")
                        .build(),
                EntityDefinition.builder(EntityType.HVAC_ZONE, "HVAC Zone")
                        .description("An area served by the same ventilation supply")
                        .field("id", STRING, "Unique identifier")
                        .field("name", STRING, "Zone name")
                        .relation("sensors", EntityType.TEMPERATURE_SENSOR, "Sensors located in the zone")
                        .relation("fedBy", EntityType.AIR_HANDLING_UNIT, "Equipment feeding the zone")
                        .synonyms(NO, "sone", "ventilasjonssone", "hvac-sone", "område")
                        .synonyms(EN, "zone", "hvac zone", "space")
                        .build(),
                EntityDefinition.builder(EntityType.ROOM, "Room")
                        .description("A single room")
                        .field("id", STRING, "Unique identifier")
                        .field("name", STRING, "Room name")
                        .field("area_sqm", DECIMAL, "Floor area in square metres")
                        .relation("sensors", EntityType.TEMPERATURE_SENSOR, "Sensors in the room")
                        .synonyms(NO, "rommet", "rommene", "kontor")
                        .synonyms(EN, "room", "office")
                        .build(),

                // Systems
                system(EntityType.HVAC_SYSTEM, "HVAC System", "Heating, ventilation and air conditioning",
                        new String[]{"ventilasjonsanlegg", "ventilasjonssystem", "klimaanlegg", "hvac-anlegg", "hvac"},
                        new String[]{"hvac system", "ventilation system", "climate system", "hvac"}),
                system(EntityType.ELECTRICAL_SYSTEM, "Electrical System", "Power distribution",
                        new String[]{"elektrisk anlegg", "elektrisk system", "elanlegg", "el-anlegg"},
                        new String[]{"electrical system", "electric system", "power system"}),
                system(EntityType.LIGHTING_SYSTEM, "Lighting System", "Lighting and lighting control",
                        new String[]{"belysningsanlegg", "lysanlegg", "belysning"},
                        new String[]{"lighting system", "lighting"}),
                system(EntityType.HOT_WATER_SYSTEM, "Hot Water System", "Domestic hot water",
                        new String[]{"varmtvannsanlegg", "tappevann", "varmtvann"},
                        new String[]{"hot water system", "domestic hot water", "hot water"}),

                // Equipment
                EntityDefinition.builder(EntityType.AIR_HANDLING_UNIT, "Air Handling Unit")
                        .description("Central ventilation unit supplying conditioned air")
                        .field("id", STRING, "Unique identifier")
                        .field("name", STRING, "Equipment name")
                        .field("manufacturer", STRING, "Manufacturer")
                        .field("model", STRING, "Model designation")
                        .field("capacity", DECIMAL, "Rated air volume")
                        .field("capacity_unit", STRING, "Unit of the rated capacity")
                        .relation("zones", EntityType.HVAC_ZONE, "Zones fed by the unit")
                        .relation("sensors", EntityType.TEMPERATURE_SENSOR, "Points on the unit")
                        .synonyms(NO, "aggregat", " ahu ", " ahu-", "luftbehandler", "ventilasjonsenhet")
                        .synonyms(EN, "air handling unit", "air handler")
                        .build(),
                equipment(EntityType.VAV, "VAV", "Variable air volume terminal",
                        new String[]{"vav-spjeld", "vav"},
                        new String[]{"vav box", "variable air volume"}),
                equipment(EntityType.CHILLER, "Chiller", "Produces chilled water for cooling",
                        new String[]{"kjølemaskin", "chiller", "kjøleanlegg"},
                        new String[]{"chiller", "cooling unit", "cooling machine"}),
                equipment(EntityType.BOILER, "Boiler", "Produces hot water for heating",
                        new String[]{"varmekjel", "fyrkjel", "kjeleanlegg"},
                        new String[]{"boiler"}),
                equipment(EntityType.PUMP, "Pump", "Circulates water in a loop",
                        new String[]{"pumpe", "sirkulasjonspumpe", "vannpumpe"},
                        new String[]{"pump", "circulation pump"}),
                equipment(EntityType.FAN, "Ventilation Fan", "Supply or exhaust fan",
                        new String[]{"vifte", "ventilator"},
                        new String[]{"exhaust fan", "supply fan"}),

                // Meters
                meter(EntityType.ELECTRICAL_METER, "Electrical Meter", "Measures electricity consumption",
                        new String[]{"strømmåler", "elmåler", "elektrisitetsmåler", "hovedmåler"},
                        new String[]{"electrical meter", "electricity meter", "power meter"}),
                meter(EntityType.THERMAL_ENERGY_METER, "Thermal Energy Meter", "Measures delivered heating or cooling energy",
                        new String[]{"energimåler", "varmemåler", "termisk måler"},
                        new String[]{"thermal meter", "heat meter"}),
                meter(EntityType.WATER_METER, "Water Meter", "Measures water consumption",
                        new String[]{"vannmåler"},
                        new String[]{"water meter"}),

                // Sensors
                sensor(EntityType.TEMPERATURE_SENSOR, "Temperature Sensor",
                        new String[]{"temperatursensor", "temperaturføler", "temperatur", "temp"},
                        new String[]{"temperature sensor", "temp sensor", "temperature"}),
                sensor(EntityType.HUMIDITY_SENSOR, "Humidity Sensor",
                        new String[]{"fuktsensor", "fuktighetssensor", "luftfuktighet", "fuktighet"},
                        new String[]{"humidity sensor", "humidity"}),
                sensor(EntityType.CO2_SENSOR, "CO2 Sensor",
                        new String[]{"co2-sensor", "co2", "luftkvalitet"},
                        new String[]{"co2 sensor", "carbon dioxide sensor", "air quality"}),
                sensor(EntityType.POWER_SENSOR, "Power Sensor",
                        new String[]{"effektsensor", "effektmåler", "wattmåler", "effekt"},
                        new String[]{"power sensor", "watt sensor", "power"}),
                sensor(EntityType.ENERGY_SENSOR, "Energy Sensor",
                        new String[]{"energisensor", "energimåling", "energiforbruk"},
                        new String[]{"energy sensor", "energy consumption"}),
                sensor(EntityType.FLOW_SENSOR, "Flow Sensor",
                        new String[]{"strømningssensor", "flowsensor", "luftmengde"},
                        new String[]{"flow sensor", "air flow"}),
                sensor(EntityType.PRESSURE_SENSOR, "Pressure Sensor",
                        new String[]{"trykksensor", "trykkmåler", "trykk"},
                        new String[]{"pressure sensor", "pressure"}),

                EntityDefinition.builder(EntityType.TIMESERIES, "Timeseries")
                        .description("Stored measurements of a point")
                        .field("id", STRING, "Unique identifier")
                        .field("external_id", STRING, "Identifier in the timeseries store")
                        .field("resolution", STRING, "Sampling interval, e.g. 15min")
                        .synonyms(NO, "tidsserie", "data", "målinger", "historikk")
                        .synonyms(EN, "timeseries", "time series", "data", "measurements", "history")
                        .build(),

                EntityDefinition.builder(EntityType.BUILDING, "Building")
                        .description("A building, the root of the location hierarchy")
                        .field("id", STRING, "Unique identifier")
                        .field("name", STRING, "Building name")
                        .field("description", STRING, "Free-text description")
                        .field("address", STRING, "Street address")
                        .field("area_sqm", DECIMAL, "Gross floor area in square metres")
                        .field("year_built", INTEGER, "Year of completion")
                        .field("energy_class", STRING, "Energy rating A-G")
                        .relation("floors", EntityType.FLOOR, "Floors of the building")
                        .relation("systems", EntityType.HVAC_SYSTEM, "Technical systems")
                        .relation("meters", EntityType.ELECTRICAL_METER, "Meters metering the building")
                        .synonyms(NO, "bygning", "bygg", "hus", "operahus")
                        .synonyms(EN, "building", "facility", "structure")
                        .build()
        );
    }

    // ========== Traversals ==========

    public static List<TraversalPattern> getTraversalPatterns() {
        return List.of(
                new TraversalPattern("building_sensors", "Alle sensorer i en bygning",
                        "Building -> System -> Equipment -> Sensor",
                        List.of("building", "system", "equipment", "sensor"),
                        List.of("sensorer i bygg", "sensors in building", "alle sensorer")),
                new TraversalPattern("zone_sensors", "Sensorer i en HVAC-sone",
                        "HVAC Zone -> Sensor",
                        List.of("zone", "sensor"),
                        List.of("sensorer i sone", "sensors in zone", "sone sensor")),
                new TraversalPattern("equipment_timeseries", "Tidsserier for utstyr",
                        "Equipment -> Sensor -> Timeseries",
                        List.of("equipment", "sensor", "timeseries"),
                        List.of("tidsserie", "timeseries", "data for", "målinger")),
                new TraversalPattern("ahu_zones", "Soner som mates av et ventilasjonsaggregat",
                        "Air Handling Unit -> HVAC Zone",
                        List.of("ahu", "zone"),
                        List.of("soner som", "zones fed", "mater", "feeds")),
                new TraversalPattern("building_meters", "Målere i en bygning",
                        "Building -> Meter",
                        List.of("building", "meter"),
                        List.of("målere", "meters", "strømmåler", "electrical meter")),
                new TraversalPattern("full_hierarchy", "Komplett hierarki for en bygning",
                        "Building -> Floor -> Zone -> Equipment -> Sensor",
                        List.of("building", "floor", "zone", "equipment", "sensor"),
                        List.of("hierarki", "hierarchy", "full oversikt", "alt i"))
        );
    }

    // ========== Intent keywords ==========

    /**
     * Aggregate questions are checked first so "hvor mange" wins over list phrasing;
     * entity lookups are checked last because their triggers ("finn", "get") are the broadest.
     */
    public static List<IntentKeywordRule> getIntentRules() {
        return List.of(
                IntentKeywordRule.builder()
                        .kind(IntentKind.AGGREGATE)
                        .priority(10)
                        .keywords("hvor mange", "antall", "totalt", "sum", "gjennomsnitt", "tell opp",
                                "how many", "count", "total", "average", "number of")
                        .build(),
                IntentKeywordRule.builder()
                        .kind(IntentKind.PATH)
                        .priority(20)
                        .keywords("vei mellom", "sti fra", "kobling mellom", "forbindelse mellom",
                                "path between", "path from", "connection between", "link between")
                        .build(),
                IntentKeywordRule.builder()
                        .kind(IntentKind.TRAVERSE)
                        .priority(30)
                        .keywords("sensorer i", "utstyr i", "soner som", "som mater", "koblet til",
                                "relatert til", "i bygget", "i sonen", "tilhører",
                                "sensors in", "equipment in", "zones that", "zones fed", "feeds",
                                "connected to", "related to", "in the building", "in zone", "belongs to")
                        .build(),
                IntentKeywordRule.builder()
                        .kind(IntentKind.LIST)
                        .priority(40)
                        .keywords("vis alle", "list opp", "list alle", "hvilke", "gi meg alle", "hent alle",
                                "show all", "list all", "which", "give me all", "get all", "what are the")
                        .build(),
                IntentKeywordRule.builder()
                        .kind(IntentKind.ENTITY)
                        .priority(50)
                        .keywords("hva er", "vis meg", "finn", "hent", "gi meg info om", "detaljer om",
                                "informasjon om", "når ble", "hva heter",
                                "what is", "show me", "find", "get", "give me info about", "details about",
                                "information about", "when was")
                        .build()
        );
    }

    // ========== Helpers ==========

    private static EntityDefinition system(EntityType type, String name, String description,
                                           String[] norwegian, String[] english) {
        return EntityDefinition.builder(type, name)
                .description(description)
                .field("id", STRING, "Unique identifier")
                .field("name", STRING, "System name")
                .field("description", STRING, "Free-text description")
                .relation("equipment", EntityType.AIR_HANDLING_UNIT, "Member equipment")
                .synonyms(NO, norwegian)
                .synonyms(EN, english)
                .build();
    }

    private static EntityDefinition equipment(EntityType type, String name, String description,
                                              String[] norwegian, String[] english) {
        return EntityDefinition.builder(type, name)
                .description(description)
                .field("id", STRING, "Unique identifier")
                .field("name", STRING, "Equipment name")
                .field("manufacturer", STRING, "Manufacturer")
                .field("model", STRING, "Model designation")
                .relation("sensors", EntityType.TEMPERATURE_SENSOR, "Points on the equipment")
                .synonyms(NO, norwegian)
                .synonyms(EN, english)
                .build();
    }

    private static EntityDefinition meter(EntityType type, String name, String description,
                                          String[] norwegian, String[] english) {
        return EntityDefinition.builder(type, name)
                .description(description)
                .field("id", STRING, "Unique identifier")
                .field("name", STRING, "Meter name")
                .field("unit", STRING, "Unit of measurement")
                .relation("sensors", EntityType.POWER_SENSOR, "Points on the meter")
                .synonyms(NO, norwegian)
                .synonyms(EN, english)
                .build();
    }

    private static EntityDefinition sensor(EntityType type, String name,
                                           String[] norwegian, String[] english) {
        return EntityDefinition.builder(type, name)
                .description(name + " point")
                .field("id", STRING, "Unique identifier")
                .field("name", STRING, "Sensor name")
                .field("unit", STRING, "Unit of measurement")
                .relation("timeseries", EntityType.TIMESERIES, "Stored measurements")
                .synonyms(NO, norwegian)
                .synonyms(EN, english)
                .build();
    }
}
