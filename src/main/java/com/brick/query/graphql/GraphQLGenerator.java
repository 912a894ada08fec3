package com.brick.query.graphql;

import com.brick.query.core.model.EntityCategory;
import com.brick.query.core.model.EntityType;
import com.brick.query.core.model.ExtractedIntent;
import com.brick.query.core.model.FieldDefinition;
import com.brick.query.core.model.GeneratedQuery;
import com.brick.query.core.model.IntentKind;
import com.brick.query.graph.InputSanitizer;
import com.brick.query.ontology.BrickOntology;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Builds the structured (GraphQL-shaped) query for an extracted intent.
 *
 * <p>Output is a pure function of the input: identical intents always produce
 * byte-identical query text, variables and field lists. The query is never executed as
 * GraphQL; it is the contract handed to {@link com.brick.query.cypher.CypherResolver}.</p>
 *
 * <pre>
 * GraphQLGenerator generator = new GraphQLGenerator(BrickOntology.defaultOntology());
 * GeneratedQuery query = generator.generate(IntentKind.LIST, EntityType.TEMPERATURE_SENSOR, Map.of(), List.of());
 * // query ListSensors {
 * //   sensors(sensorType: "Temperature_Sensor") { ... }
 * // }
 * </pre>
 */
public class GraphQLGenerator {
    private static final Logger log = LoggerFactory.getLogger(GraphQLGenerator.class);

    private static final List<String> MINIMAL_FIELDS = List.of("id", "name");
    private static final List<String> OVERVIEW_FIELDS = List.of("id", "name", "address");
    private static final List<String> COUNT_FIELDS = List.of("count");

    private final BrickOntology ontology;
    private final List<TraversalShape> traversalShapes;

    public GraphQLGenerator(BrickOntology ontology) {
        this.ontology = Objects.requireNonNull(ontology, "ontology is required");
        this.traversalShapes = List.of(
                new TraversalShape("BuildingWithDetails", GraphQLGenerator::isBuildingScoped, this::buildingWithDetails),
                new TraversalShape("ZoneWithSensors", GraphQLGenerator::isZoneScoped, this::zoneWithSensors),
                new TraversalShape("SystemWithEquipment", GraphQLGenerator::isSystemScoped, this::systemWithEquipment),
                new TraversalShape("EquipmentWithZones", GraphQLGenerator::isEquipmentScoped, this::equipmentWithZones),
                new TraversalShape("SensorsWithTimeseries", GraphQLGenerator::isSensorScoped, this::sensorsWithTimeseries)
        );
    }

    public GeneratedQuery generate(ExtractedIntent intent) {
        return generate(intent.kind(), intent.entityType(), intent.parameters(), intent.requestedFields());
    }

    /**
     * Generates the structured query.
     *
     * @param kind            intent kind
     * @param entityType      primary entity, may be {@code null}
     * @param parameters      extracted filter values, may be {@code null}
     * @param requestedFields explicit field selection, may be {@code null} or empty
     */
    public GeneratedQuery generate(IntentKind kind, EntityType entityType,
                                   Map<String, Object> parameters, List<String> requestedFields) {
        Map<String, Object> params = parameters != null ? parameters : Map.of();
        List<String> requested = requestedFields != null ? requestedFields : List.of();

        GeneratedQuery query = switch (kind) {
            case ENTITY -> singleEntity(entityType, params, requested);
            case LIST -> list(entityType, params, requested);
            case TRAVERSE -> traverse(entityType, params);
            case AGGREGATE -> aggregate(entityType);
            case PATH, UNKNOWN -> overview();
        };
        log.debug("graphql.generated operation={} kind={} entity={}", query.operationName(), kind, entityType);
        return query;
    }

    // ========== Single entity ==========

    private GeneratedQuery singleEntity(EntityType entityType, Map<String, Object> params, List<String> requested) {
        EntityType entity = entityType != null ? entityType : EntityType.BUILDING;
        GraphQLType type = GraphQLType.forEntity(entity);
        List<String> fields = selectFields(entity, requested);

        List<String> args = new ArrayList<>();
        subTypeArgument(entity, type, args);
        Map<String, Object> variables = new LinkedHashMap<>();
        String id = stringParam(params, "id");
        if (id != null) {
            args.add("id: $id");
            variables.put("id", id);
        }
        String name = firstStringParam(params, "name", nameFallbackKey(type));
        if (name != null) {
            args.add("name: $name");
            variables.put("name", name);
        }

        String operation = "Get" + type.getTypeName();
        String text = render(operation, variables.keySet(), type.getSingularField(), args, QueryField.scalars(fields));
        return new GeneratedQuery(text, variables, operation,
                "Get " + type.getTypeName() + " by ID or name", fields);
    }

    // ========== List ==========

    private GeneratedQuery list(EntityType entityType, Map<String, Object> params, List<String> requested) {
        if (entityType == null) {
            String text = render("ListBuildings", Set.of(), GraphQLType.BUILDING.getPluralField(), List.of(),
                    QueryField.scalars(OVERVIEW_FIELDS));
            return new GeneratedQuery(text, Map.of(), "ListBuildings", "List all Buildings", OVERVIEW_FIELDS);
        }

        GraphQLType type = GraphQLType.forEntity(entityType);
        List<String> fields = selectFields(entityType, requested);
        List<String> args = new ArrayList<>();
        subTypeArgument(entityType, type, args);

        Map<String, Object> variables = new LinkedHashMap<>();
        String buildingId = stringParam(params, "building_id");
        if (buildingId != null && type != GraphQLType.BUILDING) {
            args.add("buildingId: $buildingId");
            variables.put("buildingId", buildingId);
        }

        String operation = "List" + type.getPluralName();
        String text = render(operation, variables.keySet(), type.getPluralField(), args, QueryField.scalars(fields));
        return new GeneratedQuery(text, variables, operation, "List all " + type.getPluralName(), fields);
    }

    // ========== Traversal ==========

    private GeneratedQuery traverse(EntityType entityType, Map<String, Object> params) {
        for (TraversalShape shape : traversalShapes) {
            if (shape.matches(entityType, params)) {
                return shape.build(entityType, params);
            }
        }
        return allSensors();
    }

    private static boolean isBuildingScoped(EntityType entity, Map<String, Object> params) {
        return entity == EntityType.BUILDING || entity == EntityType.FLOOR
                || (entity != null && entity.getCategory() == EntityCategory.METER)
                || stringParam(params, "building_name") != null;
    }

    private static boolean isZoneScoped(EntityType entity, Map<String, Object> params) {
        return entity == EntityType.HVAC_ZONE || entity == EntityType.ROOM
                || stringParam(params, "zone_name") != null;
    }

    private static boolean isSystemScoped(EntityType entity, Map<String, Object> params) {
        return entity != null && entity.getCategory() == EntityCategory.SYSTEM;
    }

    private static boolean isEquipmentScoped(EntityType entity, Map<String, Object> params) {
        return (entity != null && entity.isEquipment()) || stringParam(params, "equipment_name") != null;
    }

    private static boolean isSensorScoped(EntityType entity, Map<String, Object> params) {
        return entity != null && (entity.isSensor() || entity == EntityType.TIMESERIES);
    }

    private GeneratedQuery buildingWithDetails(EntityType entity, Map<String, Object> params) {
        Map<String, Object> variables = nameVariable(params, "building_name");
        List<String> args = variables.isEmpty() ? List.of() : List.of("name: $name");
        List<QueryField> selection = new ArrayList<>(QueryField.scalars("id", "name", "address", "areaSqm", "energyClass"));
        selection.add(QueryField.of("floors",
                QueryField.of("id"), QueryField.of("name"), QueryField.of("level"),
                QueryField.of("zones", QueryField.of("id"), QueryField.of("name"))));
        selection.add(QueryField.of("systems",
                QueryField.of("id"), QueryField.of("name"), QueryField.of("systemType"),
                QueryField.of("equipment", QueryField.of("id"), QueryField.of("name"), QueryField.of("equipmentType"))));
        selection.add(QueryField.of("meters", QueryField.of("id"), QueryField.of("name"), QueryField.of("meterType")));

        String text = render("BuildingWithDetails", variables.keySet(), "building", args, selection);
        return new GeneratedQuery(text, variables, "BuildingWithDetails", "Get building with all details",
                List.of("id", "name", "floors", "systems", "meters"));
    }

    private GeneratedQuery zoneWithSensors(EntityType entity, Map<String, Object> params) {
        Map<String, Object> variables = nameVariable(params, "zone_name");
        List<String> args = variables.isEmpty() ? List.of() : List.of("name: $name");
        List<QueryField> selection = new ArrayList<>(QueryField.scalars("id", "name"));
        selection.add(QueryField.of("sensors",
                QueryField.of("id"), QueryField.of("name"), QueryField.of("unit"), QueryField.of("sensorType"),
                QueryField.of("timeseries", QueryField.of("externalId"), QueryField.of("resolution"))));
        selection.add(QueryField.of("fedBy", QueryField.of("id"), QueryField.of("name"), QueryField.of("equipmentType")));

        String text = render("ZoneWithSensors", variables.keySet(), "zones", args, selection);
        return new GeneratedQuery(text, variables, "ZoneWithSensors", "Get zones with sensors",
                List.of("id", "name", "sensors", "fedBy"));
    }

    private GeneratedQuery systemWithEquipment(EntityType entity, Map<String, Object> params) {
        List<String> args = new ArrayList<>();
        args.add("systemType: \"" + entity.getTypeName() + "\"");
        List<QueryField> selection = new ArrayList<>(QueryField.scalars("id", "name", "systemType"));
        selection.add(QueryField.of("equipment",
                QueryField.of("id"), QueryField.of("name"), QueryField.of("equipmentType"),
                QueryField.of("sensors", QueryField.of("id"), QueryField.of("name"), QueryField.of("sensorType"))));

        String text = render("SystemWithEquipment", Set.of(), "systems", args, selection);
        return new GeneratedQuery(text, Map.of(), "SystemWithEquipment",
                "Get " + entity.getTypeName() + " with member equipment", List.of("id", "name", "systemType", "equipment"));
    }

    private GeneratedQuery equipmentWithZones(EntityType entity, Map<String, Object> params) {
        EntityType equipment = entity != null && entity.isEquipment() ? entity : EntityType.AIR_HANDLING_UNIT;
        // equipment_name literals ("ahu", "aggregat") name the family, not a unit
        Map<String, Object> variables = new LinkedHashMap<>();
        String name = stringParam(params, "name");
        if (name != null) {
            variables.put("name", name);
        }
        List<String> args = new ArrayList<>();
        args.add("equipmentType: \"" + equipment.getTypeName() + "\"");
        if (!variables.isEmpty()) {
            args.add("name: $name");
        }
        List<QueryField> selection = new ArrayList<>(
                QueryField.scalars("id", "name", "equipmentType", "manufacturer", "model"));
        selection.add(QueryField.of("zones", QueryField.of("id"), QueryField.of("name")));
        selection.add(QueryField.of("sensors",
                QueryField.of("id"), QueryField.of("name"), QueryField.of("unit"), QueryField.of("sensorType")));

        String text = render("EquipmentWithZones", variables.keySet(), "equipment", args, selection);
        return new GeneratedQuery(text, variables, "EquipmentWithZones",
                "Get " + equipment.getTypeName() + " with zones and sensors", List.of("id", "name", "zones", "sensors"));
    }

    private GeneratedQuery sensorsWithTimeseries(EntityType entity, Map<String, Object> params) {
        List<String> args = new ArrayList<>();
        String what = "all";
        if (entity != null && entity.isSensor()) {
            args.add("sensorType: \"" + entity.getTypeName() + "\"");
            what = entity.getTypeName();
        }
        List<QueryField> selection = new ArrayList<>(QueryField.scalars("id", "name", "unit", "sensorType"));
        selection.add(QueryField.of("timeseries",
                QueryField.of("id"), QueryField.of("externalId"), QueryField.of("resolution")));

        String text = render("SensorsWithTimeseries", Set.of(), "sensors", args, selection);
        return new GeneratedQuery(text, Map.of(), "SensorsWithTimeseries",
                "Get " + what + " sensors with timeseries", List.of("id", "name", "unit", "timeseries"));
    }

    private GeneratedQuery allSensors() {
        List<QueryField> selection = new ArrayList<>(QueryField.scalars("id", "name", "unit", "sensorType"));
        selection.add(QueryField.of("timeseries", QueryField.of("externalId")));
        String text = render("AllSensors", Set.of(), "sensors", List.of(), selection);
        return new GeneratedQuery(text, Map.of(), "AllSensors", "Get all sensors with timeseries",
                List.of("id", "name", "unit", "sensorType"));
    }

    // ========== Aggregate ==========

    private GeneratedQuery aggregate(EntityType entityType) {
        if (entityType == null) {
            return new GeneratedQuery("query CountSensors {\n  sensorCount\n}", Map.of(),
                    "CountSensors", "Count all sensors", COUNT_FIELDS);
        }
        if (entityType.isSensor()) {
            String text = "query CountSensors {\n  sensorCount(sensorType: \"" + entityType.getTypeName() + "\")\n}";
            return new GeneratedQuery(text, Map.of(), "CountSensors",
                    "Count " + entityType.getTypeName() + " sensors", COUNT_FIELDS);
        }
        if (entityType.isEquipment()) {
            String text = "query CountEquipment {\n  equipmentCount(equipmentType: \"" + entityType.getTypeName() + "\")\n}";
            return new GeneratedQuery(text, Map.of(), "CountEquipment",
                    "Count " + entityType.getTypeName() + " equipment", COUNT_FIELDS);
        }

        GraphQLType type = GraphQLType.forEntity(entityType);
        List<String> args = new ArrayList<>();
        subTypeArgument(entityType, type, args);
        String operation = "Count" + type.getPluralName();
        String text = render(operation, Set.of(), type.getPluralField(), args, QueryField.scalars("id"));
        return new GeneratedQuery(text, Map.of(), operation, "Count " + type.getPluralName(), COUNT_FIELDS);
    }

    // ========== Overview ==========

    private GeneratedQuery overview() {
        String text = render("Overview", Set.of(), GraphQLType.BUILDING.getPluralField(), List.of(),
                QueryField.scalars(OVERVIEW_FIELDS));
        return new GeneratedQuery(text, Map.of(), "Overview", "Get building overview", OVERVIEW_FIELDS);
    }

    // ========== Helpers ==========

    /**
     * Default selection for an entity: the ontology's scalar fields camel-cased, plus the
     * sub-type field for family types.
     */
    List<String> defaultFields(EntityType entityType) {
        GraphQLType type = GraphQLType.forEntity(entityType);
        Set<String> fields = new LinkedHashSet<>();
        ontology.getDefinition(entityType).ifPresent(definition -> {
            for (FieldDefinition field : definition.getScalarFields()) {
                fields.add(FieldNames.toCamelCase(field.name()));
            }
        });
        if (fields.isEmpty()) {
            fields.addAll(MINIMAL_FIELDS);
        }
        type.getSubTypeArgument().ifPresent(fields::add);
        return List.copyOf(fields);
    }

    private List<String> selectFields(EntityType entityType, List<String> requested) {
        Set<String> fields = new LinkedHashSet<>();
        for (String field : requested) {
            String camel = FieldNames.toCamelCase(field != null ? field.trim() : null);
            if (InputSanitizer.isIdentifier(camel)) {
                fields.add(camel);
            }
        }
        return fields.isEmpty() ? defaultFields(entityType) : List.copyOf(fields);
    }

    private static void subTypeArgument(EntityType entity, GraphQLType type, List<String> args) {
        type.getSubTypeArgument().ifPresent(arg -> args.add(arg + ": \"" + entity.getTypeName() + "\""));
    }

    private static String nameFallbackKey(GraphQLType type) {
        return switch (type) {
            case BUILDING -> "building_name";
            case HVAC_ZONE, ROOM -> "zone_name";
            case EQUIPMENT -> "equipment_name";
            default -> "name";
        };
    }

    private static Map<String, Object> nameVariable(Map<String, Object> params, String fallbackKey) {
        Map<String, Object> variables = new LinkedHashMap<>();
        String name = firstStringParam(params, "name", fallbackKey);
        if (name != null) {
            variables.put("name", name);
        }
        return variables;
    }

    private static String firstStringParam(Map<String, Object> params, String key, String fallbackKey) {
        String value = stringParam(params, key);
        return value != null ? value : stringParam(params, fallbackKey);
    }

    private static String stringParam(Map<String, Object> params, String key) {
        Object value = params.get(key);
        if (value == null) {
            return null;
        }
        String text = String.valueOf(value).trim();
        return text.isEmpty() ? null : text;
    }

    private static String render(String operation, Set<String> variableNames, String rootField,
                                 List<String> args, List<QueryField> selection) {
        StringBuilder out = new StringBuilder();
        out.append("query ").append(operation);
        if (!variableNames.isEmpty()) {
            out.append('(');
            out.append(String.join(", ", variableNames.stream().map(v -> "$" + v + ": String").toList()));
            out.append(')');
        }
        out.append(" {\n  ").append(rootField);
        if (!args.isEmpty()) {
            out.append('(').append(String.join(", ", args)).append(')');
        }
        out.append(" {\n");
        for (QueryField field : selection) {
            field.render(out, 0);
        }
        out.append("  }\n}");
        return out.toString();
    }
}
