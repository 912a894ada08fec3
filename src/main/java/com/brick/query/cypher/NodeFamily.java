package com.brick.query.cypher;

import com.brick.query.core.model.EntityCategory;
import com.brick.query.core.model.EntityType;
import com.brick.query.core.model.RelationType;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * The node families the resolver can match, with everything needed to build their
 * Cypher: variable and return alias, candidate labels, sub-type argument, parent scopes,
 * default projection and one-hop relations.
 *
 * <p>Scope templates use {@code %X} for the family's own node pattern.</p>
 */
enum NodeFamily {

    BUILDING("b", "building", "buildings", null, null,
            List.of("id", "name", "description", "address", "area_sqm", "year_built", "energy_class"),
            List.of()),

    FLOOR("f", "floor", "floors", null, null,
            List.of("id", "name", "level"),
            List.of(new Scope("buildingId", "(:brick_Building {id: $buildingId})-[:brick_hasPart]->%X", "building"))),

    ZONE("z", "zone", "zones", null, null,
            List.of("id", "name"),
            List.of(new Scope("floorId", "(:brick_Floor {id: $floorId})-[:brick_hasPart]->%X", "floor"),
                    new Scope("buildingId",
                            "(:brick_Building {id: $buildingId})-[:brick_hasPart]->(:brick_Floor)-[:brick_hasPart]->%X",
                            "building"))),

    ROOM("r", "room", "rooms", null, null,
            List.of("id", "name"),
            List.of(new Scope("zoneId", "(:brick_HVAC_Zone {id: $zoneId})-[:brick_hasPart]->%X", "zone"),
                    new Scope("floorId", "(:brick_Floor {id: $floorId})-[:brick_hasPart]->%X", "floor"))),

    SYSTEM("sys", "system", "systems", "systemType", EntityCategory.SYSTEM,
            List.of("id", "name", "systemType"),
            List.of(new Scope("buildingId", "(:brick_Building {id: $buildingId})-[:brick_hasPart]->%X", "building"))),

    EQUIPMENT("eq", "equipment", "equipment", "equipmentType", EntityCategory.EQUIPMENT,
            List.of("id", "name", "equipmentType", "manufacturer", "model"),
            List.of(new Scope("systemId", "({id: $systemId})-[:brick_hasMember]->%X", "system"),
                    new Scope("buildingId",
                            "(:brick_Building {id: $buildingId})-[:brick_hasPart]->()-[:brick_hasMember]->%X",
                            "building"))),

    SENSOR("s", "sensor", "sensors", "sensorType", EntityCategory.SENSOR,
            List.of("id", "name", "unit", "sensorType"),
            List.of(new Scope("zoneId", "(:brick_HVAC_Zone {id: $zoneId})-[:brick_hasPoint]->%X", "zone"),
                    new Scope("equipmentId", "({id: $equipmentId})-[:brick_hasPoint]->%X", "equipment"))),

    METER("m", "meter", "meters", "meterType", EntityCategory.METER,
            List.of("id", "name", "unit", "meterType"),
            List.of(new Scope("buildingId", "(:brick_Building {id: $buildingId})-[:brick_isMeteredBy]->%X", "building"))),

    TIMESERIES("ts", "timeseries", "timeseries", null, null,
            List.of("id", "external_id", "resolution"),
            List.of(new Scope("sensorId", "({id: $sensorId})-[:brick_hasTimeseries]->%X", "sensor")));

    /**
     * Restricts a family to nodes reachable from a parent identified by a scope input.
     *
     * @param key      input key in camelCase; the snake_case alias is accepted too
     * @param template path ending in {@code %X}
     * @param noun     parent name used in query descriptions
     */
    record Scope(String key, String template, String noun) {
    }

    /**
     * A one-hop relation selectable as a nested field.
     */
    record Hop(RelationType relation, boolean outgoing, NodeFamily target) {

        String pattern(String from, String to) {
            String edge = "-[:" + relation.getLabel() + "]-";
            return outgoing
                    ? "(" + from + ")" + edge + ">(" + to + ")"
                    : "(" + to + ")" + edge + ">(" + from + ")";
        }
    }

    private final String variable;
    private final String alias;
    private final String plural;
    private final String subTypeField;
    private final EntityCategory category;
    private final List<String> defaultProjection;
    private final List<Scope> scopes;

    NodeFamily(String variable, String alias, String plural, String subTypeField, EntityCategory category,
               List<String> defaultProjection, List<Scope> scopes) {
        this.variable = variable;
        this.alias = alias;
        this.plural = plural;
        this.subTypeField = subTypeField;
        this.category = category;
        this.defaultProjection = defaultProjection;
        this.scopes = scopes;
    }

    String variable() {
        return variable;
    }

    String alias() {
        return alias;
    }

    String plural() {
        return plural;
    }

    Optional<String> subTypeField() {
        return Optional.ofNullable(subTypeField);
    }

    Optional<EntityCategory> category() {
        return Optional.ofNullable(category);
    }

    List<String> defaultProjection() {
        return defaultProjection;
    }

    List<Scope> scopes() {
        return scopes;
    }

    /**
     * Labels a node of this family may carry when no sub-type narrows it.
     */
    List<String> labels() {
        return switch (this) {
            case BUILDING -> List.of(EntityType.BUILDING.getLabel());
            case FLOOR -> List.of(EntityType.FLOOR.getLabel());
            case ZONE -> List.of(EntityType.HVAC_ZONE.getLabel());
            case ROOM -> List.of(EntityType.ROOM.getLabel());
            case TIMESERIES -> List.of(EntityType.TIMESERIES.getLabel());
            default -> Arrays.stream(EntityType.values())
                    .filter(t -> t.getCategory() == category)
                    .map(EntityType::getLabel)
                    .toList();
        };
    }

    /**
     * Relations reachable from this family by nested field name.
     */
    Optional<Hop> hop(String field) {
        Hop hop = switch (this) {
            case BUILDING -> switch (field) {
                case "floors" -> new Hop(RelationType.HAS_PART, true, FLOOR);
                case "systems" -> new Hop(RelationType.HAS_PART, true, SYSTEM);
                case "meters" -> new Hop(RelationType.IS_METERED_BY, true, METER);
                default -> null;
            };
            case FLOOR -> switch (field) {
                case "zones" -> new Hop(RelationType.HAS_PART, true, ZONE);
                case "rooms" -> new Hop(RelationType.HAS_PART, true, ROOM);
                default -> null;
            };
            case ZONE -> switch (field) {
                case "sensors" -> new Hop(RelationType.HAS_POINT, true, SENSOR);
                case "fedBy" -> new Hop(RelationType.FEEDS, false, EQUIPMENT);
                case "rooms" -> new Hop(RelationType.HAS_PART, true, ROOM);
                default -> null;
            };
            case ROOM -> "sensors".equals(field) ? new Hop(RelationType.HAS_POINT, true, SENSOR) : null;
            case SYSTEM -> "equipment".equals(field) ? new Hop(RelationType.HAS_MEMBER, true, EQUIPMENT) : null;
            case EQUIPMENT -> switch (field) {
                case "sensors" -> new Hop(RelationType.HAS_POINT, true, SENSOR);
                case "zones" -> new Hop(RelationType.FEEDS, true, ZONE);
                default -> null;
            };
            case SENSOR -> "timeseries".equals(field) ? new Hop(RelationType.HAS_TIMESERIES, true, TIMESERIES) : null;
            case METER -> switch (field) {
                case "sensors" -> new Hop(RelationType.HAS_POINT, true, SENSOR);
                case "timeseries" -> new Hop(RelationType.HAS_TIMESERIES, true, TIMESERIES);
                default -> null;
            };
            case TIMESERIES -> null;
        };
        return Optional.ofNullable(hop);
    }
}
