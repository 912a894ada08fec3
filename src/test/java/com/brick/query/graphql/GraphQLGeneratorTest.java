package com.brick.query.graphql;

import com.brick.query.core.model.EntityType;
import com.brick.query.core.model.GeneratedQuery;
import com.brick.query.core.model.IntentKind;
import com.brick.query.ontology.BrickOntology;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("GraphQL Generator Tests")
class GraphQLGeneratorTest {

    private GraphQLGenerator generator;

    @BeforeEach
    void setUp() {
        generator = new GraphQLGenerator(BrickOntology.defaultOntology());
    }

    @Nested
    @DisplayName("List queries")
    class ListTests {

        @Test
        @DisplayName("temperature sensors should list sensors narrowed by type")
        void listTemperatureSensors() {
            GeneratedQuery query = generator.generate(IntentKind.LIST, EntityType.TEMPERATURE_SENSOR, Map.of(), List.of());

            assertEquals("ListSensors", query.operationName());
            assertTrue(query.queryText().startsWith("query ListSensors {"));
            assertTrue(query.queryText().contains("sensors(sensorType: \"Temperature_Sensor\")"));
            assertEquals(List.of("id", "name", "unit", "sensorType"), query.fields());
            assertTrue(query.variables().isEmpty());
        }

        @Test
        @DisplayName("building id should become a variable")
        void buildingScope() {
            GeneratedQuery query = generator.generate(IntentKind.LIST, EntityType.FLOOR,
                    Map.of("building_id", "building_opera"), List.of());

            assertEquals(Map.of("buildingId", "building_opera"), query.variables());
            assertTrue(query.queryText().contains("query ListFloors($buildingId: String)"));
            assertTrue(query.queryText().contains("floors(buildingId: $buildingId)"));
        }

        @Test
        @DisplayName("no entity should list buildings")
        void noEntity() {
            GeneratedQuery query = generator.generate(IntentKind.LIST, null, null, null);
            assertEquals("ListBuildings", query.operationName());
        }

        @Test
        @DisplayName("requested fields should be camel-cased and filtered to identifiers")
        void requestedFields() {
            GeneratedQuery query = generator.generate(IntentKind.LIST, EntityType.BUILDING, Map.of(),
                    List.of("energy_class", "area_sqm", "bad field", "name"));

            assertEquals(List.of("energyClass", "areaSqm", "name"), query.fields());
            assertFalse(query.queryText().contains("bad field"));
        }

        @Test
        @DisplayName("default fields should follow the ontology")
        void defaultFields() {
            assertEquals(List.of("id", "name", "level"), generator.defaultFields(EntityType.FLOOR));
            assertTrue(generator.defaultFields(EntityType.CHILLER).contains("equipmentType"));
            assertTrue(generator.defaultFields(EntityType.BUILDING).contains("yearBuilt"));
        }
    }

    @Nested
    @DisplayName("Aggregate queries")
    class AggregateTests {

        @Test
        @DisplayName("floors should be counted through a list of ids")
        void countFloors() {
            GeneratedQuery query = generator.generate(IntentKind.AGGREGATE, EntityType.FLOOR, Map.of(), List.of());

            assertEquals("CountFloors", query.operationName());
            assertEquals("query CountFloors {\n  floors {\n      id\n  }\n}", query.queryText());
            assertEquals(List.of("count"), query.fields());
        }

        @Test
        @DisplayName("sensors and equipment should use count roots")
        void countRoots() {
            assertEquals("query CountSensors {\n  sensorCount(sensorType: \"CO2_Sensor\")\n}",
                    generator.generate(IntentKind.AGGREGATE, EntityType.CO2_SENSOR, null, null).queryText());
            assertEquals("CountEquipment",
                    generator.generate(IntentKind.AGGREGATE, EntityType.PUMP, null, null).operationName());
            assertEquals("query CountSensors {\n  sensorCount\n}",
                    generator.generate(IntentKind.AGGREGATE, null, null, null).queryText());
        }
    }

    @Nested
    @DisplayName("Entity and traversal queries")
    class TraversalTests {

        @Test
        @DisplayName("single building lookup should bind the building name")
        void singleBuilding() {
            GeneratedQuery query = generator.generate(IntentKind.ENTITY, EntityType.BUILDING,
                    Map.of("building_name", "operahuset"), List.of("address"));

            assertEquals("GetBuilding", query.operationName());
            assertEquals(Map.of("name", "operahuset"), query.variables());
            assertTrue(query.queryText().contains("building(name: $name)"));
            assertFalse(query.queryText().contains("operahuset"));
        }

        @ParameterizedTest
        @CsvSource({
                "BUILDING, BuildingWithDetails",
                "ELECTRICAL_METER, BuildingWithDetails",
                "HVAC_ZONE, ZoneWithSensors",
                "HVAC_SYSTEM, SystemWithEquipment",
                "AIR_HANDLING_UNIT, EquipmentWithZones",
                "TEMPERATURE_SENSOR, SensorsWithTimeseries",
                "TIMESERIES, SensorsWithTimeseries"
        })
        @DisplayName("traversals should pick the shape for the entity")
        void traversalShapes(EntityType entity, String expectedOperation) {
            assertEquals(expectedOperation,
                    generator.generate(IntentKind.TRAVERSE, entity, Map.of(), List.of()).operationName());
        }

        @Test
        @DisplayName("parameters should choose the shape when no entity is known")
        void parameterScopedTraversal() {
            assertEquals("ZoneWithSensors", generator.generate(IntentKind.TRAVERSE, null,
                    Map.of("zone_name", "foyer"), List.of()).operationName());
            assertEquals("EquipmentWithZones", generator.generate(IntentKind.TRAVERSE, null,
                    Map.of("equipment_name", "ahu"), List.of()).operationName());
            assertEquals("AllSensors", generator.generate(IntentKind.TRAVERSE, null,
                    Map.of(), List.of()).operationName());
        }

        @Test
        @DisplayName("building traversal should nest floors, systems and meters")
        void buildingWithDetails() {
            String text = generator.generate(IntentKind.TRAVERSE, EntityType.BUILDING, Map.of(), List.of()).queryText();
            assertTrue(text.contains("floors {"));
            assertTrue(text.contains("systems {"));
            assertTrue(text.contains("meters {"));
        }

        @ParameterizedTest
        @EnumSource(value = IntentKind.class, names = {"PATH", "UNKNOWN"})
        @DisplayName("path and unknown intents should give the overview")
        void overview(IntentKind kind) {
            assertEquals("Overview", generator.generate(kind, EntityType.CHILLER, Map.of(), List.of()).operationName());
        }
    }

    @Test
    @DisplayName("generation should be deterministic")
    void deterministic() {
        for (IntentKind kind : IntentKind.values()) {
            for (EntityType type : EntityType.values()) {
                Map<String, Object> params = Map.of("name", "Foyer", "building_id", "b1");
                GeneratedQuery first = generator.generate(kind, type, params, List.of());
                GeneratedQuery second = generator.generate(kind, type, params, List.of());
                assertEquals(first, second, kind + "/" + type);
            }
        }
    }

    @Test
    @DisplayName("field names should convert between cases")
    void fieldNames() {
        assertEquals("areaSqm", FieldNames.toCamelCase("area_sqm"));
        assertEquals("area_sqm", FieldNames.toSnakeCase("areaSqm"));
        assertEquals("external_id", FieldNames.toSnakeCase("externalId"));
        assertEquals("id", FieldNames.toCamelCase("id"));
    }
}
