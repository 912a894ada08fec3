package com.brick.query.format;

import com.brick.query.core.model.IntentKind;
import com.brick.query.core.model.QueryLocale;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Response Formatter Tests")
class ResponseFormatterTest {

    private ResponseFormatter formatter;

    @BeforeEach
    void setUp() {
        formatter = new ResponseFormatter();
    }

    private static Map<String, Object> sensor(int i) {
        Map<String, Object> sensor = new LinkedHashMap<>();
        sensor.put("id", "sensor_" + i);
        sensor.put("name", "T" + i);
        sensor.put("unit", "°C");
        sensor.put("sensorType", "brick_Temperature_Sensor");
        return Map.of("sensor", sensor);
    }

    @Nested
    @DisplayName("Aggregate")
    class AggregateTests {

        @Test
        @DisplayName("count column should be reported")
        void countColumn() {
            List<Map<String, Object>> rows = List.of(Map.of("count", 3L));
            assertEquals("Antall: 3", formatter.format(rows, IntentKind.AGGREGATE, "Hvor mange etasjer?", null, QueryLocale.NO));
            assertEquals("Count: 3", formatter.format(rows, IntentKind.AGGREGATE, "How many floors?", null, QueryLocale.EN));
        }

        @Test
        @DisplayName("rows without a count column should be counted")
        void rowCount() {
            List<Map<String, Object>> rows = List.of(
                    Map.of("floor", Map.of("id", "f1")),
                    Map.of("floor", Map.of("id", "f2")),
                    Map.of("floor", Map.of("id", "f3")));
            assertEquals("Antall: 3", formatter.format(rows, IntentKind.AGGREGATE,
                    "Hvor mange etasjer har bygningen?", "Count Floors", QueryLocale.NO));
        }

        @Test
        @DisplayName("whole doubles should be shown without decimals")
        void wholeDouble() {
            assertEquals("Antall: 4", formatter.format(List.of(Map.of("count", 4.0)),
                    IntentKind.AGGREGATE, "antall", null, QueryLocale.NO));
        }
    }

    @Nested
    @DisplayName("Empty results")
    class EmptyTests {

        @ParameterizedTest
        @EnumSource(IntentKind.class)
        @DisplayName("every renderer should answer an empty result with the no-results sentence")
        void emptyResult(IntentKind kind) {
            assertEquals(ResponseMessages.NORWEGIAN.noResults(),
                    formatter.format(List.of(), kind, "q", null, QueryLocale.NO));
            assertEquals(ResponseMessages.ENGLISH.noResults(),
                    formatter.format(null, kind, "q", null, QueryLocale.EN));
        }

        @Test
        @DisplayName("rows holding only nulls and empty lists should count as empty")
        void onlyNulls() {
            Map<String, Object> row = new HashMap<>();
            row.put("sensor", null);
            row.put("timeseries", List.of());
            assertEquals(ResponseMessages.NORWEGIAN.noResults(),
                    formatter.format(List.of(row), IntentKind.LIST, "q", null, QueryLocale.NO));
        }
    }

    @Nested
    @DisplayName("List")
    class ListTests {

        @Test
        @DisplayName("list lines should show the name and labelled fields")
        void listLines() {
            String text = formatter.format(List.of(sensor(1), sensor(2)), IntentKind.LIST,
                    "List alle temperatursensorer", "Get Temperature_Sensor sensors", QueryLocale.NO);

            assertTrue(text.startsWith("Fant 2 resultater:"));
            assertTrue(text.contains("  1. T1 | Enhet: °C | Type: Temperature Sensor"), text);
            assertTrue(text.contains("  2. T2"));
        }

        @Test
        @DisplayName("long lists should be truncated with a trailer")
        void truncated() {
            List<Map<String, Object>> rows = new ArrayList<>();
            for (int i = 1; i <= 20; i++) {
                rows.add(sensor(i));
            }

            String text = formatter.format(rows, IntentKind.LIST, "show all sensors", null, QueryLocale.EN);

            assertTrue(text.startsWith("Found 20 results:"));
            assertTrue(text.contains("  15. T15"));
            assertFalse(text.contains("  16. T16"));
            assertTrue(text.endsWith("... and 5 more results"));
        }

        @Test
        @DisplayName("custom limits should be honoured")
        void customLimits() {
            ResponseFormatter tight = new ResponseFormatter(new FormatterLimits(2, 2, 1, 1, 1));
            List<Map<String, Object>> rows = List.of(sensor(1), sensor(2), sensor(3));

            String text = tight.format(rows, IntentKind.LIST, "q", null, QueryLocale.NO);

            assertTrue(text.contains("  1. T1 | Enhet: °C"));
            assertFalse(text.contains("Type:"));
            assertTrue(text.endsWith("... og 1 flere resultater"));
        }

        @Test
        @DisplayName("list values should be inlined and truncated")
        void inlineLists() {
            Map<String, Object> zone = new LinkedHashMap<>();
            zone.put("name", "Foyer");
            zone.put("sensors", List.of(Map.of("name", "A"), Map.of("name", "B"), Map.of("name", "C"), Map.of("name", "D")));

            String text = formatter.format(List.of(Map.of("zone", zone)), IntentKind.LIST, "q", null, QueryLocale.EN);

            assertTrue(text.contains("1. Foyer | Sensors: A, B, C ... +1 more"), text);
        }
    }

    @Nested
    @DisplayName("Entity")
    class EntityTests {

        @Test
        @DisplayName("entity should list its fields and nested items")
        void entity() {
            Map<String, Object> building = new LinkedHashMap<>();
            building.put("id", "building_opera");
            building.put("name", "Operahuset");
            building.put("year_built", 2008L);
            List<Map<String, Object>> floors = new ArrayList<>();
            for (int i = 1; i <= 6; i++) {
                floors.add(Map.of("name", "Plan " + i, "level", i));
            }
            building.put("floors", floors);

            String text = formatter.format(List.of(Map.of("building", building)), IntentKind.ENTITY,
                    "Vis bygningen", null, QueryLocale.NO);

            List<String> lines = Arrays.asList(text.split("\n"));
            assertEquals("Operahuset", lines.get(0));
            assertTrue(lines.contains("  Byggeår: 2008"));
            assertTrue(lines.contains("  Etasjer:"));
            assertTrue(lines.contains("    • Plan 1 (1)"));
            assertFalse(lines.contains("    • Plan 6 (6)"));
            assertTrue(lines.contains("    ... +1 mer"));
        }

        @Test
        @DisplayName("question about one field should be answered directly")
        void singleField() {
            Map<String, Object> building = Map.of("name", "Operahuset", "address", "Kirsten Flagstads plass 1");

            assertEquals("Adressen er: Kirsten Flagstads plass 1", formatter.format(
                    List.of(Map.of("building", building)), IntentKind.ENTITY,
                    "Hva er bygningens adresse?", null, QueryLocale.NO));
            assertEquals("The address is: Kirsten Flagstads plass 1", formatter.format(
                    List.of(Map.of("building", building)), IntentKind.ENTITY,
                    "What is the building address?", null, QueryLocale.EN));
        }

        @Test
        @DisplayName("field answers should search nested values")
        void nestedFieldAnswer() {
            Map<String, Object> row = Map.of("b", Map.of("details", Map.of("energy_class", "A")), "other", "x");
            assertEquals(java.util.Optional.of("Energimerket er: A"),
                    formatter.answerField(List.of(row), "Hva er energimerket?"));
        }
    }

    @Nested
    @DisplayName("Traversal")
    class TraversalTests {

        @Test
        @DisplayName("traversal should use the query description and nest related items")
        void traversal() {
            Map<String, Object> zone = new LinkedHashMap<>();
            zone.put("id", "zone_foyer");
            zone.put("name", "Foyer");
            zone.put("sensors", List.of(Map.of("name", "T1", "sensorType", "brick_Temperature_Sensor")));
            zone.put("tags", List.of("public", "ground"));

            String text = formatter.format(List.of(Map.of("zone", zone)), IntentKind.TRAVERSE,
                    "Sensorer i Foyer", "Get zones with sensors", QueryLocale.NO);

            assertEquals(String.join("\n",
                    "Get zones with sensors",
                    "",
                    "  • Foyer",
                    "      Sensorer:",
                    "        - T1 (Temperature Sensor)",
                    "      Tags: public, ground"), text);
        }

        @Test
        @DisplayName("missing description should fall back to the results header")
        void header() {
            String text = formatter.format(List.of(Map.of("name", "X")), IntentKind.PATH, "q", " ", QueryLocale.EN);
            assertTrue(text.startsWith("Results\n"));
        }
    }

    @Nested
    @DisplayName("Replies")
    class ReplyTests {

        @Test
        @DisplayName("low confidence should quote the question")
        void lowConfidence() {
            String no = formatter.lowConfidence("Hei", QueryLocale.NO);
            assertTrue(no.startsWith("Beklager, jeg forstod ikke helt spørsmålet: \"Hei\""));
            assertTrue(formatter.lowConfidence("Hi", QueryLocale.EN).startsWith("Sorry, I didn't understand: \"Hi\""));
        }

        @Test
        @DisplayName("error replies should carry the error in the request language")
        void errors() {
            assertTrue(formatter.connectionError("refused", QueryLocale.NO).startsWith("Kunne ikke koble til FalkorDB: refused"));
            assertTrue(formatter.connectionError("refused", QueryLocale.EN).startsWith("Could not connect to FalkorDB: refused"));
            assertEquals("Query execution error: syntax", formatter.queryError("syntax", QueryLocale.EN));
            assertEquals("Kunne ikke lage en spørring for spørsmålet: bad", formatter.resolutionError("bad", QueryLocale.NO));
        }
    }

    @Nested
    @DisplayName("Helpers")
    class HelperTests {

        @Test
        @DisplayName("labels should be shown without namespace")
        void display() {
            assertEquals("Temperature Sensor", ResponseFormatter.display("brick_Temperature_Sensor"));
            assertEquals("2.5", ResponseFormatter.display(2.5));
            assertEquals("12", ResponseFormatter.display(12.0));
        }

        @Test
        @DisplayName("field labels should translate or title-case")
        void fieldLabels() {
            assertEquals("Energimerke", ResponseMessages.NORWEGIAN.fieldLabel("energy_class"));
            assertEquals("External ID", ResponseMessages.ENGLISH.fieldLabel("external_id"));
            assertEquals("Supply Temp", ResponseMessages.ENGLISH.fieldLabel("supplyTemp"));
            assertEquals("Unit", ResponseMessages.ENGLISH.fieldLabel("unit"));
        }

        @Test
        @DisplayName("limits below one should be rejected")
        void limits() {
            assertThrows(IllegalArgumentException.class, () -> new FormatterLimits(0, 1, 1, 1, 1));
            assertThrows(IllegalArgumentException.class, () -> new FormatterLimits(1, 1, 1, 1, -1));
        }
    }

    @Nested
    @DisplayName("Result cleaning")
    class CleanerTests {

        @Test
        @DisplayName("nulls and empty containers should be removed recursively")
        void cleansRecursively() {
            Map<String, Object> inner = new HashMap<>();
            inner.put("unit", null);
            inner.put("tags", new ArrayList<>());
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("name", "T1");
            row.put("meta", inner);
            row.put("timeseries", Arrays.asList(null, Map.of("id", "ts1")));

            List<Map<String, Object>> cleaned = ResultCleaner.cleanRows(List.of(row));

            assertEquals(1, cleaned.size());
            assertEquals(Map.of("name", "T1", "timeseries", List.of(Map.of("id", "ts1"))), cleaned.get(0));
        }

        @Test
        @DisplayName("scalars should pass through unchanged")
        void scalars() {
            assertEquals(5, ResultCleaner.clean(5));
            assertNull(ResultCleaner.clean(null));
            assertNull(ResultCleaner.clean(Map.of()));
        }
    }
}
