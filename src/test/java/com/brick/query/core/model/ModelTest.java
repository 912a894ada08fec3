package com.brick.query.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Core Model Tests")
class ModelTest {

    @Nested
    @DisplayName("EntityType")
    class EntityTypeTests {

        @ParameterizedTest
        @EnumSource(EntityType.class)
        @DisplayName("label should be prefixed type name and round-trip through fromLabel")
        void labelRoundTrip(EntityType type) {
            assertEquals("brick_" + type.getTypeName(), type.getLabel());
            assertEquals(type, EntityType.fromLabel(type.getLabel()).orElseThrow());
        }

        @Test
        @DisplayName("fromLabel should reject unknown or unprefixed labels")
        void fromLabelRejectsUnknown() {
            assertTrue(EntityType.fromLabel("Temperature_Sensor").isEmpty());
            assertTrue(EntityType.fromLabel("brick_Unicorn").isEmpty());
            assertTrue(EntityType.fromLabel(null).isEmpty());
        }

        @Test
        @DisplayName("aliases should resolve within their category")
        void aliasesWithinCategory() {
            assertEquals(EntityType.TEMPERATURE_SENSOR,
                    EntityType.fromTypeName("temperature", EntityCategory.SENSOR).orElseThrow());
            assertEquals(EntityType.ELECTRICAL_METER,
                    EntityType.fromTypeName("Electrical", EntityCategory.METER).orElseThrow());
            assertEquals(EntityType.ELECTRICAL_SYSTEM,
                    EntityType.fromTypeName("Electrical", EntityCategory.SYSTEM).orElseThrow());
            assertTrue(EntityType.fromTypeName("Temperature", EntityCategory.METER).isEmpty());
        }

        @Test
        @DisplayName("parse should accept labels, type names and constant names")
        void parseAcceptsAllForms() {
            assertEquals(EntityType.AIR_HANDLING_UNIT, EntityType.parse("brick_Air_Handling_Unit").orElseThrow());
            assertEquals(EntityType.AIR_HANDLING_UNIT, EntityType.parse("Air_Handling_Unit").orElseThrow());
            assertEquals(EntityType.AIR_HANDLING_UNIT, EntityType.parse("air_handling_unit").orElseThrow());
            assertEquals(EntityType.AIR_HANDLING_UNIT, EntityType.parse("AHU").orElseThrow());
            assertTrue(EntityType.parse(" ").isEmpty());
        }

        @Test
        @DisplayName("categories should drive sensor and equipment predicates")
        void categoryPredicates() {
            assertTrue(EntityType.CO2_SENSOR.isSensor());
            assertFalse(EntityType.CO2_SENSOR.isEquipment());
            assertTrue(EntityType.PUMP.isEquipment());
            assertFalse(EntityType.WATER_METER.isSensor());
        }
    }

    @Nested
    @DisplayName("IntentKind and QueryLocale")
    class CodeTests {

        @ParameterizedTest
        @EnumSource(IntentKind.class)
        @DisplayName("intent codes should round-trip")
        void intentCodes(IntentKind kind) {
            assertEquals(kind, IntentKind.fromCode(kind.getCode()).orElseThrow());
        }

        @Test
        @DisplayName("intent code lookup should ignore case and reject unknown codes")
        void intentCodeLookup() {
            assertEquals(IntentKind.LIST, IntentKind.fromCode(" QUERY_LIST ").orElseThrow());
            assertTrue(IntentKind.fromCode("query_everything").isEmpty());
            assertTrue(IntentKind.fromCode(null).isEmpty());
        }

        @Test
        @DisplayName("locale should parse its codes case-insensitively")
        void localeCodes() {
            assertEquals(QueryLocale.NO, QueryLocale.fromCode("no"));
            assertEquals(QueryLocale.EN, QueryLocale.fromCode(" EN "));
        }

        @ParameterizedTest
        @ValueSource(strings = {"de", "nb", "", "  "})
        @DisplayName("unsupported locales should be rejected")
        void unsupportedLocale(String code) {
            assertThrows(IllegalArgumentException.class, () -> QueryLocale.fromCode(code));
        }
    }

    @Nested
    @DisplayName("PipelineState")
    class PipelineStateTests {

        @Test
        @DisplayName("happy path transitions should be allowed")
        void happyPath() {
            assertTrue(PipelineState.RECEIVED.canTransitionTo(PipelineState.INTENT_EXTRACTED));
            assertTrue(PipelineState.INTENT_EXTRACTED.canTransitionTo(PipelineState.QUERY_GENERATED));
            assertTrue(PipelineState.QUERY_GENERATED.canTransitionTo(PipelineState.QUERY_RESOLVED));
            assertTrue(PipelineState.QUERY_RESOLVED.canTransitionTo(PipelineState.RESULTS_FORMATTED));
        }

        @Test
        @DisplayName("stages should not be skipped")
        void noSkipping() {
            assertFalse(PipelineState.RECEIVED.canTransitionTo(PipelineState.QUERY_GENERATED));
            assertFalse(PipelineState.INTENT_EXTRACTED.canTransitionTo(PipelineState.QUERY_RESOLVED));
            assertFalse(PipelineState.QUERY_GENERATED.canTransitionTo(PipelineState.EXECUTION_FAILED));
        }

        @ParameterizedTest
        @EnumSource(value = PipelineState.class,
                names = {"LOW_CONFIDENCE", "RESOLUTION_FAILED", "EXECUTION_FAILED", "RESULTS_FORMATTED"})
        @DisplayName("terminal states should have no outgoing transitions")
        void terminalStates(PipelineState state) {
            assertTrue(state.isTerminal());
            for (PipelineState next : PipelineState.values()) {
                assertFalse(state.canTransitionTo(next), state + " -> " + next);
            }
        }

        @Test
        @DisplayName("only RESULTS_FORMATTED should count as success")
        void onlyFormattedIsSuccess() {
            Set<PipelineState> successes = EnumSet.noneOf(PipelineState.class);
            for (PipelineState state : PipelineState.values()) {
                if (state.isSuccess()) {
                    successes.add(state);
                }
            }
            assertEquals(EnumSet.of(PipelineState.RESULTS_FORMATTED), successes);
        }

        @Test
        @DisplayName("stage trace names should be numbered in pipeline order")
        void traceNames() {
            assertEquals("1_intent_extraction", PipelineStage.INTENT_EXTRACTION.getTraceName());
            assertEquals("5_response_formatting", PipelineStage.FORMATTING.getTraceName());
        }
    }

    @Nested
    @DisplayName("ExtractedIntent")
    class ExtractedIntentTests {

        @Test
        @DisplayName("builder defaults should describe an unknown rule-based intent")
        void builderDefaults() {
            ExtractedIntent intent = ExtractedIntent.builder().build();
            assertEquals(IntentKind.UNKNOWN, intent.kind());
            assertEquals(ExtractedIntent.Source.RULE_BASED, intent.source());
            assertTrue(intent.entity().isEmpty());
            assertTrue(intent.traversal().isEmpty());
            assertEquals("", intent.question());
        }

        @ParameterizedTest
        @ValueSource(doubles = {-0.01, 1.01})
        @DisplayName("confidence outside [0, 1] should be rejected")
        void confidenceRange(double confidence) {
            assertThrows(IllegalArgumentException.class,
                    () -> ExtractedIntent.builder().confidence(confidence).build());
        }

        @Test
        @DisplayName("parameters and fields should be defensively copied")
        void defensiveCopies() {
            Map<String, Object> params = new HashMap<>();
            params.put("id", "ahu-1");
            List<String> fields = new ArrayList<>(List.of("id"));

            ExtractedIntent intent = ExtractedIntent.builder()
                    .kind(IntentKind.ENTITY)
                    .entityType(EntityType.AIR_HANDLING_UNIT)
                    .parameters(params)
                    .requestedFields(fields)
                    .confidence(0.7)
                    .build();
            params.put("name", "x");
            fields.add("name");

            assertEquals(Map.of("id", "ahu-1"), intent.parameters());
            assertEquals(List.of("id"), intent.requestedFields());
            assertThrows(UnsupportedOperationException.class, () -> intent.parameters().put("a", "b"));
        }
    }
}
