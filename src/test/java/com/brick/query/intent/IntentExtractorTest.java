package com.brick.query.intent;

import com.brick.query.core.model.EntityType;
import com.brick.query.core.model.ExtractedIntent;
import com.brick.query.core.model.IntentKind;
import com.brick.query.llm.LLMException;
import com.brick.query.llm.LLMProvider;
import com.brick.query.llm.LLMRequest;
import com.brick.query.metrics.MetricsService;
import com.brick.query.ontology.BrickOntology;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.ArgumentCaptor;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@DisplayName("Intent Extractor Tests")
class IntentExtractorTest {

    private BrickOntology ontology;

    @BeforeEach
    void setUp() {
        ontology = BrickOntology.defaultOntology();
    }

    @Nested
    @DisplayName("Language model reply parsing")
    class ParserTests {

        private LLMIntentParser parser;

        @BeforeEach
        void setUp() {
            parser = new LLMIntentParser(ontology);
        }

        @Test
        @DisplayName("should parse a complete reply")
        void completeReply() {
            String reply = """
                    {"intent_type": "query_traverse", "entity_class": "brick_HVAC_Zone",
                     "parameters": {"equipment_name": "AHU-1", "level": 2, "active": true, "skip": null},
                     "fields": ["id", "name"], "traversal_hint": "ahu_zones", "confidence": 0.9}
                    """;

            ExtractedIntent intent = parser.parse(reply, "Hvilke soner mater AHU-1?");

            assertEquals(IntentKind.TRAVERSE, intent.kind());
            assertEquals(EntityType.HVAC_ZONE, intent.entityType());
            assertEquals("AHU-1", intent.parameters().get("equipment_name"));
            assertEquals(2, intent.parameters().get("level"));
            assertEquals(true, intent.parameters().get("active"));
            assertFalse(intent.parameters().containsKey("skip"));
            assertEquals(List.of("id", "name"), intent.requestedFields());
            assertEquals("ahu_zones", intent.traversalHint());
            assertEquals(0.9, intent.confidence(), 1e-9);
            assertEquals(ExtractedIntent.Source.LLM, intent.source());
            assertEquals("Hvilke soner mater AHU-1?", intent.question());
        }

        @Test
        @DisplayName("should strip a markdown code fence and default the confidence")
        void codeFence() {
            String reply = "```json\n{\"intent_type\": \"query_list\", \"entity_class\": \"Temperature_Sensor\"}\n```";

            ExtractedIntent intent = parser.parse(reply, "q");

            assertEquals(IntentKind.LIST, intent.kind());
            assertEquals(EntityType.TEMPERATURE_SENSOR, intent.entityType());
            assertEquals(LLMIntentParser.DEFAULT_CONFIDENCE, intent.confidence(), 1e-9);
        }

        @Test
        @DisplayName("unknown traversal hints should be dropped")
        void unknownTraversalHint() {
            ExtractedIntent intent = parser.parse(
                    "{\"intent_type\": \"query_list\", \"traversal_hint\": \"teleport\"}", "q");
            assertNull(intent.traversalHint());
            assertNull(intent.entityType());
        }

        @ParameterizedTest
        @ValueSource(strings = {
                "",
                "not json",
                "[1, 2]",
                "{\"entity_class\": \"brick_Floor\"}",
                "{\"intent_type\": \"query_everything\"}",
                "{\"intent_type\": \"query_list\", \"entity_class\": \"brick_Unicorn\"}",
                "{\"intent_type\": \"query_list\", \"parameters\": {\"a\": [1]}}",
                "{\"intent_type\": \"query_list\", \"fields\": [\"id; DROP\"]}",
                "{\"intent_type\": \"query_list\", \"fields\": \"id\"}",
                "{\"intent_type\": \"query_list\", \"confidence\": 1.5}",
                "{\"intent_type\": \"query_list\", \"confidence\": \"high\"}"
        })
        @DisplayName("malformed replies should raise IntentParseException")
        void malformedReplies(String reply) {
            assertThrows(IntentParseException.class, () -> parser.parse(reply, "q"));
        }
    }

    @Nested
    @DisplayName("Extraction with a language model")
    class LLMPathTests {

        private LLMProvider provider;
        private MetricsService metrics;

        @BeforeEach
        void setUp() {
            provider = mock(LLMProvider.class);
            metrics = mock(MetricsService.class);
            when(provider.getProviderName()).thenReturn("mock");
        }

        private IntentExtractor extractor(boolean useLLM) {
            return IntentExtractor.builder()
                    .ontology(ontology)
                    .llmProvider(provider)
                    .useLLM(useLLM)
                    .llmTimeout(Duration.ofSeconds(5))
                    .metricsService(metrics)
                    .build();
        }

        @Test
        @DisplayName("should use the model reply when it parses")
        void usesModelReply() {
            when(provider.isAvailable()).thenReturn(true);
            when(provider.complete(any())).thenReturn(
                    "{\"intent_type\": \"query_entity\", \"entity_class\": \"brick_Building\", \"confidence\": 0.95}");

            ExtractedIntent intent = extractor(true).extract("Hva er bygningens adresse?");

            assertEquals(ExtractedIntent.Source.LLM, intent.source());
            assertEquals(EntityType.BUILDING, intent.entityType());
            verify(metrics, never()).incrementExtractionFallback(anyString());
        }

        @Test
        @DisplayName("request should carry the system prompt, low temperature, JSON mode and timeout")
        void requestShape() {
            when(provider.isAvailable()).thenReturn(true);
            when(provider.complete(any())).thenReturn("{\"intent_type\": \"query_list\"}");

            extractor(true).extract("Vis alle målere");

            ArgumentCaptor<LLMRequest> captor = ArgumentCaptor.forClass(LLMRequest.class);
            verify(provider).complete(captor.capture());
            LLMRequest request = captor.getValue();
            assertEquals("Vis alle målere", request.userMessage());
            assertFalse(request.systemPrompt().isBlank());
            assertEquals(IntentExtractor.LLM_TEMPERATURE, request.temperature(), 1e-9);
            assertTrue(request.jsonResponse());
            assertEquals(Duration.ofSeconds(5), request.timeout());
        }

        @Test
        @DisplayName("unavailable model should fall back to rules")
        void unavailable() {
            when(provider.isAvailable()).thenReturn(false);

            ExtractedIntent intent = extractor(true).extract("List alle temperatursensorer");

            assertEquals(ExtractedIntent.Source.RULE_BASED, intent.source());
            assertEquals(EntityType.TEMPERATURE_SENSOR, intent.entityType());
            verify(provider, never()).complete(any());
            verify(metrics).incrementExtractionFallback("unavailable");
        }

        @Test
        @DisplayName("model error should fall back to rules")
        void modelError() {
            when(provider.isAvailable()).thenReturn(true);
            when(provider.complete(any())).thenThrow(new LLMException("timeout"));

            ExtractedIntent intent = extractor(true).extract("List alle temperatursensorer");

            assertEquals(ExtractedIntent.Source.RULE_BASED, intent.source());
            verify(metrics).incrementExtractionFallback("llm_error");
        }

        @Test
        @DisplayName("malformed reply should fall back to rules")
        void malformedReply() {
            when(provider.isAvailable()).thenReturn(true);
            when(provider.complete(any())).thenReturn("Sure! Here are the temperature sensors.");

            ExtractedIntent intent = extractor(true).extract("List alle temperatursensorer");

            assertEquals(ExtractedIntent.Source.RULE_BASED, intent.source());
            assertEquals(IntentKind.LIST, intent.kind());
            verify(metrics).incrementExtractionFallback("parse_error");
        }

        @Test
        @DisplayName("unexpected runtime failure should fall back to rules")
        void unexpectedError() {
            when(provider.isAvailable()).thenReturn(true);
            when(provider.complete(any())).thenThrow(new IllegalStateException("boom"));

            ExtractedIntent intent = extractor(true).extract("Antall etasjer");

            assertEquals(IntentKind.AGGREGATE, intent.kind());
            verify(metrics).incrementExtractionFallback("unexpected_error");
        }

        @Test
        @DisplayName("disabled model should never be consulted")
        void disabled() {
            ExtractedIntent intent = extractor(false).extract("List alle temperatursensorer");

            assertEquals(ExtractedIntent.Source.RULE_BASED, intent.source());
            verify(provider, never()).isAvailable();
            verify(provider, never()).complete(any());
        }

        @Test
        @DisplayName("batch extraction should keep question order")
        void batch() {
            List<ExtractedIntent> intents = extractor(false)
                    .extractBatch(List.of("Antall etasjer", "List alle temperatursensorer"));
            assertEquals(IntentKind.AGGREGATE, intents.get(0).kind());
            assertEquals(IntentKind.LIST, intents.get(1).kind());
        }
    }

    @Test
    @DisplayName("system prompt should list intent codes, entity labels and traversal names")
    void systemPrompt() {
        String prompt = new IntentPromptBuilder(ontology).buildSystemPrompt();
        assertTrue(prompt.contains("query_aggregate"));
        assertTrue(prompt.contains("brick_Temperature_Sensor"));
        assertTrue(prompt.contains("ahu_zones"));
    }
}
