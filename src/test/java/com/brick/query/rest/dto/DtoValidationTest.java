package com.brick.query.rest.dto;

import com.brick.query.api.QueryPipeline;
import com.brick.query.api.QueryExplanation;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DtoValidationTest {

    // ========== QueryRequest Tests ==========

    @Test
    @DisplayName("Should create valid QueryRequest")
    void testValidQueryRequest() {
        QueryRequest req = new QueryRequest("Vis alle målere", "no", null);
        assertEquals("Vis alle målere", req.question());
        assertFalse(req.debugEnabled());
        assertTrue(new QueryRequest("q", null, true).debugEnabled());
    }

    @Test
    @DisplayName("Should reject QueryRequest with null or blank question")
    void testQueryRequestBlankQuestion() {
        assertThrows(IllegalArgumentException.class, () -> new QueryRequest(null, "no", null));
        assertThrows(IllegalArgumentException.class, () -> new QueryRequest("  ", "no", null));
    }

    @Test
    @DisplayName("Should deserialize QueryRequest from JSON")
    void testQueryRequestJson() throws Exception {
        QueryRequest req = new ObjectMapper().readValue(
                "{\"question\": \"Number of floors\", \"language\": \"en\", \"debug\": true}", QueryRequest.class);
        assertEquals("en", req.language());
        assertTrue(req.debugEnabled());
    }

    // ========== ErrorResponse Tests ==========

    @Test
    @DisplayName("Should build error responses with status and timestamp")
    void testErrorResponses() {
        ErrorResponse bad = ErrorResponse.badRequest("question is required", "/api/v1/kg/query");
        assertEquals(400, bad.status());
        assertEquals("Bad Request", bad.error());
        assertNotNull(bad.timestamp());

        assertEquals(500, ErrorResponse.internalError("boom", "/api/v1/kg/explain").status());
    }

    // ========== ExplainResponse Tests ==========

    @Test
    @DisplayName("ExplainResponse should omit nulls when serialized")
    void testExplainResponseJson() throws Exception {
        QueryExplanation explanation = QueryPipeline.builder().build().explain("Hei");
        ExplainResponse response = ExplainResponse.from(explanation);

        JsonNode json = new ObjectMapper().valueToTree(response);

        assertEquals("unknown", json.get("intent").asText());
        assertFalse(json.has("entityType"));
        assertFalse(json.has("error"));
        assertTrue(json.has("cypher"));
    }
}
