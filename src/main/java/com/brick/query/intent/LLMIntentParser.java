package com.brick.query.intent;

import com.brick.query.core.model.EntityType;
import com.brick.query.core.model.ExtractedIntent;
import com.brick.query.core.model.IntentKind;
import com.brick.query.ontology.BrickOntology;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Parses a language-model reply into an {@link ExtractedIntent}.
 *
 * <p>The reply must be one JSON object (optionally wrapped in a markdown code fence) with:</p>
 * <ul>
 *   <li>{@code intent_type}: a known intent code (required)</li>
 *   <li>{@code entity_class}: a known Brick label or type name, or null</li>
 *   <li>{@code parameters}: an object with scalar values</li>
 *   <li>{@code fields}: an array of field identifiers</li>
 *   <li>{@code traversal_hint}: a traversal pattern name, or null</li>
 *   <li>{@code confidence}: a number in [0, 1], {@value #DEFAULT_CONFIDENCE} when absent</li>
 * </ul>
 * Anything else raises {@link IntentParseException}.
 */
public class LLMIntentParser {
    private static final Logger log = LoggerFactory.getLogger(LLMIntentParser.class);

    public static final double DEFAULT_CONFIDENCE = 0.7;

    private static final Pattern CODE_FENCE = Pattern.compile("^```(?:json)?\\s*|\\s*```$");
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private final BrickOntology ontology;
    private final ObjectMapper objectMapper;

    public LLMIntentParser(BrickOntology ontology) {
        this.ontology = Objects.requireNonNull(ontology, "ontology is required");
        this.objectMapper = new ObjectMapper();
    }

    /**
     * @param reply    raw model reply
     * @param question the question the reply answers
     * @throws IntentParseException if the reply does not match the expected shape
     */
    public ExtractedIntent parse(String reply, String question) {
        if (reply == null || reply.isBlank()) {
            throw new IntentParseException("Empty model reply");
        }
        JsonNode root = readObject(CODE_FENCE.matcher(reply.trim()).replaceAll(""));

        IntentKind kind = parseKind(root.get("intent_type"));
        EntityType entityType = parseEntity(root.get("entity_class"));
        Map<String, Object> parameters = parseParameters(root.get("parameters"));
        List<String> fields = parseFields(root.get("fields"));
        String traversalHint = parseTraversalHint(root.get("traversal_hint"));
        double confidence = parseConfidence(root.get("confidence"));

        return ExtractedIntent.builder()
                .kind(kind)
                .entityType(entityType)
                .parameters(parameters)
                .requestedFields(fields)
                .confidence(confidence)
                .question(question)
                .traversalHint(traversalHint)
                .source(ExtractedIntent.Source.LLM)
                .build();
    }

    private JsonNode readObject(String json) {
        try {
            JsonNode root = objectMapper.readTree(json);
            if (root == null || !root.isObject()) {
                throw new IntentParseException("Model reply is not a JSON object");
            }
            return root;
        } catch (JsonProcessingException e) {
            throw new IntentParseException("Model reply is not valid JSON: " + e.getOriginalMessage(), e);
        }
    }

    private static IntentKind parseKind(JsonNode node) {
        if (node == null || !node.isTextual()) {
            throw new IntentParseException("intent_type is missing or not a string");
        }
        return IntentKind.fromCode(node.asText())
                .orElseThrow(() -> new IntentParseException("Unknown intent_type '" + node.asText() + "'"));
    }

    private static EntityType parseEntity(JsonNode node) {
        if (isAbsent(node)) {
            return null;
        }
        if (!node.isTextual()) {
            throw new IntentParseException("entity_class must be a string or null");
        }
        return EntityType.parse(node.asText())
                .orElseThrow(() -> new IntentParseException("Unknown entity_class '" + node.asText() + "'"));
    }

    private static Map<String, Object> parseParameters(JsonNode node) {
        Map<String, Object> parameters = new LinkedHashMap<>();
        if (isAbsent(node)) {
            return parameters;
        }
        if (!node.isObject()) {
            throw new IntentParseException("parameters must be an object");
        }
        Iterator<Map.Entry<String, JsonNode>> entries = node.fields();
        while (entries.hasNext()) {
            Map.Entry<String, JsonNode> entry = entries.next();
            JsonNode value = entry.getValue();
            if (value.isNull()) {
                continue;
            }
            if (value.isTextual()) {
                parameters.put(entry.getKey(), value.asText());
            } else if (value.isNumber()) {
                parameters.put(entry.getKey(), value.numberValue());
            } else if (value.isBoolean()) {
                parameters.put(entry.getKey(), value.booleanValue());
            } else {
                throw new IntentParseException("parameter '" + entry.getKey() + "' must be a scalar");
            }
        }
        return parameters;
    }

    private static List<String> parseFields(JsonNode node) {
        List<String> fields = new ArrayList<>();
        if (isAbsent(node)) {
            return fields;
        }
        if (!node.isArray()) {
            throw new IntentParseException("fields must be an array");
        }
        for (JsonNode field : node) {
            if (!field.isTextual() || !IDENTIFIER.matcher(field.asText()).matches()) {
                throw new IntentParseException("fields must contain identifiers, got " + field);
            }
            fields.add(field.asText());
        }
        return fields;
    }

    private String parseTraversalHint(JsonNode node) {
        if (isAbsent(node)) {
            return null;
        }
        if (!node.isTextual()) {
            throw new IntentParseException("traversal_hint must be a string or null");
        }
        String hint = node.asText();
        if (ontology.getTraversal(hint).isEmpty()) {
            log.debug("intent.parse ignoring unknown traversal_hint={}", hint);
            return null;
        }
        return hint;
    }

    private static double parseConfidence(JsonNode node) {
        if (isAbsent(node)) {
            return DEFAULT_CONFIDENCE;
        }
        if (!node.isNumber()) {
            throw new IntentParseException("confidence must be a number");
        }
        double confidence = node.asDouble();
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IntentParseException("confidence must be between 0.0 and 1.0, got " + confidence);
        }
        return confidence;
    }

    private static boolean isAbsent(JsonNode node) {
        return node == null || node.isNull();
    }
}
