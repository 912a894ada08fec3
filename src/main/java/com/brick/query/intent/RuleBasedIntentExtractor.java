package com.brick.query.intent;

import com.brick.query.core.model.EntityType;
import com.brick.query.core.model.ExtractedIntent;
import com.brick.query.core.model.IntentKind;
import com.brick.query.ontology.BrickOntology;
import com.brick.query.ontology.TraversalPattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Deterministic keyword and regex based intent extraction.
 * Used on its own when no language model is configured and as the fallback whenever
 * the model path fails.
 *
 * <p>Confidence starts at {@value #BASE_CONFIDENCE} and grows with each corroborating
 * signal (recognised entity, matching traversal pattern, recognised intent keyword),
 * capped at {@value #MAX_CONFIDENCE}.</p>
 */
public class RuleBasedIntentExtractor {
    private static final Logger log = LoggerFactory.getLogger(RuleBasedIntentExtractor.class);

    public static final double BASE_CONFIDENCE = 0.5;
    public static final double ENTITY_BONUS = 0.2;
    public static final double TRAVERSAL_BONUS = 0.15;
    public static final double INTENT_BONUS = 0.1;
    public static final double MAX_CONFIDENCE = 0.85;

    private final BrickOntology ontology;
    private final List<ParameterRule> parameterRules;

    public RuleBasedIntentExtractor(BrickOntology ontology) {
        this(ontology, DefaultParameterRules.getRules());
    }

    public RuleBasedIntentExtractor(BrickOntology ontology, List<ParameterRule> parameterRules) {
        this.ontology = Objects.requireNonNull(ontology, "ontology is required");
        List<ParameterRule> sorted = new ArrayList<>(parameterRules);
        sorted.sort(Comparator.comparingInt(ParameterRule::getPriority));
        this.parameterRules = List.copyOf(sorted);
    }

    /**
     * Extracts an intent. Never fails; unrecognised questions yield {@link IntentKind#UNKNOWN}
     * with the base confidence.
     */
    public ExtractedIntent extract(String question) {
        String original = question != null ? question : "";
        String lower = original.toLowerCase(Locale.ROOT);

        IntentKind kind = ontology.detectIntentKeyword(lower);
        Optional<EntityType> entity = ontology.findEntityByText(lower);
        Optional<TraversalPattern> traversal = ontology.findTraversalByKeyword(lower);
        Map<String, Object> parameters = extractParameters(lower);

        double confidence = computeConfidence(entity.isPresent(), traversal.isPresent(),
                kind != IntentKind.UNKNOWN);

        log.debug("intent.rules kind={} entity={} traversal={} params={} confidence={}",
                kind, entity.orElse(null), traversal.map(TraversalPattern::name).orElse(null),
                parameters.keySet(), confidence);

        return ExtractedIntent.builder()
                .kind(kind)
                .entityType(entity.orElse(null))
                .parameters(parameters)
                .confidence(confidence)
                .question(original)
                .traversalHint(traversal.map(TraversalPattern::name).orElse(null))
                .source(ExtractedIntent.Source.RULE_BASED)
                .build();
    }

    /**
     * Applies the parameter rules in priority order; the first value found for a key is kept.
     */
    public Map<String, Object> extractParameters(String lowerQuestion) {
        Map<String, Object> parameters = new LinkedHashMap<>();
        for (ParameterRule rule : parameterRules) {
            if (parameters.containsKey(rule.getKey())) {
                continue;
            }
            rule.extract(lowerQuestion).ifPresent(value -> parameters.put(rule.getKey(), value));
        }
        return parameters;
    }

    /**
     * Additive confidence score. Adding a signal never lowers the result.
     */
    public static double computeConfidence(boolean entityFound, boolean traversalFound, boolean intentFound) {
        double confidence = BASE_CONFIDENCE;
        if (entityFound) {
            confidence += ENTITY_BONUS;
        }
        if (traversalFound) {
            confidence += TRAVERSAL_BONUS;
        }
        if (intentFound) {
            confidence += INTENT_BONUS;
        }
        return Math.min(confidence, MAX_CONFIDENCE);
    }

    public List<ParameterRule> getParameterRules() {
        return parameterRules;
    }
}
