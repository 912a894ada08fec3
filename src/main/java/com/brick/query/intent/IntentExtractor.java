package com.brick.query.intent;

import com.brick.query.core.model.ExtractedIntent;
import com.brick.query.llm.LLMException;
import com.brick.query.llm.LLMProvider;
import com.brick.query.llm.LLMRequest;
import com.brick.query.llm.NoOpLLMProvider;
import com.brick.query.metrics.MetricsService;
import com.brick.query.metrics.NoOpMetricsService;
import com.brick.query.ontology.BrickOntology;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Turns a question into an {@link ExtractedIntent}.
 *
 * <p>When a language model is enabled and reachable it is asked first; its reply is
 * parsed strictly by {@link LLMIntentParser}. Any failure on that path (unreachable
 * model, timeout, malformed reply) is logged and the deterministic
 * {@link RuleBasedIntentExtractor} answers instead, so extraction itself never fails.</p>
 *
 * <pre>
 * IntentExtractor extractor = IntentExtractor.builder()
 *     .ontology(BrickOntology.defaultOntology())
 *     .llmProvider(OllamaLLMProvider.createDefault())
 *     .useLLM(true)
 *     .build();
 *
 * ExtractedIntent intent = extractor.extract("Vis alle temperatursensorer");
 * </pre>
 */
public class IntentExtractor {
    private static final Logger log = LoggerFactory.getLogger(IntentExtractor.class);

    static final double LLM_TEMPERATURE = 0.1;

    private final LLMProvider llmProvider;
    private final boolean useLLM;
    private final Duration llmTimeout;
    private final IntentPromptBuilder promptBuilder;
    private final LLMIntentParser parser;
    private final RuleBasedIntentExtractor ruleBased;
    private final MetricsService metricsService;

    private IntentExtractor(Builder builder) {
        BrickOntology ontology = builder.ontology;
        this.llmProvider = builder.llmProvider != null ? builder.llmProvider : new NoOpLLMProvider();
        this.useLLM = builder.useLLM;
        this.llmTimeout = builder.llmTimeout != null ? builder.llmTimeout : LLMRequest.DEFAULT_TIMEOUT;
        this.promptBuilder = new IntentPromptBuilder(ontology);
        this.parser = new LLMIntentParser(ontology);
        this.ruleBased = new RuleBasedIntentExtractor(ontology);
        this.metricsService = builder.metricsService != null ? builder.metricsService : new NoOpMetricsService();
    }

    /**
     * Extracts the intent of a question. Never throws.
     */
    public ExtractedIntent extract(String question) {
        String text = question != null ? question : "";
        if (useLLM) {
            if (!llmProvider.isAvailable()) {
                log.warn("intent.llm.unavailable provider={} falling back to rules", llmProvider.getProviderName());
                metricsService.incrementExtractionFallback("unavailable");
            } else {
                try {
                    ExtractedIntent intent = extractWithLLM(text);
                    log.info("intent.extracted source=LLM kind={} entity={} confidence={}",
                            intent.kind(), intent.entityType(), intent.confidence());
                    return intent;
                } catch (LLMException e) {
                    log.warn("intent.llm.failed provider={} error={}", llmProvider.getProviderName(), e.getMessage());
                    metricsService.incrementExtractionFallback("llm_error");
                } catch (IntentParseException e) {
                    log.warn("intent.llm.malformed provider={} error={}", llmProvider.getProviderName(), e.getMessage());
                    metricsService.incrementExtractionFallback("parse_error");
                } catch (RuntimeException e) {
                    log.error("intent.llm.unexpected provider={} error={}", llmProvider.getProviderName(), e.getMessage(), e);
                    metricsService.incrementExtractionFallback("unexpected_error");
                }
            }
        }

        ExtractedIntent intent = ruleBased.extract(text);
        log.info("intent.extracted source=RULE_BASED kind={} entity={} confidence={}",
                intent.kind(), intent.entityType(), intent.confidence());
        return intent;
    }

    /**
     * Extracts intents for several questions, one call each, in order.
     */
    public List<ExtractedIntent> extractBatch(List<String> questions) {
        List<ExtractedIntent> intents = new ArrayList<>(questions.size());
        for (String question : questions) {
            intents.add(extract(question));
        }
        return intents;
    }

    private ExtractedIntent extractWithLLM(String question) {
        LLMRequest request = new LLMRequest(
                promptBuilder.buildSystemPrompt(), question, LLM_TEMPERATURE, true, llmTimeout);
        String reply = llmProvider.complete(request);
        log.debug("intent.llm.reply length={}", reply != null ? reply.length() : 0);
        return parser.parse(reply, question);
    }

    public boolean isUseLLM() {
        return useLLM;
    }

    public LLMProvider getLlmProvider() {
        return llmProvider;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private BrickOntology ontology;
        private LLMProvider llmProvider;
        private boolean useLLM;
        private Duration llmTimeout;
        private MetricsService metricsService;

        public Builder ontology(BrickOntology ontology) {
            this.ontology = ontology;
            return this;
        }

        public Builder llmProvider(LLMProvider llmProvider) {
            this.llmProvider = llmProvider;
            return this;
        }

        public Builder useLLM(boolean useLLM) {
            this.useLLM = useLLM;
            return this;
        }

        public Builder llmTimeout(Duration llmTimeout) {
            this.llmTimeout = llmTimeout;
            return this;
        }

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        public IntentExtractor build() {
            Objects.requireNonNull(ontology, "ontology is required");
            return new IntentExtractor(this);
        }
    }
}
