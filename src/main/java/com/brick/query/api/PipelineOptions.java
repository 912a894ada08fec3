package com.brick.query.api;

import com.brick.query.core.model.QueryLocale;
import com.brick.query.cypher.UnresolvedQueryPolicy;
import com.brick.query.format.FormatterLimits;

import java.time.Duration;
import java.util.Objects;

/**
 * Options for the query pipeline.
 * Configures the default answer language, the confidence cut-off, language model usage,
 * the unresolved-query policy and output truncation.
 */
public class PipelineOptions {

    private static final double DEFAULT_LOW_CONFIDENCE_THRESHOLD = 0.3;
    private static final Duration DEFAULT_LLM_TIMEOUT = Duration.ofSeconds(30);

    private final QueryLocale defaultLocale;
    private final double lowConfidenceThreshold;
    private final boolean useLLM;
    private final Duration llmTimeout;
    private final UnresolvedQueryPolicy unresolvedQueryPolicy;
    private final FormatterLimits formatterLimits;

    private PipelineOptions(Builder builder) {
        this.defaultLocale = builder.defaultLocale;
        this.lowConfidenceThreshold = builder.lowConfidenceThreshold;
        this.useLLM = builder.useLLM;
        this.llmTimeout = builder.llmTimeout;
        this.unresolvedQueryPolicy = builder.unresolvedQueryPolicy;
        this.formatterLimits = builder.formatterLimits;
    }

    public QueryLocale getDefaultLocale() {
        return defaultLocale;
    }

    public double getLowConfidenceThreshold() {
        return lowConfidenceThreshold;
    }

    public boolean isUseLLM() {
        return useLLM;
    }

    public Duration getLlmTimeout() {
        return llmTimeout;
    }

    public UnresolvedQueryPolicy getUnresolvedQueryPolicy() {
        return unresolvedQueryPolicy;
    }

    public FormatterLimits getFormatterLimits() {
        return formatterLimits;
    }

    /**
     * Rule-based extraction, Norwegian answers.
     */
    public static PipelineOptions defaults() {
        return builder().build();
    }

    /**
     * Language model extraction with rule-based fallback.
     */
    public static PipelineOptions withLLM() {
        return builder().useLLM(true).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private QueryLocale defaultLocale = QueryLocale.NO;
        private double lowConfidenceThreshold = DEFAULT_LOW_CONFIDENCE_THRESHOLD;
        private boolean useLLM = false;
        private Duration llmTimeout = DEFAULT_LLM_TIMEOUT;
        private UnresolvedQueryPolicy unresolvedQueryPolicy = UnresolvedQueryPolicy.DEFAULT_TEMPLATE;
        private FormatterLimits formatterLimits = FormatterLimits.DEFAULTS;

        public Builder defaultLocale(QueryLocale defaultLocale) {
            this.defaultLocale = Objects.requireNonNull(defaultLocale, "defaultLocale");
            return this;
        }

        public Builder lowConfidenceThreshold(double lowConfidenceThreshold) {
            if (lowConfidenceThreshold < 0.0 || lowConfidenceThreshold > 1.0) {
                throw new IllegalArgumentException("lowConfidenceThreshold must be between 0.0 and 1.0");
            }
            this.lowConfidenceThreshold = lowConfidenceThreshold;
            return this;
        }

        public Builder useLLM(boolean useLLM) {
            this.useLLM = useLLM;
            return this;
        }

        public Builder llmTimeout(Duration llmTimeout) {
            if (llmTimeout == null || llmTimeout.isZero() || llmTimeout.isNegative()) {
                throw new IllegalArgumentException("llmTimeout must be positive");
            }
            this.llmTimeout = llmTimeout;
            return this;
        }

        public Builder unresolvedQueryPolicy(UnresolvedQueryPolicy unresolvedQueryPolicy) {
            this.unresolvedQueryPolicy = Objects.requireNonNull(unresolvedQueryPolicy, "unresolvedQueryPolicy");
            return this;
        }

        public Builder formatterLimits(FormatterLimits formatterLimits) {
            this.formatterLimits = Objects.requireNonNull(formatterLimits, "formatterLimits");
            return this;
        }

        public PipelineOptions build() {
            return new PipelineOptions(this);
        }
    }
}
