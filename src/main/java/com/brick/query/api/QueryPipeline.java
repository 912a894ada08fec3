package com.brick.query.api;

import com.brick.query.core.model.EntityType;
import com.brick.query.core.model.ExtractedIntent;
import com.brick.query.core.model.GeneratedQuery;
import com.brick.query.core.model.PipelineStage;
import com.brick.query.core.model.PipelineState;
import com.brick.query.core.model.QueryLocale;
import com.brick.query.core.model.ResolvedQuery;
import com.brick.query.cypher.CypherResolver;
import com.brick.query.cypher.QueryResolutionException;
import com.brick.query.format.ResponseFormatter;
import com.brick.query.graph.GraphConnection;
import com.brick.query.graph.GraphConnectionException;
import com.brick.query.graph.InputSanitizer;
import com.brick.query.graphql.GraphQLGenerator;
import com.brick.query.intent.IntentExtractor;
import com.brick.query.llm.LLMProvider;
import com.brick.query.llm.NoOpLLMProvider;
import com.brick.query.logging.LogContext;
import com.brick.query.metrics.MetricsService;
import com.brick.query.metrics.NoOpMetricsService;
import com.brick.query.ontology.BrickOntology;
import com.brick.query.tracing.NoOpTracingService;
import com.brick.query.tracing.Span;
import com.brick.query.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Main entry point for answering building questions from the knowledge graph.
 *
 * <p>A question passes through five stages: intent extraction, structured query generation,
 * Cypher resolution, graph execution and response formatting. Every request ends in exactly
 * one terminal {@link PipelineState} and always carries a localized response text; expected
 * failures (low confidence, unresolvable query, database errors) are reported in the result,
 * never thrown.</p>
 *
 * <p>Usage:</p>
 * <pre>
 * QueryPipeline pipeline = QueryPipeline.builder()
 *     .options(PipelineOptions.defaults())
 *     .build();
 *
 * try (GraphConnection connection = new FalkorDBConnection("localhost", 6379, "brick")) {
 *     PipelineResult result = pipeline.process("Hvor mange etasjer har bygget?", QueryLocale.NO, connection);
 *     System.out.println(result.response());
 * }
 * </pre>
 *
 * <p>Instances hold no per-request state and may be shared between threads.</p>
 */
public class QueryPipeline {

    private static final Logger log = LoggerFactory.getLogger(QueryPipeline.class);

    private final BrickOntology ontology;
    private final PipelineOptions options;
    private final IntentExtractor intentExtractor;
    private final GraphQLGenerator generator;
    private final CypherResolver resolver;
    private final ResponseFormatter formatter;
    private final MetricsService metricsService;
    private final TracingService tracingService;

    private QueryPipeline(Builder builder) {
        this.ontology = builder.ontology;
        this.options = builder.options;
        this.metricsService = builder.metricsService;
        this.tracingService = builder.tracingService;
        this.intentExtractor = IntentExtractor.builder()
                .ontology(ontology)
                .llmProvider(builder.llmProvider)
                .useLLM(options.isUseLLM())
                .llmTimeout(options.getLlmTimeout())
                .metricsService(metricsService)
                .build();
        this.generator = new GraphQLGenerator(ontology);
        this.resolver = new CypherResolver(options.getUnresolvedQueryPolicy());
        this.formatter = new ResponseFormatter(options.getFormatterLimits());
    }

    // ========== Processing ==========

    /**
     * Answers a question in the default language.
     */
    public PipelineResult process(String question, GraphConnection connection) {
        return process(question, options.getDefaultLocale(), connection);
    }

    /**
     * Answers a question against the given graph.
     *
     * @param question   natural-language question
     * @param locale     answer language, {@code null} for the default
     * @param connection open graph connection, owned by the caller
     * @return the outcome; {@link PipelineResult#response()} is always set
     * @throws IllegalArgumentException if the question is blank, too long or contains control characters
     */
    public PipelineResult process(String question, QueryLocale locale, GraphConnection connection) {
        InputSanitizer.validateQuestion(question);
        Objects.requireNonNull(connection, "connection is required");
        QueryLocale language = locale != null ? locale : options.getDefaultLocale();
        String correlationId = LogContext.generateCorrelationId();
        long start = System.nanoTime();

        try (LogContext logCtx = LogContext.forQuestion(correlationId, language.getCode());
             Span span = tracingService.startSpan("kgquery.process", Map.of("language", language.getCode()))) {
            Request request = new Request(correlationId, question, language);
            PipelineResult result = run(request, connection);

            span.setAttribute("state", result.state().name());
            span.setAttribute("result_count", result.resultCount());
            span.setStatus(result.success() ? Span.SpanStatus.OK : Span.SpanStatus.ERROR);
            metricsService.incrementOutcome(result.state());
            log.info("pipeline.completed state={} success={} results={} durationMs={}",
                    result.state(), result.success(), result.resultCount(),
                    Duration.ofNanos(System.nanoTime() - start).toMillis());
            return result;
        }
    }

    private PipelineResult run(Request request, GraphConnection connection) {
        // Stage 1
        ExtractedIntent intent = stage(PipelineStage.INTENT_EXTRACTION,
                () -> intentExtractor.extract(request.question));
        request.intent = intent;
        recordIntent(request.debug, intent);
        metricsService.recordIntentConfidence(intent.confidence());
        request.advance(PipelineState.INTENT_EXTRACTED);

        if (intent.confidence() < options.getLowConfidenceThreshold()) {
            log.info("pipeline.lowConfidence confidence={} threshold={}",
                    intent.confidence(), options.getLowConfidenceThreshold());
            request.advance(PipelineState.LOW_CONFIDENCE);
            return request.finish(null, formatter.lowConfidence(request.question, request.locale), null);
        }

        // Stage 2
        GeneratedQuery generated = stage(PipelineStage.QUERY_GENERATION, () -> generator.generate(intent));
        request.generated = generated;
        request.debug.put(PipelineStage.QUERY_GENERATION, "graphql_operation", generated.operationName());
        request.debug.put(PipelineStage.QUERY_GENERATION, "graphql_query", generated.queryText());
        request.debug.put(PipelineStage.QUERY_GENERATION, "variables", generated.variables());
        request.advance(PipelineState.QUERY_GENERATED);

        // Stage 3
        ResolvedQuery resolved;
        try {
            resolved = stage(PipelineStage.QUERY_RESOLUTION, () -> resolver.resolve(generated));
        } catch (QueryResolutionException e) {
            log.warn("pipeline.resolutionFailed operation={} error={}", generated.operationName(), e.getMessage());
            request.debug.put(PipelineStage.QUERY_RESOLUTION, "error", e.getMessage());
            request.advance(PipelineState.RESOLUTION_FAILED);
            return request.finish(null, formatter.resolutionError(e.getMessage(), request.locale), e.getMessage());
        }
        request.resolved = resolved;
        if (resolved.fallback()) {
            metricsService.incrementResolverFallback();
        }
        request.debug.put(PipelineStage.QUERY_RESOLUTION, "cypher_description", resolved.description());
        request.debug.put(PipelineStage.QUERY_RESOLUTION, "cypher_query", resolved.cypher());
        request.debug.put(PipelineStage.QUERY_RESOLUTION, "cypher_params", resolved.parameters());
        request.debug.put(PipelineStage.QUERY_RESOLUTION, "fallback", resolved.fallback());
        request.advance(PipelineState.QUERY_RESOLVED);

        // Stage 4
        List<Map<String, Object>> rows;
        try {
            rows = stage(PipelineStage.EXECUTION, () -> connection.query(resolved.cypher(), resolved.parameters()));
        } catch (GraphConnectionException e) {
            log.error("pipeline.connectionFailed graph={} error={}", connection.getGraphName(), e.getMessage());
            return executionFailed(request, formatter.connectionError(e.getMessage(), request.locale), e);
        } catch (RuntimeException e) {
            log.error("pipeline.executionFailed graph={} error={}", connection.getGraphName(), e.getMessage());
            return executionFailed(request, formatter.queryError(e.getMessage(), request.locale), e);
        }
        request.debug.put(PipelineStage.EXECUTION, "result_count", rows.size());

        // Stage 5
        String response = stage(PipelineStage.FORMATTING,
                () -> formatter.format(rows, intent, generated, request.locale));
        request.debug.put(PipelineStage.FORMATTING, "response_length", response.length());
        request.advance(PipelineState.RESULTS_FORMATTED);
        return request.finish(rows, response, null);
    }

    private PipelineResult executionFailed(Request request, String response, RuntimeException e) {
        String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        request.debug.put(PipelineStage.EXECUTION, "error", message);
        request.advance(PipelineState.EXECUTION_FAILED);
        return request.finish(null, response, message);
    }

    // ========== Explain ==========

    /**
     * Explains a question in the default language.
     */
    public QueryExplanation explain(String question) {
        return explain(question, options.getDefaultLocale());
    }

    /**
     * Runs extraction, generation and resolution without executing anything.
     * The language only tags the log context; explanations are not localized.
     */
    public QueryExplanation explain(String question, QueryLocale locale) {
        InputSanitizer.validateQuestion(question);
        QueryLocale language = locale != null ? locale : options.getDefaultLocale();
        try (LogContext logCtx = LogContext.forExplain(LogContext.generateCorrelationId())
                .with("language", language.getCode());
             Span span = tracingService.startSpan("kgquery.explain")) {
            ExtractedIntent intent = intentExtractor.extract(question);
            boolean lowConfidence = intent.confidence() < options.getLowConfidenceThreshold();
            GeneratedQuery generated = generator.generate(intent);
            try {
                ResolvedQuery resolved = resolver.resolve(generated);
                span.setStatus(Span.SpanStatus.OK);
                log.debug("explain.completed operation={} fallback={}", generated.operationName(), resolved.fallback());
                return new QueryExplanation(question, intent, lowConfidence, generated, resolved, null);
            } catch (QueryResolutionException e) {
                span.recordException(e);
                span.setStatus(Span.SpanStatus.ERROR);
                log.warn("explain.resolutionFailed operation={} error={}", generated.operationName(), e.getMessage());
                return new QueryExplanation(question, intent, lowConfidence, generated, null, e.getMessage());
            }
        }
    }

    // ========== Accessors ==========

    public BrickOntology getOntology() {
        return ontology;
    }

    public PipelineOptions getOptions() {
        return options;
    }

    public LLMProvider getLlmProvider() {
        return intentExtractor.getLlmProvider();
    }

    // ========== Internals ==========

    private <T> T stage(PipelineStage stage, Supplier<T> work) {
        long start = System.nanoTime();
        try (Span span = tracingService.startSpan("kgquery.stage", Map.of("stage", stage.getTraceName()))) {
            try {
                T value = work.get();
                span.setStatus(Span.SpanStatus.OK);
                return value;
            } catch (RuntimeException e) {
                span.recordException(e);
                span.setStatus(Span.SpanStatus.ERROR);
                throw e;
            }
        } finally {
            metricsService.recordStageDuration(stage, Duration.ofNanos(System.nanoTime() - start));
        }
    }

    private static void recordIntent(DebugTrail debug, ExtractedIntent intent) {
        debug.put(PipelineStage.INTENT_EXTRACTION, "intent_type", intent.kind().getCode());
        debug.put(PipelineStage.INTENT_EXTRACTION, "entity_class",
                intent.entity().map(EntityType::getTypeName).orElse(null));
        debug.put(PipelineStage.INTENT_EXTRACTION, "intent_confidence", intent.confidence());
        debug.put(PipelineStage.INTENT_EXTRACTION, "parameters", intent.parameters());
        debug.put(PipelineStage.INTENT_EXTRACTION, "source", intent.source().name());
    }

    /**
     * Mutable state of one in-flight request.
     */
    private static final class Request {
        private final String correlationId;
        private final String question;
        private final QueryLocale locale;
        private final DebugTrail debug = new DebugTrail();
        private PipelineState state = PipelineState.RECEIVED;
        private ExtractedIntent intent;
        private GeneratedQuery generated;
        private ResolvedQuery resolved;

        private Request(String correlationId, String question, QueryLocale locale) {
            this.correlationId = correlationId;
            this.question = question;
            this.locale = locale;
        }

        private void advance(PipelineState next) {
            if (!state.canTransitionTo(next)) {
                throw new IllegalStateException("Illegal pipeline transition " + state + " -> " + next);
            }
            state = next;
        }

        private PipelineResult finish(List<Map<String, Object>> rows, String response, String error) {
            return new PipelineResult(state.isSuccess(), correlationId, question, locale, state,
                    intent, generated, resolved, rows, response, error, debug);
        }
    }

    // ========== Builder ==========

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private BrickOntology ontology;
        private LLMProvider llmProvider = new NoOpLLMProvider();
        private PipelineOptions options = PipelineOptions.defaults();
        private MetricsService metricsService = new NoOpMetricsService();
        private TracingService tracingService = new NoOpTracingService();

        public Builder ontology(BrickOntology ontology) {
            this.ontology = ontology;
            return this;
        }

        public Builder llmProvider(LLMProvider llmProvider) {
            this.llmProvider = Objects.requireNonNull(llmProvider, "llmProvider");
            return this;
        }

        public Builder options(PipelineOptions options) {
            this.options = Objects.requireNonNull(options, "options");
            return this;
        }

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = Objects.requireNonNull(metricsService, "metricsService");
            return this;
        }

        public Builder tracingService(TracingService tracingService) {
            this.tracingService = Objects.requireNonNull(tracingService, "tracingService");
            return this;
        }

        public QueryPipeline build() {
            if (ontology == null) {
                ontology = BrickOntology.defaultOntology();
            }
            return new QueryPipeline(this);
        }
    }
}
