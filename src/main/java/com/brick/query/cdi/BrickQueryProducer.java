package com.brick.query.cdi;

import com.brick.query.api.PipelineOptions;
import com.brick.query.api.QueryPipeline;
import com.brick.query.core.model.QueryLocale;
import com.brick.query.cypher.UnresolvedQueryPolicy;
import com.brick.query.format.FormatterLimits;
import com.brick.query.graph.FalkorDBConnection;
import com.brick.query.graph.GraphConnection;
import com.brick.query.health.FalkorDBHealthCheck;
import com.brick.query.health.HealthCheckRegistry;
import com.brick.query.health.LLMProviderHealthCheck;
import com.brick.query.health.OntologyHealthCheck;
import com.brick.query.llm.LLMProvider;
import com.brick.query.llm.NoOpLLMProvider;
import com.brick.query.llm.OllamaLLMProvider;
import com.brick.query.llm.OpenAIChatProvider;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Locale;
import java.util.Optional;

/**
 * CDI producer that wires the query pipeline from MicroProfile Config properties.
 *
 * <p>Defaults live in {@code META-INF/microprofile-config.properties}; any of them can be
 * overridden by the container's configuration:</p>
 * <pre>
 * brick-query.falkordb.host=localhost
 * brick-query.falkordb.port=6379
 * brick-query.falkordb.graph-name=brick
 * brick-query.llm.enabled=true
 * brick-query.llm.provider=ollama
 * </pre>
 */
@ApplicationScoped
public class BrickQueryProducer {

    private static final Logger log = LoggerFactory.getLogger(BrickQueryProducer.class);

    // ── FalkorDB ──────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "brick-query.falkordb.host", defaultValue = "localhost")
    String falkordbHost;

    @Inject
    @ConfigProperty(name = "brick-query.falkordb.port", defaultValue = "6379")
    int falkordbPort;

    @Inject
    @ConfigProperty(name = "brick-query.falkordb.graph-name", defaultValue = "brick")
    String falkordbGraphName;

    // ── Pipeline ──────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "brick-query.pipeline.default-language", defaultValue = "no")
    String defaultLanguage;

    @Inject
    @ConfigProperty(name = "brick-query.pipeline.low-confidence-threshold", defaultValue = "0.3")
    double lowConfidenceThreshold;

    @Inject
    @ConfigProperty(name = "brick-query.pipeline.unresolved-policy", defaultValue = "DEFAULT_TEMPLATE")
    String unresolvedPolicy;

    // ── Formatter ─────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "brick-query.format.max-list-rows", defaultValue = "15")
    int maxListRows;

    @Inject
    @ConfigProperty(name = "brick-query.format.max-traversal-rows", defaultValue = "20")
    int maxTraversalRows;

    @Inject
    @ConfigProperty(name = "brick-query.format.max-nested-items", defaultValue = "5")
    int maxNestedItems;

    // ── LLM ───────────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "brick-query.llm.enabled", defaultValue = "false")
    boolean llmEnabled;

    @Inject
    @ConfigProperty(name = "brick-query.llm.provider", defaultValue = "ollama")
    String llmProviderType;

    @Inject
    @ConfigProperty(name = "brick-query.llm.base-url")
    Optional<String> llmBaseUrl;

    @Inject
    @ConfigProperty(name = "brick-query.llm.model")
    Optional<String> llmModel;

    @Inject
    @ConfigProperty(name = "brick-query.llm.api-key")
    Optional<String> llmApiKey;

    @Inject
    @ConfigProperty(name = "brick-query.llm.timeout-seconds", defaultValue = "30")
    int llmTimeoutSeconds;

    // ══════════════════════════════════════════════════════════
    //  Producers
    // ══════════════════════════════════════════════════════════

    @Produces
    @ApplicationScoped
    public GraphConnection graphConnection() {
        log.info("Producing GraphConnection: falkordb={}:{}/{}", falkordbHost, falkordbPort, falkordbGraphName);
        return new FalkorDBConnection(falkordbHost, falkordbPort, falkordbGraphName);
    }

    public void closeConnection(@Disposes GraphConnection connection) {
        log.info("Closing GraphConnection graph={}", connection.getGraphName());
        connection.close();
    }

    @Produces
    @ApplicationScoped
    public LLMProvider llmProvider() {
        if (!llmEnabled) {
            log.info("LLM intent extraction disabled");
            return new NoOpLLMProvider();
        }
        LLMProvider provider = createLLMProvider();
        log.info("LLM intent extraction enabled: provider={}", provider.getProviderName());
        return provider;
    }

    @Produces
    @ApplicationScoped
    public QueryPipeline queryPipeline(LLMProvider llmProvider) {
        PipelineOptions options = PipelineOptions.builder()
                .defaultLocale(QueryLocale.fromCode(defaultLanguage))
                .lowConfidenceThreshold(lowConfidenceThreshold)
                .useLLM(llmEnabled)
                .llmTimeout(Duration.ofSeconds(llmTimeoutSeconds))
                .unresolvedQueryPolicy(UnresolvedQueryPolicy.valueOf(unresolvedPolicy.trim().toUpperCase(Locale.ROOT)))
                .formatterLimits(new FormatterLimits(maxListRows, maxTraversalRows, maxNestedItems,
                        FormatterLimits.DEFAULTS.maxFieldsPerRow(), FormatterLimits.DEFAULTS.maxInlineItems()))
                .build();
        log.info("Producing QueryPipeline: language={} threshold={} llm={}",
                options.getDefaultLocale().getCode(), options.getLowConfidenceThreshold(), options.isUseLLM());
        return QueryPipeline.builder()
                .llmProvider(llmProvider)
                .options(options)
                .build();
    }

    @Produces
    @ApplicationScoped
    public HealthCheckRegistry healthCheckRegistry(GraphConnection connection, LLMProvider llmProvider,
                                                   QueryPipeline pipeline) {
        return new HealthCheckRegistry()
                .register(new FalkorDBHealthCheck(connection))
                .register(new LLMProviderHealthCheck(llmProvider, llmEnabled))
                .register(new OntologyHealthCheck(pipeline.getOntology()));
    }

    // ══════════════════════════════════════════════════════════
    //  Internal
    // ══════════════════════════════════════════════════════════

    private LLMProvider createLLMProvider() {
        Duration connectTimeout = Duration.ofSeconds(llmTimeoutSeconds);
        if ("ollama".equalsIgnoreCase(llmProviderType)) {
            OllamaLLMProvider.Builder builder = OllamaLLMProvider.builder().connectTimeout(connectTimeout);
            llmBaseUrl.ifPresent(builder::baseUrl);
            llmModel.ifPresent(builder::model);
            return builder.build();
        }
        if ("openai".equalsIgnoreCase(llmProviderType)) {
            OpenAIChatProvider.Builder builder = OpenAIChatProvider.builder().connectTimeout(connectTimeout);
            llmBaseUrl.ifPresent(builder::baseUrl);
            llmModel.ifPresent(builder::model);
            llmApiKey.ifPresent(builder::apiKey);
            return builder.build();
        }
        log.warn("Unknown LLM provider '{}', falling back to NoOp", llmProviderType);
        return new NoOpLLMProvider();
    }
}
