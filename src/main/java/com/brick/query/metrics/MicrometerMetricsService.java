package com.brick.query.metrics;

import com.brick.query.core.model.PipelineStage;
import com.brick.query.core.model.PipelineState;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 * Requires {@code micrometer-core} on the classpath (optional dependency).
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code kgquery.stage.duration} - Timer (tag: stage)</li>
 *   <li>{@code kgquery.pipeline.outcome} - Counter (tag: outcome)</li>
 *   <li>{@code kgquery.intent.confidence} - DistributionSummary</li>
 *   <li>{@code kgquery.intent.fallback} - Counter (tag: reason)</li>
 *   <li>{@code kgquery.resolver.fallback} - Counter</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final DistributionSummary confidenceSummary;
    private final Counter resolverFallbackCounter;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.confidenceSummary = DistributionSummary.builder("kgquery.intent.confidence")
                .description("Distribution of intent extraction confidence")
                .register(registry);
        this.resolverFallbackCounter = Counter.builder("kgquery.resolver.fallback")
                .description("Number of structured queries resolved with the generic fallback template")
                .register(registry);
    }

    @Override
    public void recordStageDuration(PipelineStage stage, Duration duration) {
        Timer timer = timerCache.computeIfAbsent(stage.name(), k ->
                Timer.builder("kgquery.stage.duration")
                        .description("Duration of a pipeline stage")
                        .tag("stage", stage.getTraceName())
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void incrementOutcome(PipelineState terminalState) {
        String key = "outcome:" + terminalState.name();
        Counter counter = counterCache.computeIfAbsent(key, k ->
                Counter.builder("kgquery.pipeline.outcome")
                        .description("Number of requests by terminal state")
                        .tag("outcome", terminalState.name())
                        .register(registry));
        counter.increment();
    }

    @Override
    public void recordIntentConfidence(double confidence) {
        confidenceSummary.record(confidence);
    }

    @Override
    public void incrementExtractionFallback(String reason) {
        String key = "fallback:" + reason;
        Counter counter = counterCache.computeIfAbsent(key, k ->
                Counter.builder("kgquery.intent.fallback")
                        .description("Number of times the rule-based extractor replaced the language model")
                        .tag("reason", reason)
                        .register(registry));
        counter.increment();
    }

    @Override
    public void incrementResolverFallback() {
        resolverFallbackCounter.increment();
    }
}
