package com.brick.query.metrics;

import com.brick.query.core.model.PipelineStage;
import com.brick.query.core.model.PipelineState;

import java.time.Duration;

/**
 * Interface for recording query pipeline metrics.
 * Implementations can integrate with Micrometer, Prometheus, or other metrics systems.
 * The default {@link NoOpMetricsService} does nothing, ensuring the library works
 * without any metrics dependencies on the classpath.
 */
public interface MetricsService {

    void recordStageDuration(PipelineStage stage, Duration duration);

    void incrementOutcome(PipelineState terminalState);

    void recordIntentConfidence(double confidence);

    void incrementExtractionFallback(String reason);

    void incrementResolverFallback();
}
