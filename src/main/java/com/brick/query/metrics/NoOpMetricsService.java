package com.brick.query.metrics;

import com.brick.query.core.model.PipelineStage;
import com.brick.query.core.model.PipelineState;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordStageDuration(PipelineStage stage, Duration duration) {
    }

    @Override
    public void incrementOutcome(PipelineState terminalState) {
    }

    @Override
    public void recordIntentConfidence(double confidence) {
    }

    @Override
    public void incrementExtractionFallback(String reason) {
    }

    @Override
    public void incrementResolverFallback() {
    }
}
