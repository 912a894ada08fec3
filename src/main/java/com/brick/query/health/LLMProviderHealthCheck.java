package com.brick.query.health;

import com.brick.query.llm.LLMProvider;

/**
 * Reports whether the configured language model is reachable.
 * Extraction falls back to rules without it, so an outage is DEGRADED rather than DOWN.
 */
public class LLMProviderHealthCheck implements HealthCheck {

    private final LLMProvider provider;
    private final boolean enabled;

    public LLMProviderHealthCheck(LLMProvider provider, boolean enabled) {
        this.provider = provider;
        this.enabled = enabled;
    }

    @Override
    public String getName() {
        return "llm";
    }

    @Override
    public HealthStatus check() {
        if (!enabled) {
            return HealthStatus.up("Language model disabled, rule-based extraction")
                    .withDetail("provider", provider.getProviderName());
        }
        if (provider.isAvailable()) {
            return HealthStatus.up().withDetail("provider", provider.getProviderName());
        }
        return HealthStatus.degraded("Language model unavailable, using rule-based extraction")
                .withDetail("provider", provider.getProviderName());
    }
}
