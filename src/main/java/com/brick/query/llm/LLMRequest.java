package com.brick.query.llm;

import java.time.Duration;
import java.util.Objects;

/**
 * A single chat completion request.
 *
 * @param systemPrompt instructions and catalogue context
 * @param userMessage  the user's question
 * @param temperature  sampling temperature, 0.0 - 2.0
 * @param jsonResponse whether the provider should constrain the reply to a JSON object
 * @param timeout      upper bound for the whole call
 */
public record LLMRequest(
        String systemPrompt,
        String userMessage,
        double temperature,
        boolean jsonResponse,
        Duration timeout
) {
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    public LLMRequest {
        Objects.requireNonNull(systemPrompt, "systemPrompt is required");
        Objects.requireNonNull(userMessage, "userMessage is required");
        if (temperature < 0.0 || temperature > 2.0) {
            throw new IllegalArgumentException("temperature must be between 0.0 and 2.0");
        }
        timeout = timeout != null ? timeout : DEFAULT_TIMEOUT;
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
    }
}
