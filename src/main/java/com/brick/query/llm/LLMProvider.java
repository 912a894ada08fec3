package com.brick.query.llm;

/**
 * Interface for language-model integration.
 * The model is only ever asked to turn a question into a structured intent;
 * it never sees or produces executable queries.
 */
public interface LLMProvider {

    /**
     * Sends a single chat completion and returns the raw text of the reply.
     * One synchronous call, bounded by {@link LLMRequest#timeout()}.
     *
     * @param request system prompt, user message and sampling settings
     * @return the model's reply text
     * @throws LLMException on transport errors, timeouts or non-success responses
     */
    String complete(LLMRequest request);

    /**
     * Returns the name/identifier of this LLM provider.
     */
    String getProviderName();

    /**
     * Checks if the provider is available and configured.
     */
    boolean isAvailable();
}
