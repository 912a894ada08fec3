package com.brick.query.llm;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * No-operation LLM provider for when language-model extraction is disabled.
 * Reports itself unavailable so the rule-based extractor is used directly.
 */
public class NoOpLLMProvider implements LLMProvider {
    private static final Logger log = LoggerFactory.getLogger(NoOpLLMProvider.class);

    @Override
    public String complete(LLMRequest request) {
        log.debug("NoOp LLM provider called for question: '{}'", request.userMessage());
        throw new LLMException("LLM extraction not available - NoOp provider in use");
    }

    @Override
    public String getProviderName() {
        return "NoOp";
    }

    @Override
    public boolean isAvailable() {
        return false;
    }
}
