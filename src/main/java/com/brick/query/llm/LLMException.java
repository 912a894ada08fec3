package com.brick.query.llm;

/**
 * Raised when a language-model call fails: unreachable endpoint, timeout,
 * non-success status or a reply without content.
 */
public class LLMException extends RuntimeException {

    public LLMException(String message) {
        super(message);
    }

    public LLMException(String message, Throwable cause) {
        super(message, cause);
    }
}
