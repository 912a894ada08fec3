package com.brick.query.intent;

/**
 * Raised when a language-model reply does not match the expected intent shape.
 */
public class IntentParseException extends RuntimeException {

    public IntentParseException(String message) {
        super(message);
    }

    public IntentParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
