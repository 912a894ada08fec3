package com.brick.query.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * MDC scope for one request. Entries are removed again on {@link #close()}.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forQuestion(correlationId, "no")) {
 *     log.info("query.resolved operation={} fallback={}", operation, fallback);
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    public static LogContext forQuestion(String correlationId, String language) {
        LogContext ctx = new LogContext();
        ctx.put("correlationId", correlationId);
        ctx.put("language", language);
        ctx.put("operation", "process");
        return ctx;
    }

    public static LogContext forExplain(String correlationId) {
        LogContext ctx = new LogContext();
        ctx.put("correlationId", correlationId);
        ctx.put("operation", "explain");
        return ctx;
    }

    public static String generateCorrelationId() {
        return UUID.randomUUID().toString();
    }

    /**
     * Adds another entry to this scope.
     */
    public LogContext with(String key, String value) {
        put(key, value);
        return this;
    }

    private void put(String key, String value) {
        keys.add(key);
        MDC.put(key, value);
    }

    @Override
    public void close() {
        for (String key : keys) {
            MDC.remove(key);
        }
        keys.clear();
    }
}
