package com.brick.query.tracing;

import java.util.Map;

/**
 * Creates spans around pipeline stages.
 * The default {@link NoOpTracingService} keeps the compiler usable without any tracing
 * dependency on the classpath.
 */
public interface TracingService {

    Span startSpan(String operationName);

    Span startSpan(String operationName, Map<String, String> attributes);
}
