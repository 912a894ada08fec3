package com.brick.query.tracing;

/**
 * A unit of work in a trace. Ends on {@link #close()}, so it fits try-with-resources.
 *
 * <pre>
 * try (Span span = tracingService.startSpan("kgquery.resolve")) {
 *     span.setAttribute("operation", "sensors");
 *     span.setStatus(SpanStatus.OK);
 * }
 * </pre>
 */
public interface Span extends AutoCloseable {

    void setAttribute(String key, String value);

    void setAttribute(String key, long value);

    void setStatus(SpanStatus status);

    void recordException(Throwable t);

    @Override
    void close();

    enum SpanStatus { OK, ERROR }
}
