package net.honeyhive.Tracing;

/**
 * Wrapper interface for trace scope that hides the underlying tracing implementation.
 *
 * A scope represents the time period during which a span (and the baggage that came
 * with it) is the "current" context. This must be closed when the scope ends
 * (use try-with-resources).
 *
 * Example usage:
 * <pre>
 * TracingSpan span = tracer.startSpan("retrieve-documents");
 * try (TracingScope scope = span.makeCurrent()) {
 *     // do work - span is now the current span
 * } finally {
 *     span.end();
 * }
 * </pre>
 */
public interface TracingScope extends AutoCloseable {

    /**
     * Closes the scope. This restores the previous context as the current context.
     * Unlike AutoCloseable.close(), this method does not throw exceptions.
     */
    @Override
    void close();
}
