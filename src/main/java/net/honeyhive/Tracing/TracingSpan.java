package net.honeyhive.Tracing;

import net.honeyhive.Context.TracingContext;
import org.springframework.lang.Nullable;

/**
 * Wrapper interface for trace spans that hides the underlying tracing implementation.
 *
 * Spans created by {@link HoneyHiveTracer#startSpan(String)} are wrapped in this type so
 * callers never have to deal with the raw OpenTelemetry span or context. When tracing is
 * unavailable (no tracer could be discovered) a no-op implementation is handed out instead.
 *
 * Attributes are append-only while the span is open; once {@link #end()} has been called
 * further writes are ignored by the underlying SDK.
 */
public interface TracingSpan {

    /**
     * Sets an attribute on the span.
     *
     * @param key the attribute key
     * @param value the attribute value
     * @return this span for chaining
     */
    TracingSpan setAttribute(String key, String value);

    /**
     * Sets an attribute on the span.
     *
     * @param key the attribute key
     * @param value the attribute value
     * @return this span for chaining
     */
    TracingSpan setAttribute(String key, long value);

    /**
     * Sets an attribute on the span.
     *
     * @param key the attribute key
     * @param value the attribute value
     * @return this span for chaining
     */
    TracingSpan setAttribute(String key, double value);

    /**
     * Sets an attribute on the span.
     *
     * @param key the attribute key
     * @param value the attribute value
     * @return this span for chaining
     */
    TracingSpan setAttribute(String key, boolean value);

    /**
     * Records an exception in the span and marks it as failed.
     *
     * @param exception the exception to record
     * @return this span for chaining
     */
    TracingSpan recordException(Throwable exception);

    /**
     * Sets the span status to success/OK.
     *
     * @return this span for chaining
     */
    TracingSpan setSuccess();

    /**
     * Sets the span status to error with a message.
     *
     * @param message the error message
     * @return this span for chaining
     */
    TracingSpan setError(String message);

    /**
     * Ends the span. Must be called when the operation is complete.
     */
    void end();

    /**
     * Makes this span, together with the baggage it was started under, the current context.
     * Returns a scope that must be closed when done.
     *
     * @return a TracingScope that must be closed (use try-with-resources)
     */
    TracingScope makeCurrent();

    /**
     * The context holding this span and its baggage. Capture it to continue the trace on
     * another thread.
     */
    TracingContext getContext();

    /**
     * Whether attribute writes on this span are recorded.
     */
    boolean isRecording();

    /**
     * Gets the underlying span object if needed for advanced operations.
     * Returns null for no-op implementations.
     *
     * @return the underlying span object, or null
     */
    @Nullable
    Object getUnderlyingSpan();
}
