package net.honeyhive.Tracing;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.context.Context;
import net.honeyhive.Context.OpenTelemetryTracingContext;
import net.honeyhive.Context.TracingContext;
import org.springframework.lang.Nullable;

/**
 * OpenTelemetry implementation of TracingSpan that wraps a real OTel Span.
 *
 * The span is held together with the context it was started under, so that activating
 * it also re-activates the tracer's baggage for any child spans.
 */
public class OpenTelemetryTracingSpan implements TracingSpan {

    private final Span span;
    private final Context context;

    /**
     * @param span the started span
     * @param parentContext the context the span was started from (carries the baggage)
     */
    public OpenTelemetryTracingSpan(Span span, Context parentContext) {
        this.span = span;
        this.context = parentContext.with(span);
    }

    @Override
    public TracingSpan setAttribute(String key, String value) {
        span.setAttribute(key, value);
        return this;
    }

    @Override
    public TracingSpan setAttribute(String key, long value) {
        span.setAttribute(key, value);
        return this;
    }

    @Override
    public TracingSpan setAttribute(String key, double value) {
        span.setAttribute(key, value);
        return this;
    }

    @Override
    public TracingSpan setAttribute(String key, boolean value) {
        span.setAttribute(key, value);
        return this;
    }

    @Override
    public TracingSpan recordException(Throwable exception) {
        span.recordException(exception);
        span.setAttribute(AttributeNames.ERROR, String.valueOf(exception.getMessage()));
        span.setAttribute(AttributeNames.ERROR_TYPE, exception.getClass().getSimpleName());
        span.setStatus(StatusCode.ERROR, exception.getMessage() != null ? exception.getMessage() : "");
        return this;
    }

    @Override
    public TracingSpan setSuccess() {
        span.setStatus(StatusCode.OK);
        return this;
    }

    @Override
    public TracingSpan setError(String message) {
        span.setStatus(StatusCode.ERROR, message);
        return this;
    }

    @Override
    public void end() {
        span.end();
    }

    @Override
    public TracingScope makeCurrent() {
        return new OpenTelemetryTracingScope(context.makeCurrent());
    }

    @Override
    public TracingContext getContext() {
        return new OpenTelemetryTracingContext(context);
    }

    @Override
    public boolean isRecording() {
        return span.isRecording();
    }

    @Override
    @Nullable
    public Object getUnderlyingSpan() {
        return span;
    }

    /**
     * Gets the underlying OpenTelemetry Span.
     */
    public Span getSpan() {
        return span;
    }
}
