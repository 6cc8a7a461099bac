package net.honeyhive.Tracing;

import net.honeyhive.Context.OpenTelemetryTracingContext;
import net.honeyhive.Context.TracingContext;
import org.springframework.lang.Nullable;

/**
 * No-op implementation of TracingSpan, handed out when no tracer could be resolved.
 *
 * All methods do nothing but return 'this' for method chaining compatibility, so
 * application code keeps running untraced.
 */
public class NoOpTracingSpan implements TracingSpan {

    /** Singleton instance to avoid creating many no-op objects */
    public static final NoOpTracingSpan INSTANCE = new NoOpTracingSpan();

    private NoOpTracingSpan() {
        // Private constructor for singleton
    }

    @Override
    public TracingSpan setAttribute(String key, String value) {
        return this;
    }

    @Override
    public TracingSpan setAttribute(String key, long value) {
        return this;
    }

    @Override
    public TracingSpan setAttribute(String key, double value) {
        return this;
    }

    @Override
    public TracingSpan setAttribute(String key, boolean value) {
        return this;
    }

    @Override
    public TracingSpan recordException(Throwable exception) {
        return this;
    }

    @Override
    public TracingSpan setSuccess() {
        return this;
    }

    @Override
    public TracingSpan setError(String message) {
        return this;
    }

    @Override
    public void end() {
        // No-op
    }

    @Override
    public TracingScope makeCurrent() {
        return NoOpTracingScope.INSTANCE;
    }

    @Override
    public TracingContext getContext() {
        return OpenTelemetryTracingContext.current();
    }

    @Override
    public boolean isRecording() {
        return false;
    }

    @Override
    @Nullable
    public Object getUnderlyingSpan() {
        return null;
    }
}
