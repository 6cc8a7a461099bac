package net.honeyhive.Context;

import io.opentelemetry.api.baggage.Baggage;
import io.opentelemetry.api.baggage.BaggageBuilder;
import io.opentelemetry.context.Context;
import net.honeyhive.Tracing.OpenTelemetryTracingScope;
import net.honeyhive.Tracing.TracingScope;
import org.springframework.lang.Nullable;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * OpenTelemetry implementation of TracingContext that wraps a real OTel Context.
 *
 * Baggage lives in the OTel {@link Baggage} stored inside the context, which is itself
 * immutable, so copy-on-write comes for free.
 */
public class OpenTelemetryTracingContext implements TracingContext {

    private final Context context;

    public OpenTelemetryTracingContext(Context context) {
        this.context = context;
    }

    /**
     * The context current on the calling thread.
     */
    public static OpenTelemetryTracingContext current() {
        return new OpenTelemetryTracingContext(Context.current());
    }

    /**
     * An empty context with no span and no baggage.
     */
    public static OpenTelemetryTracingContext root() {
        return new OpenTelemetryTracingContext(Context.root());
    }

    @Override
    public TracingContext withBaggage(String key, @Nullable String value) {
        if (value == null || value.isEmpty()) {
            return this;
        }
        Baggage updated = Baggage.fromContext(context).toBuilder().put(key, value).build();
        return new OpenTelemetryTracingContext(context.with(updated));
    }

    @Override
    public TracingContext withBaggage(Map<String, String> entries) {
        if (entries.isEmpty()) {
            return this;
        }
        BaggageBuilder builder = Baggage.fromContext(context).toBuilder();
        entries.forEach((key, value) -> {
            if (value != null && !value.isEmpty()) {
                builder.put(key, value);
            }
        });
        return new OpenTelemetryTracingContext(context.with(builder.build()));
    }

    @Override
    @Nullable
    public String getBaggage(String key) {
        return Baggage.fromContext(context).getEntryValue(key);
    }

    @Override
    public String getBaggage(String key, String defaultValue) {
        String value = getBaggage(key);
        return value != null ? value : defaultValue;
    }

    @Override
    public Map<String, String> getAllBaggage() {
        Map<String, String> entries = new LinkedHashMap<>();
        Baggage.fromContext(context).forEach((key, entry) -> entries.put(key, entry.getValue()));
        return entries;
    }

    @Override
    public TracingScope makeCurrent() {
        return new OpenTelemetryTracingScope(context.makeCurrent());
    }

    @Override
    public Runnable wrap(Runnable runnable) {
        return context.wrap(runnable);
    }

    @Override
    public <T> Callable<T> wrap(Callable<T> callable) {
        return context.wrap(callable);
    }

    @Override
    public Object getUnderlyingContext() {
        return context;
    }

    /**
     * Gets the underlying OpenTelemetry Context.
     */
    public Context getContext() {
        return context;
    }
}
