package net.honeyhive.Context;

import io.opentelemetry.api.baggage.propagation.W3CBaggagePropagator;
import io.opentelemetry.api.trace.propagation.W3CTraceContextPropagator;
import io.opentelemetry.context.Context;
import io.opentelemetry.context.Scope;
import io.opentelemetry.context.propagation.TextMapGetter;
import io.opentelemetry.context.propagation.TextMapPropagator;
import org.springframework.lang.Nullable;

import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.function.Supplier;

/**
 * Static entry points for reading, deriving and carrying the tracing context.
 *
 * A thread-local current context does not survive a hop onto another thread, so every
 * hand-off has to capture the context at submission time, as the {@code wrap} helpers do.
 */
public final class ContextPropagator {

    private static final TextMapPropagator PROPAGATOR = TextMapPropagator.composite(
            W3CTraceContextPropagator.getInstance(),
            W3CBaggagePropagator.getInstance());

    private ContextPropagator() {
    }

    public static TracingContext current() {
        return OpenTelemetryTracingContext.current();
    }

    /**
     * Returns a child of {@code ctx} carrying the entry. {@code ctx} itself is unchanged.
     */
    public static TracingContext withBaggage(TracingContext ctx, String key, @Nullable String value) {
        return ctx.withBaggage(key, value);
    }

    public static String getBaggage(TracingContext ctx, String key, String defaultValue) {
        return ctx.getBaggage(key, defaultValue);
    }

    @Nullable
    public static String getBaggage(String key) {
        return current().getBaggage(key);
    }

    /**
     * Captures the current context now and restores it when the task runs.
     */
    public static Runnable wrap(Runnable runnable) {
        return Context.current().wrap(runnable);
    }

    /**
     * Captures the current context now and restores it when the task runs.
     */
    public static <T> Callable<T> wrap(Callable<T> callable) {
        return Context.current().wrap(callable);
    }

    /**
     * Captures the current context now and restores it when the supplier is called.
     */
    public static <T> Supplier<T> wrapSupplier(Supplier<T> supplier) {
        Context captured = Context.current();
        return () -> {
            try (Scope ignored = captured.makeCurrent()) {
                return supplier.get();
            }
        };
    }

    /**
     * An executor that runs every task under the context present when it was submitted.
     */
    public static Executor wrap(Executor executor) {
        return Context.taskWrapping(executor);
    }

    /**
     * An executor service that runs every task under the context present when it was submitted.
     */
    public static ExecutorService wrap(ExecutorService executorService) {
        return Context.taskWrapping(executorService);
    }

    /**
     * Writes W3C {@code traceparent}, {@code tracestate} and {@code baggage} entries for the
     * current context into the carrier.
     */
    public static void inject(Map<String, String> carrier) {
        inject(current(), carrier);
    }

    public static void inject(TracingContext ctx, Map<String, String> carrier) {
        Context context = (Context) ctx.getUnderlyingContext();
        PROPAGATOR.inject(context, carrier, (map, key, value) -> {
            if (map != null) {
                map.put(key, value);
            }
        });
    }

    /**
     * Rebuilds a context (remote parent span plus baggage) from carrier entries.
     */
    public static TracingContext extract(Map<String, String> carrier) {
        Context context = PROPAGATOR.extract(Context.current(), carrier, new MapGetter());
        return new OpenTelemetryTracingContext(context);
    }

    /**
     * TextMapGetter implementation for extracting headers from a Map.
     */
    private static class MapGetter implements TextMapGetter<Map<String, String>> {
        @Override
        public Iterable<String> keys(Map<String, String> carrier) {
            return carrier.keySet();
        }

        @Override
        @Nullable
        public String get(@Nullable Map<String, String> carrier, String key) {
            return carrier != null ? carrier.get(key) : null;
        }
    }
}
