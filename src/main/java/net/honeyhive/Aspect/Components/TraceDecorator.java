package net.honeyhive.Aspect.Components;

import net.honeyhive.Aspect.Components.Utility.MetricsRecorder;
import net.honeyhive.Context.ContextPropagator;
import net.honeyhive.Registry.TracerRegistry;
import net.honeyhive.Tracing.HoneyHiveTracer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.Nullable;

import java.lang.reflect.UndeclaredThrowableException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletionStage;

/**
 * Wraps operations in spans.
 *
 * <pre>{@code
 * TraceDecorator decorator = new TraceDecorator(tracer, TracerRegistry.processWide(), metrics);
 * SyncOperation<Answer> answer = decorator.wrap("answer", () -> model.answer(question));
 * AsyncOperation<Answer> later = decorator.wrapAsync("answer", () -> client.answerAsync(question));
 * }</pre>
 *
 * Sync or async handling is fixed by which method wraps the operation. The tracer is
 * resolved per call: the explicit one given here, else the one named by the current
 * baggage, else the fallback of {@link #withFallback}. Without any the operation runs
 * untraced.
 */
public class TraceDecorator {

    private static final Logger logger = LoggerFactory.getLogger(TraceDecorator.class);

    @FunctionalInterface
    public interface SyncOperation<T> {
        T call() throws Exception;
    }

    @FunctionalInterface
    public interface AsyncOperation<T> {
        CompletionStage<T> call() throws Exception;
    }

    @Nullable
    private final HoneyHiveTracer tracer;
    @Nullable
    private final HoneyHiveTracer fallbackTracer;
    private final TracerRegistry tracerRegistry;
    private final MetricsRecorder metricsRecorder;

    public TraceDecorator(@Nullable HoneyHiveTracer tracer, TracerRegistry tracerRegistry,
                          MetricsRecorder metricsRecorder) {
        this(tracer, null, tracerRegistry, metricsRecorder);
    }

    private TraceDecorator(@Nullable HoneyHiveTracer tracer, @Nullable HoneyHiveTracer fallbackTracer,
                           TracerRegistry tracerRegistry, MetricsRecorder metricsRecorder) {
        this.tracer = tracer;
        this.fallbackTracer = fallbackTracer;
        this.tracerRegistry = tracerRegistry;
        this.metricsRecorder = metricsRecorder;
    }

    /**
     * A decorator that prefers the tracer active in the current baggage and uses
     * {@code fallbackTracer} only when none is.
     */
    public static TraceDecorator withFallback(HoneyHiveTracer fallbackTracer, TracerRegistry tracerRegistry,
                                              MetricsRecorder metricsRecorder) {
        return new TraceDecorator(null, fallbackTracer, tracerRegistry, metricsRecorder);
    }

    public <T> SyncOperation<T> wrap(String name, SyncOperation<T> operation) {
        TraceSettings settings = TraceSettings.named(name);
        TracedOperation strategy = TracedOperation.sync();
        return () -> {
            @SuppressWarnings("unchecked")
            T result = (T) rethrow(() -> invoke(strategy, settings, operation::call, Map.of()));
            return result;
        };
    }

    public <T> AsyncOperation<T> wrapAsync(String name, AsyncOperation<T> operation) {
        TraceSettings settings = TraceSettings.named(name);
        TracedOperation strategy = TracedOperation.async(CompletionStage.class);
        return () -> {
            @SuppressWarnings("unchecked")
            CompletionStage<T> result = (CompletionStage<T>) rethrow(
                    () -> invoke(strategy, settings, operation::call, Map.of()));
            return result;
        };
    }

    /**
     * Runs one invocation with an already chosen strategy.
     */
    public Object invoke(TracedOperation strategy, TraceSettings settings, Invocation invocation,
                         Map<String, Object> inputs) throws Throwable {
        HoneyHiveTracer resolved = tracerRegistry.discover(tracer, ContextPropagator.current());
        if (resolved == null) {
            resolved = fallbackTracer;
        }
        if (resolved == null || resolved.isClosed()) {
            logger.debug("No tracer in scope for {}, running untraced", settings.spanName());
            return invocation.proceed();
        }
        TracedCall call = new TracedCall(resolved, settings, metricsRecorder, strategy.mode());
        call.start(inputs);
        return strategy.proceed(call, invocation);
    }

    /**
     * Names arguments for capture, or returns an empty map when inputs are not captured.
     */
    public static Map<String, Object> inputs(TraceSettings settings, Object[] args) {
        if (!settings.captureInputs() || args == null) {
            return Map.of();
        }
        Map<String, Object> inputs = new LinkedHashMap<>();
        String[] names = settings.parameterNames();
        for (int i = 0; i < args.length; i++) {
            String name = i < names.length ? names[i] : "arg" + i;
            if (args[i] != null) {
                inputs.put(name, args[i]);
            }
        }
        return inputs;
    }

    private static Object rethrow(Invocation invocation) throws Exception {
        try {
            return invocation.proceed();
        } catch (Exception | Error e) {
            throw e;
        } catch (Throwable t) {
            throw new UndeclaredThrowableException(t);
        }
    }
}
