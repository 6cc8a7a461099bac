package net.honeyhive.Aspect.Components;

import net.honeyhive.Tracing.TracingScope;

import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;

/**
 * Span covers the call until the returned stage completes.
 *
 * The span is current while the operation builds its stage, so work it hands to
 * context-propagating executors continues under the span. The caller receives a stage
 * that completes only after the span has ended.
 */
final class AsyncTracedOperation implements TracedOperation {

    private final Class<?> returnType;

    AsyncTracedOperation(Class<?> returnType) {
        this.returnType = returnType;
    }

    @Override
    public Object proceed(TracedCall call, Invocation invocation) throws Throwable {
        CompletionStage<?> stage;
        try (TracingScope scope = call.activate()) {
            stage = (CompletionStage<?>) invocation.proceed();
        } catch (Throwable t) {
            call.fail(t);
            call.end();
            throw t;
        }
        if (stage == null) {
            call.succeed(null);
            call.end();
            return null;
        }
        CompletionStage<?> traced = stage.whenComplete((result, error) -> {
            if (error != null) {
                call.fail(unwrap(error));
            } else {
                call.succeed(result);
            }
            call.end();
        });
        return returnType.isInstance(traced) ? traced : stage;
    }

    private static Throwable unwrap(Throwable error) {
        if (error instanceof CompletionException && error.getCause() != null) {
            return error.getCause();
        }
        return error;
    }

    @Override
    public String mode() {
        return ASYNC;
    }
}
