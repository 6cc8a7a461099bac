package net.honeyhive.Aspect.Components;

import net.honeyhive.Tracing.TracingScope;

/**
 * Span covers the call until it returns or throws.
 */
final class SyncTracedOperation implements TracedOperation {

    static final SyncTracedOperation INSTANCE = new SyncTracedOperation();

    private SyncTracedOperation() {
    }

    @Override
    public Object proceed(TracedCall call, Invocation invocation) throws Throwable {
        Object result;
        try (TracingScope scope = call.activate()) {
            result = invocation.proceed();
        } catch (Throwable t) {
            call.fail(t);
            call.end();
            throw t;
        }
        call.succeed(result);
        call.end();
        return result;
    }

    @Override
    public String mode() {
        return SYNC;
    }
}
