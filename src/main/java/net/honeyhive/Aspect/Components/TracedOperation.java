package net.honeyhive.Aspect.Components;

import java.lang.reflect.Method;
import java.util.concurrent.CompletionStage;

/**
 * How a call is wrapped in its span. Chosen once, when the operation is wrapped, from
 * its calling convention.
 */
public interface TracedOperation {

    String SYNC = "sync";
    String ASYNC = "async";

    /**
     * Runs {@code invocation} under the started {@code call} and completes the call.
     */
    Object proceed(TracedCall call, Invocation invocation) throws Throwable;

    /**
     * {@code sync} or {@code async}, as reported in metrics.
     */
    String mode();

    static TracedOperation sync() {
        return SyncTracedOperation.INSTANCE;
    }

    static TracedOperation async(Class<?> returnType) {
        return new AsyncTracedOperation(returnType);
    }

    static TracedOperation forMethod(Method method) {
        Class<?> returnType = method.getReturnType();
        return CompletionStage.class.isAssignableFrom(returnType) ? async(returnType) : sync();
    }
}
