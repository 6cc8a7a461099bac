package net.honeyhive.Context;

import net.honeyhive.Tracing.TracingScope;
import org.springframework.lang.Nullable;

import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Immutable snapshot of the execution context: the active span plus the baggage that
 * rides along with it.
 *
 * Every write returns a new context; the receiver is never modified, so a context can be
 * shared between threads without locking. A child derived with {@link #withBaggage}
 * keeps every parent entry it does not overwrite.
 */
public interface TracingContext {

    /**
     * Returns a new context with the baggage entry added or replaced.
     * A null or empty value leaves the context unchanged.
     */
    TracingContext withBaggage(String key, @Nullable String value);

    /**
     * Returns a new context with all entries added or replaced.
     */
    TracingContext withBaggage(Map<String, String> entries);

    /**
     * Reads a baggage entry.
     *
     * @return the value, or null if the key is absent
     */
    @Nullable
    String getBaggage(String key);

    /**
     * Reads a baggage entry, falling back to {@code defaultValue} when absent.
     */
    String getBaggage(String key, String defaultValue);

    /**
     * All baggage entries in this context.
     */
    Map<String, String> getAllBaggage();

    /**
     * Makes this context current on the calling thread until the returned scope is closed.
     */
    TracingScope makeCurrent();

    /**
     * Wraps a task so that it runs with this context current, whichever thread runs it.
     */
    Runnable wrap(Runnable runnable);

    /**
     * Wraps a task so that it runs with this context current, whichever thread runs it.
     */
    <T> Callable<T> wrap(Callable<T> callable);

    /**
     * Gets the underlying context object if needed for advanced operations.
     */
    Object getUnderlyingContext();
}
