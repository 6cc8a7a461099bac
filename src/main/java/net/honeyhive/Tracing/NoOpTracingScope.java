package net.honeyhive.Tracing;

/**
 * No-op implementation of TracingScope, handed out when there is nothing to activate.
 *
 * The close() method does nothing.
 */
public class NoOpTracingScope implements TracingScope {

    /** Singleton instance to avoid creating many no-op objects */
    public static final NoOpTracingScope INSTANCE = new NoOpTracingScope();

    private NoOpTracingScope() {
        // Private constructor for singleton
    }

    @Override
    public void close() {
        // No-op
    }
}
