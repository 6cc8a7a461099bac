package net.honeyhive.Provider;

/**
 * A tracer's hold on a {@link TraceProvider}.
 *
 * @param provider the provider the tracer's processor is attached to
 * @param owner whether this tracer created the provider
 * @param degraded whether the provider is a local fallback with no export
 */
public record ProviderLease(TraceProvider provider, boolean owner, boolean degraded) {
}
