package net.honeyhive.Tracing;

import io.opentelemetry.api.trace.SpanKind;
import net.honeyhive.Context.ContextPropagator;
import org.springframework.http.HttpRequest;
import org.springframework.http.client.ClientHttpRequestExecution;
import org.springframework.http.client.ClientHttpRequestInterceptor;
import org.springframework.http.client.ClientHttpResponse;

import java.io.IOException;
import java.util.HashMap;
import java.util.Map;

/**
 * Opens a CLIENT span around each outgoing RestTemplate request and injects W3C
 * trace-context and baggage headers.
 */
public class HttpTracingInterceptor implements ClientHttpRequestInterceptor {

    private final HoneyHiveTracer tracer;

    public HttpTracingInterceptor(HoneyHiveTracer tracer) {
        this.tracer = tracer;
    }

    @Override
    public ClientHttpResponse intercept(HttpRequest request, byte[] body, ClientHttpRequestExecution execution)
            throws IOException {
        String method = request.getMethod().name();
        TracingSpan span = tracer.startSpan("HTTP " + method, SpanKind.CLIENT, Map.of(
                "http.request.method", method,
                "url.full", request.getURI().toString()));
        try (TracingScope scope = span.makeCurrent()) {
            Map<String, String> carrier = new HashMap<>();
            ContextPropagator.inject(span.getContext(), carrier);
            carrier.forEach((name, value) -> request.getHeaders().set(name, value));

            ClientHttpResponse response = execution.execute(request, body);
            int status = response.getStatusCode().value();
            span.setAttribute("http.response.status_code", status);
            if (status >= 500) {
                span.setError("HTTP " + status);
            } else {
                span.setSuccess();
            }
            return response;
        } catch (IOException | RuntimeException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }
}
