package net.honeyhive.Provider;

import io.opentelemetry.context.Context;
import io.opentelemetry.sdk.common.CompletableResultCode;
import io.opentelemetry.sdk.trace.ReadWriteSpan;
import io.opentelemetry.sdk.trace.ReadableSpan;
import io.opentelemetry.sdk.trace.SpanProcessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Composite processor installed once on the SDK provider.
 *
 * {@code SdkTracerProvider} fixes its processors at build time, so tracers that join an
 * existing provider attach their own processor here instead. A processor can only be
 * detached by the caller that holds its reference.
 */
public class AttachableSpanProcessor implements SpanProcessor {

    private static final Logger logger = LoggerFactory.getLogger(AttachableSpanProcessor.class);

    private final CopyOnWriteArrayList<SpanProcessor> processors = new CopyOnWriteArrayList<>();

    public void attach(SpanProcessor processor) {
        processors.addIfAbsent(processor);
    }

    public boolean detach(SpanProcessor processor) {
        return processors.remove(processor);
    }

    /**
     * Snapshot of the attached processors, in attach order.
     */
    public List<SpanProcessor> processors() {
        return List.copyOf(processors);
    }

    @Override
    public void onStart(Context parentContext, ReadWriteSpan span) {
        for (SpanProcessor processor : processors) {
            if (!processor.isStartRequired()) {
                continue;
            }
            try {
                processor.onStart(parentContext, span);
            } catch (RuntimeException e) {
                logger.debug("Span processor {} failed on start: {}", processor, e.getMessage());
            }
        }
    }

    @Override
    public boolean isStartRequired() {
        return true;
    }

    @Override
    public void onEnd(ReadableSpan span) {
        for (SpanProcessor processor : processors) {
            if (!processor.isEndRequired()) {
                continue;
            }
            try {
                processor.onEnd(span);
            } catch (RuntimeException e) {
                logger.debug("Span processor {} failed on end: {}", processor, e.getMessage());
            }
        }
    }

    @Override
    public boolean isEndRequired() {
        return true;
    }

    @Override
    public CompletableResultCode forceFlush() {
        List<CompletableResultCode> results = new ArrayList<>();
        for (SpanProcessor processor : processors) {
            results.add(processor.forceFlush());
        }
        return CompletableResultCode.ofAll(results);
    }

    @Override
    public CompletableResultCode shutdown() {
        List<CompletableResultCode> results = new ArrayList<>();
        for (SpanProcessor processor : processors) {
            results.add(processor.shutdown());
        }
        processors.clear();
        return CompletableResultCode.ofAll(results);
    }
}
