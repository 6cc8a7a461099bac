package net.honeyhive.Aspect.Components;

import net.honeyhive.Aspect.Components.Utility.MetricsRecorder;
import net.honeyhive.Tracing.AttributeNames;
import net.honeyhive.Tracing.HoneyHiveTracer;
import net.honeyhive.Tracing.TracingScope;
import net.honeyhive.Tracing.TracingSpan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.Nullable;

import java.util.Map;

/**
 * One traced invocation.
 *
 * Moves through {@code PENDING -> SPAN_STARTED -> SUCCESS | ERROR -> SPAN_ENDED}; any
 * other transition is a bug and throws {@link IllegalStateException}.
 */
public class TracedCall {

    public enum State {
        PENDING,
        SPAN_STARTED,
        SUCCESS,
        ERROR,
        SPAN_ENDED
    }

    private static final Logger logger = LoggerFactory.getLogger(TracedCall.class);

    private final HoneyHiveTracer tracer;
    private final TraceSettings settings;
    private final MetricsRecorder metricsRecorder;
    private final String mode;
    private final long startTime = System.currentTimeMillis();

    private volatile State state = State.PENDING;
    private volatile boolean succeeded;
    private TracingSpan span;

    public TracedCall(HoneyHiveTracer tracer, TraceSettings settings, MetricsRecorder metricsRecorder, String mode) {
        this.tracer = tracer;
        this.settings = settings;
        this.metricsRecorder = metricsRecorder;
        this.mode = mode;
    }

    public synchronized void start(Map<String, Object> inputs) {
        transition(State.PENDING, State.SPAN_STARTED);
        span = tracer.startSpan(settings.spanName());
        span.setAttribute(AttributeNames.EVENT_TYPE, settings.eventType());
        span.setAttribute(AttributeNames.EVENT_NAME, settings.spanName());
        inputs.forEach((name, value) -> tracer.writeAttribute(span, AttributeNames.PARAMS + "." + name, value));
    }

    /**
     * Makes the span current on the calling thread.
     */
    public TracingScope activate() {
        return span.makeCurrent();
    }

    public synchronized void succeed(@Nullable Object result) {
        transition(State.SPAN_STARTED, State.SUCCESS);
        if (settings.captureOutput() && result != null) {
            try {
                tracer.writeAttribute(span, AttributeNames.RESULT, result);
            } catch (RuntimeException e) {
                logger.debug("Could not record result of {}: {}", settings.spanName(), e.getMessage());
            }
        }
        span.setSuccess();
        succeeded = true;
    }

    public synchronized void fail(Throwable error) {
        transition(State.SPAN_STARTED, State.ERROR);
        span.recordException(error);
    }

    public synchronized void end() {
        if (state != State.SUCCESS && state != State.ERROR) {
            throw new IllegalStateException("cannot end traced call in state " + state);
        }
        state = State.SPAN_ENDED;
        span.end();
        metricsRecorder.recordTracedCall(mode, succeeded, startTime);
    }

    public State getState() {
        return state;
    }

    public TracingSpan getSpan() {
        return span;
    }

    private void transition(State expected, State next) {
        if (state != expected) {
            throw new IllegalStateException("cannot move traced call from " + state + " to " + next);
        }
        state = next;
    }
}
