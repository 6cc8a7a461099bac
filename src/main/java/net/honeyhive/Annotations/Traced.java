package net.honeyhive.Annotations;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Traces every call of the annotated method in a span of its own. On a class, traces
 * each of its public methods, deciding sync or async per method; a method's own
 * annotation overrides the class's.
 *
 * Methods returning a {@link java.util.concurrent.CompletionStage} are traced until
 * the stage completes; all others until they return or throw. Exceptions are recorded
 * on the span and rethrown unchanged.
 *
 * The tracer is the one whose baggage is current, or else the one wired into the aspect.
 * With neither, the method runs untraced.
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target({ElementType.METHOD, ElementType.TYPE})
public @interface Traced {

    /** Span name. Defaults to {@code SimpleClassName.method}. Ignored on a class. */
    String name() default "";

    /** Written as {@code honeyhive_event_type}. Default: tool */
    String eventType() default "tool";

    /** Record arguments under {@code honeyhive_inputs._params_.<name>}. Default: true */
    boolean captureInputs() default true;

    /** Record the return value under {@code honeyhive_outputs.result}. Default: true */
    boolean captureOutput() default true;
}
