package net.honeyhive.Aspect.Components;

import net.honeyhive.Annotations.Traced;

import java.lang.reflect.Method;
import java.lang.reflect.Parameter;

/**
 * What to record for one traced operation. Resolved once per wrapped operation.
 *
 * @param spanName name of the span, also written as the event name
 * @param eventType value of {@code honeyhive_event_type}
 * @param captureInputs whether arguments are recorded
 * @param captureOutput whether the result is recorded
 * @param parameterNames argument names, by position
 */
public record TraceSettings(String spanName,
                            String eventType,
                            boolean captureInputs,
                            boolean captureOutput,
                            String[] parameterNames) {

    static final String DEFAULT_EVENT_TYPE = "tool";

    public static TraceSettings named(String spanName) {
        return new TraceSettings(spanName, DEFAULT_EVENT_TYPE, false, true, new String[0]);
    }

    public static TraceSettings forMethod(Method method, Traced traced) {
        return forMethod(method, traced, traced.name().isEmpty() ? defaultName(method) : traced.name());
    }

    /**
     * Settings for a method traced through its class's annotation, named {@code Class.method}.
     */
    public static TraceSettings forClassMember(Method method, Traced classTraced) {
        return forMethod(method, classTraced, defaultName(method));
    }

    private static String defaultName(Method method) {
        return method.getDeclaringClass().getSimpleName() + "." + method.getName();
    }

    private static TraceSettings forMethod(Method method, Traced traced, String name) {
        Parameter[] parameters = method.getParameters();
        String[] names = new String[parameters.length];
        for (int i = 0; i < parameters.length; i++) {
            names[i] = parameters[i].getName();
        }
        return new TraceSettings(name, traced.eventType(), traced.captureInputs(), traced.captureOutput(), names);
    }
}
