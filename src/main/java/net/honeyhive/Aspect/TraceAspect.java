package net.honeyhive.Aspect;

import net.honeyhive.Annotations.Traced;
import net.honeyhive.Aspect.Components.TraceDecorator;
import net.honeyhive.Aspect.Components.TraceSettings;
import net.honeyhive.Aspect.Components.TracedOperation;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.reflect.MethodSignature;

import java.lang.reflect.Method;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Aspect that intercepts @Traced annotated methods, and the public methods of @Traced
 * annotated classes, and runs them inside a span.
 *
 * The sync or async strategy and the capture settings are resolved on the first call
 * of each method and reused afterwards.
 */
@Aspect
public class TraceAspect {

    private final TraceDecorator decorator;

    private final ConcurrentHashMap<Method, TracedMethod> methods = new ConcurrentHashMap<>();

    public TraceAspect(TraceDecorator decorator) {
        this.decorator = decorator;
    }

    @Around("@annotation(traced)")
    public Object traceMethod(ProceedingJoinPoint pjp, Traced traced) throws Throwable {
        Method method = ((MethodSignature) pjp.getSignature()).getMethod();
        TracedMethod tracedMethod = methods.computeIfAbsent(method,
                m -> new TracedMethod(TracedOperation.forMethod(m), TraceSettings.forMethod(m, traced)));
        return decorator.invoke(tracedMethod.operation(), tracedMethod.settings(), pjp::proceed,
                TraceDecorator.inputs(tracedMethod.settings(), pjp.getArgs()));
    }

    @Around("@within(traced) && execution(public * *(..)) && !@annotation(net.honeyhive.Annotations.Traced)")
    public Object traceClassMember(ProceedingJoinPoint pjp, Traced traced) throws Throwable {
        Method method = ((MethodSignature) pjp.getSignature()).getMethod();
        TracedMethod tracedMethod = methods.computeIfAbsent(method,
                m -> new TracedMethod(TracedOperation.forMethod(m), TraceSettings.forClassMember(m, traced)));
        return decorator.invoke(tracedMethod.operation(), tracedMethod.settings(), pjp::proceed,
                TraceDecorator.inputs(tracedMethod.settings(), pjp.getArgs()));
    }

    private record TracedMethod(TracedOperation operation, TraceSettings settings) {
    }
}
