package net.honeyhive.Aspect.Components;

/**
 * The underlying call a traced operation wraps.
 */
@FunctionalInterface
public interface Invocation {

    Object proceed() throws Throwable;
}
