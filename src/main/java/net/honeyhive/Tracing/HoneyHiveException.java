package net.honeyhive.Tracing;

/**
 * Root of the unchecked exceptions raised by the tracer library.
 *
 * Only configuration problems are ever surfaced to callers; everything else is
 * caught inside the library and turned into a degraded mode or a boolean result.
 */
public class HoneyHiveException extends RuntimeException {

    public HoneyHiveException(String message) {
        super(message);
    }

    public HoneyHiveException(String message, Throwable cause) {
        super(message, cause);
    }
}
