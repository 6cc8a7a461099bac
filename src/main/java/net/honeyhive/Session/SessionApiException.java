package net.honeyhive.Session;

import net.honeyhive.Tracing.HoneyHiveException;

/**
 * Transport or protocol failure talking to the session endpoints.
 * Caught inside the tracer; never handed to application code.
 */
public class SessionApiException extends HoneyHiveException {

    public SessionApiException(String message) {
        super(message);
    }

    public SessionApiException(String message, Throwable cause) {
        super(message, cause);
    }
}
