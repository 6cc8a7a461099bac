package net.honeyhive.Config;

import net.honeyhive.Tracing.HoneyHiveException;

/**
 * Thrown when a tracer cannot be constructed from its configuration, e.g. no API key
 * outside test mode.
 */
public class TracerConfigurationException extends HoneyHiveException {

    public TracerConfigurationException(String message) {
        super(message);
    }
}
