package com.quantflow.core.error;

/**
 * Invalid configuration value or parameter combination. Raised at startup, never corrected silently.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
