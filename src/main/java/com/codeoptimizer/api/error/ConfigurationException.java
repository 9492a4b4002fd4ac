package com.codeoptimizer.api.error;

/**
 * Invalid configuration. This is the only error that stops the optimizer before a run starts.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
