package com.codeoptimizer.api.error;

/**
 * Base class for recoverable failures that are attached to a single file or transformation.
 */
public class OptimizerException extends Exception {

    public OptimizerException(String message) {
        super(message);
    }

    public OptimizerException(String message, Throwable cause) {
        super(message, cause);
    }
}
