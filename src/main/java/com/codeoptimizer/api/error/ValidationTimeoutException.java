package com.codeoptimizer.api.error;

public class ValidationTimeoutException extends OptimizerException {
    private final long timeoutMs;

    public ValidationTimeoutException(long timeoutMs) {
        super("Execution timed out after " + timeoutMs + " ms");
        this.timeoutMs = timeoutMs;
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }
}
