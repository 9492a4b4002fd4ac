package com.codeoptimizer.dependency;

import com.codeoptimizer.api.error.Severity;

/**
 * Severity of a dependency cycle, derived from the number of files it spans.
 */
public enum CycleSeverity {
    HIGH,
    MEDIUM,
    LOW;

    public static CycleSeverity forLength(int length) {
        if (length <= 3) {
            return HIGH;
        }
        if (length <= 5) {
            return MEDIUM;
        }
        return LOW;
    }

    public Severity toIssueSeverity() {
        switch (this) {
            case HIGH:
                return Severity.MAJOR;
            case MEDIUM:
                return Severity.MINOR;
            default:
                return Severity.INFO;
        }
    }
}
