package com.codeoptimizer.api.error;

import java.util.Locale;

public enum Severity {
    CRITICAL, // Must be fixed, e.g. dynamic code evaluation
    MAJOR,    // Serious problem, also reported as "error"
    MINOR,    // Code smell, also reported as "warning"
    INFO;     // Informational

    /**
     * Sort rank, lower ranks are handled first.
     */
    public int rank() {
        return ordinal();
    }

    /**
     * Parses a severity name, accepting the aliases error and warning.
     */
    public static Severity fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Severity must not be null");
        }

        switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "critical":
                return CRITICAL;
            case "major":
            case "error":
                return MAJOR;
            case "minor":
            case "warning":
                return MINOR;
            case "info":
                return INFO;
            default:
                throw new IllegalArgumentException("Unknown severity: " + value);
        }
    }

    public String getId() {
        return name().toLowerCase(Locale.ROOT);
    }
}
