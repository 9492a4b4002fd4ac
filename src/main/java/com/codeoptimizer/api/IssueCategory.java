package com.codeoptimizer.api;

import java.util.Locale;

/**
 * Category of a detected issue. Transformations reuse it as their type.
 */
public enum IssueCategory {
    SECURITY,
    PERFORMANCE,
    MAINTAINABILITY,
    COMPLEXITY;

    public String getId() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static IssueCategory fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Category must not be null");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown issue category: " + value, e);
        }
    }
}
