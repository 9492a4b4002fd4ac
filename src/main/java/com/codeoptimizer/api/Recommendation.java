package com.codeoptimizer.api;

public enum Recommendation {
    APPLY,
    REVIEW,
    REJECT
}
