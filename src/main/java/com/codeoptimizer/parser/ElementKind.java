package com.codeoptimizer.parser;

/**
 * Kinds of syntax elements recorded by the parsers.
 */
public enum ElementKind {
    FUNCTION(true),
    CLASS(false),
    CONDITIONAL(true),
    LOOP(true),
    CASE(true),
    CATCH(true),
    TERNARY(true),
    LOGICAL(true),
    CALL(false),
    STATEMENT(false);

    private final boolean countsForComplexity;

    ElementKind(boolean countsForComplexity) {
        this.countsForComplexity = countsForComplexity;
    }

    /**
     * Whether each element of this kind adds one to cyclomatic complexity.
     */
    public boolean countsForComplexity() {
        return countsForComplexity;
    }
}
