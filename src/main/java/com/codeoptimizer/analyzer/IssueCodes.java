package com.codeoptimizer.analyzer;

/**
 * Codes of the issues the built-in detectors report.
 */
public final class IssueCodes {
    public static final String EVAL_USAGE = "EVAL_USAGE";
    public static final String FUNCTION_CONSTRUCTOR = "FUNCTION_CONSTRUCTOR";
    public static final String COMMAND_EXECUTION = "COMMAND_EXECUTION";
    public static final String DEBUG_PRINT = "DEBUG_PRINT";
    public static final String EXCESSIVE_COMPLEXITY = "EXCESSIVE_COMPLEXITY";
    public static final String NESTED_LOOPS = "NESTED_LOOPS";
    public static final String LOOP_BOUND_RECOMPUTED = "LOOP_BOUND_RECOMPUTED";
    public static final String FUNCTION_TOO_LONG = "FUNCTION_TOO_LONG";
    public static final String VAR_DECLARATION = "VAR_DECLARATION";
    public static final String LOOSE_EQUALITY = "LOOSE_EQUALITY";
    public static final String REDUNDANT_TERNARY = "REDUNDANT_TERNARY";
    public static final String CIRCULAR_DEPENDENCY = "CIRCULAR_DEPENDENCY";

    private IssueCodes() {
    }
}
