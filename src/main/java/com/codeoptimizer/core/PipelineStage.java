package com.codeoptimizer.core;

/**
 * States of one optimizer run, in execution order. ERROR and CANCELLED end a run early.
 */
public enum PipelineStage {
    ANALYZING,
    GENERATING,
    PRIORITIZING,
    VALIDATING,
    APPLYING,
    REPORTING,
    LEARNING,
    DONE,
    ERROR,
    CANCELLED;

    public boolean isTerminal() {
        return this == DONE || this == ERROR || this == CANCELLED;
    }
}
