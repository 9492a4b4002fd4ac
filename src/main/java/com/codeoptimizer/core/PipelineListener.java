package com.codeoptimizer.core;

/**
 * Receives stage transitions of a run. Callbacks run on the thread driving the pipeline.
 */
public interface PipelineListener {

    default void stageStarted(PipelineStage stage) {
    }

    default void stageCompleted(PipelineStage stage) {
    }

    default void stageFailed(PipelineStage stage, Throwable error) {
    }
}
