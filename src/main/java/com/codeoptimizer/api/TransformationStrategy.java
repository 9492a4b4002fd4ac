package com.codeoptimizer.api;

import java.util.List;

import com.codeoptimizer.config.OptimizerConfig;

/**
 * Turns the issues of one file into candidate transformations, one strategy per category.
 */
public interface TransformationStrategy {
    String getName();

    IssueCategory getCategory();

    default void initialize(OptimizerConfig config) {
    }

    List<Transformation> analyze(FileAnalysis fileAnalysis);
}
