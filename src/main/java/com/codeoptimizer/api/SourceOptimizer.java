package com.codeoptimizer.api;

import java.util.List;

import com.codeoptimizer.core.PipelineResult;

/**
 * The main optimizer interface: analyze, transform, validate and apply over a set of files.
 */
public interface SourceOptimizer {
    PipelineResult run(List<SourceFile> files);
}
