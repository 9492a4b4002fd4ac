package com.codeoptimizer.api;

import com.codeoptimizer.config.OptimizerConfig;

/**
 * Extension point for additional issue detectors. A plugin that throws is excluded from the merge.
 */
public interface DetectorPlugin {
    /**
     * Name used in logs and in plugin configuration.
     */
    String getName();

    /**
     * Initialize the plugin with the configuration.
     */
    default void initialize(OptimizerConfig config) {
    }

    AnalysisFragment detect(SourceUnit unit);
}
