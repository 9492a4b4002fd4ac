package com.codeoptimizer.core;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import com.codeoptimizer.api.FileAnalysis;
import com.codeoptimizer.api.OptimizationOutcome;
import com.codeoptimizer.dependency.DependencyReport;

/**
 * Everything a run produced: the aggregate outcome, per-file analyses, the transformation plan
 * and the dependency report.
 */
public class PipelineResult {
    private final OptimizationOutcome outcome;
    private final List<FileAnalysis> analyses;
    private final List<PlanEntry> plan;
    private final DependencyReport dependencyReport;
    private final Map<Path, String> skippedFiles;

    public PipelineResult(OptimizationOutcome outcome, List<FileAnalysis> analyses, List<PlanEntry> plan,
                          DependencyReport dependencyReport, Map<Path, String> skippedFiles) {
        this.outcome = outcome;
        this.analyses = List.copyOf(analyses);
        this.plan = List.copyOf(plan);
        this.dependencyReport = dependencyReport;
        this.skippedFiles = Map.copyOf(skippedFiles);
    }

    public OptimizationOutcome getOutcome() { return outcome; }
    public List<FileAnalysis> getAnalyses() { return analyses; }

    /**
     * Every transformation that passed the confidence cutoff, in priority order.
     */
    public List<PlanEntry> getPlan() { return plan; }

    /**
     * Null when the run ended before dependency analysis finished.
     */
    public DependencyReport getDependencyReport() { return dependencyReport; }

    /**
     * Files that could not be analyzed, with the reason.
     */
    public Map<Path, String> getSkippedFiles() { return skippedFiles; }

    public List<PlanEntry> getEntries(PlanEntry.Status status) {
        return plan.stream().filter(entry -> entry.getStatus() == status).toList();
    }
}
