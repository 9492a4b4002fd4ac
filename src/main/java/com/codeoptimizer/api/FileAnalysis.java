package com.codeoptimizer.api;

import java.nio.file.Path;
import java.util.List;

/**
 * Analyzer output for one file.
 */
public class FileAnalysis {
    private final SourceUnit unit;
    private final Metrics metrics;
    private final List<Issue> issues;

    public FileAnalysis(SourceUnit unit, Metrics metrics, List<Issue> issues) {
        this.unit = unit;
        this.metrics = metrics;
        this.issues = List.copyOf(issues);
    }

    public SourceUnit getUnit() { return unit; }
    public Metrics getMetrics() { return metrics; }
    public List<Issue> getIssues() { return issues; }

    public Path getPath() {
        return unit.getPath();
    }

    public List<Issue> getIssues(String code) {
        return issues.stream().filter(issue -> issue.getCode().equals(code)).toList();
    }
}
