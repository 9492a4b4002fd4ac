package com.codeoptimizer.api;

import java.util.List;

/**
 * Contribution of one detector plugin. Metrics may be null when the plugin only reports issues.
 */
public class AnalysisFragment {
    private final Metrics metrics;
    private final List<Issue> issues;

    public AnalysisFragment(Metrics metrics, List<Issue> issues) {
        this.metrics = metrics;
        this.issues = List.copyOf(issues);
    }

    public static AnalysisFragment ofIssues(List<Issue> issues) {
        return new AnalysisFragment(null, issues);
    }

    public Metrics getMetrics() { return metrics; }
    public List<Issue> getIssues() { return issues; }
}
