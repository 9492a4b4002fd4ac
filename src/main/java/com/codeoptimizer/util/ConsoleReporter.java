package com.codeoptimizer.util;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import com.codeoptimizer.api.FileAnalysis;
import com.codeoptimizer.api.Issue;
import com.codeoptimizer.api.OptimizationOutcome;
import com.codeoptimizer.api.error.Severity;
import com.codeoptimizer.core.PipelineResult;
import com.codeoptimizer.core.PlanEntry;
import com.codeoptimizer.dependency.CircularDependency;
import com.codeoptimizer.dependency.DependencyReport;

/**
 * Renders issues, the transformation plan and the run summary for the terminal.
 */
public class ConsoleReporter {
    public static final String ANSI_RESET = "\u001B[0m";
    public static final String ANSI_RED = "\u001B[31m";
    public static final String ANSI_GREEN = "\u001B[32m";
    public static final String ANSI_YELLOW = "\u001B[33m";
    public static final String ANSI_BLUE = "\u001B[34m";
    public static final String ANSI_BOLD = "\u001B[1m";

    private final boolean useColors;

    public ConsoleReporter(boolean useColors) {
        this.useColors = useColors;
    }

    public String formatIssue(Issue issue) {
        StringBuilder sb = new StringBuilder();
        sb.append(colorize(_severityColor(issue.getSeverity()), issue.getSeverity().name()))
                .append(" [").append(issue.getCode()).append("] ")
                .append(issue.getMessage())
                .append(" (Line ").append(issue.getLocation().getLine()).append(")");

        if (issue.getSuggestion() != null && !issue.getSuggestion().isEmpty()) {
            sb.append("\n  ").append(colorize(ANSI_GREEN, "Suggestion: ")).append(issue.getSuggestion());
        }
        return sb.toString();
    }

    public String formatIssues(FileAnalysis analysis) {
        StringBuilder sb = new StringBuilder();
        sb.append(colorize(ANSI_BOLD, analysis.getPath() + ":")).append("\n");
        for (Issue issue : analysis.getIssues()) {
            sb.append("  ").append(formatIssue(issue).replace("\n", "\n  ")).append("\n");
        }
        return sb.toString();
    }

    public String formatPlanEntry(PlanEntry entry) {
        String status = switch (entry.getStatus()) {
            case APPLIED, APPROVED -> colorize(ANSI_GREEN, entry.getStatus().name());
            case NEEDS_REVIEW -> colorize(ANSI_YELLOW, entry.getStatus().name());
            case REJECTED, CONFLICT, STALE, FAILED -> colorize(ANSI_RED, entry.getStatus().name());
        };

        StringBuilder sb = new StringBuilder();
        sb.append(status).append(" ").append(_fileName(entry.getTransformation().getFilePath()))
                .append(": ").append(entry.getTransformation().getDescription())
                .append(String.format(" (confidence %.2f)", entry.getTransformation().getConfidence()));
        if (entry.getReason() != null && !"validated".equals(entry.getReason())) {
            sb.append("\n    ").append(entry.getReason());
        }
        return sb.toString();
    }

    public String formatCycles(DependencyReport report) {
        StringBuilder sb = new StringBuilder();
        sb.append(colorize(ANSI_BOLD, "Dependencies:")).append(" ")
                .append(report.getTotalFiles()).append(" files, ")
                .append(report.getTotalDependencies()).append(" imports, ")
                .append(String.format("%.1f", report.getAverageDependencies())).append(" per file on average\n");

        Map<CircularDependency, String> suggestions = report.getSuggestions();
        for (CircularDependency cycle : report.getCycles()) {
            sb.append("  ").append(colorize(ANSI_YELLOW, cycle.getSeverity().name())).append(" ")
                    .append(cycle.getFiles().stream().map(ConsoleReporter::_fileName).collect(Collectors.joining(" -> ")))
                    .append("\n");
            if (suggestions.containsKey(cycle)) {
                sb.append("    ").append(colorize(ANSI_GREEN, "Suggestion: ")).append(suggestions.get(cycle)).append("\n");
            }
        }
        return sb.toString();
    }

    public String formatSummary(PipelineResult result) {
        OptimizationOutcome outcome = result.getOutcome();
        StringBuilder sb = new StringBuilder();

        sb.append(colorize(ANSI_BOLD, "Optimization summary")).append(" (").append(outcome.getFinalStage()).append(")\n");
        sb.append("  Files analyzed: ").append(outcome.getFilesAnalyzed()).append("\n");
        if (outcome.getFilesSkipped() > 0) {
            sb.append("  Files skipped: ").append(colorize(ANSI_YELLOW, String.valueOf(outcome.getFilesSkipped()))).append("\n");
        }
        sb.append("  Issues found: ").append(outcome.getIssuesFound()).append("\n");
        sb.append("  Circular dependencies: ").append(outcome.getCyclesFound()).append("\n");
        sb.append("  Transformations proposed: ").append(outcome.getTransformationsProposed()).append("\n");
        sb.append("  Transformations applied: ").append(colorize(ANSI_GREEN, String.valueOf(outcome.getTransformationsApplied()))).append("\n");
        sb.append("  Transformations rejected: ").append(outcome.getTransformationsRejected()).append("\n");

        double delta = outcome.getScoreDelta();
        String deltaText = String.format("%+.1f", delta);
        sb.append(String.format("  Quality score: %.1f -> %.1f (", outcome.getScoreBefore(), outcome.getScoreAfter()))
                .append(colorize(delta >= 0 ? ANSI_GREEN : ANSI_RED, deltaText)).append(")\n");

        long criticalCount = result.getAnalyses().stream()
                .flatMap(a -> a.getIssues().stream())
                .filter(issue -> issue.getSeverity() == Severity.CRITICAL)
                .count();
        if (criticalCount > 0) {
            sb.append("  ").append(colorize(ANSI_RED, criticalCount + " critical issues")).append("\n");
        }
        return sb.toString();
    }

    public String formatSkipped(Map<Path, String> skipped) {
        return skipped.entrySet().stream()
                .map(e -> colorize(ANSI_YELLOW, "Skipped ") + e.getKey() + ": " + e.getValue())
                .collect(Collectors.joining("\n"));
    }

    public Map<Severity, List<Issue>> groupBySeverity(List<Issue> issues) {
        return issues.stream().collect(Collectors.groupingBy(Issue::getSeverity));
    }

    public String colorize(String color, String message) {
        if (useColors) {
            return color + message + ANSI_RESET;
        }
        return message;
    }

    private static String _severityColor(Severity severity) {
        return switch (severity) {
            case CRITICAL, MAJOR -> ANSI_RED;
            case MINOR -> ANSI_YELLOW;
            case INFO -> ANSI_BLUE;
        };
    }

    private static String _fileName(Path path) {
        return path.getFileName() != null ? path.getFileName().toString() : path.toString();
    }
}
