package com.codeoptimizer.analyzer;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;

import com.codeoptimizer.analyzer.rules.FunctionLengthDetector;
import com.codeoptimizer.analyzer.rules.LegacySyntaxDetector;
import com.codeoptimizer.analyzer.rules.LoopBoundDetector;
import com.codeoptimizer.analyzer.rules.NestedLoopDetector;
import com.codeoptimizer.analyzer.rules.RedundantTernaryDetector;
import com.codeoptimizer.api.AnalysisFragment;
import com.codeoptimizer.api.DetectorPlugin;
import com.codeoptimizer.api.FileAnalysis;
import com.codeoptimizer.api.Issue;
import com.codeoptimizer.api.IssueCategory;
import com.codeoptimizer.api.Metrics;
import com.codeoptimizer.api.SourceUnit;
import com.codeoptimizer.api.error.PluginException;
import com.codeoptimizer.api.error.Severity;
import com.codeoptimizer.config.OptimizerConfig;
import com.codeoptimizer.dependency.CircularDependency;
import com.codeoptimizer.util.LoggerUtil;

/**
 * Produces the metrics and issues of one parsed file: complexity from the syntax tree,
 * lexical checks over the text, then the contributions of every registered detector plugin.
 */
public class IssueDetector {
    private static final Logger logger = LoggerUtil.getLogger(IssueDetector.class);

    private final OptimizerConfig config;
    private final MetricsCalculator metricsCalculator = new MetricsCalculator();
    private final LexicalRules lexicalRules = new LexicalRules();
    private final List<DetectorPlugin> plugins = new CopyOnWriteArrayList<>();

    public IssueDetector(OptimizerConfig config) {
        this.config = config;
    }

    /**
     * Detector with the built-in rule plugins registered.
     */
    public static IssueDetector withDefaultRules(OptimizerConfig config) {
        IssueDetector detector = new IssueDetector(config);
        detector.registerPlugin(new NestedLoopDetector());
        detector.registerPlugin(new LoopBoundDetector());
        detector.registerPlugin(new FunctionLengthDetector());
        detector.registerPlugin(new LegacySyntaxDetector());
        detector.registerPlugin(new RedundantTernaryDetector());
        return detector;
    }

    public void registerPlugin(DetectorPlugin plugin) {
        plugin.initialize(config);
        plugins.add(plugin);
        logger.fine("Registered detector plugin: " + plugin.getName());
    }

    public List<DetectorPlugin> getPlugins() {
        return List.copyOf(plugins);
    }

    public FileAnalysis analyze(SourceUnit unit) {
        return analyze(unit, List.of());
    }

    /**
     * Analyzes one file. Cycles whose first file is this unit are reported as issues of this file.
     */
    public FileAnalysis analyze(SourceUnit unit, Collection<CircularDependency> cycles) {
        Metrics metrics = metricsCalculator.calculate(unit);
        List<Issue> issues = new ArrayList<>();

        _checkComplexity(unit, metrics, issues);
        issues.addAll(lexicalRules.apply(unit));

        for (DetectorPlugin plugin : plugins) {
            try {
                AnalysisFragment fragment = plugin.detect(unit);
                if (fragment == null) {
                    continue;
                }
                metrics = metrics.merge(fragment.getMetrics());
                issues.addAll(fragment.getIssues());
            } catch (RuntimeException e) {
                PluginException failure = new PluginException(plugin.getName(), e);
                logger.log(Level.WARNING, failure.getMessage() + " while analyzing " + unit.getPath(), e);
            }
        }

        for (CircularDependency cycle : cycles) {
            if (cycle.getFiles().get(0).equals(unit.getPath())) {
                issues.add(_cycleIssue(unit, cycle));
            }
        }

        metrics = metricsCalculator.scoreIssues(metrics, issues);
        List<Issue> reported = _filter(issues);

        logger.fine("Analyzed " + unit.getPath() + ": " + metrics + ", " + reported.size() + " issues");
        return new FileAnalysis(unit, metrics, reported);
    }

    private void _checkComplexity(SourceUnit unit, Metrics metrics, List<Issue> issues) {
        int complexity = metrics.getComplexity();
        if (complexity <= config.getMaxComplexity()) {
            return;
        }

        Severity severity = complexity > config.getCriticalComplexity() ? Severity.CRITICAL : Severity.MAJOR;
        issues.add(IssueFactory.atFile(unit)
                .code(IssueCodes.EXCESSIVE_COMPLEXITY)
                .category(IssueCategory.COMPLEXITY)
                .severity(severity)
                .message("Cyclomatic complexity " + complexity + " exceeds the maximum of " + config.getMaxComplexity())
                .suggestion("Split the file into smaller functions or modules")
                .build());
    }

    private static Issue _cycleIssue(SourceUnit unit, CircularDependency cycle) {
        String chain = cycle.getFiles().stream()
                .map(IssueDetector::_fileName)
                .collect(Collectors.joining(" -> ")) + " -> " + _fileName(cycle.getFiles().get(0));

        return IssueFactory.atFile(unit)
                .code(IssueCodes.CIRCULAR_DEPENDENCY)
                .category(IssueCategory.MAINTAINABILITY)
                .severity(cycle.getSeverity().toIssueSeverity())
                .message("Circular dependency: " + chain)
                .suggestion("Move the shared code into a module both files can import")
                .build();
    }

    private static String _fileName(Path path) {
        return path.getFileName() != null ? path.getFileName().toString() : path.toString();
    }

    private List<Issue> _filter(List<Issue> issues) {
        Set<IssueCategory> enabled = config.getEnabledCategories();
        Set<String> ignored = config.getIgnoreRules();
        Set<Severity> severities = config.getSeverityFilter();

        return issues.stream()
                .filter(issue -> enabled.contains(issue.getCategory()))
                .filter(issue -> !ignored.contains(issue.getCode()))
                .filter(issue -> severities.isEmpty() || severities.contains(issue.getSeverity()))
                .collect(Collectors.toList());
    }
}
