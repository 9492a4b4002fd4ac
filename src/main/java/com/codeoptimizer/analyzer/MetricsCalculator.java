package com.codeoptimizer.analyzer;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import com.codeoptimizer.api.Issue;
import com.codeoptimizer.api.IssueCategory;
import com.codeoptimizer.api.Metrics;
import com.codeoptimizer.api.SourceUnit;
import com.codeoptimizer.api.error.Severity;
import com.codeoptimizer.parser.ElementKind;
import com.codeoptimizer.parser.SourceMask;
import com.codeoptimizer.parser.SyntaxElement;
import com.codeoptimizer.parser.SyntaxTree;

/**
 * Derives the metrics snapshot of a file from its syntax tree and text.
 */
public class MetricsCalculator {
    private static final int MIN_DUPLICATE_LINE_LENGTH = 10;

    /**
     * Cyclomatic complexity: 1 plus one per branching construct and per function.
     */
    public static int complexity(SyntaxTree tree) {
        int complexity = 1;
        for (SyntaxElement element : tree.getElements()) {
            if (element.getKind().countsForComplexity()) {
                complexity++;
            }
        }
        return complexity;
    }

    public Metrics calculate(SourceUnit unit) {
        SyntaxTree tree = unit.getTree();
        String text = unit.getText();
        String withoutComments = SourceMask.maskComments(text, unit.getFileType());

        String[] originalLines = text.split("\\R", -1);
        String[] codeOnlyLines = withoutComments.split("\\R", -1);
        int totalLines = originalLines.length;
        if (totalLines > 0 && originalLines[totalLines - 1].isEmpty()) {
            totalLines--;
        }

        int codeLines = 0;
        int commentLines = 0;
        int nonTrivial = 0;
        int duplicates = 0;
        Set<String> seen = new HashSet<>();

        for (int i = 0; i < totalLines; i++) {
            String code = codeOnlyLines[i].trim();
            if (!code.isEmpty()) {
                codeLines++;
            } else if (!originalLines[i].trim().isEmpty()) {
                commentLines++;
            }

            if (_isNonTrivial(code)) {
                nonTrivial++;
                if (!seen.add(code.replaceAll("\\s+", " "))) {
                    duplicates++;
                }
            }
        }

        int complexity = complexity(tree);
        double duplicationRatio = nonTrivial == 0 ? 0.0 : (double) duplicates / nonTrivial;
        double commentRatio = codeLines == 0 ? 0.0 : (double) commentLines / codeLines;

        double maintainability = 100.0
                - 2.0 * (complexity - 1)
                - 30.0 * duplicationRatio
                + 10.0 * Math.min(1.0, commentRatio);

        return Metrics.builder()
                .complexity(complexity)
                .maintainabilityScore(maintainability)
                .duplicationRatio(duplicationRatio)
                .totalLines(totalLines)
                .codeLines(codeLines)
                .commentLines(commentLines)
                .functionCount(tree.getElements(ElementKind.FUNCTION).size())
                .build();
    }

    /**
     * Lowers the security and performance scores according to the issues found in those categories.
     */
    public Metrics scoreIssues(Metrics metrics, List<Issue> issues) {
        return metrics.toBuilder()
                .securityScore(Math.min(metrics.getSecurityScore(), _categoryScore(issues, IssueCategory.SECURITY)))
                .performanceScore(Math.min(metrics.getPerformanceScore(), _categoryScore(issues, IssueCategory.PERFORMANCE)))
                .build();
    }

    private static double _categoryScore(List<Issue> issues, IssueCategory category) {
        double score = 100.0;
        for (Issue issue : issues) {
            if (issue.getCategory() != category) {
                continue;
            }
            if (issue.getSeverity() == Severity.CRITICAL) {
                score -= 25;
            } else if (issue.getSeverity() == Severity.MAJOR) {
                score -= 10;
            } else {
                score -= 3;
            }
        }
        return score;
    }

    private static boolean _isNonTrivial(String line) {
        return line.length() >= MIN_DUPLICATE_LINE_LENGTH && !line.matches("[{}()\\[\\];,\\s]*");
    }
}
