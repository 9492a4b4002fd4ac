package com.codeoptimizer.transform.strategies;

import java.util.Optional;

import com.codeoptimizer.api.FileAnalysis;
import com.codeoptimizer.api.Issue;
import com.codeoptimizer.api.SourceRange;
import com.codeoptimizer.api.Transformation;

/**
 * Helpers shared by the built-in strategies.
 */
final class StrategySupport {

    private StrategySupport() {
    }

    /**
     * The issue's range in the analyzed text, or empty for file-level issues.
     */
    static Optional<SourceRange> rangeOf(FileAnalysis analysis, Issue issue) {
        if (!issue.getLocation().hasRange()) {
            return Optional.empty();
        }
        String text = analysis.getUnit().getText();
        int end = issue.getLocation().getEndOffset();
        if (end > text.length()) {
            return Optional.empty();
        }
        return Optional.of(SourceRange.of(text, issue.getLocation().getStartOffset(), end));
    }

    /**
     * Builder pre-filled with the identity, file and classification of the issue being fixed.
     */
    static Transformation.Builder fixFor(FileAnalysis analysis, Issue issue, String strategyName) {
        return Transformation.builder()
                .id(issue.getId() + "/" + strategyName)
                .issueId(issue.getId())
                .filePath(analysis.getPath())
                .type(issue.getCategory())
                .severity(issue.getSeverity());
    }

    static int previousNonWhitespace(String text, int index) {
        int i = index - 1;
        while (i >= 0 && Character.isWhitespace(text.charAt(i))) {
            i--;
        }
        return i;
    }

    static int nextNonWhitespace(String text, int index) {
        int i = index;
        while (i < text.length() && Character.isWhitespace(text.charAt(i))) {
            i++;
        }
        return i;
    }
}
