package com.codeoptimizer.transform.strategies;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import com.codeoptimizer.analyzer.IssueCodes;
import com.codeoptimizer.api.FileAnalysis;
import com.codeoptimizer.api.Issue;
import com.codeoptimizer.api.IssueCategory;
import com.codeoptimizer.api.SourceRange;
import com.codeoptimizer.api.Transformation;
import com.codeoptimizer.api.TransformationStrategy;
import com.codeoptimizer.parser.SourceMask;

/**
 * Removes debug output and modernizes legacy JavaScript syntax.
 */
public class MaintainabilityStrategy implements TransformationStrategy {
    static final double DEBUG_PRINT_CONFIDENCE = 0.85;
    static final double VAR_CONFIDENCE = 0.72;
    static final double EQUALITY_CONFIDENCE = 0.6;

    @Override
    public String getName() {
        return "maintainability";
    }

    @Override
    public IssueCategory getCategory() {
        return IssueCategory.MAINTAINABILITY;
    }

    @Override
    public List<Transformation> analyze(FileAnalysis analysis) {
        List<Transformation> transformations = new ArrayList<>();
        String text = analysis.getUnit().getText();
        String masked = SourceMask.maskCode(text, analysis.getUnit().getFileType());

        for (Issue issue : analysis.getIssues(IssueCodes.DEBUG_PRINT)) {
            StrategySupport.rangeOf(analysis, issue)
                    .flatMap(range -> _statementLine(text, masked, range))
                    .ifPresent(line -> transformations.add(StrategySupport.fixFor(analysis, issue, getName())
                            .original(line)
                            .replacement("")
                            .confidence(DEBUG_PRINT_CONFIDENCE)
                            .description("Remove debug output")
                            .build()));
        }

        for (Issue issue : analysis.getIssues(IssueCodes.VAR_DECLARATION)) {
            StrategySupport.rangeOf(analysis, issue)
                    .filter(range -> "var".equals(range.getText()))
                    .ifPresent(range -> transformations.add(StrategySupport.fixFor(analysis, issue, getName())
                            .original(range)
                            .replacement("let")
                            .confidence(VAR_CONFIDENCE)
                            .description("Declare with block-scoped 'let'")
                            .build()));
        }

        for (Issue issue : analysis.getIssues(IssueCodes.LOOSE_EQUALITY)) {
            StrategySupport.rangeOf(analysis, issue)
                    .filter(range -> "==".equals(range.getText()) || "!=".equals(range.getText()))
                    .ifPresent(range -> transformations.add(StrategySupport.fixFor(analysis, issue, getName())
                            .original(range)
                            .replacement(range.getText() + "=")
                            .confidence(EQUALITY_CONFIDENCE)
                            .description("Compare with strict '" + range.getText() + "='")
                            .build()));
        }

        return transformations;
    }

    /**
     * The full line holding the statement, when the statement is the only thing on it and follows a
     * complete statement or a brace. Removing it elsewhere could change which statement a branch controls.
     */
    private static Optional<SourceRange> _statementLine(String text, String masked, SourceRange statement) {
        if (statement.getText().contains("printStackTrace")) {
            return Optional.empty();
        }

        int lineStart = text.lastIndexOf('\n', statement.getStart() - 1) + 1;
        int lineEnd = text.indexOf('\n', statement.getEnd());
        if (lineEnd < 0) {
            lineEnd = text.length();
        }
        if (!masked.substring(lineStart, statement.getStart()).isBlank()
                || !masked.substring(statement.getEnd(), lineEnd).isBlank()) {
            return Optional.empty();
        }

        int previous = StrategySupport.previousNonWhitespace(masked, lineStart);
        if (previous >= 0 && "{};".indexOf(masked.charAt(previous)) < 0) {
            return Optional.empty();
        }

        if (lineEnd < text.length()) {
            return Optional.of(SourceRange.of(text, lineStart, lineEnd + 1));
        }
        int start = lineStart > 0 ? lineStart - 1 : lineStart;
        return Optional.of(SourceRange.of(text, start, lineEnd));
    }
}
