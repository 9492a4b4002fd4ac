package com.codeoptimizer.transform.strategies;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import com.codeoptimizer.analyzer.IssueCodes;
import com.codeoptimizer.analyzer.rules.RedundantTernaryDetector;
import com.codeoptimizer.api.FileAnalysis;
import com.codeoptimizer.api.Issue;
import com.codeoptimizer.api.IssueCategory;
import com.codeoptimizer.api.SourceRange;
import com.codeoptimizer.api.Transformation;
import com.codeoptimizer.api.TransformationStrategy;
import com.codeoptimizer.parser.ElementKind;
import com.codeoptimizer.parser.SourceMask;
import com.codeoptimizer.parser.SyntaxElement;
import com.codeoptimizer.plugins.FileType;

/**
 * Collapses {@code c ? true : false} into the condition itself.
 */
public class ComplexityStrategy implements TransformationStrategy {
    static final double TERNARY_CONFIDENCE = 0.9;

    @Override
    public String getName() {
        return "complexity";
    }

    @Override
    public IssueCategory getCategory() {
        return IssueCategory.COMPLEXITY;
    }

    @Override
    public List<Transformation> analyze(FileAnalysis analysis) {
        List<Transformation> transformations = new ArrayList<>();
        String text = analysis.getUnit().getText();
        FileType type = analysis.getUnit().getFileType();
        String masked = SourceMask.maskCode(text, type);

        for (Issue issue : analysis.getIssues(IssueCodes.REDUNDANT_TERNARY)) {
            Optional<SourceRange> range = StrategySupport.rangeOf(analysis, issue);
            if (range.isEmpty()) {
                continue;
            }
            Optional<SyntaxElement> ternary = _ternaryAt(analysis, range.get());
            if (ternary.isEmpty() || !RedundantTernaryDetector.isRedundant(ternary.get(), text)) {
                continue;
            }

            SyntaxElement element = ternary.get();
            int start = element.getStart();
            int conditionStart = element.getParts().get(0).getStart();
            int conditionEnd = element.getParts().get(0).getEnd();

            // some parsers leave the parentheses of "(c) ? ..." outside the ternary's range
            if (start == conditionStart) {
                int before = StrategySupport.previousNonWhitespace(masked, conditionStart);
                int after = StrategySupport.nextNonWhitespace(masked, conditionEnd);
                if (before >= 0 && after < masked.length() && masked.charAt(before) == '(' && masked.charAt(after) == ')') {
                    start = before;
                    conditionStart = before + 1;
                    conditionEnd = after;
                }
            }

            String condition = text.substring(conditionStart, conditionEnd).trim();
            boolean negated = "false".equals(element.getParts().get(1).textOf(text).trim());
            String replacement;
            if (negated) {
                replacement = "!(" + condition + ")";
            } else if (type == FileType.JAVA) {
                replacement = "(" + condition + ")";
            } else {
                replacement = "!!(" + condition + ")";
            }

            transformations.add(StrategySupport.fixFor(analysis, issue, getName())
                    .original(SourceRange.of(text, start, element.getEnd()))
                    .replacement(replacement)
                    .confidence(TERNARY_CONFIDENCE)
                    .description("Replace the boolean ternary with its condition")
                    .build());
        }

        return transformations;
    }

    private static Optional<SyntaxElement> _ternaryAt(FileAnalysis analysis, SourceRange range) {
        return analysis.getUnit().getTree().getElements(ElementKind.TERNARY).stream()
                .filter(e -> e.getStart() == range.getStart() && e.getEnd() == range.getEnd())
                .findFirst();
    }
}
