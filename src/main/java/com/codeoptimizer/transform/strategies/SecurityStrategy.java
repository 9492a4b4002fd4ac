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
 * Replaces {@code eval(data)} with {@code JSON.parse(data)}. Only correct when the evaluated
 * string is data, so the validation gate decides whether the fix survives.
 */
public class SecurityStrategy implements TransformationStrategy {
    static final double EVAL_CONFIDENCE = 0.75;

    @Override
    public String getName() {
        return "security";
    }

    @Override
    public IssueCategory getCategory() {
        return IssueCategory.SECURITY;
    }

    @Override
    public List<Transformation> analyze(FileAnalysis analysis) {
        List<Transformation> transformations = new ArrayList<>();
        String masked = SourceMask.maskCode(analysis.getUnit().getText(), analysis.getUnit().getFileType());

        for (Issue issue : analysis.getIssues(IssueCodes.EVAL_USAGE)) {
            Optional<SourceRange> range = StrategySupport.rangeOf(analysis, issue);
            if (range.isEmpty()) {
                continue;
            }

            SourceRange call = range.get();
            int open = masked.indexOf('(', call.getStart());
            if (open < 0 || open >= call.getEnd() - 1) {
                continue;
            }
            String arguments = call.getText().substring(open - call.getStart() + 1, call.length() - 1);
            if (arguments.isBlank()) {
                continue;
            }

            transformations.add(StrategySupport.fixFor(analysis, issue, getName())
                    .original(call)
                    .replacement("JSON.parse(" + arguments + ")")
                    .confidence(EVAL_CONFIDENCE)
                    .description("Parse the evaluated string as JSON instead of executing it")
                    .build());
        }

        return transformations;
    }
}
