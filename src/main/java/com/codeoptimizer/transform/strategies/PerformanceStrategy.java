package com.codeoptimizer.transform.strategies;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.codeoptimizer.analyzer.IssueCodes;
import com.codeoptimizer.analyzer.rules.LoopBoundDetector;
import com.codeoptimizer.api.FileAnalysis;
import com.codeoptimizer.api.Issue;
import com.codeoptimizer.api.IssueCategory;
import com.codeoptimizer.api.SourceRange;
import com.codeoptimizer.api.Transformation;
import com.codeoptimizer.api.TransformationStrategy;
import com.codeoptimizer.parser.SourceMask;
import com.codeoptimizer.plugins.FileType;

/**
 * Caches a loop bound that the header re-reads on every iteration:
 * {@code for (let i = 0; i < items.length; ...)} becomes
 * {@code for (let i = 0, itemsLength = items.length; i < itemsLength; ...)}.
 */
public class PerformanceStrategy implements TransformationStrategy {
    static final double LOOP_BOUND_CONFIDENCE = 0.8;

    @Override
    public String getName() {
        return "performance";
    }

    @Override
    public IssueCategory getCategory() {
        return IssueCategory.PERFORMANCE;
    }

    @Override
    public List<Transformation> analyze(FileAnalysis analysis) {
        List<Transformation> transformations = new ArrayList<>();
        String text = analysis.getUnit().getText();
        FileType type = analysis.getUnit().getFileType();
        String masked = SourceMask.maskCode(text, type);
        List<String> reserved = new ArrayList<>();

        for (Issue issue : analysis.getIssues(IssueCodes.LOOP_BOUND_RECOMPUTED)) {
            Optional<SourceRange> range = StrategySupport.rangeOf(analysis, issue);
            if (range.isEmpty()) {
                continue;
            }

            Matcher header = LoopBoundDetector.headerPattern(type).matcher(masked);
            header.region(range.get().getStart(), range.get().getEnd());
            if (!header.matches()) {
                continue;
            }

            String index = header.group(2);
            String collection = header.group(5);
            String bound = _freshName(text, reserved, _boundName(type, collection));
            reserved.add(bound);

            String replacement = "for (" + header.group(1) + " " + index + " = " +
                    text.substring(header.start(3), header.end(3)) + ", " +
                    bound + " = " + collection + "." + header.group(6) + "; " +
                    index + " " + header.group(4) + " " + bound + ";";

            transformations.add(StrategySupport.fixFor(analysis, issue, getName())
                    .original(range.get())
                    .replacement(replacement)
                    .confidence(LOOP_BOUND_CONFIDENCE)
                    .description("Read " + collection + "." + header.group(6) + " once before the loop")
                    .build());
        }

        return transformations;
    }

    private static String _boundName(FileType type, String collection) {
        if (type == FileType.JAVA) {
            return "n";
        }
        String last = collection.substring(collection.lastIndexOf('.') + 1);
        return last + "Length";
    }

    /**
     * The candidate, or the candidate with a numeric suffix when the name already occurs in the file.
     */
    private static String _freshName(String text, List<String> reserved, String candidate) {
        String name = candidate;
        int suffix = 1;
        while (reserved.contains(name) || Pattern.compile("(?<![\\w$])" + Pattern.quote(name) + "(?![\\w$])").matcher(text).find()) {
            name = candidate + suffix++;
        }
        return name;
    }
}
