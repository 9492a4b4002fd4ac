package com.codeoptimizer.analyzer.rules;

import java.util.ArrayList;
import java.util.List;

import com.codeoptimizer.analyzer.IssueCodes;
import com.codeoptimizer.analyzer.IssueFactory;
import com.codeoptimizer.api.AnalysisFragment;
import com.codeoptimizer.api.DetectorPlugin;
import com.codeoptimizer.api.Issue;
import com.codeoptimizer.api.IssueCategory;
import com.codeoptimizer.api.SourceUnit;
import com.codeoptimizer.api.error.Severity;
import com.codeoptimizer.config.OptimizerConfig;
import com.codeoptimizer.parser.ElementKind;
import com.codeoptimizer.parser.SyntaxElement;
import com.codeoptimizer.parser.SyntaxTree;

/**
 * Reports loops nested at or beyond the configured depth, once per outermost offending loop.
 */
public class NestedLoopDetector implements DetectorPlugin {
    private int maxDepth = 3;

    @Override
    public String getName() {
        return "nestedLoops";
    }

    @Override
    public void initialize(OptimizerConfig config) {
        this.maxDepth = config.getPluginConfig("nestedLoops", "maxDepth", 3);
    }

    @Override
    public AnalysisFragment detect(SourceUnit unit) {
        SyntaxTree tree = unit.getTree();
        List<SyntaxElement> loops = tree.getElements(ElementKind.LOOP);
        List<Issue> issues = new ArrayList<>();

        for (SyntaxElement loop : loops) {
            if (tree.loopDepth(loop) != maxDepth) {
                continue;
            }

            int deepest = maxDepth;
            for (SyntaxElement inner : loops) {
                if (loop.contains(inner)) {
                    deepest = Math.max(deepest, tree.loopDepth(inner));
                }
            }

            issues.add(IssueFactory.create(unit, loop.getStart(), loop.getEnd(),
                    IssueCodes.NESTED_LOOPS, IssueCategory.PERFORMANCE,
                    deepest > maxDepth ? Severity.MAJOR : Severity.MINOR,
                    "Loops nested " + deepest + " levels deep",
                    "Index the inner collection in a map or extract the inner loops into a function"));
        }

        return AnalysisFragment.ofIssues(issues);
    }
}
