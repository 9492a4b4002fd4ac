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

public class FunctionLengthDetector implements DetectorPlugin {
    private int maxLines = 50;
    private int criticalLines = 100;

    @Override
    public String getName() {
        return "functionLength";
    }

    @Override
    public void initialize(OptimizerConfig config) {
        this.maxLines = config.getPluginConfig("functionLength", "maxLines", 50);
        this.criticalLines = Math.max(maxLines, config.getPluginConfig("functionLength", "criticalLines", 100));
    }

    @Override
    public AnalysisFragment detect(SourceUnit unit) {
        List<Issue> issues = new ArrayList<>();

        for (SyntaxElement function : unit.getTree().getElements(ElementKind.FUNCTION)) {
            int lines = function.getLineCount();
            if (lines <= maxLines) {
                continue;
            }
            String name = function.getName() != null ? "'" + function.getName() + "'" : "Anonymous function";
            issues.add(IssueFactory.create(unit, function.getStart(), function.getEnd(),
                    IssueCodes.FUNCTION_TOO_LONG, IssueCategory.MAINTAINABILITY,
                    lines > criticalLines ? Severity.MAJOR : Severity.MINOR,
                    name + " is too long (" + lines + " lines, max allowed is " + maxLines + ")",
                    "Consider breaking this function into smaller helper functions"));
        }

        return AnalysisFragment.ofIssues(issues);
    }
}
