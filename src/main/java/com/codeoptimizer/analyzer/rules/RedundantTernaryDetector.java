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
import com.codeoptimizer.parser.ElementKind;
import com.codeoptimizer.parser.SyntaxElement;

/**
 * Ternaries that only map a condition to a boolean literal, such as {@code c ? true : false}.
 */
public class RedundantTernaryDetector implements DetectorPlugin {

    @Override
    public String getName() {
        return "redundantTernary";
    }

    /**
     * True when the ternary's branches are the literals true and false in either order.
     */
    public static boolean isRedundant(SyntaxElement ternary, String text) {
        if (ternary.getParts().size() != 3) {
            return false;
        }
        String whenTrue = ternary.getParts().get(1).textOf(text).trim();
        String whenFalse = ternary.getParts().get(2).textOf(text).trim();
        return ("true".equals(whenTrue) && "false".equals(whenFalse))
                || ("false".equals(whenTrue) && "true".equals(whenFalse));
    }

    @Override
    public AnalysisFragment detect(SourceUnit unit) {
        List<Issue> issues = new ArrayList<>();

        for (SyntaxElement ternary : unit.getTree().getElements(ElementKind.TERNARY)) {
            if (isRedundant(ternary, unit.getText())) {
                issues.add(IssueFactory.create(unit, ternary.getStart(), ternary.getEnd(),
                        IssueCodes.REDUNDANT_TERNARY, IssueCategory.COMPLEXITY, Severity.MINOR,
                        "Conditional expression returns a boolean literal",
                        "Use the condition itself"));
            }
        }

        return AnalysisFragment.ofIssues(issues);
    }
}
