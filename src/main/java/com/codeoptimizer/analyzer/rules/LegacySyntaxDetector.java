package com.codeoptimizer.analyzer.rules;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.codeoptimizer.analyzer.IssueCodes;
import com.codeoptimizer.analyzer.IssueFactory;
import com.codeoptimizer.api.AnalysisFragment;
import com.codeoptimizer.api.DetectorPlugin;
import com.codeoptimizer.api.Issue;
import com.codeoptimizer.api.IssueCategory;
import com.codeoptimizer.api.SourceUnit;
import com.codeoptimizer.api.error.Severity;
import com.codeoptimizer.parser.SourceMask;

/**
 * JavaScript idioms superseded by ES6: var declarations and loose equality.
 */
public class LegacySyntaxDetector implements DetectorPlugin {
    private static final Pattern VAR_KEYWORD = Pattern.compile("(?<![\\w$.])var(?=\\s+[A-Za-z_$\\[{])");
    private static final Pattern LOOSE_EQUALITY = Pattern.compile("(?<![=!<>])([=!]=)(?!=)");

    @Override
    public String getName() {
        return "legacySyntax";
    }

    @Override
    public AnalysisFragment detect(SourceUnit unit) {
        if (!unit.getFileType().isJavaScriptFamily()) {
            return AnalysisFragment.ofIssues(List.of());
        }

        String masked = SourceMask.maskCode(unit.getText(), unit.getFileType());
        List<Issue> issues = new ArrayList<>();

        Matcher var = VAR_KEYWORD.matcher(masked);
        while (var.find()) {
            issues.add(IssueFactory.create(unit, var.start(), var.end(),
                    IssueCodes.VAR_DECLARATION, IssueCategory.MAINTAINABILITY, Severity.MINOR,
                    "Function-scoped 'var' declaration",
                    "Use 'let' or 'const'"));
        }

        Matcher equality = LOOSE_EQUALITY.matcher(masked);
        while (equality.find()) {
            issues.add(IssueFactory.create(unit, equality.start(1), equality.end(1),
                    IssueCodes.LOOSE_EQUALITY, IssueCategory.MAINTAINABILITY, Severity.MINOR,
                    "Loose equality operator '" + equality.group(1) + "' coerces operand types",
                    "Use '" + equality.group(1) + "=' instead"));
        }

        return AnalysisFragment.ofIssues(issues);
    }
}
