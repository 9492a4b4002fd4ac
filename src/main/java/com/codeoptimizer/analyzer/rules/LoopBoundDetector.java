package com.codeoptimizer.analyzer.rules;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
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
import com.codeoptimizer.parser.ElementKind;
import com.codeoptimizer.parser.SourceMask;
import com.codeoptimizer.parser.SyntaxElement;
import com.codeoptimizer.plugins.FileType;

/**
 * Finds counting loops that re-read the collection size in every iteration although the
 * loop body never changes the collection.
 */
public class LoopBoundDetector implements DetectorPlugin {

    /**
     * Groups: 1 keyword, 2 index, 3 initial value, 4 comparison, 5 collection, 6 size accessor.
     */
    public static final Pattern JS_LOOP_HEADER = Pattern.compile(
            "for\\s*\\(\\s*(let|var)\\s+([A-Za-z_$][\\w$]*)\\s*=\\s*([^;,]+?)\\s*;\\s*\\2\\s*(<=?)\\s*"
                    + "([A-Za-z_$][\\w$]*(?:\\.[A-Za-z_$][\\w$]*)*)\\.(length)\\s*;");

    public static final Pattern JAVA_LOOP_HEADER = Pattern.compile(
            "for\\s*\\(\\s*(int)\\s+([A-Za-z_$][\\w$]*)\\s*=\\s*([^;,]+?)\\s*;\\s*\\2\\s*(<=?)\\s*"
                    + "([A-Za-z_$][\\w$]*(?:\\.[A-Za-z_$][\\w$]*)*)\\.(size\\(\\s*\\)|length\\(\\s*\\))\\s*;");

    private static final String MUTATORS = "(?:push|pop|shift|unshift|splice|add|addAll|remove|removeIf|clear|append|insert|delete)";

    @Override
    public String getName() {
        return "loopBounds";
    }

    public static Pattern headerPattern(FileType type) {
        return type == FileType.JAVA ? JAVA_LOOP_HEADER : JS_LOOP_HEADER;
    }

    @Override
    public AnalysisFragment detect(SourceUnit unit) {
        String masked = SourceMask.maskCode(unit.getText(), unit.getFileType());
        Matcher matcher = headerPattern(unit.getFileType()).matcher(masked);
        List<Issue> issues = new ArrayList<>();

        while (matcher.find()) {
            String collection = matcher.group(5);
            Optional<SyntaxElement> loop = unit.getTree().findInnermost(ElementKind.LOOP, matcher.start(), matcher.end());
            if (loop.isEmpty() || _mutates(masked.substring(matcher.end(), loop.get().getEnd()), collection)) {
                continue;
            }

            issues.add(IssueFactory.create(unit, matcher.start(), matcher.end(),
                    IssueCodes.LOOP_BOUND_RECOMPUTED, IssueCategory.PERFORMANCE, Severity.MINOR,
                    "Loop re-reads " + collection + "." + matcher.group(6) + " on every iteration",
                    "Read the size once before the loop"));
        }

        return AnalysisFragment.ofIssues(issues);
    }

    private static boolean _mutates(String body, String collection) {
        Pattern mutation = Pattern.compile(Pattern.quote(collection) + "\\s*(?:\\.\\s*" + MUTATORS + "\\s*\\(|\\.length\\s*=[^=]|=[^=])");
        return mutation.matcher(body).find();
    }
}
