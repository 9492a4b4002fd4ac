package com.codeoptimizer.analyzer;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.codeoptimizer.api.Issue;
import com.codeoptimizer.api.IssueCategory;
import com.codeoptimizer.api.SourceUnit;
import com.codeoptimizer.api.error.Severity;
import com.codeoptimizer.parser.SourceMask;

/**
 * Lexical checks over the raw text, run on a copy with comments and literals blanked out.
 */
public class LexicalRules {
    private static final Pattern JS_EVAL = Pattern.compile("(?<![\\w$.])eval\\s*\\(");
    private static final Pattern JS_FUNCTION_CONSTRUCTOR = Pattern.compile("(?<![\\w$.])new\\s+Function\\s*\\(");
    private static final Pattern JS_DEBUG_PRINT = Pattern.compile(
            "(?<![\\w$.])console\\s*\\.\\s*(?:log|debug|info|trace)\\s*\\(");

    private static final Pattern JAVA_COMMAND_EXECUTION = Pattern.compile(
            "Runtime\\s*\\.\\s*getRuntime\\s*\\(\\s*\\)\\s*\\.\\s*exec\\s*\\(|(?<![\\w$.])new\\s+ProcessBuilder\\s*\\(");
    private static final Pattern JAVA_DEBUG_PRINT = Pattern.compile(
            "(?<![\\w$.])System\\s*\\.\\s*(?:out|err)\\s*\\.\\s*print(?:ln|f)?\\s*\\(|\\.\\s*printStackTrace\\s*\\(");

    public List<Issue> apply(SourceUnit unit) {
        String masked = SourceMask.maskCode(unit.getText(), unit.getFileType());
        List<Issue> issues = new ArrayList<>();

        if (unit.getFileType().isJavaScriptFamily()) {
            _scanCalls(unit, masked, JS_EVAL, false, (start, end) -> IssueFactory.create(unit, start, end,
                    IssueCodes.EVAL_USAGE, IssueCategory.SECURITY, Severity.CRITICAL,
                    "Usage of eval() is a security risk",
                    "Parse data with JSON.parse() or dispatch through a lookup table instead of evaluating code"), issues);

            _scanCalls(unit, masked, JS_FUNCTION_CONSTRUCTOR, false, (start, end) -> IssueFactory.create(unit, start, end,
                    IssueCodes.FUNCTION_CONSTRUCTOR, IssueCategory.SECURITY, Severity.MAJOR,
                    "The Function constructor evaluates code from strings",
                    "Declare the function statically"), issues);

            _scanCalls(unit, masked, JS_DEBUG_PRINT, true, (start, end) -> IssueFactory.create(unit, start, end,
                    IssueCodes.DEBUG_PRINT, IssueCategory.MAINTAINABILITY, Severity.INFO,
                    "Debug output left in code",
                    "Remove the statement or use a logger"), issues);
        } else {
            _scanCalls(unit, masked, JAVA_COMMAND_EXECUTION, false, (start, end) -> IssueFactory.create(unit, start, end,
                    IssueCodes.COMMAND_EXECUTION, IssueCategory.SECURITY, Severity.MAJOR,
                    "External command execution",
                    "Validate every argument and never pass user input to a shell"), issues);

            _scanCalls(unit, masked, JAVA_DEBUG_PRINT, true, (start, end) -> IssueFactory.create(unit, start, end,
                    IssueCodes.DEBUG_PRINT, IssueCategory.MAINTAINABILITY, Severity.INFO,
                    "Debug output left in code",
                    "Use java.util.logging or remove the statement"), issues);
        }

        return issues;
    }

    private interface IssueMaker {
        Issue make(int start, int end);
    }

    /**
     * Reports every call whose opening matches the pattern. The range covers the call up to its
     * closing parenthesis, and for statements also the receiver and the trailing semicolon.
     */
    private static void _scanCalls(SourceUnit unit, String masked, Pattern pattern, boolean statement,
                                   IssueMaker maker, List<Issue> issues) {
        Matcher matcher = pattern.matcher(masked);
        while (matcher.find()) {
            int open = matcher.end() - 1;
            int close = SourceMask.findClosing(masked, open);
            if (close < 0) {
                continue;
            }

            int start = matcher.start();
            int end = close + 1;
            if (statement) {
                while (start > 0 && _isReceiverChar(masked.charAt(start - 1))) {
                    start--;
                }
                int next = end;
                while (next < masked.length() && (masked.charAt(next) == ' ' || masked.charAt(next) == '\t')) {
                    next++;
                }
                if (next < masked.length() && masked.charAt(next) == ';') {
                    end = next + 1;
                }
            }
            issues.add(maker.make(start, end));
        }
    }

    private static boolean _isReceiverChar(char c) {
        return Character.isJavaIdentifierPart(c) || c == '.';
    }
}
