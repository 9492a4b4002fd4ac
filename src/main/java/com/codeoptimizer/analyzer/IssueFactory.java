package com.codeoptimizer.analyzer;

import com.codeoptimizer.api.Issue;
import com.codeoptimizer.api.IssueCategory;
import com.codeoptimizer.api.Location;
import com.codeoptimizer.api.SourceUnit;
import com.codeoptimizer.api.error.Severity;
import com.codeoptimizer.parser.LineIndex;

/**
 * Builds issues anchored to a character range of a source unit.
 */
public final class IssueFactory {
    private static final int MAX_SNIPPET_LENGTH = 120;

    private IssueFactory() {
    }

    public static Issue.Builder at(SourceUnit unit, int start, int end) {
        LineIndex index = unit.getTree().getLineIndex();
        Location location = new Location(unit.getPath(), index.lineOf(start), index.columnOf(start), start, end);
        return Issue.builder()
                .location(location)
                .codeSnippet(_snippet(unit.getText(), start, end));
    }

    /**
     * Issue about the whole file, anchored at line 1 without a range.
     */
    public static Issue.Builder atFile(SourceUnit unit) {
        return Issue.builder().location(new Location(unit.getPath(), 1, 1, -1, -1));
    }

    public static Issue create(SourceUnit unit, int start, int end, String code, IssueCategory category,
                               Severity severity, String message, String suggestion) {
        return at(unit, start, end)
                .code(code)
                .category(category)
                .severity(severity)
                .message(message)
                .suggestion(suggestion)
                .build();
    }

    private static String _snippet(String text, int start, int end) {
        if (start < 0 || end <= start || end > text.length()) {
            return null;
        }
        String snippet = text.substring(start, end);
        return snippet.length() > MAX_SNIPPET_LENGTH ? snippet.substring(0, MAX_SNIPPET_LENGTH) + "..." : snippet;
    }
}
