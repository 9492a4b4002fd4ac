package com.codeoptimizer.parser;

import com.codeoptimizer.plugins.FileType;

/**
 * Blanks out comments and literal contents while keeping every offset and line break,
 * so lexical rules can run plain regular expressions over code only.
 */
public final class SourceMask {

    private SourceMask() {
    }

    /**
     * Comments become spaces, string and template literal contents become spaces, quotes stay.
     */
    public static String maskCode(String text, FileType type) {
        return _mask(text, type, true);
    }

    /**
     * Only comments become spaces.
     */
    public static String maskComments(String text, FileType type) {
        return _mask(text, type, false);
    }

    /**
     * Index of the bracket closing the one at {@code openIndex}, or -1. Expects masked text.
     */
    public static int findClosing(String masked, int openIndex) {
        char open = masked.charAt(openIndex);
        char close = open == '(' ? ')' : open == '[' ? ']' : open == '{' ? '}' : 0;
        if (close == 0) {
            return -1;
        }
        int depth = 0;
        for (int i = openIndex; i < masked.length(); i++) {
            char c = masked.charAt(i);
            if (c == open) {
                depth++;
            } else if (c == close) {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    private static String _mask(String text, FileType type, boolean maskLiterals) {
        boolean templates = type.isJavaScriptFamily();
        char[] out = text.toCharArray();
        int i = 0;
        int n = text.length();

        while (i < n) {
            char c = text.charAt(i);
            char next = i + 1 < n ? text.charAt(i + 1) : 0;

            if (c == '/' && next == '/') {
                while (i < n && text.charAt(i) != '\n' && text.charAt(i) != '\r') {
                    out[i++] = ' ';
                }
            } else if (c == '/' && next == '*') {
                int end = text.indexOf("*/", i + 2);
                end = end < 0 ? n : end + 2;
                _blank(out, i, end);
                i = end;
            } else if (!templates && text.startsWith("\"\"\"", i)) {
                int close = text.indexOf("\"\"\"", i + 3);
                int end = close < 0 ? n : close + 3;
                if (maskLiterals) {
                    _blank(out, i + 3, close < 0 ? n : close);
                }
                i = end;
            } else if (c == '"' || c == '\'' || (templates && c == '`')) {
                int end = _literalEnd(text, i, c);
                if (maskLiterals) {
                    boolean closed = end - 1 > i && text.charAt(end - 1) == c;
                    _blank(out, i + 1, closed ? end - 1 : end);
                }
                i = end;
            } else {
                i++;
            }
        }
        return new String(out);
    }

    private static int _literalEnd(String text, int start, char quote) {
        int i = start + 1;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == '\\') {
                i += 2;
                continue;
            }
            if (c == quote) {
                return i + 1;
            }
            if ((c == '\n' || c == '\r') && quote != '`') {
                return i;
            }
            i++;
        }
        return text.length();
    }

    private static void _blank(char[] out, int from, int to) {
        for (int i = from; i < to && i < out.length; i++) {
            if (out[i] != '\n' && out[i] != '\r') {
                out[i] = ' ';
            }
        }
    }
}
