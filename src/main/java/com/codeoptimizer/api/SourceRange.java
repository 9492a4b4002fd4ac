package com.codeoptimizer.api;

import java.util.Objects;

/**
 * The original text a transformation replaces, with its character offsets [start, end).
 */
public class SourceRange {
    private final int start;
    private final int end;
    private final String text;

    public SourceRange(int start, int end, String text) {
        if (start < 0 || start >= end) {
            throw new IllegalArgumentException("Invalid range [" + start + ", " + end + ")");
        }
        Objects.requireNonNull(text, "text");
        if (text.length() != end - start) {
            throw new IllegalArgumentException("Original text length " + text.length() +
                    " does not match range [" + start + ", " + end + ")");
        }
        this.start = start;
        this.end = end;
        this.text = text;
    }

    /**
     * Captures the range [start, end) of the given source text.
     */
    public static SourceRange of(String source, int start, int end) {
        if (end > source.length()) {
            throw new IllegalArgumentException("Range end " + end + " is past the text length " + source.length());
        }
        return new SourceRange(start, end, source.substring(start, end));
    }

    public int getStart() { return start; }
    public int getEnd() { return end; }
    public String getText() { return text; }

    public int length() {
        return end - start;
    }

    public boolean overlaps(SourceRange other) {
        return start < other.end && other.start < end;
    }

    /**
     * True when the given text still holds the original substring at this range.
     */
    public boolean matches(String source) {
        return source != null && end <= source.length() && source.regionMatches(start, text, 0, text.length());
    }

    @Override
    public String toString() {
        return "[" + start + ", " + end + ")";
    }
}
