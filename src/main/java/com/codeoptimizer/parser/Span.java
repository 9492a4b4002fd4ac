package com.codeoptimizer.parser;

/**
 * Character range [start, end) inside a source text.
 */
public class Span {
    private final int start;
    private final int end;

    public Span(int start, int end) {
        this.start = start;
        this.end = end;
    }

    public int getStart() { return start; }
    public int getEnd() { return end; }

    public boolean contains(int offset) {
        return offset >= start && offset < end;
    }

    public boolean contains(Span other) {
        return start <= other.start && other.end <= end;
    }

    public String textOf(String source) {
        return source.substring(Math.max(0, start), Math.min(source.length(), end));
    }

    @Override
    public String toString() {
        return "[" + start + ", " + end + ")";
    }
}
