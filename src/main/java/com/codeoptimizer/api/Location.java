package com.codeoptimizer.api;

import java.nio.file.Path;

/**
 * Position of an issue: 1-based line and column plus the character offset range [start, end).
 */
public class Location {
    private final Path file;
    private final int line;
    private final int column;
    private final int startOffset;
    private final int endOffset;

    public Location(Path file, int line, int column, int startOffset, int endOffset) {
        this.file = file;
        this.line = line;
        this.column = column;
        this.startOffset = startOffset;
        this.endOffset = endOffset;
    }

    public Path getFile() { return file; }
    public int getLine() { return line; }
    public int getColumn() { return column; }
    public int getStartOffset() { return startOffset; }
    public int getEndOffset() { return endOffset; }

    public boolean hasRange() {
        return startOffset >= 0 && endOffset > startOffset;
    }

    @Override
    public String toString() {
        String name = file != null && file.getFileName() != null ? file.getFileName().toString() : "<unknown>";
        return name + ":" + line + ":" + column;
    }
}
