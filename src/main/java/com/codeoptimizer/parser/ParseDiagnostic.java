package com.codeoptimizer.parser;

/**
 * A problem reported by a parser.
 */
public class ParseDiagnostic {
    private final String message;
    private final int line;
    private final int column;
    private final int offset;

    public ParseDiagnostic(String message, int line, int column, int offset) {
        this.message = message;
        this.line = line;
        this.column = column;
        this.offset = offset;
    }

    public String getMessage() { return message; }
    public int getLine() { return line; }
    public int getColumn() { return column; }
    public int getOffset() { return offset; }

    @Override
    public String toString() {
        return line + ":" + column + " " + message;
    }
}
