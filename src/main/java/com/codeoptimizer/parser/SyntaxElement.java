package com.codeoptimizer.parser;

import java.util.List;

/**
 * One construct of a parsed file in language-neutral form.
 */
public class SyntaxElement {
    private final ElementKind kind;
    private final String name;
    private final Span span;
    private final int line;
    private final int column;
    private final int endLine;
    private final List<String> parameters;
    private final List<Span> parts;

    public SyntaxElement(ElementKind kind, String name, Span span, int line, int column, int endLine,
                         List<String> parameters, List<Span> parts) {
        this.kind = kind;
        this.name = name;
        this.span = span;
        this.line = line;
        this.column = column;
        this.endLine = endLine;
        this.parameters = parameters != null ? List.copyOf(parameters) : List.of();
        this.parts = parts != null ? List.copyOf(parts) : List.of();
    }

    public ElementKind getKind() { return kind; }

    /**
     * Function, class or callee name. Null for anonymous constructs.
     */
    public String getName() { return name; }

    public Span getSpan() { return span; }
    public int getStart() { return span.getStart(); }
    public int getEnd() { return span.getEnd(); }
    public int getLine() { return line; }
    public int getColumn() { return column; }
    public int getEndLine() { return endLine; }
    public List<String> getParameters() { return parameters; }

    /**
     * Sub-ranges: condition, then and else branch for a ternary.
     */
    public List<Span> getParts() { return parts; }

    public int getLineCount() {
        return endLine - line + 1;
    }

    /**
     * Strict containment, an element does not contain itself.
     */
    public boolean contains(SyntaxElement other) {
        return this != other && span.contains(other.span);
    }

    @Override
    public String toString() {
        return kind + (name != null ? " " + name : "") + " " + span + " line " + line;
    }
}
