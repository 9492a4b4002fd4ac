package com.codeoptimizer.validation;

import java.util.List;
import java.util.Optional;

import com.codeoptimizer.api.SourceRange;
import com.codeoptimizer.api.Transformation;
import com.codeoptimizer.parser.ElementKind;
import com.codeoptimizer.parser.Span;
import com.codeoptimizer.parser.SyntaxElement;
import com.codeoptimizer.parser.SyntaxTree;
import com.codeoptimizer.plugins.javascript.ScriptHarness;

/**
 * The smallest region around an edit that can be executed and measured on its own: the
 * innermost enclosing function, else the top-level statements the edit touches, else the file.
 */
class ExecutionUnit {

    enum Kind {
        FUNCTION,
        STATEMENTS,
        FILE
    }

    private final Kind kind;
    private final Span originalSpan;
    private final Span editedSpan;
    private final String originalSource;
    private final String editedSource;
    private final int arity;
    private final boolean runnable;

    private ExecutionUnit(Kind kind, Span originalSpan, Span editedSpan, String originalSource,
                          String editedSource, int arity, boolean runnable) {
        this.kind = kind;
        this.originalSpan = originalSpan;
        this.editedSpan = editedSpan;
        this.originalSource = originalSource;
        this.editedSource = editedSource;
        this.arity = arity;
        this.runnable = runnable;
    }

    Kind getKind() { return kind; }
    Span getOriginalSpan() { return originalSpan; }
    Span getEditedSpan() { return editedSpan; }

    /**
     * Executable source before the edit: a function expression for function units, statements otherwise.
     */
    String getOriginalSource() { return originalSource; }

    String getEditedSource() { return editedSource; }
    int getArity() { return arity; }

    /**
     * False when the unit cannot run outside its file, for instance module import statements.
     */
    boolean isRunnable() { return runnable; }

    static ExecutionUnit locate(SyntaxTree tree, String text, Transformation transformation) {
        SourceRange edit = transformation.getOriginal();
        int delta = transformation.getReplacement().length() - edit.length();

        Optional<SyntaxElement> function = tree.findInnermost(ElementKind.FUNCTION, edit.getStart(), edit.getEnd());
        if (function.isPresent()) {
            SyntaxElement element = function.get();
            Span span = element.getSpan();
            String editedText = _edited(text, span, transformation);
            Optional<String> original = ScriptHarness.functionExpression(text, span.getStart(), span.textOf(text));
            Optional<String> edited = ScriptHarness.functionExpression(text, span.getStart(), editedText);

            if (original.isPresent() && edited.isPresent()) {
                return new ExecutionUnit(Kind.FUNCTION, span, new Span(span.getStart(), span.getEnd() + delta),
                        original.get(), edited.get(), element.getParameters().size(), true);
            }
        }

        List<SyntaxElement> statements = tree.elementsOverlapping(ElementKind.STATEMENT, edit.getStart(), edit.getEnd());
        if (!statements.isEmpty()) {
            int start = edit.getStart();
            int end = edit.getEnd();
            boolean runnable = true;
            for (SyntaxElement statement : statements) {
                start = Math.min(start, statement.getStart());
                end = Math.max(end, statement.getEnd());
                String source = statement.getSpan().textOf(text).trim();
                if (source.startsWith("import") || source.startsWith("export")) {
                    runnable = false;
                }
            }
            Span span = new Span(start, end);
            return new ExecutionUnit(Kind.STATEMENTS, span, new Span(start, end + delta),
                    span.textOf(text), _edited(text, span, transformation), 0, runnable);
        }

        Span file = new Span(0, text.length());
        return new ExecutionUnit(Kind.FILE, file, new Span(0, text.length() + delta),
                text, transformation.applyTo(text), 0, false);
    }

    /**
     * Text of the span after the edit, which must lie inside it.
     */
    private static String _edited(String text, Span span, Transformation transformation) {
        SourceRange edit = transformation.getOriginal();
        return text.substring(span.getStart(), edit.getStart()) + transformation.getReplacement() +
                text.substring(edit.getEnd(), span.getEnd());
    }
}
