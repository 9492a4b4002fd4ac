package com.codeoptimizer.plugins.javascript;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.codeoptimizer.api.error.ParseException;
import com.codeoptimizer.parser.ElementKind;
import com.codeoptimizer.parser.LineIndex;
import com.codeoptimizer.parser.ParseDiagnostic;
import com.codeoptimizer.parser.SourceMask;
import com.codeoptimizer.parser.Span;
import com.codeoptimizer.parser.SyntaxElement;
import com.codeoptimizer.parser.SyntaxParser;
import com.codeoptimizer.parser.SyntaxTree;
import com.codeoptimizer.plugins.FileType;
import org.openjdk.nashorn.api.tree.BinaryTree;
import org.openjdk.nashorn.api.tree.CaseTree;
import org.openjdk.nashorn.api.tree.CatchTree;
import org.openjdk.nashorn.api.tree.ClassDeclarationTree;
import org.openjdk.nashorn.api.tree.CompilationUnitTree;
import org.openjdk.nashorn.api.tree.ConditionalExpressionTree;
import org.openjdk.nashorn.api.tree.Diagnostic;
import org.openjdk.nashorn.api.tree.DoWhileLoopTree;
import org.openjdk.nashorn.api.tree.ExpressionTree;
import org.openjdk.nashorn.api.tree.ForInLoopTree;
import org.openjdk.nashorn.api.tree.ForLoopTree;
import org.openjdk.nashorn.api.tree.ForOfLoopTree;
import org.openjdk.nashorn.api.tree.FunctionCallTree;
import org.openjdk.nashorn.api.tree.FunctionDeclarationTree;
import org.openjdk.nashorn.api.tree.FunctionExpressionTree;
import org.openjdk.nashorn.api.tree.IdentifierTree;
import org.openjdk.nashorn.api.tree.IfTree;
import org.openjdk.nashorn.api.tree.MemberSelectTree;
import org.openjdk.nashorn.api.tree.Parser;
import org.openjdk.nashorn.api.tree.SimpleTreeVisitorES6;
import org.openjdk.nashorn.api.tree.Tree;
import org.openjdk.nashorn.api.tree.WhileLoopTree;

/**
 * JavaScript parser backed by the Nashorn parser API in ES6 mode. Sources with top-level
 * import or export statements are parsed as ES6 modules.
 */
public class JavaScriptParser implements SyntaxParser {
    private static final Pattern MODULE_SYNTAX = Pattern.compile(
            "^\\s*(?:import\\s*[\\w{*'\"]|export\\s)", Pattern.MULTILINE);
    private static final Pattern SCOPED_LOOP_DECLARATION = Pattern.compile("\\bfor\\s*\\(\\s*(let|const)\\b");

    @Override
    public List<FileType> getSupportedTypes() {
        return List.of(FileType.JAVASCRIPT);
    }

    @Override
    public SyntaxTree parse(Path path, String text) throws ParseException {
        LineIndex index = new LineIndex(text);
        List<ParseDiagnostic> diagnostics = new ArrayList<>();

        CompilationUnitTree cu = _parse(path, text, diagnostics, index);
        if (cu == null || !diagnostics.isEmpty()) {
            throw new ParseException(path, diagnostics);
        }

        List<SyntaxElement> elements = new ArrayList<>();
        try {
            for (Tree statement : cu.getSourceElements()) {
                _record(elements, ElementKind.STATEMENT, statement, null, List.of(), List.of(), index, text);
            }
            cu.accept(new ElementCollector(elements, index, text), null);
        } catch (RuntimeException | AssertionError e) {
            throw new ParseException(path, "unsupported syntax: " + e.getMessage(), e);
        }

        return new SyntaxTree(path, FileType.JAVASCRIPT, text, elements, index);
    }

    @Override
    public List<ParseDiagnostic> diagnose(Path path, String text) {
        List<ParseDiagnostic> diagnostics = new ArrayList<>();
        LineIndex index = new LineIndex(text);
        CompilationUnitTree cu = _parse(path, text, diagnostics, index);
        if (cu == null && diagnostics.isEmpty()) {
            diagnostics.add(new ParseDiagnostic("Unparseable JavaScript source", 1, 1, 0));
        }
        return diagnostics;
    }

    private CompilationUnitTree _parse(Path path, String text, List<ParseDiagnostic> diagnostics, LineIndex index) {
        String maskedText = SourceMask.maskCode(text, FileType.JAVASCRIPT);
        Parser parser = MODULE_SYNTAX.matcher(maskedText).find()
                ? Parser.create("--es6-module")
                : Parser.create("--language=es6");
        String parsedText = _withVarLoopDeclarations(text, maskedText);

        try {
            return parser.parse(path.toString(), parsedText, diagnostic -> {
                if (diagnostic.getKind() == Diagnostic.Kind.ERROR) {
                    int offset = (int) Math.max(0, Math.min(text.length(), diagnostic.getPosition()));
                    diagnostics.add(new ParseDiagnostic(_firstLine(diagnostic.getMessage()),
                            index.lineOf(offset), index.columnOf(offset), offset));
                }
            });
        } catch (RuntimeException | AssertionError e) {
            diagnostics.add(new ParseDiagnostic(_firstLine(String.valueOf(e.getMessage())), 1, 1, 0));
            return null;
        }
    }

    /**
     * Nashorn desugars {@code for (let ...)} and {@code for (const ...)} into a block its tree API
     * cannot translate, losing the loop. The declaration keyword is replaced by {@code var} padded
     * to the same length, so every offset of the text stays valid.
     */
    static String _withVarLoopDeclarations(String text, String maskedText) {
        Matcher matcher = SCOPED_LOOP_DECLARATION.matcher(maskedText);
        if (!matcher.find()) {
            return text;
        }

        StringBuilder rewritten = new StringBuilder(text);
        do {
            int start = matcher.start(1);
            int end = matcher.end(1);
            rewritten.replace(start, end, String.format("%-" + (end - start) + "s", "var"));
        } while (matcher.find());
        return rewritten.toString();
    }

    private static String _firstLine(String message) {
        int newline = message.indexOf('\n');
        return newline >= 0 ? message.substring(0, newline) : message;
    }

    private static void _record(List<SyntaxElement> elements, ElementKind kind, Tree node, String name,
                                List<String> parameters, List<Span> parts, LineIndex index, String text) {
        _record(elements, kind, node.getStartPosition(), node.getEndPosition(), name, parameters, parts, index, text);
    }

    private static void _record(List<SyntaxElement> elements, ElementKind kind, long nodeStart, long nodeEnd,
                                String name, List<String> parameters, List<Span> parts, LineIndex index, String text) {
        int start = (int) Math.max(0, nodeStart);
        int end = (int) Math.min(text.length(), nodeEnd);
        if (end <= start) {
            return;
        }
        elements.add(new SyntaxElement(kind, name, new Span(start, end),
                index.lineOf(start), index.columnOf(start), index.lineOf(end - 1), parameters, parts));
    }

    private static Span _span(Tree node, String text) {
        int start = (int) Math.max(0, node.getStartPosition());
        int end = (int) Math.min(text.length(), node.getEndPosition());
        return new Span(start, Math.max(start, end));
    }

    private static List<String> _parameterNames(List<? extends ExpressionTree> parameters) {
        List<String> names = new ArrayList<>();
        for (int i = 0; i < parameters.size(); i++) {
            ExpressionTree parameter = parameters.get(i);
            names.add(parameter instanceof IdentifierTree ? ((IdentifierTree) parameter).getName() : "arg" + i);
        }
        return names;
    }

    /**
     * Records the constructs the analyzer cares about. Every override delegates to super so the
     * whole tree is visited.
     */
    private static class ElementCollector extends SimpleTreeVisitorES6<Void, Void> {
        private final List<SyntaxElement> elements;
        private final LineIndex index;
        private final String text;

        ElementCollector(List<SyntaxElement> elements, LineIndex index, String text) {
            this.elements = elements;
            this.index = index;
            this.text = text;
        }

        private void _add(ElementKind kind, Tree node, String name) {
            _record(elements, kind, node, name, List.of(), List.of(), index, text);
        }

        @Override
        public Void visitFunctionDeclaration(FunctionDeclarationTree node, Void r) {
            String name = node.getName() != null ? node.getName().getName() : null;
            _record(elements, ElementKind.FUNCTION, node, name, _parameterNames(node.getParameters()),
                    List.of(), index, text);
            return super.visitFunctionDeclaration(node, r);
        }

        @Override
        public Void visitFunctionExpression(FunctionExpressionTree node, Void r) {
            String name = node.getName() != null ? node.getName().getName() : null;
            _record(elements, ElementKind.FUNCTION, node, name, _parameterNames(node.getParameters()),
                    List.of(), index, text);
            return super.visitFunctionExpression(node, r);
        }

        @Override
        public Void visitClassDeclaration(ClassDeclarationTree node, Void r) {
            _add(ElementKind.CLASS, node, node.getName() != null ? node.getName().getName() : null);
            return super.visitClassDeclaration(node, r);
        }

        @Override
        public Void visitIf(IfTree node, Void r) {
            _add(ElementKind.CONDITIONAL, node, null);
            return super.visitIf(node, r);
        }

        @Override
        public Void visitForLoop(ForLoopTree node, Void r) {
            _add(ElementKind.LOOP, node, "for");
            return super.visitForLoop(node, r);
        }

        @Override
        public Void visitForInLoop(ForInLoopTree node, Void r) {
            _add(ElementKind.LOOP, node, "for-in");
            return super.visitForInLoop(node, r);
        }

        @Override
        public Void visitForOfLoop(ForOfLoopTree node, Void r) {
            _add(ElementKind.LOOP, node, "for-of");
            return super.visitForOfLoop(node, r);
        }

        @Override
        public Void visitWhileLoop(WhileLoopTree node, Void r) {
            _add(ElementKind.LOOP, node, "while");
            return super.visitWhileLoop(node, r);
        }

        @Override
        public Void visitDoWhileLoop(DoWhileLoopTree node, Void r) {
            _add(ElementKind.LOOP, node, "do");
            return super.visitDoWhileLoop(node, r);
        }

        @Override
        public Void visitCase(CaseTree node, Void r) {
            if (node.getExpression() != null) {
                _add(ElementKind.CASE, node, null);
            }
            return super.visitCase(node, r);
        }

        @Override
        public Void visitCatch(CatchTree node, Void r) {
            _add(ElementKind.CATCH, node, null);
            return super.visitCatch(node, r);
        }

        @Override
        public Void visitConditionalExpression(ConditionalExpressionTree node, Void r) {
            List<Span> parts = List.of(
                    _span(node.getCondition(), text),
                    _span(node.getTrueExpression(), text),
                    _span(node.getFalseExpression(), text));
            // Nashorn starts a conditional expression at its '?' token
            long start = Math.min(node.getStartPosition(), node.getCondition().getStartPosition());
            _record(elements, ElementKind.TERNARY, start, node.getEndPosition(), null, List.of(), parts, index, text);
            return super.visitConditionalExpression(node, r);
        }

        @Override
        public Void visitBinary(BinaryTree node, Void r) {
            if (node.getKind() == Tree.Kind.CONDITIONAL_AND) {
                _add(ElementKind.LOGICAL, node, "&&");
            } else if (node.getKind() == Tree.Kind.CONDITIONAL_OR) {
                _add(ElementKind.LOGICAL, node, "||");
            }
            return super.visitBinary(node, r);
        }

        @Override
        public Void visitFunctionCall(FunctionCallTree node, Void r) {
            ExpressionTree callee = node.getFunctionSelect();
            String name = null;
            if (callee instanceof IdentifierTree) {
                name = ((IdentifierTree) callee).getName();
            } else if (callee instanceof MemberSelectTree) {
                name = ((MemberSelectTree) callee).getIdentifier();
            }
            _add(ElementKind.CALL, node, name);
            return super.visitFunctionCall(node, r);
        }
    }
}
