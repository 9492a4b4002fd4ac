package com.codeoptimizer.plugins.java;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import com.codeoptimizer.api.error.ParseException;
import com.codeoptimizer.parser.ElementKind;
import com.codeoptimizer.parser.LineIndex;
import com.codeoptimizer.parser.ParseDiagnostic;
import com.codeoptimizer.parser.Span;
import com.codeoptimizer.parser.SyntaxElement;
import com.codeoptimizer.parser.SyntaxParser;
import com.codeoptimizer.parser.SyntaxTree;
import com.codeoptimizer.plugins.FileType;
import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.Problem;
import com.github.javaparser.Range;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.CallableDeclaration;
import com.github.javaparser.ast.body.Parameter;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.expr.BinaryExpr;
import com.github.javaparser.ast.expr.ConditionalExpr;
import com.github.javaparser.ast.expr.LambdaExpr;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.stmt.CatchClause;
import com.github.javaparser.ast.stmt.DoStmt;
import com.github.javaparser.ast.stmt.ForEachStmt;
import com.github.javaparser.ast.stmt.ForStmt;
import com.github.javaparser.ast.stmt.IfStmt;
import com.github.javaparser.ast.stmt.SwitchEntry;
import com.github.javaparser.ast.stmt.WhileStmt;

/**
 * Java parser backed by JavaParser. JavaParser positions are inclusive line/column pairs and
 * are converted to half-open character offsets.
 */
public class JavaSourceParser implements SyntaxParser {
    private final ParserConfiguration configuration = new ParserConfiguration()
            .setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17);

    @Override
    public List<FileType> getSupportedTypes() {
        return List.of(FileType.JAVA);
    }

    @Override
    public SyntaxTree parse(Path path, String text) throws ParseException {
        LineIndex index = new LineIndex(text);
        ParseResult<CompilationUnit> result = _parse(text);

        if (!result.isSuccessful() || result.getResult().isEmpty()) {
            throw new ParseException(path, _toDiagnostics(result.getProblems(), index));
        }

        CompilationUnit cu = result.getResult().get();
        List<SyntaxElement> elements = new ArrayList<>();

        cu.findAll(TypeDeclaration.class).forEach(type ->
                _add(elements, ElementKind.CLASS, type, type.getNameAsString(), List.of(), List.of(), index));

        cu.findAll(CallableDeclaration.class).forEach(callable -> {
            List<String> parameters = new ArrayList<>();
            for (Object parameter : callable.getParameters()) {
                parameters.add(((Parameter) parameter).getNameAsString());
            }
            _add(elements, ElementKind.FUNCTION, callable, callable.getNameAsString(), parameters, List.of(), index);
        });

        cu.findAll(LambdaExpr.class).forEach(lambda -> _add(elements, ElementKind.FUNCTION, lambda, null,
                lambda.getParameters().stream().map(Parameter::getNameAsString).collect(Collectors.toList()),
                List.of(), index));

        cu.findAll(IfStmt.class).forEach(node -> _add(elements, ElementKind.CONDITIONAL, node, null, index));
        cu.findAll(ForStmt.class).forEach(node -> _add(elements, ElementKind.LOOP, node, null, index));
        cu.findAll(ForEachStmt.class).forEach(node -> _add(elements, ElementKind.LOOP, node, null, index));
        cu.findAll(WhileStmt.class).forEach(node -> _add(elements, ElementKind.LOOP, node, null, index));
        cu.findAll(DoStmt.class).forEach(node -> _add(elements, ElementKind.LOOP, node, null, index));
        cu.findAll(CatchClause.class).forEach(node -> _add(elements, ElementKind.CATCH, node, null, index));

        cu.findAll(SwitchEntry.class).stream()
                .filter(entry -> !entry.getLabels().isEmpty())
                .forEach(entry -> _add(elements, ElementKind.CASE, entry, null, index));

        cu.findAll(BinaryExpr.class).stream()
                .filter(expr -> expr.getOperator() == BinaryExpr.Operator.AND
                        || expr.getOperator() == BinaryExpr.Operator.OR)
                .forEach(expr -> _add(elements, ElementKind.LOGICAL, expr, expr.getOperator().asString(), index));

        cu.findAll(ConditionalExpr.class).forEach(expr -> {
            List<Span> parts = new ArrayList<>();
            _span(expr.getCondition(), index).ifPresent(parts::add);
            _span(expr.getThenExpr(), index).ifPresent(parts::add);
            _span(expr.getElseExpr(), index).ifPresent(parts::add);
            _add(elements, ElementKind.TERNARY, expr, null, List.of(), parts.size() == 3 ? parts : List.of(), index);
        });

        cu.findAll(MethodCallExpr.class).forEach(call ->
                _add(elements, ElementKind.CALL, call, call.getNameAsString(), index));

        return new SyntaxTree(path, FileType.JAVA, text, elements, index);
    }

    @Override
    public List<ParseDiagnostic> diagnose(Path path, String text) {
        ParseResult<CompilationUnit> result = _parse(text);
        if (result.isSuccessful() && result.getResult().isPresent()) {
            return List.of();
        }
        List<ParseDiagnostic> diagnostics = _toDiagnostics(result.getProblems(), new LineIndex(text));
        return diagnostics.isEmpty() ? List.of(new ParseDiagnostic("Unparseable Java source", 1, 1, 0)) : diagnostics;
    }

    private ParseResult<CompilationUnit> _parse(String text) {
        // JavaParser is not thread-safe, one instance per parse
        return new JavaParser(configuration).parse(text);
    }

    private static void _add(List<SyntaxElement> elements, ElementKind kind, Node node, String name, LineIndex index) {
        _add(elements, kind, node, name, List.of(), List.of(), index);
    }

    private static void _add(List<SyntaxElement> elements, ElementKind kind, Node node, String name,
                             List<String> parameters, List<Span> parts, LineIndex index) {
        Optional<Range> range = node.getRange();
        if (range.isEmpty()) {
            return;
        }
        Range r = range.get();
        Span span = _toSpan(r, index);
        elements.add(new SyntaxElement(kind, name, span, r.begin.line, r.begin.column, r.end.line, parameters, parts));
    }

    private static Optional<Span> _span(Node node, LineIndex index) {
        return node.getRange().map(r -> _toSpan(r, index));
    }

    private static Span _toSpan(Range range, LineIndex index) {
        int start = index.offsetOf(range.begin.line, range.begin.column);
        int end = index.offsetOf(range.end.line, range.end.column) + 1;
        return new Span(start, Math.max(start + 1, end));
    }

    private static List<ParseDiagnostic> _toDiagnostics(List<Problem> problems, LineIndex index) {
        List<ParseDiagnostic> diagnostics = new ArrayList<>();
        for (Problem problem : problems) {
            int line = 1;
            int column = 1;
            Optional<Range> range = problem.getLocation().flatMap(tokens -> tokens.getBegin().getRange());
            if (range.isPresent()) {
                line = range.get().begin.line;
                column = range.get().begin.column;
            }
            diagnostics.add(new ParseDiagnostic(problem.getMessage(), line, column, index.offsetOf(line, column)));
        }
        return diagnostics;
    }
}
