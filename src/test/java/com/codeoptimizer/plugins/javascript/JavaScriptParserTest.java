package com.codeoptimizer.plugins.javascript;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

import com.codeoptimizer.api.error.ParseException;
import com.codeoptimizer.parser.ElementKind;
import com.codeoptimizer.parser.ParseDiagnostic;
import com.codeoptimizer.parser.SourceMask;
import com.codeoptimizer.parser.SyntaxElement;
import com.codeoptimizer.parser.SyntaxTree;
import com.codeoptimizer.plugins.FileType;
import org.junit.jupiter.api.Test;

class JavaScriptParserTest {

    private final JavaScriptParser parser = new JavaScriptParser();
    private final Path path = Paths.get("sample.js");

    @Test
    void parse_function_recordsNameAndParameters() throws ParseException {
        SyntaxTree tree = parser.parse(path, "function add(a, b) { return a + b; }\n");

        List<SyntaxElement> functions = tree.getElements(ElementKind.FUNCTION);
        assertThat(functions).hasSize(1);
        assertThat(functions.get(0).getName()).isEqualTo("add");
        assertThat(functions.get(0).getParameters()).containsExactly("a", "b");
        assertThat(tree.getFileType()).isEqualTo(FileType.JAVASCRIPT);
    }

    @Test
    void parse_controlFlow_recordsBranchesAndLoops() throws ParseException {
        String code = """
                function f(items) {
                  for (let i = 0; i < 3; i++) {
                    while (items.length > 0 && i > 1) {
                      items.pop();
                    }
                  }
                  if (items) {
                    return items ? 1 : 2;
                  }
                  try { g(); } catch (e) { return 0; }
                }
                """;

        SyntaxTree tree = parser.parse(path, code);

        assertThat(tree.getElements(ElementKind.LOOP)).hasSize(2);
        assertThat(tree.getElements(ElementKind.CONDITIONAL)).hasSize(1);
        assertThat(tree.getElements(ElementKind.TERNARY)).hasSize(1);
        assertThat(tree.getElements(ElementKind.LOGICAL)).hasSize(1);
        assertThat(tree.getElements(ElementKind.CATCH)).hasSize(1);
        assertThat(tree.getElements(ElementKind.CALL)).extracting(SyntaxElement::getName).contains("pop", "g");
    }

    @Test
    void parse_nestedLoop_hasDepthTwo() throws ParseException {
        String code = "for (let i = 0; i < 2; i++) { for (let j = 0; j < 2; j++) { } }\n";

        SyntaxTree tree = parser.parse(path, code);

        List<SyntaxElement> loops = tree.getElements(ElementKind.LOOP);
        assertThat(loops).extracting(tree::loopDepth).containsExactlyInAnyOrder(1, 2);
    }

    @Test
    void parse_topLevelStatements_areRecorded() throws ParseException {
        SyntaxTree tree = parser.parse(path, "let a = 1;\nlet b = a + 1;\n");

        assertThat(tree.getElements(ElementKind.STATEMENT)).hasSize(2);
    }

    @Test
    void parse_ternary_recordsConditionAndBranches() throws ParseException {
        String code = "let x = y > 1 ? true : false;\n";

        SyntaxElement ternary = parser.parse(path, code).getElements(ElementKind.TERNARY).get(0);

        assertThat(ternary.getParts()).hasSize(3);
        assertThat(ternary.getParts().get(0).textOf(code)).isEqualTo("y > 1");
        assertThat(ternary.getParts().get(1).textOf(code)).isEqualTo("true");
        assertThat(ternary.getParts().get(2).textOf(code)).isEqualTo("false");
    }

    @Test
    void parse_ternary_spanStartsAtCondition() throws ParseException {
        String code = "function f(a) { return a > 1 ? true : false; }\n";

        SyntaxElement ternary = parser.parse(path, code).getElements(ElementKind.TERNARY).get(0);

        assertThat(ternary.getSpan().textOf(code)).isEqualTo("a > 1 ? true : false");
    }

    @Test
    void parse_blockScopedLoopVariables_recordsLoops() throws ParseException {
        String code = """
                function f(a) {
                  for (let i = 0; i < a.length; i++) { }
                  for (const k in a) { }
                }
                """;

        SyntaxTree tree = parser.parse(path, code);

        List<SyntaxElement> loops = tree.getElements(ElementKind.LOOP);
        assertThat(loops).hasSize(2);
        assertThat(loops).extracting(loop -> loop.getSpan().textOf(code))
                .anySatisfy(text -> assertThat(text).startsWith("for (let i = 0;"))
                .anySatisfy(text -> assertThat(text).startsWith("for (const k in a)"));
        assertThat(parser.diagnose(path, code)).isEmpty();
    }

    @Test
    void withVarLoopDeclarations_keepsLengthAndSkipsStrings() {
        String code = "for (const k in o) { s = \"for (let x\"; }";
        String masked = SourceMask.maskCode(code, FileType.JAVASCRIPT);

        String rewritten = JavaScriptParser._withVarLoopDeclarations(code, masked);

        assertThat(rewritten).isEqualTo("for (var   k in o) { s = \"for (let x\"; }");
        assertThat(rewritten).hasSameSizeAs(code);
    }

    @Test
    void parse_brokenSource_throwsWithDiagnostics() {
        assertThatThrownBy(() -> parser.parse(path, "function f( { return 1; }\n"))
                .isInstanceOf(ParseException.class)
                .satisfies(e -> assertThat(((ParseException) e).getDiagnostics()).isNotEmpty());
    }

    @Test
    void diagnose_wellFormedSource_isEmpty() {
        assertThat(parser.diagnose(path, "let x = JSON.parse(s);\n")).isEmpty();
    }

    @Test
    void diagnose_missingParenthesis_reportsLine() {
        List<ParseDiagnostic> diagnostics = parser.diagnose(path, "let a = 1;\nlet x = JSON.parse(s;\n");

        assertThat(diagnostics).isNotEmpty();
        assertThat(diagnostics.get(0).getLine()).isEqualTo(2);
    }
}
