package com.codeoptimizer.validation;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.file.Paths;

import com.codeoptimizer.api.IssueCategory;
import com.codeoptimizer.api.Recommendation;
import com.codeoptimizer.api.SourceRange;
import com.codeoptimizer.api.Transformation;
import com.codeoptimizer.api.ValidationIssue;
import com.codeoptimizer.api.ValidationResult;
import com.codeoptimizer.api.error.Severity;
import com.codeoptimizer.config.ConfigurationLoader;
import com.codeoptimizer.config.OptimizerConfig;
import com.codeoptimizer.parser.ParserRegistry;
import com.codeoptimizer.plugins.javascript.ScriptSandbox;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

class ValidationGateTest {

    private static final OptimizerConfig CONFIG = ConfigurationLoader.loadDefaultConfig();
    private static final ParserRegistry PARSERS = ParserRegistry.withDefaults();

    private static ScriptSandbox sandbox;
    private static ValidationGate gate;

    @BeforeAll
    static void setUp() {
        sandbox = new ScriptSandbox(CONFIG.getTimeoutMs());
        gate = new ValidationGate(CONFIG, PARSERS, sandbox);
    }

    @AfterAll
    static void tearDown() {
        sandbox.close();
    }

    @Test
    void validate_wellFormedReplacement_isApproved() {
        String code = "let data = eval(\"[1, 2]\");\n";

        ValidationResult result = gate.validate(_fix("data.js", code, "eval(\"[1, 2]\")", "JSON.parse(\"[1, 2]\")"), code);

        assertThat(result.isValid()).isTrue();
        assertThat(result.getRecommendation()).isEqualTo(Recommendation.APPLY);
        assertThat(result.summary()).isEqualTo("validated");
    }

    @Test
    void validate_missingParenthesis_isRejectedAsSyntax() {
        String code = "let data = eval(\"[1, 2]\");\n";

        ValidationResult result = gate.validate(_fix("data.js", code, "eval(\"[1, 2]\")", "JSON.parse(\"[1, 2]\""), code);

        assertThat(result.isValid()).isFalse();
        assertThat(result.getRecommendation()).isEqualTo(Recommendation.REJECT);
        assertThat(result.hasIssue(ValidationIssue.Type.SYNTAX)).isTrue();
    }

    @Test
    void validate_changedFileText_isRejectedAsStale() {
        String code = "let data = eval(\"[1, 2]\");\n";
        Transformation fix = _fix("data.js", code, "eval(\"[1, 2]\")", "JSON.parse(\"[1, 2]\")");

        ValidationResult result = gate.validate(fix, "let information = eval(\"[1, 2]\");\n");

        assertThat(result.getRecommendation()).isEqualTo(Recommendation.REJECT);
        assertThat(result.getIssues().get(0).getMessage()).contains("Stale");
    }

    @Test
    void validate_unsupportedFileType_isRejected() {
        String code = "let value: number = 1;\n";

        ValidationResult result = gate.validate(_fix("typed.ts", code, "1", "2"), code);

        assertThat(result.getRecommendation()).isEqualTo(Recommendation.REJECT);
        assertThat(result.getIssues().get(0).getMessage()).contains("No parser");
    }

    @Test
    void validate_editedCodeThrows_isRejectedAtRuntime() {
        String code = "let total = 1 + 2;\n";

        ValidationResult result = gate.validate(_fix("total.js", code, "1 + 2", "missing.value"), code);

        assertThat(result.getRecommendation()).isEqualTo(Recommendation.REJECT);
        assertThat(result.hasIssue(ValidationIssue.Type.RUNTIME)).isTrue();
        assertThat(result.summary()).contains("Edited code throws");
    }

    @Test
    void validate_originalAlsoThrows_passesRuntimeStage() {
        String code = "let value = missing.first;\n";

        ValidationResult result = gate.validate(_fix("value.js", code, "missing.first", "missing.second"), code);

        assertThat(result.isValid()).isTrue();
        assertThat(result.getRecommendation()).isEqualTo(Recommendation.APPLY);
    }

    @Test
    void validate_infiniteLoop_isRejectedAfterTimeout() {
        String code = "function spin(n) { return n; }\n";

        try (ScriptSandbox quick = new ScriptSandbox(300)) {
            ValidationGate quickGate = new ValidationGate(CONFIG, PARSERS, quick);

            ValidationResult result = quickGate.validate(
                    _fix("spin.js", code, "return n;", "while (true) {} return n;"), code);

            assertThat(result.getRecommendation()).isEqualTo(Recommendation.REJECT);
            assertThat(result.hasIssue(ValidationIssue.Type.RUNTIME)).isTrue();
        }
    }

    @Test
    void validate_changedReturnValue_failsGeneratedTests() {
        String code = "function pick(a, b) { return a; }\n";

        ValidationResult result = gate.validate(_fix("pick.js", code, "return a;", "return b;"), code);

        assertThat(result.getRecommendation()).isEqualTo(Recommendation.REJECT);
        assertThat(result.hasIssue(ValidationIssue.Type.TEST)).isTrue();
        assertThat(result.getTestResults()).isNotNull();
        assertThat(result.getTestResults().getFailed()).isEqualTo(3);
        assertThat(result.getTestResults().getPassed()).isEqualTo(3);
    }

    @Test
    void validate_equivalentFunction_passesGeneratedTests() {
        String code = "function f(a) { return a > 1 ? true : false; }\n";

        ValidationResult result = gate.validate(_fix("f.js", code, "a > 1 ? true : false", "!!(a > 1)"), code);

        assertThat(result.getRecommendation()).isEqualTo(Recommendation.APPLY);
        assertThat(result.getTestResults().getPassed()).isEqualTo(6);
        assertThat(result.getTestResults().getFailed()).isZero();
    }

    @Test
    void validate_javaSyntaxError_isRejected() {
        String code = "class A { int twice(int x) { return x * 2; } }\n";

        ValidationResult result = gate.validate(_fix("A.java", code, "x * 2", "x * "), code);

        assertThat(result.getRecommendation()).isEqualTo(Recommendation.REJECT);
        assertThat(result.hasIssue(ValidationIssue.Type.SYNTAX)).isTrue();
    }

    @Test
    void validate_javaEquivalentEdit_skipsExecutionStages() {
        String code = "class A { int twice(int x) { return x * 2; } }\n";

        ValidationResult result = gate.validate(_fix("A.java", code, "x * 2", "x + x"), code);

        assertThat(result.getRecommendation()).isEqualTo(Recommendation.APPLY);
        assertThat(result.getIssues()).extracting(ValidationIssue::getLevel)
                .containsOnly(ValidationIssue.Level.INFO);
        assertThat(result.getIssues()).extracting(ValidationIssue::getType)
                .containsExactly(ValidationIssue.Type.RUNTIME, ValidationIssue.Type.TEST);
    }

    @Test
    void validate_addedCall_needsReview() {
        String code = "class A { int same(int x) { return x; } }\n";

        ValidationResult result = gate.validate(_fix("A.java", code, "return x;", "return Math.abs(x);"), code);

        assertThat(result.isValid()).isTrue();
        assertThat(result.getRecommendation()).isEqualTo(Recommendation.REVIEW);
        assertThat(result.hasIssue(ValidationIssue.Type.BEHAVIOR)).isTrue();
    }

    @Test
    void validate_addedNestedLoops_isRejectedAsRegression() {
        String code = "class A { int same(int x) { return x; } }\n";
        String slow = "for (int i = 0; i < x; i++) { for (int j = 0; j < x; j++) { touch(); } } return x;";

        ValidationResult result = gate.validate(_fix("A.java", code, "return x;", slow), code);

        assertThat(result.getRecommendation()).isEqualTo(Recommendation.REJECT);
        assertThat(result.hasIssue(ValidationIssue.Type.BEHAVIOR)).isTrue();
    }

    private static Transformation _fix(String file, String text, String original, String replacement) {
        int start = text.indexOf(original);
        return Transformation.builder()
                .id(file + "#" + start)
                .filePath(Paths.get(file))
                .original(SourceRange.of(text, start, start + original.length()))
                .replacement(replacement)
                .type(IssueCategory.MAINTAINABILITY)
                .severity(Severity.MINOR)
                .confidence(0.9)
                .build();
    }
}
