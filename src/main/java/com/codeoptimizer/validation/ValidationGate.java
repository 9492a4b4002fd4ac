package com.codeoptimizer.validation;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.logging.Logger;

import com.codeoptimizer.api.SourceRange;
import com.codeoptimizer.api.TestResults;
import com.codeoptimizer.api.Transformation;
import com.codeoptimizer.api.ValidationIssue;
import com.codeoptimizer.api.ValidationResult;
import com.codeoptimizer.api.error.ParseException;
import com.codeoptimizer.api.error.ValidationTimeoutException;
import com.codeoptimizer.config.OptimizerConfig;
import com.codeoptimizer.parser.ParseDiagnostic;
import com.codeoptimizer.parser.ParserRegistry;
import com.codeoptimizer.parser.SyntaxParser;
import com.codeoptimizer.parser.SyntaxTree;
import com.codeoptimizer.plugins.FileType;
import com.codeoptimizer.plugins.javascript.ScriptHarness;
import com.codeoptimizer.plugins.javascript.ScriptResult;
import com.codeoptimizer.plugins.javascript.ScriptSandbox;
import com.codeoptimizer.util.LoggerUtil;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Decides whether a transformation may touch disk. Stages run in order and stop at the first
 * critical finding: syntax, runtime, generated tests, then the static cost comparison.
 * Thread-safe; every execution gets its own sandbox context.
 */
public class ValidationGate {
    private static final Logger logger = LoggerUtil.getLogger(ValidationGate.class);

    private static final double CRITICAL_COST_RATIO = 10.0;

    private final OptimizerConfig config;
    private final ParserRegistry parsers;
    private final ScriptSandbox sandbox;
    private final CostEstimator costEstimator = new CostEstimator();
    private final ObjectMapper mapper = new ObjectMapper();

    public ValidationGate(OptimizerConfig config, ParserRegistry parsers, ScriptSandbox sandbox) {
        this.config = config;
        this.parsers = parsers;
        this.sandbox = sandbox;
    }

    /**
     * Validates one transformation against the file text it will be applied to.
     */
    public ValidationResult validate(Transformation transformation, String currentText) {
        ValidationResult.Builder result = ValidationResult.builder(transformation.getId());
        SourceRange original = transformation.getOriginal();
        Path path = transformation.getFilePath();

        if (!original.matches(currentText)) {
            result.addIssue(new ValidationIssue(ValidationIssue.Type.SYNTAX, ValidationIssue.Level.CRITICAL,
                    "Stale transformation: the text at " + original + " no longer matches"));
            return _finish(transformation, result);
        }

        FileType type = FileType.detect(path);
        Optional<SyntaxParser> parser = parsers.forType(type);
        if (parser.isEmpty()) {
            result.addIssue(new ValidationIssue(ValidationIssue.Type.SYNTAX, ValidationIssue.Level.CRITICAL,
                    "No parser for " + type.getDescription() + " files"));
            return _finish(transformation, result);
        }

        String editedText = transformation.applyTo(currentText);
        SyntaxTree before;
        SyntaxTree after;

        // syntax
        List<ParseDiagnostic> diagnostics = parser.get().diagnose(path, editedText);
        for (ParseDiagnostic diagnostic : diagnostics) {
            result.addIssue(new ValidationIssue(ValidationIssue.Type.SYNTAX, ValidationIssue.Level.CRITICAL,
                    diagnostic.getMessage(), diagnostic.getLine()));
        }
        if (result.hasCriticalIssue()) {
            return _finish(transformation, result);
        }
        try {
            before = parser.get().parse(path, currentText);
            after = parser.get().parse(path, editedText);
        } catch (ParseException e) {
            result.addIssue(new ValidationIssue(ValidationIssue.Type.SYNTAX, ValidationIssue.Level.CRITICAL,
                    e.getMessage()));
            return _finish(transformation, result);
        }

        ExecutionUnit unit = ExecutionUnit.locate(before, currentText, transformation);

        if (type.isJavaScriptFamily()) {
            _runtimeStage(transformation, unit, result);
            if (result.hasCriticalIssue()) {
                return _finish(transformation, result);
            }
            _testStage(transformation, unit, result);
            if (result.hasCriticalIssue()) {
                return _finish(transformation, result);
            }
        } else {
            result.addIssue(new ValidationIssue(ValidationIssue.Type.RUNTIME, ValidationIssue.Level.INFO,
                    "Not applicable to " + type.getDescription() + " sources"));
            result.addIssue(new ValidationIssue(ValidationIssue.Type.TEST, ValidationIssue.Level.INFO,
                    "Not applicable to " + type.getDescription() + " sources"));
        }

        _behaviorStage(before, after, unit, result);
        return _finish(transformation, result);
    }

    private void _runtimeStage(Transformation transformation, ExecutionUnit unit, ValidationResult.Builder result) {
        if (!unit.isRunnable()) {
            result.addIssue(new ValidationIssue(ValidationIssue.Type.RUNTIME, ValidationIssue.Level.INFO,
                    "Edited code cannot run in isolation"));
            return;
        }

        String editedScript;
        String originalScript;
        if (unit.getKind() == ExecutionUnit.Kind.FUNCTION) {
            editedScript = ScriptHarness.invokeOnce(unit.getEditedSource());
            originalScript = ScriptHarness.invokeOnce(unit.getOriginalSource());
        } else {
            editedScript = ScriptHarness.runStatements(unit.getEditedSource());
            originalScript = ScriptHarness.runStatements(unit.getOriginalSource());
        }

        try {
            ScriptResult edited = sandbox.execute(transformation.getId() + "#edited", editedScript);
            if (edited.isSucceeded()) {
                return;
            }
            ScriptResult original = sandbox.execute(transformation.getId() + "#original", originalScript);
            if (!original.isSucceeded()) {
                logger.fine(transformation.getId() + ": original and edited code both throw, runtime stage passes");
                return;
            }
            result.addIssue(new ValidationIssue(ValidationIssue.Type.RUNTIME, ValidationIssue.Level.CRITICAL,
                    "Edited code throws: " + edited.getError()));
        } catch (ValidationTimeoutException e) {
            result.addIssue(new ValidationIssue(ValidationIssue.Type.RUNTIME, ValidationIssue.Level.CRITICAL,
                    e.getMessage()));
        }
    }

    private void _testStage(Transformation transformation, ExecutionUnit unit, ValidationResult.Builder result) {
        if (unit.getKind() != ExecutionUnit.Kind.FUNCTION) {
            result.addIssue(new ValidationIssue(ValidationIssue.Type.TEST, ValidationIssue.Level.INFO,
                    "No enclosing function to test"));
            return;
        }

        List<List<Object>> cases = ScriptHarness.argumentVectors(unit.getArity());
        try {
            ScriptResult original = sandbox.execute(transformation.getId() + "#test-original",
                    ScriptHarness.testCases(unit.getOriginalSource(), cases));
            if (!original.isSucceeded()) {
                result.addIssue(new ValidationIssue(ValidationIssue.Type.TEST, ValidationIssue.Level.INFO,
                        "Generated test cannot run against the original code: " + original.getError()));
                return;
            }

            ScriptResult edited = sandbox.execute(transformation.getId() + "#test-edited",
                    ScriptHarness.testCases(unit.getEditedSource(), cases));
            if (!edited.isSucceeded()) {
                result.testResults(new TestResults(0, cases.size()));
                result.addIssue(new ValidationIssue(ValidationIssue.Type.TEST, ValidationIssue.Level.CRITICAL,
                        "Generated test cannot run against the edited code: " + edited.getError()));
                return;
            }

            _compareCases(cases, mapper.readTree(original.getValue()), mapper.readTree(edited.getValue()), result);
        } catch (ValidationTimeoutException e) {
            result.testResults(new TestResults(0, cases.size()));
            result.addIssue(new ValidationIssue(ValidationIssue.Type.TEST, ValidationIssue.Level.CRITICAL,
                    "Generated test: " + e.getMessage()));
        } catch (JsonProcessingException e) {
            result.addIssue(new ValidationIssue(ValidationIssue.Type.TEST, ValidationIssue.Level.CRITICAL,
                    "Unreadable test output: " + e.getOriginalMessage()));
        }
    }

    /**
     * A case passes when the original threw, or when both versions returned equal values.
     */
    private void _compareCases(List<List<Object>> cases, JsonNode expected, JsonNode actual,
                               ValidationResult.Builder result) {
        int passed = 0;
        int failed = 0;

        for (int i = 0; i < cases.size(); i++) {
            JsonNode want = expected.path(i);
            JsonNode got = actual.path(i);

            if (!want.path("ok").asBoolean()
                    || (got.path("ok").asBoolean() && want.path("value").equals(got.path("value")))) {
                passed++;
                continue;
            }

            failed++;
            String outcome = got.path("ok").asBoolean()
                    ? "returned " + got.path("value")
                    : "threw " + got.path("error").asText();
            result.addIssue(new ValidationIssue(ValidationIssue.Type.TEST, ValidationIssue.Level.CRITICAL,
                    "Arguments " + cases.get(i) + ": expected " + want.path("value") + " but " + outcome));
        }

        result.testResults(new TestResults(passed, failed));
    }

    private void _behaviorStage(SyntaxTree before, SyntaxTree after, ExecutionUnit unit,
                                ValidationResult.Builder result) {
        double costBefore = costEstimator.estimate(before, unit.getOriginalSpan());
        double costAfter = costEstimator.estimate(after, unit.getEditedSpan());
        double ratio = costAfter / costBefore;

        if (ratio >= CRITICAL_COST_RATIO) {
            result.addIssue(new ValidationIssue(ValidationIssue.Type.BEHAVIOR, ValidationIssue.Level.CRITICAL,
                    String.format("Estimated cost grows %.1fx (%.0f to %.0f)", ratio, costBefore, costAfter)));
        } else if (ratio > 1.0 + config.getBehaviorTolerance()) {
            result.addIssue(new ValidationIssue(ValidationIssue.Type.BEHAVIOR, ValidationIssue.Level.WARNING,
                    String.format("Estimated cost grows %.2fx (%.0f to %.0f)", ratio, costBefore, costAfter)));
        }
    }

    private static ValidationResult _finish(Transformation transformation, ValidationResult.Builder builder) {
        ValidationResult result = builder.build();
        logger.fine(transformation.getId() + ": " + result.getRecommendation() + " (" + result.summary() + ")");
        return result;
    }
}
