package com.codeoptimizer.core;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

import com.codeoptimizer.analyzer.IssueDetector;
import com.codeoptimizer.api.LearningEntry;
import com.codeoptimizer.api.OptimizationOutcome;
import com.codeoptimizer.api.SourceFile;
import com.codeoptimizer.api.Transformation;
import com.codeoptimizer.api.ValidationResult;
import com.codeoptimizer.apply.TransformationApplier;
import com.codeoptimizer.config.ConfigurationLoader;
import com.codeoptimizer.config.OptimizerConfig;
import com.codeoptimizer.dependency.CycleDetector;
import com.codeoptimizer.dependency.DependencyReport;
import com.codeoptimizer.parser.ParseDiagnostic;
import com.codeoptimizer.parser.ParserRegistry;
import com.codeoptimizer.parser.SyntaxParser;
import com.codeoptimizer.parser.SyntaxTree;
import com.codeoptimizer.plugins.FileType;
import com.codeoptimizer.transform.TransformationGenerator;
import com.codeoptimizer.transform.TransformationPrioritizer;
import com.codeoptimizer.validation.ValidationGate;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class OrchestratorTest {

    private static final String TERNARY = "function f(a) { return a > 1 ? true : false; }\n";

    @TempDir
    Path tempDir;

    private final InMemoryLearningLog learningLog = new InMemoryLearningLog();

    @Test
    void run_withoutAutoApply_returnsPlanAndLeavesFilesUntouched() throws IOException {
        Path file = _write("f.js", TERNARY);
        List<PipelineStage> started = new ArrayList<>();

        PipelineResult result;
        try (Orchestrator orchestrator = Orchestrator.create(ConfigurationLoader.loadDefaultConfig(), learningLog)) {
            orchestrator.addListener(new PipelineListener() {
                @Override
                public void stageStarted(PipelineStage stage) {
                    started.add(stage);
                }
            });
            result = orchestrator.run(List.of(SourceFile.read(file)));
        }

        OptimizationOutcome outcome = result.getOutcome();
        assertThat(outcome.isSuccess()).isTrue();
        assertThat(outcome.getFinalStage()).isEqualTo("VALIDATING");
        assertThat(outcome.getFilesAnalyzed()).isEqualTo(1);
        assertThat(outcome.getTransformationsApplied()).isZero();
        assertThat(started).containsExactly(PipelineStage.ANALYZING, PipelineStage.GENERATING,
                PipelineStage.PRIORITIZING, PipelineStage.VALIDATING);
        assertThat(result.getEntries(PlanEntry.Status.APPROVED))
                .extracting(entry -> entry.getTransformation().getReplacement())
                .contains("!!(a > 1)");
        assertThat(Files.readString(file)).isEqualTo(TERNARY);
        assertThat(learningLog.readAll()).noneMatch(LearningEntry::isSucceeded);
    }

    @Test
    void run_withoutAutoApply_recordsRejections() throws IOException {
        Path file = _write("f.js", TERNARY);
        OptimizerConfig config = ConfigurationLoader.loadDefaultConfig();
        ParserRegistry parsers = ParserRegistry.withDefaults();
        ValidationGate failingGate = new ValidationGate(config, parsers, null) {
            @Override
            public ValidationResult validate(Transformation transformation, String currentText) {
                throw new IllegalStateException("sandbox unavailable");
            }
        };

        PipelineResult result;
        try (Orchestrator orchestrator = _orchestrator(config, parsers, CycleDetector.fromConfig(config), failingGate)) {
            result = orchestrator.run(List.of(SourceFile.read(file)));
        }

        assertThat(result.getOutcome().getFinalStage()).isEqualTo("VALIDATING");
        assertThat(result.getEntries(PlanEntry.Status.REJECTED)).isNotEmpty();
        List<LearningEntry> learned = learningLog.readAll();
        assertThat(learned).isNotEmpty();
        assertThat(learned).noneMatch(LearningEntry::isSucceeded);
        assertThat(learned).allSatisfy(entry -> assertThat(entry.getReason()).contains("sandbox unavailable"));
    }

    @Test
    void run_sameFileNameInTwoDirectories_appliesBoth() throws IOException {
        Path first = _write("a/index.js", "var x = 1;\n");
        Path second = _write("b/index.js", "var x = 1;\n");
        OptimizerConfig config = ConfigurationLoader.loadDefaultConfig()
                .with("autoApply", true)
                .with("keepBackup", false);

        PipelineResult result;
        try (Orchestrator orchestrator = Orchestrator.create(config, learningLog)) {
            result = orchestrator.run(List.of(SourceFile.read(first), SourceFile.read(second)));
        }

        assertThat(result.getOutcome().getTransformationsApplied()).isEqualTo(2);
        assertThat(result.getEntries(PlanEntry.Status.APPLIED))
                .extracting(entry -> entry.getTransformation().getId())
                .doesNotHaveDuplicates();
        assertThat(Files.readString(first)).isEqualTo("let x = 1;\n");
        assertThat(Files.readString(second)).isEqualTo("let x = 1;\n");
    }

    @Test
    void run_parserThrowingError_skipsFileAndContinues() throws IOException {
        Path good = _write("f.java", "class F { }\n");
        Path failing = _write("g.js", TERNARY);
        OptimizerConfig config = ConfigurationLoader.loadDefaultConfig();
        ParserRegistry parsers = ParserRegistry.withDefaults();
        parsers.register(new SyntaxParser() {
            @Override
            public List<FileType> getSupportedTypes() {
                return List.of(FileType.JAVASCRIPT);
            }

            @Override
            public SyntaxTree parse(Path path, String text) {
                throw new AssertionError("parser bug");
            }

            @Override
            public List<ParseDiagnostic> diagnose(Path path, String text) {
                return List.of();
            }
        });

        PipelineResult result;
        try (Orchestrator orchestrator = _orchestrator(config, parsers, CycleDetector.fromConfig(config),
                new ValidationGate(config, parsers, null))) {
            result = orchestrator.run(List.of(SourceFile.read(good), SourceFile.read(failing)));
        }

        assertThat(result.getOutcome().isSuccess()).isTrue();
        assertThat(result.getOutcome().getFilesAnalyzed()).isEqualTo(1);
        assertThat(result.getOutcome().getFilesSkipped()).isEqualTo(1);
        assertThat(result.getSkippedFiles().get(failing)).contains("unexpected error").contains("parser bug");
    }

    @Test
    void run_failureBeforeAnalysis_reportsErrorWithoutSuccess() throws IOException {
        Path file = _write("f.js", TERNARY);
        OptimizerConfig config = ConfigurationLoader.loadDefaultConfig();
        ParserRegistry parsers = ParserRegistry.withDefaults();
        CycleDetector failingDetector = new CycleDetector(10, List.of(), false) {
            @Override
            public DependencyReport detect(Collection<SourceFile> files) {
                throw new IllegalStateException("graph unavailable");
            }
        };
        List<PipelineStage> failed = new ArrayList<>();

        PipelineResult result;
        try (Orchestrator orchestrator = _orchestrator(config, parsers, failingDetector,
                new ValidationGate(config, parsers, null))) {
            orchestrator.addListener(new PipelineListener() {
                @Override
                public void stageFailed(PipelineStage stage, Throwable error) {
                    failed.add(stage);
                }
            });
            result = orchestrator.run(List.of(SourceFile.read(file)));
        }

        assertThat(result.getOutcome().getFinalStage()).isEqualTo("ERROR");
        assertThat(result.getOutcome().isSuccess()).isFalse();
        assertThat(failed).containsExactly(PipelineStage.ANALYZING);
    }

    @Test
    void run_failureAfterAnalysis_keepsRunLevelSuccess() throws IOException {
        Path file = _write("f.js", TERNARY);
        OptimizerConfig config = ConfigurationLoader.loadDefaultConfig();
        ParserRegistry parsers = ParserRegistry.withDefaults();
        TransformationPrioritizer failingPrioritizer = new TransformationPrioritizer(config.getTypePriorityOrder()) {
            @Override
            public List<Transformation> prioritize(List<Transformation> transformations) {
                throw new IllegalStateException("ordering unavailable");
            }
        };

        PipelineResult result;
        try (Orchestrator orchestrator = new Orchestrator(config, parsers, IssueDetector.withDefaultRules(config),
                CycleDetector.fromConfig(config), TransformationGenerator.withDefaultStrategies(config),
                failingPrioritizer, new ValidationGate(config, parsers, null),
                TransformationApplier.fromConfig(config, parsers), learningLog, null)) {
            result = orchestrator.run(List.of(SourceFile.read(file)));
        }

        assertThat(result.getOutcome().getFinalStage()).isEqualTo("ERROR");
        assertThat(result.getOutcome().isSuccess()).isTrue();
        assertThat(result.getOutcome().getFilesAnalyzed()).isEqualTo(1);
    }

    @Test
    void run_withAutoApply_rewritesFileAndRecordsLearning() throws IOException {
        Path file = _write("f.js", TERNARY);
        OptimizerConfig config = ConfigurationLoader.loadDefaultConfig()
                .with("autoApply", true)
                .with("keepBackup", false);

        PipelineResult result;
        try (Orchestrator orchestrator = Orchestrator.create(config, learningLog)) {
            result = orchestrator.run(List.of(SourceFile.read(file)));
            assertThat(orchestrator.getStage()).isEqualTo(PipelineStage.DONE);
        }

        OptimizationOutcome outcome = result.getOutcome();
        assertThat(outcome.isSuccess()).isTrue();
        assertThat(outcome.getFinalStage()).isEqualTo("DONE");
        assertThat(outcome.getTransformationsApplied()).isEqualTo(1);
        assertThat(result.getEntries(PlanEntry.Status.APPLIED)).hasSize(1);
        assertThat(Files.readString(file)).contains("return !!(a > 1);");
        assertThat(Files.exists(tempDir.resolve("f.js.bak"))).isFalse();

        List<LearningEntry> learned = learningLog.readAll();
        assertThat(learned).hasSize(1);
        assertThat(learned.get(0).isSucceeded()).isTrue();
        assertThat(learned.get(0).getType()).isEqualTo("complexity");
    }

    @Test
    void run_cancelledAfterAnalysis_stopsBeforeGenerating() throws IOException {
        Path file = _write("f.js", TERNARY);
        OptimizerConfig config = ConfigurationLoader.loadDefaultConfig().with("autoApply", true);

        PipelineResult result;
        try (Orchestrator orchestrator = Orchestrator.create(config, learningLog)) {
            orchestrator.addListener(new PipelineListener() {
                @Override
                public void stageCompleted(PipelineStage stage) {
                    if (stage == PipelineStage.ANALYZING) {
                        orchestrator.cancel();
                    }
                }
            });
            result = orchestrator.run(List.of(SourceFile.read(file)));
        }

        assertThat(result.getOutcome().isCancelled()).isTrue();
        assertThat(result.getOutcome().getFinalStage()).isEqualTo("CANCELLED");
        assertThat(result.getOutcome().getFilesAnalyzed()).isEqualTo(1);
        assertThat(result.getPlan()).isEmpty();
        assertThat(Files.readString(file)).isEqualTo(TERNARY);
    }

    @Test
    void run_unsupportedAndBrokenFiles_areSkipped() throws IOException {
        Path good = _write("f.js", TERNARY);
        Path typed = _write("g.ts", "const x: number = 1;\n");
        Path broken = _write("h.js", "function h( {\n");

        PipelineResult result;
        try (Orchestrator orchestrator = Orchestrator.create(ConfigurationLoader.loadDefaultConfig(), learningLog)) {
            result = orchestrator.run(List.of(SourceFile.read(good), SourceFile.read(typed), SourceFile.read(broken)));
        }

        assertThat(result.getOutcome().isSuccess()).isTrue();
        assertThat(result.getOutcome().getFilesAnalyzed()).isEqualTo(1);
        assertThat(result.getOutcome().getFilesSkipped()).isEqualTo(2);
        assertThat(result.getSkippedFiles()).containsKeys(typed, broken);
        assertThat(result.getSkippedFiles().get(typed)).isEqualTo("unsupported file type");
        assertThat(result.getAnalyses()).extracting(analysis -> analysis.getPath()).containsExactly(good);
    }

    @Test
    void run_importCycle_isCountedAndReported() throws IOException {
        Path a = _write("a.js", "import { b } from './b';\nexport const a = 1;\n");
        Path b = _write("b.js", "import { a } from './a';\nexport const b = 2;\n");

        PipelineResult result;
        try (Orchestrator orchestrator = Orchestrator.create(ConfigurationLoader.loadDefaultConfig(), learningLog)) {
            result = orchestrator.run(List.of(SourceFile.read(a), SourceFile.read(b)));
        }

        assertThat(result.getOutcome().getCyclesFound()).isEqualTo(1);
        assertThat(result.getDependencyReport().getCycles()).hasSize(1);
    }

    private Orchestrator _orchestrator(OptimizerConfig config, ParserRegistry parsers, CycleDetector cycleDetector,
                                       ValidationGate gate) {
        return new Orchestrator(config, parsers, IssueDetector.withDefaultRules(config), cycleDetector,
                TransformationGenerator.withDefaultStrategies(config), TransformationPrioritizer.fromConfig(config),
                gate, TransformationApplier.fromConfig(config, parsers), learningLog, null);
    }

    private Path _write(String name, String content) throws IOException {
        Path file = tempDir.resolve(name);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
        return file;
    }
}
