package com.codeoptimizer.core;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BiConsumer;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.codeoptimizer.analyzer.IssueDetector;
import com.codeoptimizer.api.FileAnalysis;
import com.codeoptimizer.api.LearningEntry;
import com.codeoptimizer.api.OptimizationOutcome;
import com.codeoptimizer.api.SourceFile;
import com.codeoptimizer.api.SourceOptimizer;
import com.codeoptimizer.api.SourceUnit;
import com.codeoptimizer.api.Transformation;
import com.codeoptimizer.api.ValidatedTransformation;
import com.codeoptimizer.api.ValidationIssue;
import com.codeoptimizer.api.ValidationResult;
import com.codeoptimizer.api.error.ParseException;
import com.codeoptimizer.apply.FileApplyResult;
import com.codeoptimizer.apply.TransformationApplier;
import com.codeoptimizer.config.OptimizerConfig;
import com.codeoptimizer.dependency.CircularDependency;
import com.codeoptimizer.dependency.CycleDetector;
import com.codeoptimizer.dependency.DependencyReport;
import com.codeoptimizer.parser.ParserRegistry;
import com.codeoptimizer.parser.SyntaxParser;
import com.codeoptimizer.parser.SyntaxTree;
import com.codeoptimizer.plugins.FileType;
import com.codeoptimizer.plugins.javascript.ScriptSandbox;
import com.codeoptimizer.transform.TransformationGenerator;
import com.codeoptimizer.transform.TransformationPrioritizer;
import com.codeoptimizer.util.LoggerUtil;
import com.codeoptimizer.validation.ValidationGate;

/**
 * Drives one run through analysis, generation, prioritization, validation and application.
 * Files are processed in parallel within a stage; a stage starts only once the previous one
 * has finished for every file.
 */
public class Orchestrator implements SourceOptimizer, AutoCloseable {
    private static final Logger logger = LoggerUtil.getLogger(Orchestrator.class);

    private final OptimizerConfig config;
    private final ParserRegistry parsers;
    private final IssueDetector issueDetector;
    private final CycleDetector cycleDetector;
    private final TransformationGenerator generator;
    private final TransformationPrioritizer prioritizer;
    private final ValidationGate gate;
    private final TransformationApplier applier;
    private final LearningLog learningLog;
    private final ScriptSandbox sandbox;

    private final List<PipelineListener> listeners = new CopyOnWriteArrayList<>();
    private final AtomicBoolean cancelRequested = new AtomicBoolean(false);
    private volatile PipelineStage stage;

    public Orchestrator(OptimizerConfig config, ParserRegistry parsers, IssueDetector issueDetector,
                        CycleDetector cycleDetector, TransformationGenerator generator,
                        TransformationPrioritizer prioritizer, ValidationGate gate,
                        TransformationApplier applier, LearningLog learningLog, ScriptSandbox sandbox) {
        this.config = config;
        this.parsers = parsers;
        this.issueDetector = issueDetector;
        this.cycleDetector = cycleDetector;
        this.generator = generator;
        this.prioritizer = prioritizer;
        this.gate = gate;
        this.applier = applier;
        this.learningLog = learningLog;
        this.sandbox = sandbox;
        logger.info("Optimizer initialized: autoApply=" + config.isAutoApply() +
                ", confidenceThreshold=" + config.getConfidenceThreshold() +
                ", workers=" + config.getWorkerLimit());
    }

    /**
     * Orchestrator wired with the built-in parsers, rules and strategies. Owns its script sandbox.
     */
    public static Orchestrator create(OptimizerConfig config, LearningLog learningLog) {
        ParserRegistry parsers = ParserRegistry.withDefaults();
        ScriptSandbox sandbox = new ScriptSandbox(config.getTimeoutMs());
        return new Orchestrator(
                config,
                parsers,
                IssueDetector.withDefaultRules(config),
                CycleDetector.fromConfig(config),
                TransformationGenerator.withDefaultStrategies(config),
                TransformationPrioritizer.fromConfig(config),
                new ValidationGate(config, parsers, sandbox),
                TransformationApplier.fromConfig(config, parsers),
                learningLog,
                sandbox);
    }

    public void addListener(PipelineListener listener) {
        listeners.add(listener);
    }

    /**
     * Asks the current run to stop at the next stage boundary. Work already started in a stage finishes.
     */
    public void cancel() {
        cancelRequested.set(true);
        logger.info("Cancellation requested");
    }

    public PipelineStage getStage() {
        return stage;
    }

    @Override
    public PipelineResult run(List<SourceFile> files) {
        cancelRequested.set(false);
        RunState state = new RunState(files);
        ExecutorService executor = Executors.newFixedThreadPool(config.getWorkerLimit());

        try {
            _enter(PipelineStage.ANALYZING);
            state.dependencies = cycleDetector.detect(files);
            state.analyses = _analyzeAll(files, state.dependencies.getCycles(), state.skipped, executor);
            state.scoreBefore = _meanScore(state.analyses);
            state.scoreAfter = state.scoreBefore;
            _complete(PipelineStage.ANALYZING);
            if (cancelRequested.get()) {
                return _finish(state, PipelineStage.CANCELLED);
            }

            _enter(PipelineStage.GENERATING);
            state.proposed = generator.generate(state.analyses);
            _complete(PipelineStage.GENERATING);
            if (cancelRequested.get()) {
                return _finish(state, PipelineStage.CANCELLED);
            }

            _enter(PipelineStage.PRIORITIZING);
            List<Transformation> ordered = prioritizer.prioritize(
                    TransformationGenerator.filterByConfidence(state.proposed, config.getConfidenceThreshold()));
            _complete(PipelineStage.PRIORITIZING);
            if (cancelRequested.get()) {
                return _finish(state, PipelineStage.CANCELLED);
            }

            _enter(PipelineStage.VALIDATING);
            state.plan = _validateAll(ordered, state.texts, executor);
            _complete(PipelineStage.VALIDATING);
            if (!config.isAutoApply()) {
                logger.info("autoApply is off, returning the plan without touching any file");
                _recordLearning(state.plan);
                return _finish(state, PipelineStage.VALIDATING);
            }
            if (cancelRequested.get()) {
                return _finish(state, PipelineStage.CANCELLED);
            }

            _enter(PipelineStage.APPLYING);
            List<FileApplyResult> written = new ArrayList<>();
            state.plan = _applyAll(state.plan, written, executor);
            _complete(PipelineStage.APPLYING);
            if (cancelRequested.get()) {
                return _finish(state, PipelineStage.CANCELLED);
            }

            _enter(PipelineStage.REPORTING);
            state.scoreAfter = _meanScore(_reanalyze(state, written));
            _complete(PipelineStage.REPORTING);

            _enter(PipelineStage.LEARNING);
            _recordLearning(state.plan);
            _complete(PipelineStage.LEARNING);

            return _finish(state, PipelineStage.DONE);
        } catch (RuntimeException e) {
            PipelineStage failedStage = stage;
            state.failedStage = failedStage;
            logger.log(Level.SEVERE, "Run failed during " + failedStage, e);
            for (PipelineListener listener : listeners) {
                listener.stageFailed(failedStage, e);
            }
            return _finish(state, PipelineStage.ERROR);
        } finally {
            _shutdown(executor);
        }
    }

    private List<FileAnalysis> _analyzeAll(List<SourceFile> files, Collection<CircularDependency> cycles,
                                           Map<Path, String> skipped, ExecutorService executor) {
        Map<Path, FileAnalysis> analyses = new ConcurrentHashMap<>();
        List<Callable<Void>> tasks = new ArrayList<>();

        for (SourceFile file : files) {
            tasks.add(() -> {
                Optional<SyntaxParser> parser = parsers.forType(FileType.detect(file.getPath()));
                if (parser.isEmpty()) {
                    skipped.put(file.getPath(), "unsupported file type");
                    logger.fine("Skipping unsupported file " + file.getPath());
                    return null;
                }
                try {
                    analyses.put(file.getPath(), _analyze(parser.get(), file.getPath(), file.getText(), cycles));
                } catch (ParseException e) {
                    skipped.put(file.getPath(), e.getMessage());
                    logger.warning("Skipping " + file.getPath() + ": " + e.getMessage());
                } catch (RuntimeException e) {
                    skipped.put(file.getPath(), "unexpected error: " + e.getMessage());
                    logger.log(Level.WARNING, "Unexpected error analyzing " + file.getPath(), e);
                }
                return null;
            });
        }
        _invokeAll(executor, tasks, (i, error) -> {
            Path path = files.get(i).getPath();
            skipped.put(path, "unexpected error: " + error);
            logger.log(Level.WARNING, "Analysis of " + path + " failed", error);
        });

        List<FileAnalysis> ordered = new ArrayList<>(analyses.values());
        ordered.sort(Comparator.comparing(analysis -> analysis.getPath().toString()));
        logger.info("Analyzed " + ordered.size() + " files, skipped " + skipped.size());
        return ordered;
    }

    private FileAnalysis _analyze(SyntaxParser parser, Path path, String text,
                                  Collection<CircularDependency> cycles) throws ParseException {
        SyntaxTree tree = parser.parse(path, text);
        return issueDetector.analyze(new SourceUnit(path, text, tree.getFileType(), tree), cycles);
    }

    /**
     * Validates each file's transformations in priority order. A transformation overlapping one
     * that was already approved for the same file is marked as a conflict without validation.
     */
    private List<PlanEntry> _validateAll(List<Transformation> ordered, Map<Path, String> texts,
                                         ExecutorService executor) {
        Map<Path, List<Transformation>> byFile = _groupByFile(ordered);
        Map<Transformation, PlanEntry> entries = Collections.synchronizedMap(new IdentityHashMap<>());
        List<Path> taskFiles = new ArrayList<>(byFile.keySet());
        List<Callable<Void>> tasks = new ArrayList<>();

        for (Map.Entry<Path, List<Transformation>> file : byFile.entrySet()) {
            tasks.add(() -> {
                String text = texts.get(file.getKey());
                List<Transformation> approved = new ArrayList<>();

                for (Transformation transformation : file.getValue()) {
                    Optional<Transformation> blocker = approved.stream().filter(transformation::conflictsWith).findFirst();
                    if (blocker.isPresent()) {
                        entries.put(transformation, new PlanEntry(transformation, null,
                                PlanEntry.Status.CONFLICT, "overlaps " + blocker.get().getId()));
                        continue;
                    }

                    ValidationResult result = _validate(transformation, text);
                    PlanEntry.Status status = switch (result.getRecommendation()) {
                        case APPLY -> PlanEntry.Status.APPROVED;
                        case REVIEW -> PlanEntry.Status.NEEDS_REVIEW;
                        case REJECT -> PlanEntry.Status.REJECTED;
                    };
                    if (status == PlanEntry.Status.APPROVED) {
                        approved.add(transformation);
                    }
                    entries.put(transformation, new PlanEntry(transformation, result, status, result.summary()));
                }
                return null;
            });
        }
        _invokeAll(executor, tasks, (i, error) -> {
            logger.log(Level.WARNING, "Validation of " + taskFiles.get(i) + " failed", error);
            for (Transformation transformation : byFile.get(taskFiles.get(i))) {
                if (!entries.containsKey(transformation)) {
                    ValidationResult result = _failedValidation(transformation, error);
                    entries.put(transformation, new PlanEntry(transformation, result,
                            PlanEntry.Status.REJECTED, result.summary()));
                }
            }
        });

        List<PlanEntry> plan = new ArrayList<>();
        for (Transformation transformation : ordered) {
            PlanEntry entry = entries.get(transformation);
            if (entry != null) {
                plan.add(entry);
            }
        }
        logger.info("Validated " + plan.size() + " transformations: " +
                plan.stream().filter(e -> e.getStatus() == PlanEntry.Status.APPROVED).count() + " approved");
        return plan;
    }

    private ValidationResult _validate(Transformation transformation, String text) {
        if (text == null) {
            return ValidationResult.builder(transformation.getId())
                    .addIssue(new ValidationIssue(ValidationIssue.Type.SYNTAX, ValidationIssue.Level.CRITICAL,
                            "File text is not available"))
                    .build();
        }
        try {
            return gate.validate(transformation, text);
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Validation of " + transformation.getId() + " failed", e);
            return _failedValidation(transformation, e);
        }
    }

    private static ValidationResult _failedValidation(Transformation transformation, Throwable error) {
        return ValidationResult.builder(transformation.getId())
                .addIssue(new ValidationIssue(ValidationIssue.Type.RUNTIME, ValidationIssue.Level.CRITICAL,
                        "Validation failed: " + error))
                .build();
    }

    private List<PlanEntry> _applyAll(List<PlanEntry> plan, List<FileApplyResult> written, ExecutorService executor) {
        Map<Path, List<ValidatedTransformation>> byFile = new LinkedHashMap<>();
        for (PlanEntry entry : plan) {
            if (entry.getStatus() == PlanEntry.Status.APPROVED) {
                byFile.computeIfAbsent(entry.getTransformation().getFilePath(), p -> new ArrayList<>())
                        .add(new ValidatedTransformation(entry.getTransformation(), entry.getValidation()));
            }
        }

        Map<Transformation, FileApplyResult.EditOutcome> outcomes = Collections.synchronizedMap(new IdentityHashMap<>());
        Map<Path, String> failedFiles = new ConcurrentHashMap<>();
        List<Path> taskFiles = new ArrayList<>(byFile.keySet());
        List<Callable<Void>> tasks = new ArrayList<>();
        for (Map.Entry<Path, List<ValidatedTransformation>> file : byFile.entrySet()) {
            tasks.add(() -> {
                FileApplyResult result = applier.apply(file.getKey(), file.getValue());
                for (FileApplyResult.EditOutcome outcome : result.getOutcomes()) {
                    outcomes.put(outcome.getTransformation(), outcome);
                }
                if (result.isWritten()) {
                    synchronized (written) {
                        written.add(result);
                    }
                }
                return null;
            });
        }
        _invokeAll(executor, tasks, (i, error) -> {
            failedFiles.put(taskFiles.get(i), "apply failed: " + error);
            logger.log(Level.WARNING, "Applying transformations to " + taskFiles.get(i) + " failed", error);
        });

        List<PlanEntry> updated = new ArrayList<>();
        for (PlanEntry entry : plan) {
            Transformation transformation = entry.getTransformation();
            FileApplyResult.EditOutcome outcome = outcomes.get(transformation);
            String failure = failedFiles.get(transformation.getFilePath());
            if (outcome != null) {
                updated.add(entry.withStatus(_toStatus(outcome.getStatus()),
                        outcome.getReason() != null ? outcome.getReason() : entry.getReason()));
            } else if (failure != null && entry.getStatus() == PlanEntry.Status.APPROVED) {
                updated.add(entry.withStatus(PlanEntry.Status.FAILED, failure));
            } else {
                updated.add(entry);
            }
        }
        return updated;
    }

    private static PlanEntry.Status _toStatus(FileApplyResult.EditStatus status) {
        return switch (status) {
            case APPLIED -> PlanEntry.Status.APPLIED;
            case STALE -> PlanEntry.Status.STALE;
            case CONFLICT -> PlanEntry.Status.CONFLICT;
            case REFUSED -> PlanEntry.Status.REJECTED;
            case FAILED -> PlanEntry.Status.FAILED;
        };
    }

    /**
     * Analyses after the run: rewritten files are analyzed again from their new content.
     */
    private List<FileAnalysis> _reanalyze(RunState state, List<FileApplyResult> written) {
        Map<Path, FileAnalysis> current = new LinkedHashMap<>();
        for (FileAnalysis analysis : state.analyses) {
            current.put(analysis.getPath(), analysis);
        }

        for (FileApplyResult result : written) {
            try {
                SourceFile updated = SourceFile.read(result.getPath());
                Optional<SyntaxParser> parser = parsers.forType(FileType.detect(updated.getPath()));
                if (parser.isPresent()) {
                    current.put(updated.getPath(), _analyze(parser.get(), updated.getPath(), updated.getText(),
                            state.dependencies.getCycles()));
                }
            } catch (IOException | ParseException e) {
                logger.warning("Could not re-analyze " + result.getPath() + ": " + e.getMessage());
            }
        }
        return new ArrayList<>(current.values());
    }

    private void _recordLearning(List<PlanEntry> plan) {
        List<LearningEntry> entries = new ArrayList<>();
        Instant now = Instant.now();
        for (PlanEntry entry : plan) {
            if (entry.getStatus() == PlanEntry.Status.APPLIED || entry.getStatus().isRejection()) {
                Transformation transformation = entry.getTransformation();
                entries.add(new LearningEntry(transformation.getType().getId(), transformation.getDescription(),
                        entry.getStatus() == PlanEntry.Status.APPLIED, entry.getReason(), now));
            }
        }

        try {
            learningLog.append(entries);
            logger.fine("Recorded " + entries.size() + " learning entries");
        } catch (IOException e) {
            logger.log(Level.WARNING, "Could not write the learning log", e);
        }
    }

    private PipelineResult _finish(RunState state, PipelineStage finalStage) {
        stage = finalStage;
        int applied = 0;
        int rejected = 0;
        for (PlanEntry entry : state.plan) {
            if (entry.getStatus() == PlanEntry.Status.APPLIED) {
                applied++;
            } else if (entry.getStatus().isRejection()) {
                rejected++;
            }
        }

        OptimizationOutcome outcome = OptimizationOutcome.builder()
                .success(state.failedStage != PipelineStage.ANALYZING)
                .cancelled(finalStage == PipelineStage.CANCELLED)
                .filesAnalyzed(state.analyses.size())
                .filesSkipped(state.skipped.size())
                .issuesFound(state.analyses.stream().mapToInt(a -> a.getIssues().size()).sum())
                .cyclesFound(state.dependencies != null ? state.dependencies.getCycles().size() : 0)
                .transformationsProposed(state.proposed.size())
                .transformationsApplied(applied)
                .transformationsRejected(rejected)
                .scoreBefore(state.scoreBefore)
                .scoreAfter(state.scoreAfter)
                .startedAt(state.startedAt)
                .finishedAt(Instant.now())
                .finalStage(finalStage.name())
                .build();

        logger.info("Run finished in " + finalStage + ": " + outcome.getFilesAnalyzed() + " files, " +
                outcome.getIssuesFound() + " issues, " + applied + " transformations applied, " +
                rejected + " rejected");
        return new PipelineResult(outcome, state.analyses, state.plan, state.dependencies, state.skipped);
    }

    private void _enter(PipelineStage next) {
        stage = next;
        logger.info("Stage " + next);
        for (PipelineListener listener : listeners) {
            listener.stageStarted(next);
        }
    }

    private void _complete(PipelineStage finished) {
        for (PipelineListener listener : listeners) {
            listener.stageCompleted(finished);
        }
    }

    /**
     * Runs the tasks and waits for all of them. A task that ends with an exception or error is
     * reported to {@code onFailure} with its index.
     */
    private void _invokeAll(ExecutorService executor, List<Callable<Void>> tasks,
                            BiConsumer<Integer, Throwable> onFailure) {
        List<Future<Void>> futures;
        try {
            futures = executor.invokeAll(tasks);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancelRequested.set(true);
            logger.log(Level.WARNING, "Interrupted while waiting for " + stage, e);
            return;
        }

        for (int i = 0; i < futures.size(); i++) {
            try {
                futures.get(i).get();
            } catch (ExecutionException e) {
                onFailure.accept(i, e.getCause());
            } catch (CancellationException e) {
                onFailure.accept(i, e);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                cancelRequested.set(true);
                logger.log(Level.WARNING, "Interrupted while collecting results of " + stage, e);
                return;
            }
        }
    }

    private static double _meanScore(List<FileAnalysis> analyses) {
        return analyses.stream().mapToDouble(a -> a.getMetrics().getQualityScore()).average().orElse(0.0);
    }

    private static Map<Path, List<Transformation>> _groupByFile(List<Transformation> transformations) {
        Map<Path, List<Transformation>> byFile = new LinkedHashMap<>();
        for (Transformation transformation : transformations) {
            byFile.computeIfAbsent(transformation.getFilePath(), p -> new ArrayList<>()).add(transformation);
        }
        return byFile;
    }

    private static void _shutdown(ExecutorService executor) {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(1, TimeUnit.MINUTES)) {
                logger.warning("Timeout waiting for workers to finish");
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
    }

    @Override
    public void close() {
        if (sandbox != null) {
            sandbox.close();
        }
    }

    /**
     * Intermediate results of one run.
     */
    private static class RunState {
        final Instant startedAt = Instant.now();
        final Map<Path, String> texts = new LinkedHashMap<>();
        final Map<Path, String> skipped = new ConcurrentHashMap<>();
        DependencyReport dependencies;
        List<FileAnalysis> analyses = List.of();
        List<Transformation> proposed = List.of();
        List<PlanEntry> plan = List.of();
        double scoreBefore;
        double scoreAfter;
        PipelineStage failedStage;

        RunState(List<SourceFile> files) {
            for (SourceFile file : files) {
                texts.put(file.getPath(), file.getText());
            }
        }
    }
}
