package com.codeoptimizer.apply;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.codeoptimizer.api.SourceRange;
import com.codeoptimizer.api.Transformation;
import com.codeoptimizer.api.ValidatedTransformation;
import com.codeoptimizer.api.error.ApplyIOException;
import com.codeoptimizer.api.error.StaleEditException;
import com.codeoptimizer.apply.FileApplyResult.EditOutcome;
import com.codeoptimizer.apply.FileApplyResult.EditStatus;
import com.codeoptimizer.config.OptimizerConfig;
import com.codeoptimizer.parser.ParseDiagnostic;
import com.codeoptimizer.parser.ParserRegistry;
import com.codeoptimizer.parser.SyntaxParser;
import com.codeoptimizer.plugins.FileType;
import com.codeoptimizer.util.LoggerUtil;

/**
 * Rewrites a file with its approved edits in one write. Edits are spliced from the end of the
 * file backwards so the offsets of the remaining edits stay valid.
 */
public class TransformationApplier {
    private static final Logger logger = LoggerUtil.getLogger(TransformationApplier.class);

    static final String BACKUP_SUFFIX = ".bak";

    private final ParserRegistry parsers;
    private final boolean keepBackup;
    private final Map<Path, ReentrantLock> fileLocks = new ConcurrentHashMap<>();

    public TransformationApplier(ParserRegistry parsers, boolean keepBackup) {
        this.parsers = parsers;
        this.keepBackup = keepBackup;
    }

    public static TransformationApplier fromConfig(OptimizerConfig config, ParserRegistry parsers) {
        return new TransformationApplier(parsers, config.isKeepBackup());
    }

    /**
     * Applies the applicable edits to the file. Holds the file's lock for the whole read-modify-write.
     */
    public FileApplyResult apply(Path file, List<ValidatedTransformation> edits) {
        Path key = file.toAbsolutePath().normalize();
        ReentrantLock lock = fileLocks.computeIfAbsent(key, k -> new ReentrantLock());

        lock.lock();
        try {
            return _applyLocked(key, edits);
        } finally {
            lock.unlock();
        }
    }

    private FileApplyResult _applyLocked(Path file, List<ValidatedTransformation> edits) {
        List<EditOutcome> outcomes = new ArrayList<>();
        List<Transformation> accepted = new ArrayList<>();

        for (ValidatedTransformation edit : edits) {
            Transformation transformation = edit.getTransformation();
            if (!transformation.getFilePath().toAbsolutePath().normalize().equals(file)) {
                outcomes.add(new EditOutcome(transformation, EditStatus.REFUSED, "targets another file"));
            } else if (!edit.isApplicable()) {
                outcomes.add(new EditOutcome(transformation, EditStatus.REFUSED,
                        "validation recommends " + edit.getValidation().getRecommendation()));
            } else if (accepted.stream().anyMatch(transformation::conflictsWith)) {
                outcomes.add(new EditOutcome(transformation, EditStatus.CONFLICT, "overlaps an earlier edit"));
            } else {
                accepted.add(transformation);
            }
        }
        if (accepted.isEmpty()) {
            return new FileApplyResult(file, outcomes, false, null);
        }

        String originalText;
        try {
            originalText = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            return _failAll(file, accepted, outcomes, new ApplyIOException(file, e));
        }

        String text = originalText;
        List<Transformation> spliced = new ArrayList<>();
        for (Transformation transformation : _descending(accepted)) {
            try {
                text = _spliceOne(text, transformation);
                spliced.add(transformation);
            } catch (StaleEditException e) {
                logger.warning(e.getMessage());
                outcomes.add(new EditOutcome(transformation, EditStatus.STALE, e.getMessage()));
            }
        }
        if (spliced.isEmpty()) {
            return new FileApplyResult(file, outcomes, false, null);
        }

        Optional<String> parseFailure = _verify(file, text);
        if (parseFailure.isPresent()) {
            logger.warning("Rewritten " + file + " no longer parses, keeping the original: " + parseFailure.get());
            for (Transformation transformation : spliced) {
                outcomes.add(new EditOutcome(transformation, EditStatus.FAILED,
                        "rewritten file does not parse: " + parseFailure.get()));
            }
            return new FileApplyResult(file, outcomes, false, null);
        }

        Path backup = null;
        try {
            if (keepBackup) {
                backup = file.resolveSibling(file.getFileName() + BACKUP_SUFFIX);
                Files.writeString(backup, originalText, StandardCharsets.UTF_8);
            }
            _writeAtomically(file, text);
        } catch (IOException e) {
            return _failAll(file, spliced, outcomes, new ApplyIOException(file, e));
        }

        for (Transformation transformation : spliced) {
            outcomes.add(new EditOutcome(transformation, EditStatus.APPLIED, null));
        }
        logger.info("Applied " + spliced.size() + " transformations to " + file);
        return new FileApplyResult(file, outcomes, true, backup);
    }

    /**
     * Applies non-overlapping transformations to the text in descending start order.
     *
     * @throws StaleEditException when the text at a range differs from the transformation's original text
     */
    public static String splice(String text, List<Transformation> transformations) throws StaleEditException {
        List<Transformation> ordered = _descending(transformations);
        for (int i = 1; i < ordered.size(); i++) {
            if (ordered.get(i).getOriginal().overlaps(ordered.get(i - 1).getOriginal())) {
                throw new IllegalArgumentException("Overlapping transformations " + ordered.get(i).getId() +
                        " and " + ordered.get(i - 1).getId());
            }
        }

        String result = text;
        for (Transformation transformation : ordered) {
            result = _spliceOne(result, transformation);
        }
        return result;
    }

    private static String _spliceOne(String text, Transformation transformation) throws StaleEditException {
        SourceRange range = transformation.getOriginal();
        if (!range.matches(text)) {
            String actual = range.getEnd() <= text.length() ? text.substring(range.getStart(), range.getEnd()) : null;
            throw new StaleEditException(transformation.getId(), range.getText(), actual);
        }
        return transformation.applyTo(text);
    }

    private static List<Transformation> _descending(List<Transformation> transformations) {
        List<Transformation> ordered = new ArrayList<>(transformations);
        ordered.sort(Comparator.comparingInt((Transformation t) -> t.getOriginal().getStart()).reversed());
        return ordered;
    }

    private Optional<String> _verify(Path file, String text) {
        Optional<SyntaxParser> parser = parsers.forType(FileType.detect(file));
        if (parser.isEmpty()) {
            return Optional.empty();
        }
        List<ParseDiagnostic> diagnostics = parser.get().diagnose(file, text);
        return diagnostics.isEmpty() ? Optional.empty() : Optional.of(diagnostics.get(0).toString());
    }

    /**
     * Writes to a temporary file next to the target, then moves it over the target.
     */
    private static void _writeAtomically(Path file, String content) throws IOException {
        Path temp = Files.createTempFile(file.toAbsolutePath().getParent(), "." + file.getFileName(), ".tmp");
        try {
            Files.writeString(temp, content, StandardCharsets.UTF_8);
            try {
                Files.move(temp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
    }

    private static FileApplyResult _failAll(Path file, List<Transformation> transformations,
                                            List<EditOutcome> outcomes, ApplyIOException failure) {
        logger.log(Level.WARNING, failure.getMessage(), failure.getCause());
        for (Transformation transformation : transformations) {
            outcomes.add(new EditOutcome(transformation, EditStatus.FAILED, failure.getMessage()));
        }
        return new FileApplyResult(file, outcomes, false, null);
    }
}
