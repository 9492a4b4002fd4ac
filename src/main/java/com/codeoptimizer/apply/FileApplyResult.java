package com.codeoptimizer.apply;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.codeoptimizer.api.Transformation;

/**
 * What happened to each edit handed to the applier for one file.
 */
public class FileApplyResult {

    public enum EditStatus {
        APPLIED,
        STALE,
        CONFLICT,
        REFUSED,
        FAILED
    }

    public static class EditOutcome {
        private final Transformation transformation;
        private final EditStatus status;
        private final String reason;

        EditOutcome(Transformation transformation, EditStatus status, String reason) {
            this.transformation = transformation;
            this.status = status;
            this.reason = reason;
        }

        public Transformation getTransformation() { return transformation; }
        public EditStatus getStatus() { return status; }
        public String getReason() { return reason; }

        @Override
        public String toString() {
            return transformation.getId() + " " + status + (reason != null ? ": " + reason : "");
        }
    }

    private final Path path;
    private final List<EditOutcome> outcomes;
    private final boolean written;
    private final Path backupPath;

    FileApplyResult(Path path, List<EditOutcome> outcomes, boolean written, Path backupPath) {
        this.path = path;
        this.outcomes = List.copyOf(outcomes);
        this.written = written;
        this.backupPath = backupPath;
    }

    public Path getPath() { return path; }
    public List<EditOutcome> getOutcomes() { return outcomes; }

    /**
     * True when the file on disk was replaced.
     */
    public boolean isWritten() { return written; }

    /**
     * The backup of the previous content, or null when none was written.
     */
    public Path getBackupPath() { return backupPath; }

    public List<EditOutcome> getOutcomes(EditStatus status) {
        List<EditOutcome> matching = new ArrayList<>();
        for (EditOutcome outcome : outcomes) {
            if (outcome.getStatus() == status) {
                matching.add(outcome);
            }
        }
        return matching;
    }

    public int getAppliedCount() {
        return getOutcomes(EditStatus.APPLIED).size();
    }
}
