package com.codeoptimizer.core;

import java.util.Objects;

import com.codeoptimizer.api.Transformation;
import com.codeoptimizer.api.ValidationResult;

/**
 * One transformation of the run plan with its validation result and current status.
 */
public class PlanEntry {

    public enum Status {
        APPROVED,
        NEEDS_REVIEW,
        REJECTED,
        CONFLICT,
        APPLIED,
        STALE,
        FAILED;

        /**
         * True for transformations that were turned down or could not be written.
         */
        public boolean isRejection() {
            return this == REJECTED || this == CONFLICT || this == STALE || this == FAILED;
        }
    }

    private final Transformation transformation;
    private final ValidationResult validation;
    private final Status status;
    private final String reason;

    public PlanEntry(Transformation transformation, ValidationResult validation, Status status, String reason) {
        this.transformation = Objects.requireNonNull(transformation, "transformation");
        this.validation = validation;
        this.status = Objects.requireNonNull(status, "status");
        this.reason = reason;
    }

    public Transformation getTransformation() { return transformation; }

    /**
     * Null for conflicts, which never reach the gate.
     */
    public ValidationResult getValidation() { return validation; }

    public Status getStatus() { return status; }
    public String getReason() { return reason; }

    public PlanEntry withStatus(Status newStatus, String newReason) {
        return new PlanEntry(transformation, validation, newStatus, newReason);
    }

    @Override
    public String toString() {
        return transformation.getId() + " " + status + (reason != null ? " (" + reason + ")" : "");
    }
}
