package com.codeoptimizer.api;

import java.time.Duration;
import java.time.Instant;

/**
 * Aggregate figures of one optimizer run.
 */
public class OptimizationOutcome {
    private final boolean success;
    private final boolean cancelled;
    private final int filesAnalyzed;
    private final int filesSkipped;
    private final int issuesFound;
    private final int cyclesFound;
    private final int transformationsProposed;
    private final int transformationsApplied;
    private final int transformationsRejected;
    private final double scoreBefore;
    private final double scoreAfter;
    private final Instant startedAt;
    private final Instant finishedAt;
    private final String finalStage;

    private OptimizationOutcome(Builder builder) {
        this.success = builder.success;
        this.cancelled = builder.cancelled;
        this.filesAnalyzed = builder.filesAnalyzed;
        this.filesSkipped = builder.filesSkipped;
        this.issuesFound = builder.issuesFound;
        this.cyclesFound = builder.cyclesFound;
        this.transformationsProposed = builder.transformationsProposed;
        this.transformationsApplied = builder.transformationsApplied;
        this.transformationsRejected = builder.transformationsRejected;
        this.scoreBefore = builder.scoreBefore;
        this.scoreAfter = builder.scoreAfter;
        this.startedAt = builder.startedAt;
        this.finishedAt = builder.finishedAt;
        this.finalStage = builder.finalStage;
    }

    /**
     * False only when the run failed before any file was analyzed. A later failure still ends in
     * the ERROR stage with the results gathered so far.
     */
    public boolean isSuccess() { return success; }
    public boolean isCancelled() { return cancelled; }
    public int getFilesAnalyzed() { return filesAnalyzed; }
    public int getFilesSkipped() { return filesSkipped; }
    public int getIssuesFound() { return issuesFound; }
    public int getCyclesFound() { return cyclesFound; }
    public int getTransformationsProposed() { return transformationsProposed; }
    public int getTransformationsApplied() { return transformationsApplied; }
    public int getTransformationsRejected() { return transformationsRejected; }
    public double getScoreBefore() { return scoreBefore; }
    public double getScoreAfter() { return scoreAfter; }
    public Instant getStartedAt() { return startedAt; }
    public Instant getFinishedAt() { return finishedAt; }
    public String getFinalStage() { return finalStage; }

    public double getScoreDelta() {
        return scoreAfter - scoreBefore;
    }

    public Duration getDuration() {
        return startedAt != null && finishedAt != null ? Duration.between(startedAt, finishedAt) : Duration.ZERO;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private boolean success = true;
        private boolean cancelled;
        private int filesAnalyzed;
        private int filesSkipped;
        private int issuesFound;
        private int cyclesFound;
        private int transformationsProposed;
        private int transformationsApplied;
        private int transformationsRejected;
        private double scoreBefore;
        private double scoreAfter;
        private Instant startedAt;
        private Instant finishedAt;
        private String finalStage;

        public Builder success(boolean success) {
            this.success = success;
            return this;
        }

        public Builder cancelled(boolean cancelled) {
            this.cancelled = cancelled;
            return this;
        }

        public Builder filesAnalyzed(int filesAnalyzed) {
            this.filesAnalyzed = filesAnalyzed;
            return this;
        }

        public Builder filesSkipped(int filesSkipped) {
            this.filesSkipped = filesSkipped;
            return this;
        }

        public Builder issuesFound(int issuesFound) {
            this.issuesFound = issuesFound;
            return this;
        }

        public Builder cyclesFound(int cyclesFound) {
            this.cyclesFound = cyclesFound;
            return this;
        }

        public Builder transformationsProposed(int transformationsProposed) {
            this.transformationsProposed = transformationsProposed;
            return this;
        }

        public Builder transformationsApplied(int transformationsApplied) {
            this.transformationsApplied = transformationsApplied;
            return this;
        }

        public Builder transformationsRejected(int transformationsRejected) {
            this.transformationsRejected = transformationsRejected;
            return this;
        }

        public Builder scoreBefore(double scoreBefore) {
            this.scoreBefore = scoreBefore;
            return this;
        }

        public Builder scoreAfter(double scoreAfter) {
            this.scoreAfter = scoreAfter;
            return this;
        }

        public Builder startedAt(Instant startedAt) {
            this.startedAt = startedAt;
            return this;
        }

        public Builder finishedAt(Instant finishedAt) {
            this.finishedAt = finishedAt;
            return this;
        }

        public Builder finalStage(String finalStage) {
            this.finalStage = finalStage;
            return this;
        }

        public OptimizationOutcome build() {
            return new OptimizationOutcome(this);
        }
    }
}
