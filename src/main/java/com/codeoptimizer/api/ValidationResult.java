package com.codeoptimizer.api;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of validating one transformation. A new result is produced for every validation pass.
 */
public class ValidationResult {
    private final String transformationId;
    private final boolean valid;
    private final List<ValidationIssue> issues;
    private final TestResults testResults;
    private final Recommendation recommendation;

    private ValidationResult(Builder builder) {
        this.transformationId = builder.transformationId;
        this.issues = List.copyOf(builder.issues);
        this.testResults = builder.testResults;

        boolean critical = issues.stream().anyMatch(ValidationIssue::isCritical);
        this.valid = !critical;
        if (critical) {
            this.recommendation = Recommendation.REJECT;
        } else if (issues.stream().anyMatch(i -> i.getLevel() == ValidationIssue.Level.WARNING)) {
            this.recommendation = Recommendation.REVIEW;
        } else {
            this.recommendation = Recommendation.APPLY;
        }
    }

    public String getTransformationId() { return transformationId; }
    public boolean isValid() { return valid; }
    public List<ValidationIssue> getIssues() { return issues; }
    public TestResults getTestResults() { return testResults; }
    public Recommendation getRecommendation() { return recommendation; }

    public boolean hasIssue(ValidationIssue.Type type) {
        return issues.stream().anyMatch(issue -> issue.getType() == type);
    }

    /**
     * Short human-readable reason: the first critical or warning issue, or "validated".
     */
    public String summary() {
        return issues.stream()
                .filter(issue -> issue.getLevel() != ValidationIssue.Level.INFO)
                .findFirst()
                .map(issue -> issue.getType().name().toLowerCase() + ": " + issue.getMessage())
                .orElse("validated");
    }

    @Override
    public String toString() {
        return transformationId + " -> " + recommendation + " " + issues;
    }

    public static Builder builder(String transformationId) {
        return new Builder(transformationId);
    }

    public static class Builder {
        private final String transformationId;
        private final List<ValidationIssue> issues = new ArrayList<>();
        private TestResults testResults;

        private Builder(String transformationId) {
            this.transformationId = transformationId;
        }

        public Builder addIssue(ValidationIssue issue) {
            this.issues.add(issue);
            return this;
        }

        public Builder testResults(TestResults testResults) {
            this.testResults = testResults;
            return this;
        }

        public boolean hasCriticalIssue() {
            return issues.stream().anyMatch(ValidationIssue::isCritical);
        }

        public ValidationResult build() {
            return new ValidationResult(this);
        }
    }
}
