package com.codeoptimizer.api;

import java.nio.file.Path;
import java.util.Objects;

import com.codeoptimizer.api.error.Severity;

/**
 * A proposed edit of one contiguous range in one file. Immutable; revising it means building a new one.
 */
public class Transformation {
    private final String id;
    private final Path filePath;
    private final SourceRange original;
    private final String replacement;
    private final IssueCategory type;
    private final Severity severity;
    private final double confidence;
    private final String description;
    private final String issueId;

    private Transformation(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id");
        this.filePath = Objects.requireNonNull(builder.filePath, "filePath");
        this.original = Objects.requireNonNull(builder.original, "original");
        this.replacement = Objects.requireNonNull(builder.replacement, "replacement");
        this.type = Objects.requireNonNull(builder.type, "type");
        this.severity = Objects.requireNonNull(builder.severity, "severity");
        if (builder.confidence < 0.0 || builder.confidence > 1.0) {
            throw new IllegalArgumentException("Confidence must be within 0..1: " + builder.confidence);
        }
        this.confidence = builder.confidence;
        this.description = builder.description != null ? builder.description : "";
        this.issueId = builder.issueId;
    }

    public String getId() { return id; }
    public Path getFilePath() { return filePath; }
    public SourceRange getOriginal() { return original; }
    public String getReplacement() { return replacement; }
    public IssueCategory getType() { return type; }
    public Severity getSeverity() { return severity; }
    public double getConfidence() { return confidence; }
    public String getDescription() { return description; }
    public String getIssueId() { return issueId; }

    /**
     * True when both transformations target the same file and their ranges intersect.
     */
    public boolean conflictsWith(Transformation other) {
        return filePath.equals(other.filePath) && original.overlaps(other.original);
    }

    /**
     * Returns the text produced by applying only this transformation to the given source.
     */
    public String applyTo(String source) {
        return source.substring(0, original.getStart()) + replacement + source.substring(original.getEnd());
    }

    @Override
    public String toString() {
        return id + " " + type.getId() + "/" + severity.getId() + " " + original +
                String.format(" confidence=%.2f", confidence);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id;
        private Path filePath;
        private SourceRange original;
        private String replacement;
        private IssueCategory type;
        private Severity severity;
        private double confidence;
        private String description;
        private String issueId;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder filePath(Path filePath) {
            this.filePath = filePath;
            return this;
        }

        public Builder original(SourceRange original) {
            this.original = original;
            return this;
        }

        public Builder replacement(String replacement) {
            this.replacement = replacement;
            return this;
        }

        public Builder type(IssueCategory type) {
            this.type = type;
            return this;
        }

        public Builder severity(Severity severity) {
            this.severity = severity;
            return this;
        }

        public Builder confidence(double confidence) {
            this.confidence = confidence;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder issueId(String issueId) {
            this.issueId = issueId;
            return this;
        }

        public Transformation build() {
            return new Transformation(this);
        }
    }
}
