package com.codeoptimizer.api;

/**
 * Quantitative snapshot of one file. Scores are on a 0-100 scale, higher is better.
 */
public class Metrics {
    private final int complexity;
    private final double maintainabilityScore;
    private final double securityScore;
    private final double performanceScore;
    private final double duplicationRatio;
    private final int totalLines;
    private final int codeLines;
    private final int commentLines;
    private final int functionCount;

    private Metrics(Builder builder) {
        this.complexity = builder.complexity;
        this.maintainabilityScore = _clamp(builder.maintainabilityScore);
        this.securityScore = _clamp(builder.securityScore);
        this.performanceScore = _clamp(builder.performanceScore);
        this.duplicationRatio = builder.duplicationRatio;
        this.totalLines = builder.totalLines;
        this.codeLines = builder.codeLines;
        this.commentLines = builder.commentLines;
        this.functionCount = builder.functionCount;
    }

    public int getComplexity() { return complexity; }
    public double getMaintainabilityScore() { return maintainabilityScore; }
    public double getSecurityScore() { return securityScore; }
    public double getPerformanceScore() { return performanceScore; }
    public double getDuplicationRatio() { return duplicationRatio; }
    public int getTotalLines() { return totalLines; }
    public int getCodeLines() { return codeLines; }
    public int getCommentLines() { return commentLines; }
    public int getFunctionCount() { return functionCount; }

    /**
     * Mean of the three quality scores.
     */
    public double getQualityScore() {
        return (maintainabilityScore + securityScore + performanceScore) / 3.0;
    }

    /**
     * Merges a plugin's metrics into this snapshot: the higher complexity and the lower of each
     * quality score win, size figures stay those of this snapshot.
     */
    public Metrics merge(Metrics other) {
        if (other == null) {
            return this;
        }
        return toBuilder()
                .complexity(Math.max(complexity, other.complexity))
                .maintainabilityScore(Math.min(maintainabilityScore, other.maintainabilityScore))
                .securityScore(Math.min(securityScore, other.securityScore))
                .performanceScore(Math.min(performanceScore, other.performanceScore))
                .build();
    }

    public Builder toBuilder() {
        return builder()
                .complexity(complexity)
                .maintainabilityScore(maintainabilityScore)
                .securityScore(securityScore)
                .performanceScore(performanceScore)
                .duplicationRatio(duplicationRatio)
                .totalLines(totalLines)
                .codeLines(codeLines)
                .commentLines(commentLines)
                .functionCount(functionCount);
    }

    private static double _clamp(double score) {
        return Math.max(0.0, Math.min(100.0, score));
    }

    @Override
    public String toString() {
        return String.format("Metrics{complexity=%d, maintainability=%.1f, security=%.1f, performance=%.1f, " +
                        "duplication=%.2f, lines=%d, functions=%d}",
                complexity, maintainabilityScore, securityScore, performanceScore,
                duplicationRatio, totalLines, functionCount);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int complexity = 1;
        private double maintainabilityScore = 100.0;
        private double securityScore = 100.0;
        private double performanceScore = 100.0;
        private double duplicationRatio;
        private int totalLines;
        private int codeLines;
        private int commentLines;
        private int functionCount;

        public Builder complexity(int complexity) {
            this.complexity = complexity;
            return this;
        }

        public Builder maintainabilityScore(double maintainabilityScore) {
            this.maintainabilityScore = maintainabilityScore;
            return this;
        }

        public Builder securityScore(double securityScore) {
            this.securityScore = securityScore;
            return this;
        }

        public Builder performanceScore(double performanceScore) {
            this.performanceScore = performanceScore;
            return this;
        }

        public Builder duplicationRatio(double duplicationRatio) {
            this.duplicationRatio = duplicationRatio;
            return this;
        }

        public Builder totalLines(int totalLines) {
            this.totalLines = totalLines;
            return this;
        }

        public Builder codeLines(int codeLines) {
            this.codeLines = codeLines;
            return this;
        }

        public Builder commentLines(int commentLines) {
            this.commentLines = commentLines;
            return this;
        }

        public Builder functionCount(int functionCount) {
            this.functionCount = functionCount;
            return this;
        }

        public Metrics build() {
            return new Metrics(this);
        }
    }
}
