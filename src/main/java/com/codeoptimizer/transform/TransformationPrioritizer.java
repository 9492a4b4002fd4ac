package com.codeoptimizer.transform;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.codeoptimizer.api.IssueCategory;
import com.codeoptimizer.api.Transformation;
import com.codeoptimizer.config.OptimizerConfig;

/**
 * Orders transformations for validation and decides which of two overlapping edits survives.
 * Severity first, then the configured category order, then confidence.
 */
public class TransformationPrioritizer {
    private final List<IssueCategory> typePriorityOrder;

    public TransformationPrioritizer(List<IssueCategory> typePriorityOrder) {
        this.typePriorityOrder = List.copyOf(typePriorityOrder);
    }

    public static TransformationPrioritizer fromConfig(OptimizerConfig config) {
        return new TransformationPrioritizer(config.getTypePriorityOrder());
    }

    public Comparator<Transformation> comparator() {
        return Comparator.<Transformation>comparingInt(t -> t.getSeverity().rank())
                .thenComparingInt(t -> _typeRank(t.getType()))
                .thenComparing(Comparator.comparingDouble(Transformation::getConfidence).reversed())
                .thenComparing(t -> t.getFilePath().toString())
                .thenComparingInt(t -> t.getOriginal().getStart());
    }

    /**
     * Returns a sorted copy. The input is left untouched.
     */
    public List<Transformation> prioritize(List<Transformation> transformations) {
        List<Transformation> sorted = new ArrayList<>(transformations);
        sorted.sort(comparator());
        return sorted;
    }

    /**
     * Sorts, then drops every transformation that overlaps a higher-priority one in the same file.
     */
    public List<Transformation> resolveConflicts(List<Transformation> transformations) {
        Map<Path, List<Transformation>> keptByFile = new LinkedHashMap<>();
        List<Transformation> kept = new ArrayList<>();

        for (Transformation candidate : prioritize(transformations)) {
            List<Transformation> sameFile = keptByFile.computeIfAbsent(candidate.getFilePath(), p -> new ArrayList<>());
            if (sameFile.stream().noneMatch(candidate::conflictsWith)) {
                sameFile.add(candidate);
                kept.add(candidate);
            }
        }
        return kept;
    }

    private int _typeRank(IssueCategory category) {
        int index = typePriorityOrder.indexOf(category);
        return index >= 0 ? index : typePriorityOrder.size();
    }
}
