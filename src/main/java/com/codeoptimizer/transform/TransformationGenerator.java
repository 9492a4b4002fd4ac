package com.codeoptimizer.transform;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.codeoptimizer.api.FileAnalysis;
import com.codeoptimizer.api.Transformation;
import com.codeoptimizer.api.TransformationStrategy;
import com.codeoptimizer.api.error.PluginException;
import com.codeoptimizer.config.OptimizerConfig;
import com.codeoptimizer.transform.strategies.ComplexityStrategy;
import com.codeoptimizer.transform.strategies.MaintainabilityStrategy;
import com.codeoptimizer.transform.strategies.PerformanceStrategy;
import com.codeoptimizer.transform.strategies.SecurityStrategy;
import com.codeoptimizer.util.LoggerUtil;

/**
 * Runs every registered strategy over a file's analysis and keeps the transformations that
 * reach the configured confidence threshold.
 */
public class TransformationGenerator {
    private static final Logger logger = LoggerUtil.getLogger(TransformationGenerator.class);

    private final OptimizerConfig config;
    private final List<TransformationStrategy> strategies = new CopyOnWriteArrayList<>();

    public TransformationGenerator(OptimizerConfig config) {
        this.config = config;
    }

    /**
     * Generator with one built-in strategy per category.
     */
    public static TransformationGenerator withDefaultStrategies(OptimizerConfig config) {
        TransformationGenerator generator = new TransformationGenerator(config);
        generator.registerStrategy(new SecurityStrategy());
        generator.registerStrategy(new PerformanceStrategy());
        generator.registerStrategy(new ComplexityStrategy());
        generator.registerStrategy(new MaintainabilityStrategy());
        return generator;
    }

    public void registerStrategy(TransformationStrategy strategy) {
        strategy.initialize(config);
        strategies.add(strategy);
        logger.fine("Registered strategy: " + strategy.getName());
    }

    public List<TransformationStrategy> getStrategies() {
        return List.copyOf(strategies);
    }

    public List<Transformation> generate(FileAnalysis analysis) {
        List<Transformation> candidates = new ArrayList<>();

        for (TransformationStrategy strategy : strategies) {
            if (!config.getEnabledCategories().contains(strategy.getCategory())) {
                continue;
            }
            try {
                List<Transformation> proposed = strategy.analyze(analysis);
                if (proposed != null) {
                    candidates.addAll(proposed);
                }
            } catch (RuntimeException e) {
                PluginException failure = new PluginException(strategy.getName(), e);
                logger.log(Level.WARNING, failure.getMessage() + " for " + analysis.getPath(), e);
            }
        }

        return filterByConfidence(candidates, config.getConfidenceThreshold());
    }

    public List<Transformation> generate(List<FileAnalysis> analyses) {
        List<Transformation> all = new ArrayList<>();
        for (FileAnalysis analysis : analyses) {
            all.addAll(generate(analysis));
        }
        return all;
    }

    /**
     * Drops every transformation whose confidence is below the threshold.
     */
    public static List<Transformation> filterByConfidence(List<Transformation> transformations, double threshold) {
        List<Transformation> kept = new ArrayList<>();
        for (Transformation transformation : transformations) {
            if (transformation.getConfidence() >= threshold) {
                kept.add(transformation);
            } else {
                logger.fine("Discarded " + transformation.getId() + ": confidence " +
                        transformation.getConfidence() + " below " + threshold);
            }
        }
        return kept;
    }
}
