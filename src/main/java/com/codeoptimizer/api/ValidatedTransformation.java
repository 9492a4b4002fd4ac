package com.codeoptimizer.api;

import java.util.Objects;

/**
 * A transformation paired with the validation result that cleared (or blocked) it.
 */
public class ValidatedTransformation {
    private final Transformation transformation;
    private final ValidationResult validation;

    public ValidatedTransformation(Transformation transformation, ValidationResult validation) {
        this.transformation = Objects.requireNonNull(transformation, "transformation");
        this.validation = Objects.requireNonNull(validation, "validation");
        if (!transformation.getId().equals(validation.getTransformationId())) {
            throw new IllegalArgumentException("Validation result " + validation.getTransformationId() +
                    " does not belong to " + transformation.getId());
        }
    }

    public Transformation getTransformation() { return transformation; }
    public ValidationResult getValidation() { return validation; }

    /**
     * Only a valid result recommending apply may reach the applier.
     */
    public boolean isApplicable() {
        return validation.isValid() && validation.getRecommendation() == Recommendation.APPLY;
    }
}
