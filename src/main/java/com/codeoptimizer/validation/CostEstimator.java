package com.codeoptimizer.validation;

import com.codeoptimizer.parser.ElementKind;
import com.codeoptimizer.parser.Span;
import com.codeoptimizer.parser.SyntaxElement;
import com.codeoptimizer.parser.SyntaxTree;

/**
 * Static stand-in for the run time of a code region. A loop nested d levels deep costs 10^d and
 * a call costs 10 to the power of its loop depth, on top of a base cost of 1.
 */
public class CostEstimator {
    private static final double LOOP_FACTOR = 10.0;

    public double estimate(SyntaxTree tree, Span region) {
        double cost = 1.0;
        for (SyntaxElement element : tree.elementsWithin(region)) {
            if (element.getKind() == ElementKind.LOOP || element.getKind() == ElementKind.CALL) {
                cost += Math.pow(LOOP_FACTOR, tree.loopDepth(element));
            }
        }
        return cost;
    }
}
