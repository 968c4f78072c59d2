package org.dxworks.sasframe.rules;

/**
 * Weights and bands for the aggregate complexity score. Loaded from the registry file, immutable.
 */
public class ComplexityWeights {

    public static final ComplexityWeights DEFAULT = new ComplexityWeights(2.0, 3.0, 0.5, 1.0, 100.0, 60.0, 30.0);

    public final double branches;
    public final double nestingDepth;
    public final double statements;
    public final double datasets;
    /** Raw weighted sum that maps to a score of 100. */
    public final double normalizationCeiling;
    public final double highThreshold;
    public final double mediumThreshold;

    public ComplexityWeights(double branches, double nestingDepth, double statements, double datasets,
                             double normalizationCeiling, double highThreshold, double mediumThreshold) {
        if (branches < 0 || nestingDepth < 0 || statements < 0 || datasets < 0) {
            throw new IllegalArgumentException("complexity weights must not be negative");
        }
        if (normalizationCeiling <= 0) {
            throw new IllegalArgumentException("normalizationCeiling must be positive: " + normalizationCeiling);
        }
        if (mediumThreshold > highThreshold) {
            throw new IllegalArgumentException("medium priority threshold " + mediumThreshold
                    + " is above the high threshold " + highThreshold);
        }
        this.branches = branches;
        this.nestingDepth = nestingDepth;
        this.statements = statements;
        this.datasets = datasets;
        this.normalizationCeiling = normalizationCeiling;
        this.highThreshold = highThreshold;
        this.mediumThreshold = mediumThreshold;
    }
}
