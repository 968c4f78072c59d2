package org.dxworks.sasframe.rules;

/**
 * How much one critical or warning flag lowers migration readiness, relative to the construct count.
 */
public class ReadinessWeights {

    public static final ReadinessWeights DEFAULT = new ReadinessWeights(1.0, 0.5);

    public final double criticalWeight;
    public final double warningWeight;

    public ReadinessWeights(double criticalWeight, double warningWeight) {
        if (criticalWeight < 0 || warningWeight < 0) {
            throw new IllegalArgumentException("readiness weights must not be negative");
        }
        this.criticalWeight = criticalWeight;
        this.warningWeight = warningWeight;
    }
}
