package org.dxworks.sasframe.rules;

import java.util.List;

/**
 * Risk rules in evaluation order. Immutable; safe to share between concurrent analyses.
 */
public class RiskRuleRegistry {

    /** Id of the built-in flag raised for every unrecognised construct; registries may not reuse it. */
    public static final String UNSUPPORTED_CONSTRUCT_RULE_ID = "unsupported-construct";

    private final List<RiskRule> rules;

    public RiskRuleRegistry(List<RiskRule> rules) {
        this.rules = List.copyOf(rules);
    }

    public List<RiskRule> getRules() {
        return rules;
    }
}
