package org.dxworks.sasframe.rules;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Everything loaded from one registry file. Loaded once per process and never mutated.
 */
public class Registries {

    private final RiskRuleRegistry riskRules;
    private final MappingRegistry mappingRules;
    private final ComplexityWeights complexityWeights;
    private final ReadinessWeights readinessWeights;

    public Registries(RiskRuleRegistry riskRules, MappingRegistry mappingRules,
                      ComplexityWeights complexityWeights, ReadinessWeights readinessWeights) {
        this.riskRules = riskRules;
        this.mappingRules = mappingRules;
        this.complexityWeights = complexityWeights;
        this.readinessWeights = readinessWeights;
    }

    public RiskRuleRegistry getRiskRules() {
        return riskRules;
    }

    public MappingRegistry getMappingRules() {
        return mappingRules;
    }

    public ComplexityWeights getComplexityWeights() {
        return complexityWeights;
    }

    public ReadinessWeights getReadinessWeights() {
        return readinessWeights;
    }

    /** Rule id to recommendation, in registry order, for rules that carry one. */
    public Map<String, String> recommendations() {
        Map<String, String> recommendations = new LinkedHashMap<>();
        for (RiskRule rule : riskRules.getRules()) {
            if (rule.recommendation != null && !rule.recommendation.isBlank()) {
                recommendations.put(rule.ruleId, rule.recommendation);
            }
        }
        return recommendations;
    }
}
