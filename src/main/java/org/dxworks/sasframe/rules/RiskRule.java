package org.dxworks.sasframe.rules;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A risk rule: predicate, severity and the rationale template rendered for each match.
 */
public class RiskRule {
    public final String ruleId;
    public final PredicateKind predicateKind;
    public final Map<String, Object> parameters;
    public final Severity severity;
    public final String rationale;
    /** Advice shown in the report summary when the rule fires; may be null. */
    public final String recommendation;

    private final ConstructPredicate predicate;

    public RiskRule(String ruleId, PredicateKind predicateKind, Map<String, Object> parameters,
                    ConstructPredicate predicate, Severity severity, String rationale, String recommendation) {
        this.ruleId = ruleId;
        this.predicateKind = predicateKind;
        this.parameters = Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
        this.predicate = predicate;
        this.severity = severity;
        this.rationale = rationale;
        this.recommendation = recommendation;
    }

    public boolean matches(RuleContext context) {
        return predicate.test(context);
    }

    @Override
    public String toString() {
        return ruleId + "(" + severity.id() + ")";
    }
}
