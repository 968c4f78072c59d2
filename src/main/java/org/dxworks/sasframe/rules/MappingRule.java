package org.dxworks.sasframe.rules;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps matching constructs to target operations. Rules that need no surrounding context claim
 * {@link Confidence#HIGH}; best-effort rules claim the confidence they declare.
 */
public class MappingRule {
    public final String ruleId;
    public final PredicateKind predicateKind;
    public final Map<String, Object> parameters;
    public final boolean bestEffort;
    public final Confidence declaredConfidence;
    public final List<OperationTemplate> operations;
    /** Manual-review note; may be null. */
    public final String note;

    private final ConstructPredicate predicate;

    public MappingRule(String ruleId, PredicateKind predicateKind, Map<String, Object> parameters,
                       ConstructPredicate predicate, boolean bestEffort, Confidence declaredConfidence,
                       List<OperationTemplate> operations, String note) {
        this.ruleId = ruleId;
        this.predicateKind = predicateKind;
        this.parameters = Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
        this.predicate = predicate;
        this.bestEffort = bestEffort;
        this.declaredConfidence = declaredConfidence;
        this.operations = List.copyOf(operations);
        this.note = note;
    }

    public boolean matches(RuleContext context) {
        return predicate.test(context);
    }

    public Confidence confidence() {
        return bestEffort ? declaredConfidence : Confidence.HIGH;
    }
}
