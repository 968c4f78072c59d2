package org.dxworks.sasframe.risk;

import org.dxworks.sasframe.error.RuleEvaluationException;

import java.util.List;

/**
 * Flags in evaluation order plus the rule failures skipped on the way.
 */
public class ClassificationResult {

    private final List<RiskFlag> flags;
    private final List<RuleEvaluationException> errors;

    public ClassificationResult(List<RiskFlag> flags, List<RuleEvaluationException> errors) {
        this.flags = List.copyOf(flags);
        this.errors = List.copyOf(errors);
    }

    public List<RiskFlag> getFlags() {
        return flags;
    }

    public List<RuleEvaluationException> getErrors() {
        return errors;
    }
}
