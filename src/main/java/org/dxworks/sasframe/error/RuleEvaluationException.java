package org.dxworks.sasframe.error;

public class RuleEvaluationException extends RuntimeException {
    private final String ruleId;
    private final int constructId;

    public RuleEvaluationException(String ruleId, int constructId, Throwable cause) {
        super("rule '" + ruleId + "' failed on construct " + constructId + ": " + cause.getMessage(), cause);
        this.ruleId = ruleId;
        this.constructId = constructId;
    }

    public String getRuleId() {
        return ruleId;
    }

    public int getConstructId() {
        return constructId;
    }
}
