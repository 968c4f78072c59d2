package org.dxworks.sasframe.risk;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import org.dxworks.sasframe.rules.Severity;

@JsonPropertyOrder({"ruleId", "severity", "constructId", "line", "rationale"})
public class RiskFlag {
    public final String ruleId;
    public final Severity severity;
    public final int constructId;
    public final int line;
    public final String rationale;

    public RiskFlag(String ruleId, Severity severity, int constructId, int line, String rationale) {
        this.ruleId = ruleId;
        this.severity = severity;
        this.constructId = constructId;
        this.line = line;
        this.rationale = rationale;
    }

    @Override
    public String toString() {
        return ruleId + "/" + severity.id() + "#" + constructId + ": " + rationale;
    }
}
