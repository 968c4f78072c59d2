package org.dxworks.sasframe.report;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

@JsonPropertyOrder({"type", "message", "line", "ruleId", "constructId"})
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AnalysisError {
    public final ErrorType type;
    public final String message;
    public final Integer line;
    public final String ruleId;
    public final Integer constructId;

    public AnalysisError(ErrorType type, String message, Integer line, String ruleId, Integer constructId) {
        this.type = type;
        this.message = message;
        this.line = line;
        this.ruleId = ruleId;
        this.constructId = constructId;
    }

    public static AnalysisError of(ErrorType type, String message) {
        return new AnalysisError(type, message, null, null, null);
    }

    public static AnalysisError atLine(ErrorType type, String message, int line) {
        return new AnalysisError(type, message, line, null, null);
    }

    @Override
    public String toString() {
        return type + (line != null ? " at line " + line : "") + ": " + message;
    }
}
