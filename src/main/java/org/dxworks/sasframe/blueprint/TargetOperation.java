package org.dxworks.sasframe.blueprint;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import org.dxworks.sasframe.rules.TargetOperationKind;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

@JsonPropertyOrder({"op", "parameters"})
public class TargetOperation {
    public final TargetOperationKind op;
    public final Map<String, Object> parameters;

    public TargetOperation(TargetOperationKind op, Map<String, Object> parameters) {
        this.op = op;
        this.parameters = Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    }

    @Override
    public String toString() {
        return op + parameters.toString();
    }
}
