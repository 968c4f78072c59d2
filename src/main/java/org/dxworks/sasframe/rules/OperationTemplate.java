package org.dxworks.sasframe.rules;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One target operation of a mapping rule. Parameter values are templates filled from the construct.
 */
public class OperationTemplate {
    public final TargetOperationKind op;
    public final Map<String, String> parameters;

    public OperationTemplate(TargetOperationKind op, Map<String, String> parameters) {
        this.op = op;
        this.parameters = Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    }
}
