package org.dxworks.sasframe.blueprint;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import org.dxworks.sasframe.construct.ConstructKind;
import org.dxworks.sasframe.rules.Confidence;

import java.util.List;

/**
 * Proposed translation of one construct. An entry with no operations is {@link Confidence#UNSUPPORTED}.
 */
@JsonPropertyOrder({"constructId", "kind", "ruleId", "confidence", "operations", "note"})
@JsonInclude(JsonInclude.Include.NON_NULL)
public class BlueprintEntry {
    public final int constructId;
    public final ConstructKind kind;
    /** Mapping rule that produced the entry, null when none matched. */
    public final String ruleId;
    public final Confidence confidence;
    public final List<TargetOperation> operations;
    public final String note;

    public BlueprintEntry(int constructId, ConstructKind kind, String ruleId, Confidence confidence,
                          List<TargetOperation> operations, String note) {
        this.constructId = constructId;
        this.kind = kind;
        this.ruleId = ruleId;
        this.confidence = confidence;
        this.operations = List.copyOf(operations);
        this.note = note;
    }

    @JsonIgnore
    public boolean isMapped() {
        return confidence != Confidence.UNSUPPORTED;
    }
}
