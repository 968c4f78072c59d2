package org.dxworks.sasframe.complexity;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Complexity metrics of one construct's subtree.
 */
@JsonPropertyOrder({"constructId", "branchCount", "nestingDepth", "statementCount", "datasetCount"})
public class ComplexityScore {
    public final int constructId;
    /** Conditional and iterative constructs in the subtree, the construct itself included. */
    public final int branchCount;
    /** Block constructs on the deepest path starting at this construct. */
    public final int nestingDepth;
    /** Leaf constructs in the subtree; a leaf counts itself. */
    public final int statementCount;
    /** Distinct normalised dataset names referenced in the subtree. */
    public final int datasetCount;

    public ComplexityScore(int constructId, int branchCount, int nestingDepth, int statementCount, int datasetCount) {
        this.constructId = constructId;
        this.branchCount = branchCount;
        this.nestingDepth = nestingDepth;
        this.statementCount = statementCount;
        this.datasetCount = datasetCount;
    }

    @Override
    public String toString() {
        return "#" + constructId + "{branches=" + branchCount + ", depth=" + nestingDepth
                + ", statements=" + statementCount + ", datasets=" + datasetCount + "}";
    }
}
