package org.dxworks.sasframe.complexity;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

@JsonPropertyOrder({"branchCount", "maxNestingDepth", "statementCount", "datasetCount", "rawScore", "score", "priority"})
public class AggregateComplexity {
    public final int branchCount;
    public final int maxNestingDepth;
    public final int statementCount;
    public final int datasetCount;
    public final double rawScore;
    /** Raw score normalised to 0..100. */
    public final double score;
    public final TranslationPriority priority;

    public AggregateComplexity(int branchCount, int maxNestingDepth, int statementCount, int datasetCount,
                               double rawScore, double score, TranslationPriority priority) {
        this.branchCount = branchCount;
        this.maxNestingDepth = maxNestingDepth;
        this.statementCount = statementCount;
        this.datasetCount = datasetCount;
        this.rawScore = rawScore;
        this.score = score;
        this.priority = priority;
    }
}
