package org.dxworks.sasframe.complexity;

import java.util.List;

/**
 * Per-construct scores, indexed by construct id, plus the file aggregate.
 */
public class ComplexityReport {

    private final List<ComplexityScore> scores;
    private final AggregateComplexity aggregate;

    public ComplexityReport(List<ComplexityScore> scores, AggregateComplexity aggregate) {
        this.scores = List.copyOf(scores);
        this.aggregate = aggregate;
    }

    /** Scores in construct-id order. */
    public List<ComplexityScore> getScores() {
        return scores;
    }

    public ComplexityScore scoreOf(int constructId) {
        return scores.get(constructId);
    }

    public AggregateComplexity getAggregate() {
        return aggregate;
    }
}
