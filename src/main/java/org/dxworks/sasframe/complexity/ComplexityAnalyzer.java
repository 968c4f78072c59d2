package org.dxworks.sasframe.complexity;

import org.dxworks.sasframe.construct.Construct;
import org.dxworks.sasframe.construct.ConstructKind;
import org.dxworks.sasframe.construct.ConstructTree;
import org.dxworks.sasframe.construct.ConstructWalker;
import org.dxworks.sasframe.rules.ComplexityWeights;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Computes per-construct complexity bottom-up over the construct tree and a weighted, normalised file
 * score from the root's metrics.
 */
public class ComplexityAnalyzer {

    private static final List<String> DATASET_ATTRIBUTES = List.of("inputDatasets", "outputDatasets");

    private final ComplexityWeights weights;

    public ComplexityAnalyzer(ComplexityWeights weights) {
        this.weights = weights;
    }

    public ComplexityReport analyze(ConstructTree tree) {
        int size = tree.size();
        int[] branches = new int[size];
        int[] depths = new int[size];
        int[] statements = new int[size];
        int[] datasetCounts = new int[size];
        List<Set<String>> datasets = new ArrayList<>(Collections.nCopies(size, null));

        for (Construct construct : ConstructWalker.postOrder(tree.getRoot())) {
            int branchCount = isBranch(construct) ? 1 : 0;
            int childDepth = 0;
            int statementCount = construct.isLeaf() ? 1 : 0;
            Set<String> names = new HashSet<>();
            for (String attribute : DATASET_ATTRIBUTES) {
                names.addAll(construct.listAttribute(attribute));
            }
            for (Construct child : construct.children) {
                branchCount += branches[child.id];
                childDepth = Math.max(childDepth, depths[child.id]);
                statementCount += statements[child.id];
                names.addAll(datasets.get(child.id));
                // a child's set is not needed once folded into its parent
                datasets.set(child.id, null);
            }
            int id = construct.id;
            branches[id] = branchCount;
            depths[id] = childDepth + (opensScope(construct) ? 1 : 0);
            statements[id] = statementCount;
            datasetCounts[id] = names.size();
            datasets.set(id, names);
        }

        List<ComplexityScore> scores = new ArrayList<>(size);
        for (int id = 0; id < size; id++) {
            scores.add(new ComplexityScore(id, branches[id], depths[id], statements[id], datasetCounts[id]));
        }
        int root = tree.getRoot().id;
        return new ComplexityReport(scores,
                aggregate(branches[root], depths[root], statements[root], datasetCounts[root]));
    }

    AggregateComplexity aggregate(int branchCount, int maxDepth, int statementCount, int datasetCount) {
        double raw = weights.branches * branchCount
                + weights.nestingDepth * maxDepth
                + weights.statements * statementCount
                + weights.datasets * datasetCount;
        double score = Math.min(100.0, 100.0 * raw / weights.normalizationCeiling);
        return new AggregateComplexity(branchCount, maxDepth, statementCount, datasetCount, raw, score,
                priorityOf(score));
    }

    private TranslationPriority priorityOf(double score) {
        if (score >= weights.highThreshold) {
            return TranslationPriority.HIGH;
        }
        if (score >= weights.mediumThreshold) {
            return TranslationPriority.MEDIUM;
        }
        return TranslationPriority.LOW;
    }

    static boolean isBranch(Construct construct) {
        return switch (construct.kind) {
            case IF_THEN, DO_LOOP, WHEN_CLAUSE, MACRO_IF, MACRO_DO_LOOP -> true;
            case ELSE -> construct.booleanAttribute("elseIf");
            case PROGRAM, DATA_STEP, PROC_STEP, PROC_STATEMENT, SQL_STATEMENT, GLOBAL_STATEMENT,
                    SET_STATEMENT, MERGE_STATEMENT, UPDATE_STATEMENT, BY_STATEMENT, WHERE_STATEMENT,
                    SELECT_BLOCK, OTHERWISE_CLAUSE, DO_BLOCK, ASSIGNMENT, SUM_STATEMENT, RETAIN_STATEMENT,
                    ARRAY_STATEMENT, HASH_DECLARATION, VARIABLE_STATEMENT, OUTPUT_STATEMENT, CONTROL_STATEMENT,
                    INPUT_STATEMENT, INFILE_STATEMENT, FILE_STATEMENT, PUT_STATEMENT, DATALINES, CALL_ROUTINE,
                    EXPRESSION_STATEMENT, MACRO_DEFINITION, MACRO_INVOCATION, MACRO_LET, MACRO_ELSE,
                    MACRO_DO_BLOCK, MACRO_STATEMENT, UNKNOWN -> false;
        };
    }

    private static boolean opensScope(Construct construct) {
        return construct.block && construct.kind != ConstructKind.PROGRAM;
    }
}
