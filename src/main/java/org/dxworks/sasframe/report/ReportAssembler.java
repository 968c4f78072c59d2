package org.dxworks.sasframe.report;

import org.dxworks.sasframe.blueprint.BlueprintEntry;
import org.dxworks.sasframe.complexity.AggregateComplexity;
import org.dxworks.sasframe.complexity.ComplexityReport;
import org.dxworks.sasframe.complexity.TranslationPriority;
import org.dxworks.sasframe.construct.Construct;
import org.dxworks.sasframe.construct.ConstructTree;
import org.dxworks.sasframe.construct.RecoveryEvent;
import org.dxworks.sasframe.error.RuleEvaluationException;
import org.dxworks.sasframe.risk.ClassificationResult;
import org.dxworks.sasframe.risk.RiskFlag;
import org.dxworks.sasframe.rules.ReadinessWeights;
import org.dxworks.sasframe.rules.Severity;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Merges the stage outputs of one file into an {@link AnalysisReport} and computes migration readiness:
 * <pre>
 *   coverage  = mapped constructs / constructs            (1.0 for an empty program)
 *   severity  = clamp((wC * critical + wW * warning) / constructs)
 *   readiness = coverage * (1 - severity)
 * </pre>
 * The synthetic program root is not counted as a construct.
 */
public class ReportAssembler {

    static final String NO_RECOMMENDATIONS = "Code structure appears straightforward for automated translation.";

    private final ReadinessWeights weights;
    private final Map<String, String> recommendations;

    /**
     * @param recommendations rule id to recommendation text, in the order they should be listed
     */
    public ReportAssembler(ReadinessWeights weights, Map<String, String> recommendations) {
        this.weights = weights;
        this.recommendations = new LinkedHashMap<>(recommendations);
    }

    public AnalysisReport assemble(FileIdentity file, ConstructTree tree, ComplexityReport complexity,
                                   ClassificationResult classification, List<BlueprintEntry> blueprint,
                                   List<AnalysisError> diagnostics) {
        int totalConstructs = tree.size() - 1;
        int mapped = 0;
        for (BlueprintEntry entry : blueprint) {
            if (entry.isMapped()) {
                mapped++;
            }
        }
        double coverage = totalConstructs == 0 ? 1.0 : clamp((double) mapped / totalConstructs);

        int critical = 0;
        int warning = 0;
        for (RiskFlag flag : classification.getFlags()) {
            if (flag.severity == Severity.CRITICAL) {
                critical++;
            } else if (flag.severity == Severity.WARNING) {
                warning++;
            }
        }
        double severity = totalConstructs == 0
                ? 0.0
                : clamp((weights.criticalWeight * critical + weights.warningWeight * warning) / totalConstructs);
        double readiness = clamp(coverage * (1.0 - severity));

        List<AnalysisError> errors = new ArrayList<>(diagnostics);
        for (RecoveryEvent event : tree.getRecoveryEvents()) {
            errors.add(new AnalysisError(ErrorType.STRUCTURAL, event.message, event.line, null, null));
        }
        for (RuleEvaluationException failure : classification.getErrors()) {
            Construct construct = tree.byId(failure.getConstructId());
            errors.add(new AnalysisError(ErrorType.RULE_EVALUATION, failure.getMessage(), construct.span.line,
                    failure.getRuleId(), failure.getConstructId()));
        }
        ReportStatus status = tree.getRecoveryEvents().isEmpty() && classification.getErrors().isEmpty()
                ? ReportStatus.COMPLETE
                : ReportStatus.PARTIAL;

        return new AnalysisReport(file, status, readiness, coverage,
                summarize(file, tree, complexity.getAggregate(), classification.getFlags()),
                complexity.getAggregate(), tree.getRoot(), complexity.getScores(), classification.getFlags(),
                blueprint, tree.getRecoveryEvents(), errors);
    }

    /** Minimal report for a file whose analysis could not run. */
    public static AnalysisReport failed(FileIdentity file, List<AnalysisError> errors) {
        return new AnalysisReport(file, ReportStatus.FAILED, 0.0, 0.0, null, null, null, null, null, null, null,
                errors);
    }

    ProgramSummary summarize(FileIdentity file, ConstructTree tree, AggregateComplexity aggregate,
                             List<RiskFlag> flags) {
        ProgramSummary summary = new ProgramSummary();
        Set<String> procTypes = new TreeSet<>();
        Set<String> created = new TreeSet<>();
        Set<String> used = new TreeSet<>();
        for (Construct construct : tree.preOrder()) {
            switch (construct.kind) {
                case DATA_STEP -> summary.dataSteps++;
                case PROC_STEP -> {
                    String procName = construct.stringAttribute("procName");
                    if ("SQL".equals(procName)) {
                        summary.procSqlBlocks++;
                    } else {
                        summary.procBlocks++;
                    }
                    if (procName != null && !procName.isEmpty()) {
                        procTypes.add(procName);
                    }
                }
                case MACRO_DEFINITION -> summary.macroDefinitions++;
                case MACRO_INVOCATION -> summary.macroCalls++;
                default -> {
                    // counted only through their datasets
                }
            }
            created.addAll(construct.listAttribute("outputDatasets"));
            used.addAll(construct.listAttribute("inputDatasets"));
        }
        summary.procTypes.addAll(procTypes);
        summary.datasetsCreated.addAll(created);
        summary.datasetsUsed.addAll(used);
        summary.totalLines = file.lineCount;
        summary.totalTokens = tree.getTokenCount();
        summary.complexityScore = aggregate.score;
        summary.translationPriority = aggregate.priority;
        summary.confidenceAssessment = assessmentOf(aggregate.priority);
        summary.recommendations.addAll(recommendationsFor(flags));
        return summary;
    }

    private List<String> recommendationsFor(List<RiskFlag> flags) {
        Set<String> fired = new HashSet<>();
        for (RiskFlag flag : flags) {
            fired.add(flag.ruleId);
        }
        List<String> result = new ArrayList<>();
        for (Map.Entry<String, String> entry : recommendations.entrySet()) {
            if (fired.contains(entry.getKey()) && !result.contains(entry.getValue())) {
                result.add(entry.getValue());
            }
        }
        if (result.isEmpty()) {
            result.add(NO_RECOMMENDATIONS);
        }
        return result;
    }

    static String assessmentOf(TranslationPriority priority) {
        return switch (priority) {
            case HIGH -> "Manual review strongly recommended";
            case MEDIUM -> "Mixed automation with oversight";
            case LOW -> "Good candidate for automated translation";
        };
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
