package org.dxworks.sasframe.report;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import org.dxworks.sasframe.blueprint.BlueprintEntry;
import org.dxworks.sasframe.complexity.AggregateComplexity;
import org.dxworks.sasframe.complexity.ComplexityScore;
import org.dxworks.sasframe.construct.Construct;
import org.dxworks.sasframe.construct.RecoveryEvent;
import org.dxworks.sasframe.risk.RiskFlag;

import java.util.List;

/**
 * The per-file artifact. Failed reports carry only the file identity, status and errors.
 * Field names are part of the output contract; changes must be additive.
 */
@JsonPropertyOrder({"kind", "file", "status", "readiness", "coverage", "summary", "complexity", "constructs",
        "complexityScores", "riskFlags", "blueprint", "recoveryEvents", "errors"})
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AnalysisReport {
    public final String kind = "analysis";
    public final FileIdentity file;
    public final ReportStatus status;
    /** Derived from coverage and flag severity; see {@link ReportAssembler}. */
    public final double readiness;
    public final double coverage;
    public final ProgramSummary summary;
    public final AggregateComplexity complexity;
    public final Construct constructs;
    public final List<ComplexityScore> complexityScores;
    public final List<RiskFlag> riskFlags;
    public final List<BlueprintEntry> blueprint;
    public final List<RecoveryEvent> recoveryEvents;
    public final List<AnalysisError> errors;

    AnalysisReport(FileIdentity file, ReportStatus status, double readiness, double coverage, ProgramSummary summary,
                   AggregateComplexity complexity, Construct constructs, List<ComplexityScore> complexityScores,
                   List<RiskFlag> riskFlags, List<BlueprintEntry> blueprint, List<RecoveryEvent> recoveryEvents,
                   List<AnalysisError> errors) {
        this.file = file;
        this.status = status;
        this.readiness = readiness;
        this.coverage = coverage;
        this.summary = summary;
        this.complexity = complexity;
        this.constructs = constructs;
        this.complexityScores = complexityScores;
        this.riskFlags = riskFlags;
        this.blueprint = blueprint;
        this.recoveryEvents = recoveryEvents;
        this.errors = List.copyOf(errors);
    }
}
