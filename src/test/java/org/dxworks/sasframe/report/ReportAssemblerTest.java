package org.dxworks.sasframe.report;

import com.fasterxml.jackson.databind.JsonNode;
import org.dxworks.sasframe.blueprint.BlueprintEntry;
import org.dxworks.sasframe.blueprint.BlueprintGenerator;
import org.dxworks.sasframe.complexity.ComplexityAnalyzer;
import org.dxworks.sasframe.complexity.TranslationPriority;
import org.dxworks.sasframe.construct.ConstructTree;
import org.dxworks.sasframe.risk.ClassificationResult;
import org.dxworks.sasframe.risk.RiskClassifier;
import org.dxworks.sasframe.rules.Confidence;
import org.dxworks.sasframe.rules.MappingRegistry;
import org.dxworks.sasframe.rules.MappingRule;
import org.dxworks.sasframe.rules.OperationTemplate;
import org.dxworks.sasframe.rules.PredicateKind;
import org.dxworks.sasframe.rules.ReadinessWeights;
import org.dxworks.sasframe.rules.Registries;
import org.dxworks.sasframe.rules.RegistryLoader;
import org.dxworks.sasframe.rules.RiskRuleRegistry;
import org.dxworks.sasframe.rules.TargetOperationKind;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.dxworks.sasframe.TestUtils.APPROVAL_MAPPER;
import static org.dxworks.sasframe.TestUtils.tree;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ReportAssemblerTest {

    private static final Registries DEFAULTS = new RegistryLoader().loadDefault();

    @Test
    void assemble_FullyMappedProgramIsReady() {
        MappingRegistry everything = new MappingRegistry(List.of(new MappingRule("all", PredicateKind.MATCH,
                Map.of(), context -> true, false, Confidence.HIGH,
                List.of(new OperationTemplate(TargetOperationKind.NO_OP, Map.of())), null)));
        ConstructTree tree = tree("data a;\n  x = 1;\nrun;\n");

        AnalysisReport report = assemble(tree, new RiskRuleRegistry(List.of()), everything);

        assertEquals(ReportStatus.COMPLETE, report.status);
        assertEquals(1.0, report.coverage, 1e-9);
        assertEquals(1.0, report.readiness, 1e-9);
        assertTrue(report.errors.isEmpty());
    }

    @Test
    void assemble_EmptyProgram() {
        AnalysisReport report = assemble(tree(""), DEFAULTS.getRiskRules(), DEFAULTS.getMappingRules());

        assertEquals(1.0, report.coverage, 1e-9);
        assertEquals(1.0, report.readiness, 1e-9);
        assertTrue(report.blueprint.isEmpty());
    }

    @Test
    void assemble_ReadinessFromCoverageAndSeverity() {
        ConstructTree tree = tree("foo;\ndata a;\n  merge b c;\nrun;\n");

        AnalysisReport report = assemble(tree, DEFAULTS.getRiskRules(), DEFAULTS.getMappingRules());

        assertEquals(ReportStatus.COMPLETE, report.status);
        assertEquals(2.0 / 3.0, report.coverage, 1e-9);
        assertEquals(4.0 / 9.0, report.readiness, 1e-9);
        assertTrue(report.readiness >= 0.0 && report.readiness <= 1.0);
    }

    @Test
    void assemble_SeverityIsClamped() {
        ConstructTree tree = tree("data a;\n  merge b c;\nrun;\n");
        ReportAssembler heavy = new ReportAssembler(new ReadinessWeights(10.0, 10.0), Map.of());
        ComplexityAnalyzer complexity = new ComplexityAnalyzer(DEFAULTS.getComplexityWeights());
        ClassificationResult classification = new RiskClassifier().classify(tree, DEFAULTS.getRiskRules());
        List<BlueprintEntry> blueprint = new BlueprintGenerator().generate(tree, DEFAULTS.getMappingRules());

        AnalysisReport report = heavy.assemble(FileIdentity.of("a.sas", ""), tree, complexity.analyze(tree),
                classification, blueprint, List.of());

        assertEquals(0.0, report.readiness, 1e-9);
    }

    @Test
    void assemble_RecoveryMakesReportPartial() {
        ConstructTree tree = tree("data a;\n  end;\nrun;\n");

        AnalysisReport report = assemble(tree, DEFAULTS.getRiskRules(), DEFAULTS.getMappingRules());

        assertEquals(ReportStatus.PARTIAL, report.status);
        assertEquals(1, report.recoveryEvents.size());
        assertEquals(ErrorType.STRUCTURAL, report.errors.get(0).type);
        assertEquals(2, report.errors.get(0).line);
    }

    @Test
    void assemble_Summary() {
        ConstructTree tree = tree("data work.clean;\n  set raw;\n  retain total;\nrun;\n"
                + "proc sort data=clean out=sorted; by id; run;\n"
                + "proc sql;\n  create table final as select * from sorted;\nquit;\n");

        ProgramSummary summary = assemble(tree, DEFAULTS.getRiskRules(), DEFAULTS.getMappingRules()).summary;

        assertEquals(1, summary.dataSteps);
        assertEquals(1, summary.procBlocks);
        assertEquals(1, summary.procSqlBlocks);
        assertEquals(List.of("SORT", "SQL"), summary.procTypes);
        assertEquals(List.of("CLEAN", "FINAL", "SORTED"), summary.datasetsCreated);
        assertEquals(List.of("CLEAN", "RAW", "SORTED"), summary.datasetsUsed);
        assertEquals(List.of("RETAIN statements require stateful translation logic."), summary.recommendations);
        assertEquals(TranslationPriority.LOW, summary.translationPriority);
        assertEquals("Good candidate for automated translation", summary.confidenceAssessment);
    }

    @Test
    void assemble_NoFlagsNoRecommendations() {
        ProgramSummary summary = assemble(tree("data a;\n  x = 1;\nrun;\n"), DEFAULTS.getRiskRules(),
                DEFAULTS.getMappingRules()).summary;

        assertEquals(List.of(ReportAssembler.NO_RECOMMENDATIONS), summary.recommendations);
    }

    @Test
    void failed_CarriesOnlyIdentityAndErrors() throws Exception {
        AnalysisReport report = ReportAssembler.failed(new FileIdentity("x/broken.sas", "broken.sas", 3),
                List.of(AnalysisError.atLine(ErrorType.EXTERNAL_LEX, "unterminated string literal", 2)));

        assertEquals(ReportStatus.FAILED, report.status);
        assertEquals(0.0, report.readiness, 1e-9);
        assertNull(report.summary);
        assertNull(report.constructs);

        JsonNode json = APPROVAL_MAPPER.readTree(APPROVAL_MAPPER.writeValueAsString(report));
        assertEquals("analysis", json.get("kind").asText());
        assertEquals("failed", json.get("status").asText());
        assertEquals("EXTERNAL_LEX", json.get("errors").get(0).get("type").asText());
        assertNull(json.get("blueprint"));
    }

    @Test
    void assemble_SerializesToJson() throws Exception {
        ConstructTree tree = tree("data a;\n  merge b c;\nrun;\n");
        AnalysisReport report = assemble(tree, DEFAULTS.getRiskRules(), DEFAULTS.getMappingRules());

        JsonNode json = APPROVAL_MAPPER.readTree(APPROVAL_MAPPER.writeValueAsString(report));

        assertEquals("complete", json.get("status").asText());
        assertEquals("critical", json.get("riskFlags").get(0).get("severity").asText());
        assertEquals("medium", json.get("blueprint").get(1).get("confidence").asText());
        assertEquals("PROGRAM", json.get("constructs").get("kind").asText());
        assertNull(json.get("constructs").get("children").get(0).get("tokens"));
    }

    @Test
    void countLines_FollowsLineBreaks() {
        assertEquals(0, FileIdentity.countLines(""));
        assertEquals(1, FileIdentity.countLines("run;"));
        assertEquals(2, FileIdentity.countLines("data a;\nrun;\n"));
        assertEquals(3, FileIdentity.countLines("data a;\n\nrun;"));
        assertEquals("b.sas", FileIdentity.of("dir\\sub/b.sas", "").fileName);
    }

    private static AnalysisReport assemble(ConstructTree tree, RiskRuleRegistry risks, MappingRegistry mappings) {
        ComplexityAnalyzer complexity = new ComplexityAnalyzer(DEFAULTS.getComplexityWeights());
        ClassificationResult classification = new RiskClassifier().classify(tree, risks);
        List<BlueprintEntry> blueprint = new BlueprintGenerator().generate(tree, mappings);
        ReportAssembler assembler = new ReportAssembler(DEFAULTS.getReadinessWeights(), DEFAULTS.recommendations());
        return assembler.assemble(FileIdentity.of("test.sas", ""), tree, complexity.analyze(tree), classification,
                blueprint, List.of());
    }
}
