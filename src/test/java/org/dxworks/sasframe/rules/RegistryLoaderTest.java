package org.dxworks.sasframe.rules;

import org.dxworks.sasframe.error.RegistryLoadException;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Paths;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RegistryLoaderTest {

    private final RegistryLoader loader = new RegistryLoader();

    @Test
    void loadDefault_BundledRegistryIsValid() {
        Registries registries = loader.loadDefault();

        assertFalse(registries.getRiskRules().getRules().isEmpty());
        assertFalse(registries.getMappingRules().getRules().isEmpty());
        for (MappingRule rule : registries.getMappingRules().getRules()) {
            assertFalse(rule.predicateKind.isContextual(), rule.ruleId);
            assertFalse(rule.operations.isEmpty(), rule.ruleId);
        }
        ComplexityWeights weights = registries.getComplexityWeights();
        assertEquals(2.0, weights.branches, 1e-9);
        assertEquals(3.0, weights.nestingDepth, 1e-9);
        assertEquals(0.5, weights.statements, 1e-9);
        assertEquals(1.0, weights.datasets, 1e-9);
        assertEquals(1.0, registries.getReadinessWeights().criticalWeight, 1e-9);
        assertEquals(0.5, registries.getReadinessWeights().warningWeight, 1e-9);
        assertTrue(registries.recommendations().containsKey("retain-state"));
    }

    @Test
    void load_PartialWeightsFallBackToDefaults() {
        Registries registries = load("complexity:\n  weights:\n    branches: 5\n");

        assertEquals(5.0, registries.getComplexityWeights().branches, 1e-9);
        assertEquals(3.0, registries.getComplexityWeights().nestingDepth, 1e-9);
        assertTrue(registries.getRiskRules().getRules().isEmpty());
    }

    @Test
    void load_RejectsNegativeComplexityWeight() {
        RegistryLoadException e = assertThrows(RegistryLoadException.class,
                () -> load("complexity:\n  weights:\n    statements: -1\n"));

        assertTrue(e.getMessage().contains("complexity weights"));
    }

    @Test
    void load_RejectsContextualMappingRule() {
        RegistryLoadException e = assertThrows(RegistryLoadException.class, () -> load(""
                + "mappingRules:\n"
                + "  - ruleId: merge-join\n"
                + "    predicate: MERGE_WITHOUT_BY\n"
                + "    operations:\n"
                + "      - op: JOIN\n"));

        assertTrue(e.getMessage().contains("merge-join"));
    }

    @Test
    void load_RejectsUnknownSeverity() {
        assertThrows(RegistryLoadException.class, () -> load(""
                + "riskRules:\n"
                + "  - ruleId: r1\n"
                + "    predicate: MATCH\n"
                + "    parameters:\n"
                + "      kinds: [MERGE_STATEMENT]\n"
                + "    severity: fatal\n"
                + "    rationale: merge\n"));
    }

    @Test
    void load_RejectsDuplicateRuleIds() {
        String rule = "  - ruleId: r1\n"
                + "    predicate: MATCH\n"
                + "    parameters:\n"
                + "      kinds: [MERGE_STATEMENT]\n"
                + "    severity: info\n"
                + "    rationale: merge\n";

        assertThrows(RegistryLoadException.class, () -> load("riskRules:\n" + rule + rule));
    }

    @Test
    void load_RejectsReservedRuleId() {
        assertThrows(RegistryLoadException.class, () -> load(""
                + "riskRules:\n"
                + "  - ruleId: unsupported-construct\n"
                + "    predicate: MATCH\n"
                + "    parameters:\n"
                + "      kinds: [UNKNOWN]\n"
                + "    severity: info\n"
                + "    rationale: unknown\n"));
    }

    @Test
    void load_RejectsUnknownConstructKind() {
        assertThrows(RegistryLoadException.class, () -> load(""
                + "riskRules:\n"
                + "  - ruleId: r1\n"
                + "    predicate: MATCH\n"
                + "    parameters:\n"
                + "      kinds: [GOTO_STATEMENT]\n"
                + "    severity: info\n"
                + "    rationale: goto\n"));
    }

    @Test
    void load_RejectsMatchWithoutConditions() {
        assertThrows(RegistryLoadException.class, () -> load(""
                + "riskRules:\n"
                + "  - ruleId: everything\n"
                + "    predicate: MATCH\n"
                + "    severity: info\n"
                + "    rationale: all\n"));
    }

    @Test
    void load_BestEffortNeedsReducedConfidence() {
        assertThrows(RegistryLoadException.class, () -> load(""
                + "mappingRules:\n"
                + "  - ruleId: m1\n"
                + "    predicate: MATCH\n"
                + "    parameters:\n"
                + "      kinds: [MERGE_STATEMENT]\n"
                + "    bestEffort: true\n"
                + "    confidence: high\n"
                + "    operations:\n"
                + "      - op: JOIN\n"));
    }

    @Test
    void load_ReducedConfidenceNeedsBestEffort() {
        assertThrows(RegistryLoadException.class, () -> load(""
                + "mappingRules:\n"
                + "  - ruleId: m1\n"
                + "    predicate: MATCH\n"
                + "    parameters:\n"
                + "      kinds: [MERGE_STATEMENT]\n"
                + "    confidence: low\n"
                + "    operations:\n"
                + "      - op: JOIN\n"));
    }

    @Test
    void load_RejectsUnknownOperation() {
        assertThrows(RegistryLoadException.class, () -> load(""
                + "mappingRules:\n"
                + "  - ruleId: m1\n"
                + "    predicate: MATCH\n"
                + "    parameters:\n"
                + "      kinds: [MERGE_STATEMENT]\n"
                + "    operations:\n"
                + "      - op: TELEPORT\n"));
    }

    @Test
    void load_MissingFile() {
        assertThrows(RegistryLoadException.class, () -> loader.load(Paths.get("does-not-exist.yml")));
    }

    @Test
    void load_MalformedYaml() {
        assertThrows(RegistryLoadException.class, () -> load("riskRules: [unclosed\n"));
    }

    private Registries load(String yaml) {
        return loader.load(new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8)), "test.yml");
    }
}
