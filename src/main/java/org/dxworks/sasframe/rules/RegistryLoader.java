package org.dxworks.sasframe.rules;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.dxworks.sasframe.error.RegistryLoadException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Loads risk rules, mapping rules and weights from a YAML registry file.
 * <p>
 * Every rule is validated while loading: unknown predicate kinds, severities, confidences, operation kinds
 * or construct kinds are rejected, as are mapping rules built on contextual predicates.
 */
public class RegistryLoader {

    public static final String DEFAULT_REGISTRY_RESOURCE = "sasframe/default-registry.yml";

    private static final Logger LOGGER = LoggerFactory.getLogger(RegistryLoader.class);

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());

    public Registries loadDefault() {
        try (InputStream in = RegistryLoader.class.getClassLoader().getResourceAsStream(DEFAULT_REGISTRY_RESOURCE)) {
            if (in == null) {
                throw new RegistryLoadException("default registry " + DEFAULT_REGISTRY_RESOURCE
                        + " is missing from the classpath");
            }
            return load(in, DEFAULT_REGISTRY_RESOURCE);
        } catch (IOException e) {
            throw new RegistryLoadException("cannot read default registry: " + e.getMessage(), e);
        }
    }

    public Registries load(Path file) {
        if (!Files.isRegularFile(file)) {
            throw new RegistryLoadException("registry file not found: " + file);
        }
        try (InputStream in = Files.newInputStream(file)) {
            return load(in, file.toString());
        } catch (IOException e) {
            throw new RegistryLoadException("cannot read registry " + file + ": " + e.getMessage(), e);
        }
    }

    public Registries load(InputStream in, String sourceName) {
        YamlRegistry yaml;
        try {
            yaml = yamlMapper.readValue(in, YamlRegistry.class);
        } catch (IOException e) {
            throw new RegistryLoadException("malformed registry " + sourceName + ": " + e.getMessage(), e);
        }
        if (yaml == null) {
            throw new RegistryLoadException("registry " + sourceName + " is empty");
        }

        List<RiskRule> riskRules = riskRules(yaml.riskRules);
        List<MappingRule> mappingRules = mappingRules(yaml.mappingRules);
        Registries registries = new Registries(new RiskRuleRegistry(riskRules), new MappingRegistry(mappingRules),
                complexityWeights(yaml.complexity), readinessWeights(yaml.readiness));
        LOGGER.info("Loaded {} risk rules and {} mapping rules from {}", riskRules.size(), mappingRules.size(),
                sourceName);
        return registries;
    }

    private List<RiskRule> riskRules(List<YamlRiskRule> entries) {
        List<RiskRule> rules = new ArrayList<>();
        if (entries == null) {
            return rules;
        }
        Set<String> ids = new HashSet<>();
        for (YamlRiskRule entry : entries) {
            String ruleId = ruleId(entry.ruleId, ids);
            if (RiskRuleRegistry.UNSUPPORTED_CONSTRUCT_RULE_ID.equals(ruleId)) {
                throw new RegistryLoadException("rule id " + ruleId + " is reserved for the built-in flag");
            }
            PredicateKind kind = predicateKind(ruleId, entry.predicate);
            Map<String, Object> parameters = parameters(entry.parameters);
            if (entry.severity == null) {
                throw new RegistryLoadException("rule " + ruleId + ": severity is required");
            }
            Severity severity;
            try {
                severity = Severity.parse(entry.severity);
            } catch (IllegalArgumentException e) {
                throw new RegistryLoadException("rule " + ruleId + ": unknown severity '" + entry.severity + "'", e);
            }
            if (entry.rationale == null || entry.rationale.isBlank()) {
                throw new RegistryLoadException("rule " + ruleId + ": rationale is required");
            }
            rules.add(new RiskRule(ruleId, kind, parameters, PredicateFactory.create(ruleId, kind, parameters),
                    severity, entry.rationale, entry.recommendation));
        }
        return rules;
    }

    private List<MappingRule> mappingRules(List<YamlMappingRule> entries) {
        List<MappingRule> rules = new ArrayList<>();
        if (entries == null) {
            return rules;
        }
        Set<String> ids = new HashSet<>();
        for (YamlMappingRule entry : entries) {
            String ruleId = ruleId(entry.ruleId, ids);
            PredicateKind kind = predicateKind(ruleId, entry.predicate);
            if (kind.isContextual()) {
                throw new RegistryLoadException("mapping rule " + ruleId + ": predicate " + kind
                        + " reads surrounding constructs; mapping rules may only look at the construct itself");
            }
            Map<String, Object> parameters = parameters(entry.parameters);
            boolean bestEffort = Boolean.TRUE.equals(entry.bestEffort);
            Confidence confidence = confidence(ruleId, entry.confidence, bestEffort);
            if (entry.operations == null || entry.operations.isEmpty()) {
                throw new RegistryLoadException("mapping rule " + ruleId + ": at least one operation is required");
            }
            List<OperationTemplate> operations = new ArrayList<>();
            for (YamlOperation operation : entry.operations) {
                operations.add(operation(ruleId, operation));
            }
            rules.add(new MappingRule(ruleId, kind, parameters, PredicateFactory.create(ruleId, kind, parameters),
                    bestEffort, confidence, operations, entry.note));
        }
        return rules;
    }

    private static Confidence confidence(String ruleId, String value, boolean bestEffort) {
        if (value == null) {
            if (bestEffort) {
                throw new RegistryLoadException("mapping rule " + ruleId + ": best-effort rules must declare "
                        + "confidence medium or low");
            }
            return Confidence.HIGH;
        }
        Confidence confidence;
        try {
            confidence = Confidence.parse(value);
        } catch (IllegalArgumentException e) {
            throw new RegistryLoadException("mapping rule " + ruleId + ": unknown confidence '" + value + "'", e);
        }
        if (bestEffort && confidence != Confidence.MEDIUM && confidence != Confidence.LOW) {
            throw new RegistryLoadException("mapping rule " + ruleId + ": best-effort rules must declare "
                    + "confidence medium or low, got " + confidence.id());
        }
        if (!bestEffort && confidence != Confidence.HIGH) {
            throw new RegistryLoadException("mapping rule " + ruleId + ": confidence " + confidence.id()
                    + " requires bestEffort: true");
        }
        return confidence;
    }

    private static OperationTemplate operation(String ruleId, YamlOperation operation) {
        if (operation == null || operation.op == null) {
            throw new RegistryLoadException("mapping rule " + ruleId + ": operation without 'op'");
        }
        TargetOperationKind op;
        try {
            op = TargetOperationKind.valueOf(operation.op.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new RegistryLoadException("mapping rule " + ruleId + ": unknown operation '" + operation.op + "'", e);
        }
        Map<String, String> parameters = new LinkedHashMap<>();
        if (operation.parameters != null) {
            operation.parameters.forEach((key, value) -> parameters.put(key, String.valueOf(value)));
        }
        return new OperationTemplate(op, parameters);
    }

    private static String ruleId(String ruleId, Set<String> seen) {
        if (ruleId == null || ruleId.isBlank()) {
            throw new RegistryLoadException("rule without ruleId");
        }
        if (!seen.add(ruleId)) {
            throw new RegistryLoadException("duplicate ruleId " + ruleId);
        }
        return ruleId;
    }

    private static PredicateKind predicateKind(String ruleId, String value) {
        if (value == null) {
            throw new RegistryLoadException("rule " + ruleId + ": predicate is required");
        }
        try {
            return PredicateKind.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new RegistryLoadException("rule " + ruleId + ": unknown predicate '" + value + "'", e);
        }
    }

    private static Map<String, Object> parameters(Map<String, Object> parameters) {
        return parameters == null ? Map.of() : parameters;
    }

    private static ComplexityWeights complexityWeights(YamlComplexity complexity) {
        ComplexityWeights defaults = ComplexityWeights.DEFAULT;
        if (complexity == null) {
            return defaults;
        }
        YamlWeights weights = complexity.weights != null ? complexity.weights : new YamlWeights();
        YamlThresholds thresholds = complexity.priorityThresholds != null
                ? complexity.priorityThresholds
                : new YamlThresholds();
        try {
            return new ComplexityWeights(
                    orDefault(weights.branches, defaults.branches),
                    orDefault(weights.nestingDepth, defaults.nestingDepth),
                    orDefault(weights.statements, defaults.statements),
                    orDefault(weights.datasets, defaults.datasets),
                    orDefault(complexity.normalizationCeiling, defaults.normalizationCeiling),
                    orDefault(thresholds.high, defaults.highThreshold),
                    orDefault(thresholds.medium, defaults.mediumThreshold));
        } catch (IllegalArgumentException e) {
            throw new RegistryLoadException("invalid complexity weights: " + e.getMessage(), e);
        }
    }

    private static ReadinessWeights readinessWeights(YamlReadiness readiness) {
        ReadinessWeights defaults = ReadinessWeights.DEFAULT;
        if (readiness == null) {
            return defaults;
        }
        try {
            return new ReadinessWeights(orDefault(readiness.criticalWeight, defaults.criticalWeight),
                    orDefault(readiness.warningWeight, defaults.warningWeight));
        } catch (IllegalArgumentException e) {
            throw new RegistryLoadException("invalid readiness weights: " + e.getMessage(), e);
        }
    }

    private static double orDefault(Double value, double defaultValue) {
        return value != null ? value : defaultValue;
    }

    private static class YamlRegistry {
        public YamlComplexity complexity;
        public YamlReadiness readiness;
        public List<YamlRiskRule> riskRules;
        public List<YamlMappingRule> mappingRules;
    }

    private static class YamlComplexity {
        public YamlWeights weights;
        public Double normalizationCeiling;
        public YamlThresholds priorityThresholds;
    }

    private static class YamlWeights {
        public Double branches;
        public Double nestingDepth;
        public Double statements;
        public Double datasets;
    }

    private static class YamlThresholds {
        public Double high;
        public Double medium;
    }

    private static class YamlReadiness {
        public Double criticalWeight;
        public Double warningWeight;
    }

    private static class YamlRiskRule {
        public String ruleId;
        public String predicate;
        public Map<String, Object> parameters;
        public String severity;
        public String rationale;
        public String recommendation;
    }

    private static class YamlMappingRule {
        public String ruleId;
        public String predicate;
        public Map<String, Object> parameters;
        public String confidence;
        public Boolean bestEffort;
        public List<YamlOperation> operations;
        public String note;
    }

    private static class YamlOperation {
        public String op;
        public Map<String, Object> parameters;
    }
}
