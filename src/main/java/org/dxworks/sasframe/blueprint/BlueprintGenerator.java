package org.dxworks.sasframe.blueprint;

import org.dxworks.sasframe.construct.Construct;
import org.dxworks.sasframe.construct.ConstructKind;
import org.dxworks.sasframe.construct.ConstructTree;
import org.dxworks.sasframe.rules.Confidence;
import org.dxworks.sasframe.rules.MappingRegistry;
import org.dxworks.sasframe.rules.MappingRule;
import org.dxworks.sasframe.rules.OperationTemplate;
import org.dxworks.sasframe.rules.RuleContext;
import org.dxworks.sasframe.rules.Templates;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps each construct to target operations with the first matching mapping rule.
 * <p>
 * Every construct except the synthetic root gets exactly one entry; constructs no rule matches get an
 * empty, unsupported entry so coverage can be computed over the whole file. Risk flags are never
 * consulted.
 */
public class BlueprintGenerator {

    public List<BlueprintEntry> generate(ConstructTree tree, MappingRegistry registry) {
        List<BlueprintEntry> entries = new ArrayList<>();
        for (Construct construct : tree.preOrder()) {
            if (construct.kind == ConstructKind.PROGRAM) {
                continue;
            }
            entries.add(entryFor(construct, registry));
        }
        return entries;
    }

    BlueprintEntry entryFor(Construct construct, MappingRegistry registry) {
        RuleContext context = RuleContext.isolated(construct);
        for (MappingRule rule : registry.getRules()) {
            if (rule.matches(context)) {
                List<TargetOperation> operations = new ArrayList<>();
                for (OperationTemplate template : rule.operations) {
                    operations.add(new TargetOperation(template.op, render(template.parameters, construct)));
                }
                return new BlueprintEntry(construct.id, construct.kind, rule.ruleId, rule.confidence(), operations,
                        Templates.render(rule.note, construct));
            }
        }
        return new BlueprintEntry(construct.id, construct.kind, null, Confidence.UNSUPPORTED, List.of(),
                "No automated mapping for " + construct.kind + "; translate manually");
    }

    // "{attr}" alone keeps the attribute's own type (lists stay lists); anything else is interpolated text.
    private static Map<String, Object> render(Map<String, String> templates, Construct construct) {
        Map<String, Object> parameters = new LinkedHashMap<>();
        for (Map.Entry<String, String> entry : templates.entrySet()) {
            String placeholder = Templates.solePlaceholder(entry.getValue());
            Object value = placeholder != null
                    ? Templates.valueOf(placeholder, construct)
                    : Templates.render(entry.getValue(), construct);
            if (value != null) {
                parameters.put(entry.getKey(), value);
            }
        }
        return parameters;
    }
}
