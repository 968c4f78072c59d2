package org.dxworks.sasframe.risk;

import org.dxworks.sasframe.construct.Construct;
import org.dxworks.sasframe.construct.ConstructKind;
import org.dxworks.sasframe.construct.ConstructTree;
import org.dxworks.sasframe.error.RuleEvaluationException;
import org.dxworks.sasframe.rules.RiskRule;
import org.dxworks.sasframe.rules.RiskRuleRegistry;
import org.dxworks.sasframe.rules.RuleContext;
import org.dxworks.sasframe.rules.Severity;
import org.dxworks.sasframe.rules.Templates;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Evaluates every risk rule against every construct exactly once. Constructs are visited in pre-order and
 * rules in registry order, so the flag sequence is a function of the tree and the registry alone.
 * <p>
 * A rule whose predicate throws is skipped for that construct and reported; the other rules still run.
 */
public class RiskClassifier {

    private static final Logger LOGGER = LoggerFactory.getLogger(RiskClassifier.class);
    private static final int MAX_QUOTED_TEXT = 80;

    public ClassificationResult classify(ConstructTree tree, RiskRuleRegistry registry) {
        List<RiskFlag> flags = new ArrayList<>();
        List<RuleEvaluationException> errors = new ArrayList<>();

        for (Construct construct : tree.preOrder()) {
            if (construct.kind == ConstructKind.UNKNOWN) {
                flags.add(unsupported(construct));
            }
            RuleContext context = RuleContext.of(construct, tree);
            for (RiskRule rule : registry.getRules()) {
                boolean matched;
                try {
                    matched = rule.matches(context);
                } catch (RuntimeException e) {
                    RuleEvaluationException error = new RuleEvaluationException(rule.ruleId, construct.id, e);
                    LOGGER.warn("Skipping rule {} on {}: {}", rule.ruleId, construct, e.toString());
                    errors.add(error);
                    continue;
                }
                if (matched) {
                    flags.add(new RiskFlag(rule.ruleId, rule.severity, construct.id, construct.span.line,
                            Templates.render(rule.rationale, construct)));
                }
            }
        }
        return new ClassificationResult(flags, errors);
    }

    private static RiskFlag unsupported(Construct construct) {
        String text = construct.text;
        if (text.length() > MAX_QUOTED_TEXT) {
            text = text.substring(0, MAX_QUOTED_TEXT) + "...";
        }
        return new RiskFlag(RiskRuleRegistry.UNSUPPORTED_CONSTRUCT_RULE_ID, Severity.INFO, construct.id,
                construct.span.line, "Unrecognised statement '" + text + "' has no known translation");
    }
}
