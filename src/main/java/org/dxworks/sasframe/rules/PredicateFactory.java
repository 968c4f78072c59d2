package org.dxworks.sasframe.rules;

import org.dxworks.sasframe.construct.Construct;
import org.dxworks.sasframe.construct.ConstructKind;
import org.dxworks.sasframe.error.RegistryLoadException;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Builds {@link ConstructPredicate}s from a registry rule's predicate kind and parameters. Parameters are
 * validated here, once, so evaluation never meets a malformed rule.
 */
public final class PredicateFactory {

    private static final Set<ConstructKind> MACRO_LEVEL = EnumSet.of(ConstructKind.MACRO_DEFINITION,
            ConstructKind.MACRO_IF, ConstructKind.MACRO_ELSE, ConstructKind.MACRO_DO_BLOCK,
            ConstructKind.MACRO_DO_LOOP);

    private PredicateFactory() {
        // utility class
    }

    public static ConstructPredicate create(String ruleId, PredicateKind kind, Map<String, Object> parameters) {
        return switch (kind) {
            case MATCH -> match(ruleId, parameters);
            case MERGE_WITHOUT_BY -> PredicateFactory::mergeWithoutBy;
            case MERGE_UNSORTED_INPUTS -> PredicateFactory::mergeUnsortedInputs;
            case RECURSIVE_MACRO -> PredicateFactory::recursiveMacro;
            case MACRO_NESTING_DEPTH -> macroNestingDepth(intParameter(ruleId, parameters, "maxDepth", 3));
            case BLOCK_NESTING_DEPTH -> blockNestingDepth(intParameter(ruleId, parameters, "maxDepth", 4));
        };
    }

    // ---- MATCH ----

    private static ConstructPredicate match(String ruleId, Map<String, Object> parameters) {
        Set<ConstructKind> kinds = kinds(ruleId, parameters.get("kinds"));
        Map<String, String> equalities = stringMap(ruleId, parameters, "attributes");
        Map<String, Integer> minimums = new LinkedHashMap<>();
        for (Map.Entry<String, String> entry : stringMap(ruleId, parameters, "minimums").entrySet()) {
            minimums.put(entry.getKey(), parseInt(ruleId, "minimums." + entry.getKey(), entry.getValue()));
        }
        List<String> present = stringList(ruleId, parameters, "present");
        if (kinds.isEmpty() && equalities.isEmpty() && minimums.isEmpty() && present.isEmpty()) {
            throw new RegistryLoadException("rule " + ruleId + ": MATCH needs at least one of kinds, attributes, "
                    + "minimums or present");
        }

        return context -> {
            Construct construct = context.construct();
            if (!kinds.isEmpty() && !kinds.contains(construct.kind)) {
                return false;
            }
            for (Map.Entry<String, String> entry : equalities.entrySet()) {
                Object value = construct.attribute(entry.getKey());
                if (value == null || !String.valueOf(value).equalsIgnoreCase(entry.getValue())) {
                    return false;
                }
            }
            for (Map.Entry<String, Integer> entry : minimums.entrySet()) {
                if (construct.intAttribute(entry.getKey(), Integer.MIN_VALUE) < entry.getValue()) {
                    return false;
                }
            }
            for (String key : present) {
                if (!isPresent(construct.attribute(key))) {
                    return false;
                }
            }
            return true;
        };
    }

    private static boolean isPresent(Object value) {
        if (value == null || Boolean.FALSE.equals(value)) {
            return false;
        }
        if (value instanceof List) {
            return !((List<?>) value).isEmpty();
        }
        return !(value instanceof String) || !((String) value).isEmpty();
    }

    // ---- contextual predicates ----

    // A MERGE with no BY statement next to it in the same step matches rows by position.
    private static boolean mergeWithoutBy(RuleContext context) {
        Construct construct = context.construct();
        if (construct.kind != ConstructKind.MERGE_STATEMENT) {
            return false;
        }
        return !hasSibling(context, ConstructKind.BY_STATEMENT);
    }

    // A BY-merge with an input that no earlier PROC SORT ordered by the merge's BY keys. The merge keys must
    // be a prefix of the sort keys; the latest sort producing a dataset wins.
    private static boolean mergeUnsortedInputs(RuleContext context) {
        Construct construct = context.construct();
        if (construct.kind != ConstructKind.MERGE_STATEMENT) {
            return false;
        }
        Construct by = sibling(context, ConstructKind.BY_STATEMENT);
        List<String> inputs = construct.listAttribute("inputDatasets");
        if (by == null || inputs.isEmpty()) {
            return false;
        }
        List<String> mergeKeys = by.listAttribute("byVariables");
        Map<String, List<String>> sortKeys = new HashMap<>();
        for (Construct earlier : context.tree().preOrder()) {
            if (earlier.id >= construct.id) {
                break;
            }
            if (earlier.kind == ConstructKind.PROC_STEP && "SORT".equals(earlier.stringAttribute("procName"))) {
                List<String> keys = procByVariables(earlier);
                List<String> outputs = earlier.listAttribute("outputDatasets");
                for (String dataset : outputs.isEmpty() ? earlier.listAttribute("inputDatasets") : outputs) {
                    sortKeys.put(dataset, keys);
                }
            }
        }
        for (String input : inputs) {
            List<String> keys = sortKeys.get(input);
            if (keys == null || keys.size() < mergeKeys.size()
                    || !keys.subList(0, mergeKeys.size()).equals(mergeKeys)) {
                return true;
            }
        }
        return false;
    }

    private static List<String> procByVariables(Construct procStep) {
        for (Construct child : procStep.children) {
            if (child.kind == ConstructKind.PROC_STATEMENT && "BY".equals(child.stringAttribute("keyword"))) {
                return child.listAttribute("byVariables");
            }
        }
        return List.of();
    }

    private static Construct sibling(RuleContext context, ConstructKind kind) {
        Construct parent = context.parent();
        if (parent == null) {
            return null;
        }
        for (Construct sibling : parent.children) {
            if (sibling.kind == kind) {
                return sibling;
            }
        }
        return null;
    }

    private static boolean hasSibling(RuleContext context, ConstructKind kind) {
        return sibling(context, kind) != null;
    }

    // An invocation of an enclosing definition, or of any definition the builder found recursive.
    private static boolean recursiveMacro(RuleContext context) {
        Construct construct = context.construct();
        if (construct.kind != ConstructKind.MACRO_INVOCATION) {
            return false;
        }
        String target = construct.stringAttribute("macroName");
        if (target == null) {
            return false;
        }
        for (Construct ancestor : context.ancestors()) {
            if (ancestor.kind == ConstructKind.MACRO_DEFINITION
                    && target.equals(ancestor.stringAttribute("macroName"))) {
                return true;
            }
        }
        for (Construct candidate : context.tree().preOrder()) {
            if (candidate.kind == ConstructKind.MACRO_DEFINITION
                    && target.equals(candidate.stringAttribute("macroName"))
                    && candidate.booleanAttribute("recursive")) {
                return true;
            }
        }
        return false;
    }

    private static ConstructPredicate macroNestingDepth(int maxDepth) {
        return context -> {
            if (context.construct().kind != ConstructKind.MACRO_INVOCATION) {
                return false;
            }
            int depth = 0;
            for (Construct ancestor : context.ancestors()) {
                if (MACRO_LEVEL.contains(ancestor.kind)) {
                    depth++;
                }
            }
            return depth >= maxDepth;
        };
    }

    // Matches blocks whose own scope sits deeper than maxDepth.
    private static ConstructPredicate blockNestingDepth(int maxDepth) {
        return context -> {
            Construct construct = context.construct();
            if (!construct.block || construct.kind == ConstructKind.PROGRAM) {
                return false;
            }
            int depth = 1;
            for (Construct ancestor : context.ancestors()) {
                if (ancestor.block && ancestor.kind != ConstructKind.PROGRAM) {
                    depth++;
                }
            }
            return depth > maxDepth;
        };
    }

    // ---- parameter parsing ----

    private static Set<ConstructKind> kinds(String ruleId, Object value) {
        Set<ConstructKind> kinds = EnumSet.noneOf(ConstructKind.class);
        if (value == null) {
            return kinds;
        }
        List<?> names = value instanceof List ? (List<?>) value : List.of(value);
        for (Object name : names) {
            try {
                kinds.add(ConstructKind.valueOf(String.valueOf(name).trim().toUpperCase(Locale.ROOT)));
            } catch (IllegalArgumentException e) {
                throw new RegistryLoadException("rule " + ruleId + ": unknown construct kind '" + name + "'", e);
            }
        }
        return kinds;
    }

    private static Map<String, String> stringMap(String ruleId, Map<String, Object> parameters, String key) {
        Object value = parameters.get(key);
        Map<String, String> result = new LinkedHashMap<>();
        if (value == null) {
            return result;
        }
        if (!(value instanceof Map)) {
            throw new RegistryLoadException("rule " + ruleId + ": '" + key + "' must be a mapping");
        }
        for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
            result.put(String.valueOf(entry.getKey()), String.valueOf(entry.getValue()));
        }
        return result;
    }

    private static List<String> stringList(String ruleId, Map<String, Object> parameters, String key) {
        Object value = parameters.get(key);
        List<String> result = new ArrayList<>();
        if (value == null) {
            return result;
        }
        if (!(value instanceof List)) {
            throw new RegistryLoadException("rule " + ruleId + ": '" + key + "' must be a list");
        }
        for (Object item : (List<?>) value) {
            result.add(String.valueOf(item));
        }
        return result;
    }

    private static int intParameter(String ruleId, Map<String, Object> parameters, String key, int defaultValue) {
        Object value = parameters.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        return parseInt(ruleId, key, String.valueOf(value));
    }

    private static int parseInt(String ruleId, String key, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new RegistryLoadException("rule " + ruleId + ": '" + key + "' must be an integer, got '"
                    + value + "'", e);
        }
    }
}
