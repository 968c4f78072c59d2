package org.dxworks.sasframe.rules;

import java.util.List;

/**
 * Mapping rules in priority order: the first rule that matches a construct wins.
 */
public class MappingRegistry {

    private final List<MappingRule> rules;

    public MappingRegistry(List<MappingRule> rules) {
        this.rules = List.copyOf(rules);
    }

    public List<MappingRule> getRules() {
        return rules;
    }
}
