package org.dxworks.sasframe.rules;

/**
 * Predicate kinds a registry rule can name. Contextual predicates look beyond the construct itself
 * (ancestors, siblings, earlier steps) and therefore need the whole tree.
 */
public enum PredicateKind {
    MATCH(false),
    MERGE_WITHOUT_BY(true),
    MERGE_UNSORTED_INPUTS(true),
    RECURSIVE_MACRO(true),
    MACRO_NESTING_DEPTH(true),
    BLOCK_NESTING_DEPTH(true);

    private final boolean contextual;

    PredicateKind(boolean contextual) {
        this.contextual = contextual;
    }

    public boolean isContextual() {
        return contextual;
    }
}
