package org.dxworks.sasframe.rules;

@FunctionalInterface
public interface ConstructPredicate {

    boolean test(RuleContext context);
}
