package org.dxworks.sasframe.rules;

import org.dxworks.sasframe.construct.Construct;
import org.dxworks.sasframe.construct.ConstructTree;

import java.util.List;

/**
 * The construct a rule is evaluated against, plus the tree it belongs to when the caller provides one.
 */
public class RuleContext {

    private final Construct construct;
    private final ConstructTree tree;

    private RuleContext(Construct construct, ConstructTree tree) {
        this.construct = construct;
        this.tree = tree;
    }

    public static RuleContext of(Construct construct, ConstructTree tree) {
        return new RuleContext(construct, tree);
    }

    /** Context for predicates that only look at the construct's own subtree. */
    public static RuleContext isolated(Construct construct) {
        return new RuleContext(construct, null);
    }

    public Construct construct() {
        return construct;
    }

    public ConstructTree tree() {
        if (tree == null) {
            throw new IllegalStateException("predicate needs the construct tree but was evaluated in isolation");
        }
        return tree;
    }

    /** Nearest ancestor first. */
    public List<Construct> ancestors() {
        return tree().ancestorsOf(construct);
    }

    public Construct parent() {
        return tree().parentOf(construct);
    }
}
