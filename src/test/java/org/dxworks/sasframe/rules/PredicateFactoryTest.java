package org.dxworks.sasframe.rules;

import org.dxworks.sasframe.construct.Construct;
import org.dxworks.sasframe.construct.ConstructKind;
import org.dxworks.sasframe.construct.ConstructTree;
import org.dxworks.sasframe.error.RegistryLoadException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.dxworks.sasframe.TestUtils.first;
import static org.dxworks.sasframe.TestUtils.tree;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PredicateFactoryTest {

    @Test
    void match_AttributeEqualityIgnoresCase() {
        ConstructTree tree = tree("proc sort data=a;\n  by id;\nrun;\n");
        ConstructPredicate predicate = PredicateFactory.create("sort", PredicateKind.MATCH,
                Map.of("kinds", List.of("PROC_STEP"), "attributes", Map.of("procName", "sort")));

        assertEquals(List.of(ConstructKind.PROC_STEP), matching(tree, predicate));
    }

    @Test
    void match_MinimumsAndPresence() {
        ConstructTree tree = tree("data a;\n  infile 'C:\\in.txt';\n  input @5 x @12 y;\nrun;\n");

        ConstructPredicate pointers = PredicateFactory.create("pointers", PredicateKind.MATCH,
                Map.of("minimums", Map.of("pointerControls", 2)));
        ConstructPredicate platform = PredicateFactory.create("platform", PredicateKind.MATCH,
                Map.of("present", List.of("platformConcerns")));

        assertEquals(List.of(ConstructKind.INPUT_STATEMENT), matching(tree, pointers));
        assertEquals(List.of(ConstructKind.INFILE_STATEMENT), matching(tree, platform));
    }

    @Test
    void mergeWithoutBy_OnlyWhenNoSiblingBy() {
        ConstructTree tree = tree("data m1;\n  merge a b;\nrun;\ndata m2;\n  merge a b;\n  by id;\nrun;\n");
        ConstructPredicate predicate = PredicateFactory.create("merge", PredicateKind.MERGE_WITHOUT_BY, Map.of());

        List<Construct> hits = new ArrayList<>();
        for (Construct construct : tree.preOrder()) {
            if (predicate.test(RuleContext.of(construct, tree))) {
                hits.add(construct);
            }
        }
        assertEquals(1, hits.size());
        assertEquals(2, hits.get(0).span.line);
    }

    @Test
    void blockNestingDepth_FlagsOnlyTheDeepestBlock() {
        ConstructTree tree = tree("data a;\n"
                + "  do i = 1 to 2;\n"
                + "    do j = 1 to 2;\n"
                + "      do k = 1 to 2;\n"
                + "        if x then do;\n"
                + "          y = 1;\n"
                + "        end;\n"
                + "      end;\n"
                + "    end;\n"
                + "  end;\n"
                + "run;\n");
        ConstructPredicate predicate = PredicateFactory.create("deep", PredicateKind.BLOCK_NESTING_DEPTH,
                Map.of("maxDepth", 4));

        assertEquals(List.of(ConstructKind.IF_THEN), matching(tree, predicate));
    }

    @Test
    void macroNestingDepth_CountsMacroLevelAncestors() {
        ConstructTree tree = tree("%macro outer;\n  %if &a %then %do;\n    %inner\n  %end;\n%mend;\n%inner\n");
        ConstructPredicate predicate = PredicateFactory.create("nested", PredicateKind.MACRO_NESTING_DEPTH,
                Map.of("maxDepth", 2));

        List<Construct> hits = new ArrayList<>();
        for (Construct construct : tree.preOrder()) {
            if (predicate.test(RuleContext.of(construct, tree))) {
                hits.add(construct);
            }
        }
        assertEquals(1, hits.size());
        assertEquals(3, hits.get(0).span.line);
    }

    @Test
    void contextualPredicate_NeedsTheTree() {
        ConstructTree tree = tree("data m;\n  merge a b;\nrun;\n");
        ConstructPredicate predicate = PredicateFactory.create("merge", PredicateKind.MERGE_WITHOUT_BY, Map.of());
        Construct merge = first(tree, ConstructKind.MERGE_STATEMENT);

        assertThrows(IllegalStateException.class, () -> predicate.test(RuleContext.isolated(merge)));
        assertTrue(predicate.test(RuleContext.of(merge, tree)));
    }

    @Test
    void maxDepth_MustBeAnInteger() {
        assertThrows(RegistryLoadException.class,
                () -> PredicateFactory.create("deep", PredicateKind.BLOCK_NESTING_DEPTH, Map.of("maxDepth", "deep")));
        assertFalse(PredicateKind.MATCH.isContextual());
    }

    private static List<ConstructKind> matching(ConstructTree tree, ConstructPredicate predicate) {
        List<ConstructKind> kinds = new ArrayList<>();
        for (Construct construct : tree.preOrder()) {
            if (predicate.test(RuleContext.isolated(construct))) {
                kinds.add(construct.kind);
            }
        }
        return kinds;
    }
}
