package org.dxworks.sasframe.construct;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Worklist-based traversals. Macro-heavy sources can nest deeply, so nothing here recurses.
 */
public final class ConstructWalker {

    private ConstructWalker() {
        // utility class
    }

    /** Parent before children, children in source order. */
    public static List<Construct> preOrder(Construct root) {
        List<Construct> out = new ArrayList<>();
        Deque<Construct> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            Construct current = stack.pop();
            out.add(current);
            List<Construct> children = current.children;
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
        }
        return out;
    }

    /** Every construct appears after all of its descendants. */
    public static List<Construct> postOrder(Construct root) {
        List<Construct> preOrder = preOrder(root);
        List<Construct> out = new ArrayList<>(preOrder.size());
        for (int i = preOrder.size() - 1; i >= 0; i--) {
            out.add(preOrder.get(i));
        }
        return out;
    }
}
