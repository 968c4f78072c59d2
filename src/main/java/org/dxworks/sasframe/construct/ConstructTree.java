package org.dxworks.sasframe.construct;

import java.util.ArrayList;
import java.util.List;

/**
 * Result of {@link ConstructBuilder#build}: the frozen tree plus the recovery events met while building.
 * Ids are pre-order positions, so {@code byId(id)} is a list lookup.
 */
public class ConstructTree {

    private final Construct root;
    private final List<RecoveryEvent> recoveryEvents;
    private final int tokenCount;
    private final List<Construct> preOrder;
    private final int[] parentIds;

    public ConstructTree(Construct root, List<RecoveryEvent> recoveryEvents, int tokenCount) {
        this.root = root;
        this.recoveryEvents = List.copyOf(recoveryEvents);
        this.tokenCount = tokenCount;
        this.preOrder = List.copyOf(ConstructWalker.preOrder(root));
        this.parentIds = new int[preOrder.size()];
        parentIds[root.id] = -1;
        for (int i = 0; i < preOrder.size(); i++) {
            Construct construct = preOrder.get(i);
            if (construct.id != i) {
                throw new IllegalStateException("construct ids must follow pre-order: " + construct);
            }
            for (Construct child : construct.children) {
                parentIds[child.id] = construct.id;
            }
        }
    }

    public Construct getRoot() {
        return root;
    }

    public List<RecoveryEvent> getRecoveryEvents() {
        return recoveryEvents;
    }

    public int getTokenCount() {
        return tokenCount;
    }

    public List<Construct> preOrder() {
        return preOrder;
    }

    public int size() {
        return preOrder.size();
    }

    public Construct byId(int id) {
        return preOrder.get(id);
    }

    public Construct parentOf(Construct construct) {
        int parentId = parentIds[construct.id];
        return parentId < 0 ? null : preOrder.get(parentId);
    }

    /** Ancestors nearest first, ending with the root. Empty for the root itself. */
    public List<Construct> ancestorsOf(Construct construct) {
        List<Construct> ancestors = new ArrayList<>();
        int parentId = parentIds[construct.id];
        while (parentId >= 0) {
            ancestors.add(preOrder.get(parentId));
            parentId = parentIds[parentId];
        }
        return ancestors;
    }
}
