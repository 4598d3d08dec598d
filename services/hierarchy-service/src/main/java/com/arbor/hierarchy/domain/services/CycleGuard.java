package com.arbor.hierarchy.domain.services;

import com.arbor.hierarchy.domain.model.Node;
import com.arbor.hierarchy.domain.ports.NodeStore;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.Set;

/**
 * Detects moves that would make a node its own ancestor.
 * <p>
 * Walks the live child links breadth-first rather than trusting the stored ancestor chains, so the
 * answer stays correct even for a subtree left stale by an interrupted cascade.
 */
public final class CycleGuard {

    private final NodeStore store;

    public CycleGuard(NodeStore store) {
        this.store = store;
    }

    /**
     * True iff {@code candidateParentId} is {@code movingNodeId} itself or one of its active
     * descendants.
     */
    public boolean wouldCycle(String tenantId, String candidateParentId, String movingNodeId) {
        if (candidateParentId.equals(movingNodeId)) {
            return true;
        }
        Set<String> visited = new HashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        visited.add(movingNodeId);
        queue.add(movingNodeId);
        while (!queue.isEmpty()) {
            String current = queue.poll();
            for (Node child : store.findActiveChildren(tenantId, current)) {
                if (child.id().equals(candidateParentId)) {
                    return true;
                }
                // corrupt data may already loop; never revisit
                if (visited.add(child.id())) {
                    queue.add(child.id());
                }
            }
        }
        return false;
    }
}
