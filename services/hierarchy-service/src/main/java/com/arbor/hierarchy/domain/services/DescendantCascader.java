package com.arbor.hierarchy.domain.services;

import com.arbor.hierarchy.domain.model.DerivedPosition;
import com.arbor.hierarchy.domain.model.Node;
import com.arbor.hierarchy.domain.ports.NodeStore;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Propagates a committed change of a node's ancestry to all of its active descendants.
 * <p>
 * Breadth-first from the changed node: a child is only derived once its parent's updated snapshot
 * is in hand, so a single pass suffices. A descendant whose derived values already match what is
 * stored is not rewritten, which makes a re-run on a consistent subtree a no-op and lets the same
 * walk serve as the repair pass after an interrupted cascade.
 * <p>
 * Must run while the caller holds the tenant's mutation lease.
 */
public final class DescendantCascader {

    private static final Logger log = LoggerFactory.getLogger(DescendantCascader.class);

    private final NodeStore store;
    private final PathDeriver deriver;
    private final Clock clock;

    public DescendantCascader(NodeStore store, PathDeriver deriver, Clock clock) {
        this.store = store;
        this.deriver = deriver;
        this.clock = clock;
    }

    /**
     * @param rootOfChange the already persisted node whose ancestry changed
     * @param actor        recorded as {@code updatedBy} on every rewritten descendant
     * @return the rewritten descendants in write order
     */
    public List<Node> cascade(Node rootOfChange, String actor) {
        List<Node> rewritten = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        Deque<Node> queue = new ArrayDeque<>();
        visited.add(rootOfChange.id());
        queue.add(rootOfChange);
        Instant now = clock.instant();

        while (!queue.isEmpty()) {
            Node parent = queue.poll();
            for (Node child : store.findActiveChildren(parent.tenantId(), parent.id())) {
                if (!visited.add(child.id())) {
                    log.warn("Node {} reached twice while cascading from {}; skipping", child.id(), rootOfChange.id());
                    continue;
                }
                DerivedPosition position = deriver.derive(child.id(), child.name(), parent);
                Node next = child;
                if (!child.hasPosition(position)) {
                    next = child.withPosition(child.parentId(), position, actor, now);
                    store.update(next);
                    rewritten.add(next);
                }
                queue.add(next);
            }
        }

        log.debug("Cascade from node {} rewrote {} descendants", rootOfChange.id(), rewritten.size());
        return rewritten;
    }
}
