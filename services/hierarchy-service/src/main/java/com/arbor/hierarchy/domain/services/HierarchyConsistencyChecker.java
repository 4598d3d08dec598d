package com.arbor.hierarchy.domain.services;

import com.arbor.hierarchy.domain.model.ConsistencyReport;
import com.arbor.hierarchy.domain.model.Node;
import com.arbor.hierarchy.domain.model.NodeFilter;
import com.arbor.hierarchy.domain.ports.NodeStore;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Checks every active node of a tenant against the ancestry invariants and reports all violations
 * found, rather than stopping at the first.
 */
public final class HierarchyConsistencyChecker {

    private final NodeStore store;
    private final PathDeriver deriver;

    public HierarchyConsistencyChecker(NodeStore store, PathDeriver deriver) {
        this.store = store;
        this.deriver = deriver;
    }

    public ConsistencyReport verify(String tenantId) {
        List<Node> nodes = store.findActive(tenantId, NodeFilter.all());
        Map<String, Node> byId = new HashMap<>();
        nodes.forEach(node -> byId.put(node.id(), node));

        List<String> violations = new ArrayList<>();
        for (Node node : nodes) {
            check(node, tenantId, byId, violations);
        }
        return ConsistencyReport.of(nodes.size(), violations);
    }

    private void check(Node node, String tenantId, Map<String, Node> byId, List<String> violations) {
        List<String> chain = node.ancestorIds();
        String id = node.id();

        if (node.level() != chain.size() - 1) {
            violations.add("Node %s: level %d but %d ancestor ids".formatted(id, node.level(), chain.size()));
        }
        if (chain.isEmpty() || !chain.get(chain.size() - 1).equals(id)) {
            violations.add("Node %s: ancestor chain does not end with the node itself".formatted(id));
        }
        if (chain.size() > 1 && chain.subList(0, chain.size() - 1).contains(id)) {
            violations.add("Node %s: appears among its own ancestors".formatted(id));
        }

        boolean root = node.isRoot();
        if (root != (node.level() == 0) || root != node.path().equals(node.name())) {
            violations.add("Node %s: root flag, level %d and path '%s' disagree".formatted(id, node.level(), node.path()));
        }
        if (!root && (chain.size() < 2 || !chain.get(chain.size() - 2).equals(node.parentId()))) {
            violations.add("Node %s: parent %s is not the last ancestor".formatted(id, node.parentId()));
        }

        List<String> names = new ArrayList<>(chain.size());
        for (String ancestorId : chain) {
            Optional<Node> ancestor = Optional.ofNullable(byId.get(ancestorId)).or(() -> store.findById(ancestorId));
            if (ancestor.isEmpty()) {
                violations.add("Node %s: ancestor %s does not exist".formatted(id, ancestorId));
                return;
            }
            if (!tenantId.equals(ancestor.get().tenantId())) {
                violations.add("Node %s: ancestor %s belongs to another tenant".formatted(id, ancestorId));
                return;
            }
            names.add(ancestor.get().name());
        }
        String expected = deriver.join(names);
        if (!expected.equals(node.path())) {
            violations.add("Node %s: path '%s' but ancestors give '%s'".formatted(id, node.path(), expected));
        }
    }
}
