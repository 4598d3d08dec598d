package com.arbor.hierarchy.infrastructure.persistence;

import com.arbor.hierarchy.domain.model.Node;
import com.arbor.hierarchy.domain.model.NodeFilter;
import com.arbor.hierarchy.domain.ports.NodeStore;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;
import java.util.stream.Stream;

/**
 * Node store held in process memory. Used for local runs and tests; contents are lost on restart.
 */
public class InMemoryNodeStore implements NodeStore {

    private static final Comparator<Node> BY_PATH = Comparator.comparing(Node::path).thenComparing(Node::id);

    private final Map<String, Node> nodes = new ConcurrentHashMap<>();

    @Override
    public Optional<Node> findById(String id) {
        return Optional.ofNullable(nodes.get(id));
    }

    @Override
    public List<Node> findActiveByIds(String tenantId, Collection<String> ids) {
        Set<String> wanted = new HashSet<>(ids);
        return active(tenantId).filter(node -> wanted.contains(node.id())).toList();
    }

    @Override
    public List<Node> findActiveChildren(String tenantId, String parentId) {
        return active(tenantId).filter(node -> parentId.equals(node.parentId())).sorted(BY_PATH).toList();
    }

    @Override
    public long countActiveChildren(String tenantId, String parentId) {
        return active(tenantId).filter(node -> parentId.equals(node.parentId())).count();
    }

    @Override
    public List<Node> findActiveRoots(String tenantId) {
        return active(tenantId).filter(Node::isRoot).sorted(BY_PATH).toList();
    }

    @Override
    public List<Node> findActiveSubtree(String tenantId, List<String> ancestorIds) {
        int depth = ancestorIds.size();
        return active(tenantId)
                .filter(node -> node.ancestorIds().size() > depth
                        && node.ancestorIds().subList(0, depth).equals(ancestorIds))
                .sorted(Comparator.comparingInt(Node::level).thenComparing(BY_PATH))
                .toList();
    }

    @Override
    public List<Node> findActiveByPathPrefix(String tenantId, String pathPrefix, String separator) {
        String under = pathPrefix + separator;
        return active(tenantId)
                .filter(node -> node.path().equals(pathPrefix) || node.path().startsWith(under))
                .sorted(BY_PATH)
                .toList();
    }

    @Override
    public List<Node> findActive(String tenantId, NodeFilter filter) {
        return active(tenantId).filter(matches(filter)).sorted(BY_PATH).toList();
    }

    @Override
    public void insert(Node node) {
        if (nodes.putIfAbsent(node.id(), node) != null) {
            throw new IllegalStateException("Node already exists: " + node.id());
        }
    }

    @Override
    public void update(Node node) {
        Node previous = nodes.computeIfPresent(node.id(),
                (id, existing) -> existing.tenantId().equals(node.tenantId()) ? node : existing);
        if (previous != node) {
            throw new IllegalStateException("Node does not exist in tenant %s: %s".formatted(node.tenantId(), node.id()));
        }
    }

    /** Number of stored records, any status. */
    public int size() {
        return nodes.size();
    }

    private Stream<Node> active(String tenantId) {
        return nodes.values().stream().filter(node -> node.tenantId().equals(tenantId) && node.isVisible());
    }

    private static Predicate<Node> matches(NodeFilter filter) {
        String search = filter.search() == null ? null : filter.search().toLowerCase(Locale.ROOT);
        return node -> (filter.kind() == null || node.kind() == filter.kind())
                && (filter.parentId() == null || filter.parentId().equals(node.parentId()))
                && (filter.level() == null || node.level() == filter.level())
                && (filter.maxLevel() == null || node.level() <= filter.maxLevel())
                && (search == null || node.name().toLowerCase(Locale.ROOT).contains(search));
    }
}
