package com.arbor.hierarchy.domain.services;

import com.arbor.hierarchy.domain.exceptions.DependencyConflictException;
import com.arbor.hierarchy.domain.exceptions.HierarchyException;
import com.arbor.hierarchy.domain.exceptions.NodeNotFoundException;
import com.arbor.hierarchy.domain.exceptions.StructuralConflictException;
import com.arbor.hierarchy.domain.model.ConsistencyReport;
import com.arbor.hierarchy.domain.model.CreateNodeCommand;
import com.arbor.hierarchy.domain.model.DerivedPosition;
import com.arbor.hierarchy.domain.model.HierarchyStats;
import com.arbor.hierarchy.domain.model.Node;
import com.arbor.hierarchy.domain.model.NodeFilter;
import com.arbor.hierarchy.domain.model.NodeKind;
import com.arbor.hierarchy.domain.ports.NodeIdGenerator;
import com.arbor.hierarchy.domain.ports.NodeStore;
import com.arbor.hierarchy.domain.ports.OccupantRegistry;
import com.arbor.hierarchy.domain.ports.TenantLease;
import com.arbor.hierarchy.domain.ports.TenantMutationLock;
import com.arbor.security.TenantIsolationEnforcer;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Facade over the hierarchy of every tenant.
 * <p>
 * Every operation is scoped to the caller's tenant. A node of another tenant is reported as not
 * found, exactly like a node that never existed, so ids cannot be probed across tenants.
 * <p>
 * Structural mutations run while holding the tenant's {@link TenantMutationLock} lease: the cycle
 * check, the node's own write and the full descendant cascade of one mutation never interleave with
 * another mutation of the same tenant. All validation happens before the first write. Reads take no
 * lease and may observe a subtree mid-cascade.
 */
public class HierarchyEngine {

    private static final Logger log = LoggerFactory.getLogger(HierarchyEngine.class);

    /** Longest node name the stores accept. */
    public static final int MAX_NAME_LENGTH = 255;

    private final NodeStore store;
    private final OccupantRegistry occupants;
    private final TenantMutationLock lock;
    private final HierarchyPolicy policy;
    private final NodeIdGenerator idGenerator;
    private final Clock clock;
    private final HierarchyTelemetry telemetry;
    private final PathDeriver deriver;
    private final CycleGuard cycleGuard;
    private final DescendantCascader cascader;
    private final HierarchyConsistencyChecker checker;

    public HierarchyEngine(
            NodeStore store,
            OccupantRegistry occupants,
            TenantMutationLock lock,
            HierarchyPolicy policy,
            NodeIdGenerator idGenerator,
            Clock clock,
            HierarchyTelemetry telemetry) {
        this.store = Objects.requireNonNull(store, "store");
        this.occupants = Objects.requireNonNull(occupants, "occupants");
        this.lock = Objects.requireNonNull(lock, "lock");
        this.policy = Objects.requireNonNull(policy, "policy");
        this.idGenerator = Objects.requireNonNull(idGenerator, "idGenerator");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.telemetry = Objects.requireNonNull(telemetry, "telemetry");
        this.deriver = new PathDeriver(policy.separator());
        this.cycleGuard = new CycleGuard(store);
        this.cascader = new DescendantCascader(store, deriver, clock);
        this.checker = new HierarchyConsistencyChecker(store, deriver);
    }

    // ---- Structural mutations ----

    /**
     * Creates a node.
     * <ul>
     *   <li>With a parent: the parent must be active in the command's tenant, which is required.</li>
     *   <li>Without parent and tenant: a new tenant is established and the node's id becomes its
     *       tenant id.</li>
     *   <li>Without parent but with a tenant: an additional root, only under a multi-root policy.</li>
     * </ul>
     */
    public Node create(CreateNodeCommand command, String actor) {
        Objects.requireNonNull(command, "command");
        requireActor(actor);
        validateName(command.name());
        if (command.kind() == null) {
            throw new IllegalArgumentException("kind is required");
        }
        if (command.parentId() != null && isBlank(command.tenantId())) {
            throw new IllegalArgumentException("A tenant id is required to create a child node");
        }

        if (command.parentId() == null && command.tenantId() == null) {
            String id = idGenerator.nextId();
            return guarded("create", id, () -> telemetry.trace("create", id, id, () -> {
                Node root = Node.create(id, id, command.name(), command.kind(), null,
                        deriver.derive(id, command.name(), null), command.metadata(), actor, clock.instant());
                store.insert(root);
                telemetry.recordMutation("create", id);
                log.info("Established tenant {} with root '{}'", id, root.name());
                return root;
            }));
        }

        String tenantId = requireTenant(command.tenantId());
        return guarded("create", tenantId, () -> telemetry.trace("create", tenantId, command.parentId(), () -> {
            try (TenantLease ignored = lock.acquire(tenantId)) {
                Node parent = null;
                if (command.parentId() != null) {
                    parent = requireActive(tenantId, command.parentId(), "Parent");
                } else {
                    if (store.findActiveRoots(tenantId).isEmpty()) {
                        throw NodeNotFoundException.tenant(tenantId);
                    }
                    if (!policy.allowMultipleRoots()) {
                        throw StructuralConflictException.secondRoot(tenantId, null);
                    }
                }
                String id = idGenerator.nextId();
                Node node = Node.create(id, tenantId, command.name(), command.kind(), command.parentId(),
                        deriver.derive(id, command.name(), parent), command.metadata(), actor, clock.instant());
                store.insert(node);
                telemetry.recordMutation("create", tenantId);
                log.info("Created node {} at '{}' in tenant {}", id, node.path(), tenantId);
                return node;
            }
        }));
    }

    /**
     * Renames a node and corrects the path of every active descendant. Levels and ancestor chains
     * do not change. Renaming to the current name changes nothing.
     */
    public Node rename(String tenantId, String id, String newName, String actor) {
        requireTenant(tenantId);
        requireActor(actor);
        validateName(newName);
        return guarded("rename", tenantId, () -> telemetry.trace("rename", tenantId, id, () -> {
            try (TenantLease ignored = lock.acquire(tenantId)) {
                Node node = requireActive(tenantId, id, "Node");
                if (node.name().equals(newName)) {
                    return node;
                }
                DerivedPosition position = deriver.derive(id, newName, parentSnapshot(node));
                Node renamed = node.withName(newName, position, actor, clock.instant());
                store.update(renamed);
                List<Node> cascaded = cascader.cascade(renamed, actor);
                telemetry.recordMutation("rename", tenantId);
                telemetry.recordCascade("rename", tenantId, cascaded.size());
                log.info("Renamed node {} from '{}' to '{}', {} descendants rewritten",
                        id, node.name(), newName, cascaded.size());
                return renamed;
            }
        }));
    }

    /**
     * Re-parents a node and cascades the new ancestry to its active descendants. A null
     * {@code newParentId} turns the node into a root, which only a multi-root policy permits.
     * Moving a node under its current parent changes nothing.
     */
    public Node move(String tenantId, String id, String newParentId, String actor) {
        requireTenant(tenantId);
        requireActor(actor);
        return guarded("move", tenantId, () -> telemetry.trace("move", tenantId, id, () -> {
            if (newParentId != null && newParentId.equals(id)) {
                throw StructuralConflictException.selfParent(id);
            }
            try (TenantLease ignored = lock.acquire(tenantId)) {
                Node node = requireActive(tenantId, id, "Node");
                Node newParent = null;
                if (newParentId == null) {
                    if (node.isRoot()) {
                        return node;
                    }
                    if (!policy.allowMultipleRoots()) {
                        throw StructuralConflictException.secondRoot(tenantId, id);
                    }
                } else {
                    newParent = requireActive(tenantId, newParentId, "Parent");
                    if (newParentId.equals(node.parentId())) {
                        return node;
                    }
                    if (cycleGuard.wouldCycle(tenantId, newParentId, id)) {
                        throw StructuralConflictException.cycle(id, newParentId);
                    }
                }

                DerivedPosition position = deriver.derive(id, node.name(), newParent);
                Node moved = node.withPosition(newParentId, position, actor, clock.instant());
                store.update(moved);
                List<Node> cascaded = cascader.cascade(moved, actor);
                telemetry.recordMutation("move", tenantId);
                telemetry.recordCascade("move", tenantId, cascaded.size());
                log.info("Moved node {} from parent {} to {}, now at '{}', {} descendants rewritten",
                        id, node.parentId(), newParentId, moved.path(), cascaded.size());
                return moved;
            }
        }));
    }

    /**
     * Retires a node. Refused while the node has active children or active occupants. The record
     * is kept for audit.
     */
    public void delete(String tenantId, String id, String actor) {
        requireTenant(tenantId);
        requireActor(actor);
        guarded("delete", tenantId, () -> telemetry.trace("delete", tenantId, id, () -> {
            try (TenantLease ignored = lock.acquire(tenantId)) {
                Node node = requireActive(tenantId, id, "Node");
                long children = store.countActiveChildren(tenantId, id);
                if (children > 0) {
                    throw DependencyConflictException.activeChildren(id, children);
                }
                if (occupants.hasActiveOccupants(tenantId, id)) {
                    throw DependencyConflictException.activeOccupants(id);
                }
                store.update(node.retire(actor, clock.instant()));
                telemetry.recordMutation("delete", tenantId);
                log.info("Retired node {} ('{}') in tenant {}", id, node.path(), tenantId);
                return null;
            }
        }));
    }

    /**
     * Re-derives a node against its current parent and re-walks its subtree, rewriting only what
     * is stale. Safe to repeat; on a consistent subtree it returns an empty list.
     *
     * @return the rewritten nodes, the node itself first when it was stale
     */
    public List<Node> repair(String tenantId, String id, String actor) {
        requireTenant(tenantId);
        requireActor(actor);
        return guarded("repair", tenantId, () -> telemetry.trace("repair", tenantId, id, () -> {
            try (TenantLease ignored = lock.acquire(tenantId)) {
                Node node = requireActive(tenantId, id, "Node");
                List<Node> rewritten = new ArrayList<>();
                DerivedPosition position = deriver.derive(id, node.name(), parentSnapshot(node));
                if (!node.hasPosition(position)) {
                    node = node.withPosition(node.parentId(), position, actor, clock.instant());
                    store.update(node);
                    rewritten.add(node);
                }
                rewritten.addAll(cascader.cascade(node, actor));
                telemetry.recordCascade("repair", tenantId, rewritten.size());
                if (rewritten.isEmpty()) {
                    log.debug("Subtree of node {} already consistent", id);
                } else {
                    log.info("Repaired {} stale nodes under node {}", rewritten.size(), id);
                }
                return List.copyOf(rewritten);
            }
        }));
    }

    // ---- Queries ----

    public Node findById(String tenantId, String id) {
        return requireActive(requireTenant(tenantId), id, "Node");
    }

    /** Active direct children, ordered by path. */
    public List<Node> findChildren(String tenantId, String id) {
        requireActive(requireTenant(tenantId), id, "Node");
        return store.findActiveChildren(tenantId, id);
    }

    /** Active ancestors root first, excluding the node itself, resolved in one batched lookup. */
    public List<Node> findAncestors(String tenantId, String id) {
        Node node = requireActive(requireTenant(tenantId), id, "Node");
        List<String> chain = node.ancestorIds().subList(0, node.ancestorIds().size() - 1);
        if (chain.isEmpty()) {
            return List.of();
        }
        return store.findActiveByIds(tenantId, chain).stream()
                .sorted(Comparator.comparingInt(ancestor -> chain.indexOf(ancestor.id())))
                .toList();
    }

    /** The whole active subtree under a node, excluding the node, shallowest first. */
    public List<Node> findDescendants(String tenantId, String id) {
        Node node = requireActive(requireTenant(tenantId), id, "Node");
        return store.findActiveSubtree(tenantId, node.ancestorIds());
    }

    /** Nodes whose path is {@code prefix} or lies under it. */
    public List<Node> findByPathPrefix(String tenantId, String prefix) {
        requireTenant(tenantId);
        if (isBlank(prefix)) {
            throw new IllegalArgumentException("prefix must not be blank");
        }
        return store.findActiveByPathPrefix(tenantId, prefix, policy.separator());
    }

    public List<Node> findAll(String tenantId, NodeFilter filter) {
        return store.findActive(requireTenant(tenantId), filter == null ? NodeFilter.all() : filter);
    }

    /** Active nodes no deeper than {@code maxDepth} (all when null), ordered by path. */
    public List<Node> findHierarchy(String tenantId, Integer maxDepth) {
        return store.findActive(requireTenant(tenantId), NodeFilter.upToLevel(maxDepth));
    }

    public HierarchyStats statistics(String tenantId) {
        List<Node> nodes = store.findActive(requireTenant(tenantId), NodeFilter.all());
        Map<NodeKind, List<Node>> grouped = nodes.stream()
                .collect(Collectors.groupingBy(Node::kind, () -> new EnumMap<>(NodeKind.class), Collectors.toList()));
        Map<NodeKind, HierarchyStats.KindStats> byKind = new EnumMap<>(NodeKind.class);
        grouped.forEach((kind, ofKind) -> byKind.put(kind, new HierarchyStats.KindStats(
                ofKind.size(),
                ofKind.stream().mapToInt(Node::level).average().orElse(0))));
        int maxLevel = nodes.stream().mapToInt(Node::level).max().orElse(-1);
        return new HierarchyStats(nodes.size(), occupants.countActiveOccupants(tenantId), maxLevel, byKind);
    }

    public ConsistencyReport verify(String tenantId) {
        ConsistencyReport report = checker.verify(requireTenant(tenantId));
        if (!report.consistent()) {
            log.warn("Tenant {} has {} ancestry violations", tenantId, report.violations().size());
        }
        return report;
    }

    // ---- Internals ----

    private Node requireActive(String tenantId, String id, String role) {
        if (isBlank(id)) {
            throw new IllegalArgumentException(role + " id must not be blank");
        }
        return TenantIsolationEnforcer.conceal(tenantId, store.findById(id), Node::tenantId)
                .filter(Node::isVisible)
                .orElseThrow(() -> new NodeNotFoundException(role, id));
    }

    private Node parentSnapshot(Node node) {
        if (node.isRoot()) {
            return null;
        }
        return store.findById(node.parentId())
                .orElseThrow(() -> new IllegalStateException(
                        "Parent %s of node %s is missing from the store".formatted(node.parentId(), node.id())));
    }

    private void validateName(String name) {
        if (isBlank(name)) {
            throw new IllegalArgumentException("name must not be blank");
        }
        if (name.length() > MAX_NAME_LENGTH) {
            throw new IllegalArgumentException("name must not exceed %d characters".formatted(MAX_NAME_LENGTH));
        }
        if (name.contains(policy.separator())) {
            throw new IllegalArgumentException(
                    "name must not contain the path separator '%s'".formatted(policy.separator()));
        }
    }

    private <T> T guarded(String operation, String tenantId, Supplier<T> work) {
        try {
            return work.get();
        } catch (HierarchyException e) {
            telemetry.recordRejection(operation, tenantId, e.getClass().getSimpleName());
            log.warn("Rejected {} in tenant {}: {}", operation, tenantId, e.getMessage());
            throw e;
        }
    }

    private static String requireTenant(String tenantId) {
        if (isBlank(tenantId)) {
            throw new IllegalArgumentException("tenantId must not be blank");
        }
        return tenantId;
    }

    private static void requireActor(String actor) {
        if (isBlank(actor)) {
            throw new IllegalArgumentException("actor must not be blank");
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
