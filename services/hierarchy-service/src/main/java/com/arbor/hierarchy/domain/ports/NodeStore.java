package com.arbor.hierarchy.domain.ports;

import com.arbor.hierarchy.domain.model.Node;
import com.arbor.hierarchy.domain.model.NodeFilter;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Durable keyed storage of hierarchy nodes.
 * <p>
 * {@link #findById(String)} is the only lookup that sees every tenant and every status; the engine
 * applies tenant concealment and the visibility rule on top of it. Every other read is scoped to
 * one tenant and returns {@link com.arbor.hierarchy.domain.model.NodeStatus#ACTIVE ACTIVE} nodes
 * only. Single-record writes are atomic; there is no multi-record transaction.
 */
public interface NodeStore {

    Optional<Node> findById(String id);

    /** Active nodes of the tenant among {@code ids}, in no particular order. */
    List<Node> findActiveByIds(String tenantId, Collection<String> ids);

    /** Active direct children of {@code parentId}, ordered by path. */
    List<Node> findActiveChildren(String tenantId, String parentId);

    long countActiveChildren(String tenantId, String parentId);

    /** Active nodes without parent. */
    List<Node> findActiveRoots(String tenantId);

    /**
     * Active strict descendants of the node whose ancestor chain is {@code ancestorIds}, i.e. every
     * node whose own chain starts with it. Ordered by level, then path.
     */
    List<Node> findActiveSubtree(String tenantId, List<String> ancestorIds);

    /**
     * Active nodes whose path equals {@code pathPrefix} or starts with {@code pathPrefix + separator}.
     * Ordered by path.
     */
    List<Node> findActiveByPathPrefix(String tenantId, String pathPrefix, String separator);

    /** Active nodes matching {@code filter}, ordered by path. */
    List<Node> findActive(String tenantId, NodeFilter filter);

    /**
     * @throws IllegalStateException if a node with the same id already exists
     */
    void insert(Node node);

    /**
     * Replaces the stored state of an existing node.
     *
     * @throws IllegalStateException if the node does not exist in its tenant
     */
    void update(Node node);
}
