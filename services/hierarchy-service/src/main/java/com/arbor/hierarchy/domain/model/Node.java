package com.arbor.hierarchy.domain.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * One organizational unit in a tenant's hierarchy.
 * <p>
 * Immutable. The parent is referenced by id only, never by object, so a cycle can only exist as
 * bad data (which the cycle guard prevents) and never as a reference loop in memory. Mutations
 * return a new instance; {@code path}, {@code level} and {@code ancestorIds} always change
 * together through a {@link DerivedPosition}.
 */
public record Node(
        String id,
        String tenantId,
        String name,
        NodeKind kind,
        String parentId,
        String path,
        int level,
        List<String> ancestorIds,
        NodeMetadata metadata,
        NodeStatus status,
        String createdBy,
        String updatedBy,
        Instant createdAt,
        Instant updatedAt
) {

    public Node {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(tenantId, "tenantId");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(status, "status");
        ancestorIds = List.copyOf(ancestorIds);
        metadata = metadata == null ? NodeMetadata.empty() : metadata;
    }

    /**
     * A freshly created, active node.
     */
    public static Node create(
            String id,
            String tenantId,
            String name,
            NodeKind kind,
            String parentId,
            DerivedPosition position,
            NodeMetadata metadata,
            String actor,
            Instant now) {
        return new Node(id, tenantId, name, kind, parentId,
                position.path(), position.level(), position.ancestorIds(),
                metadata, NodeStatus.ACTIVE, actor, actor, now, now);
    }

    public boolean isRoot() {
        return parentId == null;
    }

    public boolean isVisible() {
        return status.isVisible();
    }

    public DerivedPosition position() {
        return new DerivedPosition(path, level, ancestorIds);
    }

    public boolean hasPosition(DerivedPosition candidate) {
        return path.equals(candidate.path())
                && level == candidate.level()
                && ancestorIds.equals(candidate.ancestorIds());
    }

    public Node withName(String newName, DerivedPosition position, String actor, Instant now) {
        return new Node(id, tenantId, newName, kind, parentId,
                position.path(), position.level(), position.ancestorIds(),
                metadata, status, createdBy, actor, createdAt, now);
    }

    public Node withPosition(String newParentId, DerivedPosition position, String actor, Instant now) {
        return new Node(id, tenantId, name, kind, newParentId,
                position.path(), position.level(), position.ancestorIds(),
                metadata, status, createdBy, actor, createdAt, now);
    }

    public Node retire(String actor, Instant now) {
        return new Node(id, tenantId, name, kind, parentId, path, level, ancestorIds,
                metadata, NodeStatus.RETIRED, createdBy, actor, createdAt, now);
    }
}
