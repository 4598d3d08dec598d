package com.arbor.hierarchy.domain.model;

/**
 * Input of a node creation.
 *
 * @param name     display name
 * @param kind     semantic kind
 * @param parentId parent node id, or null to create a root
 * @param tenantId tenant of the caller; null when the request establishes a new tenant
 * @param metadata caller-defined attributes, may be null
 */
public record CreateNodeCommand(
        String name,
        NodeKind kind,
        String parentId,
        String tenantId,
        NodeMetadata metadata) {

    /** Creation of a root that establishes a new tenant. */
    public static CreateNodeCommand newTenant(String name, NodeKind kind) {
        return new CreateNodeCommand(name, kind, null, null, NodeMetadata.empty());
    }

    /** Creation of a child under {@code parentId} inside {@code tenantId}. */
    public static CreateNodeCommand child(String tenantId, String parentId, String name, NodeKind kind) {
        return new CreateNodeCommand(name, kind, parentId, tenantId, NodeMetadata.empty());
    }
}
