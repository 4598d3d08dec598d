package com.arbor.hierarchy.domain.exceptions;

/**
 * The requested change would break the shape of the tree: a cycle, a node parented to itself,
 * or an additional root in a single-root tenant.
 */
public class StructuralConflictException extends HierarchyException {

    public StructuralConflictException(String message, String nodeId) {
        super(message, nodeId);
    }

    public static StructuralConflictException cycle(String nodeId, String candidateParentId) {
        return new StructuralConflictException(
                "Moving node %s under %s would create a cycle".formatted(nodeId, candidateParentId), nodeId);
    }

    public static StructuralConflictException selfParent(String nodeId) {
        return new StructuralConflictException("Node %s cannot be its own parent".formatted(nodeId), nodeId);
    }

    /**
     * @param nodeId the node that would become the additional root, null on creation
     */
    public static StructuralConflictException secondRoot(String tenantId, String nodeId) {
        return new StructuralConflictException(
                "Tenant %s already has a root; multiple roots per tenant are not enabled".formatted(tenantId),
                nodeId);
    }
}
