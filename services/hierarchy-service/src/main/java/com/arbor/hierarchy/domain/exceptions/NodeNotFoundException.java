package com.arbor.hierarchy.domain.exceptions;

/**
 * The node does not exist, is retired, or belongs to another tenant. The three cases are
 * deliberately indistinguishable.
 */
public class NodeNotFoundException extends HierarchyException {

    public NodeNotFoundException(String role, String nodeId) {
        super("%s not found: %s".formatted(role, nodeId), nodeId);
    }

    public static NodeNotFoundException tenant(String tenantId) {
        return new NodeNotFoundException("Tenant", tenantId);
    }
}
