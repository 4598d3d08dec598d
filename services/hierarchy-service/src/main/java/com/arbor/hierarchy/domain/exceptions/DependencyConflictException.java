package com.arbor.hierarchy.domain.exceptions;

/**
 * A delete was refused because something still depends on the node.
 */
public class DependencyConflictException extends HierarchyException {

    private final Dependency dependency;

    public DependencyConflictException(String message, String nodeId, Dependency dependency) {
        super(message, nodeId);
        this.dependency = dependency;
    }

    public static DependencyConflictException activeChildren(String nodeId, long childCount) {
        return new DependencyConflictException(
                "Cannot delete node %s: it has %d active children".formatted(nodeId, childCount),
                nodeId, Dependency.ACTIVE_CHILDREN);
    }

    public static DependencyConflictException activeOccupants(String nodeId) {
        return new DependencyConflictException(
                "Cannot delete node %s: it has active occupants".formatted(nodeId),
                nodeId, Dependency.ACTIVE_OCCUPANTS);
    }

    public Dependency dependency() {
        return dependency;
    }

    /** What blocked the delete. */
    public enum Dependency {
        ACTIVE_CHILDREN,
        ACTIVE_OCCUPANTS
    }
}
