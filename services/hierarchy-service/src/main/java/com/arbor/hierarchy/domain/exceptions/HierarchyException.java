package com.arbor.hierarchy.domain.exceptions;

/**
 * Base of the caller-visible failures of a hierarchy operation.
 * Each one ends the request and maps to an error response.
 */
public abstract class HierarchyException extends RuntimeException {

    private final String nodeId;

    protected HierarchyException(String message, String nodeId) {
        super(message);
        this.nodeId = nodeId;
    }

    protected HierarchyException(String message, String nodeId, Throwable cause) {
        super(message, cause);
        this.nodeId = nodeId;
    }

    /** The node the operation was about, if any. */
    public String nodeId() {
        return nodeId;
    }
}
