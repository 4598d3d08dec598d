package com.arbor.hierarchy.domain.model;

/**
 * Lifecycle state of a node. Retired nodes are kept for audit but are invisible to every query
 * and traversal; {@link #isVisible()} is the single place that rule is decided.
 */
public enum NodeStatus {

    ACTIVE,

    RETIRED;

    public boolean isVisible() {
        return switch (this) {
            case ACTIVE -> true;
            case RETIRED -> false;
        };
    }
}
