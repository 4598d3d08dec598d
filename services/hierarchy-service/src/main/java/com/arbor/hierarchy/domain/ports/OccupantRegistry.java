package com.arbor.hierarchy.domain.ports;

/**
 * Boundary to the registry of records (users and the like) that are placed on hierarchy nodes.
 * The engine only asks questions; it never reads or writes occupant records.
 */
public interface OccupantRegistry {

    /**
     * True when an active occupant of the tenant references {@code nodeId} anywhere in its node
     * id path, i.e. sits on the node or underneath it.
     */
    boolean hasActiveOccupants(String tenantId, String nodeId);

    long countActiveOccupants(String tenantId);
}
