package com.arbor.hierarchy.infrastructure.occupancy;

import com.arbor.hierarchy.domain.ports.OccupantRegistry;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Occupant registry held in process memory, for local runs and tests.
 */
public class InMemoryOccupantRegistry implements OccupantRegistry {

    private final Map<String, Occupant> occupants = new ConcurrentHashMap<>();

    /**
     * Places an occupant on a node.
     *
     * @param nodeIdPath the node's id chain at placement time, root first
     */
    public void place(String occupantId, String tenantId, List<String> nodeIdPath) {
        if (nodeIdPath.isEmpty()) {
            throw new IllegalArgumentException("nodeIdPath must not be empty");
        }
        occupants.put(occupantId, new Occupant(tenantId, List.copyOf(nodeIdPath), true));
    }

    public void deactivate(String occupantId) {
        occupants.computeIfPresent(occupantId, (id, occupant) -> new Occupant(occupant.tenantId(), occupant.nodeIdPath(), false));
    }

    @Override
    public boolean hasActiveOccupants(String tenantId, String nodeId) {
        return occupants.values().stream()
                .anyMatch(occupant -> occupant.active()
                        && occupant.tenantId().equals(tenantId)
                        && occupant.nodeIdPath().contains(nodeId));
    }

    @Override
    public long countActiveOccupants(String tenantId) {
        return occupants.values().stream()
                .filter(occupant -> occupant.active() && occupant.tenantId().equals(tenantId))
                .count();
    }

    private record Occupant(String tenantId, List<String> nodeIdPath, boolean active) {}
}
