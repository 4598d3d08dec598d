package com.arbor.hierarchy.domain.model;

import java.util.Map;

/**
 * Summary of a tenant's active hierarchy.
 *
 * @param totalNodes     number of active nodes
 * @param totalOccupants number of active occupants registered in the tenant
 * @param maxLevel       depth of the deepest active node, -1 for an empty tenant
 * @param byKind         per-kind breakdown, only kinds that occur
 */
public record HierarchyStats(long totalNodes, long totalOccupants, int maxLevel, Map<NodeKind, KindStats> byKind) {

    public HierarchyStats {
        byKind = Map.copyOf(byKind);
    }

    /**
     * @param count        active nodes of this kind
     * @param averageLevel mean depth of those nodes
     */
    public record KindStats(long count, double averageLevel) {}
}
