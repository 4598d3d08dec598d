package com.arbor.hierarchy.infrastructure.occupancy;

import com.arbor.hierarchy.domain.ports.OccupantRegistry;
import com.arbor.hierarchy.infrastructure.persistence.IdChainEncoding;
import org.springframework.jdbc.core.JdbcTemplate;

/**
 * Read-only view of the {@code node_occupants} table maintained by the users module.
 */
public class JdbcOccupantRegistry implements OccupantRegistry {

    private final JdbcTemplate jdbc;

    public JdbcOccupantRegistry(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public boolean hasActiveOccupants(String tenantId, String nodeId) {
        Long count = jdbc.queryForObject("""
                SELECT COUNT(*) FROM node_occupants
                 WHERE tenant_id = ? AND active = TRUE AND node_id_path LIKE ? ESCAPE '\\'""",
                Long.class, tenantId, "%/" + IdChainEncoding.escapeLike(nodeId) + "/%");
        return count != null && count > 0;
    }

    @Override
    public long countActiveOccupants(String tenantId) {
        Long count = jdbc.queryForObject(
                "SELECT COUNT(*) FROM node_occupants WHERE tenant_id = ? AND active = TRUE",
                Long.class, tenantId);
        return count == null ? 0 : count;
    }
}
