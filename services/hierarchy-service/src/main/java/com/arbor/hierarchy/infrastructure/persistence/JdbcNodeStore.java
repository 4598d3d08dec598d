package com.arbor.hierarchy.infrastructure.persistence;

import com.arbor.hierarchy.domain.model.Node;
import com.arbor.hierarchy.domain.model.NodeFilter;
import com.arbor.hierarchy.domain.model.NodeKind;
import com.arbor.hierarchy.domain.model.NodeStatus;
import com.arbor.hierarchy.domain.ports.NodeStore;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

/**
 * Node store over the {@code hierarchy_nodes} table.
 * <p>
 * Subtree and path-prefix lookups are single {@code LIKE} queries against the materialized
 * {@code ancestor_ids} and {@code path} columns; nothing here recurses. Each write is one statement,
 * so it is atomic on its own. {@link org.springframework.dao.DataAccessException}s propagate.
 */
public class JdbcNodeStore implements NodeStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcNodeStore.class);

    private static final String COLUMNS = """
            id, tenant_id, name, kind, parent_id, path, depth_level, ancestor_ids, metadata, status,
            created_by, updated_by, created_at, updated_at""";

    private static final String SELECT = "SELECT " + COLUMNS + " FROM hierarchy_nodes ";
    private static final String ACTIVE_IN_TENANT = "WHERE tenant_id = :tenantId AND status = 'ACTIVE' ";

    private static final RowMapper<Node> NODE_MAPPER = JdbcNodeStore::mapNode;

    private final NamedParameterJdbcTemplate jdbc;

    public JdbcNodeStore(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public Optional<Node> findById(String id) {
        return jdbc.query(SELECT + "WHERE id = :id", new MapSqlParameterSource("id", id), NODE_MAPPER)
                .stream()
                .findFirst();
    }

    @Override
    public List<Node> findActiveByIds(String tenantId, Collection<String> ids) {
        if (ids.isEmpty()) {
            return List.of();
        }
        return jdbc.query(SELECT + ACTIVE_IN_TENANT + "AND id IN (:ids)",
                tenant(tenantId).addValue("ids", ids), NODE_MAPPER);
    }

    @Override
    public List<Node> findActiveChildren(String tenantId, String parentId) {
        return jdbc.query(SELECT + ACTIVE_IN_TENANT + "AND parent_id = :parentId ORDER BY path, id",
                tenant(tenantId).addValue("parentId", parentId), NODE_MAPPER);
    }

    @Override
    public long countActiveChildren(String tenantId, String parentId) {
        Long count = jdbc.queryForObject(
                "SELECT COUNT(*) FROM hierarchy_nodes " + ACTIVE_IN_TENANT + "AND parent_id = :parentId",
                tenant(tenantId).addValue("parentId", parentId), Long.class);
        return count == null ? 0 : count;
    }

    @Override
    public List<Node> findActiveRoots(String tenantId) {
        return jdbc.query(SELECT + ACTIVE_IN_TENANT + "AND parent_id IS NULL ORDER BY path, id",
                tenant(tenantId), NODE_MAPPER);
    }

    @Override
    public List<Node> findActiveSubtree(String tenantId, List<String> ancestorIds) {
        String chain = IdChainEncoding.encode(ancestorIds);
        return jdbc.query(SELECT + ACTIVE_IN_TENANT
                        + "AND ancestor_ids LIKE :under ESCAPE '\\' AND ancestor_ids <> :chain "
                        + "ORDER BY depth_level, path, id",
                tenant(tenantId)
                        .addValue("under", IdChainEncoding.escapeLike(chain) + "%")
                        .addValue("chain", chain),
                NODE_MAPPER);
    }

    @Override
    public List<Node> findActiveByPathPrefix(String tenantId, String pathPrefix, String separator) {
        return jdbc.query(SELECT + ACTIVE_IN_TENANT
                        + "AND (path = :prefix OR path LIKE :under ESCAPE '\\') ORDER BY path, id",
                tenant(tenantId)
                        .addValue("prefix", pathPrefix)
                        .addValue("under", IdChainEncoding.escapeLike(pathPrefix + separator) + "%"),
                NODE_MAPPER);
    }

    @Override
    public List<Node> findActive(String tenantId, NodeFilter filter) {
        StringBuilder sql = new StringBuilder(SELECT).append(ACTIVE_IN_TENANT);
        MapSqlParameterSource params = tenant(tenantId);
        if (filter.kind() != null) {
            sql.append("AND kind = :kind ");
            params.addValue("kind", filter.kind().name());
        }
        if (filter.parentId() != null) {
            sql.append("AND parent_id = :parentId ");
            params.addValue("parentId", filter.parentId());
        }
        if (filter.level() != null) {
            sql.append("AND depth_level = :level ");
            params.addValue("level", filter.level());
        }
        if (filter.maxLevel() != null) {
            sql.append("AND depth_level <= :maxLevel ");
            params.addValue("maxLevel", filter.maxLevel());
        }
        if (filter.search() != null) {
            sql.append("AND LOWER(name) LIKE :search ESCAPE '\\' ");
            params.addValue("search", "%" + IdChainEncoding.escapeLike(filter.search().toLowerCase(Locale.ROOT)) + "%");
        }
        sql.append("ORDER BY path, id");
        return jdbc.query(sql.toString(), params, NODE_MAPPER);
    }

    @Override
    public void insert(Node node) {
        try {
            jdbc.update("INSERT INTO hierarchy_nodes (" + COLUMNS + ") VALUES ("
                    + ":id, :tenantId, :name, :kind, :parentId, :path, :level, :ancestorIds, :metadata, :status, "
                    + ":createdBy, :updatedBy, :createdAt, :updatedAt)", params(node));
        } catch (DuplicateKeyException e) {
            throw new IllegalStateException("Node already exists: " + node.id(), e);
        }
        log.debug("Inserted node {} in tenant {}", node.id(), node.tenantId());
    }

    @Override
    public void update(Node node) {
        int rows = jdbc.update("""
                UPDATE hierarchy_nodes
                   SET name = :name, kind = :kind, parent_id = :parentId, path = :path,
                       depth_level = :level, ancestor_ids = :ancestorIds, metadata = :metadata,
                       status = :status, updated_by = :updatedBy, updated_at = :updatedAt
                 WHERE id = :id AND tenant_id = :tenantId""", params(node));
        if (rows == 0) {
            throw new IllegalStateException("Node does not exist in tenant %s: %s".formatted(node.tenantId(), node.id()));
        }
    }

    private static MapSqlParameterSource tenant(String tenantId) {
        return new MapSqlParameterSource("tenantId", tenantId);
    }

    private static MapSqlParameterSource params(Node node) {
        return new MapSqlParameterSource()
                .addValue("id", node.id())
                .addValue("tenantId", node.tenantId())
                .addValue("name", node.name())
                .addValue("kind", node.kind().name())
                .addValue("parentId", node.parentId())
                .addValue("path", node.path())
                .addValue("level", node.level())
                .addValue("ancestorIds", IdChainEncoding.encode(node.ancestorIds()))
                .addValue("metadata", NodeMetadataCodec.toJson(node.metadata()))
                .addValue("status", node.status().name())
                .addValue("createdBy", node.createdBy())
                .addValue("updatedBy", node.updatedBy())
                .addValue("createdAt", toOffset(node.createdAt()))
                .addValue("updatedAt", toOffset(node.updatedAt()));
    }

    private static Node mapNode(ResultSet rs, int rowNum) throws SQLException {
        return new Node(
                rs.getString("id"),
                rs.getString("tenant_id"),
                rs.getString("name"),
                NodeKind.valueOf(rs.getString("kind")),
                rs.getString("parent_id"),
                rs.getString("path"),
                rs.getInt("depth_level"),
                IdChainEncoding.decode(rs.getString("ancestor_ids")),
                NodeMetadataCodec.fromJson(rs.getString("metadata")),
                NodeStatus.valueOf(rs.getString("status")),
                rs.getString("created_by"),
                rs.getString("updated_by"),
                toInstant(rs.getObject("created_at", OffsetDateTime.class)),
                toInstant(rs.getObject("updated_at", OffsetDateTime.class)));
    }

    private static OffsetDateTime toOffset(Instant instant) {
        return instant == null ? null : instant.atOffset(ZoneOffset.UTC);
    }

    private static Instant toInstant(OffsetDateTime value) {
        return value == null ? null : value.toInstant();
    }
}
