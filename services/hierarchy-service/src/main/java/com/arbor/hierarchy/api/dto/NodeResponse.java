package com.arbor.hierarchy.api.dto;

import com.arbor.hierarchy.domain.model.Node;
import com.arbor.hierarchy.domain.model.NodeKind;
import com.arbor.hierarchy.domain.model.NodeStatus;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Wire form of a {@link Node}.
 */
public record NodeResponse(
        String id,
        String tenantId,
        String name,
        NodeKind kind,
        String parentId,
        String path,
        int level,
        List<String> ancestorIds,
        Map<String, Object> metadata,
        NodeStatus status,
        String createdBy,
        String updatedBy,
        Instant createdAt,
        Instant updatedAt) {

    public static NodeResponse from(Node node) {
        return new NodeResponse(
                node.id(),
                node.tenantId(),
                node.name(),
                node.kind(),
                node.parentId(),
                node.path(),
                node.level(),
                node.ancestorIds(),
                node.metadata().values(),
                node.status(),
                node.createdBy(),
                node.updatedBy(),
                node.createdAt(),
                node.updatedAt());
    }

    public static List<NodeResponse> fromAll(List<Node> nodes) {
        return nodes.stream().map(NodeResponse::from).toList();
    }
}
