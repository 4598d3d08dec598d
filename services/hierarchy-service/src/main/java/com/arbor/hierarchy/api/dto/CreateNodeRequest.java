package com.arbor.hierarchy.api.dto;

import com.arbor.hierarchy.domain.model.NodeKind;
import com.arbor.hierarchy.domain.services.HierarchyEngine;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.util.Map;

/**
 * Body of {@code POST /api/v1/nodes}. Omitting {@code parentId} creates a root.
 */
public record CreateNodeRequest(
        @NotBlank @Size(max = HierarchyEngine.MAX_NAME_LENGTH) String name,
        @NotNull NodeKind kind,
        String parentId,
        Map<String, Object> metadata) {}
