package com.arbor.hierarchy.api.dto;

/**
 * Body of {@code POST /api/v1/nodes/{id}/move}. A null {@code parentId} asks for the node to become
 * a root.
 */
public record MoveNodeRequest(String parentId) {}
