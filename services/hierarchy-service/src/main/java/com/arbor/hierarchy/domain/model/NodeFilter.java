package com.arbor.hierarchy.domain.model;

/**
 * Optional criteria for listing the active nodes of a tenant. Null fields do not filter.
 *
 * @param kind     only nodes of this kind
 * @param parentId only direct children of this node
 * @param level    only nodes at exactly this depth
 * @param maxLevel only nodes at this depth or shallower
 * @param search   case-insensitive substring of the name
 */
public record NodeFilter(NodeKind kind, String parentId, Integer level, Integer maxLevel, String search) {

    private static final NodeFilter ALL = new NodeFilter(null, null, null, null, null);

    public NodeFilter {
        if (level != null && level < 0) {
            throw new IllegalArgumentException("level must not be negative");
        }
        if (maxLevel != null && maxLevel < 0) {
            throw new IllegalArgumentException("maxDepth must not be negative");
        }
        if (search != null && search.isBlank()) {
            search = null;
        }
    }

    public static NodeFilter all() {
        return ALL;
    }

    public static NodeFilter upToLevel(Integer maxLevel) {
        return new NodeFilter(null, null, null, maxLevel, null);
    }
}
