package com.arbor.hierarchy.domain.model;

import java.util.List;
import java.util.Objects;

/**
 * The derived ancestry of a node: materialized path, depth and root-to-self id chain.
 *
 * @param path        ancestor names joined by the separator, root first, self last
 * @param level       number of ancestors (root = 0)
 * @param ancestorIds ancestor ids root first, the node's own id last
 */
public record DerivedPosition(String path, int level, List<String> ancestorIds) {

    public DerivedPosition {
        Objects.requireNonNull(path, "path");
        ancestorIds = List.copyOf(ancestorIds);
        if (level != ancestorIds.size() - 1) {
            throw new IllegalArgumentException(
                    "level %d does not match an ancestor chain of %d ids".formatted(level, ancestorIds.size()));
        }
    }
}
