package com.arbor.hierarchy.domain.services;

import com.arbor.hierarchy.domain.model.DerivedPosition;
import com.arbor.hierarchy.domain.model.Node;
import java.util.ArrayList;
import java.util.List;

/**
 * Computes a node's materialized ancestry from its parent snapshot.
 * <p>
 * Pure and total: validation of names and parents happens before derivation.
 */
public final class PathDeriver {

    private final String separator;

    public PathDeriver(String separator) {
        if (separator == null || separator.isEmpty()) {
            throw new IllegalArgumentException("separator must not be empty");
        }
        this.separator = separator;
    }

    /**
     * @param id     the node's own id, appended to the ancestor chain
     * @param name   the node's name
     * @param parent the parent snapshot, or null for a root
     */
    public DerivedPosition derive(String id, String name, Node parent) {
        if (parent == null) {
            return new DerivedPosition(name, 0, List.of(id));
        }
        List<String> ancestorIds = new ArrayList<>(parent.ancestorIds().size() + 1);
        ancestorIds.addAll(parent.ancestorIds());
        ancestorIds.add(id);
        return new DerivedPosition(parent.path() + separator + name, parent.level() + 1, ancestorIds);
    }

    /** Joins names root first into a path. */
    public String join(List<String> names) {
        return String.join(separator, names);
    }

    public String separator() {
        return separator;
    }
}
