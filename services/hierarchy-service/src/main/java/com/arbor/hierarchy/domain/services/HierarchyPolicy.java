package com.arbor.hierarchy.domain.services;

/**
 * Tenant-wide structural rules applied by the engine.
 *
 * @param separator          text placed between ancestor names in a path
 * @param allowMultipleRoots whether a tenant may hold more than one root tree
 */
public record HierarchyPolicy(String separator, boolean allowMultipleRoots) {

    public static final String DEFAULT_SEPARATOR = " > ";

    public HierarchyPolicy {
        if (separator == null || separator.isEmpty()) {
            throw new IllegalArgumentException("separator must not be empty");
        }
    }

    /** Default separator, single root per tenant. */
    public static HierarchyPolicy defaults() {
        return new HierarchyPolicy(DEFAULT_SEPARATOR, false);
    }
}
