package com.arbor.hierarchy.config;

import com.arbor.hierarchy.domain.services.HierarchyPolicy;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Hierarchy engine settings, bound from {@code arbor.hierarchy.*}.
 *
 * <pre>
 * arbor:
 *   hierarchy:
 *     separator: " > "
 *     allow-multiple-roots: false
 *     store: jdbc
 *     lock-timeout: 10s
 * </pre>
 *
 * @param separator          text between ancestor names in a path, defaults to {@code " > "}
 * @param allowMultipleRoots whether a tenant may hold several root trees
 * @param store              backing node store, defaults to {@link StoreType#MEMORY}
 * @param lockTimeout        longest wait for a tenant's mutation lock, defaults to 10 seconds
 */
@ConfigurationProperties(prefix = "arbor.hierarchy")
@Validated
public record HierarchyProperties(
        String separator, boolean allowMultipleRoots, StoreType store, Duration lockTimeout) {

    public static final Duration DEFAULT_LOCK_TIMEOUT = Duration.ofSeconds(10);

    public HierarchyProperties {
        // an empty separator would make paths ambiguous
        if (separator == null || separator.isEmpty()) {
            separator = HierarchyPolicy.DEFAULT_SEPARATOR;
        }
        if (store == null) {
            store = StoreType.MEMORY;
        }
        if (lockTimeout == null || lockTimeout.isNegative() || lockTimeout.isZero()) {
            lockTimeout = DEFAULT_LOCK_TIMEOUT;
        }
    }

    public HierarchyPolicy toPolicy() {
        return new HierarchyPolicy(separator, allowMultipleRoots);
    }

    /** Where nodes are kept. */
    public enum StoreType {
        MEMORY,
        JDBC
    }
}
