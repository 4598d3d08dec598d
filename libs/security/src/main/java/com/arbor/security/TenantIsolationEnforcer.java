package com.arbor.security;

import java.util.Optional;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Enforces tenant isolation on resources loaded by id.
 * <p>
 * A resource of another tenant is concealed: callers see it exactly as if it did not exist, so a
 * cross-tenant probe cannot distinguish "exists elsewhere" from "never existed". The attempt is
 * logged at WARN for the security trail.
 */
public final class TenantIsolationEnforcer {

    private static final Logger log = LoggerFactory.getLogger(TenantIsolationEnforcer.class);

    private TenantIsolationEnforcer() {
        // utility class
    }

    /**
     * Returns {@code resource} only if it belongs to {@code tenantId}.
     *
     * @param tenantId the tenant of the caller
     * @param resource the loaded resource, possibly empty
     * @param tenantOf extracts the owning tenant id from the resource
     * @return the resource, or empty if absent or owned by another tenant
     */
    public static <T> Optional<T> conceal(String tenantId, Optional<T> resource, Function<T, String> tenantOf) {
        return resource.filter(value -> {
            String owner = tenantOf.apply(value);
            if (sameTenant(tenantId, owner)) {
                return true;
            }
            log.warn("Cross-tenant access concealed: tenant '{}' requested a resource of tenant '{}'", tenantId, owner);
            return false;
        });
    }

    /** True when both ids are non-null and equal. */
    public static boolean sameTenant(String tenantId, String resourceTenantId) {
        return tenantId != null && tenantId.equals(resourceTenantId);
    }
}
