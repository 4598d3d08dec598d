package com.arbor.security;

import java.util.Optional;

/**
 * Security context of a single hierarchy request.
 * <p>
 * {@code tenant} is null only for a request
 * that establishes a new tenant (creating its root); every other operation requires it.
 *
 * @param actor         the identity performing the operation
 * @param tenant        the tenant scope, or null when establishing a new tenant
 * @param correlationId trace correlation ID for this request
 */
public record ArborSecurityContext(
        AuthenticatedActor actor,
        TenantContext tenant,
        String correlationId) {

    /** Returns the tenant id if the request is tenant-scoped. */
    public Optional<String> tenantId() {
        return Optional.ofNullable(tenant).map(TenantContext::tenantId);
    }

    /**
     * Returns the tenant id.
     *
     * @throws IllegalArgumentException if the request carries no tenant
     */
    public String requireTenantId() {
        return tenantId().orElseThrow(() -> new IllegalArgumentException("A tenant id is required for this operation"));
    }

    public String actorId() {
        return actor.actorId();
    }
}
