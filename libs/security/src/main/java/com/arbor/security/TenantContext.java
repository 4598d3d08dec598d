package com.arbor.security;

/**
 * Tenant scope of a request. A tenant is identified by the id of its root node.
 *
 * @param tenantId the tenant root's node id
 */
public record TenantContext(String tenantId) {}
