package com.arbor.hierarchy.domain.ports;

/**
 * A held per-tenant lease. Closing releases it; closing twice is harmless.
 */
public interface TenantLease extends AutoCloseable {

    String tenantId();

    @Override
    void close();
}
