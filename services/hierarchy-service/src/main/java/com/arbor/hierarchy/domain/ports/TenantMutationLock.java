package com.arbor.hierarchy.domain.ports;

/**
 * Per-tenant mutual exclusion for structural mutations.
 * <p>
 * Holding the lease for a tenant guarantees that no other structural mutation of the same tree
 * interleaves with the holder's reads and writes. Readers do not take the lease.
 */
public interface TenantMutationLock {

    /**
     * Blocks until the tenant's lease is available.
     *
     * @throws com.arbor.hierarchy.domain.exceptions.TenantLockUnavailableException if the lease
     *         cannot be obtained in time
     */
    TenantLease acquire(String tenantId);
}
