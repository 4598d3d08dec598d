package com.arbor.hierarchy.domain.exceptions;

import java.time.Duration;

/**
 * Another structural mutation of the same tenant held the lock for longer than the configured
 * wait. Nothing was written.
 */
public class TenantLockUnavailableException extends RuntimeException {

    private final String tenantId;

    public TenantLockUnavailableException(String tenantId, Duration waited) {
        super("Tenant %s is busy with another structural change (waited %d ms)"
                .formatted(tenantId, waited.toMillis()));
        this.tenantId = tenantId;
    }

    public TenantLockUnavailableException(String tenantId, InterruptedException cause) {
        super("Interrupted while waiting for the structural lock of tenant %s".formatted(tenantId), cause);
        this.tenantId = tenantId;
    }

    public String tenantId() {
        return tenantId;
    }
}
