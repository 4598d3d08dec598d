package com.arbor.hierarchy.infrastructure.locking;

import com.arbor.hierarchy.domain.exceptions.TenantLockUnavailableException;
import com.arbor.hierarchy.domain.ports.TenantLease;
import com.arbor.hierarchy.domain.ports.TenantMutationLock;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One fair {@link ReentrantLock} per tenant, held in this JVM. A tenant's lock is kept only while
 * some thread holds or waits for it.
 * <p>
 * Only serializes mutations issued through this process. Running several instances against one
 * store needs a shared lease behind the same port.
 */
public class InProcessTenantMutationLock implements TenantMutationLock {

    private static final Logger log = LoggerFactory.getLogger(InProcessTenantMutationLock.class);

    private final Map<String, TenantEntry> locks = new ConcurrentHashMap<>();
    private final Duration timeout;

    public InProcessTenantMutationLock(Duration timeout) {
        if (timeout == null || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must not be negative");
        }
        this.timeout = timeout;
    }

    @Override
    public TenantLease acquire(String tenantId) {
        TenantEntry entry = locks.compute(tenantId, (id, existing) -> {
            TenantEntry current = existing == null ? new TenantEntry() : existing;
            current.users++;
            return current;
        });
        boolean locked = false;
        try {
            locked = entry.lock.tryLock(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            release(tenantId);
            throw new TenantLockUnavailableException(tenantId, e);
        }
        if (!locked) {
            release(tenantId);
            log.warn("Timed out after {} waiting for the mutation lock of tenant {}", timeout, tenantId);
            throw new TenantLockUnavailableException(tenantId, timeout);
        }
        return new Lease(tenantId, entry.lock);
    }

    /** Number of tenants with a holder or a waiter. */
    int trackedTenants() {
        return locks.size();
    }

    // The entry leaves the map once no thread holds or waits on it.
    private void release(String tenantId) {
        locks.computeIfPresent(tenantId, (id, entry) -> --entry.users == 0 ? null : entry);
    }

    private static final class TenantEntry {

        private final ReentrantLock lock = new ReentrantLock(true);
        // guarded by the map's per-key compute
        private int users;
    }

    private final class Lease implements TenantLease {

        private final String tenantId;
        private final ReentrantLock lock;
        private final AtomicBoolean released = new AtomicBoolean();

        private Lease(String tenantId, ReentrantLock lock) {
            this.tenantId = tenantId;
            this.lock = lock;
        }

        @Override
        public String tenantId() {
            return tenantId;
        }

        @Override
        public void close() {
            if (released.compareAndSet(false, true)) {
                lock.unlock();
                release(tenantId);
            }
        }
    }
}
