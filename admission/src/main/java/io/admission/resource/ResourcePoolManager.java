package io.admission.resource;

import java.time.Duration;

/**
 * Governs one finite pool. Implementations keep their own lock-guarded bookkeeping of the allocations they hold.
 */
public interface ResourcePoolManager {
    ResourceType type();

    PoolStatus status();

    /**
     * Reserve {@code amount} for an operation. Returns a {@link AllocationStatus#PENDING} allocation, or null when
     * the pool has no unit with enough free capacity.
     *
     * @param ttl lifetime after which the reaper may reclaim the allocation; null for none
     */
    ResourceAllocation allocate(String tenantId, String operationId, double amount, Duration ttl);

    /** Return the allocation's capacity to the pool. False if this pool no longer holds it. */
    boolean release(ResourceAllocation allocation);
}
