package io.admission.resource;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Scoped result of {@link ResourceAllocationSystem#managedAllocation}. Closing the lease releases every allocation it
 * holds exactly once, whichever thread closes it first.
 */
public final class AllocationLease implements AutoCloseable {
    private final ResourceAllocationSystem system;
    private final Map<ResourceType, ResourceAllocation> allocations;
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private volatile boolean failed;

    AllocationLease(ResourceAllocationSystem system, Map<ResourceType, ResourceAllocation> allocations) {
        this.system = system;
        this.allocations = Collections.unmodifiableMap(allocations);
    }

    /** Requested types mapped to their allocation; every value is null when the request was not granted. */
    public Map<ResourceType, ResourceAllocation> allocations() { return allocations; }

    public boolean isGranted() {
        return allocations.values().stream().allMatch(Objects::nonNull);
    }

    public boolean isClosed() { return closed.get(); }

    /** Work has started against these allocations. */
    public void markRunning() {
        for (ResourceAllocation a : allocations.values()) {
            if (a != null) a.transitionTo(AllocationStatus.RUNNING);
        }
    }

    /** Release as {@link AllocationStatus#FAILED} instead of {@link AllocationStatus#COMPLETED} on close. */
    public void markFailed() { failed = true; }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) return;
        AllocationStatus terminal = failed ? AllocationStatus.FAILED : AllocationStatus.COMPLETED;
        for (ResourceAllocation a : allocations.values()) {
            if (a != null) system.release(a.allocationId(), terminal);
        }
    }
}
