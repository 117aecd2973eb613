package io.admission.resource;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * A granted claim on one resource type, placed on one unit of its pool.
 */
public final class ResourceAllocation {
    private final String allocationId;
    private final String tenantId;
    private final String operationId;
    private final ResourceType resourceType;
    private final double allocatedAmount;
    private final Instant allocatedAt;
    private final Instant expiresAt; // null = never expires
    private final Integer unitId; // GPU index, null for host pools
    private final ResourceUsage usage;
    private volatile AllocationStatus status = AllocationStatus.PENDING;

    ResourceAllocation(String allocationId, String tenantId, String operationId, ResourceType resourceType,
                       double allocatedAmount, Instant allocatedAt, Instant expiresAt, Integer unitId) {
        this.allocationId = Objects.requireNonNull(allocationId);
        this.tenantId = Objects.requireNonNull(tenantId);
        this.operationId = Objects.requireNonNull(operationId);
        this.resourceType = Objects.requireNonNull(resourceType);
        this.allocatedAmount = allocatedAmount;
        this.allocatedAt = Objects.requireNonNull(allocatedAt);
        this.expiresAt = expiresAt;
        this.unitId = unitId;
        this.usage = new ResourceUsage(allocatedAt);
    }

    public String allocationId() { return allocationId; }
    public String tenantId() { return tenantId; }
    public String operationId() { return operationId; }
    public ResourceType resourceType() { return resourceType; }
    public double allocatedAmount() { return allocatedAmount; }
    public Instant allocatedAt() { return allocatedAt; }
    public Optional<Instant> expiresAt() { return Optional.ofNullable(expiresAt); }
    public OptionalInt unitId() { return unitId == null ? OptionalInt.empty() : OptionalInt.of(unitId); }
    public ResourceUsage usage() { return usage; }
    public AllocationStatus status() { return status; }

    public boolean isExpired(Instant now) {
        return expiresAt != null && !expiresAt.isAfter(now);
    }

    /**
     * Moves the allocation forward in its lifecycle.
     *
     * @return false if the transition would go backwards or leave a terminal status
     */
    synchronized boolean transitionTo(AllocationStatus next) {
        if (!status.canMoveTo(next)) return false;
        status = next;
        return true;
    }

    @Override
    public String toString() {
        return "ResourceAllocation{" +
                "id=" + allocationId +
                ", tenant=" + tenantId +
                ", op=" + operationId +
                ", type=" + resourceType +
                ", amount=" + allocatedAmount +
                ", status=" + status +
                '}';
    }
}
