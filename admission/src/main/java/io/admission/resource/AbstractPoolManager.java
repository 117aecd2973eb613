package io.admission.resource;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.Objects;
import java.util.UUID;

abstract class AbstractPoolManager implements ResourcePoolManager {
    // amounts are doubles; tolerate rounding when comparing against free capacity
    static final double EPSILON = 1e-9;

    protected final Object lock = new Object();
    protected final Clock clock;
    private final ResourceType type;

    AbstractPoolManager(ResourceType type, Clock clock) {
        this.type = Objects.requireNonNull(type);
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    @Override
    public ResourceType type() { return type; }

    protected ResourceAllocation newAllocation(String tenantId, String operationId, double amount, Duration ttl, Integer unitId) {
        Instant now = clock.instant();
        Instant expiresAt = ttl == null ? null : now.plus(ttl);
        String id = type.name().toLowerCase() + "-" + (unitId == null ? "" : unitId + "-") + UUID.randomUUID();
        return new ResourceAllocation(id, tenantId, operationId, type, amount, now, expiresAt, unitId);
    }

    static double sum(Collection<ResourceAllocation> allocations) {
        double total = 0.0;
        for (ResourceAllocation a : allocations) total += a.allocatedAmount();
        return total;
    }
}
