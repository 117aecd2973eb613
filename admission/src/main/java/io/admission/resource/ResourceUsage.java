package io.admission.resource;

import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;

/**
 * Consumption reported against an allocation. Used for reporting only; enforcement uses the allocated amount.
 */
public final class ResourceUsage {
    private final Instant startedAt;
    private final EnumMap<ResourceType, Double> consumed = new EnumMap<>(ResourceType.class);

    public ResourceUsage(Instant startedAt) {
        this.startedAt = startedAt;
    }

    public Instant startedAt() { return startedAt; }

    public synchronized void record(ResourceType type, double amount) {
        consumed.merge(type, amount, Double::sum);
    }

    public synchronized double consumed(ResourceType type) {
        return consumed.getOrDefault(type, 0.0);
    }

    public synchronized Map<ResourceType, Double> snapshot() {
        return Map.copyOf(consumed);
    }
}
