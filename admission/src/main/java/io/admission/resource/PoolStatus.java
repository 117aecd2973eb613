package io.admission.resource;

import java.util.List;

/**
 * Point-in-time view of one pool. {@code units} lists physical units for pools that have more than one.
 */
public record PoolStatus(
        ResourceType type,
        boolean available,
        double total,
        double reserved,
        double allocated,
        double free,
        int activeAllocations,
        List<UnitStatus> units
) {
    public record UnitStatus(int id, String name, double capacity, double allocated, double free,
                             int activeAllocations, double load) {}
}
