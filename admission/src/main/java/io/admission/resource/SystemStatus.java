package io.admission.resource;

import java.util.Map;

public record SystemStatus(
        Map<ResourceType, PoolStatus> pools,
        int totalAllocations,
        Map<AllocationStatus, Integer> allocationsByStatus
) {}
