package io.admission.resource;

import java.util.Map;

public record TenantResourceUsage(
        String tenantId,
        ResourceLimits limits,
        Map<ResourceType, Double> currentUsage,
        int activeAllocations,
        int totalAllocations
) {}
