package io.admission.scheduler;

import io.admission.resource.ResourceType;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;

public record TenantStats(
        String tenantId,
        TenantQuota quota,
        int runningTasks,
        int queuedTasks,
        int tasksThisMinute,
        int tasksThisHour,
        long completedTasks,
        long failedTasks,
        long retriedAttempts,
        Duration averageExecutionTime,
        double allocatedSeconds,
        double fairShareDeficit,
        Optional<Instant> lastScheduledAt,
        Map<ResourceType, Double> resourceUsage
) {}
