package io.admission.scheduler;

import java.util.Map;

public record SchedulerStats(
        SchedulingPolicy policy,
        boolean running,
        int runningTasks,
        int completedTasksInHistory,
        long totalSubmitted,
        long totalCompleted,
        long totalFailed,
        long totalCancelled,
        long totalRetried,
        long totalWaitingResources,
        long totalRejected,
        QueueStats queue,
        Map<String, TenantStats> tenants
) {}
