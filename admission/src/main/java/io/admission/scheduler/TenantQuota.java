package io.admission.scheduler;

import io.admission.resource.ResourceLimits;

import java.time.Duration;
import java.util.Objects;

/**
 * Scheduling limits for one tenant. Burst capacity and duration are carried for reporting.
 */
public record TenantQuota(
        String tenantId,
        ResourceLimits resourceLimits,
        int maxConcurrentTasks,
        int maxQueuedTasks,
        TaskPriority defaultPriority,
        int priorityBoost,
        double fairShareWeight,
        double burstCapacity,
        Duration burstDuration,
        int maxTasksPerMinute,
        int maxTasksPerHour
) {
    public TenantQuota {
        Objects.requireNonNull(tenantId, "tenantId");
        Objects.requireNonNull(resourceLimits, "resourceLimits");
        Objects.requireNonNull(defaultPriority, "defaultPriority");
        Objects.requireNonNull(burstDuration, "burstDuration");
        if (fairShareWeight <= 0) throw new IllegalArgumentException("fairShareWeight must be positive");
    }

    public static TenantQuota defaults(String tenantId) { return builder(tenantId).build(); }

    public static Builder builder(String tenantId) { return new Builder(tenantId); }

    public Builder toBuilder() {
        return new Builder(tenantId)
                .resourceLimits(resourceLimits)
                .maxConcurrentTasks(maxConcurrentTasks)
                .maxQueuedTasks(maxQueuedTasks)
                .defaultPriority(defaultPriority)
                .priorityBoost(priorityBoost)
                .fairShareWeight(fairShareWeight)
                .burstCapacity(burstCapacity)
                .burstDuration(burstDuration)
                .maxTasksPerMinute(maxTasksPerMinute)
                .maxTasksPerHour(maxTasksPerHour);
    }

    public static class Builder {
        private final String tenantId;
        private ResourceLimits resourceLimits = ResourceLimits.defaults();
        private int maxConcurrentTasks = 5;
        private int maxQueuedTasks = 100;
        private TaskPriority defaultPriority = TaskPriority.NORMAL;
        private int priorityBoost = 0;
        private double fairShareWeight = 1.0;
        private double burstCapacity = 2.0;
        private Duration burstDuration = Duration.ofMinutes(5);
        private int maxTasksPerMinute = 10;
        private int maxTasksPerHour = 100;

        Builder(String tenantId) { this.tenantId = tenantId; }

        public Builder resourceLimits(ResourceLimits l) { this.resourceLimits = l; return this; }
        public Builder maxConcurrentTasks(int n) { this.maxConcurrentTasks = n; return this; }
        public Builder maxQueuedTasks(int n) { this.maxQueuedTasks = n; return this; }
        public Builder defaultPriority(TaskPriority p) { this.defaultPriority = p; return this; }
        public Builder priorityBoost(int b) { this.priorityBoost = b; return this; }
        public Builder fairShareWeight(double w) { this.fairShareWeight = w; return this; }
        public Builder burstCapacity(double c) { this.burstCapacity = c; return this; }
        public Builder burstDuration(Duration d) { this.burstDuration = d; return this; }
        public Builder maxTasksPerMinute(int n) { this.maxTasksPerMinute = n; return this; }
        public Builder maxTasksPerHour(int n) { this.maxTasksPerHour = n; return this; }

        public TenantQuota build() {
            return new TenantQuota(tenantId, resourceLimits, maxConcurrentTasks, maxQueuedTasks, defaultPriority,
                    priorityBoost, fairShareWeight, burstCapacity, burstDuration, maxTasksPerMinute, maxTasksPerHour);
        }
    }
}
