package io.admission.scheduler;

import java.util.Collection;
import java.util.EnumMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Point-in-time view of a task queue.
 *
 * @param deficits fair-share deficit per tenant; empty for the other disciplines
 */
public record QueueStats(
        SchedulingPolicy policy,
        int totalQueued,
        Map<String, Integer> queuedByTenant,
        Map<TaskPriority, Integer> queuedByPriority,
        Map<String, Double> deficits
) {
    static QueueStats of(SchedulingPolicy policy, Collection<ScheduledTask> queued, Map<String, Double> deficits) {
        Map<String, Integer> byTenant = new TreeMap<>();
        Map<TaskPriority, Integer> byPriority = new EnumMap<>(TaskPriority.class);
        for (ScheduledTask t : queued) {
            byTenant.merge(t.tenantId(), 1, Integer::sum);
            byPriority.merge(t.priority(), 1, Integer::sum);
        }
        return new QueueStats(policy, queued.size(), byTenant, byPriority, new TreeMap<>(deficits));
    }
}
