package io.admission.scheduler;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Weighted fair share with deficit tracking.
 * <p>
 * Each tenant carries a deficit: how much execution time it is owed relative to its weighted share of everything
 * executed so far. A queued task's effective priority is {@code priority.level + deficit * weight}, so a tenant that
 * has received less than its share moves ahead of its own nominal priority. Deficits change only in
 * {@link #reconcileDeficits()}, which the scheduler calls from its monitor.
 */
public class FairShareTaskQueue implements TaskQueue {
    private record Entry(ScheduledTask task, long seq) {}

    private final List<Entry> entries = new ArrayList<>();
    private final Map<String, Double> weights = new LinkedHashMap<>();
    private final Map<String, Double> deficits = new HashMap<>();
    private final Map<String, Double> allocatedSeconds = new HashMap<>();
    private final Comparator<Entry> order = Comparator
            .comparingDouble((Entry e) -> -effectivePriority(e.task()))
            .thenComparingLong(Entry::seq);
    private long seq;

    @Override public SchedulingPolicy policy() { return SchedulingPolicy.FAIR_SHARE; }

    public synchronized void setWeight(String tenantId, double weight) {
        if (weight <= 0) throw new IllegalArgumentException("weight must be positive: " + weight);
        weights.put(tenantId, weight);
        entries.sort(order);
    }

    public synchronized double weight(String tenantId) { return weights.getOrDefault(tenantId, 1.0); }

    public synchronized double deficit(String tenantId) { return deficits.getOrDefault(tenantId, 0.0); }

    /** Credit a tenant with execution time it has just consumed. */
    public synchronized void recordAllocatedTime(String tenantId, double seconds) {
        weights.putIfAbsent(tenantId, 1.0);
        allocatedSeconds.merge(tenantId, seconds, Double::sum);
    }

    /**
     * Moves every tenant's deficit towards its share of total allocated time:
     * {@code deficit += share - allocated}, floored at {@code -share}.
     *
     * @return the updated deficits
     */
    public synchronized Map<String, Double> reconcileDeficits() {
        double totalWeight = 0.0;
        double totalTime = 0.0;
        for (Map.Entry<String, Double> w : weights.entrySet()) {
            totalWeight += w.getValue();
            totalTime += allocatedSeconds.getOrDefault(w.getKey(), 0.0);
        }
        Map<String, Double> result = new LinkedHashMap<>();
        if (totalWeight <= 0.0) return result;
        for (Map.Entry<String, Double> w : weights.entrySet()) {
            String tenant = w.getKey();
            double share = w.getValue() / totalWeight * totalTime;
            double allocated = allocatedSeconds.getOrDefault(tenant, 0.0);
            double d = deficits.getOrDefault(tenant, 0.0) + share - allocated;
            d = Math.max(d, -share);
            deficits.put(tenant, d);
            result.put(tenant, d);
        }
        entries.sort(order);
        return result;
    }

    @Override
    public synchronized void enqueue(ScheduledTask task) {
        weights.putIfAbsent(task.tenantId(), 1.0);
        entries.add(new Entry(task, seq++));
        entries.sort(order);
    }

    @Override
    public synchronized Optional<ScheduledTask> dequeue() {
        if (entries.isEmpty()) return Optional.empty();
        return Optional.of(entries.remove(0).task());
    }

    @Override
    public synchronized boolean remove(String taskId) {
        return entries.removeIf(e -> e.task().taskId().equals(taskId));
    }

    @Override public synchronized int size() { return entries.size(); }

    @Override
    public synchronized QueueStats stats() {
        List<ScheduledTask> all = new ArrayList<>(entries.size());
        for (Entry e : entries) all.add(e.task());
        return QueueStats.of(policy(), all, deficits);
    }

    // caller holds the monitor
    private double effectivePriority(ScheduledTask task) {
        String tenant = task.tenantId();
        return task.priority().level() + deficits.getOrDefault(tenant, 0.0) * weights.getOrDefault(tenant, 1.0);
    }
}
