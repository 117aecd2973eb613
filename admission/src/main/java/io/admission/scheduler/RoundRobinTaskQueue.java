package io.admission.scheduler;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * One FIFO per tenant, served in turn in the order tenants were first seen. Empty tenants are skipped.
 */
public class RoundRobinTaskQueue implements TaskQueue {
    private final Map<String, Deque<ScheduledTask>> queues = new LinkedHashMap<>();
    private final List<String> tenantOrder = new ArrayList<>();
    private int next;
    private int size;

    @Override public SchedulingPolicy policy() { return SchedulingPolicy.ROUND_ROBIN; }

    @Override
    public synchronized void enqueue(ScheduledTask task) {
        queues.computeIfAbsent(task.tenantId(), t -> {
            tenantOrder.add(t);
            return new ArrayDeque<>();
        }).addLast(task);
        size++;
    }

    @Override
    public synchronized Optional<ScheduledTask> dequeue() {
        int n = tenantOrder.size();
        for (int i = 0; i < n; i++) {
            int idx = (next + i) % n;
            Deque<ScheduledTask> q = queues.get(tenantOrder.get(idx));
            if (!q.isEmpty()) {
                next = (idx + 1) % n;
                size--;
                return Optional.of(q.pollFirst());
            }
        }
        return Optional.empty();
    }

    @Override
    public synchronized boolean remove(String taskId) {
        for (Deque<ScheduledTask> q : queues.values()) {
            if (q.removeIf(t -> t.taskId().equals(taskId))) {
                size--;
                return true;
            }
        }
        return false;
    }

    @Override public synchronized int size() { return size; }

    @Override
    public synchronized QueueStats stats() {
        List<ScheduledTask> all = new ArrayList<>(size);
        queues.values().forEach(all::addAll);
        return QueueStats.of(policy(), all, Map.of());
    }
}
