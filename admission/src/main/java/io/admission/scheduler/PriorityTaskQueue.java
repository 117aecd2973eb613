package io.admission.scheduler;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.PriorityQueue;

/**
 * Strict priority: highest level first, then earliest deadline (tasks with a deadline ahead of those without), then
 * earliest submission, then enqueue order.
 */
public class PriorityTaskQueue implements TaskQueue {
    private record Entry(ScheduledTask task, long seq) {}

    private static final Comparator<Entry> ORDER = Comparator
            .comparingInt((Entry e) -> -e.task().priority().level())
            .thenComparing((Entry e) -> e.task().deadline().orElse(null), Comparator.nullsLast(Comparator.<Instant>naturalOrder()))
            .thenComparing((Entry e) -> e.task().submittedAt())
            .thenComparingLong(Entry::seq);

    private final PriorityQueue<Entry> heap = new PriorityQueue<>(ORDER);
    private long seq;

    @Override public SchedulingPolicy policy() { return SchedulingPolicy.PRIORITY; }

    @Override
    public synchronized void enqueue(ScheduledTask task) {
        heap.add(new Entry(task, seq++));
    }

    @Override
    public synchronized Optional<ScheduledTask> dequeue() {
        Entry e = heap.poll();
        return e == null ? Optional.empty() : Optional.of(e.task());
    }

    @Override
    public synchronized boolean remove(String taskId) {
        return heap.removeIf(e -> e.task().taskId().equals(taskId));
    }

    @Override public synchronized int size() { return heap.size(); }

    @Override
    public synchronized QueueStats stats() {
        List<ScheduledTask> all = new ArrayList<>(heap.size());
        for (Entry e : heap) all.add(e.task());
        return QueueStats.of(policy(), all, Map.of());
    }
}
