package io.admission.scheduler;

import java.util.Optional;

/**
 * One scheduling discipline. Implementations are thread-safe.
 */
public interface TaskQueue {
    SchedulingPolicy policy();

    void enqueue(ScheduledTask task);

    /** Next task to dispatch, or empty when nothing is queued. */
    Optional<ScheduledTask> dequeue();

    /** @return true if the task was queued here and has been taken out */
    boolean remove(String taskId);

    int size();

    QueueStats stats();

    static TaskQueue forPolicy(SchedulingPolicy policy) {
        return switch (policy) {
            case ROUND_ROBIN -> new RoundRobinTaskQueue();
            case PRIORITY -> new PriorityTaskQueue();
            case FAIR_SHARE -> new FairShareTaskQueue();
        };
    }
}
