package io.admission.error;

import io.admission.scheduler.ScheduledTask;

/**
 * Receives tasks that reached a terminal failure: exhausted retries, never got resources, or ran past a deadline.
 */
public interface TaskFailureSink extends AutoCloseable {
    void acceptFailure(ScheduledTask task, String reason);

    @Override default void close() {}

    static TaskFailureSink noop() { return (task, reason) -> {}; }
}
