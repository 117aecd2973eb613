package io.admission.scheduler;

import io.admission.resource.ResourceType;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A unit of work submitted to the {@link FairScheduler}. The identity, requirements and limits are fixed at submission;
 * status and timings are moved only by the scheduler, through transitions that refuse to leave a terminal status.
 */
public final class ScheduledTask {
    private final String taskId;
    private final String tenantId;
    private final Map<ResourceType, Double> resourceRequirements;
    private final Duration estimatedDuration;
    private final Duration maxDuration;
    private final Instant deadline; // optional
    private final Instant submittedAt;
    private final int maxRetries;
    private final TaskWork work;

    private volatile TaskPriority priority;
    private volatile TaskStatus status = TaskStatus.QUEUED;
    private volatile Instant startedAt;
    private volatile Instant completedAt;
    private volatile int retryCount;
    private volatile Duration executionTime;
    private volatile String lastError;

    ScheduledTask(String taskId, String tenantId, TaskWork work, Map<ResourceType, Double> resourceRequirements,
                  TaskPriority priority, Duration estimatedDuration, Duration maxDuration, Instant deadline,
                  Instant submittedAt, int maxRetries) {
        this.taskId = Objects.requireNonNull(taskId);
        this.tenantId = Objects.requireNonNull(tenantId);
        this.work = Objects.requireNonNull(work);
        Map<ResourceType, Double> req = new EnumMap<>(ResourceType.class);
        req.putAll(resourceRequirements);
        this.resourceRequirements = Collections.unmodifiableMap(req);
        this.priority = Objects.requireNonNull(priority);
        this.estimatedDuration = estimatedDuration;
        this.maxDuration = Objects.requireNonNull(maxDuration);
        this.deadline = deadline;
        this.submittedAt = Objects.requireNonNull(submittedAt);
        this.maxRetries = Math.max(0, maxRetries);
    }

    public String taskId() { return taskId; }
    public String tenantId() { return tenantId; }
    public Map<ResourceType, Double> resourceRequirements() { return resourceRequirements; }
    public Optional<Duration> estimatedDuration() { return Optional.ofNullable(estimatedDuration); }
    public Duration maxDuration() { return maxDuration; }
    public Optional<Instant> deadline() { return Optional.ofNullable(deadline); }
    public Instant submittedAt() { return submittedAt; }
    public int maxRetries() { return maxRetries; }
    public TaskPriority priority() { return priority; }
    public TaskStatus status() { return status; }
    public Optional<Instant> startedAt() { return Optional.ofNullable(startedAt); }
    public Optional<Instant> completedAt() { return Optional.ofNullable(completedAt); }
    public int retryCount() { return retryCount; }
    public Optional<Duration> executionTime() { return Optional.ofNullable(executionTime); }
    public String lastError() { return lastError; }

    TaskWork work() { return work; }

    boolean isPastDeadline(Instant now) { return deadline != null && now.isAfter(deadline); }

    boolean hasExceededMaxDuration(Instant now) {
        Instant s = startedAt;
        return s != null && Duration.between(s, now).compareTo(maxDuration) > 0;
    }

    synchronized boolean markRunning(Instant now) {
        if (status != TaskStatus.QUEUED) return false;
        status = TaskStatus.RUNNING;
        startedAt = now;
        return true;
    }

    synchronized boolean markCompleted(Instant now) {
        if (status != TaskStatus.RUNNING) return false;
        finish(TaskStatus.COMPLETED, now);
        return true;
    }

    synchronized boolean markFailed(Instant now, String error) {
        if (status != TaskStatus.RUNNING) return false;
        lastError = error;
        finish(TaskStatus.FAILED, now);
        return true;
    }

    synchronized boolean markWaitingResources(Instant now) {
        if (status != TaskStatus.RUNNING) return false;
        lastError = "resources unavailable";
        finish(TaskStatus.WAITING_RESOURCES, now);
        return true;
    }

    /** Failed attempt that will run again: back to QUEUED at the lowest priority. */
    synchronized boolean markForRetry(Instant now, String error) {
        if (status != TaskStatus.RUNNING) return false;
        lastError = error;
        executionTime = Duration.between(startedAt, now);
        retryCount++;
        priority = TaskPriority.LOW;
        status = TaskStatus.QUEUED;
        startedAt = null;
        return true;
    }

    /** @return the status the task was cancelled from, or null if it was already terminal */
    synchronized TaskStatus markCancelled(Instant now, String reason) {
        TaskStatus previous = status;
        if (previous.isTerminal()) return null;
        if (reason != null) lastError = reason;
        finish(TaskStatus.CANCELLED, now);
        return previous;
    }

    private void finish(TaskStatus terminal, Instant now) {
        status = terminal;
        completedAt = now;
        if (startedAt != null) executionTime = Duration.between(startedAt, now);
    }

    @Override
    public String toString() {
        return "ScheduledTask{" +
                "id=" + taskId +
                ", tenant=" + tenantId +
                ", priority=" + priority +
                ", status=" + status +
                ", retries=" + retryCount +
                '}';
    }
}
