package io.admission.scheduler;

import io.admission.resource.ResourceType;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Running counters for one tenant: task counts, submission rate windows, execution history and the fair-share
 * bookkeeping the scheduler mirrors into it. All access goes through the tracker's monitor.
 */
public class TenantUsageTracker {
    static final int EXECUTION_HISTORY = 100;
    private static final Duration MINUTE = Duration.ofMinutes(1);
    private static final Duration HOUR = Duration.ofHours(1);

    private final String tenantId;
    private final Clock clock;

    private int runningTasks;
    private int queuedTasks;
    private int tasksThisMinute;
    private int tasksThisHour;
    private Instant minuteWindowStart;
    private Instant hourWindowStart;
    private long completedTasks;
    private long failedTasks;
    private long retriedAttempts;
    private final Map<ResourceType, Double> resourceUsage = new EnumMap<>(ResourceType.class);
    private final Deque<Duration> executionTimes = new ArrayDeque<>();
    private double allocatedSeconds;
    private double fairShareDeficit;
    private Instant lastScheduledAt;

    public TenantUsageTracker(String tenantId, Clock clock) {
        this.tenantId = tenantId;
        this.clock = clock == null ? Clock.systemUTC() : clock;
        Instant now = this.clock.instant();
        this.minuteWindowStart = now;
        this.hourWindowStart = now;
    }

    public String tenantId() { return tenantId; }

    /**
     * Checks a new submission against the quota.
     *
     * @return the reason for refusal, or empty if the task may be queued
     */
    public synchronized Optional<String> canScheduleTask(TenantQuota quota) {
        rollWindows();
        if (runningTasks >= quota.maxConcurrentTasks()) {
            return Optional.of("max concurrent tasks (" + quota.maxConcurrentTasks() + ") reached");
        }
        if (queuedTasks >= quota.maxQueuedTasks()) {
            return Optional.of("max queued tasks (" + quota.maxQueuedTasks() + ") reached");
        }
        if (tasksThisMinute >= quota.maxTasksPerMinute()) {
            return Optional.of("rate limit of " + quota.maxTasksPerMinute() + " tasks per minute reached");
        }
        if (tasksThisHour >= quota.maxTasksPerHour()) {
            return Optional.of("rate limit of " + quota.maxTasksPerHour() + " tasks per hour reached");
        }
        return Optional.empty();
    }

    /** An accepted submission: queued, and counted against both rate windows. */
    public synchronized void recordSubmitted() {
        rollWindows();
        queuedTasks++;
        tasksThisMinute++;
        tasksThisHour++;
    }

    /** A retry put the task back in the queue; it does not count against the rate windows. */
    public synchronized void recordRequeued() { queuedTasks++; }

    public synchronized void recordDequeuedWithoutRun() { queuedTasks = Math.max(0, queuedTasks - 1); }

    public synchronized void recordStarted(Map<ResourceType, Double> requirements) {
        queuedTasks = Math.max(0, queuedTasks - 1);
        runningTasks++;
        lastScheduledAt = clock.instant();
        requirements.forEach((type, amount) -> resourceUsage.merge(type, amount, Double::sum));
    }

    /**
     * A dispatched task reached a final outcome.
     *
     * @param executionTime wall time it ran, or null if it never got to run its work
     */
    public synchronized void recordFinished(Map<ResourceType, Double> requirements, Duration executionTime, boolean success) {
        stopRunning(requirements, executionTime);
        if (success) completedTasks++;
        else failedTasks++;
    }

    /** An attempt failed and the task went back to wait for a retry; not counted as a failed task. */
    public synchronized void recordRetrying(Map<ResourceType, Double> requirements, Duration executionTime) {
        stopRunning(requirements, executionTime);
        retriedAttempts++;
    }

    private void stopRunning(Map<ResourceType, Double> requirements, Duration executionTime) {
        runningTasks = Math.max(0, runningTasks - 1);
        requirements.forEach((type, amount) -> resourceUsage.computeIfPresent(type, (k, v) -> Math.max(0.0, v - amount)));
        if (executionTime != null) {
            executionTimes.addLast(executionTime);
            while (executionTimes.size() > EXECUTION_HISTORY) executionTimes.removeFirst();
            allocatedSeconds += executionTime.toNanos() / 1e9;
        }
    }

    /** Mean of the most recent execution times; zero before any task has run. */
    public synchronized Duration getAverageExecutionTime() {
        if (executionTimes.isEmpty()) return Duration.ZERO;
        long total = 0;
        for (Duration d : executionTimes) total += d.toNanos();
        return Duration.ofNanos(total / executionTimes.size());
    }

    public synchronized double allocatedSeconds() { return allocatedSeconds; }

    public synchronized void setFairShareDeficit(double deficit) { this.fairShareDeficit = deficit; }

    public synchronized int runningTasks() { return runningTasks; }

    public synchronized int queuedTasks() { return queuedTasks; }

    public synchronized TenantStats snapshot(TenantQuota quota) {
        rollWindows();
        return new TenantStats(tenantId, quota, runningTasks, queuedTasks, tasksThisMinute, tasksThisHour,
                completedTasks, failedTasks, retriedAttempts, getAverageExecutionTime(), allocatedSeconds, fairShareDeficit,
                Optional.ofNullable(lastScheduledAt), new EnumMap<>(resourceUsage));
    }

    private void rollWindows() {
        Instant now = clock.instant();
        if (Duration.between(minuteWindowStart, now).compareTo(MINUTE) >= 0) {
            tasksThisMinute = 0;
            minuteWindowStart = now;
        }
        if (Duration.between(hourWindowStart, now).compareTo(HOUR) >= 0) {
            tasksThisHour = 0;
            hourWindowStart = now;
        }
    }
}
