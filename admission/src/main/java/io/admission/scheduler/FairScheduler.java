package io.admission.scheduler;

import com.codahale.metrics.Counter;
import com.codahale.metrics.Meter;
import com.codahale.metrics.Timer;
import io.admission.error.TaskFailureSink;
import io.admission.metrics.Metrics;
import io.admission.resource.AllocationLease;
import io.admission.resource.ResourceAllocationSystem;
import io.admission.resource.ResourceType;
import io.admission.retry.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Multi-tenant task scheduler on top of a {@link ResourceAllocationSystem}.
 * <p>
 * Submissions are checked against the tenant's quota and queued under one {@link TaskQueue} discipline. A dispatch
 * thread hands queued tasks to a fixed worker pool while fewer than {@code maxConcurrentTasks} are running; each worker
 * takes every resource the task declared in one all-or-nothing lease, runs the work, and releases the lease whatever
 * the outcome. A monitor thread reconciles fair-share deficits and cancels tasks past their deadline or maximum
 * duration.
 */
public class FairScheduler implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(FairScheduler.class);

    private final ResourceAllocationSystem allocator;
    private final TaskQueue queue;
    private final RetryPolicy retryPolicy;
    private final TaskFailureSink failureSink;
    private final Clock clock;
    private final int maxConcurrentTasks;
    private final int maxRetries;
    private final Duration dispatchIdle;
    private final Duration monitorInterval;
    private final int completedHistory;

    private final Map<String, TenantQuota> quotas = new ConcurrentHashMap<>();
    private final Map<String, TenantUsageTracker> trackers = new ConcurrentHashMap<>();
    // every task that is queued, running, or still in the completed history
    private final Map<String, ScheduledTask> tasks = new ConcurrentHashMap<>();
    private final Map<String, Execution> running = new ConcurrentHashMap<>();
    private final Deque<String> completed = new ArrayDeque<>();
    // failed tasks waiting out their retry backoff: QUEUED but not yet in the queue
    private final Set<ScheduledTask> awaitingRequeue = ConcurrentHashMap.newKeySet();

    private final ExecutorService workers;
    private final AtomicBoolean started = new AtomicBoolean(false);
    private volatile Thread dispatchThread;
    private volatile ScheduledExecutorService timers;

    private final Meter submittedMeter;
    private final Meter rejectedMeter;
    private final Counter completedCounter;
    private final Counter failedCounter;
    private final Counter cancelledCounter;
    private final Counter retriedCounter;
    private final Counter waitingCounter;
    private final Timer executionTimer;

    public FairScheduler(ResourceAllocationSystem allocator,
                         SchedulingPolicy policy,
                         RetryPolicy retryPolicy,
                         TaskFailureSink failureSink,
                         Metrics metrics,
                         Clock clock,
                         int maxConcurrentTasks,
                         int maxRetries,
                         Duration dispatchIdle,
                         Duration monitorInterval,
                         int completedHistory) {
        this.allocator = Objects.requireNonNull(allocator);
        this.queue = TaskQueue.forPolicy(Objects.requireNonNull(policy));
        this.retryPolicy = Objects.requireNonNull(retryPolicy);
        this.failureSink = failureSink == null ? TaskFailureSink.noop() : failureSink;
        this.clock = clock == null ? Clock.systemUTC() : clock;
        this.maxConcurrentTasks = Math.max(1, maxConcurrentTasks);
        this.maxRetries = Math.max(0, maxRetries);
        this.dispatchIdle = Objects.requireNonNull(dispatchIdle);
        this.monitorInterval = Objects.requireNonNull(monitorInterval);
        this.completedHistory = Math.max(1, completedHistory);
        this.workers = Executors.newFixedThreadPool(this.maxConcurrentTasks, named("scheduler-worker"));

        Metrics m = Objects.requireNonNull(metrics);
        this.submittedMeter = m.meter("scheduler.submitted");
        this.rejectedMeter = m.meter("scheduler.rejected");
        this.completedCounter = m.counter("scheduler.completed");
        this.failedCounter = m.counter("scheduler.failed");
        this.cancelledCounter = m.counter("scheduler.cancelled");
        this.retriedCounter = m.counter("scheduler.retried");
        this.waitingCounter = m.counter("scheduler.waiting_resources");
        this.executionTimer = m.timer("scheduler.execution.time");
        m.gauge("scheduler.queue.depth", queue::size);
        m.gauge("scheduler.running", running::size);
    }

    public SchedulingPolicy getSchedulingPolicy() { return queue.policy(); }

    public ResourceAllocationSystem allocator() { return allocator; }

    public void setTenantQuota(TenantQuota quota) {
        quotas.put(quota.tenantId(), quota);
        allocator.setTenantLimits(quota.tenantId(), quota.resourceLimits());
        if (queue instanceof FairShareTaskQueue fair) fair.setWeight(quota.tenantId(), quota.fairShareWeight());
        tracker(quota.tenantId());
        LOG.info("Set quota for tenant {}: concurrent={}, queued={}, weight={}", quota.tenantId(),
                quota.maxConcurrentTasks(), quota.maxQueuedTasks(), quota.fairShareWeight());
    }

    public TenantQuota getTenantQuota(String tenantId) {
        return quotas.getOrDefault(tenantId, TenantQuota.defaults(tenantId));
    }

    public String submitTask(String tenantId, TaskWork work, Map<ResourceType, Double> requirements,
                             TaskPriority priority) throws QuotaExceededException {
        return submitTask(tenantId, work, requirements, priority, null, null);
    }

    /**
     * Queue a task for a tenant.
     *
     * @param priority          null for the tenant's default priority
     * @param estimatedDuration optional hint, reported only
     * @param deadline          optional; a task still running past it is cancelled
     * @return the new task's id
     * @throws QuotaExceededException if the tenant is at its concurrency, queue or rate limit
     */
    public String submitTask(String tenantId, TaskWork work, Map<ResourceType, Double> requirements,
                             TaskPriority priority, Duration estimatedDuration, Instant deadline)
            throws QuotaExceededException {
        Objects.requireNonNull(tenantId, "tenantId");
        Objects.requireNonNull(work, "work");
        TenantQuota quota = getTenantQuota(tenantId);
        TenantUsageTracker tracker = tracker(tenantId);
        // check and count under the tracker's monitor so concurrent submissions cannot both take the last slot
        synchronized (tracker) {
            Optional<String> refusal = tracker.canScheduleTask(quota);
            if (refusal.isPresent()) {
                rejectedMeter.mark();
                LOG.warn("Rejected task for tenant {}: {}", tenantId, refusal.get());
                throw new QuotaExceededException(tenantId, refusal.get());
            }
            tracker.recordSubmitted();
        }

        TaskPriority base = priority == null ? quota.defaultPriority() : priority;
        ScheduledTask task = new ScheduledTask(
                UUID.randomUUID().toString(), tenantId, work,
                requirements == null ? Map.of() : requirements,
                base.boosted(quota.priorityBoost()),
                estimatedDuration,
                quota.resourceLimits().maxOperationDuration(),
                deadline,
                clock.instant(),
                maxRetries);
        tasks.put(task.taskId(), task);
        queue.enqueue(task);
        submittedMeter.mark();
        LOG.info("Queued task {} for tenant {} at {} ({})", task.taskId(), tenantId, task.priority(), queue.policy());
        return task.taskId();
    }

    public Optional<ScheduledTask> getTask(String taskId) { return Optional.ofNullable(tasks.get(taskId)); }

    /**
     * Cancel a queued or running task. A running task's resources are released and its worker interrupted.
     *
     * @return false if the task is unknown or already finished
     */
    public boolean cancelTask(String taskId) { return cancel(taskId, "cancelled", false); }

    private boolean cancel(String taskId, String reason, boolean recordFailure) {
        ScheduledTask task = tasks.get(taskId);
        if (task == null) return false;
        TaskStatus previous = task.markCancelled(clock.instant(), reason);
        if (previous == null) return false;
        cancelledCounter.inc();
        if (previous == TaskStatus.QUEUED) {
            // may already be out of the queue if it was waiting to be retried
            queue.remove(taskId);
            tracker(task.tenantId()).recordDequeuedWithoutRun();
            remember(task);
        } else {
            Execution exec = running.get(taskId);
            if (exec != null) {
                exec.cancel();
                finish(exec, task.executionTime().orElse(null), false, true);
            }
        }
        LOG.warn("Cancelled task {} of tenant {} ({}): {}", taskId, task.tenantId(), previous, reason);
        if (recordFailure) failureSink.acceptFailure(task, reason);
        return true;
    }

    public void start() {
        if (!started.compareAndSet(false, true)) return;
        allocator.start();
        timers = Executors.newSingleThreadScheduledExecutor(named("scheduler-monitor"));
        long millis = Math.max(1, monitorInterval.toMillis());
        timers.scheduleWithFixedDelay(this::runMonitorCycle, millis, millis, TimeUnit.MILLISECONDS);
        dispatchThread = new Thread(this::runDispatch, "scheduler-dispatch");
        dispatchThread.setDaemon(true);
        dispatchThread.start();
        LOG.info("Started {} scheduler with {} workers", queue.policy(), maxConcurrentTasks);
    }

    /** Stops dispatching and cancels every running task. Queued tasks stay queued. */
    public void stop() {
        if (!started.compareAndSet(true, false)) return;
        Thread dt = dispatchThread;
        if (dt != null) {
            try { dt.join(5000); } catch (InterruptedException ie) { Thread.currentThread().interrupt(); }
        }
        for (String taskId : new ArrayList<>(running.keySet())) cancel(taskId, "scheduler stopped", false);
        ScheduledExecutorService t = timers;
        if (t != null) t.shutdownNow();
        // the delayed requeues died with the timers; put those tasks back now so a restart dispatches them
        for (ScheduledTask task : new ArrayList<>(awaitingRequeue)) requeue(task);
        allocator.stop();
        LOG.info("Stopped scheduler");
    }

    public boolean isRunning() { return started.get(); }

    @Override
    public void close() {
        stop();
        workers.shutdownNow();
        allocator.close();
        failureSink.close();
    }

    private void runDispatch() {
        long idle = Math.max(1, dispatchIdle.toMillis());
        while (started.get()) {
            try {
                if (running.size() >= maxConcurrentTasks) { sleepQuiet(idle); continue; }
                Optional<ScheduledTask> next = queue.dequeue();
                if (next.isEmpty()) { sleepQuiet(idle); continue; }
                dispatch(next.get());
            } catch (RuntimeException e) {
                LOG.error("Error in dispatch loop", e);
                sleepQuiet(idle);
            }
        }
    }

    private void dispatch(ScheduledTask task) {
        // cancelled while queued; the cancel already settled the counters
        if (!task.markRunning(clock.instant())) return;
        Execution exec = new Execution(task);
        running.put(task.taskId(), exec);
        tracker(task.tenantId()).recordStarted(task.resourceRequirements());
        LOG.debug("Dispatching task {} of tenant {}", task.taskId(), task.tenantId());
        try {
            exec.attach(workers.submit(() -> execute(exec)));
        } catch (RejectedExecutionException e) {
            LOG.error("Worker pool rejected task {}", task.taskId(), e);
            if (task.markFailed(clock.instant(), e.toString())) {
                failedCounter.inc();
                finish(exec, null, false, true);
                failureSink.acceptFailure(task, "worker pool unavailable");
            }
        }
    }

    private void execute(Execution exec) {
        ScheduledTask task = exec.task;
        if (task.status() != TaskStatus.RUNNING) {
            finish(exec, null, false, true);
            return;
        }
        boolean granted;
        Exception failure = null;
        try (AllocationLease lease = allocator.managedAllocation(
                task.tenantId(), task.taskId(), task.resourceRequirements(), task.maxDuration())) {
            exec.attach(lease);
            granted = lease.isGranted();
            if (granted && task.status() == TaskStatus.RUNNING) {
                lease.markRunning();
                try (Timer.Context ignored = executionTimer.time()) {
                    task.work().run();
                } catch (Exception e) {
                    lease.markFailed();
                    failure = e;
                }
            }
        } catch (RuntimeException e) {
            LOG.error("Unexpected error running task {}", task.taskId(), e);
            granted = true;
            failure = e;
        }

        if (!granted) {
            onResourcesUnavailable(exec);
        } else if (failure != null) {
            onFailure(exec, failure);
        } else if (task.markCompleted(clock.instant())) {
            completedCounter.inc();
            finish(exec, task.executionTime().orElse(null), true, true);
            LOG.info("Completed task {} of tenant {} in {} ms", task.taskId(), task.tenantId(),
                    task.executionTime().map(Duration::toMillis).orElse(0L));
        }
        // a cancel that raced dispatch may not have found this execution to settle
        if (task.status() == TaskStatus.CANCELLED) finish(exec, task.executionTime().orElse(null), false, true);
    }

    private void onResourcesUnavailable(Execution exec) {
        ScheduledTask task = exec.task;
        if (!task.markWaitingResources(clock.instant())) return;
        waitingCounter.inc();
        finish(exec, null, false, true);
        LOG.warn("No resources for task {} of tenant {}: {}", task.taskId(), task.tenantId(), task.resourceRequirements());
        failureSink.acceptFailure(task, "resources unavailable");
    }

    private void onFailure(Execution exec, Exception e) {
        ScheduledTask task = exec.task;
        int attempt = task.retryCount() + 1;
        String error = e.toString();
        TenantUsageTracker tracker = tracker(task.tenantId());
        if (task.retryCount() < task.maxRetries() && retryPolicy.shouldRetry(attempt, e)) {
            // count as queued before the status flips so a concurrent cancel finds the count it undoes
            tracker.recordRequeued();
            if (!task.markForRetry(clock.instant(), error)) {
                tracker.recordDequeuedWithoutRun();
                return;
            }
            retriedCounter.inc();
            finish(exec, task.executionTime().orElse(null), false, false);
            long backoff = retryPolicy.backoffMillis(attempt);
            LOG.warn("Task {} of tenant {} failed on attempt {}, retrying in {} ms: {}",
                    task.taskId(), task.tenantId(), attempt, backoff, error);
            scheduleRequeue(task, backoff);
        } else if (task.markFailed(clock.instant(), error)) {
            failedCounter.inc();
            finish(exec, task.executionTime().orElse(null), false, true);
            LOG.error("Task {} of tenant {} failed after {} attempt(s)", task.taskId(), task.tenantId(), attempt, e);
            failureSink.acceptFailure(task, "execution failed after " + attempt + " attempt(s)");
        }
    }

    private void scheduleRequeue(ScheduledTask task, long backoffMillis) {
        awaitingRequeue.add(task);
        ScheduledExecutorService t = timers;
        if (t != null && !t.isShutdown()) {
            try {
                t.schedule(() -> requeue(task), backoffMillis, TimeUnit.MILLISECONDS);
                return;
            } catch (RejectedExecutionException e) {
                LOG.debug("Monitor stopped, requeueing task {} immediately", task.taskId());
            }
        }
        requeue(task);
    }

    private void requeue(ScheduledTask task) {
        // whichever of the timer and stop() gets here first enqueues
        if (!awaitingRequeue.remove(task)) return;
        if (task.status() == TaskStatus.QUEUED) queue.enqueue(task);
    }

    /** One pass of the monitor: fair-share reconciliation, then deadline and max-duration enforcement. */
    void runMonitorCycle() {
        try {
            if (queue instanceof FairShareTaskQueue fair) {
                fair.reconcileDeficits().forEach((tenant, deficit) -> tracker(tenant).setFairShareDeficit(deficit));
            }
            Instant now = clock.instant();
            for (Execution exec : new ArrayList<>(running.values())) {
                ScheduledTask task = exec.task;
                if (task.isPastDeadline(now)) {
                    cancel(task.taskId(), "deadline exceeded", true);
                } else if (task.hasExceededMaxDuration(now)) {
                    cancel(task.taskId(), "max duration " + task.maxDuration() + " exceeded", true);
                }
            }
        } catch (RuntimeException e) {
            LOG.error("Error in scheduler monitor", e);
        }
    }

    private void finish(Execution exec, Duration executionTime, boolean success, boolean terminal) {
        if (!exec.finished.compareAndSet(false, true)) return;
        ScheduledTask task = exec.task;
        TenantUsageTracker tracker = tracker(task.tenantId());
        if (terminal) tracker.recordFinished(task.resourceRequirements(), executionTime, success);
        else tracker.recordRetrying(task.resourceRequirements(), executionTime);
        if (executionTime != null && queue instanceof FairShareTaskQueue fair) {
            fair.recordAllocatedTime(task.tenantId(), executionTime.toNanos() / 1e9);
        }
        if (terminal) remember(task);
        running.remove(task.taskId());
    }

    private void remember(ScheduledTask task) {
        synchronized (completed) {
            completed.addLast(task.taskId());
            while (completed.size() > completedHistory) {
                String evicted = completed.removeFirst();
                tasks.remove(evicted);
            }
        }
    }

    public TenantStats getTenantUsage(String tenantId) {
        return tracker(tenantId).snapshot(getTenantQuota(tenantId));
    }

    public SchedulerStats getSchedulerStats() {
        Map<String, TenantStats> tenants = new TreeMap<>();
        for (TenantUsageTracker t : trackers.values()) {
            tenants.put(t.tenantId(), t.snapshot(getTenantQuota(t.tenantId())));
        }
        int history;
        synchronized (completed) {
            history = completed.size();
        }
        return new SchedulerStats(queue.policy(), started.get(), running.size(), history,
                submittedMeter.getCount(), completedCounter.getCount(), failedCounter.getCount(),
                cancelledCounter.getCount(), retriedCounter.getCount(), waitingCounter.getCount(),
                rejectedMeter.getCount(), queue.stats(), tenants);
    }

    /** Ids of the tasks currently running. */
    public List<String> runningTaskIds() { return new ArrayList<>(running.keySet()); }

    private TenantUsageTracker tracker(String tenantId) {
        return trackers.computeIfAbsent(tenantId, t -> {
            if (queue instanceof FairShareTaskQueue fair) fair.setWeight(t, getTenantQuota(t).fairShareWeight());
            return new TenantUsageTracker(t, clock);
        });
    }

    private static ThreadFactory named(String prefix) {
        AtomicInteger n = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + n.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    private static void sleepQuiet(long millis) {
        try { Thread.sleep(millis); } catch (InterruptedException ie) { Thread.currentThread().interrupt(); }
    }

    /** A dispatched task together with the handles needed to stop it. */
    private static final class Execution {
        final ScheduledTask task;
        final AtomicBoolean finished = new AtomicBoolean(false);
        private Future<?> future;
        private AllocationLease lease;
        private boolean cancelled;

        Execution(ScheduledTask task) { this.task = task; }

        synchronized void attach(Future<?> f) {
            future = f;
            if (cancelled) f.cancel(true);
        }

        synchronized void attach(AllocationLease l) {
            lease = l;
            if (cancelled) l.close();
        }

        synchronized void cancel() {
            cancelled = true;
            if (lease != null) lease.close();
            if (future != null) future.cancel(true);
        }
    }
}
