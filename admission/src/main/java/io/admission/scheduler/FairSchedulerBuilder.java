package io.admission.scheduler;

import com.codahale.metrics.MetricRegistry;
import io.admission.error.TaskFailureSink;
import io.admission.metrics.Metrics;
import io.admission.resource.ResourceAllocationSystem;
import io.admission.retry.ExponentialBackoffRetryPolicy;
import io.admission.retry.RetryPolicy;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;

public class FairSchedulerBuilder {
    private ResourceAllocationSystem allocator;
    private SchedulingPolicy policy = SchedulingPolicy.FAIR_SHARE;
    private RetryPolicy retryPolicy = new ExponentialBackoffRetryPolicy(3, 1000, 30_000);
    private TaskFailureSink failureSink = TaskFailureSink.noop();
    private MetricRegistry metricRegistry = new MetricRegistry();
    private Clock clock = Clock.systemUTC();
    private int maxConcurrentTasks = 10;
    private int maxRetries = 3;
    private Duration dispatchIdle = Duration.ofMillis(100);
    private Duration monitorInterval = Duration.ofSeconds(5);
    private int completedHistory = 10_000;

    public FairSchedulerBuilder allocator(ResourceAllocationSystem a) { this.allocator = a; return this; }
    public FairSchedulerBuilder policy(SchedulingPolicy p) { this.policy = p; return this; }
    public FairSchedulerBuilder retry(RetryPolicy r) { this.retryPolicy = r; return this; }
    public FairSchedulerBuilder failureSink(TaskFailureSink s) { this.failureSink = s; return this; }
    public FairSchedulerBuilder metrics(MetricRegistry r) { this.metricRegistry = r; return this; }
    public FairSchedulerBuilder clock(Clock c) { this.clock = c; return this; }
    public FairSchedulerBuilder maxConcurrentTasks(int n) { this.maxConcurrentTasks = Math.max(1, n); return this; }
    public FairSchedulerBuilder maxRetries(int n) { this.maxRetries = Math.max(0, n); return this; }
    public FairSchedulerBuilder dispatchIdle(Duration d) { this.dispatchIdle = d; return this; }
    public FairSchedulerBuilder monitorInterval(Duration d) { this.monitorInterval = d; return this; }
    public FairSchedulerBuilder completedHistory(int n) { this.completedHistory = Math.max(1, n); return this; }

    public FairScheduler build() {
        Objects.requireNonNull(allocator, "allocator");
        Objects.requireNonNull(policy, "policy");
        Objects.requireNonNull(retryPolicy, "retryPolicy");
        return new FairScheduler(allocator, policy, retryPolicy, failureSink, new Metrics(metricRegistry), clock,
                maxConcurrentTasks, maxRetries, dispatchIdle, monitorInterval, completedHistory);
    }
}
