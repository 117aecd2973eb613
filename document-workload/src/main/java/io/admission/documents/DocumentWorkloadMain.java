package io.admission.documents;

import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Timer;
import io.admission.error.FileTaskFailureSink;
import io.admission.error.TaskFailureSink;
import io.admission.metrics.Metrics;
import io.admission.probe.JvmHostProbe;
import io.admission.probe.StaticHostProbe;
import io.admission.resource.PoolStatus;
import io.admission.resource.ResourceAllocationSystem;
import io.admission.retry.ExponentialBackoffRetryPolicy;
import io.admission.scheduler.FairScheduler;
import io.admission.scheduler.FairSchedulerBuilder;
import io.admission.scheduler.SchedulerStats;
import io.admission.scheduler.SchedulingPolicy;
import io.admission.scheduler.TenantQuota;
import io.admission.scheduler.TenantStats;
import picocli.CommandLine;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Runs a synthetic multi-tenant document workload through the admission scheduler and prints what happened.
 */
@CommandLine.Command(name = "document-workload", mixinStandardHelpOptions = true,
        description = "Submit document-processing jobs for several tenants through the fair scheduler")
public final class DocumentWorkloadMain implements Callable<Integer> {
    @CommandLine.Option(names = {"-t", "--tenant"}, split = ",", description = "Tenants (comma-separated or repeat option)", defaultValue = "acme,globex,initech")
    List<String> tenants = new ArrayList<>();

    @CommandLine.Option(names = {"-n", "--documents"}, description = "Documents per tenant", defaultValue = "20")
    int documents;

    @CommandLine.Option(names = {"-p", "--policy"}, description = "ROUND_ROBIN, PRIORITY or FAIR_SHARE", defaultValue = "FAIR_SHARE")
    String policy;

    @CommandLine.Option(names = {"-w", "--weight"}, description = "Fair-share weight per tenant, e.g. -w acme=3")
    Map<String, Double> weights = new LinkedHashMap<>();

    @CommandLine.Option(names = {"-c", "--max-concurrent"}, description = "Worker slots", defaultValue = "4")
    int maxConcurrent;

    @CommandLine.Option(names = {"--gpus"}, description = "Number of GPUs to model", defaultValue = "0")
    int gpus;

    @CommandLine.Option(names = {"--gpu-memory-mb"}, description = "Memory per modelled GPU", defaultValue = "8192")
    double gpuMemoryMb;

    @CommandLine.Option(names = {"--gpu-share"}, description = "Fraction of embedding jobs that ask for a GPU", defaultValue = "0.5")
    double gpuShare;

    @CommandLine.Option(names = {"--millis-per-mb"}, description = "Simulated processing time per MB of document", defaultValue = "20")
    long millisPerMb;

    @CommandLine.Option(names = {"--failure-rate"}, description = "Fraction of jobs whose work always fails", defaultValue = "0.05")
    double failureRate;

    @CommandLine.Option(names = {"--timeout-seconds"}, description = "Give up waiting after this long", defaultValue = "120")
    long timeoutSeconds;

    @CommandLine.Option(names = {"--failure-log"}, description = "JSONL file for terminal task failures", defaultValue = "document-workload-out/task_failures.jsonl")
    Path failureLog;

    @CommandLine.Option(names = {"--seed"}, description = "Random seed", defaultValue = "42")
    long seed;

    public static void main(String[] args) {
        int code = new CommandLine(new DocumentWorkloadMain()).execute(args);
        System.exit(code);
    }

    @Override
    public Integer call() throws Exception {
        if (tenants.isEmpty() || documents <= 0) {
            System.err.println("Need at least one tenant and one document");
            return 2;
        }
        SchedulingPolicy schedulingPolicy = SchedulingPolicy.parse(policy);
        MetricRegistry registry = new MetricRegistry();
        Clock clock = Clock.systemUTC();
        var probe = new JvmHostProbe(StaticHostProbe.uniformGpus(gpus, gpuMemoryMb), 500.0);
        var allocator = ResourceAllocationSystem.forHost(probe, 1000.0, clock, Duration.ofSeconds(5), new Metrics(registry));

        try (TaskFailureSink failures = new FileTaskFailureSink(failureLog, clock);
             FairScheduler scheduler = new FairSchedulerBuilder()
                     .allocator(allocator)
                     .policy(schedulingPolicy)
                     .retry(new ExponentialBackoffRetryPolicy(3, 50, 1_000))
                     .maxRetries(2)
                     .failureSink(failures)
                     .metrics(registry)
                     .clock(clock)
                     .maxConcurrentTasks(maxConcurrent)
                     .dispatchIdle(Duration.ofMillis(10))
                     .monitorInterval(Duration.ofMillis(500))
                     .build()) {
            for (String tenant : tenants) {
                scheduler.setTenantQuota(TenantQuota.builder(tenant)
                        .fairShareWeight(weights.getOrDefault(tenant, 1.0))
                        .maxConcurrentTasks(maxConcurrent)
                        .maxQueuedTasks(Math.max(100, documents))
                        .maxTasksPerMinute(Math.max(10, documents * 4))
                        .maxTasksPerHour(Math.max(100, documents * 4))
                        .build());
            }
            scheduler.start();

            DocumentWorkload workload = new DocumentWorkload(scheduler, millisPerMb, failureRate, seed, 100);
            DocumentWorkload.Report report = workload.run(
                    DocumentWorkload.jobsFor(tenants, documents, gpuShare, seed), Duration.ofSeconds(timeoutSeconds));

            print(report, scheduler, registry);
        }
        System.out.println("Failures recorded in " + failureLog);
        return 0;
    }

    private static void print(DocumentWorkload.Report report, FairScheduler scheduler, MetricRegistry registry) {
        SchedulerStats stats = scheduler.getSchedulerStats();
        System.out.println("Policy: " + stats.policy());
        System.out.println("Submitted=" + report.submitted() + " quotaRejections=" + report.quotaRejections()
                + " unsubmitted=" + report.unsubmitted() + " outcome=" + report.byStatus()
                + (report.evicted() > 0 ? " unknown=" + report.evicted() : ""));
        System.out.println("Retried=" + stats.totalRetried());
        Timer exec = registry.timer("scheduler.execution.time");
        System.out.println("Execution p50(ms)=" + fmt(exec.getSnapshot().getMedian() / 1_000_000.0)
                + " p99(ms)=" + fmt(exec.getSnapshot().get99thPercentile() / 1_000_000.0));
        System.out.println("Per-tenant summary:");
        for (TenantStats t : stats.tenants().values()) {
            System.out.println("  " + t.tenantId() + ": weight=" + t.quota().fairShareWeight()
                    + " completed=" + report.completedByTenant().getOrDefault(t.tenantId(), 0)
                    + " avgExec(ms)=" + t.averageExecutionTime().toMillis()
                    + " allocated(s)=" + fmt(t.allocatedSeconds())
                    + " deficit=" + fmt(t.fairShareDeficit()));
        }
        System.out.println("Pools:");
        for (PoolStatus pool : scheduler.allocator().getSystemStatus().pools().values()) {
            System.out.println("  " + pool.type() + ": total=" + fmt(pool.total()) + " " + pool.type().unit()
                    + " free=" + fmt(pool.free()) + " active=" + pool.activeAllocations());
        }
    }

    private static String fmt(double v) { return String.format("%.3f", v); }
}
