package io.admission.server;

import com.codahale.metrics.MetricRegistry;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import io.admission.config.AdmissionConfig;
import io.admission.error.FileTaskFailureSink;
import io.admission.error.TaskFailureSink;
import io.admission.grpc.SchedulerAdminServer;
import io.admission.metrics.Metrics;
import io.admission.probe.HostProbe;
import io.admission.probe.JvmHostProbe;
import io.admission.probe.StaticHostProbe;
import io.admission.resource.ResourceAllocationSystem;
import io.admission.retry.ExponentialBackoffRetryPolicy;
import io.admission.retry.RetryPolicy;
import io.admission.scheduler.FairScheduler;
import io.admission.scheduler.FairSchedulerBuilder;

import java.io.IOException;
import java.time.Clock;

public class AdmissionModule extends AbstractModule {
    private final AdmissionConfig config;

    public AdmissionModule(AdmissionConfig config) { this.config = config; }

    @Override
    protected void configure() {
        bind(AdmissionConfig.class).toInstance(config);
    }

    @Provides @Singleton MetricRegistry metricRegistry() { return new MetricRegistry(); }

    @Provides @Singleton Clock clock() { return Clock.systemUTC(); }

    @Provides @Singleton HostProbe hostProbe() {
        return new JvmHostProbe(StaticHostProbe.uniformGpus(config.gpuCount(), config.gpuMemoryMb()), config.diskMbps());
    }

    @Provides @Singleton ResourceAllocationSystem allocator(HostProbe probe, Clock clock, MetricRegistry registry) {
        return ResourceAllocationSystem.forHost(probe, config.networkMbps(), clock, config.reaperInterval(), new Metrics(registry));
    }

    // attempts = first run + retries
    @Provides @Singleton RetryPolicy retryPolicy() {
        return new ExponentialBackoffRetryPolicy(config.maxRetries() + 1, config.retryBaseMillis(), config.retryMaxMillis());
    }

    @Provides @Singleton TaskFailureSink failureSink(Clock clock) throws IOException {
        return new FileTaskFailureSink(config.failureLog(), clock);
    }

    @Provides @Singleton FairScheduler scheduler(ResourceAllocationSystem allocator, RetryPolicy retry, TaskFailureSink failures,
                                                 MetricRegistry registry, Clock clock) {
        return new FairSchedulerBuilder()
                .allocator(allocator)
                .policy(config.policy())
                .retry(retry)
                .failureSink(failures)
                .metrics(registry)
                .clock(clock)
                .maxConcurrentTasks(config.maxConcurrentTasks())
                .maxRetries(config.maxRetries())
                .dispatchIdle(config.dispatchIdle())
                .monitorInterval(config.monitorInterval())
                .completedHistory(config.completedHistory())
                .build();
    }

    @Provides @Singleton SchedulerAdminServer adminServer(FairScheduler scheduler) {
        return new SchedulerAdminServer(config.adminPort(), scheduler);
    }
}
