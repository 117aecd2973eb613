package io.admission.grpc;

import io.admission.resource.PoolStatus;
import io.admission.resource.ResourceLimits;
import io.admission.resource.ResourceType;
import io.admission.resource.SystemStatus;
import io.admission.resource.TenantResourceUsage;
import io.admission.scheduler.FairScheduler;
import io.admission.scheduler.QueueStats;
import io.admission.scheduler.ScheduledTask;
import io.admission.scheduler.SchedulerStats;
import io.admission.scheduler.TenantStats;
import io.grpc.Server;
import io.grpc.ServerBuilder;
import io.grpc.protobuf.services.ProtoReflectionService;
import io.grpc.stub.StreamObserver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/** gRPC admin surface over a running {@link FairScheduler}. */
public class SchedulerAdminServer implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(SchedulerAdminServer.class);

    private final Server server;

    public SchedulerAdminServer(int port, FairScheduler scheduler) {
        this(ServerBuilder.forPort(port), scheduler);
    }

    SchedulerAdminServer(ServerBuilder<?> builder, FairScheduler scheduler) {
        this.server = builder
                .addService(new ServiceImpl(scheduler))
                .addService(ProtoReflectionService.newInstance())
                .build();
    }

    public void start() throws IOException {
        server.start();
        LOG.info("Scheduler admin listening on port {}", server.getPort());
    }

    public int port() { return server.getPort(); }

    @Override
    public void close() { server.shutdownNow(); }

    static class ServiceImpl extends SchedulerAdminGrpc.SchedulerAdminImplBase {
        private final FairScheduler scheduler;

        ServiceImpl(FairScheduler scheduler) { this.scheduler = scheduler; }

        @Override
        public void getSystemStatus(Empty request, StreamObserver<SystemStatusReply> responseObserver) {
            SystemStatus status = scheduler.allocator().getSystemStatus();
            SystemStatusReply.Builder b = SystemStatusReply.newBuilder()
                    .setTotalAllocations(status.totalAllocations());
            for (PoolStatus pool : status.pools().values()) b.addPools(toPoolInfo(pool));
            status.allocationsByStatus().forEach((s, n) -> b.putAllocationsByStatus(s.name(), n));
            responseObserver.onNext(b.build());
            responseObserver.onCompleted();
        }

        @Override
        public void getSchedulerStats(Empty request, StreamObserver<SchedulerStatsReply> responseObserver) {
            SchedulerStats stats = scheduler.getSchedulerStats();
            QueueStats queue = stats.queue();
            SchedulerStatsReply.Builder b = SchedulerStatsReply.newBuilder()
                    .setPolicy(stats.policy().name())
                    .setRunning(stats.running())
                    .setRunningTasks(stats.runningTasks())
                    .setQueuedTasks(queue.totalQueued())
                    .setCompletedInHistory(stats.completedTasksInHistory())
                    .setTotalSubmitted(stats.totalSubmitted())
                    .setTotalCompleted(stats.totalCompleted())
                    .setTotalFailed(stats.totalFailed())
                    .setTotalCancelled(stats.totalCancelled())
                    .setTotalRetried(stats.totalRetried())
                    .setTotalWaitingResources(stats.totalWaitingResources())
                    .setTotalRejected(stats.totalRejected())
                    .putAllQueuedByTenant(queue.queuedByTenant())
                    .putAllDeficits(queue.deficits());
            queue.queuedByPriority().forEach((p, n) -> b.putQueuedByPriority(p.name(), n));
            for (TenantStats t : stats.tenants().values()) b.addTenants(toTenantInfo(t));
            responseObserver.onNext(b.build());
            responseObserver.onCompleted();
        }

        @Override
        public void getTenantUsage(TenantRequest request, StreamObserver<TenantUsageReply> responseObserver) {
            String tenant = request.getTenantId();
            TenantResourceUsage usage = scheduler.allocator().getTenantUsage(tenant);
            TenantUsageReply.Builder b = TenantUsageReply.newBuilder()
                    .setTenantId(tenant)
                    .setActiveAllocations(usage.activeAllocations())
                    .setTotalAllocations(usage.totalAllocations())
                    .setScheduling(toTenantInfo(scheduler.getTenantUsage(tenant)));
            usage.currentUsage().forEach((type, amount) -> b.putCurrentUsage(type.name(), amount));
            ResourceLimits limits = usage.limits();
            for (ResourceType type : ResourceType.values()) b.putLimits(type.name(), limits.limitFor(type));
            responseObserver.onNext(b.build());
            responseObserver.onCompleted();
        }

        @Override
        public void getTask(TaskRequest request, StreamObserver<TaskReply> responseObserver) {
            Optional<ScheduledTask> found = scheduler.getTask(request.getTaskId());
            TaskReply.Builder b = TaskReply.newBuilder().setTaskId(request.getTaskId()).setFound(found.isPresent());
            found.ifPresent(t -> {
                b.setTenantId(t.tenantId())
                        .setPriority(t.priority().name())
                        .setStatus(t.status().name())
                        .setRetryCount(t.retryCount())
                        .setMaxRetries(t.maxRetries())
                        .setSubmittedAtMs(t.submittedAt().toEpochMilli())
                        .setStartedAtMs(t.startedAt().map(Instant::toEpochMilli).orElse(0L))
                        .setCompletedAtMs(t.completedAt().map(Instant::toEpochMilli).orElse(0L))
                        .setExecutionTimeMs(t.executionTime().map(Duration::toMillis).orElse(0L));
                if (t.lastError() != null) b.setLastError(t.lastError());
                t.resourceRequirements().forEach((type, amount) -> b.putResourceRequirements(type.name(), amount));
            });
            responseObserver.onNext(b.build());
            responseObserver.onCompleted();
        }

        @Override
        public void cancelTask(TaskRequest request, StreamObserver<CancelReply> responseObserver) {
            boolean cancelled = scheduler.cancelTask(request.getTaskId());
            responseObserver.onNext(CancelReply.newBuilder().setCancelled(cancelled).build());
            responseObserver.onCompleted();
        }

        @Override
        public void health(Empty request, StreamObserver<HealthStatus> responseObserver) {
            HealthStatus hs = HealthStatus.newBuilder()
                    .setReady(true)
                    .setRunning(scheduler.isRunning())
                    .build();
            responseObserver.onNext(hs);
            responseObserver.onCompleted();
        }

        private static PoolInfo toPoolInfo(PoolStatus pool) {
            PoolInfo.Builder b = PoolInfo.newBuilder()
                    .setType(pool.type().name())
                    .setUnit(pool.type().unit())
                    .setAvailable(pool.available())
                    .setTotal(pool.total())
                    .setReserved(pool.reserved())
                    .setAllocated(pool.allocated())
                    .setFree(pool.free())
                    .setActiveAllocations(pool.activeAllocations());
            for (PoolStatus.UnitStatus u : pool.units()) {
                b.addUnits(UnitInfo.newBuilder()
                        .setId(u.id())
                        .setName(u.name())
                        .setCapacity(u.capacity())
                        .setAllocated(u.allocated())
                        .setFree(u.free())
                        .setActiveAllocations(u.activeAllocations())
                        .setLoad(u.load()));
            }
            return b.build();
        }

        private static TenantInfo toTenantInfo(TenantStats t) {
            return TenantInfo.newBuilder()
                    .setTenantId(t.tenantId())
                    .setRunningTasks(t.runningTasks())
                    .setQueuedTasks(t.queuedTasks())
                    .setTasksThisMinute(t.tasksThisMinute())
                    .setTasksThisHour(t.tasksThisHour())
                    .setCompletedTasks(t.completedTasks())
                    .setFailedTasks(t.failedTasks())
                    .setRetriedAttempts(t.retriedAttempts())
                    .setAverageExecutionMs(t.averageExecutionTime().toMillis())
                    .setAllocatedSeconds(t.allocatedSeconds())
                    .setFairShareDeficit(t.fairShareDeficit())
                    .setFairShareWeight(t.quota().fairShareWeight())
                    .setMaxConcurrentTasks(t.quota().maxConcurrentTasks())
                    .setMaxQueuedTasks(t.quota().maxQueuedTasks())
                    .build();
        }
    }
}
