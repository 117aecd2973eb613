package io.admission.grpc;

import io.admission.metrics.Metrics;
import io.admission.probe.StaticHostProbe;
import io.admission.resource.ResourceAllocationSystem;
import io.admission.resource.ResourceType;
import io.admission.scheduler.FairScheduler;
import io.admission.scheduler.FairSchedulerBuilder;
import io.admission.scheduler.TenantQuota;
import io.grpc.ManagedChannel;
import io.grpc.inprocess.InProcessChannelBuilder;
import io.grpc.inprocess.InProcessServerBuilder;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class SchedulerAdminServerTest {
    private FairScheduler scheduler;
    private SchedulerAdminServer server;
    private ManagedChannel channel;
    private SchedulerAdminGrpc.SchedulerAdminBlockingStub stub;

    @BeforeEach
    void setUp() throws Exception {
        var probe = new StaticHostProbe(StaticHostProbe.uniformGpus(2, 4096), 8, 16384, 500);
        var allocator = ResourceAllocationSystem.forHost(probe, 1000, Clock.systemUTC(), Duration.ofSeconds(30), new Metrics(null));
        scheduler = new FairSchedulerBuilder().allocator(allocator).build();
        String name = InProcessServerBuilder.generateName();
        server = new SchedulerAdminServer(InProcessServerBuilder.forName(name).directExecutor(), scheduler);
        server.start();
        channel = InProcessChannelBuilder.forName(name).directExecutor().build();
        stub = SchedulerAdminGrpc.newBlockingStub(channel);
    }

    @AfterEach
    void tearDown() {
        if (channel != null) channel.shutdownNow();
        if (server != null) server.close();
        if (scheduler != null) scheduler.close();
    }

    @Test
    void reports_pools_and_allocations() {
        scheduler.allocator().allocateResources("acme", "op-1", Map.of(ResourceType.GPU, 512.0), null);

        SystemStatusReply status = stub.getSystemStatus(Empty.getDefaultInstance());
        assertEquals(5, status.getPoolsCount());
        assertEquals(1, status.getTotalAllocations());
        assertEquals(1, status.getAllocationsByStatusOrThrow("ALLOCATED"));
        PoolInfo gpu = status.getPoolsList().stream().filter(p -> p.getType().equals("GPU")).findFirst().orElseThrow();
        assertEquals("MB", gpu.getUnit());
        assertEquals(2, gpu.getUnitsCount());
        assertEquals(512.0, gpu.getAllocated(), 1e-9);
    }

    @Test
    void reports_queued_work_per_tenant() throws Exception {
        scheduler.setTenantQuota(TenantQuota.builder("acme").fairShareWeight(2.0).build());
        scheduler.submitTask("acme", () -> {}, Map.of(ResourceType.CPU, 1.0), null);
        scheduler.submitTask("acme", () -> {}, Map.of(ResourceType.CPU, 1.0), null);
        scheduler.submitTask("globex", () -> {}, Map.of(), null);

        SchedulerStatsReply stats = stub.getSchedulerStats(Empty.getDefaultInstance());
        assertEquals("FAIR_SHARE", stats.getPolicy());
        assertFalse(stats.getRunning());
        assertEquals(3, stats.getQueuedTasks());
        assertEquals(3, stats.getTotalSubmitted());
        assertEquals(2, stats.getQueuedByTenantOrThrow("acme"));
        assertEquals(2, stats.getTenantsCount());

        TenantUsageReply usage = stub.getTenantUsage(TenantRequest.newBuilder().setTenantId("acme").build());
        assertEquals(2, usage.getScheduling().getQueuedTasks());
        assertEquals(2.0, usage.getScheduling().getFairShareWeight(), 1e-9);
        assertEquals(2.0, usage.getLimitsOrThrow("CPU"), 1e-9);
        assertEquals(0.0, usage.getCurrentUsageOrThrow("CPU"), 1e-9);
    }

    @Test
    void looks_up_and_cancels_tasks() throws Exception {
        String id = scheduler.submitTask("acme", () -> {}, Map.of(ResourceType.MEMORY, 128.0), null);

        TaskReply task = stub.getTask(TaskRequest.newBuilder().setTaskId(id).build());
        assertTrue(task.getFound());
        assertEquals("acme", task.getTenantId());
        assertEquals("QUEUED", task.getStatus());
        assertEquals(128.0, task.getResourceRequirementsOrThrow("MEMORY"), 1e-9);

        assertTrue(stub.cancelTask(TaskRequest.newBuilder().setTaskId(id).build()).getCancelled());
        assertFalse(stub.cancelTask(TaskRequest.newBuilder().setTaskId(id).build()).getCancelled());
        assertEquals("CANCELLED", stub.getTask(TaskRequest.newBuilder().setTaskId(id).build()).getStatus());

        assertFalse(stub.getTask(TaskRequest.newBuilder().setTaskId("missing").build()).getFound());
    }

    @Test
    void health_follows_scheduler_lifecycle() {
        assertTrue(stub.health(Empty.getDefaultInstance()).getReady());
        assertFalse(stub.health(Empty.getDefaultInstance()).getRunning());
        scheduler.start();
        assertTrue(stub.health(Empty.getDefaultInstance()).getRunning());
    }
}
