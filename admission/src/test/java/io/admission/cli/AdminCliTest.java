package io.admission.cli;

import io.admission.grpc.SchedulerAdminGrpc;
import io.admission.grpc.SchedulerAdminServer;
import io.admission.metrics.Metrics;
import io.admission.probe.StaticHostProbe;
import io.admission.resource.ResourceAllocationSystem;
import io.admission.scheduler.FairScheduler;
import io.admission.scheduler.FairSchedulerBuilder;
import io.grpc.ManagedChannel;
import io.grpc.ManagedChannelBuilder;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class AdminCliTest {
    private FairScheduler scheduler;
    private SchedulerAdminServer server;
    private ManagedChannel channel;
    private SchedulerAdminGrpc.SchedulerAdminBlockingStub stub;
    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    @BeforeEach
    void setUp() throws Exception {
        var probe = new StaticHostProbe(List.of(), 4, 4096, 200);
        var allocator = ResourceAllocationSystem.forHost(probe, 100, Clock.systemUTC(), Duration.ofSeconds(30), new Metrics(null));
        scheduler = new FairSchedulerBuilder().allocator(allocator).build();
        server = new SchedulerAdminServer(0, scheduler);
        server.start();
        channel = ManagedChannelBuilder.forAddress("127.0.0.1", server.port()).usePlaintext().build();
        stub = SchedulerAdminGrpc.newBlockingStub(channel);
    }

    @AfterEach
    void tearDown() {
        if (channel != null) channel.shutdownNow();
        if (server != null) server.close();
        if (scheduler != null) scheduler.close();
    }

    private int run(String... args) throws Exception {
        return AdminCli.run(stub, args, new PrintStream(out, true, StandardCharsets.UTF_8), new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    @Test
    void prints_health_as_json() throws Exception {
        assertEquals(0, run("health"));
        assertEquals("{\"ready\":true,\"running\":false}", out.toString(StandardCharsets.UTF_8).trim());
    }

    @Test
    void prints_task_and_cancels_it() throws Exception {
        String id = scheduler.submitTask("acme", () -> {}, Map.of(), null);
        assertEquals(0, run("task", id));
        assertTrue(out.toString(StandardCharsets.UTF_8).contains("\"status\":\"QUEUED\""));
        assertEquals(0, run("cancel", id));
        assertTrue(out.toString(StandardCharsets.UTF_8).contains("\"cancelled\":true"));
    }

    @Test
    void rejects_bad_usage() throws Exception {
        assertEquals(2, run("tenant"));
        assertTrue(err.toString(StandardCharsets.UTF_8).contains("tenant id"));
        assertEquals(2, run("bogus"));
        assertTrue(err.toString(StandardCharsets.UTF_8).contains("Usage"));
    }
}
