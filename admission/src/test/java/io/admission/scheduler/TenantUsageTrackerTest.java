package io.admission.scheduler;

import io.admission.ManualClock;
import io.admission.resource.ResourceType;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class TenantUsageTrackerTest {
    @Test
    void per_minute_limit_rejects_then_rolls_over() {
        ManualClock clock = new ManualClock();
        TenantUsageTracker tracker = new TenantUsageTracker("T", clock);
        TenantQuota quota = TenantQuota.builder("T").maxTasksPerMinute(10).maxQueuedTasks(1000).build();
        for (int i = 0; i < 10; i++) {
            assertTrue(tracker.canScheduleTask(quota).isEmpty(), "submission " + i + " should be accepted");
            tracker.recordSubmitted();
        }
        assertTrue(tracker.canScheduleTask(quota).orElseThrow().contains("per minute"));

        clock.advance(Duration.ofSeconds(59));
        assertTrue(tracker.canScheduleTask(quota).isPresent());
        clock.advance(Duration.ofSeconds(1));
        assertTrue(tracker.canScheduleTask(quota).isEmpty(), "a new minute window opens after 60s");
    }

    @Test
    void hourly_window_is_independent_of_the_minute_window() {
        ManualClock clock = new ManualClock();
        TenantUsageTracker tracker = new TenantUsageTracker("T", clock);
        TenantQuota quota = TenantQuota.builder("T").maxTasksPerMinute(5).maxTasksPerHour(12).maxQueuedTasks(1000).build();
        int accepted = 0;
        for (int minute = 0; minute < 4; minute++) {
            while (tracker.canScheduleTask(quota).isEmpty()) {
                tracker.recordSubmitted();
                accepted++;
            }
            clock.advance(Duration.ofMinutes(1));
        }
        assertEquals(12, accepted);
        assertTrue(tracker.canScheduleTask(quota).orElseThrow().contains("per hour"));
        clock.advance(Duration.ofHours(1));
        assertTrue(tracker.canScheduleTask(quota).isEmpty());
    }

    @Test
    void concurrency_and_queue_limits() {
        TenantUsageTracker tracker = new TenantUsageTracker("T", new ManualClock());
        TenantQuota quota = TenantQuota.builder("T").maxConcurrentTasks(1).maxQueuedTasks(2).build();
        tracker.recordSubmitted();
        tracker.recordSubmitted();
        assertTrue(tracker.canScheduleTask(quota).orElseThrow().contains("queued"));

        tracker.recordStarted(Map.of(ResourceType.CPU, 1.0));
        assertEquals(1, tracker.queuedTasks());
        assertTrue(tracker.canScheduleTask(quota).orElseThrow().contains("concurrent"));

        tracker.recordFinished(Map.of(ResourceType.CPU, 1.0), Duration.ofSeconds(2), true);
        assertTrue(tracker.canScheduleTask(quota).isEmpty());
        assertEquals(0, tracker.runningTasks());
    }

    @Test
    void average_execution_time_uses_recent_history() {
        TenantUsageTracker tracker = new TenantUsageTracker("T", new ManualClock());
        assertEquals(Duration.ZERO, tracker.getAverageExecutionTime());
        for (int i = 0; i < TenantUsageTracker.EXECUTION_HISTORY; i++) {
            tracker.recordStarted(Map.of());
            tracker.recordFinished(Map.of(), Duration.ofSeconds(100), true);
        }
        for (int i = 0; i < TenantUsageTracker.EXECUTION_HISTORY; i++) {
            tracker.recordStarted(Map.of());
            tracker.recordFinished(Map.of(), Duration.ofSeconds(1), true);
        }
        assertEquals(Duration.ofSeconds(1), tracker.getAverageExecutionTime(), "older samples fall out of the window");
        assertEquals(100 * 100 + 100, tracker.allocatedSeconds(), 1e-6);

        TenantStats stats = tracker.snapshot(TenantQuota.defaults("T"));
        assertEquals(200, stats.completedTasks());
        assertEquals(0, stats.failedTasks());
        assertTrue(stats.lastScheduledAt().isPresent());
    }

    @Test
    void resource_usage_follows_running_tasks() {
        TenantUsageTracker tracker = new TenantUsageTracker("T", new ManualClock());
        tracker.recordSubmitted();
        tracker.recordStarted(Map.of(ResourceType.GPU, 512.0, ResourceType.CPU, 1.0));
        assertEquals(512.0, tracker.snapshot(TenantQuota.defaults("T")).resourceUsage().get(ResourceType.GPU), 1e-9);
        tracker.recordFinished(Map.of(ResourceType.GPU, 512.0, ResourceType.CPU, 1.0), null, false);
        TenantStats stats = tracker.snapshot(TenantQuota.defaults("T"));
        assertEquals(0.0, stats.resourceUsage().get(ResourceType.GPU), 1e-9);
        assertEquals(1, stats.failedTasks());
    }

    @Test
    void retried_attempt_frees_resources_without_counting_a_failure() {
        TenantUsageTracker tracker = new TenantUsageTracker("T", new ManualClock());
        tracker.recordSubmitted();
        tracker.recordStarted(Map.of(ResourceType.CPU, 1.0));
        tracker.recordRetrying(Map.of(ResourceType.CPU, 1.0), Duration.ofSeconds(3));
        tracker.recordRequeued();

        TenantStats stats = tracker.snapshot(TenantQuota.defaults("T"));
        assertEquals(0, stats.runningTasks());
        assertEquals(1, stats.queuedTasks());
        assertEquals(0, stats.failedTasks());
        assertEquals(1, stats.retriedAttempts());
        assertEquals(0.0, stats.resourceUsage().get(ResourceType.CPU), 1e-9);
        assertEquals(3.0, stats.allocatedSeconds(), 1e-9);
    }
}
