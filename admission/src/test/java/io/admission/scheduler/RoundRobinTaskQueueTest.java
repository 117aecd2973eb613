package io.admission.scheduler;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static io.admission.scheduler.TaskFixtures.task;
import static org.junit.jupiter.api.Assertions.*;

public class RoundRobinTaskQueueTest {
    @Test
    void cycles_tenants_regardless_of_submission_skew() {
        RoundRobinTaskQueue q = new RoundRobinTaskQueue();
        // each tenant submits its ten tasks back to back
        for (String tenant : List.of("A", "B", "C")) {
            for (int i = 0; i < 10; i++) q.enqueue(task(tenant, TaskPriority.NORMAL));
        }
        List<String> order = new ArrayList<>();
        while (q.size() > 0) order.add(q.dequeue().orElseThrow().tenantId());
        assertEquals(30, order.size());
        for (int i = 0; i < order.size(); i++) {
            assertEquals(List.of("A", "B", "C").get(i % 3), order.get(i), "position " + i + " in " + order);
        }
        assertTrue(q.dequeue().isEmpty());
    }

    @Test
    void skips_tenants_with_nothing_queued() {
        RoundRobinTaskQueue q = new RoundRobinTaskQueue();
        q.enqueue(task("A", TaskPriority.NORMAL));
        q.enqueue(task("A", TaskPriority.NORMAL));
        q.enqueue(task("A", TaskPriority.NORMAL));
        q.enqueue(task("B", TaskPriority.NORMAL));
        q.enqueue(task("C", TaskPriority.NORMAL));
        List<String> order = new ArrayList<>();
        while (q.size() > 0) order.add(q.dequeue().orElseThrow().tenantId());
        assertEquals(List.of("A", "B", "C", "A", "A"), order);
    }

    @Test
    void priority_does_not_let_a_tenant_jump_its_turn() {
        RoundRobinTaskQueue q = new RoundRobinTaskQueue();
        q.enqueue(task("A", TaskPriority.LOW));
        q.enqueue(task("B", TaskPriority.EMERGENCY));
        q.enqueue(task("B", TaskPriority.EMERGENCY));
        assertEquals("A", q.dequeue().orElseThrow().tenantId());
        assertEquals("B", q.dequeue().orElseThrow().tenantId());
    }

    @Test
    void removes_a_queued_task_by_id() {
        RoundRobinTaskQueue q = new RoundRobinTaskQueue();
        ScheduledTask a = task("A", TaskPriority.NORMAL);
        ScheduledTask b = task("B", TaskPriority.NORMAL);
        q.enqueue(a);
        q.enqueue(b);
        assertTrue(q.remove(a.taskId()));
        assertFalse(q.remove(a.taskId()));
        assertEquals(1, q.size());
        assertEquals(b, q.dequeue().orElseThrow());

        QueueStats stats = q.stats();
        assertEquals(SchedulingPolicy.ROUND_ROBIN, stats.policy());
        assertEquals(0, stats.totalQueued());
    }
}
