package io.admission.resource;

import io.admission.ManualClock;
import io.admission.probe.StaticHostProbe;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class HostPoolManagerTest {
    @Test
    void memory_reserve_is_twenty_percent_capped_at_one_gigabyte() {
        var small = HostPoolManager.memory(new StaticHostProbe(List.of(), 4, 2000, 100), new ManualClock());
        assertEquals(400, small.status().reserved(), 1e-9);
        assertEquals(1600, small.status().free(), 1e-9);

        var large = HostPoolManager.memory(new StaticHostProbe(List.of(), 4, 32768, 100), new ManualClock());
        assertEquals(1024, large.status().reserved(), 1e-9);
    }

    @Test
    void reserve_is_never_handed_out() {
        var mem = HostPoolManager.memory(new StaticHostProbe(List.of(), 4, 2000, 100), new ManualClock());
        assertNull(mem.allocate("t", "op", 1601, null));
        ResourceAllocation a = mem.allocate("t", "op", 1600, null);
        assertNotNull(a);
        assertFalse(a.unitId().isPresent());
        assertNull(mem.allocate("t", "op", 1, null));
    }

    @Test
    void cpu_capacity_counts_every_held_allocation() {
        var cpu = HostPoolManager.cpu(new StaticHostProbe(List.of(), 4, 8192, 100), new ManualClock());
        // fresh allocations are PENDING and still count against the pool
        assertNotNull(cpu.allocate("a", "op1", 2.5, null));
        assertNotNull(cpu.allocate("b", "op2", 1.5, null));
        assertNull(cpu.allocate("c", "op3", 0.5, null));
        PoolStatus status = cpu.status();
        assertEquals(4.0, status.allocated(), 1e-9);
        assertEquals(2, status.activeAllocations());
        assertEquals(ResourceType.CPU, status.type());
    }

    @Test
    void network_pool_uses_configured_throughput() {
        var net = HostPoolManager.networkIo(250, new ManualClock());
        assertNotNull(net.allocate("t", "op", 250, null));
        assertNull(net.allocate("t", "op", 0.001, null));
        assertEquals(0.0, net.status().reserved(), 1e-9);
    }
}
