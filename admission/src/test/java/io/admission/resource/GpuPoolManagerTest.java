package io.admission.resource;

import io.admission.ManualClock;
import io.admission.probe.HostProbe.GpuDevice;
import io.admission.probe.StaticHostProbe;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class GpuPoolManagerTest {
    private static GpuPoolManager twoGpus(double first, double second) {
        var probe = new StaticHostProbe(List.of(new GpuDevice(0, "gpu-0", first, 0.0), new GpuDevice(1, "gpu-1", second, 0.0)), 8, 16384, 500);
        return new GpuPoolManager(probe, new ManualClock());
    }

    @Test
    void places_request_on_device_with_most_headroom() {
        GpuPoolManager pool = twoGpus(4096, 8192);
        ResourceAllocation a = pool.allocate("t1", "op", 2048, null);
        assertNotNull(a);
        assertEquals(1, a.unitId().getAsInt(), "largest free device should be chosen");

        // gpu-1 now has 6144 free vs 4096 on gpu-0
        ResourceAllocation b = pool.allocate("t1", "op", 3000, null);
        assertEquals(1, b.unitId().getAsInt());
        // 3144 left on gpu-1, 4096 on gpu-0
        ResourceAllocation c = pool.allocate("t1", "op", 3500, null);
        assertEquals(0, c.unitId().getAsInt());
    }

    @Test
    void ties_go_to_first_device() {
        GpuPoolManager pool = twoGpus(4096, 4096);
        assertEquals(0, pool.allocate("t1", "op", 1024, null).unitId().getAsInt());
    }

    @Test
    void refuses_request_no_single_device_can_hold() {
        GpuPoolManager pool = twoGpus(4096, 4096);
        assertNull(pool.allocate("t1", "op", 5000, null), "memory is not split across devices");
        PoolStatus status = pool.status();
        assertEquals(8192, status.total(), 1e-9);
        assertEquals(0, status.activeAllocations());
    }

    @Test
    void no_gpus_means_no_allocation() {
        var pool = new GpuPoolManager(new StaticHostProbe(List.of(), 4, 8192, 100), new ManualClock());
        assertNull(pool.allocate("t1", "op", 1, null));
        assertFalse(pool.status().available());
    }

    @Test
    void release_frees_capacity_once() {
        GpuPoolManager pool = twoGpus(1000, 1000);
        ResourceAllocation a = pool.allocate("t1", "op", 1000, Duration.ofMinutes(1));
        ResourceAllocation b = pool.allocate("t1", "op", 1000, null);
        assertNotNull(a);
        assertNotNull(b);
        assertNull(pool.allocate("t1", "op", 1, null));
        assertTrue(pool.release(a));
        assertFalse(pool.release(a));
        assertNotNull(pool.allocate("t1", "op", 1000, null));

        PoolStatus status = pool.status();
        assertEquals(2, status.units().size());
        assertEquals(2000, status.allocated(), 1e-9);
        assertEquals(0, status.free(), 1e-9);
    }
}
