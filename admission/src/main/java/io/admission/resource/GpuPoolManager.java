package io.admission.resource;

import io.admission.probe.HostProbe;
import io.admission.probe.HostProbe.GpuDevice;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * GPU memory across all devices reported by the probe. A request lands on the device with the most free memory that
 * can hold it, which keeps large contiguous headroom available on the others.
 */
public class GpuPoolManager extends AbstractPoolManager {
    private static final Logger LOG = LoggerFactory.getLogger(GpuPoolManager.class);

    private final HostProbe probe;
    private final Map<Integer, List<ResourceAllocation>> byDevice = new HashMap<>();

    public GpuPoolManager(HostProbe probe, Clock clock) {
        super(ResourceType.GPU, clock);
        this.probe = probe;
    }

    @Override
    public ResourceAllocation allocate(String tenantId, String operationId, double amount, Duration ttl) {
        List<GpuDevice> devices = probe.gpuDevices();
        if (devices.isEmpty()) {
            LOG.warn("No GPU available for {} ({} MB requested)", tenantId, amount);
            return null;
        }
        synchronized (lock) {
            GpuDevice best = null;
            double bestFree = 0.0;
            for (GpuDevice d : devices) {
                double free = d.memoryTotalMb() - sum(byDevice.getOrDefault(d.id(), List.of()));
                if (free + EPSILON < amount) continue;
                if (best == null || free > bestFree) {
                    best = d;
                    bestFree = free;
                }
            }
            if (best == null) {
                LOG.warn("No GPU with {} MB free for {}", amount, tenantId);
                return null;
            }
            ResourceAllocation allocation = newAllocation(tenantId, operationId, amount, ttl, best.id());
            byDevice.computeIfAbsent(best.id(), k -> new ArrayList<>()).add(allocation);
            LOG.info("Allocated {} MB on GPU {} for {}", amount, best.id(), tenantId);
            return allocation;
        }
    }

    @Override
    public boolean release(ResourceAllocation allocation) {
        if (allocation.unitId().isEmpty()) return false;
        synchronized (lock) {
            List<ResourceAllocation> held = byDevice.get(allocation.unitId().getAsInt());
            return held != null && held.remove(allocation);
        }
    }

    @Override
    public PoolStatus status() {
        List<GpuDevice> devices = probe.gpuDevices();
        List<PoolStatus.UnitStatus> units = new ArrayList<>();
        double total = 0.0;
        double allocated = 0.0;
        int active = 0;
        synchronized (lock) {
            for (GpuDevice d : devices) {
                List<ResourceAllocation> held = byDevice.getOrDefault(d.id(), List.of());
                double used = sum(held);
                units.add(new PoolStatus.UnitStatus(d.id(), d.name(), d.memoryTotalMb(), used,
                        Math.max(0.0, d.memoryTotalMb() - used), held.size(), d.load()));
                total += d.memoryTotalMb();
                allocated += used;
                active += held.size();
            }
        }
        return new PoolStatus(type(), !devices.isEmpty(), total, 0.0, allocated, Math.max(0.0, total - allocated), active, units);
    }
}
