package io.admission.resource;

import io.admission.probe.HostProbe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.function.DoubleSupplier;
import java.util.function.DoubleUnaryOperator;

/**
 * A pool with a single implicit unit, the whole host. A reserve computed from the total is never handed out.
 */
public class HostPoolManager extends AbstractPoolManager {
    private static final Logger LOG = LoggerFactory.getLogger(HostPoolManager.class);

    /** Memory kept back for the host: 20% of total, at most 1 GB. */
    public static final DoubleUnaryOperator MEMORY_RESERVE = total -> Math.min(total * 0.2, 1024.0);
    public static final DoubleUnaryOperator NO_RESERVE = total -> 0.0;

    private final DoubleSupplier totalSupplier;
    private final DoubleUnaryOperator reserve;
    private final List<ResourceAllocation> held = new ArrayList<>();

    public HostPoolManager(ResourceType type, DoubleSupplier totalSupplier, DoubleUnaryOperator reserve, Clock clock) {
        super(type, clock);
        this.totalSupplier = totalSupplier;
        this.reserve = reserve == null ? NO_RESERVE : reserve;
    }

    public static HostPoolManager cpu(HostProbe probe, Clock clock) {
        return new HostPoolManager(ResourceType.CPU, () -> probe.cpu().totalCores(), NO_RESERVE, clock);
    }

    public static HostPoolManager memory(HostProbe probe, Clock clock) {
        return new HostPoolManager(ResourceType.MEMORY, () -> probe.memory().totalMb(), MEMORY_RESERVE, clock);
    }

    public static HostPoolManager diskIo(HostProbe probe, Clock clock) {
        return new HostPoolManager(ResourceType.DISK_IO, () -> probe.disk().maxThroughputMbps(), NO_RESERVE, clock);
    }

    public static HostPoolManager networkIo(double maxThroughputMbps, Clock clock) {
        return new HostPoolManager(ResourceType.NETWORK_IO, () -> maxThroughputMbps, NO_RESERVE, clock);
    }

    @Override
    public ResourceAllocation allocate(String tenantId, String operationId, double amount, Duration ttl) {
        double total = totalSupplier.getAsDouble();
        double reserved = reserve.applyAsDouble(total);
        synchronized (lock) {
            double free = total - reserved - sum(held);
            if (free + EPSILON < amount) {
                LOG.warn("Not enough {} for {}: requested {} {}, free {}", type(), tenantId, amount, type().unit(), String.format("%.2f", free));
                return null;
            }
            ResourceAllocation allocation = newAllocation(tenantId, operationId, amount, ttl, null);
            held.add(allocation);
            LOG.info("Allocated {} {} {} for {}", amount, type().unit(), type(), tenantId);
            return allocation;
        }
    }

    @Override
    public boolean release(ResourceAllocation allocation) {
        synchronized (lock) {
            return held.remove(allocation);
        }
    }

    @Override
    public PoolStatus status() {
        double total = totalSupplier.getAsDouble();
        double reserved = reserve.applyAsDouble(total);
        double allocated;
        int active;
        synchronized (lock) {
            allocated = sum(held);
            active = held.size();
        }
        double free = Math.max(0.0, total - reserved - allocated);
        return new PoolStatus(type(), total > 0, total, reserved, allocated, free, active, List.of());
    }
}
