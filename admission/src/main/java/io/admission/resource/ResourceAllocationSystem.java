package io.admission.resource;

import com.codahale.metrics.Meter;
import io.admission.metrics.Metrics;
import io.admission.probe.HostProbe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Multi-resource allocation over a set of pool managers.
 * <p>
 * A request either gets every resource it names or none of them: when one pool refuses, the grants already taken from
 * the other pools are handed back before the call returns, and the caller sees a map of nulls. Successful grants are
 * recorded in an allocation index and charged to the tenant until released, either explicitly or by the reaper once
 * they pass their expiry.
 */
public class ResourceAllocationSystem implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(ResourceAllocationSystem.class);

    private final Map<ResourceType, ResourcePoolManager> pools = new EnumMap<>(ResourceType.class);
    private final Clock clock;
    private final Duration reaperInterval;

    // guards tenantLimits, tenantUsage and index
    private final Object lock = new Object();
    // serialises whole allocate transactions so concurrent requests from one tenant cannot both pass its ceiling
    private final Object transactionLock = new Object();
    private final Map<String, ResourceLimits> tenantLimits = new HashMap<>();
    private final Map<String, EnumMap<ResourceType, Double>> tenantUsage = new HashMap<>();
    private final Map<String, ResourceAllocation> index = new LinkedHashMap<>();

    private final Meter grantMeter;
    private final Meter denyMeter;
    private final Meter expiredMeter;

    private volatile ScheduledExecutorService reaper;

    public ResourceAllocationSystem(List<ResourcePoolManager> pools, Clock clock, Duration reaperInterval, Metrics metrics) {
        for (ResourcePoolManager pool : pools) {
            if (this.pools.putIfAbsent(pool.type(), pool) != null) {
                throw new IllegalArgumentException("Duplicate pool for " + pool.type());
            }
        }
        this.clock = clock == null ? Clock.systemUTC() : clock;
        this.reaperInterval = reaperInterval == null ? Duration.ofSeconds(30) : reaperInterval;
        Metrics m = metrics == null ? new Metrics(null) : metrics;
        this.grantMeter = m.meter("allocator.grants");
        this.denyMeter = m.meter("allocator.denials");
        this.expiredMeter = m.meter("allocator.expired");
        for (ResourcePoolManager pool : this.pools.values()) {
            String prefix = "allocator.pool." + pool.type().name().toLowerCase();
            m.gauge(prefix + ".free", () -> pool.status().free());
            m.gauge(prefix + ".allocated", () -> pool.status().allocated());
        }
        m.gauge("allocator.allocations.active", this::activeAllocationCount);
    }

    /** The standard five pools over one host. */
    public static ResourceAllocationSystem forHost(HostProbe probe, double networkMbps, Clock clock,
                                                   Duration reaperInterval, Metrics metrics) {
        List<ResourcePoolManager> pools = List.of(
                new GpuPoolManager(probe, clock),
                HostPoolManager.cpu(probe, clock),
                HostPoolManager.memory(probe, clock),
                HostPoolManager.diskIo(probe, clock),
                HostPoolManager.networkIo(networkMbps, clock));
        return new ResourceAllocationSystem(pools, clock, reaperInterval, metrics);
    }

    public void setTenantLimits(String tenantId, ResourceLimits limits) {
        synchronized (lock) {
            tenantLimits.put(tenantId, limits);
        }
        LOG.info("Set resource limits for tenant {}", tenantId);
    }

    public ResourceLimits getTenantLimits(String tenantId) {
        synchronized (lock) {
            return tenantLimits.getOrDefault(tenantId, ResourceLimits.defaults());
        }
    }

    /**
     * Allocate every resource in {@code requirements}, or nothing.
     *
     * @param ttl lifetime of each allocation; null for allocations that only end on release
     * @return one entry per requested type; all values are null if any type could not be granted
     */
    public Map<ResourceType, ResourceAllocation> allocateResources(String tenantId, String operationId,
                                                                   Map<ResourceType, Double> requirements, Duration ttl) {
        Map<ResourceType, ResourceAllocation> result = new EnumMap<>(ResourceType.class);
        if (requirements.isEmpty()) return result;

        synchronized (transactionLock) {
            ResourceLimits limits = getTenantLimits(tenantId);
            List<ResourceAllocation> taken = new ArrayList<>();
            ResourceType failedType = null;
            for (Map.Entry<ResourceType, Double> e : requirements.entrySet()) {
                ResourceType type = e.getKey();
                double amount = e.getValue() == null ? 0.0 : e.getValue();
                if (amount <= 0.0) {
                    LOG.warn("Rejecting non-positive {} request of {} for {}", type, amount, tenantId);
                    failedType = type;
                    break;
                }
                double inUse = currentUsage(tenantId, type);
                if (inUse + amount > limits.limitFor(type) + AbstractPoolManager.EPSILON) {
                    LOG.warn("Request exceeds tenant limit: {} {} {} (in use {}, limit {})",
                            tenantId, type, amount, inUse, limits.limitFor(type));
                    failedType = type;
                    break;
                }
                ResourcePoolManager pool = pools.get(type);
                ResourceAllocation allocation = pool == null ? null : pool.allocate(tenantId, operationId, amount, ttl);
                if (allocation == null) {
                    failedType = type;
                    break;
                }
                taken.add(allocation);
            }

            if (failedType != null) {
                for (ResourceAllocation a : taken) {
                    pools.get(a.resourceType()).release(a);
                    a.transitionTo(AllocationStatus.FAILED);
                }
                denyMeter.mark();
                LOG.warn("Could not allocate {} for {} ({}); released {} partial grant(s)",
                        failedType, tenantId, operationId, taken.size());
                for (ResourceType type : requirements.keySet()) result.put(type, null);
                return result;
            }

            synchronized (lock) {
                EnumMap<ResourceType, Double> usage = tenantUsage.computeIfAbsent(tenantId, k -> new EnumMap<>(ResourceType.class));
                for (ResourceAllocation a : taken) {
                    a.transitionTo(AllocationStatus.ALLOCATED);
                    index.put(a.allocationId(), a);
                    usage.merge(a.resourceType(), a.allocatedAmount(), Double::sum);
                    result.put(a.resourceType(), a);
                }
            }
        }
        grantMeter.mark();
        LOG.info("Allocated {} for {} ({})", result.keySet(), tenantId, operationId);
        return result;
    }

    /** Allocate and wrap the result in a lease that releases everything on close. */
    public AllocationLease managedAllocation(String tenantId, String operationId,
                                             Map<ResourceType, Double> requirements, Duration ttl) {
        return new AllocationLease(this, allocateResources(tenantId, operationId, requirements, ttl));
    }

    /**
     * Release an allocation. Safe to call more than once: only the first call frees capacity.
     *
     * @return false if the id is unknown, e.g. already released or reaped
     */
    public boolean releaseAllocation(String allocationId) {
        return release(allocationId, AllocationStatus.COMPLETED);
    }

    boolean release(String allocationId, AllocationStatus terminal) {
        ResourceAllocation allocation;
        synchronized (lock) {
            allocation = index.remove(allocationId);
            if (allocation == null) {
                LOG.warn("Allocation {} not found", allocationId);
                return false;
            }
            EnumMap<ResourceType, Double> usage = tenantUsage.get(allocation.tenantId());
            if (usage != null) {
                usage.computeIfPresent(allocation.resourceType(), (k, v) -> Math.max(0.0, v - allocation.allocatedAmount()));
            }
        }
        allocation.transitionTo(terminal);
        ResourcePoolManager pool = pools.get(allocation.resourceType());
        boolean released = pool != null && pool.release(allocation);
        if (released) {
            LOG.info("Released allocation {} as {}", allocationId, terminal);
        } else {
            LOG.warn("Pool {} no longer held allocation {}", allocation.resourceType(), allocationId);
        }
        return released;
    }

    /**
     * Release every active allocation whose expiry has passed.
     *
     * @return number of allocations reclaimed
     */
    public int reapExpired() {
        Instant now = clock.instant();
        List<String> expired = new ArrayList<>();
        synchronized (lock) {
            for (ResourceAllocation a : index.values()) {
                if (a.status().isActive() && a.isExpired(now)) expired.add(a.allocationId());
            }
        }
        int reaped = 0;
        for (String id : expired) {
            if (release(id, AllocationStatus.EXPIRED)) {
                reaped++;
                expiredMeter.mark();
                LOG.info("Released expired allocation {}", id);
            }
        }
        return reaped;
    }

    public synchronized void start() {
        if (reaper != null) return;
        reaper = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "allocation-reaper");
            t.setDaemon(true);
            return t;
        });
        long millis = Math.max(1, reaperInterval.toMillis());
        reaper.scheduleWithFixedDelay(this::reapQuietly, millis, millis, TimeUnit.MILLISECONDS);
        LOG.info("Started allocation reaper every {} ms", millis);
    }

    public synchronized void stop() {
        if (reaper == null) return;
        reaper.shutdownNow();
        reaper = null;
        LOG.info("Stopped allocation reaper");
    }

    public boolean isReaperRunning() { return reaper != null; }

    private void reapQuietly() {
        try {
            reapExpired();
        } catch (RuntimeException e) {
            // an exception would cancel the periodic task
            LOG.error("Error in allocation reaper", e);
        }
    }

    public Optional<ResourceAllocation> getAllocation(String allocationId) {
        synchronized (lock) {
            return Optional.ofNullable(index.get(allocationId));
        }
    }

    public SystemStatus getSystemStatus() {
        Map<ResourceType, PoolStatus> poolStatus = new EnumMap<>(ResourceType.class);
        for (ResourcePoolManager pool : pools.values()) poolStatus.put(pool.type(), pool.status());
        Map<AllocationStatus, Integer> byStatus = new EnumMap<>(AllocationStatus.class);
        for (AllocationStatus s : AllocationStatus.values()) byStatus.put(s, 0);
        int total;
        synchronized (lock) {
            total = index.size();
            for (ResourceAllocation a : index.values()) byStatus.merge(a.status(), 1, Integer::sum);
        }
        return new SystemStatus(poolStatus, total, byStatus);
    }

    public TenantResourceUsage getTenantUsage(String tenantId) {
        ResourceLimits limits = getTenantLimits(tenantId);
        Map<ResourceType, Double> usage = new EnumMap<>(ResourceType.class);
        int active = 0;
        int total = 0;
        synchronized (lock) {
            for (ResourceType t : ResourceType.values()) usage.put(t, 0.0);
            EnumMap<ResourceType, Double> current = tenantUsage.get(tenantId);
            if (current != null) usage.putAll(current);
            for (ResourceAllocation a : index.values()) {
                if (!a.tenantId().equals(tenantId)) continue;
                total++;
                if (a.status().isActive()) active++;
            }
        }
        return new TenantResourceUsage(tenantId, limits, usage, active, total);
    }

    private double currentUsage(String tenantId, ResourceType type) {
        synchronized (lock) {
            EnumMap<ResourceType, Double> usage = tenantUsage.get(tenantId);
            return usage == null ? 0.0 : usage.getOrDefault(type, 0.0);
        }
    }

    private int activeAllocationCount() {
        synchronized (lock) {
            return index.size();
        }
    }

    @Override
    public void close() {
        stop();
    }
}
