package io.admission.resource;

import java.time.Duration;
import java.util.Objects;

/**
 * Per-tenant resource ceilings. GPU and CPU time budgets are reported alongside usage but not enforced.
 */
public record ResourceLimits(
        double maxGpuMemoryMb,
        double maxGpuTimeSeconds,
        double maxCpuCores,
        double maxCpuTimeSeconds,
        double maxMemoryMb,
        double maxDiskIoMbps,
        double maxNetworkIoMbps,
        Duration maxOperationDuration
) {
    public ResourceLimits {
        Objects.requireNonNull(maxOperationDuration, "maxOperationDuration");
    }

    public static ResourceLimits defaults() {
        return new ResourceLimits(1024.0, 300.0, 2.0, 600.0, 2048.0, 100.0, 100.0, Duration.ofMinutes(30));
    }

    /** Ceiling for a single resource type, in that type's unit. */
    public double limitFor(ResourceType type) {
        return switch (type) {
            case GPU -> maxGpuMemoryMb;
            case CPU -> maxCpuCores;
            case MEMORY -> maxMemoryMb;
            case DISK_IO -> maxDiskIoMbps;
            case NETWORK_IO -> maxNetworkIoMbps;
        };
    }

    public ResourceLimits withLimit(ResourceType type, double value) {
        return switch (type) {
            case GPU -> new ResourceLimits(value, maxGpuTimeSeconds, maxCpuCores, maxCpuTimeSeconds, maxMemoryMb, maxDiskIoMbps, maxNetworkIoMbps, maxOperationDuration);
            case CPU -> new ResourceLimits(maxGpuMemoryMb, maxGpuTimeSeconds, value, maxCpuTimeSeconds, maxMemoryMb, maxDiskIoMbps, maxNetworkIoMbps, maxOperationDuration);
            case MEMORY -> new ResourceLimits(maxGpuMemoryMb, maxGpuTimeSeconds, maxCpuCores, maxCpuTimeSeconds, value, maxDiskIoMbps, maxNetworkIoMbps, maxOperationDuration);
            case DISK_IO -> new ResourceLimits(maxGpuMemoryMb, maxGpuTimeSeconds, maxCpuCores, maxCpuTimeSeconds, maxMemoryMb, value, maxNetworkIoMbps, maxOperationDuration);
            case NETWORK_IO -> new ResourceLimits(maxGpuMemoryMb, maxGpuTimeSeconds, maxCpuCores, maxCpuTimeSeconds, maxMemoryMb, maxDiskIoMbps, value, maxOperationDuration);
        };
    }

    public ResourceLimits withMaxOperationDuration(Duration duration) {
        return new ResourceLimits(maxGpuMemoryMb, maxGpuTimeSeconds, maxCpuCores, maxCpuTimeSeconds, maxMemoryMb, maxDiskIoMbps, maxNetworkIoMbps, duration);
    }
}
