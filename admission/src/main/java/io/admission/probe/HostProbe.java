package io.admission.probe;

import java.util.List;

/**
 * Read-only view of the host's capacities. Pool managers query it on every allocation and status call, so
 * implementations must be cheap and thread-safe.
 */
public interface HostProbe {
    List<GpuDevice> gpuDevices();

    CpuInfo cpu();

    MemoryInfo memory();

    DiskInfo disk();

    record GpuDevice(int id, String name, double memoryTotalMb, double load) {}

    record CpuInfo(int totalCores, double utilizationPercent) {}

    record MemoryInfo(double totalMb, double availableMb) {}

    record DiskInfo(double maxThroughputMbps) {}
}
