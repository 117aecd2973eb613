package io.admission.probe;

import java.lang.management.ManagementFactory;
import java.lang.management.OperatingSystemMXBean;
import java.util.List;

/**
 * Reads CPU and physical memory from the platform MX bean. The JVM has no portable view of GPUs or disk bandwidth,
 * so those come from configuration.
 */
public class JvmHostProbe implements HostProbe {
    private static final double MB = 1024.0 * 1024.0;

    private final OperatingSystemMXBean os = ManagementFactory.getOperatingSystemMXBean();
    private final List<GpuDevice> gpus;
    private final double diskMbps;

    public JvmHostProbe(List<GpuDevice> gpus, double diskMbps) {
        this.gpus = List.copyOf(gpus);
        this.diskMbps = Math.max(0, diskMbps);
    }

    @Override
    public List<GpuDevice> gpuDevices() { return gpus; }

    @Override
    public CpuInfo cpu() {
        double load = -1;
        if (os instanceof com.sun.management.OperatingSystemMXBean sun) load = sun.getCpuLoad();
        return new CpuInfo(Runtime.getRuntime().availableProcessors(), load < 0 ? 0.0 : load * 100.0);
    }

    @Override
    public MemoryInfo memory() {
        if (os instanceof com.sun.management.OperatingSystemMXBean sun) {
            return new MemoryInfo(sun.getTotalMemorySize() / MB, sun.getFreeMemorySize() / MB);
        }
        // no physical view; fall back to the heap ceiling
        double max = Runtime.getRuntime().maxMemory() / MB;
        return new MemoryInfo(max, max);
    }

    @Override
    public DiskInfo disk() { return new DiskInfo(diskMbps); }
}
