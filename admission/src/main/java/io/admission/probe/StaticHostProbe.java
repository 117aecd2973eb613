package io.admission.probe;

import java.util.ArrayList;
import java.util.List;

/**
 * Fixed capacities, for configured inventories and tests.
 */
public class StaticHostProbe implements HostProbe {
    private final List<GpuDevice> gpus;
    private final int cpuCores;
    private final double memoryMb;
    private final double diskMbps;

    public StaticHostProbe(List<GpuDevice> gpus, int cpuCores, double memoryMb, double diskMbps) {
        this.gpus = List.copyOf(gpus);
        this.cpuCores = Math.max(0, cpuCores);
        this.memoryMb = Math.max(0, memoryMb);
        this.diskMbps = Math.max(0, diskMbps);
    }

    /** {@code count} identical GPUs named {@code gpu-<index>}. */
    public static List<GpuDevice> uniformGpus(int count, double memoryMbEach) {
        List<GpuDevice> list = new ArrayList<>();
        for (int i = 0; i < count; i++) list.add(new GpuDevice(i, "gpu-" + i, memoryMbEach, 0.0));
        return list;
    }

    @Override public List<GpuDevice> gpuDevices() { return gpus; }
    @Override public CpuInfo cpu() { return new CpuInfo(cpuCores, 0.0); }
    @Override public MemoryInfo memory() { return new MemoryInfo(memoryMb, memoryMb); }
    @Override public DiskInfo disk() { return new DiskInfo(diskMbps); }
}
