package io.admission.config;

import io.admission.scheduler.SchedulingPolicy;

import java.nio.file.Path;
import java.time.Duration;

public record AdmissionConfig(
        SchedulingPolicy policy,
        int maxConcurrentTasks,
        Duration dispatchIdle,
        Duration monitorInterval,
        Duration reaperInterval,
        int maxRetries,
        long retryBaseMillis,
        long retryMaxMillis,
        int completedHistory,
        double diskMbps,
        double networkMbps,
        int gpuCount,
        double gpuMemoryMb,
        int adminPort,
        Path failureLog
) {
    public static AdmissionConfig defaults() {
        return new AdmissionConfig(SchedulingPolicy.FAIR_SHARE, 10, Duration.ofMillis(100), Duration.ofSeconds(5),
                Duration.ofSeconds(30), 3, 1000, 30_000, 10_000, 500.0, 1000.0, 0, 0.0, 9090,
                Path.of("./out/task_failures.jsonl"));
    }

    public static AdmissionConfig fromEnv() {
        SchedulingPolicy policy = SchedulingPolicy.parse(get("policy", "FAIR_SHARE"));
        int maxConcurrent = Integer.parseInt(get("max.concurrent", "10"));
        Duration idle = Duration.ofMillis(Long.parseLong(get("dispatch.idle.ms", "100")));
        Duration monitor = Duration.ofMillis(Long.parseLong(get("monitor.interval.ms", "5000")));
        Duration reaper = Duration.ofMillis(Long.parseLong(get("reaper.interval.ms", "30000")));
        int retries = Integer.parseInt(get("max.retries", "3"));
        long base = Long.parseLong(get("retry.base.ms", "1000"));
        long max = Long.parseLong(get("retry.max.ms", "30000"));
        int history = Integer.parseInt(get("completed.history", "10000"));
        double disk = Double.parseDouble(get("disk.mbps", "500"));
        double net = Double.parseDouble(get("network.mbps", "1000"));
        int gpus = Integer.parseInt(get("gpu.count", "0"));
        double gpuMem = Double.parseDouble(get("gpu.memory.mb", "0"));
        int port = Integer.parseInt(get("port", "9090"));
        Path failures = Path.of(get("failure.log", "./out/task_failures.jsonl"));
        return new AdmissionConfig(policy, maxConcurrent, idle, monitor, reaper, retries, base, max, history,
                disk, net, gpus, gpuMem, port, failures);
    }

    // admission.max.concurrent falls back to ADMISSION_MAX_CONCURRENT
    private static String get(String key, String def) {
        String env = "ADMISSION_" + key.toUpperCase().replace('.', '_');
        return System.getProperty("admission." + key, System.getenv().getOrDefault(env, def));
    }
}
