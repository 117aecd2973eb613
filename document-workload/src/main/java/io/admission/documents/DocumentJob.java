package io.admission.documents;

import io.admission.resource.ResourceType;

import java.util.EnumMap;
import java.util.Map;

/**
 * One synthetic document-processing job.
 *
 * @param sizeKb drives both the declared resources and how long the job runs
 */
public record DocumentJob(String tenantId, String documentId, Stage stage, int sizeKb, boolean useGpu) {

    public enum Stage {
        /** Parse and chunk: CPU and memory. */
        INGEST,
        /** Embedding: CPU and memory, plus GPU memory when one is used. */
        EMBED,
        /** Write vectors and metadata: disk bandwidth and memory. */
        STORE
    }

    public Map<ResourceType, Double> requirements() {
        Map<ResourceType, Double> req = new EnumMap<>(ResourceType.class);
        double mb = Math.max(1.0, sizeKb / 1024.0);
        switch (stage) {
            case INGEST -> {
                req.put(ResourceType.CPU, 0.5);
                req.put(ResourceType.MEMORY, 64.0 + 4 * mb);
            }
            case EMBED -> {
                req.put(ResourceType.CPU, 1.0);
                req.put(ResourceType.MEMORY, 128.0 + 8 * mb);
                if (useGpu) req.put(ResourceType.GPU, 256.0);
            }
            case STORE -> {
                req.put(ResourceType.DISK_IO, Math.min(50.0, 5.0 + mb));
                req.put(ResourceType.MEMORY, 32.0);
            }
        }
        return req;
    }
}
