package io.admission.documents;

import io.admission.resource.ResourceType;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DocumentJobTest {
    @Test
    void requirements_follow_stage_and_size() {
        Map<ResourceType, Double> ingest = new DocumentJob("t", "d", DocumentJob.Stage.INGEST, 2048, false).requirements();
        assertEquals(Map.of(ResourceType.CPU, 0.5, ResourceType.MEMORY, 72.0), ingest);

        Map<ResourceType, Double> embed = new DocumentJob("t", "d", DocumentJob.Stage.EMBED, 512, true).requirements();
        assertEquals(1.0, embed.get(ResourceType.CPU));
        assertEquals(136.0, embed.get(ResourceType.MEMORY), "small documents count as one MB");
        assertEquals(256.0, embed.get(ResourceType.GPU));

        Map<ResourceType, Double> store = new DocumentJob("t", "d", DocumentJob.Stage.STORE, 100 * 1024, false).requirements();
        assertEquals(50.0, store.get(ResourceType.DISK_IO), "disk bandwidth is capped");
        assertFalse(store.containsKey(ResourceType.CPU));
    }

    @Test
    void cpu_only_embedding_asks_for_no_gpu() {
        assertFalse(new DocumentJob("t", "d", DocumentJob.Stage.EMBED, 1024, false).requirements().containsKey(ResourceType.GPU));
    }

    @Test
    void generated_jobs_cycle_stages_per_tenant() {
        List<DocumentJob> jobs = DocumentWorkload.jobsFor(List.of("a", "b"), 4, 1.0, 7);
        assertEquals(8, jobs.size());
        assertEquals(DocumentJob.Stage.INGEST, jobs.get(0).stage());
        assertEquals("b", jobs.get(1).tenantId());
        assertEquals(DocumentJob.Stage.EMBED, jobs.get(2).stage());
        assertEquals(DocumentJob.Stage.INGEST, jobs.get(6).stage());
        for (DocumentJob j : jobs) assertEquals(j.stage() == DocumentJob.Stage.EMBED, j.useGpu(), j.toString());
    }
}
