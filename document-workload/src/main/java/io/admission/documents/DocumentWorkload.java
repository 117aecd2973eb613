package io.admission.documents;

import io.admission.scheduler.FairScheduler;
import io.admission.scheduler.QuotaExceededException;
import io.admission.scheduler.ScheduledTask;
import io.admission.scheduler.TaskPriority;
import io.admission.scheduler.TaskStatus;
import io.admission.scheduler.TaskWork;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.TreeMap;

/**
 * Feeds document jobs through a scheduler the way the ingestion and storage stages of a document pipeline would, and
 * waits for the outcome. Submissions refused by a tenant's quota are retried after a pause until the timeout.
 */
public class DocumentWorkload {
    private static final Logger LOG = LoggerFactory.getLogger(DocumentWorkload.class);

    private final FairScheduler scheduler;
    private final long millisPerMb;
    private final double failureRate;
    private final Random random;
    private final long submitBackoffMillis;

    public DocumentWorkload(FairScheduler scheduler, long millisPerMb, double failureRate, long seed, long submitBackoffMillis) {
        this.scheduler = scheduler;
        this.millisPerMb = Math.max(0, millisPerMb);
        this.failureRate = Math.max(0.0, Math.min(1.0, failureRate));
        this.random = new Random(seed);
        this.submitBackoffMillis = Math.max(1, submitBackoffMillis);
    }

    public record Report(int submitted,
                         int quotaRejections,
                         int unsubmitted,
                         int evicted,
                         Map<TaskStatus, Integer> byStatus,
                         Map<String, Integer> completedByTenant) {
        public int count(TaskStatus status) { return byStatus.getOrDefault(status, 0); }
    }

    public Report run(List<DocumentJob> jobs, Duration timeout) {
        long deadline = System.currentTimeMillis() + timeout.toMillis();
        Map<String, DocumentJob> submitted = new LinkedHashMap<>();
        int rejections = 0;
        int unsubmitted = 0;
        for (DocumentJob job : jobs) {
            Optional<String> id = Optional.empty();
            while (id.isEmpty() && System.currentTimeMillis() < deadline) {
                try {
                    id = Optional.of(scheduler.submitTask(job.tenantId(), workFor(job), job.requirements(), priorityFor(job)));
                } catch (QuotaExceededException e) {
                    rejections++;
                    LOG.debug("Submission of {} refused: {}", job.documentId(), e.reason());
                    sleepQuiet(submitBackoffMillis);
                }
            }
            if (id.isPresent()) submitted.put(id.get(), job);
            else unsubmitted++;
        }
        LOG.info("Submitted {} of {} document jobs ({} quota rejections)", submitted.size(), jobs.size(), rejections);

        while (System.currentTimeMillis() < deadline && !allTerminal(submitted.keySet())) sleepQuiet(50);

        Map<TaskStatus, Integer> byStatus = new EnumMap<>(TaskStatus.class);
        Map<String, Integer> completedByTenant = new TreeMap<>();
        int evicted = 0;
        for (Map.Entry<String, DocumentJob> e : submitted.entrySet()) {
            Optional<TaskStatus> status = scheduler.getTask(e.getKey()).map(ScheduledTask::status);
            // dropped from the scheduler's bounded history; its outcome is no longer known
            if (status.isEmpty()) {
                evicted++;
                continue;
            }
            byStatus.merge(status.get(), 1, Integer::sum);
            if (status.get() == TaskStatus.COMPLETED) completedByTenant.merge(e.getValue().tenantId(), 1, Integer::sum);
        }
        if (evicted > 0) LOG.warn("{} finished job(s) fell out of the scheduler history before they were counted", evicted);
        return new Report(submitted.size(), rejections, unsubmitted, evicted, byStatus, completedByTenant);
    }

    /** Jobs for each tenant, cycling through the three stages. */
    public static List<DocumentJob> jobsFor(List<String> tenants, int perTenant, double gpuShare, long seed) {
        Random r = new Random(seed);
        List<DocumentJob> jobs = new ArrayList<>();
        DocumentJob.Stage[] stages = DocumentJob.Stage.values();
        for (int i = 0; i < perTenant; i++) {
            for (String tenant : tenants) {
                DocumentJob.Stage stage = stages[i % stages.length];
                int sizeKb = 64 + r.nextInt(4096);
                boolean gpu = stage == DocumentJob.Stage.EMBED && r.nextDouble() < gpuShare;
                jobs.add(new DocumentJob(tenant, tenant + "-doc-" + i, stage, sizeKb, gpu));
            }
        }
        return jobs;
    }

    private TaskPriority priorityFor(DocumentJob job) {
        return job.stage() == DocumentJob.Stage.STORE ? TaskPriority.HIGH : null;
    }

    private TaskWork workFor(DocumentJob job) {
        long millis = (long) (millisPerMb * Math.max(1.0, job.sizeKb() / 1024.0));
        boolean fail;
        synchronized (random) {
            fail = random.nextDouble() < failureRate;
        }
        return () -> {
            Thread.sleep(millis);
            if (fail) throw new IllegalStateException("could not process " + job.documentId());
        };
    }

    private boolean allTerminal(Iterable<String> ids) {
        for (String id : ids) {
            Optional<ScheduledTask> t = scheduler.getTask(id);
            if (t.isPresent() && !t.get().status().isTerminal()) return false;
        }
        return true;
    }

    private static void sleepQuiet(long millis) {
        try { Thread.sleep(millis); } catch (InterruptedException ie) { Thread.currentThread().interrupt(); }
    }
}
