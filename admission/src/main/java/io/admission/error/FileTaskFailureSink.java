package io.admission.error;

import io.admission.scheduler.ScheduledTask;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;

/** Appends one JSON object per failed task to a file. */
public class FileTaskFailureSink implements TaskFailureSink {
    private static final Logger LOG = LoggerFactory.getLogger(FileTaskFailureSink.class);

    private final Path file;
    private final Clock clock;

    public FileTaskFailureSink(Path file) throws IOException { this(file, Clock.systemUTC()); }

    public FileTaskFailureSink(Path file, Clock clock) throws IOException {
        this.file = file;
        this.clock = clock;
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        if (!Files.exists(file)) {
            Files.writeString(file, "", StandardCharsets.UTF_8, StandardOpenOption.CREATE);
        }
    }

    public Path file() { return file; }

    @Override
    public synchronized void acceptFailure(ScheduledTask task, String reason) {
        String json = String.format(
                "{\"ts\":\"%s\",\"taskId\":\"%s\",\"tenantId\":\"%s\",\"status\":\"%s\",\"retries\":%d,\"reason\":\"%s\",\"error\":\"%s\"}%n",
                clock.instant(), safe(task.taskId()), safe(task.tenantId()), task.status(), task.retryCount(),
                safe(reason), safe(task.lastError() == null ? "" : task.lastError())
        );
        try {
            Files.writeString(file, json, StandardCharsets.UTF_8, StandardOpenOption.APPEND);
        } catch (IOException e) {
            LOG.error("Could not record failure of task {} to {}", task.taskId(), file, e);
        }
    }

    private static String safe(String s) {
        return s.replace("\\", "\\\\").replace("\"", "'").replace("\n", " ").replace("\r", " ");
    }
}
