package io.crewcomposer.core.job;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class ScheduleJobRunner {
    private static final Logger LOG = LoggerFactory.getLogger(ScheduleJobRunner.class);
    private static final DateTimeFormatter FILE_TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss").withZone(ZoneOffset.UTC);

    public static final Path DEFAULT_RELATIVE_LOG_DIR = Path.of("output", "run-logs");

    private final JobExecutor executor;
    private final Path logDirectory;

    public ScheduleJobRunner(JobExecutor executor, Path logDirectory) {
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
        this.logDirectory = Objects.requireNonNull(logDirectory, "logDirectory must not be null");
    }

    public Path logDirectory() {
        return logDirectory;
    }

    public JobRunResult run(String scheduleId, String jobRef, Map<String, Object> inputs, Instant fireTime) {
        boolean success;
        boolean interrupted = false;
        String output;
        try {
            String result = executor.execute(jobRef, inputs == null ? Map.of() : inputs);
            output = result == null ? "" : result;
            success = true;
        } catch (Exception e) {
            interrupted = e instanceof InterruptedException;
            output = stackTrace(e);
            success = false;
        }

        // The log is written before the interrupt is restored; file channels close on interrupt.
        Path logFile = writeLog(scheduleId, fireTime, output);
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
        if (success) {
            LOG.info("Schedule {} run at {} succeeded (log: {})", scheduleId, fireTime, logFile);
        } else {
            LOG.warn("Schedule {} run at {} failed (log: {})", scheduleId, fireTime, logFile);
        }
        return new JobRunResult(scheduleId, fireTime, success, output, logFile);
    }

    public static String logFileName(String scheduleId, Instant fireTime) {
        return "schedule_" + sanitize(scheduleId) + "_" + FILE_TIMESTAMP.format(fireTime) + ".log";
    }

    private Path writeLog(String scheduleId, Instant fireTime, String output) {
        Path logFile = logDirectory.resolve(logFileName(scheduleId, fireTime));
        String content = "[schedule " + scheduleId + "] " + fireTime + "\n" + output;
        try {
            Files.createDirectories(logDirectory);
            Files.writeString(logFile, content, StandardCharsets.UTF_8);
            return logFile;
        } catch (IOException e) {
            LOG.warn("Unable to write run log {}: {}", logFile, e.getMessage());
            return null;
        }
    }

    private static String sanitize(String scheduleId) {
        if (scheduleId == null || scheduleId.isBlank()) {
            return "unknown";
        }
        return scheduleId.replaceAll("[^A-Za-z0-9._-]", "_");
    }

    private static String stackTrace(Throwable error) {
        StringWriter buffer = new StringWriter();
        try (PrintWriter writer = new PrintWriter(buffer)) {
            error.printStackTrace(writer);
        }
        return buffer.toString();
    }
}
