package io.crewcomposer.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.time.ZoneId;

@JsonIgnoreProperties(ignoreUnknown = true)
public record SchedulerConfig(
    @JsonAlias({"store_path"}) String storePath,
    @JsonAlias({"run_log_dir"}) String runLogDir,
    @JsonAlias({"poll_seconds"}) int pollSeconds,
    @JsonAlias({"misfire_grace_seconds"}) int misfireGraceSeconds,
    @JsonAlias({"worker_threads"}) int workerThreads,
    String timezone
) {

    public SchedulerConfig {
        requirePositive("pollSeconds", pollSeconds);
        // Every firing is a few milliseconds late, so a zero grace would skip them all.
        requirePositive("misfireGraceSeconds", misfireGraceSeconds);
        requirePositive("workerThreads", workerThreads);
    }

    public static SchedulerConfig defaults() {
        return new SchedulerConfig(
            "db/schedules.json",
            "output/run-logs",
            5,
            60,
            4,
            ""
        );
    }

    // Blank means the local zone of the service host.
    public ZoneId zone() {
        if (timezone == null || timezone.isBlank()) {
            return ZoneId.systemDefault();
        }
        return ZoneId.of(timezone.trim());
    }

    private static void requirePositive(String name, int value) {
        if (value <= 0) {
            throw new IllegalArgumentException(name + " must be positive, got " + value);
        }
    }
}
