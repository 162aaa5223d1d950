package io.crewcomposer.core.job;

import java.nio.file.Path;
import java.time.Instant;

/**
 * Outcome of one firing. {@code logFile} is null when the run log could not be written.
 */
public record JobRunResult(String scheduleId, Instant fireTime, boolean success, String output, Path logFile) {
}
