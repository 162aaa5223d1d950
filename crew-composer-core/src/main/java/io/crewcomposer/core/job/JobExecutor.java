package io.crewcomposer.core.job;

import java.util.Map;

/**
 * Runs one job definition. {@code jobRef} is null when the schedule relies on the default job.
 * Returns the text recorded in the run log.
 */
@FunctionalInterface
public interface JobExecutor {
    String execute(String jobRef, Map<String, Object> inputs) throws Exception;
}
