package io.crewcomposer.core.job;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Runs a job as an external command inside the project root. Arguments may contain the
 * placeholders {@code {job}} and {@code {inputs}}; inputs are rendered as JSON. An argument
 * carrying {@code {job}} is dropped when the schedule has no job reference. The job reference
 * and inputs are also exported as {@code CREW_COMPOSER_JOB} and {@code CREW_COMPOSER_INPUTS}.
 */
public final class ProcessJobExecutor implements JobExecutor {
    public static final String JOB_PLACEHOLDER = "{job}";
    public static final String INPUTS_PLACEHOLDER = "{inputs}";
    private static final int MAX_OUTPUT_CHARS = 64_000;

    private final List<String> command;
    private final Path workingDirectory;
    private final Duration timeout;
    private final ObjectMapper mapper = new ObjectMapper();

    public ProcessJobExecutor(List<String> command, Path workingDirectory, Duration timeout) {
        Objects.requireNonNull(command, "command must not be null");
        if (command.isEmpty()) {
            throw new IllegalArgumentException("command must not be empty");
        }
        this.command = List.copyOf(command);
        this.workingDirectory = Objects.requireNonNull(workingDirectory, "workingDirectory must not be null");
        this.timeout = Objects.requireNonNull(timeout, "timeout must not be null");
    }

    @Override
    public String execute(String jobRef, Map<String, Object> inputs) throws Exception {
        String inputsJson = renderInputs(inputs);
        List<String> commandLine = commandLine(jobRef, inputsJson);

        Path outputFile = Files.createTempFile("crew-composer-job-", ".out");
        try {
            ProcessBuilder builder = new ProcessBuilder(commandLine)
                .directory(workingDirectory.toFile())
                .redirectErrorStream(true)
                .redirectOutput(outputFile.toFile());
            builder.environment().put("CREW_COMPOSER_INPUTS", inputsJson);
            if (jobRef != null) {
                builder.environment().put("CREW_COMPOSER_JOB", jobRef);
            }
            Process process = builder.start();
            boolean finished = false;
            try {
                finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            } finally {
                if (!finished) {
                    process.destroyForcibly();
                }
            }
            if (!finished) {
                throw new JobExecutionException("Job timed out after " + timeout.toSeconds() + "s", readOutput(outputFile));
            }
            String output = readOutput(outputFile);
            if (process.exitValue() != 0) {
                throw new JobExecutionException("Job exited with code " + process.exitValue(), output);
            }
            return output;
        } finally {
            Files.deleteIfExists(outputFile);
        }
    }

    List<String> commandLine(String jobRef, String inputsJson) {
        List<String> resolved = new ArrayList<>(command.size());
        for (String argument : command) {
            if (argument.contains(JOB_PLACEHOLDER)) {
                if (jobRef == null) {
                    continue;
                }
                argument = argument.replace(JOB_PLACEHOLDER, jobRef);
            }
            resolved.add(argument.replace(INPUTS_PLACEHOLDER, inputsJson));
        }
        return resolved;
    }

    private String renderInputs(Map<String, Object> inputs) throws JsonProcessingException {
        return mapper.writeValueAsString(inputs == null ? Map.of() : inputs);
    }

    private static String readOutput(Path outputFile) throws IOException {
        String output = new String(Files.readAllBytes(outputFile), StandardCharsets.UTF_8);
        if (output.length() > MAX_OUTPUT_CHARS) {
            output = output.substring(0, MAX_OUTPUT_CHARS) + "\n[truncated]";
        }
        return output;
    }
}
