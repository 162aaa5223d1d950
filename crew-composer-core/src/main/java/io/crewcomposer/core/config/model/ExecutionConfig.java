package io.crewcomposer.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ExecutionConfig(
    List<String> command,
    @JsonAlias({"timeout_seconds"}) int timeoutSeconds
) {

    public static ExecutionConfig defaults() {
        return new ExecutionConfig(
            List.of("crewai", "run"),
            3600
        );
    }
}
