package io.crewcomposer.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ComposerConfig(
    SchedulerConfig scheduler,
    ExecutionConfig execution
) {

    public static ComposerConfig defaults() {
        return new ComposerConfig(
            SchedulerConfig.defaults(),
            ExecutionConfig.defaults()
        );
    }
}
