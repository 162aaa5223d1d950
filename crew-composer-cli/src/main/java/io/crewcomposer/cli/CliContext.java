package io.crewcomposer.cli;

import io.crewcomposer.core.schedule.ScheduleStore;
import io.crewcomposer.core.trigger.TriggerBuilder;

public record CliContext(
    ScheduleStore store,
    TriggerBuilder triggerBuilder,
    ServiceRunner serviceRunner
) {
    public CliContext(ScheduleStore store, TriggerBuilder triggerBuilder) {
        this(store, triggerBuilder, pollSeconds -> {
            throw new UnsupportedOperationException("schedule service runner is not configured");
        });
    }
}
