package io.crewcomposer.cli;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.crewcomposer.core.schedule.ScheduleEntry;
import io.crewcomposer.core.schedule.ScheduleJson;
import io.crewcomposer.core.schedule.TriggerKind;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "upsert", description = "Create a schedule, or replace the one with the same id")
public final class UpsertScheduleCommand implements Callable<Integer> {
    private static final TypeReference<Map<String, Object>> INPUTS_TYPE = new TypeReference<>() {
    };

    private final CliContext context;
    private final ObjectMapper mapper = ScheduleJson.newMapper();

    @Option(names = "--id", description = "Schedule id (generated when omitted)")
    String id;

    @Option(names = "--name", description = "Human readable label")
    String name;

    @Option(names = "--crew", description = "Job definition to run (default job when omitted)")
    String crew;

    @Option(names = "--trigger", description = "date, interval or cron", defaultValue = "date")
    String trigger;

    @Option(names = "--run-at", description = "ISO-8601 timestamp for date triggers")
    String runAt;

    @Option(names = "--interval-seconds", description = "Seconds between runs for interval triggers")
    Integer intervalSeconds;

    @Option(names = "--cron", description = "Cron field for cron triggers, e.g. --cron minute=0 --cron hour=*")
    Map<String, String> cron;

    @Option(names = "--timezone", description = "Timezone id, e.g. Europe/Berlin")
    String timezone;

    @Option(names = "--disabled", description = "Store the schedule without scheduling it")
    boolean disabled;

    @Option(names = "--input", description = "Job input, e.g. --input topic=AI")
    Map<String, String> input;

    @Option(names = "--inputs-json", description = "Job inputs as a JSON object")
    String inputsJson;

    public UpsertScheduleCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            ScheduleEntry entry = new ScheduleEntry(
                id,
                name,
                crew,
                TriggerKind.fromValue(trigger),
                runAt,
                intervalSeconds,
                cron,
                timezone,
                !disabled,
                inputs(),
                null,
                null
            );
            context.triggerBuilder().build(entry);
            ScheduleEntry saved = context.store().upsert(entry);
            System.out.println(mapper.writerWithDefaultPrettyPrinter().writeValueAsString(saved));
            return 0;
        } catch (Exception e) {
            System.err.println("Upsert schedule failed: " + e.getMessage());
            return 1;
        }
    }

    private Map<String, Object> inputs() throws Exception {
        Map<String, Object> inputs = new LinkedHashMap<>();
        if (inputsJson != null && !inputsJson.isBlank()) {
            inputs.putAll(mapper.readValue(inputsJson, INPUTS_TYPE));
        }
        if (input != null) {
            inputs.putAll(input);
        }
        return inputs;
    }
}
