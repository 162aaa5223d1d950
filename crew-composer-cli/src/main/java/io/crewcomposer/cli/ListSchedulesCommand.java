package io.crewcomposer.cli;

import io.crewcomposer.core.schedule.ScheduleEntry;
import io.crewcomposer.core.schedule.ScheduleJson;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "list", description = "List stored schedules")
public final class ListSchedulesCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = "--json", description = "Print the schedules as JSON")
    boolean json;

    public ListSchedulesCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            List<ScheduleEntry> entries = context.store().list();
            if (json) {
                System.out.println(ScheduleJson.newMapper().writerWithDefaultPrettyPrinter().writeValueAsString(entries));
                return 0;
            }
            if (entries.isEmpty()) {
                System.out.println("No schedules");
                return 0;
            }
            for (ScheduleEntry entry : entries) {
                System.out.println(entry.id()
                    + " | " + entry.name()
                    + " | " + entry.triggerKind().value()
                    + " | " + (entry.enabled() ? "enabled" : "disabled"));
            }
            return 0;
        } catch (Exception e) {
            System.err.println("List schedules failed: " + e.getMessage());
            return 1;
        }
    }
}
