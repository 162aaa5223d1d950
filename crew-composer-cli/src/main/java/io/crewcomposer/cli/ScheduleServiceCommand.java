package io.crewcomposer.cli;

import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "schedule-service", description = "Run the scheduler service until interrupted")
public final class ScheduleServiceCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = {"--poll"}, description = "Seconds between schedule store checks (default from config)")
    Integer pollSeconds;

    public ScheduleServiceCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            if (pollSeconds != null && pollSeconds <= 0) {
                System.err.println("Schedule service failed: --poll must be > 0");
                return 1;
            }
            return context.serviceRunner().run(pollSeconds);
        } catch (Exception e) {
            System.err.println("Schedule service failed: " + e.getMessage());
            return 1;
        }
    }
}
