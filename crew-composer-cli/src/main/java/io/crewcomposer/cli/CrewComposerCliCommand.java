package io.crewcomposer.cli;

import picocli.CommandLine;
import picocli.CommandLine.Command;

@Command(name = "crew-composer", mixinStandardHelpOptions = true, description = "Crew Composer schedule management")
public final class CrewComposerCliCommand implements Runnable {

    @Override
    public void run() {
        // Root command only shows help when no subcommand is provided.
    }

    public static CommandLine commandLine(CliContext context) {
        CommandLine schedules = new CommandLine(new SchedulesCommand())
            .addSubcommand("list", new ListSchedulesCommand(context))
            .addSubcommand("upsert", new UpsertScheduleCommand(context))
            .addSubcommand("delete", new DeleteScheduleCommand(context));
        return new CommandLine(new CrewComposerCliCommand())
            .addSubcommand("schedules", schedules)
            .addSubcommand("schedule-service", new ScheduleServiceCommand(context));
    }
}
