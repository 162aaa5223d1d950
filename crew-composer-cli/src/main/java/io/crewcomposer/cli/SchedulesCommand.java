package io.crewcomposer.cli;

import picocli.CommandLine.Command;

@Command(name = "schedules", mixinStandardHelpOptions = true, description = "List, create, update or delete schedules")
public final class SchedulesCommand implements Runnable {

    @Override
    public void run() {
        // Group command only shows help when no subcommand is provided.
    }
}
