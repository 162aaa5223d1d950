package io.crewcomposer.cli;

import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

@Command(name = "delete", description = "Delete a schedule by id")
public final class DeleteScheduleCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(index = "0", description = "Schedule id")
    String id;

    public DeleteScheduleCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            if (context.store().delete(id)) {
                System.out.println("Deleted: " + id);
                return 0;
            }
            System.out.println("Not found: " + id);
            return 1;
        } catch (Exception e) {
            System.err.println("Delete schedule failed: " + e.getMessage());
            return 1;
        }
    }
}
