package io.crewcomposer.app;

import io.crewcomposer.cli.CliContext;
import io.crewcomposer.cli.CrewComposerCliCommand;
import io.crewcomposer.core.config.ConfigPaths;
import io.crewcomposer.core.config.ConfigService;
import io.crewcomposer.core.config.model.ComposerConfig;
import io.crewcomposer.core.config.model.SchedulerConfig;
import io.crewcomposer.core.job.ProcessJobExecutor;
import io.crewcomposer.core.job.ScheduleJobRunner;
import io.crewcomposer.core.schedule.FileScheduleStore;
import io.crewcomposer.core.schedule.ScheduleStore;
import io.crewcomposer.core.scheduler.ScheduledJobEngine;
import io.crewcomposer.core.scheduler.SchedulerService;
import io.crewcomposer.core.trigger.TriggerBuilder;
import java.nio.file.Path;
import java.time.Clock;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.ZoneId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class CrewComposerApplication {
    private static final Logger LOG = LoggerFactory.getLogger(CrewComposerApplication.class);

    private CrewComposerApplication() {
    }

    public static void main(String[] args) {
        Path projectRoot = ConfigPaths.resolveProjectRoot();
        ComposerConfig config = loadConfig(new ConfigService(), projectRoot);
        SchedulerConfig schedulerConfig = config.scheduler();

        Path storePath = ConfigPaths.resolve(projectRoot, schedulerConfig.storePath());
        ScheduleStore store = new FileScheduleStore(storePath);
        TriggerBuilder triggerBuilder = new TriggerBuilder(resolveZone(schedulerConfig));

        CliContext context = new CliContext(
            store,
            triggerBuilder,
            pollSeconds -> runScheduleService(projectRoot, config, store, storePath, triggerBuilder, pollSeconds)
        );

        int exitCode = CrewComposerCliCommand.commandLine(context).execute(args);
        System.exit(exitCode);
    }

    private static ComposerConfig loadConfig(ConfigService configService, Path projectRoot) {
        Path configPath = ConfigPaths.configPath(projectRoot);
        try {
            return configService.load(configPath);
        } catch (Exception e) {
            LOG.warn("Unable to load {}; using defaults: {}", configPath, e.getMessage());
            return ComposerConfig.defaults();
        }
    }

    private static ZoneId resolveZone(SchedulerConfig schedulerConfig) {
        try {
            return schedulerConfig.zone();
        } catch (DateTimeException e) {
            LOG.warn("Unknown scheduler timezone '{}'; using {}", schedulerConfig.timezone(), ZoneId.systemDefault());
            return ZoneId.systemDefault();
        }
    }

    private static int runScheduleService(
        Path projectRoot,
        ComposerConfig config,
        ScheduleStore store,
        Path storePath,
        TriggerBuilder triggerBuilder,
        Integer pollSecondsOverride
    ) throws Exception {
        SchedulerConfig schedulerConfig = config.scheduler();
        int pollSeconds = pollSecondsOverride != null ? pollSecondsOverride : schedulerConfig.pollSeconds();

        ProcessJobExecutor executor = new ProcessJobExecutor(
            config.execution().command(),
            projectRoot,
            Duration.ofSeconds(config.execution().timeoutSeconds())
        );
        ScheduleJobRunner runner = new ScheduleJobRunner(executor, ConfigPaths.resolve(projectRoot, schedulerConfig.runLogDir()));
        ScheduledJobEngine engine = new ScheduledJobEngine(
            Duration.ofSeconds(schedulerConfig.misfireGraceSeconds()),
            schedulerConfig.workerThreads(),
            Clock.systemUTC()
        );
        SchedulerService service = new SchedulerService(store, triggerBuilder, engine, runner, Duration.ofSeconds(pollSeconds));

        Runtime.getRuntime().addShutdownHook(new Thread(service::stop, "schedule-service-shutdown"));
        service.start();
        System.out.println("Schedule service started; watching " + storePath + " every " + pollSeconds + "s");
        System.out.println("Run logs: " + runner.logDirectory());
        service.awaitTermination();
        return 0;
    }
}
