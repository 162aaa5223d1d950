package io.crewcomposer.cli;

import static org.assertj.core.api.Assertions.assertThat;

import io.crewcomposer.core.schedule.FileScheduleStore;
import io.crewcomposer.core.schedule.ScheduleEntry;
import io.crewcomposer.core.schedule.TriggerKind;
import io.crewcomposer.core.trigger.TriggerBuilder;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SchedulesCommandTest {

    @TempDir
    Path tempDir;

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();
    private final AtomicReference<Integer> pollOverride = new AtomicReference<>();
    private PrintStream originalOut;
    private PrintStream originalErr;
    private FileScheduleStore store;
    private CliContext context;

    @BeforeEach
    void setUp() {
        originalOut = System.out;
        originalErr = System.err;
        System.setOut(new PrintStream(out, true, StandardCharsets.UTF_8));
        System.setErr(new PrintStream(err, true, StandardCharsets.UTF_8));
        store = new FileScheduleStore(tempDir.resolve("db/schedules.json"));
        context = new CliContext(store, new TriggerBuilder(ZoneOffset.UTC), pollSeconds -> {
            pollOverride.set(pollSeconds);
            return 0;
        });
    }

    @AfterEach
    void tearDown() {
        System.setOut(originalOut);
        System.setErr(originalErr);
    }

    @Test
    void shouldUpsertIntervalScheduleWithInputs() {
        int code = execute(
            "schedules", "upsert",
            "--id", "s1",
            "--name", "demo",
            "--crew", "research",
            "--trigger", "interval",
            "--interval-seconds", "60",
            "--inputs-json", "{\"topic\": \"X\", \"depth\": 2}",
            "--input", "topic=Y"
        );

        assertThat(code).isZero();
        assertThat(stdout()).contains("\"id\" : \"s1\"").contains("\"trigger\" : \"interval\"");
        List<ScheduleEntry> entries = store.list();
        assertThat(entries).hasSize(1);
        ScheduleEntry stored = entries.get(0);
        assertThat(stored.jobRef()).isEqualTo("research");
        assertThat(stored.intervalSeconds()).isEqualTo(60);
        assertThat(stored.inputs()).containsEntry("topic", "Y").containsEntry("depth", 2);
    }

    @Test
    void shouldUpsertCronScheduleFromRepeatedFields() {
        int code = execute("schedules", "upsert", "--id", "hourly", "--trigger", "cron", "--cron", "minute=0", "--cron", "hour=*", "--disabled");

        assertThat(code).isZero();
        ScheduleEntry stored = store.list().get(0);
        assertThat(stored.triggerKind()).isEqualTo(TriggerKind.CRON);
        assertThat(stored.cron()).containsExactlyInAnyOrderEntriesOf(Map.of("minute", "0", "hour", "*"));
        assertThat(stored.enabled()).isFalse();
    }

    @Test
    void shouldRefuseInvalidTrigger() {
        int code = execute("schedules", "upsert", "--id", "broken", "--trigger", "cron");

        assertThat(code).isEqualTo(1);
        assertThat(stderr()).contains("Upsert schedule failed").contains("broken");
        assertThat(store.list()).isEmpty();
    }

    @Test
    void shouldListSchedules() throws Exception {
        store.upsert(ScheduleEntry.ofInterval("s1", "demo", 60, Map.of()));
        store.upsert(ScheduleEntry.ofDate("s2", "once", "2030-01-01T00:00:00", Map.of()).withEnabled(false));

        assertThat(execute("schedules", "list")).isZero();

        assertThat(stdout()).contains("s1 | demo | interval | enabled").contains("s2 | once | date | disabled");
    }

    @Test
    void shouldListSchedulesAsJson() throws Exception {
        store.upsert(ScheduleEntry.ofInterval("s1", "demo", 60, Map.of()));

        assertThat(execute("schedules", "list", "--json")).isZero();

        assertThat(stdout().trim()).startsWith("[").endsWith("]").contains("\"interval_seconds\" : 60");
    }

    @Test
    void shouldReportEmptyStore() {
        assertThat(execute("schedules", "list")).isZero();

        assertThat(stdout()).contains("No schedules");
    }

    @Test
    void shouldDeleteScheduleOnce() throws Exception {
        store.upsert(ScheduleEntry.ofInterval("s1", "demo", 60, Map.of()));

        assertThat(execute("schedules", "delete", "s1")).isZero();
        assertThat(execute("schedules", "delete", "s1")).isEqualTo(1);

        assertThat(stdout()).contains("Deleted: s1").contains("Not found: s1");
        assertThat(store.list()).isEmpty();
    }

    @Test
    void shouldPassPollOverrideToServiceRunner() {
        assertThat(execute("schedule-service", "--poll", "2")).isZero();
        assertThat(pollOverride.get()).isEqualTo(2);

        assertThat(execute("schedule-service")).isZero();
        assertThat(pollOverride.get()).isNull();

        assertThat(execute("schedule-service", "--poll", "0")).isEqualTo(1);
        assertThat(stderr()).contains("--poll must be > 0");
    }

    @Test
    void shouldFailWhenServiceRunnerIsNotConfigured() {
        CliContext withoutRunner = new CliContext(store, new TriggerBuilder(ZoneOffset.UTC));

        int code = CrewComposerCliCommand.commandLine(withoutRunner).execute("schedule-service");

        assertThat(code).isEqualTo(1);
        assertThat(stderr()).contains("Schedule service failed");
    }

    private int execute(String... args) {
        return CrewComposerCliCommand.commandLine(context).execute(args);
    }

    private String stdout() {
        return out.toString(StandardCharsets.UTF_8);
    }

    private String stderr() {
        return err.toString(StandardCharsets.UTF_8);
    }
}
