package io.crewcomposer.core.scheduler;

import static org.assertj.core.api.Assertions.assertThat;

import io.crewcomposer.core.job.ScheduleJobRunner;
import io.crewcomposer.core.schedule.FileScheduleStore;
import io.crewcomposer.core.schedule.ScheduleEntry;
import io.crewcomposer.core.schedule.ScheduleStore;
import io.crewcomposer.core.schedule.StoreRevision;
import io.crewcomposer.core.trigger.TriggerBuilder;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;
import java.util.stream.Stream;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SchedulerServiceTest {

    @TempDir
    Path tempDir;

    private final List<String> executed = new CopyOnWriteArrayList<>();
    private FileScheduleStore store;
    private ScheduledJobEngine engine;
    private Path logDir;
    private SchedulerService service;

    @BeforeEach
    void setUp() {
        store = new FileScheduleStore(tempDir.resolve("db/schedules.json"));
        engine = new ScheduledJobEngine(Duration.ofSeconds(60), 2, Clock.systemUTC());
        logDir = tempDir.resolve("output/run-logs");
        service = newService(store);
    }

    @AfterEach
    void tearDown() {
        service.stop();
    }

    @Test
    void shouldNotRebuildAnythingOnSecondPassWithoutChanges() throws Exception {
        engine.start();
        store.upsert(ScheduleEntry.ofInterval("interval", null, 3600, Map.of()));
        store.upsert(ScheduleEntry.ofCron("cron", null, Map.of("minute", "0"), Map.of()));

        ReconcileResult first = service.reconcile();
        ReconcileResult second = service.reconcile();

        assertThat(first.added()).containsExactly("interval", "cron");
        assertThat(second.hasChanges()).isFalse();
        assertThat(engine.jobIds()).containsExactlyInAnyOrder("interval", "cron");
    }

    @Test
    void shouldRebuildJobWhenEntryVersionChanges() throws Exception {
        engine.start();
        store.upsert(ScheduleEntry.ofInterval("s1", null, 3600, Map.of()));
        service.reconcile();
        Instant firstFire = engine.nextFireTime("s1").orElseThrow();

        store.upsert(ScheduleEntry.ofInterval("s1", null, 7200, Map.of()));
        ReconcileResult result = service.reconcile();

        assertThat(result.rebuilt()).containsExactly("s1");
        assertThat(result.added()).isEmpty();
        assertThat(engine.nextFireTime("s1").orElseThrow()).isAfter(firstFire.plusSeconds(3000));
    }

    @Test
    void shouldScheduleDisabledEntryOnlyOnceEnabled() throws Exception {
        engine.start();
        store.upsert(ScheduleEntry.ofInterval("s1", null, 3600, Map.of()).withEnabled(false));

        assertThat(service.reconcile().added()).isEmpty();
        assertThat(engine.contains("s1")).isFalse();

        store.upsert(ScheduleEntry.ofInterval("s1", null, 3600, Map.of()).withEnabled(true));

        assertThat(service.reconcile().added()).containsExactly("s1");
        assertThat(engine.contains("s1")).isTrue();
    }

    @Test
    void shouldRemoveJobsForDisabledAndDeletedEntries() throws Exception {
        engine.start();
        store.upsert(ScheduleEntry.ofInterval("keep", null, 3600, Map.of()));
        store.upsert(ScheduleEntry.ofInterval("disable", null, 3600, Map.of()));
        store.upsert(ScheduleEntry.ofInterval("delete", null, 3600, Map.of()));
        service.reconcile();

        store.upsert(ScheduleEntry.ofInterval("disable", null, 3600, Map.of()).withEnabled(false));
        store.delete("delete");
        ReconcileResult result = service.reconcile();

        assertThat(result.removed()).containsExactlyInAnyOrder("disable", "delete");
        assertThat(engine.jobIds()).containsExactly("keep");
    }

    @Test
    void shouldSkipInvalidTriggerWhileSchedulingValidSibling() throws Exception {
        engine.start();
        store.upsert(ScheduleEntry.ofCron("good", null, Map.of("minute", "0", "hour", "*"), Map.of()));
        store.upsert(ScheduleEntry.ofCron("bad", null, Map.of(), Map.of()));

        ReconcileResult result = service.reconcile();

        assertThat(result.invalid()).containsExactly("bad");
        assertThat(result.added()).containsExactly("good");
        assertThat(engine.jobIds()).containsExactly("good");
    }

    @Test
    void shouldScheduleSiblingsOfFarFutureOneShot() throws Exception {
        store.upsert(ScheduleEntry.ofDate("far", null, "+999999999-01-01T00:00:00", Map.of()));
        store.upsert(ScheduleEntry.ofInterval("good", null, 3600, Map.of()));

        service.start();

        assertThat(engine.jobIds()).containsExactlyInAnyOrder("far", "good");
        assertThat(engine.nextFireTime("far").orElseThrow()).isEqualTo(Instant.parse("+999999999-01-01T00:00:00Z"));

        store.upsert(ScheduleEntry.ofInterval("good2", null, 3600, Map.of()));

        assertThat(service.pollOnce()).isTrue();
        assertThat(engine.contains("good2")).isTrue();
    }

    @Test
    void shouldRetryFailedPassOnNextPoll() throws Exception {
        AtomicInteger listCalls = new AtomicInteger();
        ScheduleStore flaky = new ScheduleStore() {
            @Override
            public List<ScheduleEntry> list() {
                if (listCalls.incrementAndGet() == 1) {
                    throw new IllegalStateException("store briefly unreadable");
                }
                return store.list();
            }

            @Override
            public ScheduleEntry upsert(ScheduleEntry entry) throws IOException {
                return store.upsert(entry);
            }

            @Override
            public boolean delete(String id) throws IOException {
                return store.delete(id);
            }

            @Override
            public StoreRevision revision() throws IOException {
                return store.revision();
            }
        };
        SchedulerService flakyService = newService(flaky);
        try {
            engine.start();
            store.upsert(ScheduleEntry.ofInterval("s1", null, 3600, Map.of()));

            assertThat(flakyService.pollOnce()).isFalse();
            assertThat(engine.contains("s1")).isFalse();

            assertThat(flakyService.pollOnce()).isTrue();
            assertThat(engine.contains("s1")).isTrue();
            assertThat(flakyService.pollOnce()).isFalse();
        } finally {
            flakyService.stop();
        }
    }

    @Test
    void shouldPickUpFixedTriggerOnNextPass() throws Exception {
        engine.start();
        store.upsert(ScheduleEntry.ofCron("s1", null, Map.of("minute", "99"), Map.of()));
        assertThat(service.reconcile().invalid()).containsExactly("s1");

        store.upsert(ScheduleEntry.ofCron("s1", null, Map.of("minute", "30"), Map.of()));

        assertThat(service.reconcile().added()).containsExactly("s1");
    }

    @Test
    void shouldNotReAddOneShotJobAfterItRan() throws Exception {
        engine.start();
        store.upsert(ScheduleEntry.ofDate("once", null, Instant.now().toString(), Map.of("topic", "X")).withJobRef("once"));
        service.reconcile();

        assertThat(waitUntil(() -> executed.size() == 1 && !engine.contains("once"))).isTrue();

        store.upsert(ScheduleEntry.ofInterval("other", null, 3600, Map.of()));
        ReconcileResult result = service.reconcile();

        assertThat(result.added()).containsExactly("other");
        assertThat(engine.contains("once")).isFalse();
        Thread.sleep(100);
        assertThat(executed).containsExactly("once:X");
    }

    @Test
    void shouldReconcileOnlyWhenStoreRevisionChanges() throws Exception {
        engine.start();

        assertThat(service.pollOnce()).isTrue();
        assertThat(service.pollOnce()).isFalse();

        store.upsert(ScheduleEntry.ofInterval("s1", null, 3600, Map.of()));

        assertThat(service.pollOnce()).isTrue();
        assertThat(engine.contains("s1")).isTrue();
        assertThat(service.pollOnce()).isFalse();
    }

    @Test
    void shouldSurvivePollFailures() {
        ScheduleStore failing = new ScheduleStore() {
            @Override
            public List<ScheduleEntry> list() {
                return List.of();
            }

            @Override
            public ScheduleEntry upsert(ScheduleEntry entry) {
                throw new UnsupportedOperationException();
            }

            @Override
            public boolean delete(String id) {
                throw new UnsupportedOperationException();
            }

            @Override
            public StoreRevision revision() throws IOException {
                throw new IOException("disk unavailable");
            }
        };
        SchedulerService failingService = newService(failing);
        try {
            engine.start();

            assertThat(failingService.pollOnce()).isFalse();
            assertThat(failingService.pollOnce()).isFalse();
        } finally {
            failingService.stop();
        }
    }

    @Test
    void shouldRunDueJobAndWriteRunLog() throws Exception {
        store.upsert(ScheduleEntry.ofDate("s1", "demo", Instant.now().toString(), Map.of("topic", "X")).withJobRef("research"));

        service.start();

        assertThat(waitUntil(() -> listLogs().size() == 1)).isTrue();
        Path log = listLogs().get(0);
        assertThat(log.getFileName().toString()).startsWith("schedule_s1_").endsWith(".log");
        assertThat(waitUntil(() -> readLog(log).endsWith("ran research with X"))).isTrue();
        assertThat(readLog(log)).startsWith("[schedule s1] ");
    }

    @Test
    void shouldStopIdempotentlyAndReleaseWaiters() throws Exception {
        service.start();
        assertThat(service.isRunning()).isTrue();

        service.stop();
        service.stop();

        assertThat(service.isRunning()).isFalse();
        assertThat(engine.isRunning()).isFalse();
        assertThat(service.awaitTermination(Duration.ofSeconds(1))).isTrue();
        assertThat(service.pollOnce()).isFalse();
    }

    private SchedulerService newService(ScheduleStore backingStore) {
        ScheduleJobRunner runner = new ScheduleJobRunner((jobRef, inputs) -> {
            executed.add(inputs.isEmpty() ? jobRef : jobRef + ":" + inputs.get("topic"));
            return "ran " + jobRef + " with " + inputs.get("topic");
        }, logDir);
        return new SchedulerService(backingStore, new TriggerBuilder(ZoneOffset.UTC), engine, runner, Duration.ofHours(1));
    }

    private List<Path> listLogs() {
        if (!Files.isDirectory(logDir)) {
            return List.of();
        }
        try (Stream<Path> files = Files.list(logDir)) {
            return files.toList();
        } catch (IOException e) {
            throw new IllegalStateException(e);
        }
    }

    private static String readLog(Path log) {
        try {
            return Files.readString(log);
        } catch (IOException e) {
            throw new IllegalStateException(e);
        }
    }

    private static boolean waitUntil(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (System.nanoTime() < deadline) {
            if (condition.getAsBoolean()) {
                return true;
            }
            Thread.sleep(10);
        }
        return condition.getAsBoolean();
    }
}
