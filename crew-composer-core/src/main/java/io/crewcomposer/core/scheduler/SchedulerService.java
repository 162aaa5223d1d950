package io.crewcomposer.core.scheduler;

import io.crewcomposer.core.job.ScheduleJobRunner;
import io.crewcomposer.core.schedule.ScheduleEntry;
import io.crewcomposer.core.schedule.ScheduleStore;
import io.crewcomposer.core.schedule.StoreRevision;
import io.crewcomposer.core.trigger.InvalidTriggerException;
import io.crewcomposer.core.trigger.Trigger;
import io.crewcomposer.core.trigger.TriggerBuilder;
import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps a {@link ScheduledJobEngine} in sync with a {@link ScheduleStore}. The store is polled for
 * revision changes and every change triggers a full reconciliation pass. The {@code updated_at}
 * of each scheduled entry is remembered in memory only, so a fresh instance treats every active
 * entry as new.
 */
public final class SchedulerService implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(SchedulerService.class);

    private final ScheduleStore store;
    private final TriggerBuilder triggerBuilder;
    private final ScheduledJobEngine engine;
    private final ScheduleJobRunner runner;
    private final Duration pollInterval;
    private final Map<String, Instant> knownVersions = new HashMap<>();
    private final CountDownLatch terminated = new CountDownLatch(1);

    private ScheduledExecutorService poller;
    private StoreRevision lastRevision;
    private boolean started;
    private boolean stopped;

    public SchedulerService(
        ScheduleStore store,
        TriggerBuilder triggerBuilder,
        ScheduledJobEngine engine,
        ScheduleJobRunner runner,
        Duration pollInterval
    ) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.triggerBuilder = Objects.requireNonNull(triggerBuilder, "triggerBuilder must not be null");
        this.engine = Objects.requireNonNull(engine, "engine must not be null");
        this.runner = Objects.requireNonNull(runner, "runner must not be null");
        this.pollInterval = Objects.requireNonNull(pollInterval, "pollInterval must not be null");
        if (pollInterval.isZero() || pollInterval.isNegative()) {
            throw new IllegalArgumentException("pollInterval must be positive");
        }
    }

    public synchronized void start() {
        if (stopped) {
            throw new IllegalStateException("Scheduler service has been stopped");
        }
        if (started) {
            return;
        }
        started = true;
        engine.start();
        lastRevision = currentRevision();
        reconcile();

        poller = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "schedule-poller");
            thread.setDaemon(true);
            return thread;
        });
        long periodMs = pollInterval.toMillis();
        poller.scheduleWithFixedDelay(this::pollOnce, periodMs, periodMs, TimeUnit.MILLISECONDS);
        LOG.info("Scheduler service started; polling every {}s", pollInterval.toSeconds());
    }

    /**
     * Reconciles when the store revision changed since the previous tick. Returns whether a pass
     * ran. Failures are logged and never propagate, so a broken tick does not end the poll loop.
     * The revision is only recorded after a completed pass, so a failed pass is retried on the
     * next tick.
     */
    public synchronized boolean pollOnce() {
        if (stopped) {
            return false;
        }
        try {
            StoreRevision revision = store.revision();
            if (revision.equals(lastRevision)) {
                return false;
            }
            reconcile();
            lastRevision = revision;
            return true;
        } catch (Exception e) {
            LOG.error("Schedule poll failed", e);
            return false;
        }
    }

    public synchronized ReconcileResult reconcile() {
        List<String> added = new ArrayList<>();
        List<String> rebuilt = new ArrayList<>();
        List<String> removed = new ArrayList<>();
        List<String> invalid = new ArrayList<>();

        Map<String, ScheduleEntry> active = new LinkedHashMap<>();
        Map<String, Trigger> triggers = new HashMap<>();
        for (ScheduleEntry entry : store.list()) {
            if (!entry.enabled()) {
                continue;
            }
            try {
                triggers.put(entry.id(), triggerBuilder.build(entry));
                active.put(entry.id(), entry);
            } catch (InvalidTriggerException e) {
                LOG.warn("Skipping schedule {}: {}", entry.id(), e.getMessage());
                invalid.add(entry.id());
            } catch (RuntimeException e) {
                LOG.warn("Skipping schedule {}: trigger could not be built", entry.id(), e);
                invalid.add(entry.id());
            }
        }

        for (String id : engine.jobIds()) {
            if (!active.containsKey(id)) {
                engine.remove(id);
                removed.add(id);
            }
        }
        knownVersions.keySet().retainAll(active.keySet());

        for (ScheduleEntry entry : active.values()) {
            String id = entry.id();
            boolean known = knownVersions.containsKey(id);
            if (known && Objects.equals(knownVersions.get(id), entry.updatedAt())) {
                // Unchanged. A one-shot job that already ran stays out of the engine.
                continue;
            }
            engine.remove(id);
            try {
                engine.add(id, triggers.get(id), fireTime -> runner.run(id, entry.jobRef(), entry.inputs(), fireTime));
            } catch (RuntimeException e) {
                LOG.warn("Skipping schedule {}: job could not be registered", id, e);
                knownVersions.remove(id);
                invalid.add(id);
                continue;
            }
            knownVersions.put(id, entry.updatedAt());
            if (known) {
                rebuilt.add(id);
            } else {
                added.add(id);
            }
        }

        ReconcileResult result = new ReconcileResult(added, rebuilt, removed, invalid);
        if (result.hasChanges() || !invalid.isEmpty()) {
            LOG.info(
                "Reconciled schedules: added={}, rebuilt={}, removed={}, invalid={}",
                added,
                rebuilt,
                removed,
                invalid
            );
        } else {
            LOG.debug("Reconciled schedules: no changes");
        }
        return result;
    }

    /**
     * Stops the poll loop and the job engine. Runs already in flight are not awaited.
     */
    public synchronized void stop() {
        if (stopped) {
            return;
        }
        stopped = true;
        if (poller != null) {
            poller.shutdownNow();
        }
        engine.shutdown();
        knownVersions.clear();
        terminated.countDown();
        LOG.info("Scheduler service stopped");
    }

    public void awaitTermination() throws InterruptedException {
        terminated.await();
    }

    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        return terminated.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    public synchronized boolean isRunning() {
        return started && !stopped;
    }

    @Override
    public void close() {
        stop();
    }

    private StoreRevision currentRevision() {
        try {
            return store.revision();
        } catch (IOException e) {
            LOG.warn("Could not read schedule store revision: {}", e.getMessage());
            return null;
        }
    }
}
