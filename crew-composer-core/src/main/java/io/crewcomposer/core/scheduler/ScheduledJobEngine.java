package io.crewcomposer.core.scheduler;

import io.crewcomposer.core.trigger.Trigger;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-process job engine. One timer thread computes fire times and hands firings to a fixed
 * worker pool. Each job runs at most one instance at a time, missed fire times are coalesced
 * into a single run, and firings later than the misfire grace period are skipped.
 */
public final class ScheduledJobEngine implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(ScheduledJobEngine.class);

    public static final Duration DEFAULT_MISFIRE_GRACE = Duration.ofSeconds(60);

    private final Duration misfireGrace;
    private final int workerThreads;
    private final Clock clock;
    private final Map<String, ScheduledJob> jobs = new ConcurrentHashMap<>();

    private ScheduledExecutorService timer;
    private ExecutorService workers;
    private volatile boolean running;

    public ScheduledJobEngine() {
        this(DEFAULT_MISFIRE_GRACE, 4, Clock.systemUTC());
    }

    public ScheduledJobEngine(Duration misfireGrace, int workerThreads, Clock clock) {
        this.misfireGrace = Objects.requireNonNull(misfireGrace, "misfireGrace must not be null");
        if (misfireGrace.isNegative() || misfireGrace.isZero()) {
            throw new IllegalArgumentException("misfireGrace must be positive");
        }
        if (workerThreads <= 0) {
            throw new IllegalArgumentException("workerThreads must be > 0");
        }
        this.workerThreads = workerThreads;
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public synchronized void start() {
        if (running) {
            return;
        }
        timer = Executors.newSingleThreadScheduledExecutor(daemonThreads("schedule-timer-"));
        workers = Executors.newFixedThreadPool(workerThreads, daemonThreads("schedule-worker-"));
        running = true;
        LOG.debug("Job engine started with {} worker threads", workerThreads);
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Registers a job, replacing any job with the same id. Returns false when the trigger has no
     * fire time left, in which case nothing is registered.
     */
    public synchronized boolean add(String id, Trigger trigger, Consumer<Instant> action) {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(trigger, "trigger must not be null");
        Objects.requireNonNull(action, "action must not be null");
        if (!running) {
            throw new IllegalStateException("Job engine is not running");
        }
        remove(id);

        Optional<Instant> first = trigger.nextFireTime(null, clock.instant());
        if (first.isEmpty()) {
            LOG.info("Schedule {} has no upcoming fire time; not scheduled", id);
            return false;
        }
        ScheduledJob job = new ScheduledJob(id, trigger, action);
        jobs.put(id, job);
        job.scheduleAt(first.get());
        LOG.debug("Schedule {} next fires at {}", id, first.get());
        return true;
    }

    public boolean remove(String id) {
        ScheduledJob job = jobs.remove(id);
        if (job == null) {
            return false;
        }
        job.cancel();
        return true;
    }

    public boolean contains(String id) {
        return jobs.containsKey(id);
    }

    public Set<String> jobIds() {
        return Set.copyOf(jobs.keySet());
    }

    public Optional<Instant> nextFireTime(String id) {
        ScheduledJob job = jobs.get(id);
        return job == null ? Optional.empty() : Optional.ofNullable(job.nextFireTime);
    }

    /**
     * Cancels every pending firing and stops both thread pools without waiting for runs that are
     * already in flight.
     */
    public synchronized void shutdown() {
        if (!running) {
            return;
        }
        running = false;
        jobs.values().forEach(ScheduledJob::cancel);
        jobs.clear();
        timer.shutdownNow();
        workers.shutdown();
        LOG.debug("Job engine shut down");
    }

    @Override
    public void close() {
        shutdown();
    }

    static long delayMillis(Duration delay) {
        if (delay.isNegative()) {
            return 0L;
        }
        try {
            return delay.toMillis();
        } catch (ArithmeticException e) {
            return Long.MAX_VALUE;
        }
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    private final class ScheduledJob {
        private final String id;
        private final Trigger trigger;
        private final Consumer<Instant> action;
        private final AtomicBoolean executing = new AtomicBoolean();

        private volatile Instant nextFireTime;
        private ScheduledFuture<?> pending;
        private boolean cancelled;

        private ScheduledJob(String id, Trigger trigger, Consumer<Instant> action) {
            this.id = id;
            this.trigger = trigger;
            this.action = action;
        }

        private synchronized void scheduleAt(Instant fireTime) {
            if (cancelled) {
                return;
            }
            nextFireTime = fireTime;
            long delayMs = delayMillis(Duration.between(clock.instant(), fireTime));
            try {
                pending = timer.schedule(() -> fire(fireTime), delayMs, TimeUnit.MILLISECONDS);
            } catch (RejectedExecutionException e) {
                LOG.debug("Timer rejected schedule {}; engine is shutting down", id);
                cancelled = true;
            }
        }

        private synchronized void cancel() {
            cancelled = true;
            nextFireTime = null;
            if (pending != null) {
                pending.cancel(false);
            }
        }

        private synchronized boolean isCancelled() {
            return cancelled;
        }

        private void fire(Instant scheduledTime) {
            if (isCancelled()) {
                return;
            }
            Instant now = clock.instant();
            Duration lateness = Duration.between(scheduledTime, now);
            if (lateness.compareTo(misfireGrace) > 0) {
                LOG.warn("Schedule {} missed its fire time {} by {}s; skipping run", id, scheduledTime, lateness.toSeconds());
            } else {
                dispatch(scheduledTime);
            }

            Optional<Instant> next;
            try {
                next = trigger.nextFireTime(scheduledTime, now);
            } catch (RuntimeException e) {
                LOG.error("Schedule {} trigger failed to compute its next fire time; removing job", id, e);
                next = Optional.empty();
            }
            if (next.isPresent()) {
                scheduleAt(next.get());
            } else if (jobs.remove(id, this)) {
                cancel();
                LOG.info("Schedule {} has no further fire times; removed from engine", id);
            }
        }

        private void dispatch(Instant fireTime) {
            if (!executing.compareAndSet(false, true)) {
                LOG.warn("Schedule {} is still running; skipping firing at {}", id, fireTime);
                return;
            }
            try {
                workers.execute(() -> {
                    try {
                        action.accept(fireTime);
                    } catch (RuntimeException e) {
                        LOG.error("Schedule {} run at {} failed", id, fireTime, e);
                    } finally {
                        executing.set(false);
                    }
                });
            } catch (RejectedExecutionException e) {
                executing.set(false);
                LOG.warn("Schedule {} firing at {} rejected; engine is shutting down", id, fireTime);
            }
        }
    }
}
