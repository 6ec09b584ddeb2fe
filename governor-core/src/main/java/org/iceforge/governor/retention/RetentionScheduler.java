package org.iceforge.governor.retention;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs {@link RetentionPruner} cycles on a fixed delay from a single background thread.
 * <p>
 * At most one cycle runs at a time. A tick or {@link #runNow()} that finds a cycle in progress is
 * skipped rather than queued. A cycle that throws an exception is logged and counted; the next tick
 * runs as usual. An {@link Error} ends scheduled pruning: the scheduler moves to
 * {@link SchedulerState#STOPPED} so {@link #status()} reports it instead of ticks silently ceasing.
 */
public class RetentionScheduler {
    private static final Logger log = LoggerFactory.getLogger(RetentionScheduler.class);

    private final RetentionPruner pruner;
    private final PruneConfig config;
    private final Clock clock;

    private final AtomicReference<SchedulerState> state = new AtomicReference<>(SchedulerState.IDLE);
    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final AtomicLong cyclesCompleted = new AtomicLong();
    private final AtomicLong cyclesSkipped = new AtomicLong();
    private final AtomicLong cyclesFailed = new AtomicLong();
    private final Deque<PruneStats> history = new ArrayDeque<>();

    private volatile ScheduledExecutorService executor;
    private volatile Instant lastRunAt;
    private volatile PruneStats lastStats;

    /**
     * @throws IllegalArgumentException if the config is invalid
     */
    public RetentionScheduler(RetentionPruner pruner, PruneConfig config, Clock clock) {
        this.pruner = Objects.requireNonNull(pruner, "pruner");
        this.config = Objects.requireNonNull(config, "config").validate();
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public synchronized void start() {
        if (state.get() == SchedulerState.STOPPED) {
            throw new IllegalStateException("Retention scheduler was stopped and cannot be restarted");
        }
        if (!config.enabled()) {
            log.info("Retention pruning disabled");
            return;
        }
        if (executor != null) return;
        executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "governor-prune");
            t.setDaemon(true);
            return t;
        });
        long millis = config.interval().toMillis();
        executor.scheduleWithFixedDelay(this::tick, millis, millis, TimeUnit.MILLISECONDS);
        log.info("Retention scheduler started: interval={} maxJobAge={} maxArtifactAge={} maxArtifactsPerTenant={} dryRun={}",
                config.interval(), config.maxJobAge(), config.maxArtifactAge(), config.maxArtifactsPerTenant(), config.dryRun());
    }

    void tick() {
        try {
            runNow();
        } catch (RuntimeException e) {
            // runNow already handles cycle faults; keep the schedule alive regardless
            log.error("Retention tick failed", e);
        } catch (Error e) {
            cyclesFailed.incrementAndGet();
            state.set(SchedulerState.STOPPED);
            cancelled.set(true);
            ScheduledExecutorService ex = executor;
            if (ex != null) ex.shutdown();
            log.error("Retention tick failed with a fatal error; scheduled pruning stopped", e);
            throw e;
        }
    }

    /**
     * Runs a cycle on the calling thread.
     *
     * @return the cycle's stats, or empty if a cycle was already running or the scheduler is stopped
     */
    public Optional<PruneStats> runNow() {
        if (!state.compareAndSet(SchedulerState.IDLE, SchedulerState.RUNNING)) {
            if (state.get() == SchedulerState.RUNNING) {
                cyclesSkipped.incrementAndGet();
                log.info("Retention cycle already in progress; skipping");
            }
            return Optional.empty();
        }
        try {
            PruneStats stats = pruner.runCycle(config, cancelled::get);
            cyclesCompleted.incrementAndGet();
            record(stats);
            return Optional.of(stats);
        } catch (RuntimeException e) {
            cyclesFailed.incrementAndGet();
            log.error("Retention cycle failed", e);
            PruneStats failed = PruneStats.builder(clock.instant())
                    .dryRun(config.dryRun())
                    .aborted(true)
                    .error("Retention cycle failed: " + e.getMessage())
                    .build();
            record(failed);
            return Optional.of(failed);
        } finally {
            state.compareAndSet(SchedulerState.RUNNING, SchedulerState.IDLE);
        }
    }

    /**
     * Stops scheduling and signals a running cycle to finish its current batch, waiting at most
     * the configured shutdown grace.
     */
    public synchronized void stop() {
        SchedulerState previous = state.getAndSet(SchedulerState.STOPPED);
        if (previous == SchedulerState.STOPPED) return;
        cancelled.set(true);
        ScheduledExecutorService ex = executor;
        if (ex == null) {
            log.info("Retention scheduler stopped");
            return;
        }
        ex.shutdown();
        try {
            if (!ex.awaitTermination(config.shutdownGrace().toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Retention cycle did not finish within {}; interrupting", config.shutdownGrace());
                ex.shutdownNow();
            }
        } catch (InterruptedException e) {
            ex.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Retention scheduler stopped");
    }

    public SchedulerStatus status() {
        return new SchedulerStatus(config.enabled(), state.get(), config.interval(), lastRunAt, lastStats,
                cyclesCompleted.get(), cyclesSkipped.get(), cyclesFailed.get());
    }

    /** Recent cycle results, oldest first. */
    public List<PruneStats> history() {
        synchronized (history) {
            return List.copyOf(history);
        }
    }

    public PruneConfig config() {
        return config;
    }

    public boolean isRunning() {
        return state.get() == SchedulerState.RUNNING;
    }

    private void record(PruneStats stats) {
        synchronized (history) {
            history.addLast(stats);
            while (history.size() > config.historySize()) {
                history.removeFirst();
            }
        }
        lastStats = stats;
        lastRunAt = stats.timestamp();
    }
}
