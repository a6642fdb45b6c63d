package io.blockchain.walletsync.listener;

import io.blockchain.walletsync.metrics.SyncMetrics;
import io.blockchain.walletsync.slotting.Slotting;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Logs a warning when a listener call runs longer than a fraction of the current slot.
 *
 * The wrapped call always runs to completion on the caller's thread. The first
 * warning fires after slotDuration / divisor; when repeating is enabled it fires
 * again each time the elapsed time doubles.
 */
public final class TimeoutWatchdog implements AutoCloseable {
    private static final Logger LOG = Logger.getLogger(TimeoutWatchdog.class.getName());
    private static final String TAG = "Wallet blistener ";

    private final Slotting slotting;
    private final int divisor;
    private final boolean repeat;
    private final ScheduledExecutorService scheduler;
    private final boolean ownsScheduler;

    public TimeoutWatchdog(Slotting slotting, int divisor, boolean repeat) {
        this(slotting, divisor, repeat, Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "wallet-blistener-watchdog");
            t.setDaemon(true);
            return t;
        }), true);
    }

    public TimeoutWatchdog(Slotting slotting, int divisor, boolean repeat, ScheduledExecutorService scheduler) {
        this(slotting, divisor, repeat, scheduler, false);
    }

    private TimeoutWatchdog(Slotting slotting, int divisor, boolean repeat,
                            ScheduledExecutorService scheduler, boolean ownsScheduler) {
        if (divisor <= 0) {
            throw new IllegalArgumentException("divisor must be > 0");
        }
        this.slotting = Objects.requireNonNull(slotting, "slotting");
        this.divisor = divisor;
        this.repeat = repeat;
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.ownsScheduler = ownsScheduler;
    }

    /** Threshold for the first warning. */
    public Duration threshold() {
        Duration slot = slotting.getCurrentEpochSlotDuration();
        Duration threshold = slot.dividedBy(divisor);
        return threshold.isZero() ? Duration.ofMillis(1) : threshold;
    }

    public <T> T watch(SyncPhase phase, Supplier<T> action) {
        Duration first;
        try {
            first = threshold();
        } catch (RuntimeException e) {
            LOG.log(Level.WARNING, TAG + phase.label() + ": no slot duration, running without watchdog", e);
            return action.get();
        }
        Warner warner = new Warner(phase, first);
        warner.schedule(first);
        try {
            return action.get();
        } finally {
            warner.stop();
        }
    }

    @Override
    public void close() {
        if (ownsScheduler) {
            scheduler.shutdownNow();
        }
    }

    private final class Warner implements Runnable {
        private final SyncPhase phase;
        private Duration elapsed;
        private ScheduledFuture<?> pending;
        private boolean stopped;
        private boolean warned;

        Warner(SyncPhase phase, Duration first) {
            this.phase = phase;
            this.elapsed = first;
        }

        synchronized void schedule(Duration delay) {
            if (stopped) return;
            pending = scheduler.schedule(this, delay.toNanos(), TimeUnit.NANOSECONDS);
        }

        synchronized void stop() {
            stopped = true;
            if (pending != null) {
                pending.cancel(false);
            }
        }

        @Override
        public void run() {
            Duration delay;
            synchronized (this) {
                if (stopped) return;
                if (!warned) {
                    warned = true;
                    SyncMetrics.recordOverrun(phase.label());
                }
                LOG.warning(TAG + phase.label() + " takes more than " + elapsed + ", still waiting");
                if (!repeat) return;
                delay = elapsed;
                elapsed = elapsed.multipliedBy(2);
            }
            schedule(delay);
        }
    }
}
