package com.questrail.empire.protocol.gge.internal.time;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * ScheduledExecutorScheduler
 * =============================================================================
 * Production {@link MonotonicScheduler} implementation backed by a
 * {@link ScheduledExecutorService}.
 *
 * <h2>Design</h2>
 * <p>Monotonic deadlines are converted into relative delays at scheduling time
 * using the provided {@link MonotonicClock}. The same clock instance must be used
 * by callers computing deadlines.</p>
 *
 * <h2>Blocking tasks</h2>
 * <p>Connect routines and connection checks block on correlated responses for up
 * to their timeout. The executor therefore needs more than one thread; the
 * runtime sizes it from {@code EmpireLinkConfig.schedulerThreads()}.</p>
 *
 * <h2>Failures</h2>
 * <p>A task that throws is logged here. {@link ScheduledExecutorService} would
 * otherwise park the exception in a future nobody reads.</p>
 *
 * <h2>Executor Ownership</h2>
 * <p>This class does <strong>not</strong> own the executor. Callers are
 * responsible for shutdown.</p>
 */
public final class ScheduledExecutorScheduler implements MonotonicScheduler {

    private static final Logger log = LoggerFactory.getLogger(ScheduledExecutorScheduler.class);

    private final ScheduledExecutorService executor;
    private final MonotonicClock clock;

    /**
     * Creates a scheduler backed by the given executor.
     *
     * @param executor the underlying scheduled executor service
     * @param clock    the monotonic clock used for delay calculations
     */
    public ScheduledExecutorScheduler(ScheduledExecutorService executor, MonotonicClock clock) {
        this.executor = Objects.requireNonNull(executor, "executor");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public Cancellable scheduleAtNanos(long deadlineNanos, Runnable task) {
        Objects.requireNonNull(task, "task");

        // Deadlines in the past run immediately.
        long delayNanos = Math.max(0, deadlineNanos - clock.nowNanos());

        ScheduledFuture<?> future = executor.schedule(() -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                log.error("Scheduled task failed", e);
            }
        }, delayNanos, TimeUnit.NANOSECONDS);

        return new ScheduledFutureCancellable(future);
    }

    /**
     * Adapter from {@link ScheduledFuture} to {@link Cancellable}.
     */
    private static final class ScheduledFutureCancellable implements Cancellable {
        private final ScheduledFuture<?> future;

        private ScheduledFutureCancellable(ScheduledFuture<?> future) {
            this.future = future;
        }

        @Override
        public boolean cancel() {
            // Never interrupt a running connect routine; it owns its own cleanup.
            return future.cancel(false);
        }
    }
}
