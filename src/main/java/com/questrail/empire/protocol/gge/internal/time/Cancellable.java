package com.questrail.empire.protocol.gge.internal.time;

/**
 * Cancellable
 * =============================================================================
 * Minimal cancellation handle for scheduled tasks.
 *
 * <p>
 * Implemented by the production {@link ScheduledExecutorScheduler} and by the
 * deterministic scheduler used in tests. Heartbeats, connection checks and
 * reconnect delays all hand out one of these.
 * </p>
 */
public interface Cancellable
{
    /**
     * Attempt to cancel the scheduled task.
     *
     * @return {@code true} if cancellation succeeded; {@code false} if the task
     *         was already executed or previously cancelled.
     */
    boolean cancel();
}
