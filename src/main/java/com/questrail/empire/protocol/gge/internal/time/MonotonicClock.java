package com.questrail.empire.protocol.gge.internal.time;

/**
 * MonotonicClock
 * =============================================================================
 * Time source for connection timing.
 *
 * <h2>Binding invariant</h2>
 * Heartbeat cadence, connection checks and reconnect backoff MUST use a
 * monotonic time source. Wall-clock time is only used by log timestamps.
 */
public interface MonotonicClock
{
    /**
     * Returns a monotonically increasing tick value in nanoseconds.
     *
     * <p>Values are only meaningful for elapsed time computations.</p>
     */
    long nowNanos();
}
