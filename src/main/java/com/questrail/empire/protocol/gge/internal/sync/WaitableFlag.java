package com.questrail.empire.protocol.gge.internal.sync;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * WaitableFlag
 * =============================================================================
 * Boolean signal with an optional timeout-bounded wait.
 *
 * <p>Used for the connection lifecycle flags ({@code opened}, {@code connected},
 * {@code closed}) and for the completion of every in-flight correlated request.</p>
 *
 * <h2>Semantics</h2>
 * <ul>
 *   <li>{@link #set()} is idempotent and releases every thread waiting at that moment.</li>
 *   <li>{@link #clear()} resets the flag without waking anybody.</li>
 *   <li>A waiter released by a {@code set()} returns {@code true} even when a
 *       {@code clear()} happens before it gets to run.</li>
 * </ul>
 */
public final class WaitableFlag
{
    private boolean set;

    // Bumped on every false -> true transition so released waiters can tell.
    private long generation;

    public synchronized void set()
    {
        if (!set) {
            set = true;
            generation++;
            notifyAll();
        }
    }

    public synchronized void clear()
    {
        set = false;
    }

    public synchronized boolean isSet()
    {
        return set;
    }

    /**
     * Wait without a deadline until the flag is set.
     */
    public synchronized void await() throws InterruptedException
    {
        long observed = generation;
        while (!set && generation == observed) {
            wait();
        }
    }

    /**
     * Wait until the flag is set or the timeout elapses.
     *
     * @param timeout maximum time to wait; zero or negative means "do not wait"
     * @return {@code true} if the flag was set, {@code false} on timeout
     */
    public synchronized boolean await(Duration timeout) throws InterruptedException
    {
        Objects.requireNonNull(timeout, "timeout");
        if (set) {
            return true;
        }

        long remaining = timeout.toNanos();
        if (remaining <= 0) {
            return false;
        }

        long observed = generation;
        long deadline = System.nanoTime() + remaining;
        while (!set && generation == observed) {
            if (remaining <= 0) {
                return false;
            }
            TimeUnit.NANOSECONDS.timedWait(this, remaining);
            remaining = deadline - System.nanoTime();
        }
        return true;
    }

    @Override
    public synchronized String toString()
    {
        return "WaitableFlag[" + (set ? "set" : "clear") + "]";
    }
}
