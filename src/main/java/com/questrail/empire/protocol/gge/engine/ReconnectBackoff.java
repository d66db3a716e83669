package com.questrail.empire.protocol.gge.engine;

import java.time.Duration;
import java.util.Objects;
import java.util.Random;

/**
 * Reconnect delay for the n-th consecutive restart.
 *
 * <pre>
 *   attempt   0     1     2     3     4      5+
 *   base(s)   120   180   300   600   1800   3600
 * </pre>
 *
 * plus 0 to 29 seconds of jitter so that many zones dropped by the same outage do
 * not come back in lockstep.
 */
public final class ReconnectBackoff
{
    private static final long[] BASE_SECONDS = {120, 180, 300, 600, 1800};
    private static final long CEILING_SECONDS = 3600;
    private static final int JITTER_SECONDS = 30;

    private final Random random;

    public ReconnectBackoff(Random random) {
        this.random = Objects.requireNonNull(random, "random");
    }

    /**
     * Delay without jitter.
     */
    public static Duration baseDelay(int attempt) {
        if (attempt < 0) {
            throw new IllegalArgumentException("attempt must be >= 0");
        }
        long seconds = attempt < BASE_SECONDS.length ? BASE_SECONDS[attempt] : CEILING_SECONDS;
        return Duration.ofSeconds(seconds);
    }

    public Duration delayFor(int attempt) {
        return baseDelay(attempt).plusSeconds(random.nextInt(JITTER_SECONDS));
    }
}
