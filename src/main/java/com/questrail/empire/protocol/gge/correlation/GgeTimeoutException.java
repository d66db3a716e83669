package com.questrail.empire.protocol.gge.correlation;

import java.time.Duration;

/**
 * Raised to the caller of a correlated call when no matching frame arrived in time.
 *
 * <p>A timeout is never fatal to the connection. The pending request has already
 * been removed when this is thrown.</p>
 */
public final class GgeTimeoutException extends RuntimeException
{
    private final String expected;
    private final Duration timeout;

    public GgeTimeoutException(String expected, Duration timeout) {
        super("Timed out after " + timeout.toMillis() + "ms waiting for " + expected);
        this.expected = expected;
        this.timeout = timeout;
    }

    public String expected() {
        return expected;
    }

    public Duration timeout() {
        return timeout;
    }
}
