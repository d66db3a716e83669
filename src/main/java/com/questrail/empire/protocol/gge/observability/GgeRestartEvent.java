package com.questrail.empire.protocol.gge.observability;

import com.questrail.empire.protocol.gge.model.ServerType;

import java.time.Duration;
import java.time.Instant;

/**
 * Record representing a scheduled reconnect.
 *
 * @param attempt consecutive restart count before this restart; {@code -1} for a
 *                login retry, which does not use the backoff table
 * @param delay   time until the connect routine runs again
 */
public record GgeRestartEvent(
    Instant timestamp,
    ServerType serverType,
    String zone,
    Kind kind,
    int attempt,
    Duration delay,
    String reason
) {
    public enum Kind {
        /** Backoff restart after a transport fault or failed check. */
        RESTART,
        /** Fixed-delay retry after a failed login attempt. */
        LOGIN_RETRY
    }
}
