package com.questrail.empire.protocol.gge.observability;

import com.questrail.empire.protocol.gge.model.ServerType;

import java.time.Instant;

/**
 * Record representing an error or anomaly on one connection.
 *
 * @param cause underlying exception; may be {@code null}
 */
public record GgeErrorEvent(
    Instant timestamp,
    ServerType serverType,
    String zone,
    String message,
    Throwable cause
) {
}
