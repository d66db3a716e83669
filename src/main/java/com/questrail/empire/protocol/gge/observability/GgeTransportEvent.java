package com.questrail.empire.protocol.gge.observability;

import com.questrail.empire.protocol.gge.model.ServerType;

import java.time.Instant;

/**
 * Record representing a transport-level notification (open, close, error).
 *
 * @param closeCode close code for {@link Kind#CLOSED}, {@code -1} otherwise
 */
public record GgeTransportEvent(
    Instant timestamp,
    ServerType serverType,
    String zone,
    Kind kind,
    int closeCode,
    String detail
) {
    public enum Kind {
        OPENED,
        CLOSED,
        ERROR
    }
}
