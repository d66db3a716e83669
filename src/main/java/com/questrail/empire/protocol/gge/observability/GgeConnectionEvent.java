package com.questrail.empire.protocol.gge.observability;

import com.questrail.empire.protocol.gge.model.ServerType;

import java.time.Instant;

/**
 * Record representing a lifecycle step of one zone connection.
 */
public record GgeConnectionEvent(
    Instant timestamp,
    ServerType serverType,
    String zone,
    Kind kind,
    String detail
) {
    public enum Kind {
        /** A connect attempt started (new transport created). */
        CONNECTING,
        /** Handshake and login succeeded; steady state begins. */
        LOGGED_IN,
        /** The server rejected the credentials; no retry follows. */
        LOGIN_REJECTED,
        /** The account did not exist and was registered. */
        REGISTERED,
        /** {@code connected} was cleared. */
        DISCONNECTED,
        /** Periodic status check answered. */
        CHECK_OK,
        /** Periodic status check timed out. */
        CHECK_TIMEOUT
    }
}
