package com.questrail.empire.protocol.gge.internal.time;

import java.time.Instant;

/**
 * WallClock
 * =============================================================================
 * Wall-clock source for event timestamps only.
 *
 * <p>
 * It may jump (NTP, DST, manual changes) and MUST NOT drive heartbeats, checks or
 * reconnect delays.
 * </p>
 */
public interface WallClock
{
    Instant now();
}
