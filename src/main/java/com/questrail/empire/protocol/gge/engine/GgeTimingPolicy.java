package com.questrail.empire.protocol.gge.engine;

import java.time.Duration;
import java.util.Objects;

/**
 * GgeTimingPolicy
 * -----------------------------------------------------------------------------
 * Operational timing for one connection.
 *
 * <p>These values only control <em>when</em> things happen. Whether a connection
 * restarts, retries or gives up is decided by the engine and the login strategy.</p>
 *
 * <h2>Configuration Parameters</h2>
 * <ul>
 *   <li><b>responseTimeout</b>: default wait for a correlated reply.</li>
 *   <li><b>openTimeout</b>: how long a connect attempt waits for the transport to open.</li>
 *   <li><b>heartbeatInterval</b>: cadence of the {@code pin} keep-alive.</li>
 *   <li><b>extraLoginCommandDelay</b>: delay of the optional {@code gbl} after login.</li>
 *   <li><b>checkInterval</b>: cadence of the {@code gpi} status check.</li>
 *   <li><b>checkFailureRestartDelay</b>: wait between a failed check and the restart.</li>
 *   <li><b>disconnectedCheckDelay</b>: when a check finds the connection down, how long
 *       it waits before restarting a connection that is still down.</li>
 *   <li><b>loginRetryDelay</b>: wait before restarting after a failed connect attempt.</li>
 * </ul>
 */
public record GgeTimingPolicy(
        Duration responseTimeout,
        Duration openTimeout,
        Duration heartbeatInterval,
        Duration extraLoginCommandDelay,
        Duration checkInterval,
        Duration checkFailureRestartDelay,
        Duration disconnectedCheckDelay,
        Duration loginRetryDelay
) {
    /**
     * Canonical constructor with validation.
     */
    public GgeTimingPolicy {
        requireNonNegative(responseTimeout, "responseTimeout");
        requireNonNegative(openTimeout, "openTimeout");
        requirePositive(heartbeatInterval, "heartbeatInterval");
        requireNonNegative(extraLoginCommandDelay, "extraLoginCommandDelay");
        requirePositive(checkInterval, "checkInterval");
        requireNonNegative(checkFailureRestartDelay, "checkFailureRestartDelay");
        requireNonNegative(disconnectedCheckDelay, "disconnectedCheckDelay");
        requireNonNegative(loginRetryDelay, "loginRetryDelay");
    }

    /**
     * Creates the policy the live servers are used to.
     *
     * <p>Default values:</p>
     * <ul>
     *   <li>responseTimeout: 5s</li>
     *   <li>openTimeout: 60s</li>
     *   <li>heartbeatInterval: 60s</li>
     *   <li>extraLoginCommandDelay: 1s</li>
     *   <li>checkInterval: 15min</li>
     *   <li>checkFailureRestartDelay: 10s</li>
     *   <li>disconnectedCheckDelay: 10min</li>
     *   <li>loginRetryDelay: 5min</li>
     * </ul>
     */
    public static GgeTimingPolicy defaults() {
        return new GgeTimingPolicy(
                Duration.ofSeconds(5),
                Duration.ofSeconds(60),
                Duration.ofSeconds(60),
                Duration.ofSeconds(1),
                Duration.ofMinutes(15),
                Duration.ofSeconds(10),
                Duration.ofMinutes(10),
                Duration.ofMinutes(5)
        );
    }

    private static void requireNonNegative(Duration d, String name) {
        Objects.requireNonNull(d, name);
        if (d.isNegative()) {
            throw new IllegalArgumentException(name + " must be non-negative");
        }
    }

    private static void requirePositive(Duration d, String name) {
        Objects.requireNonNull(d, name);
        if (d.isNegative() || d.isZero()) {
            throw new IllegalArgumentException(name + " must be positive");
        }
    }
}
