package com.questrail.empire.protocol.gge.observability;

/**
 * Main interface for receiving connection observability events.
 * Implementations can provide logging, metrics, or tracing.
 *
 * <p>Callbacks may arrive from Netty I/O threads and scheduler threads alike, so
 * implementations must be thread-safe and must not block.</p>
 */
public interface GgeObservabilitySink {
    /**
     * Called when a connection moves through its lifecycle.
     * @param event the lifecycle event
     */
    void onConnectionEvent(GgeConnectionEvent event);

    /**
     * Called when a transport-level event occurs (open, close, error).
     * @param event the transport event
     */
    void onTransportEvent(GgeTransportEvent event);

    /**
     * Called when a reconnect has been scheduled.
     * @param event the restart details
     */
    void onRestartScheduled(GgeRestartEvent event);

    /**
     * Called when an error or anomaly occurs (undecodable frame, failed login step).
     * @param event the error event
     */
    void onError(GgeErrorEvent event);
}
