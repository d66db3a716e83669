package com.questrail.empire.protocol.gge.transport;

/**
 * GgeTransport
 * -----------------------------------------------------------------------------
 * One physical connection to a game server, carrying complete text messages.
 *
 * <p>A transport is single-use: it is opened once and closed once. The engine
 * creates a fresh transport through {@link GgeTransportFactory} for every
 * connect attempt.</p>
 */
public interface GgeTransport
{
    /**
     * Register the listener. Must be called before {@link #open()}.
     */
    void setListener(GgeTransportListener listener);

    /**
     * Start connecting. Returns immediately; the outcome is reported through
     * {@link GgeTransportListener#onOpen()} or
     * {@link GgeTransportListener#onError(Throwable)}.
     */
    void open();

    /**
     * Send one complete message. Messages sent before the transport is open, or
     * after it closed, are dropped by the implementation.
     */
    void send(String message);

    /**
     * Close the transport. Idempotent.
     */
    void close();
}
