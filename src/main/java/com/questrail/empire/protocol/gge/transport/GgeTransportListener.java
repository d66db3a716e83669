package com.questrail.empire.protocol.gge.transport;

/**
 * GgeTransportListener
 * -----------------------------------------------------------------------------
 * Callback sink for {@link GgeTransport}.
 *
 * <p>Callbacks for one transport are delivered serially (Netty implementations
 * deliver them on the channel's event loop). Implementations must not block
 * inside a callback.</p>
 */
public interface GgeTransportListener
{
    /**
     * The transport is ready to carry messages.
     */
    void onOpen();

    /**
     * One complete inbound message, already split from the stream where the
     * transport is stream-based.
     */
    void onData(String message);

    /**
     * An I/O or handshake failure. A close usually follows.
     */
    void onError(Throwable cause);

    /**
     * The transport is gone.
     *
     * @param code   WebSocket-style close code; {@code 1006} for an abnormal close
     * @param reason close reason, possibly empty
     */
    void onClose(int code, String reason);
}
