package com.questrail.empire.protocol.gge.transport.netty;

import com.questrail.empire.protocol.gge.transport.GgeTransportListener;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Forwards channel events to the port listener.
 *
 * <p>Guarantees a single {@code onClose} per transport no matter how many paths
 * (close frame, connect failure, channel inactive) report the end of the channel,
 * and remembers whether an error preceded it.</p>
 */
final class ListenerRelay
{
    private volatile GgeTransportListener listener;
    private volatile boolean errored;
    private final AtomicBoolean closed = new AtomicBoolean();

    void setListener(GgeTransportListener listener) {
        this.listener = listener;
    }

    GgeTransportListener requireListener() {
        GgeTransportListener l = listener;
        if (l == null) {
            throw new IllegalStateException("GgeTransportListener must be set before open()");
        }
        return l;
    }

    boolean errored() {
        return errored;
    }

    void opened() {
        GgeTransportListener l = listener;
        if (l != null && !closed.get()) {
            l.onOpen();
        }
    }

    void data(String message) {
        GgeTransportListener l = listener;
        if (l != null && !closed.get()) {
            l.onData(message);
        }
    }

    void error(Throwable cause) {
        errored = true;
        GgeTransportListener l = listener;
        if (l != null && !closed.get()) {
            l.onError(cause);
        }
    }

    void closed(int code, String reason) {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        GgeTransportListener l = listener;
        if (l != null) {
            l.onClose(code, reason == null ? "" : reason);
        }
    }
}
