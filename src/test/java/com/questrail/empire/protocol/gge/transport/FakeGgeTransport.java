package com.questrail.empire.protocol.gge.transport;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * FakeGgeTransport
 * -----------------------------------------------------------------------------
 * Test-only {@link GgeTransport} implementation.
 *
 * <p>Stores outbound messages and hands each one to a responder whose replies are
 * delivered synchronously, on the sending thread, before {@link #send(String)}
 * returns. Callers register their waiter before sending, so a synchronous reply
 * is never missed. Tests can also inject inbound messages, errors and closes.</p>
 */
public final class FakeGgeTransport implements GgeTransport {

    private final Function<String, List<String>> responder;
    private final boolean openOnOpen;

    private GgeTransportListener listener;
    private final List<String> sent = new ArrayList<>();
    private boolean opened;
    private boolean closed;

    public FakeGgeTransport(Function<String, List<String>> responder, boolean openOnOpen) {
        this.responder = Objects.requireNonNull(responder, "responder");
        this.openOnOpen = openOnOpen;
    }

    @Override
    public synchronized void setListener(GgeTransportListener listener) {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    @Override
    public void open() {
        GgeTransportListener l;
        synchronized (this) {
            opened = true;
            l = listener;
        }
        if (openOnOpen && l != null) {
            l.onOpen();
        }
    }

    @Override
    public void send(String message) {
        Objects.requireNonNull(message, "message");
        synchronized (this) {
            if (!opened || closed) {
                return;
            }
            sent.add(message);
        }
        for (String reply : responder.apply(message)) {
            injectData(reply);
        }
    }

    @Override
    public void close() {
        GgeTransportListener l;
        synchronized (this) {
            if (closed) {
                return;
            }
            closed = true;
            l = listener;
        }
        if (l != null) {
            l.onClose(1000, "");
        }
    }

    // ---------------------------------------------------------------------
    // Test helpers
    // ---------------------------------------------------------------------

    public void injectData(String message) {
        requireListener().onData(message);
    }

    public void injectError(Throwable cause) {
        requireListener().onError(cause);
    }

    public void injectClose(int code, String reason) {
        synchronized (this) {
            closed = true;
        }
        requireListener().onClose(code, reason);
    }

    public synchronized List<String> sent() {
        return Collections.unmodifiableList(new ArrayList<>(sent));
    }

    public synchronized boolean isClosed() {
        return closed;
    }

    private synchronized GgeTransportListener requireListener() {
        if (listener == null) {
            throw new IllegalStateException("No listener installed");
        }
        return listener;
    }

    /**
     * Factory that records every transport it creates.
     */
    public static final class Factory implements GgeTransportFactory {
        private final Function<String, List<String>> responder;
        private final List<FakeGgeTransport> created = new ArrayList<>();
        private volatile boolean openOnOpen = true;

        public Factory(Function<String, List<String>> responder) {
            this.responder = Objects.requireNonNull(responder, "responder");
        }

        public Factory() {
            this(message -> List.of());
        }

        /**
         * Whether created transports report {@code onOpen} as soon as they are opened.
         */
        public void setOpenOnOpen(boolean openOnOpen) {
            this.openOnOpen = openOnOpen;
        }

        @Override
        public synchronized GgeTransport create() {
            FakeGgeTransport transport = new FakeGgeTransport(responder, openOnOpen);
            created.add(transport);
            return transport;
        }

        public synchronized List<FakeGgeTransport> created() {
            return new ArrayList<>(created);
        }

        public synchronized FakeGgeTransport last() {
            if (created.isEmpty()) {
                throw new IllegalStateException("No transport created yet");
            }
            return created.get(created.size() - 1);
        }

        public synchronized List<String> allSent() {
            List<String> all = new ArrayList<>();
            created.forEach(t -> all.addAll(t.sent()));
            return all;
        }
    }
}
