package com.questrail.empire.protocol.gge.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.questrail.empire.protocol.gge.codec.GgeDecodeException;
import com.questrail.empire.protocol.gge.codec.GgeFrameDecoder;
import com.questrail.empire.protocol.gge.codec.GgeFrameEncoder;
import com.questrail.empire.protocol.gge.correlation.GgeTimeoutException;
import com.questrail.empire.protocol.gge.correlation.MatchSpec;
import com.questrail.empire.protocol.gge.correlation.PendingRequest;
import com.questrail.empire.protocol.gge.correlation.PendingRequests;
import com.questrail.empire.protocol.gge.internal.sync.WaitableFlag;
import com.questrail.empire.protocol.gge.internal.time.Cancellable;
import com.questrail.empire.protocol.gge.internal.time.MonotonicClock;
import com.questrail.empire.protocol.gge.internal.time.MonotonicScheduler;
import com.questrail.empire.protocol.gge.internal.time.SystemWallClock;
import com.questrail.empire.protocol.gge.internal.time.WallClock;
import com.questrail.empire.protocol.gge.model.DelimitedResponse;
import com.questrail.empire.protocol.gge.model.GgeResponse;
import com.questrail.empire.protocol.gge.model.ServerType;
import com.questrail.empire.protocol.gge.model.XmlResponse;
import com.questrail.empire.protocol.gge.observability.GgeConnectionEvent;
import com.questrail.empire.protocol.gge.observability.GgeErrorEvent;
import com.questrail.empire.protocol.gge.observability.GgeObservabilitySink;
import com.questrail.empire.protocol.gge.observability.GgeRestartEvent;
import com.questrail.empire.protocol.gge.observability.GgeTransportEvent;
import com.questrail.empire.protocol.gge.observability.NullObservabilitySink;
import com.questrail.empire.protocol.gge.transport.GgeTransport;
import com.questrail.empire.protocol.gge.transport.GgeTransportFactory;
import com.questrail.empire.protocol.gge.transport.GgeTransportListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Random;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * GgeProtocolEngine
 * =============================================================================
 * Connection lifecycle and request correlation for one zone.
 *
 * <h2>Responsibilities</h2>
 * <ul>
 *   <li>Owns the current {@link GgeTransport}; a connect attempt always creates a
 *       fresh one through {@link GgeTransportFactory}.</li>
 *   <li>Frames outbound commands and decodes inbound frames.</li>
 *   <li>Matches inbound frames against {@link PendingRequests}.</li>
 *   <li>Drives heartbeat, periodic status checks and reconnect backoff through the
 *       injected {@link MonotonicScheduler}.</li>
 * </ul>
 *
 * <h2>What the engine does NOT do</h2>
 * It does not know how to log in. The login sequence is installed as the
 * <em>connect routine</em> ({@link #setConnectRoutine(Runnable)}) and is rerun by
 * every reconnect.
 *
 * <h2>Connect attempts and staleness</h2>
 * Every {@link #init()} starts a new <em>generation</em>. Transport callbacks,
 * heartbeats, status checks and login retries remember the generation they
 * belong to and do nothing once a newer attempt exists. At most one reconnect is
 * scheduled at a time: {@link #restart(String)} cancels the previous one.
 *
 * <h2>Shutdown</h2>
 * {@link #shutdown()} is terminal. Once it has run, no restart, login retry or
 * connect routine is started again, whatever timer or attempt is still in flight.
 *
 * <h2>Threading</h2>
 * Transport callbacks never block. Correlated waits ({@link #await}) block the
 * calling thread, which is a scheduler thread for connect routines and checks or
 * the caller's own thread for gateway requests.
 */
public final class GgeProtocolEngine
{
    private static final Logger log = LoggerFactory.getLogger(GgeProtocolEngine.class);

    static final String HEARTBEAT_COMMAND = "pin";
    static final String HEARTBEAT_ARGUMENT = "<RoundHouseKick>";
    static final String STATUS_COMMAND = "gpi";
    static final String EXTRA_LOGIN_COMMAND = "gbl";

    private final String zone;
    private final ServerType serverType;
    private final GgeTransportFactory transportFactory;
    private final GgeFrameDecoder decoder;
    private final GgeFrameEncoder encoder;
    private final MonotonicScheduler scheduler;
    private final MonotonicClock clock;
    private final WallClock wallClock;
    private final GgeTimingPolicy timing;
    private final ReconnectBackoff backoff;
    private final GgeObservabilitySink sink;
    private final boolean extraLoginCommand;

    private final PendingRequests pending = new PendingRequests();
    private final WaitableFlag opened = new WaitableFlag();
    private final WaitableFlag connected = new WaitableFlag();
    private final WaitableFlag closed = new WaitableFlag();

    private final AtomicInteger generation = new AtomicInteger();
    private final AtomicInteger restartAttempts = new AtomicInteger();

    private volatile GgeTransport transport;
    private volatile Runnable connectRoutine = () -> { };
    private volatile boolean reconnectRequested;
    private volatile boolean restartOnTransportError = true;
    private volatile boolean shutDown;

    // Guarded by this.
    private Cancellable scheduledReconnect;

    private GgeProtocolEngine(Builder b)
    {
        this.zone = b.zone;
        this.serverType = b.serverType;
        this.transportFactory = Objects.requireNonNull(b.transportFactory, "transportFactory");
        this.scheduler = Objects.requireNonNull(b.scheduler, "scheduler");
        this.clock = Objects.requireNonNull(b.clock, "clock");
        this.wallClock = b.wallClock;
        this.timing = b.timing;
        this.backoff = new ReconnectBackoff(b.random);
        this.sink = b.sink;
        this.extraLoginCommand = b.extraLoginCommand;
        this.decoder = new GgeFrameDecoder(b.mapper);
        this.encoder = new GgeFrameEncoder(b.mapper);
    }

    public static Builder builder(String zone, ServerType serverType)
    {
        return new Builder(zone, serverType);
    }

    // -------------------------------------------------------------------------
    // Lifecycle
    // -------------------------------------------------------------------------

    /**
     * Start a new connect attempt: create a transport, bind its events to this
     * attempt and open it. Does not wait for the transport to open.
     *
     * @return the generation of the new attempt
     * @throws GgeProtocolException if the engine has been shut down
     */
    public int init()
    {
        if (shutDown) {
            throw new GgeProtocolException("Connection closed");
        }
        int gen = generation.incrementAndGet();

        opened.clear();
        closed.clear();
        connected.clear();

        GgeTransport t = transportFactory.create();
        t.setListener(new AttemptListener(gen));
        this.transport = t;

        reportConnectionEvent(GgeConnectionEvent.Kind.CONNECTING, t.toString());
        t.open();
        return gen;
    }

    /**
     * Wait up to the open timeout for the current transport to open.
     */
    public boolean awaitOpened() throws InterruptedException
    {
        return opened.await(timing.openTimeout());
    }

    /**
     * Enter steady state after a successful login: heartbeat now and every
     * interval, optional housekeeping command, reset of the restart counter, then
     * the first status check.
     */
    public void pingAndCheck()
    {
        connected.set();
        reportConnectionEvent(GgeConnectionEvent.Kind.LOGGED_IN, "restart counter reset");

        int gen = generation.get();
        heartbeat(gen);

        if (extraLoginCommand) {
            scheduler.scheduleAfter(timing.extraLoginCommandDelay(), clock, () -> {
                if (isCurrent(gen)) {
                    sendJson(EXTRA_LOGIN_COMMAND, JsonNodeFactory.instance.objectNode());
                    log.debug("[{}][{}] Sent {} after login", serverType, zone, EXTRA_LOGIN_COMMAND);
                }
            });
        }

        restartAttempts.set(0);
        checkConnection();
    }

    /**
     * One status check.
     *
     * <ul>
     *   <li>Connected and answered: next check after the check interval.</li>
     *   <li>Connected and unanswered: restart after a short delay, but only if the
     *       connection is still marked connected by then.</li>
     *   <li>Not connected: restart after a longer delay if still not connected.</li>
     * </ul>
     */
    public void checkConnection()
    {
        if (!connected.isSet()) {
            log.warn("[{}][{}] Not connected, skipping status check", serverType, zone);
            int gen = generation.get();
            scheduler.scheduleAfter(timing.disconnectedCheckDelay(), clock, () -> {
                if (!shutDown && isCurrent(gen) && !connected.isSet()) {
                    restart("still disconnected after status check");
                }
            });
            return;
        }

        int gen = generation.get();
        try {
            PendingRequest<DelimitedResponse> status = expectDelimited(STATUS_COMMAND, MatchSpec.any());
            sendJson(STATUS_COMMAND, JsonNodeFactory.instance.objectNode());
            await(status, timing.responseTimeout());

            reportConnectionEvent(GgeConnectionEvent.Kind.CHECK_OK, STATUS_COMMAND);
            scheduler.scheduleAfter(timing.checkInterval(), clock, () -> {
                if (isCurrent(gen)) {
                    checkConnection();
                }
            });
        } catch (GgeTimeoutException e) {
            reportConnectionEvent(GgeConnectionEvent.Kind.CHECK_TIMEOUT, e.getMessage());
            scheduler.scheduleAfter(timing.checkFailureRestartDelay(), clock, () -> {
                // Re-read right before acting; a connection that already dropped is
                // left to its own reconnect.
                if (connected.isSet()) {
                    restart("status check timed out");
                } else {
                    log.warn("[{}][{}] Not connected, not restarting after failed check", serverType, zone);
                }
            });
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Mark the connection down and close the transport.
     *
     * @param reconnect whether a reconnect is intended afterwards
     */
    public void disconnect(boolean reconnect)
    {
        boolean wasConnected = connected.isSet();
        connected.clear();
        reconnectRequested = reconnect;
        if (wasConnected) {
            reportConnectionEvent(GgeConnectionEvent.Kind.DISCONNECTED, reconnect ? "reconnect requested" : "closing");
        }

        GgeTransport t = transport;
        if (t != null) {
            t.close();
        }
    }

    /**
     * Disconnect and rerun the connect routine after the backoff delay for the
     * current restart count.
     */
    public void restart(String reason)
    {
        if (shutDown) {
            log.debug("[{}][{}] Closed, not restarting ({})", serverType, zone, reason);
            return;
        }
        int attempt = restartAttempts.getAndIncrement();
        Duration delay = backoff.delayFor(attempt);

        sink.onRestartScheduled(new GgeRestartEvent(
                wallClock.now(), serverType, zone, GgeRestartEvent.Kind.RESTART, attempt, delay, reason));

        disconnect(false);
        reconnectRequested = true;
        scheduleReconnect(delay);
    }

    /**
     * Failed connect attempt: log and restart after the login retry delay, unless
     * a newer attempt has started in the meantime.
     */
    public void scheduleRetry(String message)
    {
        scheduleRetry(generation.get(), message);
    }

    /**
     * Same as {@link #scheduleRetry(String)} for the attempt that {@link #init()}
     * numbered {@code gen}. Nothing is scheduled if that attempt is already stale
     * or the engine has been shut down.
     */
    public void scheduleRetry(int gen, String message)
    {
        if (shutDown || !isCurrent(gen)) {
            log.debug("[{}][{}] Attempt {} superseded, no login retry ({})", serverType, zone, gen, message);
            return;
        }
        Duration delay = timing.loginRetryDelay();

        sink.onRestartScheduled(new GgeRestartEvent(
                wallClock.now(), serverType, zone, GgeRestartEvent.Kind.LOGIN_RETRY, -1, delay, message));

        scheduler.scheduleAfter(delay, clock, () -> {
            if (!shutDown && isCurrent(gen)) {
                restart(message);
            }
        });
    }

    /**
     * Run the connect routine on the scheduler as soon as possible.
     */
    public void connectAsync()
    {
        scheduleReconnect(Duration.ZERO);
    }

    /**
     * Close for good: cancel any scheduled reconnect and close the transport.
     */
    public void shutdown()
    {
        shutDown = true;
        synchronized (this) {
            if (scheduledReconnect != null) {
                scheduledReconnect.cancel();
                scheduledReconnect = null;
            }
        }
        // Outstanding timers of the current attempt see a newer generation.
        generation.incrementAndGet();
        disconnect(false);
    }

    private synchronized void scheduleReconnect(Duration delay)
    {
        if (shutDown) {
            return;
        }
        if (scheduledReconnect != null) {
            scheduledReconnect.cancel();
        }
        scheduledReconnect = scheduler.scheduleAfter(delay, clock, this::runConnectRoutine);
    }

    private void runConnectRoutine()
    {
        synchronized (this) {
            scheduledReconnect = null;
        }
        if (shutDown) {
            return;
        }
        connectRoutine.run();
    }

    private void heartbeat(int gen)
    {
        if (!connected.isSet() || !isCurrent(gen)) {
            return;
        }
        sendRaw(HEARTBEAT_COMMAND, HEARTBEAT_ARGUMENT);
        scheduler.scheduleAfter(timing.heartbeatInterval(), clock, () -> heartbeat(gen));
    }

    private boolean isCurrent(int gen)
    {
        return generation.get() == gen;
    }

    // -------------------------------------------------------------------------
    // Outbound
    // -------------------------------------------------------------------------

    public void sendRaw(String command, String... args)
    {
        sendRaw(command, Arrays.asList(args));
    }

    public void sendRaw(String command, List<String> args)
    {
        send(encoder.command(zone, command, args));
    }

    public void sendJson(String command, JsonNode data)
    {
        send(encoder.jsonCommand(zone, command, data));
    }

    public void sendXml(String tag, String action, String room, String body)
    {
        send(encoder.xml(tag, action, room, body));
    }

    private void send(String frame)
    {
        GgeTransport t = transport;
        if (t == null) {
            log.debug("[{}][{}] No transport, dropping {}", serverType, zone, frame);
            return;
        }
        log.trace("[{}][{}] >> {}", serverType, zone, frame);
        t.send(frame);
    }

    // -------------------------------------------------------------------------
    // Correlation
    // -------------------------------------------------------------------------

    /**
     * Register a waiter for a delimited reply. Register before sending the
     * request so a fast reply cannot be missed.
     */
    public PendingRequest<DelimitedResponse> expectDelimited(String command, MatchSpec spec)
    {
        PendingRequest<DelimitedResponse> request = PendingRequest.delimited(command, spec);
        pending.register(request);
        return request;
    }

    public PendingRequest<XmlResponse> expectXml(String tag, String action, String room)
    {
        PendingRequest<XmlResponse> request = PendingRequest.xml(tag, action, room);
        pending.register(request);
        return request;
    }

    /**
     * Wait for a registered request.
     *
     * @throws GgeTimeoutException if nothing matched in time; the request has been
     *                             removed from the pending list
     */
    public <R extends GgeResponse> R await(PendingRequest<R> request, Duration timeout)
            throws InterruptedException
    {
        Objects.requireNonNull(request, "request");
        boolean matched;
        try {
            matched = request.done().await(timeout);
        } catch (InterruptedException e) {
            pending.remove(request);
            throw e;
        }

        if (!matched) {
            if (pending.remove(request)) {
                throw new GgeTimeoutException(request.description(), timeout);
            }
            // Matched between the deadline and the removal; completion is imminent.
            request.done().await();
        }
        return request.response();
    }

    public DelimitedResponse waitForDelimited(String command, MatchSpec spec) throws InterruptedException
    {
        return waitForDelimited(command, spec, timing.responseTimeout());
    }

    public DelimitedResponse waitForDelimited(String command, MatchSpec spec, Duration timeout)
            throws InterruptedException
    {
        return await(expectDelimited(command, spec), timeout);
    }

    public XmlResponse waitForXml(String tag, String action, String room) throws InterruptedException
    {
        return waitForXml(tag, action, room, timing.responseTimeout());
    }

    public XmlResponse waitForXml(String tag, String action, String room, Duration timeout)
            throws InterruptedException
    {
        return await(expectXml(tag, action, room), timeout);
    }

    // -------------------------------------------------------------------------
    // Inbound
    // -------------------------------------------------------------------------

    private void handleFrame(String raw)
    {
        log.trace("[{}][{}] << {}", serverType, zone, raw);

        final GgeResponse response;
        try {
            response = decoder.decode(raw);
        } catch (GgeDecodeException e) {
            reportError("Dropped undecodable frame", e);
            return;
        }
        pending.offer(response);
    }

    /**
     * Transport callbacks for one connect attempt.
     */
    private final class AttemptListener implements GgeTransportListener
    {
        private final int gen;

        AttemptListener(int gen)
        {
            this.gen = gen;
        }

        @Override
        public void onOpen()
        {
            if (!isCurrent(gen)) {
                return;
            }
            transportEvent(GgeTransportEvent.Kind.OPENED, -1, "");
            opened.set();
        }

        @Override
        public void onData(String message)
        {
            if (!isCurrent(gen)) {
                return;
            }
            handleFrame(message);
        }

        @Override
        public void onError(Throwable cause)
        {
            if (!isCurrent(gen)) {
                return;
            }
            transportEvent(GgeTransportEvent.Kind.ERROR, -1, String.valueOf(cause));
            if (restartOnTransportError) {
                restart("transport error: " + cause);
            }
        }

        @Override
        public void onClose(int code, String reason)
        {
            if (!isCurrent(gen)) {
                return;
            }
            transportEvent(GgeTransportEvent.Kind.CLOSED, code, reason);
            opened.clear();
            closed.set();
            disconnect(true);
        }
    }

    /**
     * Report a lifecycle step on behalf of the login sequence.
     */
    public void reportConnectionEvent(GgeConnectionEvent.Kind kind, String detail)
    {
        sink.onConnectionEvent(new GgeConnectionEvent(wallClock.now(), serverType, zone, kind, detail));
    }

    public void reportError(String message, Throwable cause)
    {
        sink.onError(new GgeErrorEvent(wallClock.now(), serverType, zone, message, cause));
    }

    private void transportEvent(GgeTransportEvent.Kind kind, int code, String detail)
    {
        sink.onTransportEvent(new GgeTransportEvent(wallClock.now(), serverType, zone, kind, code, detail));
    }

    // -------------------------------------------------------------------------
    // Accessors
    // -------------------------------------------------------------------------

    /**
     * The routine every reconnect reruns; normally the login sequence.
     */
    public void setConnectRoutine(Runnable connectRoutine)
    {
        this.connectRoutine = Objects.requireNonNull(connectRoutine, "connectRoutine");
    }

    /**
     * Whether a transport error triggers {@link #restart(String)}. Enabled by default.
     */
    public void setRestartOnTransportError(boolean restartOnTransportError)
    {
        this.restartOnTransportError = restartOnTransportError;
    }

    public boolean isConnected()
    {
        return connected.isSet();
    }

    public boolean isOpened()
    {
        return opened.isSet();
    }

    public boolean isClosed()
    {
        return closed.isSet();
    }

    public boolean isShutDown()
    {
        return shutDown;
    }

    public int generation()
    {
        return generation.get();
    }

    public boolean reconnectRequested()
    {
        return reconnectRequested;
    }

    public int restartAttempts()
    {
        return restartAttempts.get();
    }

    public int pendingRequestCount()
    {
        return pending.size();
    }

    public String zone()
    {
        return zone;
    }

    public ServerType serverType()
    {
        return serverType;
    }

    public GgeTimingPolicy timing()
    {
        return timing;
    }

    @Override
    public String toString()
    {
        return "GgeProtocolEngine[" + serverType + "/" + zone + "]";
    }

    // -------------------------------------------------------------------------
    // Builder
    // -------------------------------------------------------------------------

    public static final class Builder
    {
        private final String zone;
        private final ServerType serverType;

        private GgeTransportFactory transportFactory;
        private MonotonicScheduler scheduler;
        private MonotonicClock clock;
        private WallClock wallClock = SystemWallClock.INSTANCE;
        private GgeTimingPolicy timing = GgeTimingPolicy.defaults();
        private GgeObservabilitySink sink = NullObservabilitySink.INSTANCE;
        private ObjectMapper mapper = new ObjectMapper();
        private Random random = new Random();
        private boolean extraLoginCommand;

        private Builder(String zone, ServerType serverType)
        {
            this.zone = Objects.requireNonNull(zone, "zone");
            this.serverType = Objects.requireNonNull(serverType, "serverType");
        }

        public Builder withTransportFactory(GgeTransportFactory transportFactory)
        {
            this.transportFactory = Objects.requireNonNull(transportFactory, "transportFactory");
            return this;
        }

        public Builder withScheduler(MonotonicScheduler scheduler, MonotonicClock clock)
        {
            this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        public Builder withWallClock(WallClock wallClock)
        {
            this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
            return this;
        }

        public Builder withTiming(GgeTimingPolicy timing)
        {
            this.timing = Objects.requireNonNull(timing, "timing");
            return this;
        }

        public Builder withObservabilitySink(GgeObservabilitySink sink)
        {
            this.sink = Objects.requireNonNull(sink, "sink");
            return this;
        }

        public Builder withObjectMapper(ObjectMapper mapper)
        {
            this.mapper = Objects.requireNonNull(mapper, "mapper");
            return this;
        }

        public Builder withRandom(Random random)
        {
            this.random = Objects.requireNonNull(random, "random");
            return this;
        }

        public Builder withExtraLoginCommand(boolean extraLoginCommand)
        {
            this.extraLoginCommand = extraLoginCommand;
            return this;
        }

        public GgeProtocolEngine build()
        {
            return new GgeProtocolEngine(this);
        }
    }
}
