package com.questrail.empire.protocol.gge.login;

import com.questrail.empire.protocol.gge.engine.GgeProtocolEngine;
import com.questrail.empire.protocol.gge.engine.GgeTimingPolicy;
import com.questrail.empire.protocol.gge.model.ServerType;
import com.questrail.empire.protocol.gge.model.ZoneCredentials;
import com.questrail.empire.protocol.gge.observability.GgeConnectionEvent;
import com.questrail.empire.protocol.gge.observability.GgeErrorEvent;
import com.questrail.empire.protocol.gge.observability.GgeRestartEvent;
import com.questrail.empire.protocol.gge.observability.RecordingObservabilitySink;
import com.questrail.empire.protocol.gge.time.DeterministicScheduler;
import com.questrail.empire.protocol.gge.time.ManualMonotonicClock;
import com.questrail.empire.protocol.gge.transport.FakeGgeTransport;
import com.questrail.empire.protocol.gge.transport.ScriptedGgeServer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Random;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * GgeConnectionTest
 * -----------------------------------------------------------------------------
 * Full connect attempts (handshake, variant login, steady state) against a
 * scripted server.
 */
class GgeConnectionTest {

    private static final GgeTimingPolicy TIMING = new GgeTimingPolicy(
            Duration.ofMillis(50),
            Duration.ofMillis(50),
            Duration.ofSeconds(60),
            Duration.ofSeconds(1),
            Duration.ofMinutes(15),
            Duration.ofSeconds(10),
            Duration.ofMinutes(10),
            Duration.ofMinutes(5));

    private static final ZoneCredentials ACCOUNT = new ZoneCredentials("knight", "secret", "2");

    private ManualMonotonicClock clock;
    private DeterministicScheduler scheduler;
    private RecordingObservabilitySink sink;
    private ScriptedGgeServer server;
    private FakeGgeTransport.Factory transports;

    @BeforeEach
    void setUp() {
        clock = new ManualMonotonicClock();
        scheduler = new DeterministicScheduler(clock);
        sink = new RecordingObservabilitySink();
        server = new ScriptedGgeServer().reply("gpi", 0, "{}");
        transports = new FakeGgeTransport.Factory(server);
    }

    private GgeConnection connection(ServerType type, LoginStrategy strategy) {
        GgeProtocolEngine engine = GgeProtocolEngine.builder("EmpireEx_2", type)
                .withTransportFactory(transports)
                .withScheduler(scheduler, clock)
                .withTiming(TIMING)
                .withObservabilitySink(sink)
                .withRandom(new Random(1))
                .build();
        return new GgeConnection(engine, strategy, ACCOUNT);
    }

    private long connectAttempts() {
        return sink.connectionKinds().stream().filter(k -> k == GgeConnectionEvent.Kind.CONNECTING).count();
    }

    private List<GgeRestartEvent> retries() {
        return sink.restarts().stream()
                .filter(e -> e.kind() == GgeRestartEvent.Kind.LOGIN_RETRY)
                .collect(Collectors.toList());
    }

    // ---------------------------------------------------------------------
    // Single realm
    // ---------------------------------------------------------------------

    @Test
    void singleRealmLoginEntersSteadyState() {
        server.reply("lli", 0, "{}");
        GgeConnection connection = connection(ServerType.EP, new SingleRealmLogin());

        connection.connect();

        assertTrue(connection.isConnected());
        assertEquals(List.of("verChk", "login", "autoJoin", "roundTrip", "lli", "pin", "gpi"), server.received());
        assertTrue(sink.connectionKinds().contains(GgeConnectionEvent.Kind.LOGGED_IN));
        assertTrue(sink.restarts().isEmpty());
    }

    @Test
    void handshakeFramesAreExact() {
        server.reply("lli", 0, null);
        GgeConnection connection = connection(ServerType.EP, new SingleRealmLogin());

        connection.connect();

        List<String> sent = transports.last().sent();
        assertEquals("<msg t='sys'><body action='verChk' r='0'><ver v='166' /></body></msg>", sent.get(0));
        assertEquals("<msg t='sys'><body action='login' r='0'><login z='EmpireEx_2'><nick><![CDATA[]]></nick>"
                + "<pword><![CDATA[1065004%fr%0]]></pword></login></body></msg>", sent.get(1));
        assertEquals("<msg t='sys'><body action='autoJoin' r='-1'></body></msg>", sent.get(2));
        assertEquals("<msg t='sys'><body action='roundTrip' r='1'></body></msg>", sent.get(3));
        assertTrue(sent.get(4).startsWith("%xt%EmpireEx_2%lli%1%{\"CONM\":175,"));
        assertTrue(sent.get(4).contains("\"NOM\":\"knight\",\"PW\":\"secret\",\"LT\":null"));
    }

    @Test
    void invalidCredentialsStopWithoutRetry() {
        server.reply("lli", 21, null);
        GgeConnection connection = connection(ServerType.EP, new SingleRealmLogin());

        connection.connect();
        scheduler.advance(Duration.ofHours(3));

        assertFalse(connection.isConnected());
        assertTrue(sink.connectionKinds().contains(GgeConnectionEvent.Kind.LOGIN_REJECTED));
        assertTrue(sink.restarts().isEmpty());
        assertEquals(1, connectAttempts());
    }

    @Test
    void otherLoginStatusSchedulesOneRetry() {
        server.reply("lli", 3, null);
        GgeConnection connection = connection(ServerType.EP, new SingleRealmLogin());

        connection.connect();

        assertEquals(1, retries().size());
        assertEquals(Duration.ofMinutes(5), retries().get(0).delay());
        assertTrue(retries().get(0).reason().contains("3"));

        scheduler.advance(Duration.ofMinutes(5));
        GgeRestartEvent restart = sink.restarts().get(1);
        assertEquals(GgeRestartEvent.Kind.RESTART, restart.kind());

        scheduler.advance(restart.delay());
        assertEquals(2, connectAttempts());
        assertEquals(2, retries().size());
    }

    @Test
    void nonZeroInfoStatusFailsAttempt() {
        server.withNfoStatus(5).reply("lli", 0, null);
        GgeConnection connection = connection(ServerType.EP, new SingleRealmLogin());

        connection.connect();

        assertFalse(connection.isConnected());
        assertEquals("Unexpected status: 5", retries().get(0).reason());
        assertEquals(0, server.count("lli"));
    }

    @Test
    void unansweredHandshakeStepFailsAttempt() {
        server.silenceXml("autoJoin").reply("lli", 0, null);
        GgeConnection connection = connection(ServerType.EP, new SingleRealmLogin());

        connection.connect();

        assertFalse(connection.isConnected());
        assertEquals(1, retries().size());
        assertEquals(0, connection.engine().pendingRequestCount());
    }

    @Test
    void transportThatNeverOpensFailsAttempt() {
        transports.setOpenOnOpen(false);
        GgeConnection connection = connection(ServerType.EP, new SingleRealmLogin());

        connection.connect();

        assertEquals("Socket not connected", retries().get(0).reason());
        assertTrue(server.received().isEmpty());
    }

    @Test
    void startConnectsOnScheduler() {
        server.reply("lli", 0, null);
        GgeConnection connection = connection(ServerType.EP, new SingleRealmLogin());

        connection.start();
        assertFalse(connection.isConnected());

        scheduler.runDueTasks();
        assertTrue(connection.isConnected());
    }

    @Test
    void restartRerunsLoginOnFreshTransport() {
        server.reply("lli", 0, null);
        GgeConnection connection = connection(ServerType.EP, new SingleRealmLogin());
        connection.connect();

        connection.restart();
        assertFalse(connection.isConnected());

        scheduler.advance(sink.restarts().get(0).delay());

        assertTrue(connection.isConnected());
        assertEquals(2, transports.created().size());
        assertEquals(2, server.count("lli"));
        assertEquals(0, connection.engine().restartAttempts());
    }

    @Test
    void closeStopsReconnecting() {
        server.reply("lli", 0, null);
        GgeConnection connection = connection(ServerType.EP, new SingleRealmLogin());
        connection.connect();

        connection.close();
        scheduler.advance(Duration.ofHours(3));

        assertFalse(connection.isConnected());
        assertEquals(1, connectAttempts());
    }

    @Test
    void closeDuringConnectAttemptStaysClosed() {
        AtomicReference<GgeConnection> current = new AtomicReference<>();
        transports = new FakeGgeTransport.Factory(message -> {
            if (message.contains("action='verChk'")) {
                current.get().close();
                return List.of();
            }
            return server.apply(message);
        });
        GgeConnection connection = connection(ServerType.EP, new SingleRealmLogin());
        current.set(connection);

        connection.connect();
        scheduler.advance(Duration.ofMinutes(5));
        scheduler.advance(Duration.ofMinutes(3));

        assertFalse(connection.isConnected());
        assertTrue(sink.restarts().isEmpty());
        assertEquals(1, connectAttempts());
        assertEquals(1, transports.created().size());
    }

    @Test
    void closeWhileDisconnectedCheckPendingStaysClosed() {
        server.reply("lli", 0, null);
        GgeConnection connection = connection(ServerType.EP, new SingleRealmLogin());
        connection.connect();

        transports.last().injectClose(1006, "");
        // The periodic check finds the connection down and arms the long re-check.
        scheduler.advance(Duration.ofMinutes(15));

        connection.close();
        scheduler.advance(Duration.ofMinutes(10));
        scheduler.advance(Duration.ofMinutes(3));

        assertTrue(sink.restarts().isEmpty());
        assertEquals(1, connectAttempts());
        assertEquals(1, transports.created().size());
    }

    // ---------------------------------------------------------------------
    // Four Kingdoms
    // ---------------------------------------------------------------------

    @Test
    void registeringLoginSucceedsDirectly() {
        server.reply("core_lga", 10005, null);
        GgeConnection connection = connection(ServerType.E4K, new RegisteringLogin(new Random(3)));

        connection.connect();

        assertTrue(connection.isConnected());
        assertEquals(0, server.count("core_reg"));
    }

    @Test
    void missingPlayerIsRegisteredThenLoggedIn() {
        server.reply("core_lga", 10010, null)
              .reply("core_lga", 10005, null)
              .reply("core_reg", 10005, null);
        GgeConnection connection = connection(ServerType.E4K, new RegisteringLogin(new Random(3)));

        connection.connect();

        assertTrue(connection.isConnected());
        assertEquals(2, server.count("core_lga"));
        assertEquals(1, server.count("core_reg"));
        assertTrue(sink.connectionKinds().contains(GgeConnectionEvent.Kind.REGISTERED));
        assertTrue(retries().isEmpty());

        String register = transports.last().sent().stream()
                .filter(s -> s.contains("%core_reg%")).findFirst().orElseThrow();
        assertTrue(register.matches(".*\"MAIL\":\"knight-\\d{1,5}@mail\\.com\".*"));
    }

    @Test
    void failedLoginAfterRegistrationRetries() {
        server.reply("core_lga", 10010, null)
              .reply("core_lga", 1, null)
              .reply("core_reg", 10005, null);
        GgeConnection connection = connection(ServerType.E4K, new RegisteringLogin(new Random(3)));

        connection.connect();

        assertFalse(connection.isConnected());
        assertEquals(2, server.count("core_lga"));
        assertEquals(1, retries().size());
    }

    @Test
    void failedRegistrationRetries() {
        server.reply("core_lga", 10010, null)
              .reply("core_reg", 10011, null);
        GgeConnection connection = connection(ServerType.E4K, new RegisteringLogin(new Random(3)));

        connection.connect();

        assertFalse(connection.isConnected());
        assertEquals(1, server.count("core_lga"));
        assertTrue(retries().get(0).reason().contains("10011"));
    }

    @Test
    void unexpectedLoginStatusRetriesWithoutRegistering() {
        server.reply("core_lga", 42, null);
        GgeConnection connection = connection(ServerType.E4K, new RegisteringLogin(new Random(3)));

        connection.connect();

        assertEquals(0, server.count("core_reg"));
        assertEquals(1, retries().size());
    }

    // ---------------------------------------------------------------------
    // Temporary server
    // ---------------------------------------------------------------------

    @Test
    void temporaryServerLogsInWithToken() {
        server.reply("tlep", "lli", 0, null);
        GgeConnection connection = connection(ServerType.LIVE, new TemporaryServerLogin());

        connection.connect();

        assertTrue(connection.isConnected());
        assertTrue(transports.last().sent().contains("%xt%EmpireEx_2%tlep%1%{\"TLT\":\"secret\"}%"));
    }

    @Test
    void temporaryServerFailureIsNotRetried() {
        server.reply("tlep", "lli", 3, null);
        GgeConnection connection = connection(ServerType.LIVE, new TemporaryServerLogin());

        connection.connect();
        scheduler.advance(Duration.ofHours(3));

        assertFalse(connection.isConnected());
        assertTrue(sink.restarts().isEmpty());
        assertTrue(sink.hasEventOfType(GgeErrorEvent.class));
        assertEquals(1, connectAttempts());
    }

    @Test
    void temporaryServerIgnoresTransportErrors() {
        server.reply("tlep", "lli", 0, null);
        GgeConnection connection = connection(ServerType.LIVE, new TemporaryServerLogin());
        connection.connect();

        transports.last().injectError(new IOException("reset"));

        assertTrue(sink.restarts().isEmpty());
    }
}
