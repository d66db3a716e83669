package com.questrail.empire.protocol.gge.login;

import com.questrail.empire.protocol.gge.engine.GgeProtocolEngine;
import com.questrail.empire.protocol.gge.engine.GgeProtocolException;
import com.questrail.empire.protocol.gge.model.ServerType;
import com.questrail.empire.protocol.gge.model.ZoneCredentials;
import com.questrail.empire.protocol.gge.observability.GgeConnectionEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * GgeConnection
 * =============================================================================
 * One zone: an engine, the login strategy of its variant and the account.
 *
 * <h2>Connect routine</h2>
 * <ol>
 *   <li>{@link GgeProtocolEngine#init()}, then wait for the transport to open.</li>
 *   <li>{@link HandshakePrologue}.</li>
 *   <li>{@link LoginStrategy#login}.</li>
 *   <li>{@code Success}: {@link GgeProtocolEngine#pingAndCheck()}.<br>
 *       {@code InvalidCredentials}: report and stop.<br>
 *       {@code Failed}, or any exception on the way: login retry (if the
 *       strategy retries).</li>
 * </ol>
 *
 * <p>The routine is installed on the engine, so every backoff restart reruns it
 * against a fresh transport while this object, the zone and the account stay
 * the same.</p>
 *
 * <p>A failure is retried on behalf of the attempt it belongs to. After
 * {@link #close()} an attempt still in flight fails without scheduling anything.</p>
 */
public final class GgeConnection
{
    private static final Logger log = LoggerFactory.getLogger(GgeConnection.class);

    private final GgeProtocolEngine engine;
    private final LoginStrategy strategy;
    private final ZoneCredentials credentials;
    private final HandshakePrologue prologue = new HandshakePrologue();

    public GgeConnection(GgeProtocolEngine engine, LoginStrategy strategy, ZoneCredentials credentials)
    {
        this.engine = Objects.requireNonNull(engine, "engine");
        this.strategy = Objects.requireNonNull(strategy, "strategy");
        this.credentials = Objects.requireNonNull(credentials, "credentials");

        engine.setConnectRoutine(this::connect);
        engine.setRestartOnTransportError(strategy.restartsOnTransportError());
    }

    /**
     * Run one connect attempt on the calling thread. Blocks until the attempt
     * has logged in or failed.
     */
    public void connect()
    {
        int attempt = engine.generation();
        try {
            attempt = engine.init();
            if (!engine.awaitOpened()) {
                throw new GgeProtocolException("Socket not connected");
            }
            log.debug("[{}][{}] Transport open, starting handshake", engine.serverType(), engine.zone());

            prologue.perform(engine);
            LoginOutcome outcome = strategy.login(engine, credentials);

            if (outcome instanceof LoginOutcome.Success) {
                // pingAndCheck() runs the first status check itself and keeps it rescheduling.
                engine.pingAndCheck();
            }
            else if (outcome instanceof LoginOutcome.InvalidCredentials) {
                engine.reportConnectionEvent(GgeConnectionEvent.Kind.LOGIN_REJECTED,
                        "Invalid credentials for " + credentials.username()
                                + " (status " + ((LoginOutcome.InvalidCredentials) outcome).status() + ")");
            }
            else {
                failed(attempt, ((LoginOutcome.Failed) outcome).message(), null);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (RuntimeException e) {
            failed(attempt, String.valueOf(e.getMessage()), e);
        }
    }

    /**
     * Start connecting in the background.
     */
    public void start()
    {
        engine.connectAsync();
    }

    /**
     * Administrative reconnect; goes through the normal backoff.
     */
    public void restart()
    {
        engine.restart("restart requested");
    }

    /**
     * Stop for good. No reconnect follows.
     */
    public void close()
    {
        engine.shutdown();
    }

    public boolean isConnected()
    {
        return engine.isConnected();
    }

    public String zone()
    {
        return engine.zone();
    }

    public ServerType serverType()
    {
        return engine.serverType();
    }

    public GgeProtocolEngine engine()
    {
        return engine;
    }

    public LoginStrategy strategy()
    {
        return strategy;
    }

    private void failed(int attempt, String message, Throwable cause)
    {
        if (engine.isShutDown()) {
            log.debug("[{}][{}] Attempt failed after close: {}", engine.serverType(), engine.zone(), message);
            return;
        }
        if (strategy.retriesOnFailure()) {
            engine.scheduleRetry(attempt, message);
        }
        else {
            engine.reportError("Connect attempt failed: " + message, cause);
        }
    }

    @Override
    public String toString()
    {
        return "GgeConnection[" + engine.serverType() + "/" + engine.zone() + ", " + strategy + "]";
    }
}
