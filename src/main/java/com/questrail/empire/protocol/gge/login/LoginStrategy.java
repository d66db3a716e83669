package com.questrail.empire.protocol.gge.login;

import com.questrail.empire.protocol.gge.engine.GgeProtocolEngine;
import com.questrail.empire.protocol.gge.model.ZoneCredentials;

/**
 * LoginStrategy
 * =============================================================================
 * The account step that follows the shared handshake, one per game variant.
 *
 * <p>A strategy sends its login command through the engine, waits for the reply
 * and classifies it. It never schedules anything itself; {@link GgeConnection}
 * turns the outcome into steady state, a retry or a stop.</p>
 */
public sealed interface LoginStrategy permits SingleRealmLogin, RegisteringLogin, TemporaryServerLogin
{
    /**
     * Perform the account step. The handshake has already completed.
     *
     * @throws com.questrail.empire.protocol.gge.correlation.GgeTimeoutException if a reply never came
     */
    LoginOutcome login(GgeProtocolEngine engine, ZoneCredentials credentials) throws InterruptedException;

    /**
     * Whether a failed attempt is retried after the login retry delay.
     */
    default boolean retriesOnFailure()
    {
        return true;
    }

    /**
     * Whether a transport error restarts the connection.
     */
    default boolean restartsOnTransportError()
    {
        return true;
    }
}
