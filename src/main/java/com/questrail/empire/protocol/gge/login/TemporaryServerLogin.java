package com.questrail.empire.protocol.gge.login;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.questrail.empire.protocol.gge.correlation.MatchSpec;
import com.questrail.empire.protocol.gge.correlation.PendingRequest;
import com.questrail.empire.protocol.gge.engine.GgeProtocolEngine;
import com.questrail.empire.protocol.gge.model.DelimitedResponse;
import com.questrail.empire.protocol.gge.model.ZoneCredentials;

/**
 * Temporary event server login with {@code tlep}.
 *
 * <p>The password slot of the credentials carries the one-off token. Tokens
 * expire, so a failed attempt is not retried and a transport error does not
 * restart the connection. The reply to {@code tlep} arrives as {@code lli}.</p>
 */
public final class TemporaryServerLogin implements LoginStrategy
{
    static final String LOGIN_COMMAND = "tlep";
    static final String REPLY_COMMAND = "lli";

    @Override
    public LoginOutcome login(GgeProtocolEngine engine, ZoneCredentials credentials) throws InterruptedException
    {
        ObjectNode data = JsonNodeFactory.instance.objectNode();
        data.put("TLT", credentials.password());

        PendingRequest<DelimitedResponse> reply = engine.expectDelimited(REPLY_COMMAND, MatchSpec.any());
        engine.sendJson(LOGIN_COMMAND, data);
        int status = engine.await(reply, engine.timing().responseTimeout()).status();

        if (status == SingleRealmLogin.STATUS_SUCCESS) {
            return LoginOutcome.SUCCESS;
        }
        if (status == SingleRealmLogin.STATUS_INVALID_CREDENTIALS) {
            return new LoginOutcome.InvalidCredentials(status);
        }
        return new LoginOutcome.Failed("Login failed with status: " + status);
    }

    @Override
    public boolean retriesOnFailure()
    {
        return false;
    }

    @Override
    public boolean restartsOnTransportError()
    {
        return false;
    }

    @Override
    public String toString()
    {
        return "TemporaryServerLogin";
    }
}
