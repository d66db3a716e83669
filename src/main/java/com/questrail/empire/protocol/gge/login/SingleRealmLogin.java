package com.questrail.empire.protocol.gge.login;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.questrail.empire.protocol.gge.correlation.MatchSpec;
import com.questrail.empire.protocol.gge.correlation.PendingRequest;
import com.questrail.empire.protocol.gge.engine.GgeProtocolEngine;
import com.questrail.empire.protocol.gge.model.DelimitedResponse;
import com.questrail.empire.protocol.gge.model.ZoneCredentials;

/**
 * Empire login with {@code lli}.
 *
 * <ul>
 *   <li>{@code 0}: logged in.</li>
 *   <li>{@code 21}: wrong username or password; terminal.</li>
 *   <li>anything else: retried.</li>
 * </ul>
 */
public final class SingleRealmLogin implements LoginStrategy
{
    static final String LOGIN_COMMAND = "lli";
    static final int STATUS_SUCCESS = 0;
    static final int STATUS_INVALID_CREDENTIALS = 21;

    @Override
    public LoginOutcome login(GgeProtocolEngine engine, ZoneCredentials credentials) throws InterruptedException
    {
        PendingRequest<DelimitedResponse> reply = engine.expectDelimited(LOGIN_COMMAND, MatchSpec.any());
        engine.sendJson(LOGIN_COMMAND, loginPayload(credentials));
        int status = engine.await(reply, engine.timing().responseTimeout()).status();

        if (status == STATUS_SUCCESS) {
            return LoginOutcome.SUCCESS;
        }
        if (status == STATUS_INVALID_CREDENTIALS) {
            return new LoginOutcome.InvalidCredentials(status);
        }
        return new LoginOutcome.Failed("Login failed with status: " + status);
    }

    static ObjectNode loginPayload(ZoneCredentials credentials)
    {
        ObjectNode data = JsonNodeFactory.instance.objectNode();
        data.put("CONM", 175);
        data.put("RTM", 24);
        data.put("ID", 0);
        data.put("PL", 1);
        data.put("NOM", credentials.username());
        data.put("PW", credentials.password());
        data.putNull("LT");
        data.put("LANG", "fr");
        data.put("DID", "0");
        data.put("AID", "1760000000000000000");
        data.put("KID", "");
        data.put("REF", "https://empire.goodgamestudios.com");
        data.put("GCI", "");
        data.put("SID", 9);
        data.put("PLFID", 1);
        return data;
    }

    @Override
    public String toString()
    {
        return "SingleRealmLogin";
    }
}
