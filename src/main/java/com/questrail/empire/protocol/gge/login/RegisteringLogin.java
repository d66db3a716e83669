package com.questrail.empire.protocol.gge.login;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.questrail.empire.protocol.gge.correlation.MatchSpec;
import com.questrail.empire.protocol.gge.correlation.PendingRequest;
import com.questrail.empire.protocol.gge.engine.GgeProtocolEngine;
import com.questrail.empire.protocol.gge.model.DelimitedResponse;
import com.questrail.empire.protocol.gge.model.ZoneCredentials;
import com.questrail.empire.protocol.gge.observability.GgeConnectionEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Random;

/**
 * RegisteringLogin
 * =============================================================================
 * Four Kingdoms login with {@code core_lga}; creates the account on first use.
 *
 * <pre>
 *   core_lga ── 10005 ──────────────────────────────► success
 *      │
 *      └── 10010 (player not found)
 *             core_reg ── 10005 ── core_lga ── 10005 ► success
 *                │                    └──── other ──► failed
 *                └──── other ────────────────────────► failed
 * </pre>
 *
 * <p>The registration mail is throwaway: {@code <username>-<n>@mail.com} with a
 * random {@code n} below 99999.</p>
 */
public final class RegisteringLogin implements LoginStrategy
{
    private static final Logger log = LoggerFactory.getLogger(RegisteringLogin.class);

    static final String LOGIN_COMMAND = "core_lga";
    static final String REGISTER_COMMAND = "core_reg";
    static final int STATUS_SUCCESS = 10005;
    static final int STATUS_PLAYER_NOT_FOUND = 10010;

    private static final String APP_ID = "1760000000000000000";

    private final Random random;

    public RegisteringLogin()
    {
        this(new Random());
    }

    public RegisteringLogin(Random random)
    {
        this.random = Objects.requireNonNull(random, "random");
    }

    @Override
    public LoginOutcome login(GgeProtocolEngine engine, ZoneCredentials credentials) throws InterruptedException
    {
        int status = requestLogin(engine, credentials);
        if (status == STATUS_SUCCESS) {
            return LoginOutcome.SUCCESS;
        }
        if (status != STATUS_PLAYER_NOT_FOUND) {
            return new LoginOutcome.Failed("Login failed with status: " + status);
        }

        log.info("[{}][{}] Player not found, registering {}", engine.serverType(), engine.zone(), credentials.username());
        PendingRequest<DelimitedResponse> reply = engine.expectDelimited(REGISTER_COMMAND, MatchSpec.any());
        engine.sendJson(REGISTER_COMMAND, registerPayload(credentials));
        int registered = engine.await(reply, engine.timing().responseTimeout()).status();
        if (registered != STATUS_SUCCESS) {
            return new LoginOutcome.Failed("Registration failed with status: " + registered);
        }
        engine.reportConnectionEvent(GgeConnectionEvent.Kind.REGISTERED, credentials.username());

        status = requestLogin(engine, credentials);
        if (status == STATUS_SUCCESS) {
            return LoginOutcome.SUCCESS;
        }
        return new LoginOutcome.Failed("Login after registration failed with status: " + status);
    }

    private int requestLogin(GgeProtocolEngine engine, ZoneCredentials credentials) throws InterruptedException
    {
        PendingRequest<DelimitedResponse> reply = engine.expectDelimited(LOGIN_COMMAND, MatchSpec.any());
        engine.sendJson(LOGIN_COMMAND, loginPayload(credentials));
        return engine.await(reply, engine.timing().responseTimeout()).status();
    }

    static ObjectNode loginPayload(ZoneCredentials credentials)
    {
        ObjectNode data = JsonNodeFactory.instance.objectNode();
        data.put("NM", credentials.username());
        data.put("PW", credentials.password());
        data.put("L", "fr");
        data.put("AID", APP_ID);
        data.put("DID", "5");
        data.put("PLFID", "3");
        data.put("ADID", "null");
        data.put("AFUID", "ggetracker");
        data.put("IDFV", "null");
        return data;
    }

    ObjectNode registerPayload(ZoneCredentials credentials)
    {
        ObjectNode data = JsonNodeFactory.instance.objectNode();
        data.put("PN", credentials.username());
        data.put("PW", credentials.password());
        data.put("MAIL", credentials.username() + "-" + random.nextInt(99999) + "@mail.com");
        data.put("LANG", "fr");
        data.put("AID", APP_ID);
        data.put("DID", "5");
        data.put("PLFID", "3");
        data.put("ADID", "null");
        data.put("AFUID", "appsFlyerUID");
        data.put("IDFV", "null");
        data.put("REF", "");
        return data;
    }

    @Override
    public String toString()
    {
        return "RegisteringLogin";
    }
}
