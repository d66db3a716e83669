package com.questrail.empire.protocol.gge.login;

import com.questrail.empire.protocol.gge.correlation.MatchSpec;
import com.questrail.empire.protocol.gge.correlation.PendingRequest;
import com.questrail.empire.protocol.gge.engine.GgeProtocolEngine;
import com.questrail.empire.protocol.gge.engine.GgeProtocolException;
import com.questrail.empire.protocol.gge.model.DelimitedResponse;
import com.questrail.empire.protocol.gge.model.XmlResponse;

/**
 * HandshakePrologue
 * =============================================================================
 * XML exchange every variant performs before its login command.
 *
 * <pre>
 *   verChk    (r=0)   -> apiOK        (r=0)
 *   login     (r=0)   -> %nfo%        status 0
 *   autoJoin  (r=-1)  -> joinOK       (r=1)
 *   roundTrip (r=1)   -> roundTripRes (r=1)
 * </pre>
 *
 * <p>The {@code login} body always carries the same anonymous nick and client
 * build string; the account itself is authenticated afterwards by the strategy.</p>
 */
public final class HandshakePrologue
{
    static final String SYSTEM = "sys";
    static final String VERSION_BODY = "<ver v='166' />";
    static final String INFO_COMMAND = "nfo";

    /**
     * @throws GgeProtocolException if {@code nfo} reports a non-zero status
     * @throws com.questrail.empire.protocol.gge.correlation.GgeTimeoutException if a step is not answered
     */
    public void perform(GgeProtocolEngine engine) throws InterruptedException
    {
        PendingRequest<XmlResponse> apiOk = engine.expectXml(SYSTEM, "apiOK", "0");
        engine.sendXml(SYSTEM, "verChk", "0", VERSION_BODY);
        engine.await(apiOk, engine.timing().responseTimeout());

        PendingRequest<DelimitedResponse> info = engine.expectDelimited(INFO_COMMAND, MatchSpec.any());
        engine.sendXml(SYSTEM, "login", "0", loginBody(engine.zone()));
        DelimitedResponse nfo = engine.await(info, engine.timing().responseTimeout());
        if (nfo.status() != 0) {
            throw new GgeProtocolException("Unexpected status: " + nfo.status());
        }

        PendingRequest<XmlResponse> joined = engine.expectXml(SYSTEM, "joinOK", "1");
        engine.sendXml(SYSTEM, "autoJoin", "-1", "");
        engine.await(joined, engine.timing().responseTimeout());

        PendingRequest<XmlResponse> roundTrip = engine.expectXml(SYSTEM, "roundTripRes", "1");
        engine.sendXml(SYSTEM, "roundTrip", "1", "");
        engine.await(roundTrip, engine.timing().responseTimeout());
    }

    static String loginBody(String zone)
    {
        return "<login z='" + zone + "'><nick><![CDATA[]]></nick>"
                + "<pword><![CDATA[1065004%fr%0]]></pword></login>";
    }
}
