package com.questrail.empire.protocol.gge.login;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.questrail.empire.protocol.gge.model.ZoneCredentials;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * LoginPayloadsTest
 * -----------------------------------------------------------------------------
 * Field names, values and order of the login and register payloads.
 */
class LoginPayloadsTest {

    private static final ZoneCredentials ACCOUNT = new ZoneCredentials("knight", "secret", "2");

    private static List<String> fieldNames(ObjectNode node) {
        List<String> names = new ArrayList<>();
        node.fieldNames().forEachRemaining(names::add);
        return names;
    }

    @Test
    void singleRealmPayload() {
        ObjectNode data = SingleRealmLogin.loginPayload(ACCOUNT);

        assertEquals(List.of("CONM", "RTM", "ID", "PL", "NOM", "PW", "LT", "LANG", "DID", "AID", "KID", "REF",
                "GCI", "SID", "PLFID"), fieldNames(data));
        assertEquals(175, data.get("CONM").asInt());
        assertEquals("knight", data.get("NOM").asText());
        assertEquals("secret", data.get("PW").asText());
        assertTrue(data.get("LT").isNull());
        assertEquals("https://empire.goodgamestudios.com", data.get("REF").asText());
    }

    @Test
    void registeringLoginPayload() {
        ObjectNode data = RegisteringLogin.loginPayload(ACCOUNT);

        assertEquals(List.of("NM", "PW", "L", "AID", "DID", "PLFID", "ADID", "AFUID", "IDFV"), fieldNames(data));
        assertEquals("knight", data.get("NM").asText());
        assertEquals("ggetracker", data.get("AFUID").asText());
    }

    @Test
    void registerPayloadUsesThrowawayMail() {
        ObjectNode data = new RegisteringLogin(new Random(11)).registerPayload(ACCOUNT);

        assertEquals("knight", data.get("PN").asText());
        assertTrue(data.get("MAIL").asText().matches("knight-\\d{1,5}@mail\\.com"));
        assertEquals("", data.get("REF").asText());
    }

    @Test
    void handshakeLoginBodyCarriesZone() {
        assertEquals("<login z='EmpireEx_2'><nick><![CDATA[]]></nick><pword><![CDATA[1065004%fr%0]]></pword></login>",
                HandshakePrologue.loginBody("EmpireEx_2"));
    }

    @Test
    void temporaryServerNeverRetries() {
        LoginStrategy strategy = new TemporaryServerLogin();

        assertFalse(strategy.retriesOnFailure());
        assertFalse(strategy.restartsOnTransportError());
        assertTrue(new SingleRealmLogin().retriesOnFailure());
        assertTrue(new RegisteringLogin().restartsOnTransportError());
    }
}
