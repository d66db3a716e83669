package com.questrail.empire.protocol.gge.codec;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.questrail.empire.protocol.gge.model.DelimitedResponse;
import com.questrail.empire.protocol.gge.model.GgeResponse;
import com.questrail.empire.protocol.gge.model.XmlResponse;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * GgeFrameDecoderTest
 * -----------------------------------------------------------------------------
 * Unit tests for {@link GgeFrameDecoder}.
 */
final class GgeFrameDecoderTest
{
    private final GgeFrameDecoder decoder = new GgeFrameDecoder(new ObjectMapper());

    @Test
    void decodesXmlFrame()
    {
        GgeResponse r = decoder.decode("<msg t='sys'><body action='joinOK' r='1'><pid id='0'/></body></msg>");

        XmlResponse xml = assertInstanceOf(XmlResponse.class, r);
        assertEquals("sys", xml.tag());
        assertEquals("joinOK", xml.action());
        assertEquals("1", xml.room());
        assertEquals("<pid id='0'/>", xml.body());
    }

    @Test
    void decodesXmlFrameWithEmptyBody()
    {
        XmlResponse xml = (XmlResponse) decoder.decode("<msg t='sys'><body action='apiOK' r='0'></body></msg>");

        assertEquals("apiOK", xml.action());
        assertEquals("", xml.body());
    }

    @Test
    void rejectsMalformedXml()
    {
        assertThrows(GgeDecodeException.class, () -> decoder.decode("<cross-domain-policy/>"));
    }

    @Test
    void decodesJsonPayload()
    {
        DelimitedResponse r = (DelimitedResponse) decoder.decode("%xt%gpi%1%0%{\"GID\":5,\"N\":\"x\"}%");

        assertEquals("gpi", r.command());
        assertEquals(0, r.status());
        assertTrue(r.payload().isObject());
        assertEquals(5, r.payload().get("GID").asInt());
    }

    @Test
    void absentPayloadIsNull()
    {
        DelimitedResponse r = (DelimitedResponse) decoder.decode("%xt%nfo%1%0%");

        assertEquals("nfo", r.command());
        assertFalse(r.hasPayload());
        assertNull(r.payload());
    }

    @Test
    void nonJsonPayloadIsKeptAsText()
    {
        DelimitedResponse r = (DelimitedResponse) decoder.decode("%xt%pin%1%0%<RoundHouseKick>%");

        assertTrue(r.payload().isTextual());
        assertEquals("<RoundHouseKick>", r.payload().asText());
    }

    @Test
    void payloadSegmentsAreRejoined()
    {
        DelimitedResponse r = (DelimitedResponse) decoder.decode("%xt%abc%1%0%a%b%c%");

        assertEquals("a%b%c", r.payload().asText());
    }

    @Test
    void nonZeroStatusIsKept()
    {
        DelimitedResponse r = (DelimitedResponse) decoder.decode("%xt%lli%1%21%");

        assertEquals(21, r.status());
    }

    @Test
    void rejectsTooFewSegments()
    {
        assertThrows(GgeDecodeException.class, () -> decoder.decode("%xt%lli%1%"));
    }

    @Test
    void rejectsNonNumericStatus()
    {
        assertThrows(GgeDecodeException.class, () -> decoder.decode("%xt%lli%1%ok%"));
    }

    @Test
    void rejectsBrokenJson()
    {
        assertThrows(GgeDecodeException.class, () -> decoder.decode("%xt%gdi%1%0%{\"O\":%"));
    }

    @Test
    void abbreviatesLongFrames()
    {
        String raw = "x".repeat(500);
        assertEquals(203, GgeFrameDecoder.abbreviate(raw).length());
        assertEquals("short", GgeFrameDecoder.abbreviate("short"));
    }
}
