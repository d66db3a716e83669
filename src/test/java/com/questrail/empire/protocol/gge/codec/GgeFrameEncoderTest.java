package com.questrail.empire.protocol.gge.codec;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * GgeFrameEncoderTest
 * -----------------------------------------------------------------------------
 * Outbound framing must be bit-exact.
 */
final class GgeFrameEncoderTest
{
    private final ObjectMapper mapper = new ObjectMapper();
    private final GgeFrameEncoder encoder = new GgeFrameEncoder(mapper);

    @Test
    void heartbeatFrame()
    {
        assertEquals("%xt%EmpireEx_2%pin%1%<RoundHouseKick>%",
                encoder.command("EmpireEx_2", "pin", List.of("<RoundHouseKick>")));
    }

    @Test
    void commandWithoutArguments()
    {
        assertEquals("%xt%EmpireEx_2%gpi%1%", encoder.command("EmpireEx_2", "gpi", List.of()));
    }

    @Test
    void multipleArguments()
    {
        assertEquals("%xt%Z%cmd%1%a%b%", encoder.command("Z", "cmd", List.of("a", "b")));
    }

    @Test
    void jsonCommandIsCompact()
    {
        ObjectNode data = mapper.createObjectNode();
        data.put("TLT", "token");
        data.putObject("O").put("OID", 3);

        assertEquals("%xt%Z%tlep%1%{\"TLT\":\"token\",\"O\":{\"OID\":3}}%",
                encoder.jsonCommand("Z", "tlep", data));
    }

    @Test
    void emptyJsonObject()
    {
        assertEquals("%xt%Z%gbl%1%{}%", encoder.jsonCommand("Z", "gbl", mapper.createObjectNode()));
    }

    @Test
    void xmlFrame()
    {
        assertEquals("<msg t='sys'><body action='verChk' r='0'><ver v='166' /></body></msg>",
                encoder.xml("sys", "verChk", "0", "<ver v='166' />"));
    }

    @Test
    void xmlFrameWithEmptyBody()
    {
        assertEquals("<msg t='sys'><body action='autoJoin' r='-1'></body></msg>",
                encoder.xml("sys", "autoJoin", "-1", ""));
    }
}
