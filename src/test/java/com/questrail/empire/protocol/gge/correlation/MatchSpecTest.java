package com.questrail.empire.protocol.gge.correlation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MatchSpecTest {

    private final ObjectMapper mapper = new ObjectMapper();

    private JsonNode json(String s) throws Exception {
        return mapper.readTree(s);
    }

    @Test
    void anyMatchesEverythingIncludingAbsentPayload() throws Exception {
        assertTrue(MatchSpec.any().matches(null));
        assertTrue(MatchSpec.any().matches(json("{\"X\":1}")));
    }

    @Test
    void presentRequiresPayload() {
        assertFalse(MatchSpec.present().matches(null));
        assertTrue(MatchSpec.present().matches(TextNode.valueOf("")));
    }

    @Test
    void exactComparesWholePayload() throws Exception {
        assertTrue(MatchSpec.exactly("<RoundHouseKick>").matches(TextNode.valueOf("<RoundHouseKick>")));
        assertFalse(MatchSpec.exactly("a").matches(TextNode.valueOf("b")));
        assertTrue(MatchSpec.exactly(json("{\"X\":1}")).matches(json("{\"X\":1}")));
        assertFalse(MatchSpec.exactly(json("{\"X\":1}")).matches(json("{\"X\":1,\"Y\":2}")));
    }

    @Test
    void patternNeedsContainerPayload() throws Exception {
        MatchSpec spec = MatchSpec.pattern(json("{}"));

        assertTrue(spec.matches(json("{\"X\":1}")));
        assertFalse(spec.matches(json("[]")));
        assertFalse(spec.matches(TextNode.valueOf("{}")));
        assertFalse(spec.matches(null));
    }

    @Test
    void patternMatchesSubset() throws Exception {
        MatchSpec spec = MatchSpec.pattern(json("{\"PID\":3}"));

        assertTrue(spec.matches(json("{\"PID\":3,\"N\":\"x\"}")));
        assertFalse(spec.matches(json("{\"PID\":4}")));
    }
}
