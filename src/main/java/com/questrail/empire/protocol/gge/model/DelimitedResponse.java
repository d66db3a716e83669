package com.questrail.empire.protocol.gge.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Objects;

/**
 * Delimited command frame: {@code %xt%<command>%<room>%<status>%<payload>%}.
 *
 * @param command command name, e.g. {@code lli}, {@code gpi}
 * @param status  server status code; {@code 0} is success for most commands
 * @param payload decoded payload: an object node when the raw payload was a JSON
 *                object, a text node otherwise, or {@code null} when the frame had
 *                no payload segment
 */
public record DelimitedResponse(String command, int status, JsonNode payload) implements GgeResponse {

    public DelimitedResponse {
        Objects.requireNonNull(command, "command");
    }

    public boolean hasPayload() {
        return payload != null;
    }
}
