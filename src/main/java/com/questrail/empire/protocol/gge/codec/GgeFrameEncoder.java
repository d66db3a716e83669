package com.questrail.empire.protocol.gge.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.List;
import java.util.Objects;

/**
 * GgeFrameEncoder
 * ============================================================================
 * Produces outbound text frames. Framing must be bit-exact for the live server:
 *
 * <pre>
 *   %xt%&lt;zone&gt;%&lt;command&gt;%1%&lt;arg0&gt;%&lt;arg1&gt;...%
 *   &lt;msg t='T'&gt;&lt;body action='A' r='R'&gt;BODY&lt;/body&gt;&lt;/msg&gt;
 * </pre>
 *
 * {@code %} is both separator and terminator. Arguments are not escaped; a JSON
 * argument is written compactly.
 */
public final class GgeFrameEncoder
{
    private static final String SEPARATOR = "%";
    private static final String EXTENSION = "xt";
    private static final String ROOM = "1";

    private final ObjectMapper mapper;

    public GgeFrameEncoder(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    public String command(String zone, String command, List<String> args) {
        Objects.requireNonNull(zone, "zone");
        Objects.requireNonNull(command, "command");
        Objects.requireNonNull(args, "args");

        StringBuilder sb = new StringBuilder();
        sb.append(SEPARATOR).append(EXTENSION)
          .append(SEPARATOR).append(zone)
          .append(SEPARATOR).append(command)
          .append(SEPARATOR).append(ROOM);
        for (String arg : args) {
            sb.append(SEPARATOR).append(arg);
        }
        return sb.append(SEPARATOR).toString();
    }

    public String jsonCommand(String zone, String command, JsonNode data) {
        Objects.requireNonNull(data, "data");
        try {
            return command(zone, command, List.of(mapper.writeValueAsString(data)));
        } catch (JsonProcessingException e) {
            // JsonNode trees always serialize; anything else is a programming error.
            throw new IllegalArgumentException("Unserializable payload for " + command, e);
        }
    }

    public String xml(String tag, String action, String room, String body) {
        return "<msg t='" + tag + "'><body action='" + action + "' r='" + room + "'>"
                + body + "</body></msg>";
    }
}
