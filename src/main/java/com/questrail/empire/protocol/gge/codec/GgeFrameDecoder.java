package com.questrail.empire.protocol.gge.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;
import com.questrail.empire.protocol.gge.model.DelimitedResponse;
import com.questrail.empire.protocol.gge.model.GgeResponse;
import com.questrail.empire.protocol.gge.model.XmlResponse;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * GgeFrameDecoder
 * ============================================================================
 * Converts one complete inbound text frame into a {@link GgeResponse}.
 *
 * <h2>XML frames</h2>
 * Text starting with {@code <} must contain a single
 * {@code <msg t='T'><body action='A' r='R'>BODY</body></msg>} element.
 *
 * <h2>Delimited frames</h2>
 * Any other text is split on {@code %} with empty segments dropped:
 *
 * <pre>
 *   %xt%lli%1%0%{"CID":1}%
 *    [0] [1] [2][3] [4...]
 *    xt  cmd room status payload
 * </pre>
 *
 * The payload is every segment from index 4 on, joined back with {@code %}.
 * It is decoded as JSON only when it begins with <code>{</code>; otherwise it is
 * kept verbatim as a text node.
 *
 * <h2>What this decoder does NOT do</h2>
 * It never drops frames silently. Failures surface as {@link GgeDecodeException}
 * and the engine decides what to do with them.
 */
public final class GgeFrameDecoder
{
    private static final Pattern XML_FRAME = Pattern.compile(
            "<msg t='(.*?)'><body action='(.*?)' r='(.*?)'>(.*?)</body></msg>");

    private static final String SEPARATOR = "%";

    private final ObjectMapper mapper;

    public GgeFrameDecoder(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    /**
     * Decodes a raw frame.
     *
     * @throws GgeDecodeException if the frame is malformed
     */
    public GgeResponse decode(String raw) {
        Objects.requireNonNull(raw, "raw");
        if (raw.startsWith("<")) {
            return decodeXml(raw);
        }
        return decodeDelimited(raw);
    }

    private XmlResponse decodeXml(String raw) {
        Matcher m = XML_FRAME.matcher(raw);
        if (!m.find()) {
            throw new GgeDecodeException("Malformed XML frame: " + abbreviate(raw));
        }
        return new XmlResponse(m.group(1), m.group(2), m.group(3), m.group(4));
    }

    private DelimitedResponse decodeDelimited(String raw) {
        List<String> segments = new ArrayList<>();
        for (String segment : raw.split(SEPARATOR)) {
            if (!segment.isEmpty()) {
                segments.add(segment);
            }
        }
        if (segments.size() < 4) {
            throw new GgeDecodeException("Delimited frame has " + segments.size()
                    + " segments, expected at least 4: " + abbreviate(raw));
        }

        final int status;
        try {
            status = Integer.parseInt(segments.get(3).trim());
        } catch (NumberFormatException e) {
            throw new GgeDecodeException("Non-numeric status in frame: " + abbreviate(raw), e);
        }

        JsonNode payload = null;
        if (segments.size() > 4) {
            String data = String.join(SEPARATOR, segments.subList(4, segments.size()));
            payload = data.startsWith("{") ? parseJson(data, raw) : TextNode.valueOf(data);
        }
        return new DelimitedResponse(segments.get(1), status, payload);
    }

    private JsonNode parseJson(String data, String raw) {
        try {
            return mapper.readTree(data);
        } catch (JsonProcessingException e) {
            throw new GgeDecodeException("Invalid JSON payload in frame: " + abbreviate(raw), e);
        }
    }

    static String abbreviate(String raw) {
        return raw.length() <= 200 ? raw : raw.substring(0, 200) + "...";
    }
}
