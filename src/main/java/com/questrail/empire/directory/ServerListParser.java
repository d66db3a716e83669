package com.questrail.empire.directory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.dataformat.xml.XmlMapper;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * ServerListParser
 * =============================================================================
 * Reads the XML server list:
 *
 * <pre>
 *   &lt;network&gt;
 *     &lt;instances&gt;
 *       &lt;instance&gt;&lt;zone&gt;EmpireEx_2&lt;/zone&gt;&lt;server&gt;host:443&lt;/server&gt;&lt;/instance&gt;
 *       ...
 *     &lt;/instances&gt;
 *   &lt;/network&gt;
 * </pre>
 *
 * <p>Jackson reads a single {@code <instance>} as an object and repeated ones as
 * an array; both come out as a list. Instances without a zone or server are
 * skipped. An optional {@code <enabled>} element is honoured.</p>
 */
public final class ServerListParser
{
    private final XmlMapper mapper;

    public ServerListParser()
    {
        this(new XmlMapper());
    }

    public ServerListParser(XmlMapper mapper)
    {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    /**
     * @throws IllegalArgumentException if the document is not XML or has no
     *                                  {@code instances} element
     */
    public List<ServerDescriptor> parse(String xml)
    {
        Objects.requireNonNull(xml, "xml");

        final JsonNode root;
        try {
            root = mapper.readTree(xml);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Server list is not valid XML", e);
        }
        // XmlMapper drops the root element name, so <network> is the tree root.
        JsonNode instances = root == null ? null : root.get("instances");
        if (instances == null) {
            throw new IllegalArgumentException("Server list has no <instances> element");
        }

        JsonNode instance = instances.get("instance");
        if (instance == null || instance.isNull()) {
            return Collections.emptyList();
        }

        List<ServerDescriptor> result = new ArrayList<>();
        if (instance.isArray()) {
            for (JsonNode node : instance) {
                addDescriptor(node, result);
            }
        } else {
            addDescriptor(instance, result);
        }
        return result;
    }

    private static void addDescriptor(JsonNode node, List<ServerDescriptor> out)
    {
        String zone = text(node, "zone");
        String server = text(node, "server");
        if (zone == null || server == null) {
            return;
        }
        String enabled = text(node, "enabled");
        out.add(new ServerDescriptor(zone, server, enabled == null || !enabled.equalsIgnoreCase("false")));
    }

    private static String text(JsonNode node, String field)
    {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        String text = value.asText().trim();
        return text.isEmpty() ? null : text;
    }
}
