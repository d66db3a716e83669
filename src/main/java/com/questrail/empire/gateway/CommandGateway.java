package com.questrail.empire.gateway;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.questrail.empire.directory.ConnectionDirectory;
import com.questrail.empire.protocol.gge.correlation.GgeTimeoutException;
import com.questrail.empire.protocol.gge.correlation.MatchSpec;
import com.questrail.empire.protocol.gge.correlation.PendingRequest;
import com.questrail.empire.protocol.gge.engine.GgeProtocolEngine;
import com.questrail.empire.protocol.gge.login.GgeConnection;
import com.questrail.empire.protocol.gge.model.DelimitedResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * CommandGateway
 * =============================================================================
 * Synchronous bridge from an external request to one correlated command on a
 * zone's connection. Transport-agnostic: an HTTP layer maps its routes onto
 * these methods and writes {@link GatewayResponse#status()} and
 * {@link GatewayResponse#body()} back unchanged.
 *
 * <h2>Responses</h2>
 * <ul>
 *   <li>unknown zone: 404 {@code {"error":"Server not found"}}</li>
 *   <li>zone not connected: 500 {@code {"error":"Server not connected"}}</li>
 *   <li>reply: 200 {@code {server, command, return_code, content}}</li>
 *   <li>no reply in time: 200 {@code {error:"Timeout", server, command, response_headers, return_code:-1}}</li>
 * </ul>
 *
 * <p>The reply to {@code jca} is {@code jaa}; the gateway waits for, and
 * reports, the rewritten name.</p>
 */
public final class CommandGateway
{
    private static final Logger log = LoggerFactory.getLogger(CommandGateway.class);

    public static final Duration DEFAULT_TIMEOUT = Duration.ofMillis(1000);

    static final Map<String, String> REPLY_COMMANDS = Map.of("jca", "jaa");

    private final ConnectionDirectory directory;
    private final CommandHeaderMappings mappings;
    private final ObjectMapper mapper;
    private final Duration timeout;

    public CommandGateway(ConnectionDirectory directory, CommandHeaderMappings mappings, ObjectMapper mapper)
    {
        this(directory, mappings, mapper, DEFAULT_TIMEOUT);
    }

    public CommandGateway(
            ConnectionDirectory directory, CommandHeaderMappings mappings, ObjectMapper mapper, Duration timeout)
    {
        this.directory = Objects.requireNonNull(directory, "directory");
        this.mappings = Objects.requireNonNull(mappings, "mappings");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
    }

    /**
     * Execute with headers as they appear in a URL segment: the inside of a JSON
     * object without its braces. The literal {@code null} means no headers.
     */
    public GatewayResponse execute(String server, String command, String rawHeaders)
    {
        Optional<GgeConnection> connection = lookup(server);
        Optional<GatewayResponse> unavailable = checkAvailable(connection);
        if (unavailable.isPresent()) {
            return unavailable.get();
        }

        String inner = rawHeaders == null || rawHeaders.equals("null") ? "" : rawHeaders;
        final JsonNode headers;
        try {
            headers = mapper.readTree("{" + inner + "}");
        } catch (JsonProcessingException e) {
            log.debug("[{}] Unparsable headers for {}: {}", server, command, e.getOriginalMessage());
            return timeout(server, command, mapper.createObjectNode());
        }
        if (!headers.isObject()) {
            return timeout(server, command, mapper.createObjectNode());
        }
        return send(server, command, (ObjectNode) headers, connection.get().engine());
    }

    /**
     * Send {@code command} with {@code headers} and wait for the matching reply.
     */
    public GatewayResponse execute(String server, String command, ObjectNode headers)
    {
        Objects.requireNonNull(command, "command");
        Objects.requireNonNull(headers, "headers");

        Optional<GgeConnection> connection = lookup(server);
        Optional<GatewayResponse> unavailable = checkAvailable(connection);
        if (unavailable.isPresent()) {
            return unavailable.get();
        }
        return send(server, command, headers, connection.get().engine());
    }

    // The connection is resolved once per request; a zone removed afterwards
    // answers through the closed engine as a timeout.
    private GatewayResponse send(String server, String command, ObjectNode headers, GgeProtocolEngine engine)
    {
        ObjectNode expected = mappings.expectedHeaders(command, headers);
        String replyCommand = REPLY_COMMANDS.getOrDefault(command, command);

        PendingRequest<DelimitedResponse> reply = engine.expectDelimited(replyCommand, MatchSpec.pattern(expected));
        engine.sendJson(command, headers);
        try {
            DelimitedResponse response = engine.await(reply, timeout);
            ObjectNode body = mapper.createObjectNode();
            body.put("server", server);
            body.put("command", replyCommand);
            body.put("return_code", response.status());
            body.set("content", response.hasPayload() ? response.payload() : NullNode.getInstance());
            return new GatewayResponse(GatewayResponse.OK, body);
        } catch (GgeTimeoutException e) {
            return timeout(server, replyCommand, expected);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return timeout(server, replyCommand, expected);
        }
    }

    /**
     * Zone to {@code connected}.
     */
    public GatewayResponse status()
    {
        ObjectNode body = mapper.createObjectNode();
        directory.status().forEach((zone, connected) -> body.put(zone, connected.booleanValue()));
        return new GatewayResponse(GatewayResponse.OK, body);
    }

    public GatewayResponse addTemporaryServer(String zone, String host, String username, String token)
    {
        try {
            directory.addTemporaryServer(zone, host, username, token);
            return message(GatewayResponse.OK, "Server added");
        } catch (IllegalArgumentException e) {
            return error(GatewayResponse.BAD_REQUEST, e.getMessage());
        }
    }

    public GatewayResponse removeServer(String zone)
    {
        if (zone == null || zone.isBlank()) {
            return error(GatewayResponse.BAD_REQUEST, "Missing parameters");
        }
        if (directory.remove(zone)) {
            return message(GatewayResponse.OK, "Server deleted");
        }
        return error(GatewayResponse.NOT_FOUND, "Server not found");
    }

    private Optional<GgeConnection> lookup(String server)
    {
        return server == null ? Optional.empty() : directory.get(server);
    }

    private Optional<GatewayResponse> checkAvailable(Optional<GgeConnection> connection)
    {
        if (connection.isEmpty()) {
            return Optional.of(error(GatewayResponse.NOT_FOUND, "Server not found"));
        }
        if (!connection.get().isConnected()) {
            return Optional.of(error(GatewayResponse.SERVER_ERROR, "Server not connected"));
        }
        return Optional.empty();
    }

    private GatewayResponse timeout(String server, String command, ObjectNode expected)
    {
        ObjectNode body = mapper.createObjectNode();
        body.put("error", "Timeout");
        body.put("server", server);
        body.put("command", command);
        body.set("response_headers", expected);
        body.put("return_code", -1);
        return new GatewayResponse(GatewayResponse.OK, body);
    }

    private GatewayResponse error(int status, String message)
    {
        ObjectNode body = mapper.createObjectNode();
        body.put("error", message);
        return new GatewayResponse(status, body);
    }

    private GatewayResponse message(int status, String message)
    {
        ObjectNode body = mapper.createObjectNode();
        body.put("message", message);
        return new GatewayResponse(status, body);
    }
}
