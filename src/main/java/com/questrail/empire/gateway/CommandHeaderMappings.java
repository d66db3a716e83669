package com.questrail.empire.gateway;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.questrail.empire.protocol.gge.internal.match.NestedHeaders;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * CommandHeaderMappings
 * =============================================================================
 * Per-command projection of request headers onto the shape of the reply.
 *
 * <pre>
 *   { "gdi": { "PID": "O.OID" } }
 * </pre>
 *
 * reads: for {@code gdi}, the request's {@code PID} value is expected in the
 * reply at {@code O.OID}. Commands without an entry expect the request headers
 * back verbatim.
 *
 * <p>Deployments supply {@code commands.json} in the config directory. The copy
 * bundled in the jar is empty and only used when that file is absent.</p>
 */
public final class CommandHeaderMappings
{
    public static final String DEFAULT_RESOURCE = "commands.json";

    private final Map<String, Map<String, String>> mappings;

    public CommandHeaderMappings(Map<String, Map<String, String>> mappings)
    {
        Objects.requireNonNull(mappings, "mappings");
        Map<String, Map<String, String>> copy = new LinkedHashMap<>();
        mappings.forEach((command, paths) ->
                copy.put(command, Collections.unmodifiableMap(new LinkedHashMap<>(paths))));
        this.mappings = Collections.unmodifiableMap(copy);
    }

    public static CommandHeaderMappings empty()
    {
        return new CommandHeaderMappings(Collections.emptyMap());
    }

    /**
     * Load from a classpath resource.
     *
     * @throws IllegalStateException if the resource is missing
     * @throws UncheckedIOException  if it cannot be parsed
     */
    public static CommandHeaderMappings fromClasspath(ObjectMapper mapper, String resource)
    {
        try (InputStream in = CommandHeaderMappings.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalStateException("Missing classpath resource " + resource);
            }
            return new CommandHeaderMappings(
                    mapper.readValue(in, new TypeReference<Map<String, Map<String, String>>>() { }));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + resource, e);
        }
    }

    /**
     * Load from a file.
     *
     * @throws UncheckedIOException if it cannot be read or parsed
     */
    public static CommandHeaderMappings fromFile(ObjectMapper mapper, Path file)
    {
        try (InputStream in = Files.newInputStream(file)) {
            return new CommandHeaderMappings(
                    mapper.readValue(in, new TypeReference<Map<String, Map<String, String>>>() { }));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + file, e);
        }
    }

    public boolean isMapped(String command)
    {
        return mappings.containsKey(command);
    }

    /**
     * Headers the reply to {@code command} is expected to carry.
     */
    public ObjectNode expectedHeaders(String command, ObjectNode requestHeaders)
    {
        Map<String, String> paths = mappings.get(command);
        if (paths == null) {
            return requestHeaders;
        }

        ObjectNode expected = JsonNodeFactory.instance.objectNode();
        paths.forEach((requestKey, responsePath) -> {
            if (requestHeaders.has(requestKey)) {
                NestedHeaders.setNestedValue(expected, responsePath, requestHeaders.get(requestKey));
            }
        });
        return expected;
    }

    public int size()
    {
        return mappings.size();
    }
}
