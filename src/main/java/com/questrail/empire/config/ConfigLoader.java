package com.questrail.empire.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.questrail.empire.gateway.CommandHeaderMappings;
import com.questrail.empire.protocol.gge.model.ZoneCredentials;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * ConfigLoader
 * =============================================================================
 * Builds an {@link EmpireLinkConfig} from the deployment's config directory and
 * environment.
 *
 * <h2>Files</h2>
 * <pre>
 *   instances.json    {"allowed": ["EmpireEx_2", ...]}
 *   credentials.json  {"EmpireEx_2": {"USERNAME": "...", "PASSWORD": "...", "SERVER_ID": "2"}}
 *   commands.json     {"gdi": {"PID": "O.OID"}, ...}   optional, see {@link CommandHeaderMappings}
 * </pre>
 *
 * <h2>Environment</h2>
 * <ul>
 *   <li>{@value #CONFIG_DIR_ENV}: directory holding the files, default {@value #DEFAULT_CONFIG_DIR}</li>
 *   <li>{@value #EXTRA_LOGIN_ENV}: {@code true} enables the post-login {@code gbl}</li>
 * </ul>
 *
 * <p>A missing or unparsable file is logged and read as empty. The process still
 * starts; it just has no zones to connect. Without {@code commands.json} the
 * bundled mapping is used and every gateway command expects its headers back.</p>
 */
public final class ConfigLoader
{
    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    public static final String CONFIG_DIR_ENV = "EMPIRE_CONFIG_DIR";
    public static final String DEFAULT_CONFIG_DIR = "/app/config";
    public static final String EXTRA_LOGIN_ENV = "HAS_GBL";

    static final String INSTANCES_FILE = "instances.json";
    static final String CREDENTIALS_FILE = "credentials.json";
    static final String COMMANDS_FILE = CommandHeaderMappings.DEFAULT_RESOURCE;

    private final ObjectMapper mapper;

    public ConfigLoader(ObjectMapper mapper)
    {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    /**
     * Load from the process environment.
     */
    public EmpireLinkConfig load()
    {
        return load(System.getenv());
    }

    public EmpireLinkConfig load(Map<String, String> env)
    {
        Path dir = Paths.get(env.getOrDefault(CONFIG_DIR_ENV, DEFAULT_CONFIG_DIR));
        return EmpireLinkConfig.builder()
                .withAllowedZones(loadAllowedZones(dir.resolve(INSTANCES_FILE)))
                .withCredentials(loadCredentials(dir.resolve(CREDENTIALS_FILE)))
                .withExtraLoginCommand("true".equalsIgnoreCase(env.get(EXTRA_LOGIN_ENV)))
                .withCommandMappings(loadCommandMappings(dir.resolve(COMMANDS_FILE)))
                .build();
    }

    public CommandHeaderMappings loadCommandMappings(Path file)
    {
        if (!Files.isRegularFile(file)) {
            log.warn("{} not found, using the bundled command mappings", file);
            return CommandHeaderMappings.fromClasspath(mapper, CommandHeaderMappings.DEFAULT_RESOURCE);
        }
        try {
            CommandHeaderMappings mappings = CommandHeaderMappings.fromFile(mapper, file);
            log.info("Loaded header mappings for {} command(s) from {}", mappings.size(), file);
            return mappings;
        } catch (UncheckedIOException e) {
            log.error("Failed to parse {}: {}", file, e.getCause().getMessage());
            return CommandHeaderMappings.empty();
        }
    }

    public Set<String> loadAllowedZones(Path file)
    {
        JsonNode root = read(file);
        if (root == null) {
            return Collections.emptySet();
        }
        JsonNode allowed = root.get("allowed");
        if (allowed == null || !allowed.isArray()) {
            log.error("{} has no \"allowed\" array", file);
            return Collections.emptySet();
        }

        Set<String> zones = new LinkedHashSet<>();
        for (JsonNode zone : allowed) {
            if (zone.isTextual() && !zone.asText().isBlank()) {
                zones.add(zone.asText());
            }
        }
        log.info("Loaded {} allowed instance(s) from {}", zones.size(), file);
        return zones;
    }

    public Map<String, ZoneCredentials> loadCredentials(Path file)
    {
        JsonNode root = read(file);
        if (root == null) {
            return Collections.emptyMap();
        }
        if (!root.isObject()) {
            log.error("{} is not a JSON object", file);
            return Collections.emptyMap();
        }

        Map<String, ZoneCredentials> credentials = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            JsonNode account = entry.getValue();
            credentials.put(entry.getKey(), new ZoneCredentials(
                    text(account, "USERNAME"),
                    text(account, "PASSWORD"),
                    text(account, "SERVER_ID")));
        }
        log.info("Loaded credentials for {} zone(s) from {}", credentials.size(), file);
        return credentials;
    }

    private JsonNode read(Path file)
    {
        if (!Files.isRegularFile(file)) {
            log.error("Config file {} not found", file);
            return null;
        }
        try {
            return mapper.readTree(file.toFile());
        } catch (IOException e) {
            log.error("Failed to parse {}: {}", file, e.getMessage());
            return null;
        }
    }

    private static String text(JsonNode node, String field)
    {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || value.isContainerNode()) {
            return null;
        }
        return value.asText();
    }
}
