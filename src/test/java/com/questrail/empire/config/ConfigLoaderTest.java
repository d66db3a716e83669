package com.questrail.empire.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.questrail.empire.gateway.CommandHeaderMappings;
import com.questrail.empire.protocol.gge.model.ZoneCredentials;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ConfigLoaderTest
 * -----------------------------------------------------------------------------
 * Reading the config directory and environment.
 */
class ConfigLoaderTest {

    private final ConfigLoader loader = new ConfigLoader(new ObjectMapper());

    private static void write(Path file, String content) throws IOException {
        Files.write(file, content.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void loadsBothFilesAndEnvironment(@TempDir Path dir) throws IOException {
        write(dir.resolve("instances.json"), "{\"allowed\": [\"EmpireEx_2\", \"EmpireEx_3\"]}");
        write(dir.resolve("credentials.json"),
                "{\"EmpireEx_2\": {\"USERNAME\": \"knight\", \"PASSWORD\": \"secret\", \"SERVER_ID\": 2}}");

        EmpireLinkConfig config = loader.load(Map.of(
                ConfigLoader.CONFIG_DIR_ENV, dir.toString(),
                ConfigLoader.EXTRA_LOGIN_ENV, "true"));

        assertEquals(Set.of("EmpireEx_2", "EmpireEx_3"), config.allowedZones());
        assertEquals(new ZoneCredentials("knight", "secret", "2"), config.credentials().get("EmpireEx_2"));
        assertTrue(config.extraLoginCommand());
        assertEquals(3, config.feeds().size());
    }

    @Test
    void extraLoginCommandIsOffUnlessTrue(@TempDir Path dir) {
        EmpireLinkConfig config = loader.load(Map.of(
                ConfigLoader.CONFIG_DIR_ENV, dir.toString(),
                ConfigLoader.EXTRA_LOGIN_ENV, "yes"));

        assertFalse(config.extraLoginCommand());
    }

    @Test
    void missingFilesGiveEmptyConfig(@TempDir Path dir) {
        EmpireLinkConfig config = loader.load(Map.of(ConfigLoader.CONFIG_DIR_ENV, dir.toString()));

        assertTrue(config.allowedZones().isEmpty());
        assertTrue(config.credentials().isEmpty());
        assertFalse(config.extraLoginCommand());
    }

    @Test
    void unparsableFileIsReadAsEmpty(@TempDir Path dir) throws IOException {
        Path instances = dir.resolve("instances.json");
        write(instances, "{\"allowed\": [");

        assertTrue(loader.loadAllowedZones(instances).isEmpty());
    }

    @Test
    void allowedMustBeAnArray(@TempDir Path dir) throws IOException {
        Path instances = dir.resolve("instances.json");
        write(instances, "{\"allowed\": \"EmpireEx_2\"}");

        assertTrue(loader.loadAllowedZones(instances).isEmpty());
    }

    @Test
    void blankZoneNamesAreIgnored(@TempDir Path dir) throws IOException {
        Path instances = dir.resolve("instances.json");
        write(instances, "{\"allowed\": [\"EmpireEx_2\", \"\", 7]}");

        assertEquals(Set.of("EmpireEx_2"), loader.loadAllowedZones(instances));
    }

    @Test
    void partialCredentialsAreKeptButIncomplete(@TempDir Path dir) throws IOException {
        Path credentials = dir.resolve("credentials.json");
        write(credentials, "{\"EmpireEx_2\": {\"USERNAME\": \"knight\"}}");

        ZoneCredentials account = loader.loadCredentials(credentials).get("EmpireEx_2");

        assertEquals("knight", account.username());
        assertNull(account.password());
        assertFalse(account.isComplete());
    }

    @Test
    void credentialsMustBeAnObject(@TempDir Path dir) throws IOException {
        Path credentials = dir.resolve("credentials.json");
        write(credentials, "[1, 2]");

        assertTrue(loader.loadCredentials(credentials).isEmpty());
    }

    @Test
    void commandMappingsComeFromConfigDirectory(@TempDir Path dir) throws IOException {
        write(dir.resolve("commands.json"), "{\"gdi\": {\"PID\": \"O.OID\"}}");

        EmpireLinkConfig config = loader.load(Map.of(ConfigLoader.CONFIG_DIR_ENV, dir.toString()));

        CommandHeaderMappings mappings = config.commandMappings();
        assertEquals(1, mappings.size());
        assertTrue(mappings.isMapped("gdi"));
    }

    @Test
    void missingCommandMappingsFallBackToBundledCopy(@TempDir Path dir) {
        CommandHeaderMappings mappings = loader.loadCommandMappings(dir.resolve("commands.json"));

        assertEquals(0, mappings.size());
    }

    @Test
    void unparsableCommandMappingsAreReadAsEmpty(@TempDir Path dir) throws IOException {
        Path commands = dir.resolve("commands.json");
        write(commands, "{\"gdi\": [");

        assertEquals(0, loader.loadCommandMappings(commands).size());
    }
}
