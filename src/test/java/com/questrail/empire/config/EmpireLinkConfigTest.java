package com.questrail.empire.config;

import com.questrail.empire.directory.ServerFeed;
import com.questrail.empire.protocol.gge.engine.GgeTimingPolicy;
import com.questrail.empire.protocol.gge.model.ServerType;
import com.questrail.empire.protocol.gge.model.ZoneCredentials;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class EmpireLinkConfigTest {

    @Test
    void builderDefaults() {
        EmpireLinkConfig config = EmpireLinkConfig.builder().build();

        assertTrue(config.allowedZones().isEmpty());
        assertEquals(ServerFeed.defaults(), config.feeds());
        assertEquals(GgeTimingPolicy.defaults(), config.timingPolicy());
        assertFalse(config.extraLoginCommand());
        assertEquals(16, config.schedulerThreads());
    }

    @Test
    void builderCollectsValues() {
        ServerFeed feed = new ServerFeed("EP", "https://lists.example/1.xml", "wss", ServerType.EP);
        EmpireLinkConfig config = EmpireLinkConfig.builder()
                .withAllowedZones(Set.of("EmpireEx_2"))
                .addCredentials("EmpireEx_2", new ZoneCredentials("knight", "secret", "2"))
                .withFeeds(List.of(feed))
                .withSchedulerThreads(4)
                .build();

        assertEquals(Set.of("EmpireEx_2"), config.allowedZones());
        assertEquals("knight", config.credentials().get("EmpireEx_2").username());
        assertEquals(List.of(feed), config.feeds());
        assertEquals(4, config.schedulerThreads());
    }

    @Test
    void configIsImmutable() {
        EmpireLinkConfig config = EmpireLinkConfig.builder().withAllowedZones(Set.of("EmpireEx_2")).build();

        assertThrows(UnsupportedOperationException.class, () -> config.allowedZones().add("EmpireEx_3"));
    }

    @Test
    void rejectsEmptySchedulerPool() {
        assertThrows(IllegalArgumentException.class,
                () -> EmpireLinkConfig.builder().withSchedulerThreads(0).build());
    }

    @Test
    void credentialsHidePassword() {
        String text = new ZoneCredentials("knight", "secret", "2").toString();

        assertTrue(text.contains("knight"));
        assertFalse(text.contains("secret"));
    }
}
