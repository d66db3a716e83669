package com.questrail.empire.config;

import com.questrail.empire.directory.ServerFeed;
import com.questrail.empire.gateway.CommandHeaderMappings;
import com.questrail.empire.protocol.gge.engine.GgeTimingPolicy;
import com.questrail.empire.protocol.gge.model.ZoneCredentials;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Aggregated configuration for the empire-link runtime.
 *
 * @param allowedZones      zones a connection may be created for
 * @param credentials       account per zone
 * @param feeds             server lists to discover zones from
 * @param timingPolicy      connection timing
 * @param extraLoginCommand send {@code gbl} shortly after every login
 * @param schedulerThreads  size of the scheduler pool that runs connect routines
 *                          and status checks; these block on replies
 * @param commandMappings   expected reply headers per gateway command
 */
public record EmpireLinkConfig(
    Set<String> allowedZones,
    Map<String, ZoneCredentials> credentials,
    List<ServerFeed> feeds,
    GgeTimingPolicy timingPolicy,
    boolean extraLoginCommand,
    int schedulerThreads,
    CommandHeaderMappings commandMappings
) {
    public EmpireLinkConfig {
        allowedZones = Set.copyOf(Objects.requireNonNull(allowedZones, "allowedZones"));
        credentials = Map.copyOf(Objects.requireNonNull(credentials, "credentials"));
        feeds = List.copyOf(Objects.requireNonNull(feeds, "feeds"));
        Objects.requireNonNull(timingPolicy, "timingPolicy");
        Objects.requireNonNull(commandMappings, "commandMappings");
        if (schedulerThreads < 1) {
            throw new IllegalArgumentException("schedulerThreads must be >= 1");
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final Set<String> allowedZones = new LinkedHashSet<>();
        private final Map<String, ZoneCredentials> credentials = new HashMap<>();
        private List<ServerFeed> feeds = new ArrayList<>(ServerFeed.defaults());
        private GgeTimingPolicy timingPolicy = GgeTimingPolicy.defaults();
        private boolean extraLoginCommand;
        private int schedulerThreads = 16;
        private CommandHeaderMappings commandMappings = CommandHeaderMappings.empty();

        public Builder withAllowedZones(Set<String> zones) {
            this.allowedZones.addAll(zones);
            return this;
        }

        public Builder withCredentials(Map<String, ZoneCredentials> credentials) {
            this.credentials.putAll(credentials);
            return this;
        }

        public Builder addCredentials(String zone, ZoneCredentials credentials) {
            this.credentials.put(Objects.requireNonNull(zone, "zone"), Objects.requireNonNull(credentials, "credentials"));
            return this;
        }

        public Builder withFeeds(List<ServerFeed> feeds) {
            this.feeds = new ArrayList<>(feeds);
            return this;
        }

        public Builder withTimingPolicy(GgeTimingPolicy timingPolicy) {
            this.timingPolicy = timingPolicy;
            return this;
        }

        public Builder withExtraLoginCommand(boolean enabled) {
            this.extraLoginCommand = enabled;
            return this;
        }

        public Builder withSchedulerThreads(int threads) {
            this.schedulerThreads = threads;
            return this;
        }

        public Builder withCommandMappings(CommandHeaderMappings commandMappings) {
            this.commandMappings = commandMappings;
            return this;
        }

        public EmpireLinkConfig build() {
            return new EmpireLinkConfig(
                    allowedZones, credentials, feeds, timingPolicy, extraLoginCommand, schedulerThreads, commandMappings);
        }
    }
}
