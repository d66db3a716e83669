package com.questrail.empire.directory;

import com.questrail.empire.protocol.gge.login.GgeConnection;
import com.questrail.empire.protocol.gge.model.ServerType;
import com.questrail.empire.protocol.gge.model.ZoneCredentials;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.regex.Pattern;

/**
 * ConnectionDirectory
 * =============================================================================
 * The zone-keyed set of live connections.
 *
 * <h2>Discovery</h2>
 * For each {@link ServerFeed}: fetch and parse the server list, then create one
 * {@link GgeConnection} per instance that is
 * <ul>
 *   <li>enabled in the list,</li>
 *   <li>on the allow-list, and</li>
 *   <li>backed by complete credentials.</li>
 * </ul>
 * A feed that cannot be fetched or parsed is logged and skipped; it never
 * prevents the other feeds from being used.
 *
 * <h2>Identity</h2>
 * A zone maps to exactly one connection. Reconnects happen inside the connection
 * and never replace the entry.
 */
public final class ConnectionDirectory
{
    private static final Logger log = LoggerFactory.getLogger(ConnectionDirectory.class);

    static final Pattern TEMPORARY_HOST = Pattern.compile("^[\\dA-Za-z-]+\\.goodgamestudios\\.com$");

    private final List<ServerFeed> feeds;
    private final ServerListFetcher fetcher;
    private final ServerListParser parser;
    private final Set<String> allowedZones;
    private final CredentialsSource credentials;
    private final GgeConnectionFactory factory;

    private final ConcurrentMap<String, GgeConnection> connections = new ConcurrentHashMap<>();

    public ConnectionDirectory(
            List<ServerFeed> feeds,
            ServerListFetcher fetcher,
            ServerListParser parser,
            Set<String> allowedZones,
            CredentialsSource credentials,
            GgeConnectionFactory factory)
    {
        this.feeds = List.copyOf(Objects.requireNonNull(feeds, "feeds"));
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        this.parser = Objects.requireNonNull(parser, "parser");
        this.allowedZones = Set.copyOf(Objects.requireNonNull(allowedZones, "allowedZones"));
        this.credentials = Objects.requireNonNull(credentials, "credentials");
        this.factory = Objects.requireNonNull(factory, "factory");
    }

    /**
     * Read every feed and register a connection for each eligible zone. Zones
     * already registered are kept as they are.
     *
     * @return the connections created by this call, by zone
     */
    public Map<String, GgeConnection> discover()
    {
        Map<String, GgeConnection> discovered = new LinkedHashMap<>();
        for (ServerFeed feed : feeds) {
            List<ServerDescriptor> descriptors;
            try {
                descriptors = parser.parse(fetcher.fetch(feed.url()));
            } catch (IOException | IllegalArgumentException e) {
                log.error("Failed to load server list {} from {}: {}", feed.name(), feed.url(), e.getMessage());
                continue;
            }

            for (ServerDescriptor descriptor : descriptors) {
                register(feed, descriptor).ifPresent(c -> discovered.put(c.zone(), c));
            }
        }
        log.info("Discovered {} connection(s): {}", discovered.size(), discovered.keySet());
        return discovered;
    }

    private Optional<GgeConnection> register(ServerFeed feed, ServerDescriptor descriptor)
    {
        String zone = descriptor.zone();
        if (!descriptor.enabled()) {
            log.debug("[{}][{}] Disabled in server list", feed.serverType(), zone);
            return Optional.empty();
        }
        if (!allowedZones.contains(zone)) {
            log.debug("[{}][{}] Not in allowed instances", feed.serverType(), zone);
            return Optional.empty();
        }

        Optional<ZoneCredentials> account = credentials.credentialsFor(zone);
        if (account.isEmpty() || !account.get().isComplete()) {
            log.warn("[{}][{}] Missing or incomplete credentials, skipping", feed.serverType(), zone);
            return Optional.empty();
        }
        if (connections.containsKey(zone)) {
            log.warn("[{}][{}] Already registered, ignoring duplicate from {}", feed.serverType(), zone, feed.name());
            return Optional.empty();
        }

        GgeConnection connection = factory.create(feed, descriptor, account.get());
        connections.put(zone, connection);
        log.info("[{}][{}] Matching server found at {}", feed.serverType(), zone, descriptor.server());
        return Optional.of(connection);
    }

    /**
     * Start the connect routine of every registered connection.
     */
    public void connectAll()
    {
        connections.values().forEach(GgeConnection::start);
    }

    /**
     * Administrative bulk reconnect.
     */
    public void restartAll()
    {
        connections.values().forEach(GgeConnection::restart);
    }

    public void closeAll()
    {
        connections.values().forEach(GgeConnection::close);
        connections.clear();
    }

    /**
     * Register and start a temporary event server, replacing any connection
     * with the same zone.
     *
     * @param host bare host name under {@code goodgamestudios.com}
     * @param token one-off login token
     * @throws IllegalArgumentException if a parameter is blank or the host is not allowed
     */
    public GgeConnection addTemporaryServer(String zone, String host, String username, String token)
    {
        if (isBlank(zone) || isBlank(host) || isBlank(username) || isBlank(token)) {
            throw new IllegalArgumentException("Missing parameters");
        }
        if (!TEMPORARY_HOST.matcher(host).matches()) {
            throw new IllegalArgumentException("Invalid socket URL");
        }

        remove(zone);
        GgeConnection connection = factory.create(
                ServerType.LIVE, zone, "wss://" + host, false, new ZoneCredentials(username, token, zone));
        connections.put(zone, connection);
        connection.start();
        log.info("[{}][{}] Temporary server added at {}", ServerType.LIVE, zone, host);
        return connection;
    }

    /**
     * Close and forget a zone.
     *
     * @return {@code false} if the zone was unknown
     */
    public boolean remove(String zone)
    {
        GgeConnection removed = connections.remove(zone);
        if (removed == null) {
            return false;
        }
        removed.close();
        return true;
    }

    public Optional<GgeConnection> get(String zone)
    {
        return Optional.ofNullable(connections.get(zone));
    }

    public Set<String> zones()
    {
        return new TreeSet<>(connections.keySet());
    }

    public Collection<GgeConnection> connections()
    {
        return connections.values();
    }

    /**
     * Zone to {@code connected}, sorted by zone.
     */
    public SortedMap<String, Boolean> status()
    {
        SortedMap<String, Boolean> status = new TreeMap<>();
        connections.forEach((zone, c) -> status.put(zone, c.isConnected()));
        return status;
    }

    private static boolean isBlank(String s)
    {
        return s == null || s.isBlank();
    }
}
