package com.questrail.empire.directory;

import com.questrail.empire.protocol.gge.model.ServerType;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * One remote server list.
 *
 * @param name       short label used in logs
 * @param url        where the XML list is fetched from
 * @param scheme     scheme prepended to each listed server: {@code ws}, {@code wss}
 *                   or {@code tcp} for the raw-stream transport
 * @param serverType game variant every zone of this list belongs to
 */
public record ServerFeed(String name, String url, String scheme, ServerType serverType) {

    public static final String TCP = "tcp";

    private static final String MIRROR = "https://gge-tracker.github.io/gge-cdn-mirror-files/";

    public ServerFeed {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(url, "url");
        Objects.requireNonNull(scheme, "scheme");
        Objects.requireNonNull(serverType, "serverType");
        scheme = scheme.toLowerCase(Locale.ROOT);
        if (!scheme.equals("ws") && !scheme.equals("wss") && !scheme.equals(TCP)) {
            throw new IllegalArgumentException("Unsupported scheme: " + scheme);
        }
    }

    /**
     * Empire, Empire (second list) and Four Kingdoms.
     */
    public static List<ServerFeed> defaults() {
        return List.of(
                new ServerFeed("EP", MIRROR + "1.xml", "wss", ServerType.EP),
                new ServerFeed("SP", MIRROR + "39.xml", "wss", ServerType.EP),
                new ServerFeed("E4K", MIRROR + "e4k.xml", "ws", ServerType.E4K));
    }

    public boolean isRawStream() {
        return TCP.equals(scheme);
    }

    /**
     * Endpoint URL for a listed {@code host[:port]}.
     */
    public String endpointFor(String server) {
        return scheme + "://" + server;
    }
}
