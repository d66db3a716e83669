package com.questrail.empire.directory;

import java.util.Objects;

/**
 * One {@code <instance>} of a server list.
 *
 * @param zone    zone name, e.g. {@code EmpireEx_2}
 * @param server  {@code host[:port]} without scheme
 * @param enabled {@code false} only when the list explicitly disables the instance
 */
public record ServerDescriptor(String zone, String server, boolean enabled) {

    public ServerDescriptor {
        Objects.requireNonNull(zone, "zone");
        Objects.requireNonNull(server, "server");
    }
}
