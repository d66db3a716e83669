package com.questrail.empire.protocol.gge.model;

/**
 * Account used to log into one zone.
 *
 * @param username account name
 * @param password account password (or temporary token for {@link ServerType#LIVE})
 * @param serverId numeric identifier of the zone on the tracker side
 */
public record ZoneCredentials(String username, String password, String serverId) {

    /**
     * A zone is only connected when every field is present.
     */
    public boolean isComplete() {
        return notBlank(username) && notBlank(password) && notBlank(serverId);
    }

    @Override
    public String toString() {
        return "ZoneCredentials[username=" + username + ", serverId=" + serverId + "]";
    }

    private static boolean notBlank(String value) {
        return value != null && !value.isBlank();
    }
}
