package com.questrail.empire.directory;

import com.questrail.empire.protocol.gge.model.ZoneCredentials;

import java.util.Optional;

/**
 * Account lookup by zone name.
 */
@FunctionalInterface
public interface CredentialsSource
{
    /**
     * @return the stored account, complete or not, or empty when the zone has none
     */
    Optional<ZoneCredentials> credentialsFor(String zone);
}
