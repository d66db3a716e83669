package com.questrail.empire.directory;

import com.questrail.empire.protocol.gge.model.ZoneCredentials;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link CredentialsSource} over a fixed map, as loaded from {@code credentials.json}.
 */
public final class StaticCredentialsSource implements CredentialsSource
{
    private final Map<String, ZoneCredentials> credentials;

    public StaticCredentialsSource(Map<String, ZoneCredentials> credentials)
    {
        this.credentials = Map.copyOf(Objects.requireNonNull(credentials, "credentials"));
    }

    @Override
    public Optional<ZoneCredentials> credentialsFor(String zone)
    {
        return Optional.ofNullable(credentials.get(zone));
    }
}
