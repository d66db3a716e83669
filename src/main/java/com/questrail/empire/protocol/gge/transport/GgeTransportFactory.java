package com.questrail.empire.protocol.gge.transport;

/**
 * Creates a new, unopened {@link GgeTransport} for each connect attempt.
 */
@FunctionalInterface
public interface GgeTransportFactory
{
    GgeTransport create();
}
