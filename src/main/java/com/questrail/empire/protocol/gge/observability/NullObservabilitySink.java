package com.questrail.empire.protocol.gge.observability;

/**
 * No-op implementation of GgeObservabilitySink.
 */
public final class NullObservabilitySink implements GgeObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onConnectionEvent(GgeConnectionEvent event) {}

    @Override
    public void onTransportEvent(GgeTransportEvent event) {}

    @Override
    public void onRestartScheduled(GgeRestartEvent event) {}

    @Override
    public void onError(GgeErrorEvent event) {}
}
