package com.questrail.empire.directory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.questrail.empire.protocol.gge.engine.GgeProtocolEngine;
import com.questrail.empire.protocol.gge.engine.GgeTimingPolicy;
import com.questrail.empire.protocol.gge.internal.time.MonotonicClock;
import com.questrail.empire.protocol.gge.internal.time.MonotonicScheduler;
import com.questrail.empire.protocol.gge.login.GgeConnection;
import com.questrail.empire.protocol.gge.login.LoginStrategy;
import com.questrail.empire.protocol.gge.login.RegisteringLogin;
import com.questrail.empire.protocol.gge.login.SingleRealmLogin;
import com.questrail.empire.protocol.gge.login.TemporaryServerLogin;
import com.questrail.empire.protocol.gge.model.ServerType;
import com.questrail.empire.protocol.gge.model.ZoneCredentials;
import com.questrail.empire.protocol.gge.observability.GgeObservabilitySink;
import com.questrail.empire.protocol.gge.transport.GgeTransportFactory;
import com.questrail.empire.protocol.gge.transport.netty.NettyGgeTransports;

import io.netty.channel.EventLoopGroup;

import java.util.Objects;

/**
 * GgeConnectionFactory
 * =============================================================================
 * Assembles an engine, a transport and the login strategy of the variant into a
 * {@link GgeConnection}. Every connection it creates shares the same scheduler,
 * clocks, timing and observability sink.
 *
 * <table>
 *   <caption>Variant to strategy</caption>
 *   <tr><th>{@link ServerType}</th><th>strategy</th></tr>
 *   <tr><td>EP</td><td>{@link SingleRealmLogin}</td></tr>
 *   <tr><td>E4K</td><td>{@link RegisteringLogin}</td></tr>
 *   <tr><td>LIVE</td><td>{@link TemporaryServerLogin}</td></tr>
 * </table>
 */
public final class GgeConnectionFactory
{
    /**
     * Picks the transport for an endpoint.
     */
    @FunctionalInterface
    public interface TransportSelector
    {
        GgeTransportFactory select(String endpointUrl, boolean rawStream);
    }

    private final TransportSelector transports;
    private final MonotonicScheduler scheduler;
    private final MonotonicClock clock;
    private final GgeTimingPolicy timing;
    private final GgeObservabilitySink sink;
    private final ObjectMapper mapper;
    private final boolean extraLoginCommand;

    public GgeConnectionFactory(
            TransportSelector transports,
            MonotonicScheduler scheduler,
            MonotonicClock clock,
            GgeTimingPolicy timing,
            GgeObservabilitySink sink,
            ObjectMapper mapper,
            boolean extraLoginCommand)
    {
        this.transports = Objects.requireNonNull(transports, "transports");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.timing = Objects.requireNonNull(timing, "timing");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.extraLoginCommand = extraLoginCommand;
    }

    /**
     * Netty transports on a shared event loop group.
     */
    public static TransportSelector netty(EventLoopGroup group)
    {
        Objects.requireNonNull(group, "group");
        return (url, rawStream) -> rawStream
                ? NettyGgeTransports.tcp(url, group)
                : NettyGgeTransports.webSocket(url, group);
    }

    /**
     * Connection for a zone found in a server list.
     */
    public GgeConnection create(ServerFeed feed, ServerDescriptor descriptor, ZoneCredentials credentials)
    {
        return create(feed.serverType(), descriptor.zone(), feed.endpointFor(descriptor.server()),
                feed.isRawStream(), credentials);
    }

    public GgeConnection create(
            ServerType serverType, String zone, String endpointUrl, boolean rawStream, ZoneCredentials credentials)
    {
        GgeProtocolEngine engine = GgeProtocolEngine.builder(zone, serverType)
                .withTransportFactory(transports.select(endpointUrl, rawStream))
                .withScheduler(scheduler, clock)
                .withTiming(timing)
                .withObservabilitySink(sink)
                .withObjectMapper(mapper)
                .withExtraLoginCommand(extraLoginCommand)
                .build();
        return new GgeConnection(engine, strategyFor(serverType), credentials);
    }

    static LoginStrategy strategyFor(ServerType serverType)
    {
        switch (serverType) {
            case EP:
                return new SingleRealmLogin();
            case E4K:
                return new RegisteringLogin();
            case LIVE:
                return new TemporaryServerLogin();
            default:
                throw new IllegalArgumentException("Unknown server type: " + serverType);
        }
    }
}
