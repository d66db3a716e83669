package com.questrail.empire.protocol.gge.transport.netty;

import com.questrail.empire.protocol.gge.transport.GgeTransportFactory;

import io.netty.channel.EventLoopGroup;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;

import javax.net.ssl.SSLException;
import java.net.URI;
import java.util.Objects;

/**
 * Factories for the two Netty-backed transports.
 *
 * <p>The returned {@link GgeTransportFactory} creates a fresh, unopened transport
 * per connect attempt. The TLS context for {@code wss} is built once per factory.</p>
 */
public final class NettyGgeTransports
{
    private NettyGgeTransports() {
    }

    /**
     * Message-framed transport for a {@code ws://} or {@code wss://} URL.
     */
    public static GgeTransportFactory webSocket(String url, EventLoopGroup group)
    {
        Objects.requireNonNull(url, "url");
        Objects.requireNonNull(group, "group");

        URI uri = URI.create(url);
        String scheme = uri.getScheme();
        if (!"ws".equalsIgnoreCase(scheme) && !"wss".equalsIgnoreCase(scheme)) {
            throw new IllegalArgumentException("Unsupported WebSocket scheme: " + url);
        }
        SslContext sslContext = "wss".equalsIgnoreCase(scheme) ? clientSslContext() : null;
        return () -> new NettyWebSocketTransport(uri, group, sslContext);
    }

    /**
     * Raw-stream transport. Any scheme prefix on {@code url} is ignored.
     */
    public static GgeTransportFactory tcp(String url, EventLoopGroup group)
    {
        Objects.requireNonNull(group, "group");

        TcpAddress address = TcpAddress.parse(url);
        return () -> new NettyTcpTransport(address, group);
    }

    private static SslContext clientSslContext()
    {
        try {
            return SslContextBuilder.forClient().build();
        } catch (SSLException e) {
            throw new IllegalStateException("Unable to initialize client TLS context", e);
        }
    }
}
