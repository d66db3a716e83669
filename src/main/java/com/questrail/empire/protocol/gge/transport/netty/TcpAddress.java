package com.questrail.empire.protocol.gge.transport.netty;

import java.util.Objects;

/**
 * Host and port of a raw-stream game server.
 *
 * <p>Server lists publish these as URLs ({@code tcp://host:port}, sometimes with
 * no port). The scheme is irrelevant to a raw socket and is stripped; a missing
 * port means {@value #DEFAULT_PORT}.</p>
 */
public record TcpAddress(String host, int port) {

    public static final int DEFAULT_PORT = 443;

    public TcpAddress {
        Objects.requireNonNull(host, "host");
        if (host.isBlank()) {
            throw new IllegalArgumentException("host must not be blank");
        }
        if (port < 1 || port > 65535) {
            throw new IllegalArgumentException("port out of range: " + port);
        }
    }

    public static TcpAddress parse(String url) {
        Objects.requireNonNull(url, "url");

        String rest = url.trim();
        int scheme = rest.indexOf("://");
        if (scheme >= 0) {
            rest = rest.substring(scheme + 3);
        }
        int slash = rest.indexOf('/');
        if (slash >= 0) {
            rest = rest.substring(0, slash);
        }

        int colon = rest.lastIndexOf(':');
        if (colon < 0) {
            return new TcpAddress(rest, DEFAULT_PORT);
        }
        try {
            return new TcpAddress(rest.substring(0, colon), Integer.parseInt(rest.substring(colon + 1)));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid port in " + url, e);
        }
    }

    @Override
    public String toString() {
        return host + ":" + port;
    }
}
