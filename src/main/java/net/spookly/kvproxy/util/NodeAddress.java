package net.spookly.kvproxy.util;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.experimental.Accessors;

import java.net.InetSocketAddress;

/**
 * Parsed {@code host:port} of a storage node or listener.
 */
@Getter
@Accessors(fluent = true)
@EqualsAndHashCode
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class NodeAddress {
    private final String host;
    private final int port;

    /**
     * Parse a {@code host:port} address. IPv6 hosts may be bracketed.
     */
    public static NodeAddress parse(String raw) {
        if (raw == null || raw.trim().isEmpty()) {
            throw new IllegalArgumentException("address is required");
        }
        String value = raw.trim();
        int lastColon = value.lastIndexOf(':');
        if (lastColon <= 0 || lastColon == value.length() - 1) {
            throw new IllegalArgumentException("address must be host:port: " + raw);
        }
        String host = value.substring(0, lastColon).trim();
        if (host.startsWith("[") && host.endsWith("]")) {
            host = host.substring(1, host.length() - 1);
        }
        String portRaw = value.substring(lastColon + 1).trim();
        int port;
        try {
            port = Integer.parseInt(portRaw);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("port must be numeric: " + portRaw, e);
        }
        if (port < 1 || port > 65535) {
            throw new IllegalArgumentException("port must be between 1 and 65535: " + port);
        }
        if (host.isEmpty()) {
            throw new IllegalArgumentException("host is required: " + raw);
        }
        return new NodeAddress(host, port);
    }

    /**
     * Unresolved socket address; resolution happens when a connection is opened.
     */
    public InetSocketAddress toSocketAddress() {
        return InetSocketAddress.createUnresolved(host, port);
    }

    /**
     * Resolved socket address for binding a listener.
     */
    public InetSocketAddress toBindAddress() {
        return new InetSocketAddress(host, port);
    }

    @Override
    public String toString() {
        return host.indexOf(':') >= 0 ? "[" + host + "]:" + port : host + ":" + port;
    }
}
