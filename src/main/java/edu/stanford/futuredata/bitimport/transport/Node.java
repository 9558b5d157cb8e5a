package edu.stanford.futuredata.bitimport.transport;

import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class Node {

    public static final String DEFAULT_SCHEME = "http";
    public static final String DEFAULT_HOST = "localhost";
    public static final int DEFAULT_PORT = 10101;

    private static final Pattern ADDRESS_PATTERN =
            Pattern.compile("^(([+a-z]+)://)?([0-9a-z.-]+|\\[[:0-9a-fA-F]+])?(:([0-9]+))?$");

    private final String scheme;
    private final String host;
    // 0 when the server did not report a port.
    private final int port;

    public Node(String scheme, String host, int port) {
        this.scheme = Objects.requireNonNull(scheme, "scheme");
        this.host = Objects.requireNonNull(host, "host");
        this.port = port;
    }

    public static Node defaultNode() {
        return new Node(DEFAULT_SCHEME, DEFAULT_HOST, DEFAULT_PORT);
    }

    public static Node parse(String address) {
        Matcher m = ADDRESS_PATTERN.matcher(address);
        if (!m.matches()) {
            throw new IllegalArgumentException("Not a valid server address: " + address);
        }
        String scheme = m.group(2) != null ? m.group(2) : DEFAULT_SCHEME;
        String host = m.group(3) != null ? m.group(3) : DEFAULT_HOST;
        int port = m.group(5) != null ? Integer.parseInt(m.group(5)) : DEFAULT_PORT;
        return new Node(scheme, host, port);
    }

    public String getScheme() {
        return scheme;
    }

    public String getHost() {
        return host;
    }

    public int getPort() {
        return port;
    }

    // Base URL usable by an HTTP client; "http+protobuf" style schemes are cut at the '+'.
    public String url() {
        int plus = scheme.indexOf('+');
        String normalized = plus >= 0 ? scheme.substring(0, plus) : scheme;
        if (port > 0) {
            return String.format("%s://%s:%d", normalized, host, port);
        }
        return String.format("%s://%s", normalized, host);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Node)) {
            return false;
        }
        Node other = (Node) o;
        return port == other.port && scheme.equals(other.scheme) && host.equals(other.host);
    }

    @Override
    public int hashCode() {
        return Objects.hash(scheme, host, port);
    }

    @Override
    public String toString() {
        return String.format("%s://%s:%d", scheme, host, port);
    }
}
