package org.catalogregistry.registry.common.http;

import java.net.URI;
import java.net.URISyntaxException;

import lombok.Getter;

/**
 * Where and how to reach an HTTP service: its base URI, the protocol derived
 * from it, and whether certificate validation is skipped.
 */
@Getter
public class ConnectionContext {
    public enum Protocol {
        HTTP(80),
        HTTPS(443);

        private final int defaultPort;

        Protocol(int defaultPort) {
            this.defaultPort = defaultPort;
        }

        public int getDefaultPort() {
            return defaultPort;
        }
    }

    private final URI uri;
    private final Protocol protocol;
    private final boolean insecure;

    private ConnectionContext(URI uri, boolean insecure) {
        this.uri = uri;
        this.insecure = insecure;
        if (uri.getScheme() == null) {
            throw new IllegalArgumentException("URI has no scheme: " + uri);
        }
        switch (uri.getScheme().toLowerCase()) {
            case "http":
                this.protocol = Protocol.HTTP;
                break;
            case "https":
                this.protocol = Protocol.HTTPS;
                break;
            default:
                throw new IllegalArgumentException("Invalid protocol " + uri.getScheme());
        }
        if (insecure && protocol == Protocol.HTTP) {
            throw new IllegalArgumentException("Cannot allow insecure connections over plain HTTP");
        }
    }

    public static ConnectionContext of(String url) {
        return of(url, false);
    }

    public static ConnectionContext of(String url, boolean insecure) {
        try {
            return new ConnectionContext(new URI(url), insecure);
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("Invalid URI " + url, e);
        }
    }

    /** Scheme, host and port of the base URI. */
    public String origin() {
        return uri.getScheme() + "://" + uri.getHost() + (uri.getPort() == -1 ? "" : ":" + uri.getPort());
    }

    /** Credentials embedded in the URI as {@code user:password}, or null. */
    public String userInfo() {
        return uri.getRawUserInfo();
    }

    /** The request path relative to this context's base URI, without a leading slash. */
    public String basePath() {
        var path = uri.getPath();
        if (path == null || path.isEmpty() || "/".equals(path)) {
            return "";
        }
        return path.startsWith("/") ? path.substring(1) : path;
    }

    @Override
    public String toString() {
        return "ConnectionContext{uri=" + origin() + "/" + basePath() + ", insecure=" + insecure + "}";
    }
}
