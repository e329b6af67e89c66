package org.catalogregistry.registry.common.http;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import lombok.Getter;
import reactor.core.publisher.Mono;

/**
 * Client for one HTTP service, either the search cluster or a remote catalog.
 *
 * <p>Paths are resolved against the base path of the service URI, so a catalog at
 * {@code http://host/csw} is reached by posting to the empty path. Credentials in the URI
 * are sent as basic auth on every request. Header names are matched case-insensitively,
 * and caller headers replace the defaults.
 */
public abstract class AbstractRestClient {
    public static final String JSON_CONTENT_TYPE = "application/json";

    private static final String USER_AGENT = "CatalogRegistry-1.0";

    @Getter
    protected final ConnectionContext connectionContext;
    protected final HttpClientAdapter httpClientAdapter;
    private final Map<String, List<String>> defaultHeaders;

    protected AbstractRestClient(ConnectionContext connectionContext, HttpClientAdapter httpClientAdapter) {
        this.connectionContext = connectionContext;
        this.httpClientAdapter = httpClientAdapter;
        this.defaultHeaders = newHeaders();
        defaultHeaders.put("User-Agent", List.of(USER_AGENT));
        defaultHeaders.put("Host", List.of(getHostHeaderValue(connectionContext)));
        var basicAuth = basicAuthorization(connectionContext);
        if (basicAuth != null) {
            defaultHeaders.put("Authorization", List.of(basicAuth));
        }
    }

    /** Host and port of the service, leaving out the protocol's default port. */
    public static String getHostHeaderValue(ConnectionContext connectionContext) {
        var uri = connectionContext.getUri();
        var port = uri.getPort();
        if (port == -1 || port == connectionContext.getProtocol().getDefaultPort()) {
            return uri.getHost();
        }
        return uri.getHost() + ":" + port;
    }

    private static String basicAuthorization(ConnectionContext connectionContext) {
        if (connectionContext.userInfo() == null) {
            return null;
        }
        var credentials = URLDecoder.decode(connectionContext.userInfo(), StandardCharsets.UTF_8);
        return "Basic " + Base64.getEncoder().encodeToString(credentials.getBytes(StandardCharsets.UTF_8));
    }

    private static Map<String, List<String>> newHeaders() {
        return new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
    }

    public Mono<HttpResponse> asyncRequest(String method, String path, String body,
                                           Map<String, List<String>> additionalHeaders) {
        var headers = newHeaders();
        headers.putAll(defaultHeaders);
        if (body != null) {
            headers.put("Content-Type", List.of(JSON_CONTENT_TYPE));
        }
        if (additionalHeaders != null) {
            headers.putAll(additionalHeaders);
        }
        return httpClientAdapter.request(method, resolve(path), body, headers);
    }

    private String resolve(String path) {
        var base = connectionContext.basePath();
        if (path == null || path.isEmpty()) {
            return base;
        }
        return base.isEmpty() ? path : base + "/" + path;
    }

    public Mono<HttpResponse> getAsync(String path) {
        return asyncRequest("GET", path, null, null);
    }

    public HttpResponse get(String path) {
        return getAsync(path).block();
    }

    public Mono<HttpResponse> postAsync(String path, String body) {
        return postAsync(path, body, null);
    }

    public Mono<HttpResponse> postAsync(String path, String body, Map<String, List<String>> additionalHeaders) {
        return asyncRequest("POST", path, body, additionalHeaders);
    }

    public Mono<HttpResponse> putAsync(String path, String body) {
        return asyncRequest("PUT", path, body, null);
    }

    public Mono<HttpResponse> deleteAsync(String path) {
        return asyncRequest("DELETE", path, null, null);
    }

    public HttpResponse delete(String path) {
        return deleteAsync(path).block();
    }
}
