package org.catalogregistry.registry.common.http;

import java.util.List;
import java.util.Map;

import reactor.core.publisher.Mono;

/**
 * Sends one request over a concrete HTTP library.
 */
@FunctionalInterface
public interface HttpClientAdapter {
    /**
     * @param path already resolved against the service base path, without a leading slash
     * @param body null for requests without a payload
     * @param headers the complete header set, defaults included
     */
    Mono<HttpResponse> request(String method, String path, String body, Map<String, List<String>> headers);
}
