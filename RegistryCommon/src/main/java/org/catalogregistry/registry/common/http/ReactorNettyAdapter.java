package org.catalogregistry.registry.common.http;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.handler.codec.http.HttpMethod;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;
import reactor.netty.http.client.HttpClientResponse;

/**
 * Sends requests with a reactor-netty {@link HttpClient} whose base URL is the service origin.
 */
@Slf4j
public class ReactorNettyAdapter implements HttpClientAdapter {
    private final HttpClient client;

    public ReactorNettyAdapter(HttpClient client) {
        this.client = client;
    }

    @Override
    public Mono<HttpResponse> request(String method, String path, String body, Map<String, List<String>> headers) {
        Mono<ByteBuf> payload = body == null
            ? Mono.empty()
            : Mono.fromSupplier(() -> Unpooled.copiedBuffer(body, StandardCharsets.UTF_8));
        return client
            .headers(h -> headers.forEach(h::set))
            .request(HttpMethod.valueOf(method))
            .uri("/" + path)
            .send(payload)
            .responseSingle((response, content) -> content.asString(StandardCharsets.UTF_8)
                .defaultIfEmpty("")
                .map(text -> toResponse(response, text)))
            .doOnError(t -> log.atDebug().setMessage("{} /{} failed").addArgument(method).addArgument(path)
                .setCause(t).log());
    }

    private static HttpResponse toResponse(HttpClientResponse response, String text) {
        Map<String, String> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        response.responseHeaders().forEach(e -> headers.merge(e.getKey(), e.getValue(), (a, b) -> a + "," + b));
        return new HttpResponse(
            response.status().code(),
            response.status().reasonPhrase(),
            headers,
            text.isEmpty() ? null : text
        );
    }
}
