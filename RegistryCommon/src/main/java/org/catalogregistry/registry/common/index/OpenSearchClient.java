package org.catalogregistry.registry.common.index;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Supplier;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import org.catalogregistry.harvest.pipeline.errors.IndexUnavailableException;
import org.catalogregistry.harvest.pipeline.ir.HarvestErrorKind;
import org.catalogregistry.harvest.pipeline.ir.RecordFailure;
import org.catalogregistry.registry.common.http.AbstractRestClient;
import org.catalogregistry.registry.common.http.HttpResponse;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

/**
 * Elasticsearch/OpenSearch REST operations used by the registry.
 *
 * Transport errors, 5xx and 429 responses are retried with exponential backoff;
 * once retries are exhausted the call fails with {@link IndexUnavailableException}.
 */
@Slf4j
public class OpenSearchClient {
    public static final int DEFAULT_MAX_RETRIES = 3;
    public static final Duration DEFAULT_MIN_BACKOFF = Duration.ofMillis(500);
    public static final Duration DEFAULT_MAX_BACKOFF = Duration.ofSeconds(10);

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    @Getter
    private final AbstractRestClient restClient;
    private final int maxRetries;
    private final Duration minBackoff;
    private final Duration maxBackoff;

    public OpenSearchClient(AbstractRestClient restClient) {
        this(restClient, DEFAULT_MAX_RETRIES, DEFAULT_MIN_BACKOFF, DEFAULT_MAX_BACKOFF);
    }

    public OpenSearchClient(AbstractRestClient restClient, int maxRetries, Duration minBackoff, Duration maxBackoff) {
        this.restClient = restClient;
        this.maxRetries = maxRetries;
        this.minBackoff = minBackoff;
        this.maxBackoff = maxBackoff;
    }

    /** A response whose status is worth another attempt. */
    static class RetryableResponseException extends RuntimeException {
        RetryableResponseException(HttpResponse response) {
            super("Received " + response.statusCode() + " " + response.statusText());
        }
    }

    public ServerVersion getServerVersion() throws IndexUnavailableException {
        var response = execute("Reading server version", () -> restClient.getAsync(""));
        expectSuccess("Reading server version", response);
        return ServerVersion.parse(readJson(response));
    }

    /** Names of all indices on the server, from {@code _aliases}. */
    public Set<String> listIndices() throws IndexUnavailableException {
        var response = execute("Listing indices", () -> restClient.getAsync("_aliases"));
        expectSuccess("Listing indices", response);
        var names = new TreeSet<String>();
        readJson(response).fieldNames().forEachRemaining(names::add);
        return names;
    }

    /** @return false when the index already existed */
    public boolean createIndex(String index, ObjectNode body) throws IndexUnavailableException {
        var response = execute("Creating index " + index, () -> restClient.putAsync(index, body.toString()));
        if (response.statusCode() == 400 && response.body() != null
            && response.body().contains("resource_already_exists_exception")) {
            return false;
        }
        expectSuccess("Creating index " + index, response);
        return true;
    }

    /** @return false when there was no such index */
    public boolean deleteIndex(String index) throws IndexUnavailableException {
        var response = execute("Deleting index " + index, () -> restClient.deleteAsync(index));
        if (response.statusCode() == 404) {
            return false;
        }
        expectSuccess("Deleting index " + index, response);
        return true;
    }

    /** Delete the documents of an index matching a query; a missing index has nothing to delete. */
    public long deleteByQuery(String index, ObjectNode query) throws IndexUnavailableException {
        var body = OBJECT_MAPPER.createObjectNode();
        body.set("query", query);
        var path = index + "/_delete_by_query?conflicts=proceed&refresh=true";
        var response = execute("Deleting by query from " + index, () -> restClient.postAsync(path, body.toString()));
        if (response.statusCode() == 404) {
            return 0;
        }
        expectSuccess("Deleting by query from " + index, response);
        return readJson(response).path("deleted").asLong();
    }

    public void refresh(String index) throws IndexUnavailableException {
        var response = execute("Refreshing " + index, () -> restClient.postAsync(index + "/_refresh", null));
        if (response.statusCode() != 404) {
            expectSuccess("Refreshing " + index, response);
        }
    }

    /**
     * Send a {@code _bulk} request.
     *
     * @return the items the server rejected; a delete of a missing document is not a rejection
     */
    public List<RecordFailure> sendBulkRequest(String body) throws IndexUnavailableException {
        var response = execute("Bulk request", () -> restClient.postAsync("_bulk", body));
        expectSuccess("Bulk request", response);
        var json = readJson(response);
        var failures = new ArrayList<RecordFailure>();
        if (!json.path("errors").asBoolean(false)) {
            return failures;
        }
        for (var item : json.path("items")) {
            var entry = item.fields().next();
            var result = entry.getValue();
            var status = result.path("status").asInt();
            if (status >= 200 && status < 300) {
                continue;
            }
            if ("delete".equals(entry.getKey()) && status == 404) {
                continue;
            }
            var error = result.path("error");
            var reason = error.isObject()
                ? error.path("type").asText() + ": " + error.path("reason").asText()
                : error.asText("status " + status);
            failures.add(new RecordFailure(result.path("_id").asText(), HarvestErrorKind.INDEX_DOCUMENT,
                entry.getKey() + " rejected with " + status + " (" + reason + ")"));
        }
        log.atDebug().setMessage("Bulk request had {} rejected items").addArgument(failures::size).log();
        return failures;
    }

    private HttpResponse execute(String description, Supplier<Mono<HttpResponse>> request)
        throws IndexUnavailableException {
        try {
            return Mono.defer(request)
                .flatMap(response -> response.isServerError() || response.statusCode() == 429
                    ? Mono.<HttpResponse>error(new RetryableResponseException(response))
                    : Mono.just(response))
                .retryWhen(Retry.backoff(maxRetries, minBackoff)
                    .maxBackoff(maxBackoff)
                    .doBeforeRetry(signal -> log.atWarn().setMessage("{} failed, retrying (attempt {}): {}")
                        .addArgument(description)
                        .addArgument(signal.totalRetries() + 1)
                        .addArgument(() -> signal.failure().getMessage())
                        .log()))
                .block();
        } catch (RuntimeException e) {
            var cause = Exceptions.isRetryExhausted(e) && e.getCause() != null ? e.getCause() : Exceptions.unwrap(e);
            throw new IndexUnavailableException(description + " failed: " + cause.getMessage(), cause);
        }
    }

    private static void expectSuccess(String description, HttpResponse response) throws IndexUnavailableException {
        if (!response.isSuccess()) {
            throw new IndexUnavailableException(description + " was refused: " + response);
        }
    }

    private static JsonNode readJson(HttpResponse response) throws IndexUnavailableException {
        try {
            return OBJECT_MAPPER.readTree(response.body() == null ? "{}" : response.body());
        } catch (JsonProcessingException e) {
            throw new IndexUnavailableException("Unreadable response from search server: " + e.getOriginalMessage(), e);
        }
    }
}
