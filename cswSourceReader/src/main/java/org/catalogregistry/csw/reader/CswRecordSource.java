package org.catalogregistry.csw.reader;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

import org.catalogregistry.harvest.pipeline.errors.SourceUnreachableException;
import org.catalogregistry.harvest.pipeline.ir.RawRecord;
import org.catalogregistry.harvest.pipeline.ir.SourceEndpoint;
import org.catalogregistry.harvest.pipeline.ir.SourceListing;
import org.catalogregistry.harvest.pipeline.source.RecordSource;
import org.catalogregistry.registry.common.http.AbstractRestClient;
import org.catalogregistry.registry.common.http.ConnectionContext;
import org.catalogregistry.registry.common.http.HttpResponse;
import org.catalogregistry.registry.common.http.ReactorNettyRestClient;

import lombok.extern.slf4j.Slf4j;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

/**
 * Lists a CSW 2.0.2 service with paged {@code GetRecords} requests.
 *
 * Pages are requested from {@code startPosition} 1 in steps of the endpoint's page
 * size, following {@code nextRecord}. A listing is complete only when every page
 * was read without a modification filter and it holds all {@code numberOfRecordsMatched}
 * records; a service that stops paging early gives a truncated listing. In incremental mode the cursor is the
 * greatest {@code modified} value seen so far.
 */
@Slf4j
public class CswRecordSource implements RecordSource {
    public static final String TYPE = "csw";
    public static final int DEFAULT_MAX_RETRIES = 2;
    public static final Duration DEFAULT_MIN_BACKOFF = Duration.ofMillis(250);
    public static final Duration DEFAULT_MAX_BACKOFF = Duration.ofSeconds(5);

    private static final Map<String, List<String>> XML_HEADERS =
        Map.of("Content-Type", List.of("application/xml"));

    private final Function<String, AbstractRestClient> clientFactory;
    private final Map<String, AbstractRestClient> clients = new ConcurrentHashMap<>();
    private final CswRecordParser parser = new CswRecordParser();
    private final int maxRetries;
    private final Duration minBackoff;
    private final Duration maxBackoff;

    public CswRecordSource() {
        this(url -> new ReactorNettyRestClient(ConnectionContext.of(url)));
    }

    public CswRecordSource(Function<String, AbstractRestClient> clientFactory) {
        this(clientFactory, DEFAULT_MAX_RETRIES, DEFAULT_MIN_BACKOFF, DEFAULT_MAX_BACKOFF);
    }

    public CswRecordSource(Function<String, AbstractRestClient> clientFactory, int maxRetries,
                           Duration minBackoff, Duration maxBackoff) {
        this.clientFactory = clientFactory;
        this.maxRetries = maxRetries;
        this.minBackoff = minBackoff;
        this.maxBackoff = maxBackoff;
    }

    @Override
    public SourceListing list(SourceEndpoint endpoint, String cursor) throws SourceUnreachableException {
        if (endpoint.location() == null || endpoint.location().isBlank()) {
            throw new SourceUnreachableException("Source " + endpoint.name() + " has no CSW url");
        }
        final AbstractRestClient client;
        try {
            client = clients.computeIfAbsent(endpoint.location(), clientFactory);
        } catch (IllegalArgumentException e) {
            throw new SourceUnreachableException("Invalid CSW url for " + endpoint.name() + ": " + e.getMessage(), e);
        }
        var modifiedSince = endpoint.incremental() ? cursor : null;

        var records = new ArrayList<RawRecord>();
        var latestModified = cursor;
        int start = 1;
        int pages = 0;
        int matched = 0;
        while (true) {
            SearchResultsPage page;
            try {
                page = fetchPage(client, endpoint, start, modifiedSince);
            } catch (SourceUnreachableException e) {
                if (endpoint.allowPartialListing() && pages > 0) {
                    log.atWarn().setMessage("Listing of {} stopped at record {} after {} pages, keeping {} records: {}")
                        .addArgument(endpoint.name())
                        .addArgument(start)
                        .addArgument(pages)
                        .addArgument(records::size)
                        .addArgument(e::getMessage)
                        .log();
                    return SourceListing.partial(records, cursor);
                }
                throw e;
            }
            pages++;
            matched = page.matched();
            records.addAll(page.records());
            if (page.latestModified() != null
                && (latestModified == null || page.latestModified().compareTo(latestModified) > 0)) {
                latestModified = page.latestModified();
            }
            log.atDebug().setMessage("Read page {} of {}: {} records, next {}")
                .addArgument(pages)
                .addArgument(endpoint.name())
                .addArgument(page.records().size())
                .addArgument(page.nextRecord())
                .log();
            if (page.isLast(start)) {
                break;
            }
            start = page.nextRecord();
        }

        if (records.size() < matched) {
            var message = "Listing of " + endpoint.name() + " ended at " + records.size() + " of " + matched
                + " matched records";
            if (!endpoint.allowPartialListing()) {
                throw new SourceUnreachableException(message);
            }
            log.warn("{}, keeping them as a partial listing", message);
            return SourceListing.partial(records, cursor);
        }

        var nextCursor = endpoint.incremental() ? latestModified : null;
        if (modifiedSince != null) {
            return SourceListing.partial(records, nextCursor);
        }
        return new SourceListing(records, true, nextCursor);
    }

    private SearchResultsPage fetchPage(AbstractRestClient client, SourceEndpoint endpoint, int start,
                                        String modifiedSince) throws SourceUnreachableException {
        var body = GetRecordsRequest.build(start, endpoint.pageSize(), modifiedSince);
        var description = "GetRecords from " + endpoint.name() + " at " + start;
        HttpResponse response;
        try {
            response = Mono.defer(() -> client.postAsync("", body, XML_HEADERS))
                .flatMap(r -> r.isServerError() || r.statusCode() == 429
                    ? Mono.<HttpResponse>error(new IllegalStateException("Received " + r.statusCode()
                        + " " + r.statusText()))
                    : Mono.just(r))
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
            throw new SourceUnreachableException(description + " failed: " + cause.getMessage(), cause);
        }
        if (response == null || !response.isSuccess()) {
            throw new SourceUnreachableException(description + " was refused: " + response);
        }
        try {
            return parser.parseSearchResults(response.body() == null ? "" : response.body());
        } catch (CswParseException e) {
            throw new SourceUnreachableException(description + " returned an unusable response: "
                + e.getMessage(), e);
        }
    }
}
