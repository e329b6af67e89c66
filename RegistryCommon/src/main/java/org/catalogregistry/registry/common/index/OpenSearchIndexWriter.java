package org.catalogregistry.registry.common.index;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import com.fasterxml.jackson.databind.ObjectMapper;

import org.catalogregistry.harvest.pipeline.errors.IndexUnavailableException;
import org.catalogregistry.harvest.pipeline.ir.CanonicalRecord;
import org.catalogregistry.harvest.pipeline.ir.RecordFailure;
import org.catalogregistry.harvest.pipeline.sink.IndexWriter;

import lombok.extern.slf4j.Slf4j;

/**
 * Writes catalog documents through the {@code _bulk} API.
 *
 * Actions are buffered and sent once the buffer reaches the configured document
 * count or byte size, and on {@link #flush()}, which also refreshes every index
 * written since the last flush. Rejections from automatic sends are held back
 * and reported by the next flush.
 */
@Slf4j
public class OpenSearchIndexWriter implements IndexWriter {
    public static final int DEFAULT_MAX_DOCS_PER_BULK = 500;
    public static final long DEFAULT_MAX_BYTES_PER_BULK = 10L * 1024 * 1024;

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private final OpenSearchClient client;
    private final CatalogIndexManager catalogs;
    private final IndexDocumentProjector projector;
    private final int maxDocsPerBulkRequest;
    private final long maxBytesPerBulkRequest;

    private final List<BulkDocSection> buffer = new ArrayList<>();
    private long bufferedBytes;
    private final Set<String> touchedIndices = new LinkedHashSet<>();
    private final List<RecordFailure> rejected = new ArrayList<>();

    public OpenSearchIndexWriter(OpenSearchClient client, CatalogIndexManager catalogs) {
        this(client, catalogs, new IndexDocumentProjector(), DEFAULT_MAX_DOCS_PER_BULK, DEFAULT_MAX_BYTES_PER_BULK);
    }

    public OpenSearchIndexWriter(OpenSearchClient client,
                                 CatalogIndexManager catalogs,
                                 IndexDocumentProjector projector,
                                 int maxDocsPerBulkRequest,
                                 long maxBytesPerBulkRequest) {
        this.client = client;
        this.catalogs = catalogs;
        this.projector = projector;
        this.maxDocsPerBulkRequest = Math.max(1, maxDocsPerBulkRequest);
        this.maxBytesPerBulkRequest = maxBytesPerBulkRequest;
    }

    @Override
    public synchronized void index(String catalog, CanonicalRecord record) throws IndexUnavailableException {
        if (record.tombstoned()) {
            throw new IllegalArgumentException("Tombstoned record " + record.identifier() + " must not be indexed");
        }
        catalogs.ensureCatalog(catalog);
        append(BulkDocSection.index(projector.project(catalog, record), catalogs.documentType()));
    }

    @Override
    public synchronized void remove(String catalog, String identifier) throws IndexUnavailableException {
        catalogs.ensureCatalog(catalog);
        append(BulkDocSection.delete(catalog, identifier, catalogs.documentType()));
    }

    @Override
    public synchronized void removeSource(String catalog, String source) throws IndexUnavailableException {
        // Buffered actions are sent before the delete, never after it
        sendBuffered();
        var query = OBJECT_MAPPER.createObjectNode();
        query.putObject("term").put(IndexDocumentProjector.SOURCE, source);
        var deleted = client.deleteByQuery(catalog, query);
        log.info("Removed {} documents of source {} from catalog {}", deleted, source, catalog);
    }

    @Override
    public synchronized List<RecordFailure> flush() throws IndexUnavailableException {
        sendBuffered();
        for (var index : touchedIndices) {
            client.refresh(index);
        }
        touchedIndices.clear();
        var failures = List.copyOf(rejected);
        rejected.clear();
        return failures;
    }

    @Override
    public synchronized void discardPending() {
        if (!buffer.isEmpty()) {
            log.info("Discarding {} buffered index actions", buffer.size());
        }
        buffer.clear();
        bufferedBytes = 0;
        rejected.clear();
    }

    public synchronized int getBufferedCount() {
        return buffer.size();
    }

    private void append(BulkDocSection section) throws IndexUnavailableException {
        var size = section.getSerializedLength() + 1L;
        if (!buffer.isEmpty() && bufferedBytes + size > maxBytesPerBulkRequest) {
            sendBuffered();
        }
        buffer.add(section);
        bufferedBytes += size;
        if (buffer.size() >= maxDocsPerBulkRequest) {
            sendBuffered();
        }
    }

    private void sendBuffered() throws IndexUnavailableException {
        if (buffer.isEmpty()) {
            return;
        }
        var sections = List.copyOf(buffer);
        buffer.clear();
        bufferedBytes = 0;
        log.info("{} actions in current bulk request", sections.size());
        rejected.addAll(client.sendBulkRequest(BulkDocSection.convertToBulkRequestBody(sections)));
        sections.forEach(s -> touchedIndices.add(s.getIndexName()));
    }
}
