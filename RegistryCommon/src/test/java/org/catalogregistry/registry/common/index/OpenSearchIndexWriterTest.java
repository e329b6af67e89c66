package org.catalogregistry.registry.common.index;

import java.time.Duration;
import java.time.Instant;
import java.util.Set;

import com.fasterxml.jackson.databind.ObjectMapper;

import org.catalogregistry.harvest.pipeline.errors.IndexUnavailableException;
import org.catalogregistry.harvest.pipeline.ir.CanonicalRecord;
import org.catalogregistry.harvest.pipeline.ir.HarvestErrorKind;
import org.catalogregistry.registry.common.http.ConnectionContext;
import org.catalogregistry.registry.common.http.ReactorNettyRestClient;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class OpenSearchIndexWriterTest {
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();
    private static final Instant NOW = Instant.parse("2024-03-01T10:00:00Z");

    private FakeSearchServer server;
    private OpenSearchClient client;

    @BeforeEach
    void setUp() {
        server = new FakeSearchServer();
        client = new OpenSearchClient(new ReactorNettyRestClient(ConnectionContext.of(server.url())),
            2, Duration.ofMillis(10), Duration.ofMillis(50));
    }

    @AfterEach
    void tearDown() {
        server.close();
    }

    private OpenSearchIndexWriter writer(int maxDocs) {
        return new OpenSearchIndexWriter(client, new CatalogIndexManager(client, null),
            new IndexDocumentProjector(), maxDocs, Long.MAX_VALUE);
    }

    private static CanonicalRecord record(String source, String localId, String title) {
        var payload = OBJECT_MAPPER.createObjectNode();
        payload.put("identifier", localId);
        payload.put("title", title);
        return new CanonicalRecord(source + ":" + localId, source, payload, "f-" + title, 1, false, NOW);
    }

    @Test
    void writesAreBufferedUntilFlush() throws Exception {
        var writer = writer(100);

        writer.index("maps", record("east", "a", "Alpha"));
        writer.index("maps", record("east", "b", "Beta"));
        assertEquals(0, server.count("POST", "/_bulk"));
        assertEquals(2, writer.getBufferedCount());

        var failures = writer.flush();

        assertTrue(failures.isEmpty());
        assertEquals(1, server.count("POST", "/_bulk"));
        assertEquals(1, server.count("POST", "/maps/_refresh"));
        assertEquals("Alpha", server.documents("maps").get("east:a").get("title").asText());
    }

    @Test
    void catalogIsCreatedOnFirstUse() throws Exception {
        var writer = writer(100);

        writer.index("maps", record("east", "a", "Alpha"));
        writer.index("maps", record("east", "b", "Beta"));
        writer.flush();

        assertEquals(1, server.count("PUT", "/maps"));
        var mapping = server.createBody("maps").path("mappings").path("properties");
        assertEquals("geo_shape", mapping.path("layer_geoshape").path("type").asText());
    }

    @Test
    void bufferIsSentWhenFull() throws Exception {
        var writer = writer(2);

        for (var id : new String[] {"a", "b", "c", "d", "e"}) {
            writer.index("maps", record("east", id, id));
        }

        assertEquals(2, server.count("POST", "/_bulk"));
        assertEquals(1, writer.getBufferedCount());
        writer.flush();
        assertEquals(5, server.documents("maps").size());
    }

    @Test
    void removeOfMissingDocumentIsNotAFailure() throws Exception {
        var writer = writer(100);
        writer.index("maps", record("east", "a", "Alpha"));
        writer.flush();

        writer.remove("maps", "east:a");
        writer.remove("maps", "east:never-indexed");
        var failures = writer.flush();

        assertTrue(failures.isEmpty());
        assertTrue(server.documents("maps").isEmpty());
    }

    @Test
    void rejectedDocumentsAreReportedByFlush() throws Exception {
        server.reject("east:b");
        var writer = writer(100);

        writer.index("maps", record("east", "a", "Alpha"));
        writer.index("maps", record("east", "b", "Beta"));
        var failures = writer.flush();

        assertEquals(1, failures.size());
        assertEquals("east:b", failures.get(0).reference());
        assertEquals(HarvestErrorKind.INDEX_DOCUMENT, failures.get(0).kind());
        assertTrue(failures.get(0).message().contains("mapper_parsing_exception"));
        assertTrue(writer.flush().isEmpty());
    }

    @Test
    void removeSourceOnlyTouchesThatSource() throws Exception {
        var writer = writer(100);
        writer.index("maps", record("east", "a", "Alpha"));
        writer.index("maps", record("west", "a", "Alpha"));
        writer.flush();

        writer.index("maps", record("east", "b", "Beta"));
        writer.removeSource("maps", "east");
        writer.flush();

        assertEquals(Set.of("west:a"), server.documents("maps").keySet());
    }

    @Test
    void transientServerErrorsAreRetried() throws Exception {
        var writer = writer(100);
        writer.index("maps", record("east", "a", "Alpha"));

        server.failNext(2, 503);
        var failures = writer.flush();

        assertTrue(failures.isEmpty());
        assertEquals(1, server.documents("maps").size());
    }

    @Test
    void persistentServerErrorsMakeTheIndexUnavailable() throws Exception {
        var writer = writer(100);
        writer.index("maps", record("east", "a", "Alpha"));

        server.failNext(10, 503);
        var e = assertThrows(IndexUnavailableException.class, writer::flush);

        assertEquals(HarvestErrorKind.INDEX_UNAVAILABLE, e.getKind());
    }

    @Test
    void discardedActionsAreNeverSent() throws Exception {
        var writer = writer(100);
        writer.index("maps", record("east", "a", "Alpha"));

        writer.discardPending();
        writer.flush();

        assertEquals(0, server.count("POST", "/_bulk"));
        assertTrue(server.documents("maps").isEmpty());
    }

    @Test
    void tombstonedRecordsAreRefused() {
        var writer = writer(100);
        var tombstone = record("east", "a", "Alpha").asTombstone(NOW);

        assertThrows(IllegalArgumentException.class, () -> writer.index("maps", tombstone));
    }
}
