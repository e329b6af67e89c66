package org.catalogregistry.registry.common.index;

import java.time.Duration;
import java.util.Set;

import org.catalogregistry.harvest.pipeline.errors.IndexUnavailableException;
import org.catalogregistry.registry.common.http.ConnectionContext;
import org.catalogregistry.registry.common.http.ReactorNettyRestClient;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CatalogIndexManagerTest {

    private static CatalogIndexManager manager(FakeSearchServer server) {
        var client = new OpenSearchClient(new ReactorNettyRestClient(ConnectionContext.of(server.url())),
            1, Duration.ofMillis(10), Duration.ofMillis(20));
        return new CatalogIndexManager(client, "500m");
    }

    @Test
    void catalogLifecycle() throws Exception {
        try (var server = new FakeSearchServer()) {
            var catalogs = manager(server);

            assertFalse(catalogs.catalogExists("maps"));
            assertTrue(catalogs.createCatalog("maps"));
            assertFalse(catalogs.createCatalog("maps"));
            assertTrue(catalogs.createCatalog("imagery"));

            assertTrue(catalogs.catalogExists("maps"));
            assertEquals(Set.of("imagery", "maps"), catalogs.listCatalogs());

            assertTrue(catalogs.deleteCatalog("maps"));
            assertFalse(catalogs.deleteCatalog("maps"));
            assertEquals(Set.of("imagery"), catalogs.listCatalogs());
        }
    }

    @Test
    void legacyServerGetsTypedMappingAndDocumentType() throws Exception {
        try (var server = new FakeSearchServer("elasticsearch", "6.8.0")) {
            var catalogs = manager(server);

            catalogs.createCatalog("maps");

            assertEquals("6.8.0", catalogs.serverVersion().number());
            assertEquals("layer", catalogs.documentType());
            assertTrue(server.createBody("maps").path("mappings").has("layer"));
        }
    }

    @Test
    void versionIsReadOnce() throws Exception {
        try (var server = new FakeSearchServer()) {
            var catalogs = manager(server);

            catalogs.serverVersion();
            catalogs.documentType();
            catalogs.ensureCatalog("maps");
            catalogs.ensureCatalog("maps");

            assertEquals(1, server.requests().stream().filter(r -> r.path().equals("/")).count());
            assertEquals(1, server.count("PUT", "/maps"));
        }
    }

    @Test
    void invalidCatalogNamesAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> CatalogIndexManager.validateCatalogName("My Maps"));
        assertThrows(IllegalArgumentException.class, () -> CatalogIndexManager.validateCatalogName("_hidden"));
        CatalogIndexManager.validateCatalogName("city-maps.v2");
    }

    @Test
    void unreachableServerIsReportedAsIndexUnavailable() {
        var client = new OpenSearchClient(new ReactorNettyRestClient(ConnectionContext.of("http://127.0.0.1:1")),
            1, Duration.ofMillis(10), Duration.ofMillis(20));

        assertThrows(IndexUnavailableException.class, () -> new CatalogIndexManager(client, null).serverVersion());
    }
}
