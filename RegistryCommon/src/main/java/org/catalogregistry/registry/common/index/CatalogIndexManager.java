package org.catalogregistry.registry.common.index;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

import org.catalogregistry.harvest.pipeline.errors.IndexUnavailableException;

import lombok.extern.slf4j.Slf4j;

/**
 * Creates, lists and deletes catalogs. Each catalog is one search index whose
 * mapping matches the version of the server it lives on.
 */
@Slf4j
public class CatalogIndexManager {
    private static final Pattern CATALOG_NAME = Pattern.compile("[a-z0-9][a-z0-9_.-]*");

    private final OpenSearchClient client;
    private final String mappingPrecision;
    private final Set<String> knownCatalogs = ConcurrentHashMap.newKeySet();
    private volatile ServerVersion serverVersion;

    public CatalogIndexManager(OpenSearchClient client, String mappingPrecision) {
        this.client = client;
        this.mappingPrecision = mappingPrecision == null ? IndexMappings.DEFAULT_PRECISION : mappingPrecision;
    }

    public static void validateCatalogName(String catalog) {
        if (catalog == null || !CATALOG_NAME.matcher(catalog).matches()) {
            throw new IllegalArgumentException("Invalid catalog name '" + catalog
                + "': use lowercase letters, digits, '-', '_' or '.'");
        }
    }

    public ServerVersion serverVersion() throws IndexUnavailableException {
        var version = serverVersion;
        if (version == null) {
            version = client.getServerVersion();
            log.info("Connected to search server {}", version);
            serverVersion = version;
        }
        return version;
    }

    /** Mapping type for bulk actions, or null on typeless servers. */
    public String documentType() throws IndexUnavailableException {
        return serverVersion().isTypeless() ? null : IndexMappings.LEGACY_TYPE;
    }

    public Set<String> listCatalogs() throws IndexUnavailableException {
        return client.listIndices();
    }

    public boolean catalogExists(String catalog) throws IndexUnavailableException {
        return client.listIndices().contains(catalog);
    }

    /** @return false when the catalog already existed */
    public boolean createCatalog(String catalog) throws IndexUnavailableException {
        validateCatalogName(catalog);
        var body = IndexMappings.catalogIndexBody(serverVersion(), mappingPrecision);
        var created = client.createIndex(catalog, body);
        knownCatalogs.add(catalog);
        if (created) {
            log.info("Catalog {} created", catalog);
        } else {
            log.debug("Catalog {} already exists", catalog);
        }
        return created;
    }

    /** @return false when there was no such catalog */
    public boolean deleteCatalog(String catalog) throws IndexUnavailableException {
        knownCatalogs.remove(catalog);
        var deleted = client.deleteIndex(catalog);
        if (deleted) {
            log.info("Catalog {} removed", catalog);
        } else {
            log.info("Catalog {} does not exist", catalog);
        }
        return deleted;
    }

    /** Create the catalog unless this manager has already seen it. */
    public void ensureCatalog(String catalog) throws IndexUnavailableException {
        if (!knownCatalogs.contains(catalog)) {
            createCatalog(catalog);
        }
    }
}
