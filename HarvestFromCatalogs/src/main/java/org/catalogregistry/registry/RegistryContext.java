package org.catalogregistry.registry;

import java.time.Clock;

import org.catalogregistry.csw.reader.RecordSourceRouter;
import org.catalogregistry.harvest.pipeline.HarvestOrchestrator;
import org.catalogregistry.harvest.pipeline.HarvestScheduler;
import org.catalogregistry.harvest.pipeline.IndexRebuilder;
import org.catalogregistry.harvest.pipeline.errors.StoreUnavailableException;
import org.catalogregistry.harvest.pipeline.source.RecordSource;
import org.catalogregistry.harvest.pipeline.sysprof.SysprofRegistrar;
import org.catalogregistry.registry.common.http.ConnectionContext;
import org.catalogregistry.registry.common.http.ReactorNettyRestClient;
import org.catalogregistry.registry.common.index.CatalogIndexManager;
import org.catalogregistry.registry.common.index.IndexDocumentProjector;
import org.catalogregistry.registry.common.index.OpenSearchClient;
import org.catalogregistry.registry.common.index.OpenSearchIndexWriter;
import org.catalogregistry.registry.common.store.JdbcRecordStore;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * The components of a registry installation, wired from its configuration.
 *
 * Every harvest pass gets its own index writer, so passes of different sources
 * never share a bulk buffer.
 */
@Slf4j
@Getter
public class RegistryContext implements AutoCloseable {
    private final RegistryConfig config;
    private final JdbcRecordStore store;
    private final OpenSearchClient searchClient;
    private final CatalogIndexManager catalogs;
    private final RecordSource source;
    private final HarvestOrchestrator orchestrator;
    private final Clock clock;

    public RegistryContext(RegistryConfig config) throws StoreUnavailableException {
        this(config, RecordSourceRouter.standard(), Clock.systemUTC());
    }

    public RegistryContext(RegistryConfig config, RecordSource source, Clock clock)
        throws StoreUnavailableException {
        this.config = config;
        this.clock = clock;
        this.source = source;
        this.store = JdbcRecordStore.open(config.getDatabaseUrl());
        this.searchClient = new OpenSearchClient(new ReactorNettyRestClient(
            ConnectionContext.of(config.getSearchUrl(), config.isSearchInsecure())));
        this.catalogs = new CatalogIndexManager(searchClient, config.getMappingPrecision());
        this.orchestrator = HarvestOrchestrator.builder()
            .source(source)
            .store(store)
            .stateStore(store)
            .indexWriterFactory(this::newIndexWriter)
            .clock(clock)
            .recordConcurrency(config.getRecordConcurrency())
            .leaseTimeout(config.getLeaseTimeout())
            .build();
        log.atInfo().setMessage("Registry using store {} and search service {}")
            .addArgument(config::getDatabaseUrl)
            .addArgument(() -> searchClient.getRestClient().getConnectionContext())
            .log();
    }

    public OpenSearchIndexWriter newIndexWriter() {
        return new OpenSearchIndexWriter(searchClient, catalogs, new IndexDocumentProjector(),
            config.getBulkMaxDocs(), OpenSearchIndexWriter.DEFAULT_MAX_BYTES_PER_BULK);
    }

    public HarvestScheduler scheduler() {
        return new HarvestScheduler(orchestrator, config.getMaxConcurrentSources());
    }

    public IndexRebuilder rebuilder() {
        return new IndexRebuilder(store, newIndexWriter());
    }

    public SysprofRegistrar sysprof() {
        return new SysprofRegistrar(store, config.getProfile().toServiceProfile(), clock);
    }

    @Override
    public void close() {
        try {
            source.close();
        } catch (Exception e) {
            log.atWarn().setMessage("Error closing record sources").setCause(e).log();
        }
        store.close();
    }
}
