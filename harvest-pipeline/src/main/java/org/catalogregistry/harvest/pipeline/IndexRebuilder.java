package org.catalogregistry.harvest.pipeline;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

import org.catalogregistry.harvest.pipeline.errors.IndexUnavailableException;
import org.catalogregistry.harvest.pipeline.errors.StoreUnavailableException;
import org.catalogregistry.harvest.pipeline.ir.RecordFailure;
import org.catalogregistry.harvest.pipeline.sink.IndexWriter;
import org.catalogregistry.harvest.pipeline.store.RecordStore;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Re-projects the store's live records into the index. The index holds nothing
 * the store doesn't, so a rebuild is always a full replacement.
 */
@Slf4j
@RequiredArgsConstructor
public class IndexRebuilder {
    private final RecordStore store;
    private final IndexWriter indexWriter;

    public record RebuildResult(String source, int indexed, List<RecordFailure> failures) {}

    public RebuildResult rebuildSource(String catalog, String source)
        throws StoreUnavailableException, IndexUnavailableException {
        log.info("Rebuilding index documents of source {} in catalog {}", source, catalog);
        indexWriter.removeSource(catalog, source);
        var records = store.listRecords(source);
        for (var record : records) {
            indexWriter.index(catalog, record);
        }
        var failures = indexWriter.flush();
        log.info("Rebuilt {} documents of source {} ({} rejected)", records.size(), source, failures.size());
        return new RebuildResult(source, records.size() - failures.size(), failures);
    }

    /**
     * Rebuild every source in the store.
     *
     * @param catalogOf maps a source name to the catalog its documents live in
     */
    public List<RebuildResult> rebuildAll(Function<String, String> catalogOf)
        throws StoreUnavailableException, IndexUnavailableException {
        var results = new ArrayList<RebuildResult>();
        for (var source : store.listSources()) {
            results.add(rebuildSource(catalogOf.apply(source), source));
        }
        return results;
    }
}
