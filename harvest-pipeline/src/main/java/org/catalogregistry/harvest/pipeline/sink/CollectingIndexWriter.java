package org.catalogregistry.harvest.pipeline.sink;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import org.catalogregistry.harvest.pipeline.ir.CanonicalRecord;
import org.catalogregistry.harvest.pipeline.ir.RecordFailure;

/**
 * A collecting IndexWriter for testing the pipeline without a search engine.
 *
 * Writes are staged until {@link #flush()}, mirroring an index that only makes
 * bulk writes visible after a refresh.
 */
public class CollectingIndexWriter implements IndexWriter {

    private final Map<String, CanonicalRecord> visible = new ConcurrentHashMap<>();
    private final List<Runnable> pending = new ArrayList<>();
    private int flushCount;

    @Override
    public synchronized void index(String catalog, CanonicalRecord record) {
        if (record.tombstoned()) {
            throw new IllegalArgumentException("Tombstoned record " + record.identifier() + " must not be indexed");
        }
        pending.add(() -> visible.put(record.identifier(), record));
    }

    @Override
    public synchronized void remove(String catalog, String identifier) {
        pending.add(() -> visible.remove(identifier));
    }

    @Override
    public synchronized void removeSource(String catalog, String source) {
        pending.add(() -> visible.values().removeIf(r -> r.source().equals(source)));
    }

    @Override
    public synchronized List<RecordFailure> flush() {
        pending.forEach(Runnable::run);
        pending.clear();
        flushCount++;
        return List.of();
    }

    @Override
    public synchronized void discardPending() {
        pending.clear();
    }

    public Map<String, CanonicalRecord> getDocuments() {
        return Collections.unmodifiableMap(visible);
    }

    public synchronized int getPendingCount() {
        return pending.size();
    }

    public synchronized int getFlushCount() {
        return flushCount;
    }
}
