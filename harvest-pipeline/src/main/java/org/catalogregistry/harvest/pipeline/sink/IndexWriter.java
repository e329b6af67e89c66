package org.catalogregistry.harvest.pipeline.sink;

import java.util.List;

import org.catalogregistry.harvest.pipeline.errors.IndexUnavailableException;
import org.catalogregistry.harvest.pipeline.ir.CanonicalRecord;
import org.catalogregistry.harvest.pipeline.ir.RecordFailure;

/**
 * Port for projecting canonical records into a search index.
 *
 * The index is a cache of the store's live records: it never holds a document
 * whose record is tombstoned or absent, and can always be rebuilt from the store.
 * Writes may be buffered until {@link #flush()}.
 */
public interface IndexWriter extends AutoCloseable {

    /** Upsert the document of a live record. */
    void index(String catalog, CanonicalRecord record) throws IndexUnavailableException;

    /** Delete the document of a record. Deleting a missing document is not an error. */
    void remove(String catalog, String identifier) throws IndexUnavailableException;

    /** Delete every document projected from a source. */
    void removeSource(String catalog, String source) throws IndexUnavailableException;

    /**
     * Make pending writes visible to search.
     *
     * @return documents the index rejected individually
     */
    List<RecordFailure> flush() throws IndexUnavailableException;

    /** Drop buffered writes of an aborted pass; the next pass rebuilds what they would have changed. */
    default void discardPending() {
        // Default no-op for writers that don't buffer
    }

    @Override
    default void close() throws Exception {
        // Default no-op
    }
}
