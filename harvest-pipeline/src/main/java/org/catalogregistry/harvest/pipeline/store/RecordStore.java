package org.catalogregistry.harvest.pipeline.store;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import org.catalogregistry.harvest.pipeline.errors.RecordWriteException;
import org.catalogregistry.harvest.pipeline.errors.StoreUnavailableException;
import org.catalogregistry.harvest.pipeline.ir.CanonicalRecord;
import org.catalogregistry.harvest.pipeline.ir.RecordRevision;

/**
 * Port for the relational system of record.
 *
 * Every write is a single-record transaction that also appends the written
 * revision to the record's history. Losing connectivity surfaces as
 * {@link StoreUnavailableException}; any other failure of a single write as
 * {@link RecordWriteException}.
 */
public interface RecordStore extends AutoCloseable {

    /** Create the schema if it does not exist yet. Safe to run repeatedly. */
    void initializeSchema() throws StoreUnavailableException;

    /** Write or replace the record keyed by its identifier. */
    void upsert(CanonicalRecord record) throws StoreUnavailableException, RecordWriteException;

    Optional<CanonicalRecord> get(String identifier) throws StoreUnavailableException;

    /** Identifiers of all live (non-tombstoned) records of a source. */
    Set<String> listIdentifiers(String source) throws StoreUnavailableException;

    /** All live records of a source, for index rebuilds. */
    List<CanonicalRecord> listRecords(String source) throws StoreUnavailableException;

    /** Names of every source that has records in the store. */
    Set<String> listSources() throws StoreUnavailableException;

    /**
     * Mark a record deleted without erasing its history.
     *
     * @return the tombstoned record, with its revision incremented
     */
    CanonicalRecord tombstone(String identifier, Instant at) throws StoreUnavailableException, RecordWriteException;

    /** Every revision written for an identifier, oldest first. */
    List<RecordRevision> history(String identifier) throws StoreUnavailableException;

    @Override
    default void close() throws Exception {
        // Default no-op
    }
}
