package org.catalogregistry.harvest.pipeline.source;

import org.catalogregistry.harvest.pipeline.errors.SourceUnreachableException;
import org.catalogregistry.harvest.pipeline.ir.SourceEndpoint;
import org.catalogregistry.harvest.pipeline.ir.SourceListing;

/**
 * Port for enumerating catalog records from a metadata-service endpoint
 * (CSW service, transaction files, synthetic test data).
 *
 * Readers must only report a listing as complete when every record the source
 * holds was enumerated; the orchestrator infers deletions from complete listings.
 */
public interface RecordSource extends AutoCloseable {

    /**
     * Enumerate the records of an endpoint.
     *
     * @param endpoint the endpoint to read
     * @param cursor the cursor returned by the last completed pass, or null for a full listing
     */
    SourceListing list(SourceEndpoint endpoint, String cursor) throws SourceUnreachableException;

    @Override
    default void close() throws Exception {
        // Default no-op for sources that don't hold resources
    }
}
