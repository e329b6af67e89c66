package org.catalogregistry.harvest.pipeline.ir;

import java.util.List;

/**
 * Result of enumerating a source endpoint.
 *
 * Completeness is explicit: deletions are only inferred from listings a reader
 * declared complete, never from partial or incremental ones.
 */
public record SourceListing(
    List<RawRecord> records,
    boolean complete,
    String nextCursor
) {
    public SourceListing {
        records = List.copyOf(records);
    }

    public static SourceListing complete(List<RawRecord> records) {
        return new SourceListing(records, true, null);
    }

    public static SourceListing partial(List<RawRecord> records, String nextCursor) {
        return new SourceListing(records, false, nextCursor);
    }
}
