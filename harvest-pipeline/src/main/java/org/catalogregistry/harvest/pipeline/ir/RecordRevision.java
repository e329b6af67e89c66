package org.catalogregistry.harvest.pipeline.ir;

import java.time.Instant;

import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * One entry of a record's append-only history.
 */
public record RecordRevision(
    String identifier,
    long revision,
    String fingerprint,
    boolean tombstoned,
    Instant recordedAt,
    ObjectNode payload
) {
    public static RecordRevision of(CanonicalRecord record) {
        return new RecordRevision(
            record.identifier(),
            record.revision(),
            record.fingerprint(),
            record.tombstoned(),
            record.lastSeen(),
            record.payload()
        );
    }
}
