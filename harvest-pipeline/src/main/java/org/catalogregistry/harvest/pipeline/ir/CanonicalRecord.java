package org.catalogregistry.harvest.pipeline.ir;

import java.time.Instant;

import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Normalized store-of-record representation of a harvested metadata entry.
 *
 * The payload is the sorted, normalized JSON object; the fingerprint covers the
 * part of it whose change makes a new revision. Revision 0 marks a candidate that
 * has not been classified yet.
 */
public record CanonicalRecord(
    String identifier,
    String source,
    ObjectNode payload,
    String fingerprint,
    long revision,
    boolean tombstoned,
    Instant lastSeen
) {
    public CanonicalRecord withRevision(long newRevision) {
        return new CanonicalRecord(identifier, source, payload, fingerprint, newRevision, false, lastSeen);
    }

    public CanonicalRecord withLastSeen(Instant seenAt) {
        return new CanonicalRecord(identifier, source, payload, fingerprint, revision, tombstoned, seenAt);
    }

    /** Soft-deleted successor of this record; payload and fingerprint are retained for history. */
    public CanonicalRecord asTombstone(Instant at) {
        return new CanonicalRecord(identifier, source, payload, fingerprint, revision + 1, true, at);
    }

    public String text(String field) {
        var node = payload.get(field);
        return node == null || node.isNull() ? null : node.asText();
    }
}
