package org.catalogregistry.harvest.pipeline.detect;

import java.time.Instant;
import java.util.Optional;

import org.catalogregistry.harvest.pipeline.ir.CanonicalRecord;
import org.catalogregistry.harvest.pipeline.ir.ChangeType;
import org.catalogregistry.harvest.pipeline.ir.RecordChange;

/**
 * Classifies a candidate against the persisted state of the same identifier.
 * Pure: it decides revisions but writes nothing.
 */
public class ChangeDetector {

    public RecordChange detect(CanonicalRecord candidate, Optional<CanonicalRecord> prior) {
        if (prior.isEmpty()) {
            return new RecordChange(ChangeType.CREATED, candidate.withRevision(1));
        }
        var stored = prior.get();
        if (!stored.identifier().equals(candidate.identifier())) {
            throw new IllegalArgumentException("Cannot compare " + candidate.identifier()
                + " with stored record " + stored.identifier());
        }
        if (stored.tombstoned()) {
            // Revived after a deletion; the revision keeps counting from the tombstone
            return new RecordChange(ChangeType.CREATED, candidate.withRevision(stored.revision() + 1));
        }
        if (stored.fingerprint().equals(candidate.fingerprint())) {
            return new RecordChange(ChangeType.UNCHANGED, stored.withLastSeen(candidate.lastSeen()));
        }
        return new RecordChange(ChangeType.UPDATED, candidate.withRevision(stored.revision() + 1));
    }

    /** A record that a complete listing no longer contains. */
    public RecordChange missing(CanonicalRecord stored, Instant at) {
        if (stored.tombstoned()) {
            throw new IllegalArgumentException("Record " + stored.identifier() + " is already deleted");
        }
        return new RecordChange(ChangeType.DELETED, stored.asTombstone(at));
    }
}
