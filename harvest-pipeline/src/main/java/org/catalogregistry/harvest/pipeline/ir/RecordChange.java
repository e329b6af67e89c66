package org.catalogregistry.harvest.pipeline.ir;

/**
 * Classification of a candidate against persisted state, carrying the record to write.
 */
public record RecordChange(
    ChangeType type,
    CanonicalRecord record
) {
    public boolean requiresWrite() {
        return type != ChangeType.UNCHANGED;
    }
}
