package org.catalogregistry.harvest.pipeline.ir;

import java.time.Instant;

/**
 * Per-source bookkeeping persisted between passes.
 *
 * The cursor only moves on a completed pass, so a failed or cancelled pass is
 * retried from the last successful position. {@code indexDirty} marks a source
 * whose index documents may lag the store and must be re-projected first.
 */
public record HarvestState(
    String source,
    Instant lastSuccessAt,
    String cursor,
    Instant lastAttemptAt,
    HarvestErrorKind lastErrorKind,
    String lastErrorMessage,
    boolean indexDirty
) {
    public static HarvestState initial(String source) {
        return new HarvestState(source, null, null, null, null, null, false);
    }

    public HarvestState completed(String nextCursor, Instant at, boolean dirty) {
        return new HarvestState(source, at, nextCursor, at, null, null, dirty);
    }

    public HarvestState failed(HarvestErrorKind kind, String message, Instant at, boolean dirty) {
        return new HarvestState(source, lastSuccessAt, cursor, at, kind, message, dirty);
    }

    public HarvestState withIndexDirty(boolean dirty) {
        return new HarvestState(source, lastSuccessAt, cursor, lastAttemptAt, lastErrorKind, lastErrorMessage, dirty);
    }

    public boolean hasError() {
        return lastErrorKind != null;
    }
}
