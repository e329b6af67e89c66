package org.catalogregistry.harvest.pipeline.ir;

import java.time.Duration;
import java.util.List;

/**
 * Outcome of one harvest pass for one source.
 *
 * {@code failed} counts record-scoped failures; a pass-scoped failure is reported
 * through {@code outcome}, {@code error} and {@code errorMessage}.
 */
public record PassSummary(
    String source,
    PassOutcome outcome,
    int created,
    int updated,
    int unchanged,
    int deleted,
    int failed,
    int duplicatesResolved,
    boolean listingComplete,
    boolean reconciled,
    Duration elapsed,
    List<RecordFailure> failures,
    HarvestErrorKind error,
    String errorMessage
) {
    public PassSummary {
        failures = List.copyOf(failures);
    }

    public boolean isCompleted() {
        return outcome == PassOutcome.COMPLETED;
    }

    /** This summary turned into a failed one, keeping the counts of the work already done. */
    public PassSummary withFailure(HarvestErrorKind kind, String message) {
        return new PassSummary(source, PassOutcome.FAILED, created, updated, unchanged, deleted, failed,
            duplicatesResolved, listingComplete, reconciled, elapsed, failures, kind, message);
    }

    /** Number of records whose stored state was written by this pass. */
    public int changed() {
        return created + updated + deleted;
    }

    @Override
    public String toString() {
        return String.format("PassSummary{source='%s', outcome=%s, created=%d, updated=%d, unchanged=%d, "
                + "deleted=%d, failed=%d, duplicates=%d, complete=%s, reconciled=%s, elapsed=%dms%s}",
            source, outcome, created, updated, unchanged, deleted, failed, duplicatesResolved,
            listingComplete, reconciled, elapsed.toMillis(),
            error == null ? "" : ", error=" + error + " (" + errorMessage + ")");
    }
}
