package org.catalogregistry.harvest.pipeline;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import org.catalogregistry.harvest.pipeline.errors.HarvestException;
import org.catalogregistry.harvest.pipeline.ir.ChangeType;
import org.catalogregistry.harvest.pipeline.ir.HarvestErrorKind;
import org.catalogregistry.harvest.pipeline.ir.PassOutcome;
import org.catalogregistry.harvest.pipeline.ir.PassSummary;
import org.catalogregistry.harvest.pipeline.ir.RecordFailure;

/**
 * Thread-safe accumulator for the counts of one pass.
 */
class PassTally {
    private final String source;
    private final long startNanos = System.nanoTime();
    private final AtomicInteger created = new AtomicInteger();
    private final AtomicInteger updated = new AtomicInteger();
    private final AtomicInteger unchanged = new AtomicInteger();
    private final AtomicInteger deleted = new AtomicInteger();
    private final AtomicInteger duplicates = new AtomicInteger();
    private final AtomicBoolean wrote = new AtomicBoolean();
    private final AtomicBoolean diverged = new AtomicBoolean();
    private final List<RecordFailure> failures = new ArrayList<>();

    PassTally(String source) {
        this.source = source;
    }

    void count(ChangeType type) {
        switch (type) {
            case CREATED:
                created.incrementAndGet();
                break;
            case UPDATED:
                updated.incrementAndGet();
                break;
            case UNCHANGED:
                unchanged.incrementAndGet();
                break;
            case DELETED:
                deleted.incrementAndGet();
                break;
            default:
                throw new IllegalArgumentException("Unknown change type " + type);
        }
    }

    void duplicateResolved() {
        duplicates.incrementAndGet();
    }

    /** Store or index contents of the source were modified by this pass. */
    void markWrite() {
        wrote.set(true);
    }

    boolean hasWrites() {
        return wrote.get();
    }

    /** The index lost a document whose record is still live in the store. */
    void markIndexDivergence() {
        diverged.set(true);
    }

    boolean hasIndexDivergence() {
        return diverged.get();
    }

    synchronized void recordFailure(String reference, HarvestException e) {
        failures.add(new RecordFailure(reference, e.getKind(), e.getMessage()));
    }

    synchronized void recordFailures(List<RecordFailure> more) {
        failures.addAll(more);
    }

    PassSummary completed(boolean listingComplete, boolean reconciled) {
        return summary(PassOutcome.COMPLETED, listingComplete, reconciled, null, null);
    }

    PassSummary failed(HarvestErrorKind kind, String message) {
        return summary(PassOutcome.FAILED, false, false, kind, message);
    }

    private synchronized PassSummary summary(PassOutcome outcome, boolean listingComplete, boolean reconciled,
                                             HarvestErrorKind error, String message) {
        return new PassSummary(
            source,
            outcome,
            created.get(),
            updated.get(),
            unchanged.get(),
            deleted.get(),
            failures.size(),
            duplicates.get(),
            listingComplete,
            reconciled,
            Duration.ofNanos(System.nanoTime() - startNanos),
            failures,
            error,
            message
        );
    }
}
