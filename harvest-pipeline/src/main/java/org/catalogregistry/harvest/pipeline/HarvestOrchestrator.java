package org.catalogregistry.harvest.pipeline;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

import org.catalogregistry.harvest.pipeline.detect.ChangeDetector;
import org.catalogregistry.harvest.pipeline.errors.HarvestException;
import org.catalogregistry.harvest.pipeline.errors.LeaseUnavailableException;
import org.catalogregistry.harvest.pipeline.errors.MalformedRecordException;
import org.catalogregistry.harvest.pipeline.errors.RecordWriteException;
import org.catalogregistry.harvest.pipeline.errors.StoreUnavailableException;
import org.catalogregistry.harvest.pipeline.ir.CanonicalRecord;
import org.catalogregistry.harvest.pipeline.ir.ChangeType;
import org.catalogregistry.harvest.pipeline.ir.HarvestErrorKind;
import org.catalogregistry.harvest.pipeline.ir.HarvestState;
import org.catalogregistry.harvest.pipeline.ir.PassSummary;
import org.catalogregistry.harvest.pipeline.ir.SourceEndpoint;
import org.catalogregistry.harvest.pipeline.ir.SourceListing;
import org.catalogregistry.harvest.pipeline.normalize.RecordNormalizer;
import org.catalogregistry.harvest.pipeline.sink.IndexWriter;
import org.catalogregistry.harvest.pipeline.source.RecordSource;
import org.catalogregistry.harvest.pipeline.store.HarvestStateStore;
import org.catalogregistry.harvest.pipeline.store.RecordStore;

import lombok.Builder;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Drives harvest passes: {@code LISTING -> PER_RECORD_PROCESSING -> RECONCILING -> COMPLETED | FAILED}.
 *
 * Record-scoped failures are tallied and skipped. Pass-scoped failures end the
 * pass without advancing the source's cursor, so the next pass resumes instead
 * of skipping data. Deletions are only inferred from complete listings, and only
 * after every upsert of the pass has been committed.
 *
 * Each pass draws its index writer from {@code indexWriterFactory}, so passes of
 * different sources running at once never flush or discard each other's buffered
 * writes. A single {@code indexWriter} is only safe for sequential passes.
 */
@Slf4j
public class HarvestOrchestrator {

    public enum Phase {
        IDLE,
        LISTING,
        PER_RECORD_PROCESSING,
        RECONCILING,
        COMPLETED,
        FAILED
    }

    /** Summary of a pass together with the state the next pass should start from. */
    public record PassResult(PassSummary summary, HarvestState state) {}

    public static final Duration DEFAULT_LEASE_TIMEOUT = Duration.ofSeconds(30);

    private final RecordSource source;
    private final RecordStore store;
    private final HarvestStateStore stateStore;
    private final Supplier<IndexWriter> indexWriters;
    private final RecordNormalizer normalizer;
    private final ChangeDetector detector;
    @Getter
    private final SourceLeases leases;
    private final Clock clock;
    private final int recordConcurrency;
    private final Duration leaseTimeout;

    @Builder
    private HarvestOrchestrator(RecordSource source,
                                RecordStore store,
                                HarvestStateStore stateStore,
                                IndexWriter indexWriter,
                                Supplier<IndexWriter> indexWriterFactory,
                                RecordNormalizer normalizer,
                                ChangeDetector detector,
                                SourceLeases leases,
                                Clock clock,
                                int recordConcurrency,
                                Duration leaseTimeout) {
        if (source == null || store == null || stateStore == null) {
            throw new IllegalArgumentException("source, store and stateStore are required");
        }
        if ((indexWriter == null) == (indexWriterFactory == null)) {
            throw new IllegalArgumentException("Exactly one of indexWriter and indexWriterFactory is required");
        }
        this.source = source;
        this.store = store;
        this.stateStore = stateStore;
        this.indexWriters = indexWriterFactory != null ? indexWriterFactory : () -> indexWriter;
        this.normalizer = normalizer != null ? normalizer : new RecordNormalizer();
        this.detector = detector != null ? detector : new ChangeDetector();
        this.leases = leases != null ? leases : new SourceLeases();
        this.clock = clock != null ? clock : Clock.systemUTC();
        this.recordConcurrency = Math.max(1, recordConcurrency);
        this.leaseTimeout = leaseTimeout != null ? leaseTimeout : DEFAULT_LEASE_TIMEOUT;
    }

    public PassSummary harvest(SourceEndpoint endpoint) {
        return harvest(endpoint, PassCancellation.none());
    }

    /**
     * Run one pass of a source under its lease, loading its state before and
     * persisting it after. Never throws; every failure ends up in the summary.
     */
    public PassSummary harvest(SourceEndpoint endpoint, PassCancellation cancellation) {
        var name = endpoint.name();
        if (SourceEndpoint.isReserved(name)) {
            log.error("Refusing to harvest source {}: the name is reserved for the registry's own records", name);
            return new PassTally(name).failed(HarvestErrorKind.INTERNAL, "Source name " + name + " is reserved");
        }
        try (var lease = leases.acquire(name, leaseTimeout)) {
            HarvestState state;
            try {
                state = stateStore.loadState(name);
            } catch (StoreUnavailableException e) {
                log.atError().setMessage("Cannot load harvest state of {}").addArgument(name).setCause(e).log();
                return new PassTally(name).failed(e.getKind(), e.getMessage());
            }

            var result = runPass(endpoint, state, cancellation);
            try {
                stateStore.saveState(result.state());
            } catch (StoreUnavailableException e) {
                log.atError().setMessage("Cannot persist harvest state of {}").addArgument(name).setCause(e).log();
                var summary = result.summary();
                return summary.isCompleted() ? summary.withFailure(e.getKind(), e.getMessage()) : summary;
            }
            return result.summary();
        } catch (LeaseUnavailableException e) {
            log.warn("Skipping pass: {}", e.getMessage());
            return new PassTally(name).failed(e.getKind(), e.getMessage());
        }
    }

    /**
     * Run one pass from the given state without persisting anything about the
     * pass itself; records and index documents are written as the pass goes.
     */
    public PassResult runPass(SourceEndpoint endpoint, HarvestState state, PassCancellation cancellation) {
        var name = endpoint.name();
        if (SourceEndpoint.isReserved(name)) {
            throw new IllegalArgumentException("Source name " + name + " is reserved");
        }
        var tally = new PassTally(name);
        var indexWriter = indexWriters.get();
        var phase = Phase.IDLE;
        var dirty = state.indexDirty();
        log.info("Starting harvest pass of {} from cursor {}", name, state.cursor());

        try {
            if (dirty) {
                var rebuild = new IndexRebuilder(store, indexWriter).rebuildSource(endpoint.catalog(), name);
                tally.recordFailures(rebuild.failures());
                dirty = !rebuild.failures().isEmpty();
            }

            phase = Phase.LISTING;
            SourceListing listing = source.list(endpoint, state.cursor());
            log.info("Listed {} records from {} (complete={})", listing.records().size(), name, listing.complete());

            phase = Phase.PER_RECORD_PROCESSING;
            var candidates = normalizeAll(listing, endpoint, tally);
            processAll(candidates.records(), endpoint, indexWriter, cancellation, tally);

            var reconcile = listing.complete() && candidates.allIdentified();
            if (reconcile) {
                phase = Phase.RECONCILING;
                reconcile(endpoint, candidates.listedIdentifiers(), indexWriter, cancellation, tally);
            } else if (listing.complete()) {
                log.warn("Skipping deletion detection for {}: some listed records had no identifier", name);
            } else {
                log.debug("Skipping deletion detection for {}: listing was not complete", name);
            }

            var rejected = indexWriter.flush();
            tally.recordFailures(rejected);

            phase = Phase.COMPLETED;
            var summary = tally.completed(listing.complete(), reconcile);
            log.info("Completed harvest pass: {}", summary);
            return new PassResult(summary, state.completed(listing.nextCursor(), clock.instant(),
                dirty || !rejected.isEmpty() || tally.hasIndexDivergence()));
        } catch (HarvestException e) {
            return fail(endpoint, state, indexWriter, tally, phase, dirty, e.getKind(), e.getMessage(), e);
        } catch (RuntimeException e) {
            return fail(endpoint, state, indexWriter, tally, phase, dirty, HarvestErrorKind.INTERNAL,
                String.valueOf(e), e);
        }
    }

    private PassResult fail(SourceEndpoint endpoint, HarvestState state, IndexWriter indexWriter,
                            PassTally tally, Phase phase,
                            boolean dirty, HarvestErrorKind kind, String message, Exception cause) {
        indexWriter.discardPending();
        var summary = tally.failed(kind, message);
        if (kind == HarvestErrorKind.CANCELLED) {
            log.info("Harvest pass of {} cancelled during {}: {}", endpoint.name(), phase, summary);
        } else {
            log.atError().setMessage("Harvest pass of {} failed during {}: {}")
                .addArgument(endpoint.name()).addArgument(phase).addArgument(summary)
                .setCause(cause).log();
        }
        var failedState = state.failed(kind, message, clock.instant(), dirty || tally.hasWrites());
        return new PassResult(summary, failedState);
    }

    private record Candidates(List<CanonicalRecord> records, Set<String> listedIdentifiers, boolean allIdentified) {}

    /**
     * Normalizes in arrival order. A later duplicate of an identifier replaces the
     * earlier one. Malformed records whose identifier can still be resolved count
     * as listed, so they are never mistaken for deletions.
     */
    private Candidates normalizeAll(SourceListing listing, SourceEndpoint endpoint, PassTally tally) {
        var byIdentifier = new LinkedHashMap<String, CanonicalRecord>();
        var listed = new HashSet<String>();
        var allIdentified = true;
        var seenAt = clock.instant();
        var position = 0;
        for (var raw : listing.records()) {
            try {
                var candidate = normalizer.normalize(raw, endpoint, seenAt);
                listed.add(candidate.identifier());
                if (byIdentifier.remove(candidate.identifier()) != null) {
                    tally.duplicateResolved();
                    log.debug("Duplicate identifier {} in listing of {}; keeping the later record",
                        candidate.identifier(), endpoint.name());
                }
                byIdentifier.put(candidate.identifier(), candidate);
            } catch (MalformedRecordException e) {
                log.warn("Skipping malformed record {} of {}: {}", raw.reference(position), endpoint.name(),
                    e.getMessage());
                tally.recordFailure(raw.reference(position), e);
                var identifier = normalizer.identifierOf(raw, endpoint);
                if (identifier != null) {
                    listed.add(identifier);
                } else {
                    allIdentified = false;
                }
            }
            position++;
        }
        return new Candidates(new ArrayList<>(byIdentifier.values()), listed, allIdentified);
    }

    private void processAll(List<CanonicalRecord> candidates, SourceEndpoint endpoint, IndexWriter indexWriter,
                            PassCancellation cancellation, PassTally tally) throws HarvestException {
        if (recordConcurrency == 1) {
            for (var candidate : candidates) {
                cancellation.checkpoint(endpoint.name());
                processRecord(candidate, endpoint, indexWriter, tally);
            }
            return;
        }

        // Candidates are unique per identifier, so concurrent writes never touch the same record
        var abort = new AtomicReference<HarvestException>();
        Flux.fromIterable(candidates)
            .flatMapDelayError(candidate -> Mono.fromRunnable(() -> {
                if (abort.get() != null) {
                    return;
                }
                try {
                    cancellation.checkpoint(endpoint.name());
                    processRecord(candidate, endpoint, indexWriter, tally);
                } catch (HarvestException e) {
                    abort.compareAndSet(null, e);
                }
            }).subscribeOn(Schedulers.boundedElastic()), recordConcurrency, 1)
            .then()
            .block();
        if (abort.get() != null) {
            throw abort.get();
        }
    }

    private void processRecord(CanonicalRecord candidate, SourceEndpoint endpoint, IndexWriter indexWriter,
                               PassTally tally)
        throws HarvestException {
        var change = detector.detect(candidate, store.get(candidate.identifier()));
        try {
            store.upsert(change.record());
        } catch (RecordWriteException e) {
            log.warn("Could not store {}: {}", candidate.identifier(), e.getMessage());
            tally.recordFailure(candidate.identifier(), e);
            return;
        }
        if (change.requiresWrite()) {
            tally.markWrite();
            indexWriter.index(endpoint.catalog(), change.record());
            log.atDebug().setMessage("{} {} at revision {}")
                .addArgument(change.type()).addArgument(candidate::identifier)
                .addArgument(() -> change.record().revision()).log();
        }
        tally.count(change.type());
    }

    private void reconcile(SourceEndpoint endpoint, Set<String> listed, IndexWriter indexWriter,
                           PassCancellation cancellation, PassTally tally) throws HarvestException {
        var stale = new TreeSet<>(store.listIdentifiers(endpoint.name()));
        stale.removeAll(listed);
        if (!stale.isEmpty()) {
            log.info("{} records of {} are no longer listed", stale.size(), endpoint.name());
        }
        Instant now = clock.instant();
        for (var identifier : stale) {
            cancellation.checkpoint(endpoint.name());
            var stored = store.get(identifier);
            if (stored.isEmpty() || stored.get().tombstoned()) {
                continue;
            }
            var expected = detector.missing(stored.get(), now);
            tally.markWrite();
            indexWriter.remove(endpoint.catalog(), identifier);
            try {
                var tombstone = store.tombstone(identifier, now);
                if (tombstone.revision() != expected.record().revision()) {
                    log.warn("Tombstone of {} stored at revision {}, expected {}", identifier,
                        tombstone.revision(), expected.record().revision());
                }
            } catch (RecordWriteException e) {
                log.warn("Could not tombstone {}: {}", identifier, e.getMessage());
                tally.recordFailure(identifier, e);
                tally.markIndexDivergence();
                continue;
            }
            tally.count(ChangeType.DELETED);
        }
    }
}
