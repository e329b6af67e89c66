package org.catalogregistry.harvest.pipeline;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

import org.catalogregistry.harvest.pipeline.errors.RecordWriteException;
import org.catalogregistry.harvest.pipeline.errors.StoreUnavailableException;
import org.catalogregistry.harvest.pipeline.ir.CanonicalRecord;
import org.catalogregistry.harvest.pipeline.ir.HarvestErrorKind;
import org.catalogregistry.harvest.pipeline.ir.PassOutcome;
import org.catalogregistry.harvest.pipeline.ir.RawRecord;
import org.catalogregistry.harvest.pipeline.ir.SourceEndpoint;
import org.catalogregistry.harvest.pipeline.ir.SourceListing;
import org.catalogregistry.harvest.pipeline.sink.CollectingIndexWriter;
import org.catalogregistry.harvest.pipeline.source.ScriptedRecordSource;
import org.catalogregistry.harvest.pipeline.store.InMemoryRecordStore;
import org.catalogregistry.harvest.pipeline.sysprof.ServiceProfile;
import org.catalogregistry.harvest.pipeline.sysprof.SysprofRegistrar;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.catalogregistry.harvest.pipeline.source.ScriptedRecordSource.record;
import static org.junit.jupiter.api.Assertions.*;

class HarvestOrchestratorTest {
    private static final SourceEndpoint ENDPOINT = SourceEndpoint.builder()
        .name("geodata").type("csw").catalog("maps").build();
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-03-01T10:00:00Z"), ZoneOffset.UTC);

    private ScriptedRecordSource source;
    private InMemoryRecordStore store;
    private CollectingIndexWriter index;

    @BeforeEach
    void setUp() {
        source = new ScriptedRecordSource();
        store = new InMemoryRecordStore();
        index = new CollectingIndexWriter();
    }

    private HarvestOrchestrator orchestrator() {
        return orchestrator(store, 1);
    }

    private HarvestOrchestrator orchestrator(InMemoryRecordStore recordStore, int concurrency) {
        return HarvestOrchestrator.builder()
            .source(source)
            .store(recordStore)
            .stateStore(recordStore)
            .indexWriter(index)
            .clock(CLOCK)
            .recordConcurrency(concurrency)
            .build();
    }

    private static List<RawRecord> records(int count) {
        var records = new ArrayList<RawRecord>();
        for (int i = 0; i < count; i++) {
            records.add(record("r" + i, "Record " + i));
        }
        return records;
    }

    @Test
    void createsThenUpdatesThenTombstones() throws Exception {
        var orchestrator = orchestrator();

        source.serve(record("A", "Alpha"), record("B", "Beta"));
        var first = orchestrator.harvest(ENDPOINT);
        assertEquals(PassOutcome.COMPLETED, first.outcome());
        assertEquals(2, first.created());
        assertEquals(1, store.get("geodata:A").orElseThrow().revision());
        assertEquals(1, store.get("geodata:B").orElseThrow().revision());

        source.serve(record("A", "Alpha"), record("B", "Beta, revised"));
        var second = orchestrator.harvest(ENDPOINT);
        assertEquals(1, second.unchanged());
        assertEquals(1, second.updated());
        assertEquals(1, store.get("geodata:A").orElseThrow().revision());
        assertEquals(2, store.get("geodata:B").orElseThrow().revision());
        assertEquals("Beta, revised", index.getDocuments().get("geodata:B").text("title"));

        source.serve(record("A", "Alpha"));
        var third = orchestrator.harvest(ENDPOINT);
        assertEquals(1, third.deleted());
        assertTrue(third.reconciled());
        var b = store.get("geodata:B").orElseThrow();
        assertTrue(b.tombstoned());
        assertEquals(3, b.revision());
        assertEquals(Set.of("geodata:A"), index.getDocuments().keySet());
        assertEquals(3, store.history("geodata:B").size());
    }

    @Test
    void secondPassOverSameDataChangesNothing() {
        var orchestrator = orchestrator();
        source.serve(records(10));

        orchestrator.harvest(ENDPOINT);
        var documentsAfterFirst = Set.copyOf(index.getDocuments().keySet());
        var second = orchestrator.harvest(ENDPOINT);

        assertTrue(second.isCompleted());
        assertEquals(0, second.changed());
        assertEquals(10, second.unchanged());
        assertEquals(documentsAfterFirst, index.getDocuments().keySet());
    }

    @Test
    void malformedRecordIsSkippedWithoutFailingThePass() throws Exception {
        var listing = new ArrayList<>(records(99));
        listing.add(50, new RawRecord("broken", "{not json"));
        source.serve(listing);

        var summary = orchestrator().harvest(ENDPOINT);

        assertTrue(summary.isCompleted());
        assertEquals(99, summary.created());
        assertEquals(1, summary.failed());
        assertEquals("broken", summary.failures().get(0).reference());
        assertEquals(HarvestErrorKind.MALFORMED_RECORD, summary.failures().get(0).kind());
        assertEquals(99, store.listIdentifiers("geodata").size());
    }

    @Test
    void malformedRecordDoesNotDeleteItsStoredVersion() throws Exception {
        var orchestrator = orchestrator();
        source.serve(record("A", "Alpha"), record("B", "Beta"));
        orchestrator.harvest(ENDPOINT);

        source.serve(record("A", "Alpha"), new RawRecord("B", "{broken"));
        var summary = orchestrator.harvest(ENDPOINT);

        assertEquals(0, summary.deleted());
        assertFalse(store.get("geodata:B").orElseThrow().tombstoned());
    }

    @Test
    void malformedRecordIsMatchedByItsPayloadIdentifier() throws Exception {
        var orchestrator = orchestrator();
        source.serve(new RawRecord("row-1", "{\"identifier\":\"A\",\"title\":\"Alpha\"}"));
        orchestrator.harvest(ENDPOINT);
        assertTrue(store.get("geodata:A").isPresent());

        source.serve(new RawRecord("row-1", "{\"identifier\":\"A\",\"title\":\"Alpha\",\" title\":\"Again\"}"));
        var summary = orchestrator.harvest(ENDPOINT);

        assertEquals(1, summary.failed());
        assertTrue(summary.reconciled());
        assertEquals(0, summary.deleted());
        assertFalse(store.get("geodata:A").orElseThrow().tombstoned());
    }

    @Test
    void unidentifiedMalformedRecordSuspendsDeletionDetection() throws Exception {
        var orchestrator = orchestrator();
        source.serve(record("A", "Alpha"), record("B", "Beta"));
        orchestrator.harvest(ENDPOINT);

        source.serve(record("A", "Alpha"), new RawRecord(null, "{broken"));
        var summary = orchestrator.harvest(ENDPOINT);

        assertTrue(summary.isCompleted());
        assertFalse(summary.reconciled());
        assertFalse(store.get("geodata:B").orElseThrow().tombstoned());
    }

    @Test
    void unreachableSourceFailsThePassAndKeepsEverything() throws Exception {
        var orchestrator = orchestrator();
        source.thenReturn(new SourceListing(List.of(record("A", "Alpha"), record("B", "Beta")), true, "cursor-1"));
        orchestrator.harvest(ENDPOINT);
        assertEquals("cursor-1", store.loadState("geodata").cursor());

        source.thenFail("connection reset after 1 of 2 pages");
        var summary = orchestrator.harvest(ENDPOINT);

        assertEquals(PassOutcome.FAILED, summary.outcome());
        assertEquals(HarvestErrorKind.SOURCE_UNREACHABLE, summary.error());
        assertEquals(0, summary.deleted());
        assertEquals(Set.of("geodata:A", "geodata:B"), store.listIdentifiers("geodata"));
        var state = store.loadState("geodata");
        assertEquals("cursor-1", state.cursor());
        assertEquals(HarvestErrorKind.SOURCE_UNREACHABLE, state.lastErrorKind());
        assertFalse(state.indexDirty());
    }

    @Test
    void partialListingNeverDeletes() throws Exception {
        var orchestrator = orchestrator();
        source.serve(record("A", "Alpha"), record("B", "Beta"));
        orchestrator.harvest(ENDPOINT);

        source.thenReturn(SourceListing.partial(List.of(record("A", "Alpha")), "page-2"));
        var summary = orchestrator.harvest(ENDPOINT);

        assertTrue(summary.isCompleted());
        assertFalse(summary.listingComplete());
        assertFalse(summary.reconciled());
        assertEquals(0, summary.deleted());
        assertFalse(store.get("geodata:B").orElseThrow().tombstoned());
        assertEquals("page-2", store.loadState("geodata").cursor());
    }

    @Test
    void cursorOfLastCompletedPassIsPassedToTheSource() {
        var orchestrator = orchestrator();
        source.thenReturn(SourceListing.partial(List.of(record("A", "Alpha")), "next-7"));

        orchestrator.harvest(ENDPOINT);
        orchestrator.harvest(ENDPOINT);

        assertEquals(Arrays.asList(null, "next-7"), source.getCursorsSeen());
    }

    @Test
    void duplicateIdentifiersKeepTheLastArrival() throws Exception {
        source.serve(record("A", "first"), record("B", "Beta"), record("A", "second"));

        var summary = orchestrator().harvest(ENDPOINT);

        assertEquals(2, summary.created());
        assertEquals(1, summary.duplicatesResolved());
        var a = store.get("geodata:A").orElseThrow();
        assertEquals("second", a.text("title"));
        assertEquals(1, a.revision());
    }

    @Test
    void relistedRecordIsRevived() throws Exception {
        var orchestrator = orchestrator();
        source.serve(record("A", "Alpha"), record("B", "Beta"));
        orchestrator.harvest(ENDPOINT);
        source.serve(record("A", "Alpha"));
        orchestrator.harvest(ENDPOINT);

        source.serve(record("A", "Alpha"), record("B", "Beta"));
        var summary = orchestrator.harvest(ENDPOINT);

        assertEquals(1, summary.created());
        var b = store.get("geodata:B").orElseThrow();
        assertFalse(b.tombstoned());
        assertEquals(3, b.revision());
        assertTrue(index.getDocuments().containsKey("geodata:B"));
    }

    @Test
    void recordWriteFailureIsRecordScoped() throws Exception {
        var failingStore = new InMemoryRecordStore() {
            @Override
            public synchronized void upsert(CanonicalRecord record)
                throws StoreUnavailableException, RecordWriteException {
                if (record.identifier().equals("geodata:r3")) {
                    throw new RecordWriteException("value too long for column title");
                }
                super.upsert(record);
            }
        };
        source.serve(records(5));

        var summary = orchestrator(failingStore, 1).harvest(ENDPOINT);

        assertTrue(summary.isCompleted());
        assertEquals(4, summary.created());
        assertEquals(1, summary.failed());
        assertEquals(HarvestErrorKind.RECORD_WRITE, summary.failures().get(0).kind());
        assertFalse(index.getDocuments().containsKey("geodata:r3"));
    }

    @Test
    void storeOutageFailsThePass() throws Exception {
        var outage = new OutageStore();
        source.serve(records(5));
        orchestrator(outage, 1).harvest(ENDPOINT);

        outage.unavailable = true;
        var summary = orchestrator(outage, 1).harvest(ENDPOINT);

        assertEquals(PassOutcome.FAILED, summary.outcome());
        assertEquals(HarvestErrorKind.STORE_UNAVAILABLE, summary.error());
        assertEquals(HarvestErrorKind.STORE_UNAVAILABLE, outage.loadState("geodata").lastErrorKind());
    }

    @Test
    void cancelledPassLeavesIndexConsistentAfterNextPass() throws Exception {
        var cancellation = new PassCancellation();
        var upserts = new AtomicInteger();
        var cancellingStore = new InMemoryRecordStore() {
            @Override
            public synchronized void upsert(CanonicalRecord record)
                throws StoreUnavailableException, RecordWriteException {
                super.upsert(record);
                if (upserts.incrementAndGet() == 3) {
                    cancellation.cancel();
                }
            }
        };
        source.serve(records(10));
        var orchestrator = orchestrator(cancellingStore, 1);

        var cancelled = orchestrator.harvest(ENDPOINT, cancellation);

        assertEquals(PassOutcome.FAILED, cancelled.outcome());
        assertEquals(HarvestErrorKind.CANCELLED, cancelled.error());
        assertEquals(3, cancelled.created());
        assertEquals(0, index.getPendingCount());
        var state = cancellingStore.loadState("geodata");
        assertTrue(state.indexDirty());
        assertNull(state.lastSuccessAt());

        var resumed = orchestrator.harvest(ENDPOINT);

        assertTrue(resumed.isCompleted());
        assertEquals(7, resumed.created());
        assertEquals(3, resumed.unchanged());
        assertEquals(cancellingStore.listIdentifiers("geodata"), index.getDocuments().keySet());
        assertFalse(cancellingStore.loadState("geodata").indexDirty());
    }

    @Test
    void dirtySourceIsRebuiltBeforeThePass() throws Exception {
        var orchestrator = orchestrator();
        source.serve(records(3));
        orchestrator.harvest(ENDPOINT);
        store.saveState(store.loadState("geodata").withIndexDirty(true));
        // The index lost its documents, e.g. the catalog was recreated
        index.removeSource("maps", "geodata");
        index.flush();
        assertTrue(index.getDocuments().isEmpty());

        var summary = orchestrator.harvest(ENDPOINT);

        assertEquals(3, summary.unchanged());
        assertEquals(3, index.getDocuments().size());
        assertFalse(store.loadState("geodata").indexDirty());
    }

    @Test
    void parallelRecordProcessingMatchesSequentialCounts() throws Exception {
        source.serve(records(200));

        var summary = orchestrator(store, 8).harvest(ENDPOINT);

        assertTrue(summary.isCompleted());
        assertEquals(200, summary.created());
        assertEquals(200, index.getDocuments().size());
        assertEquals(200, store.listIdentifiers("geodata").size());
    }

    @Test
    void passIsRefusedWhileTheSourceIsLeased() throws Exception {
        var leases = new SourceLeases();
        var orchestrator = HarvestOrchestrator.builder()
            .source(source)
            .store(store)
            .stateStore(store)
            .indexWriter(index)
            .leases(leases)
            .leaseTimeout(Duration.ofMillis(50))
            .build();

        try (var lease = leases.acquire("geodata", Duration.ofSeconds(1))) {
            var summary = orchestrator.harvest(ENDPOINT);
            assertEquals(HarvestErrorKind.LEASE_UNAVAILABLE, summary.error());
        }
        assertNull(store.loadState("geodata").lastAttemptAt());
        assertTrue(orchestrator.harvest(ENDPOINT).isCompleted());
    }

    @Test
    void reservedSourceNameIsNeverHarvested() throws Exception {
        var registrar = new SysprofRegistrar(store, ServiceProfile.defaults(), CLOCK);
        registrar.register();
        var reserved = SourceEndpoint.builder().name(SysprofRegistrar.SOURCE).type("csw").build();
        source.serve(record("A", "Alpha"));

        var summary = orchestrator().harvest(reserved);

        assertEquals(PassOutcome.FAILED, summary.outcome());
        assertEquals(HarvestErrorKind.INTERNAL, summary.error());
        assertTrue(registrar.registered().isPresent());
        assertEquals(1, store.get(SysprofRegistrar.IDENTIFIER).orElseThrow().revision());
        assertTrue(store.get("registry:A").isEmpty());
        assertThrows(IllegalArgumentException.class,
            () -> orchestrator().runPass(reserved, store.loadState(SysprofRegistrar.SOURCE), PassCancellation.none()));
    }

    private static class OutageStore extends InMemoryRecordStore {
        volatile boolean unavailable;

        @Override
        public synchronized Optional<CanonicalRecord> get(String identifier)
            throws StoreUnavailableException {
            if (unavailable) {
                throw new StoreUnavailableException("connection refused");
            }
            return super.get(identifier);
        }
    }
}
