package org.catalogregistry.harvest.pipeline.store;

import java.time.Instant;
import java.util.Set;

import com.fasterxml.jackson.databind.ObjectMapper;

import org.catalogregistry.harvest.pipeline.errors.RecordWriteException;
import org.catalogregistry.harvest.pipeline.ir.CanonicalRecord;
import org.catalogregistry.harvest.pipeline.ir.HarvestErrorKind;
import org.catalogregistry.harvest.pipeline.ir.HarvestState;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryRecordStoreTest {
    private static final Instant T1 = Instant.parse("2024-03-01T10:00:00Z");

    private static CanonicalRecord record(String id, String source, long revision) {
        return new CanonicalRecord(id, source, new ObjectMapper().createObjectNode(), "f" + revision,
            revision, false, T1);
    }

    @Test
    void olderRevisionIsRejected() throws Exception {
        var store = new InMemoryRecordStore();
        store.upsert(record("s:a", "s", 2));

        assertThrows(RecordWriteException.class, () -> store.upsert(record("s:a", "s", 1)));
        assertEquals(2, store.get("s:a").orElseThrow().revision());
    }

    @Test
    void sameRevisionDoesNotGrowHistory() throws Exception {
        var store = new InMemoryRecordStore();
        store.upsert(record("s:a", "s", 1));
        store.upsert(record("s:a", "s", 1).withLastSeen(T1.plusSeconds(60)));

        assertEquals(1, store.history("s:a").size());
        assertEquals(T1.plusSeconds(60), store.get("s:a").orElseThrow().lastSeen());
    }

    @Test
    void tombstonesAreExcludedFromListings() throws Exception {
        var store = new InMemoryRecordStore();
        store.upsert(record("s:a", "s", 1));
        store.upsert(record("s:b", "s", 1));
        store.upsert(record("t:c", "t", 1));

        var tombstone = store.tombstone("s:b", T1);

        assertTrue(tombstone.tombstoned());
        assertEquals(2, tombstone.revision());
        assertEquals(Set.of("s:a"), store.listIdentifiers("s"));
        assertEquals(1, store.listRecords("s").size());
        assertEquals(Set.of("s", "t"), store.listSources());
        assertEquals(2, store.history("s:b").size());
        assertTrue(store.history("s:b").get(1).tombstoned());
    }

    @Test
    void stateDefaultsToInitialAndRoundTrips() throws Exception {
        var store = new InMemoryRecordStore();
        assertEquals(HarvestState.initial("s"), store.loadState("s"));

        var failed = HarvestState.initial("s").failed(HarvestErrorKind.SOURCE_UNREACHABLE, "down", T1, true);
        store.saveState(failed);

        assertEquals(failed, store.loadState("s"));
        assertTrue(store.loadState("s").hasError());
    }
}
