package org.catalogregistry.harvest.pipeline.store;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

import org.catalogregistry.harvest.pipeline.errors.RecordWriteException;
import org.catalogregistry.harvest.pipeline.errors.StoreUnavailableException;
import org.catalogregistry.harvest.pipeline.ir.CanonicalRecord;
import org.catalogregistry.harvest.pipeline.ir.HarvestState;
import org.catalogregistry.harvest.pipeline.ir.RecordRevision;

/**
 * A store kept in memory, for pipeline tests and dry runs that must not touch a database.
 */
public class InMemoryRecordStore implements RecordStore, HarvestStateStore {

    private final Map<String, CanonicalRecord> records = new HashMap<>();
    private final Map<String, List<RecordRevision>> histories = new HashMap<>();
    private final Map<String, HarvestState> states = new HashMap<>();

    @Override
    public void initializeSchema() {
        // Nothing to create
    }

    @Override
    public synchronized void upsert(CanonicalRecord record) throws StoreUnavailableException, RecordWriteException {
        var current = records.get(record.identifier());
        if (current != null && record.revision() < current.revision()) {
            throw new RecordWriteException("Revision " + record.revision() + " of " + record.identifier()
                + " is older than stored revision " + current.revision());
        }
        records.put(record.identifier(), record);
        var history = histories.computeIfAbsent(record.identifier(), k -> new ArrayList<>());
        if (history.isEmpty() || history.get(history.size() - 1).revision() != record.revision()) {
            history.add(RecordRevision.of(record));
        }
    }

    @Override
    public synchronized Optional<CanonicalRecord> get(String identifier) throws StoreUnavailableException {
        return Optional.ofNullable(records.get(identifier));
    }

    @Override
    public synchronized Set<String> listIdentifiers(String source) throws StoreUnavailableException {
        return records.values().stream()
            .filter(r -> r.source().equals(source) && !r.tombstoned())
            .map(CanonicalRecord::identifier)
            .collect(Collectors.toCollection(TreeSet::new));
    }

    @Override
    public synchronized List<CanonicalRecord> listRecords(String source) throws StoreUnavailableException {
        return records.values().stream()
            .filter(r -> r.source().equals(source) && !r.tombstoned())
            .sorted((a, b) -> a.identifier().compareTo(b.identifier()))
            .collect(Collectors.toList());
    }

    @Override
    public synchronized Set<String> listSources() throws StoreUnavailableException {
        return records.values().stream()
            .map(CanonicalRecord::source)
            .collect(Collectors.toCollection(TreeSet::new));
    }

    @Override
    public synchronized CanonicalRecord tombstone(String identifier, Instant at)
        throws StoreUnavailableException, RecordWriteException {
        var current = records.get(identifier);
        if (current == null) {
            throw new RecordWriteException("Cannot tombstone unknown record " + identifier);
        }
        if (current.tombstoned()) {
            return current;
        }
        var tombstone = current.asTombstone(at);
        upsert(tombstone);
        return tombstone;
    }

    @Override
    public synchronized List<RecordRevision> history(String identifier) throws StoreUnavailableException {
        return List.copyOf(histories.getOrDefault(identifier, List.of()));
    }

    @Override
    public synchronized HarvestState loadState(String source) throws StoreUnavailableException {
        return states.getOrDefault(source, HarvestState.initial(source));
    }

    @Override
    public synchronized void saveState(HarvestState state) throws StoreUnavailableException {
        states.put(state.source(), state);
    }
}
