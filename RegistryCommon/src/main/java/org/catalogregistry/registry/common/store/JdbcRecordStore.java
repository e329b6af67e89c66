package org.catalogregistry.registry.common.store;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import org.catalogregistry.harvest.pipeline.errors.RecordWriteException;
import org.catalogregistry.harvest.pipeline.errors.StoreUnavailableException;
import org.catalogregistry.harvest.pipeline.ir.CanonicalRecord;
import org.catalogregistry.harvest.pipeline.ir.HarvestErrorKind;
import org.catalogregistry.harvest.pipeline.ir.HarvestState;
import org.catalogregistry.harvest.pipeline.ir.RecordRevision;
import org.catalogregistry.harvest.pipeline.store.HarvestStateStore;
import org.catalogregistry.harvest.pipeline.store.RecordStore;

import lombok.extern.slf4j.Slf4j;

/**
 * Relational store of record and harvest state over JDBC, written for DuckDB.
 *
 * One connection is shared by every operation and access is synchronized, since
 * a DuckDB connection is not thread-safe. Each record write is one transaction
 * covering the current row and its history row. Timestamps are epoch milliseconds.
 */
@Slf4j
public class JdbcRecordStore implements RecordStore, HarvestStateStore {
    public static final String DUCKDB_PREFIX = "jdbc:duckdb:";

    private static final String CREATE_RECORDS = """
        CREATE TABLE IF NOT EXISTS records (
            identifier   VARCHAR PRIMARY KEY,
            source       VARCHAR NOT NULL,
            payload      VARCHAR NOT NULL,
            fingerprint  VARCHAR NOT NULL,
            revision     BIGINT  NOT NULL,
            tombstoned   BOOLEAN NOT NULL,
            last_seen    BIGINT  NOT NULL
        )
        """;

    private static final String CREATE_REVISIONS = """
        CREATE TABLE IF NOT EXISTS record_revisions (
            identifier   VARCHAR NOT NULL,
            revision     BIGINT  NOT NULL,
            fingerprint  VARCHAR NOT NULL,
            tombstoned   BOOLEAN NOT NULL,
            recorded_at  BIGINT  NOT NULL,
            payload      VARCHAR NOT NULL,
            PRIMARY KEY (identifier, revision)
        )
        """;

    private static final String CREATE_STATE = """
        CREATE TABLE IF NOT EXISTS harvest_state (
            source              VARCHAR PRIMARY KEY,
            last_success_at     BIGINT,
            harvest_cursor      VARCHAR,
            last_attempt_at     BIGINT,
            last_error_kind     VARCHAR,
            last_error_message  VARCHAR,
            index_dirty         BOOLEAN NOT NULL
        )
        """;

    private static final String UPSERT_RECORD = """
        INSERT INTO records (identifier, source, payload, fingerprint, revision, tombstoned, last_seen)
        VALUES (?, ?, ?, ?, ?, ?, ?)
        ON CONFLICT (identifier) DO UPDATE SET
            source      = EXCLUDED.source,
            payload     = EXCLUDED.payload,
            fingerprint = EXCLUDED.fingerprint,
            revision    = EXCLUDED.revision,
            tombstoned  = EXCLUDED.tombstoned,
            last_seen   = EXCLUDED.last_seen
        """;

    private static final String INSERT_REVISION = """
        INSERT INTO record_revisions (identifier, revision, fingerprint, tombstoned, recorded_at, payload)
        VALUES (?, ?, ?, ?, ?, ?)
        ON CONFLICT DO NOTHING
        """;

    private static final String UPSERT_STATE = """
        INSERT INTO harvest_state
            (source, last_success_at, harvest_cursor, last_attempt_at, last_error_kind, last_error_message, index_dirty)
        VALUES (?, ?, ?, ?, ?, ?, ?)
        ON CONFLICT (source) DO UPDATE SET
            last_success_at    = EXCLUDED.last_success_at,
            harvest_cursor     = EXCLUDED.harvest_cursor,
            last_attempt_at    = EXCLUDED.last_attempt_at,
            last_error_kind    = EXCLUDED.last_error_kind,
            last_error_message = EXCLUDED.last_error_message,
            index_dirty        = EXCLUDED.index_dirty
        """;

    private static final String RECORD_COLUMNS =
        "identifier, source, payload, fingerprint, revision, tombstoned, last_seen";

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private final String url;
    private final Connection conn;

    private JdbcRecordStore(String url, Connection conn) {
        this.url = url;
        this.conn = conn;
    }

    /**
     * Connect to a database; for a file-backed DuckDB URL the parent directory is created.
     */
    public static JdbcRecordStore open(String url) throws StoreUnavailableException {
        try {
            if (url.startsWith(DUCKDB_PREFIX)) {
                var location = url.substring(DUCKDB_PREFIX.length());
                if (!location.isEmpty() && !location.startsWith(":memory:")) {
                    var parent = Path.of(location).toAbsolutePath().getParent();
                    if (parent != null) {
                        Files.createDirectories(parent);
                    }
                }
            }
            var conn = DriverManager.getConnection(url);
            log.info("Connected to record store {}", url);
            return new JdbcRecordStore(url, conn);
        } catch (SQLException | IOException e) {
            throw new StoreUnavailableException("Cannot open record store " + url + ": " + e.getMessage(), e);
        }
    }

    @Override
    public synchronized void initializeSchema() throws StoreUnavailableException {
        try (Statement stmt = conn.createStatement()) {
            stmt.execute(CREATE_RECORDS);
            stmt.execute(CREATE_REVISIONS);
            stmt.execute(CREATE_STATE);
            log.info("Record store schema ready on {}", url);
        } catch (SQLException e) {
            throw unavailable("Cannot create schema", e);
        }
    }

    @Override
    public synchronized void upsert(CanonicalRecord record) throws StoreUnavailableException, RecordWriteException {
        try {
            conn.setAutoCommit(false);
            try {
                var current = currentRevision(record.identifier());
                if (current.isPresent() && record.revision() < current.get()) {
                    throw new RecordWriteException("Revision " + record.revision() + " of " + record.identifier()
                        + " is older than stored revision " + current.get());
                }
                var payload = OBJECT_MAPPER.writeValueAsString(record.payload());
                try (PreparedStatement ps = conn.prepareStatement(UPSERT_RECORD)) {
                    ps.setString(1, record.identifier());
                    ps.setString(2, record.source());
                    ps.setString(3, payload);
                    ps.setString(4, record.fingerprint());
                    ps.setLong(5, record.revision());
                    ps.setBoolean(6, record.tombstoned());
                    ps.setLong(7, record.lastSeen().toEpochMilli());
                    ps.executeUpdate();
                }
                try (PreparedStatement ps = conn.prepareStatement(INSERT_REVISION)) {
                    ps.setString(1, record.identifier());
                    ps.setLong(2, record.revision());
                    ps.setString(3, record.fingerprint());
                    ps.setBoolean(4, record.tombstoned());
                    ps.setLong(5, record.lastSeen().toEpochMilli());
                    ps.setString(6, payload);
                    ps.executeUpdate();
                }
                conn.commit();
            } catch (SQLException | JsonProcessingException | RecordWriteException | RuntimeException e) {
                rollbackQuietly(e);
                throw e;
            } finally {
                conn.setAutoCommit(true);
            }
        } catch (SQLException e) {
            if (isConnectionLost(e)) {
                throw unavailable("Cannot write " + record.identifier(), e);
            }
            throw new RecordWriteException("Cannot write " + record.identifier() + ": " + e.getMessage(), e);
        } catch (JsonProcessingException e) {
            throw new RecordWriteException("Cannot serialize " + record.identifier() + ": " + e.getOriginalMessage(), e);
        }
    }

    @Override
    public synchronized Optional<CanonicalRecord> get(String identifier) throws StoreUnavailableException {
        try (PreparedStatement ps = conn.prepareStatement(
            "SELECT " + RECORD_COLUMNS + " FROM records WHERE identifier = ?")) {
            ps.setString(1, identifier);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(toRecord(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw unavailable("Cannot read " + identifier, e);
        }
    }

    @Override
    public synchronized Set<String> listIdentifiers(String source) throws StoreUnavailableException {
        var identifiers = new LinkedHashSet<String>();
        try (PreparedStatement ps = conn.prepareStatement(
            "SELECT identifier FROM records WHERE source = ? AND NOT tombstoned ORDER BY identifier")) {
            ps.setString(1, source);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    identifiers.add(rs.getString(1));
                }
            }
        } catch (SQLException e) {
            throw unavailable("Cannot list identifiers of " + source, e);
        }
        return identifiers;
    }

    @Override
    public synchronized List<CanonicalRecord> listRecords(String source) throws StoreUnavailableException {
        var records = new ArrayList<CanonicalRecord>();
        try (PreparedStatement ps = conn.prepareStatement(
            "SELECT " + RECORD_COLUMNS + " FROM records WHERE source = ? AND NOT tombstoned ORDER BY identifier")) {
            ps.setString(1, source);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    records.add(toRecord(rs));
                }
            }
        } catch (SQLException e) {
            throw unavailable("Cannot list records of " + source, e);
        }
        return records;
    }

    @Override
    public synchronized Set<String> listSources() throws StoreUnavailableException {
        var sources = new LinkedHashSet<String>();
        try (Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery("SELECT DISTINCT source FROM records ORDER BY source")) {
            while (rs.next()) {
                sources.add(rs.getString(1));
            }
        } catch (SQLException e) {
            throw unavailable("Cannot list sources", e);
        }
        return sources;
    }

    @Override
    public synchronized CanonicalRecord tombstone(String identifier, Instant at)
        throws StoreUnavailableException, RecordWriteException {
        var current = get(identifier)
            .orElseThrow(() -> new RecordWriteException("Cannot tombstone unknown record " + identifier));
        if (current.tombstoned()) {
            return current;
        }
        var tombstone = current.asTombstone(at);
        upsert(tombstone);
        return tombstone;
    }

    @Override
    public synchronized List<RecordRevision> history(String identifier) throws StoreUnavailableException {
        var revisions = new ArrayList<RecordRevision>();
        try (PreparedStatement ps = conn.prepareStatement(
            "SELECT identifier, revision, fingerprint, tombstoned, recorded_at, payload "
                + "FROM record_revisions WHERE identifier = ? ORDER BY revision")) {
            ps.setString(1, identifier);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    revisions.add(new RecordRevision(
                        rs.getString("identifier"),
                        rs.getLong("revision"),
                        rs.getString("fingerprint"),
                        rs.getBoolean("tombstoned"),
                        Instant.ofEpochMilli(rs.getLong("recorded_at")),
                        readPayload(rs.getString("payload"))
                    ));
                }
            }
        } catch (SQLException e) {
            throw unavailable("Cannot read history of " + identifier, e);
        }
        return revisions;
    }

    @Override
    public synchronized HarvestState loadState(String source) throws StoreUnavailableException {
        try (PreparedStatement ps = conn.prepareStatement(
            "SELECT last_success_at, harvest_cursor, last_attempt_at, last_error_kind, last_error_message, "
                + "index_dirty FROM harvest_state WHERE source = ?")) {
            ps.setString(1, source);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return HarvestState.initial(source);
                }
                var errorKind = rs.getString("last_error_kind");
                return new HarvestState(
                    source,
                    instantOrNull(rs, "last_success_at"),
                    rs.getString("harvest_cursor"),
                    instantOrNull(rs, "last_attempt_at"),
                    errorKind == null ? null : HarvestErrorKind.valueOf(errorKind),
                    rs.getString("last_error_message"),
                    rs.getBoolean("index_dirty")
                );
            }
        } catch (SQLException e) {
            throw unavailable("Cannot load harvest state of " + source, e);
        }
    }

    @Override
    public synchronized void saveState(HarvestState state) throws StoreUnavailableException {
        try (PreparedStatement ps = conn.prepareStatement(UPSERT_STATE)) {
            ps.setString(1, state.source());
            setInstant(ps, 2, state.lastSuccessAt());
            ps.setString(3, state.cursor());
            setInstant(ps, 4, state.lastAttemptAt());
            ps.setString(5, state.lastErrorKind() == null ? null : state.lastErrorKind().name());
            ps.setString(6, state.lastErrorMessage());
            ps.setBoolean(7, state.indexDirty());
            ps.executeUpdate();
        } catch (SQLException e) {
            throw unavailable("Cannot save harvest state of " + state.source(), e);
        }
    }

    @Override
    public synchronized void close() {
        try {
            if (!conn.isClosed()) {
                conn.close();
            }
        } catch (SQLException e) {
            log.warn("Error closing record store {}: {}", url, e.getMessage());
        }
    }

    private Optional<Long> currentRevision(String identifier) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement("SELECT revision FROM records WHERE identifier = ?")) {
            ps.setString(1, identifier);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(rs.getLong(1)) : Optional.empty();
            }
        }
    }

    private CanonicalRecord toRecord(ResultSet rs) throws SQLException {
        return new CanonicalRecord(
            rs.getString("identifier"),
            rs.getString("source"),
            readPayload(rs.getString("payload")),
            rs.getString("fingerprint"),
            rs.getLong("revision"),
            rs.getBoolean("tombstoned"),
            Instant.ofEpochMilli(rs.getLong("last_seen"))
        );
    }

    private static ObjectNode readPayload(String json) throws SQLException {
        try {
            return (ObjectNode) OBJECT_MAPPER.readTree(json);
        } catch (JsonProcessingException | ClassCastException e) {
            throw new SQLException("Stored payload is not a JSON object", e);
        }
    }

    private static Instant instantOrNull(ResultSet rs, String column) throws SQLException {
        var millis = rs.getLong(column);
        return rs.wasNull() ? null : Instant.ofEpochMilli(millis);
    }

    private static void setInstant(PreparedStatement ps, int index, Instant value) throws SQLException {
        if (value == null) {
            ps.setNull(index, Types.BIGINT);
        } else {
            ps.setLong(index, value.toEpochMilli());
        }
    }

    private void rollbackQuietly(Exception cause) {
        try {
            conn.rollback();
        } catch (SQLException e) {
            cause.addSuppressed(e);
        }
    }

    private boolean isConnectionLost(SQLException e) {
        var state = e.getSQLState();
        if (state != null && state.startsWith("08")) {
            return true;
        }
        try {
            return conn.isClosed();
        } catch (SQLException closedCheck) {
            return true;
        }
    }

    private StoreUnavailableException unavailable(String message, SQLException e) {
        return new StoreUnavailableException(message + " from " + url + ": " + e.getMessage(), e);
    }
}
