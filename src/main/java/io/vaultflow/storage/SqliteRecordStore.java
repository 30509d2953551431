package io.vaultflow.storage;

import io.vaultflow.config.VaultFlowConfig;
import io.vaultflow.model.CollectionRef;
import io.vaultflow.model.WorkItem;
import io.vaultflow.model.WorkflowState;
import io.vaultflow.util.Ids;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * The record contract over one SQLite table. A move is a single conditional {@code UPDATE} of
 * the row's collection; the {@code (collection, record_id)} key makes exclusive create and
 * move-onto-existing fail the same way the vault directories do.
 */
public final class SqliteRecordStore implements RecordStore {
    private static final Logger LOG = LoggerFactory.getLogger(SqliteRecordStore.class);
    private static final int SQLITE_CONSTRAINT = 19;
    private static final int MAX_UPDATE_ATTEMPTS = 8;

    private final Database database;
    private final StoreClock clock;

    public SqliteRecordStore(VaultFlowConfig config) {
        this(new Database(config), null);
    }

    public SqliteRecordStore(Database database, StoreClock clock) {
        this.database = database;
        this.clock = clock == null ? databaseClock(database) : clock;
    }

    @Override
    public void init() {
        database.init();
    }

    @Override
    public void createExclusive(CollectionRef collection, WorkItem item) {
        String sql = "INSERT OR IGNORE INTO records(collection,record_id,content,version,created_at_ms,updated_at_ms) VALUES(?,?,?,1,?,?)";
        long nowMs = now().toEpochMilli();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, collection.name());
            ps.setString(2, Ids.require(item.id(), "record id"));
            ps.setString(3, RecordCodec.encode(item));
            ps.setLong(4, nowMs);
            ps.setLong(5, nowMs);
            if (ps.executeUpdate() == 0) {
                throw new RecordAlreadyExistsException(collection, item.id());
            }
            LOG.debug("Created {} in {}", item.id(), collection);
        } catch (SQLException e) {
            throw new VaultStoreException("Failed to create record " + item.id() + " in " + collection, e);
        }
    }

    @Override
    public void moveAtomic(CollectionRef from, CollectionRef to, String id) {
        String sql = "UPDATE records SET collection=?,version=version+1,updated_at_ms=? WHERE collection=? AND record_id=?";
        long nowMs = now().toEpochMilli();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, to.name());
            ps.setLong(2, nowMs);
            ps.setString(3, from.name());
            ps.setString(4, Ids.require(id, "record id"));
            if (ps.executeUpdate() == 0) {
                throw new RecordNotFoundException(from, id);
            }
            LOG.debug("Moved {} {} -> {}", id, from, to);
        } catch (SQLException e) {
            if (e.getErrorCode() == SQLITE_CONSTRAINT) {
                throw new RecordAlreadyExistsException(to, id);
            }
            throw new VaultStoreException("Failed to move " + id + " from " + from + " to " + to, e);
        }
    }

    @Override
    public List<String> list(CollectionRef collection) {
        String sql = "SELECT record_id FROM records WHERE collection=? ORDER BY record_id";
        List<String> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, collection.name());
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(rs.getString(1));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new VaultStoreException("Failed to list " + collection, e);
        }
    }

    @Override
    public Optional<WorkItem> read(CollectionRef collection, String id) {
        return readRaw(collection, id).map(text -> RecordCodec.decode(collection, id, text));
    }

    @Override
    public Optional<String> readRaw(CollectionRef collection, String id) {
        return readVersioned(collection, id).map(VersionedContent::content);
    }

    @Override
    public WorkItem update(CollectionRef collection, String id, UnaryOperator<WorkItem> mutator) {
        String sql = "UPDATE records SET content=?,version=version+1,updated_at_ms=? WHERE collection=? AND record_id=? AND version=?";
        for (int attempt = 1; attempt <= MAX_UPDATE_ATTEMPTS; attempt++) {
            VersionedContent current = readVersioned(collection, id)
                    .orElseThrow(() -> new RecordNotFoundException(collection, id));
            WorkItem next = mutator.apply(RecordCodec.decode(collection, id, current.content()));
            if (next == null || !id.equals(next.id())) {
                throw new IllegalArgumentException("Update of " + id + " must keep the record id");
            }
            long nowMs = now().toEpochMilli();
            try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
                ps.setString(1, RecordCodec.encode(next));
                ps.setLong(2, nowMs);
                ps.setString(3, collection.name());
                ps.setString(4, id);
                ps.setLong(5, current.version());
                if (ps.executeUpdate() == 1) {
                    return next;
                }
            } catch (SQLException e) {
                throw new VaultStoreException("Failed to update " + id + " in " + collection, e);
            }
            LOG.debug("Concurrent update of {} in {}, attempt {}", id, collection, attempt);
        }
        throw new VaultStoreException("Gave up updating " + id + " in " + collection
                + " after " + MAX_UPDATE_ATTEMPTS + " concurrent modifications");
    }

    @Override
    public Optional<CollectionRef> locate(String id) {
        String sql = "SELECT collection FROM records WHERE record_id=? ORDER BY updated_at_ms DESC LIMIT 1";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, Ids.require(id, "record id"));
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(new CollectionRef(rs.getString(1))) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new VaultStoreException("Failed to locate " + id, e);
        }
    }

    @Override
    public void quarantine(CollectionRef collection, String id) {
        moveAtomic(collection, CollectionRef.QUARANTINE, id);
        LOG.warn("Quarantined {} from {}", id, collection);
    }

    @Override
    public List<CollectionRef> collections() {
        List<CollectionRef> out = new ArrayList<>();
        for (WorkflowState state : WorkflowState.values()) {
            out.add(CollectionRef.of(state));
        }
        out.addAll(ownerScopes());
        out.add(CollectionRef.QUARANTINE);
        return out;
    }

    @Override
    public List<CollectionRef> ownerScopes() {
        String sql = "SELECT DISTINCT collection FROM records WHERE collection LIKE ? ORDER BY collection";
        List<CollectionRef> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, CollectionRef.IN_PROGRESS_DIR + "/%");
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(CollectionRef.parse(rs.getString(1)));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new VaultStoreException("Failed to list owner scopes", e);
        }
    }

    @Override
    public Instant heartbeat(String ownerId) {
        Ids.require(ownerId, "owner id");
        Instant at = now();
        String sql = """
                INSERT INTO owner_heartbeats(owner_id,last_heartbeat_ms) VALUES(?,?)
                ON CONFLICT(owner_id) DO UPDATE SET last_heartbeat_ms=excluded.last_heartbeat_ms
                """;
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, ownerId);
            ps.setLong(2, at.toEpochMilli());
            ps.executeUpdate();
            return at;
        } catch (SQLException e) {
            throw new VaultStoreException("Failed to write heartbeat for " + ownerId, e);
        }
    }

    @Override
    public Map<String, Instant> heartbeats() {
        Map<String, Instant> out = new LinkedHashMap<>();
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement(
                     "SELECT owner_id,last_heartbeat_ms FROM owner_heartbeats ORDER BY owner_id");
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                out.put(rs.getString(1), Instant.ofEpochMilli(rs.getLong(2)));
            }
            return out;
        } catch (SQLException e) {
            throw new VaultStoreException("Failed to read heartbeats", e);
        }
    }

    @Override
    public Instant now() {
        try {
            return clock.now();
        } catch (IOException e) {
            throw new VaultStoreException("Store clock unavailable", e);
        }
    }

    private Optional<VersionedContent> readVersioned(CollectionRef collection, String id) {
        String sql = "SELECT content,version FROM records WHERE collection=? AND record_id=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, collection.name());
            ps.setString(2, Ids.require(id, "record id"));
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.of(new VersionedContent(rs.getString(1), rs.getLong(2)));
            }
        } catch (SQLException e) {
            throw new VaultStoreException("Failed to read " + id + " from " + collection, e);
        }
    }

    private static StoreClock databaseClock(Database database) {
        return () -> {
            try {
                return database.currentTime();
            } catch (SQLException e) {
                throw new IOException("SQLite clock query failed", e);
            }
        };
    }

    private record VersionedContent(String content, long version) {
    }
}
