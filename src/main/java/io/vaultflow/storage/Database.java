package io.vaultflow.storage;

import io.vaultflow.config.VaultFlowConfig;

import java.io.IOException;
import java.nio.file.Files;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.List;

/**
 * SQLite file backing {@link SqliteRecordStore}, kept under {@code .vaultflow/vaultflow.db}.
 */
public final class Database {
    private static final String MIGRATION_SCHEMA_VERSION = "vaultflow.schema.migration.v1";
    private static final List<MigrationStep> MIGRATIONS = List.of(
            new MigrationStep(
                    "20260101_001_record_lookup_indexes",
                    "Index records by id and by update time",
                    List.of(
                            "CREATE INDEX IF NOT EXISTS idx_records_record_id ON records(record_id)",
                            "CREATE INDEX IF NOT EXISTS idx_records_collection_updated ON records(collection, updated_at_ms)"
                    )
            )
    );

    private final VaultFlowConfig config;
    private final String jdbcUrl;

    public Database(VaultFlowConfig config) {
        this.config = config;
        this.jdbcUrl = "jdbc:sqlite:" + config.dbFile().toString();
    }

    public void init() {
        initDirectories();
        initSchema();
        applyAndValidatePragmas();
    }

    public Connection openConnection() throws SQLException {
        Connection conn = DriverManager.getConnection(jdbcUrl);
        try (Statement st = conn.createStatement()) {
            st.execute("PRAGMA busy_timeout=5000");
        }
        return conn;
    }

    /** The database's own clock, millisecond precision, UTC. */
    public Instant currentTime() throws SQLException {
        try (Connection c = openConnection();
             Statement st = c.createStatement();
             ResultSet rs = st.executeQuery("SELECT strftime('%Y-%m-%dT%H:%M:%fZ','now')")) {
            if (!rs.next()) {
                throw new SQLException("SQLite returned no current time");
            }
            return Instant.parse(rs.getString(1));
        }
    }

    private void initDirectories() {
        try {
            Files.createDirectories(config.internalDir());
        } catch (IOException e) {
            throw new VaultStoreException("Failed to initialize " + config.internalDir(), e);
        }
    }

    private void initSchema() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("""
                    CREATE TABLE IF NOT EXISTS records (
                        collection TEXT NOT NULL,
                        record_id TEXT NOT NULL,
                        content TEXT NOT NULL,
                        version INTEGER NOT NULL,
                        created_at_ms INTEGER NOT NULL,
                        updated_at_ms INTEGER NOT NULL,
                        PRIMARY KEY(collection, record_id)
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS owner_heartbeats (
                        owner_id TEXT PRIMARY KEY,
                        last_heartbeat_ms INTEGER NOT NULL
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS schema_migrations (
                        version TEXT PRIMARY KEY,
                        description TEXT NOT NULL,
                        checksum TEXT NOT NULL,
                        applied_at_ms INTEGER NOT NULL,
                        success INTEGER NOT NULL
                    )
                    """);
            for (MigrationStep step : MIGRATIONS) {
                if (!isMigrationApplied(conn, step.version())) {
                    applyMigration(conn, step);
                }
            }
        } catch (SQLException e) {
            throw new VaultStoreException("Failed to initialize SQLite schema at " + config.dbFile(), e);
        }
    }

    private boolean isMigrationApplied(Connection conn, String version) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(
                "SELECT 1 FROM schema_migrations WHERE version=? AND success=1 LIMIT 1")) {
            ps.setString(1, version);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        }
    }

    private void applyMigration(Connection conn, MigrationStep step) throws SQLException {
        try (Statement st = conn.createStatement()) {
            for (String sql : step.sql()) {
                st.execute(sql);
            }
        }
        try (PreparedStatement ps = conn.prepareStatement(
                "INSERT OR REPLACE INTO schema_migrations(version,description,checksum,applied_at_ms,success) VALUES(?,?,?,?,1)")) {
            ps.setString(1, step.version());
            ps.setString(2, step.description());
            ps.setString(3, checksum(step));
            ps.setLong(4, Instant.now().toEpochMilli());
            ps.executeUpdate();
        }
    }

    private static String checksum(MigrationStep step) {
        StringBuilder sb = new StringBuilder();
        sb.append(MIGRATION_SCHEMA_VERSION).append('|')
                .append(step.version()).append('|')
                .append(step.description()).append('|');
        for (String sql : step.sql()) {
            sb.append(sql).append(';');
        }
        return Integer.toHexString(sb.toString().hashCode());
    }

    private void applyAndValidatePragmas() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("PRAGMA journal_mode=WAL");
            st.execute("PRAGMA synchronous=NORMAL");

            validatePragma(st, "journal_mode", "wal");
            validatePragma(st, "synchronous", "1");
        } catch (SQLException e) {
            throw new VaultStoreException("Failed to apply SQLite pragmas at " + config.dbFile(), e);
        }
    }

    private void validatePragma(Statement st, String pragma, String expected) throws SQLException {
        try (ResultSet rs = st.executeQuery("PRAGMA " + pragma)) {
            if (!rs.next()) {
                throw new IllegalStateException("PRAGMA " + pragma + " did not return a value");
            }
            String actual = rs.getString(1);
            if (actual == null || !actual.equalsIgnoreCase(expected)) {
                throw new IllegalStateException(
                        "PRAGMA " + pragma + " mismatch, expected=" + expected + ", actual=" + actual
                );
            }
        }
    }

    private record MigrationStep(String version, String description, List<String> sql) {
    }
}
