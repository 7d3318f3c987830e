package io.xrelay.storage;

import org.sqlite.SQLiteConfig;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;

public final class Database {
    private static final String SQLITE_PREFIX = "jdbc:sqlite:";
    private static final String MIGRATION_SCHEMA_VERSION = "xrelay.schema.migration.v1";
    private static final int BUSY_TIMEOUT_MS = 5_000;

    private final String jdbcUrl;
    private final Properties connectionProperties;

    public Database(String jdbcUrl) {
        if (jdbcUrl == null || jdbcUrl.isBlank()) {
            throw new IllegalArgumentException("jdbcUrl must not be blank");
        }
        this.jdbcUrl = jdbcUrl.trim();
        this.connectionProperties = connectionProperties();
    }

    public static Database sqliteFile(Path file) {
        return new Database(SQLITE_PREFIX + file.toAbsolutePath().normalize());
    }

    public String jdbcUrl() {
        return jdbcUrl;
    }

    public void init() {
        initDirectories();
        initSchema();
        validateJournalMode();
    }

    public Connection openConnection() throws SQLException {
        return DriverManager.getConnection(jdbcUrl, connectionProperties);
    }

    private static Properties connectionProperties() {
        SQLiteConfig config = new SQLiteConfig();
        config.setJournalMode(SQLiteConfig.JournalMode.WAL);
        config.setSynchronous(SQLiteConfig.SynchronousMode.NORMAL);
        config.setBusyTimeout(BUSY_TIMEOUT_MS);
        // Writers take the lock at BEGIN so read-then-write transactions never deadlock on upgrade.
        config.setTransactionMode(SQLiteConfig.TransactionMode.IMMEDIATE);
        return config.toProperties();
    }

    private void initDirectories() {
        if (!jdbcUrl.startsWith(SQLITE_PREFIX)) {
            return;
        }
        String location = jdbcUrl.substring(SQLITE_PREFIX.length());
        int query = location.indexOf('?');
        if (query >= 0) {
            location = location.substring(0, query);
        }
        if (location.isBlank() || location.startsWith(":memory:") || location.startsWith("file:")) {
            return;
        }
        try {
            Path parent = Paths.get(location).toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize database directory for " + jdbcUrl, e);
        }
    }

    private void initSchema() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("""
                    CREATE TABLE IF NOT EXISTS available_relays (
                        id INTEGER PRIMARY KEY AUTOINCREMENT,
                        address TEXT NOT NULL,
                        port INTEGER NOT NULL,
                        source TEXT NOT NULL,
                        failure_count INTEGER NOT NULL DEFAULT 0,
                        success_count INTEGER NOT NULL DEFAULT 0,
                        last_used_at INTEGER,
                        last_checked_at INTEGER,
                        created_at INTEGER NOT NULL,
                        updated_at INTEGER NOT NULL,
                        UNIQUE(address, port)
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS deprecated_relays (
                        id INTEGER PRIMARY KEY AUTOINCREMENT,
                        address TEXT NOT NULL,
                        port INTEGER NOT NULL,
                        source TEXT,
                        protocol TEXT NOT NULL DEFAULT 'http',
                        failure_count INTEGER NOT NULL,
                        created_at INTEGER NOT NULL,
                        deprecated_at INTEGER NOT NULL,
                        UNIQUE(address, port)
                    )
                    """);
            ensureSchemaMigrationsTable(conn);
            applyVersionedMigrations(conn);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to initialize relay schema at " + jdbcUrl, e);
        }
    }

    private void ensureSchemaMigrationsTable(Connection conn) throws SQLException {
        try (Statement st = conn.createStatement()) {
            st.execute("""
                    CREATE TABLE IF NOT EXISTS schema_migrations (
                        version TEXT PRIMARY KEY,
                        description TEXT NOT NULL,
                        checksum TEXT NOT NULL,
                        applied_at_ms INTEGER NOT NULL,
                        success INTEGER NOT NULL
                    )
                    """);
        }
    }

    private void applyVersionedMigrations(Connection conn) throws SQLException {
        List<MigrationStep> steps = new ArrayList<>();
        steps.add(new MigrationStep(
                "20261017_001_available_relay_indexes",
                "Index available relays by failure count and last use",
                List.of(
                        "CREATE INDEX IF NOT EXISTS idx_available_relays_failure_count ON available_relays(failure_count)",
                        "CREATE INDEX IF NOT EXISTS idx_available_relays_last_used ON available_relays(last_used_at)"
                )
        ));
        steps.add(new MigrationStep(
                "20261017_002_deprecated_relay_retention_index",
                "Index deprecated relays by deprecation time for retention sweeps",
                List.of("CREATE INDEX IF NOT EXISTS idx_deprecated_relays_deprecated_at ON deprecated_relays(deprecated_at)")
        ));
        for (MigrationStep step : steps) {
            if (isMigrationApplied(conn, step.version())) {
                continue;
            }
            applyMigration(conn, step);
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

    private String checksum(MigrationStep step) {
        StringBuilder sb = new StringBuilder();
        sb.append(MIGRATION_SCHEMA_VERSION).append('|')
                .append(step.version()).append('|')
                .append(step.description()).append('|');
        for (String sql : step.sql()) {
            sb.append(sql).append(';');
        }
        return Integer.toHexString(sb.toString().hashCode());
    }

    private void validateJournalMode() {
        try (Connection conn = openConnection();
             Statement st = conn.createStatement();
             ResultSet rs = st.executeQuery("PRAGMA journal_mode")) {
            if (!rs.next()) {
                throw new IllegalStateException("PRAGMA journal_mode did not return a value");
            }
            String actual = rs.getString(1);
            // In-memory databases cannot use WAL and report "memory".
            if (actual == null || !(actual.equalsIgnoreCase("wal") || actual.equalsIgnoreCase("memory"))) {
                throw new IllegalStateException("PRAGMA journal_mode mismatch, expected=wal, actual=" + actual);
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to apply SQLite pragmas", e);
        }
    }

    public List<SchemaMigrationRow> listSchemaMigrations(int limit) {
        String sql = """
                SELECT version,description,checksum,applied_at_ms,success
                FROM schema_migrations
                ORDER BY applied_at_ms DESC, version DESC
                LIMIT ?
                """;
        List<SchemaMigrationRow> out = new ArrayList<>();
        try (Connection c = openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setInt(1, Math.max(1, limit));
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new SchemaMigrationRow(
                            rs.getString("version"),
                            rs.getString("description"),
                            rs.getString("checksum"),
                            rs.getLong("applied_at_ms"),
                            rs.getInt("success") == 1
                    ));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list schema migrations", e);
        }
    }

    private record MigrationStep(String version, String description, List<String> sql) {
    }

    public record SchemaMigrationRow(
            String version,
            String description,
            String checksum,
            long appliedAtMs,
            boolean success
    ) {
    }
}
