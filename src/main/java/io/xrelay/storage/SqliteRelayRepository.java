package io.xrelay.storage;

import io.xrelay.model.DeprecatedRecord;
import io.xrelay.model.RawCandidate;
import io.xrelay.model.RelayKey;
import io.xrelay.model.RelayRecord;
import io.xrelay.model.StoreMode;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.Set;

/**
 * Relational relay store. Counter updates are single {@code UPDATE ... SET n = n + 1}
 * statements and every move between the available and deprecated tables runs in one
 * transaction, so several processes may share the same database file.
 */
public final class SqliteRelayRepository implements RelayRepository {
    private static final String RELAY_COLUMNS =
            "address,port,source,failure_count,success_count,last_used_at,last_checked_at,created_at,updated_at";
    private static final String DEPRECATED_COLUMNS =
            "address,port,source,protocol,failure_count,created_at,deprecated_at";
    private static final String UPSERT_DEPRECATED = """
            INSERT INTO deprecated_relays(address,port,source,protocol,failure_count,created_at,deprecated_at)
            VALUES(?,?,?,?,?,?,?)
            ON CONFLICT(address,port) DO UPDATE SET
                failure_count=excluded.failure_count,
                deprecated_at=excluded.deprecated_at
            """;

    private final Database database;
    private final int failureThreshold;
    private final WeightedSampler sampler;

    public SqliteRelayRepository(Database database, int failureThreshold) {
        this(database, failureThreshold, new Random());
    }

    public SqliteRelayRepository(Database database, int failureThreshold, Random random) {
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("failureThreshold must be >= 1");
        }
        this.database = database;
        this.failureThreshold = failureThreshold;
        this.sampler = new WeightedSampler(random);
    }

    public Database database() {
        return database;
    }

    @Override
    public StoreMode mode() {
        return StoreMode.DURABLE;
    }

    @Override
    public int upsertMany(List<RawCandidate> candidates, long nowMs) {
        if (candidates == null || candidates.isEmpty()) {
            return 0;
        }
        String sql = """
                INSERT INTO available_relays(address,port,source,failure_count,success_count,created_at,updated_at)
                SELECT ?,?,?,0,0,?,?
                WHERE NOT EXISTS (SELECT 1 FROM deprecated_relays d WHERE d.address=? AND d.port=?)
                ON CONFLICT(address,port) DO NOTHING
                """;
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement ps = c.prepareStatement(sql)) {
                int inserted = 0;
                for (RawCandidate candidate : candidates) {
                    RelayKey key = candidate.key();
                    ps.setString(1, key.address());
                    ps.setInt(2, key.port());
                    ps.setString(3, candidate.source());
                    ps.setLong(4, nowMs);
                    ps.setLong(5, nowMs);
                    ps.setString(6, key.address());
                    ps.setInt(7, key.port());
                    inserted += ps.executeUpdate();
                }
                c.commit();
                return inserted;
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to upsert relay candidates", e);
        }
    }

    @Override
    public List<RelayRecord> getWeightedSample(int n) {
        return sampler.sample(listAvailable(), RelayRecord::weight, n);
    }

    @Override
    public List<RelayRecord> listAvailable() {
        String sql = "SELECT " + RELAY_COLUMNS + " FROM available_relays ORDER BY updated_at DESC";
        List<RelayRecord> out = new ArrayList<>();
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement(sql);
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                out.add(readRelay(rs));
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list available relays", e);
        }
    }

    @Override
    public Optional<RelayRecord> find(RelayKey key) {
        try (Connection c = database.openConnection()) {
            return findRelay(c, key);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read relay " + key, e);
        }
    }

    @Override
    public boolean reportSuccess(RelayKey key, long nowMs) {
        String sql = """
                UPDATE available_relays
                SET success_count=success_count+1, last_used_at=?, updated_at=?
                WHERE address=? AND port=?
                """;
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setLong(1, nowMs);
            ps.setLong(2, nowMs);
            ps.setString(3, key.address());
            ps.setInt(4, key.port());
            return ps.executeUpdate() > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to record relay success " + key, e);
        }
    }

    @Override
    public FailureOutcome reportFailure(RelayKey key, long nowMs) {
        String increment = """
                UPDATE available_relays
                SET failure_count=failure_count+1, updated_at=?
                WHERE address=? AND port=?
                """;
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try {
                int updated;
                try (PreparedStatement ps = c.prepareStatement(increment)) {
                    ps.setLong(1, nowMs);
                    ps.setString(2, key.address());
                    ps.setInt(3, key.port());
                    updated = ps.executeUpdate();
                }
                if (updated == 0) {
                    c.commit();
                    return FailureOutcome.missing(key);
                }
                RelayRecord current = findRelay(c, key)
                        .orElseThrow(() -> new IllegalStateException("Relay vanished inside transaction: " + key));
                boolean deprecate = current.failureCount() >= failureThreshold;
                if (deprecate) {
                    moveToDeprecated(c, key, current.source(), current.failureCount(), current.createdAtMs(), nowMs);
                }
                c.commit();
                return new FailureOutcome(key, true, current.failureCount(), deprecate);
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to record relay failure " + key, e);
        }
    }

    @Override
    public void markChecked(RelayKey key, long nowMs) {
        String sql = "UPDATE available_relays SET last_checked_at=?, updated_at=? WHERE address=? AND port=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setLong(1, nowMs);
            ps.setLong(2, nowMs);
            ps.setString(3, key.address());
            ps.setInt(4, key.port());
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to update relay check time " + key, e);
        }
    }

    @Override
    public DeprecatedRecord deprecate(RelayKey key, String source, long failureCount, long nowMs) {
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try {
                Optional<RelayRecord> current = findRelay(c, key);
                Optional<DeprecatedRecord> previous = findDeprecated(c, key);
                long createdAt = current.map(RelayRecord::createdAtMs)
                        .or(() -> previous.map(DeprecatedRecord::createdAtMs))
                        .orElse(nowMs);
                String resolvedSource = current.map(RelayRecord::source)
                        .or(() -> previous.map(DeprecatedRecord::source))
                        .orElse(source);
                moveToDeprecated(c, key, resolvedSource, failureCount, createdAt, nowMs);
                c.commit();
                return new DeprecatedRecord(key.address(), key.port(), resolvedSource,
                        DeprecatedRecord.DEFAULT_PROTOCOL, failureCount, createdAt, nowMs);
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to deprecate relay " + key, e);
        }
    }

    private void moveToDeprecated(Connection c, RelayKey key, String source, long failureCount,
                                  long createdAtMs, long nowMs) throws SQLException {
        try (PreparedStatement insert = c.prepareStatement(UPSERT_DEPRECATED);
             PreparedStatement delete = c.prepareStatement("DELETE FROM available_relays WHERE address=? AND port=?")) {
            insert.setString(1, key.address());
            insert.setInt(2, key.port());
            insert.setString(3, source);
            insert.setString(4, DeprecatedRecord.DEFAULT_PROTOCOL);
            insert.setLong(5, failureCount);
            insert.setLong(6, createdAtMs);
            insert.setLong(7, nowMs);
            insert.executeUpdate();

            delete.setString(1, key.address());
            delete.setInt(2, key.port());
            delete.executeUpdate();
        }
    }

    @Override
    public boolean isDeprecated(RelayKey key) {
        return findDeprecated(key).isPresent();
    }

    @Override
    public Set<RelayKey> deprecatedKeys() {
        Set<RelayKey> out = new HashSet<>();
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement("SELECT address,port FROM deprecated_relays");
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                out.add(new RelayKey(rs.getString("address"), rs.getInt("port")));
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list deprecated relays", e);
        }
    }

    @Override
    public Optional<DeprecatedRecord> findDeprecated(RelayKey key) {
        try (Connection c = database.openConnection()) {
            return findDeprecated(c, key);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read deprecated relay " + key, e);
        }
    }

    @Override
    public int count() {
        return countRows("SELECT COUNT(*) FROM available_relays", -1L);
    }

    @Override
    public int deprecatedCount() {
        return countRows("SELECT COUNT(*) FROM deprecated_relays", -1L);
    }

    @Override
    public DeprecatedStats deprecatedStats(int retentionDays, long nowMs) {
        long expiredCutoff = RelayRepository.retentionCutoffMs(retentionDays, nowMs);
        long recentCutoff = RelayRepository.retentionCutoffMs(RECENT_DEPRECATION_DAYS, nowMs);
        return new DeprecatedStats(
                deprecatedCount(),
                countRows("SELECT COUNT(*) FROM deprecated_relays WHERE deprecated_at < ?", expiredCutoff),
                countRows("SELECT COUNT(*) FROM deprecated_relays WHERE deprecated_at >= ?", recentCutoff)
        );
    }

    @Override
    public int sweepExpiredDeprecated(int retentionDays, long nowMs) {
        long cutoff = RelayRepository.retentionCutoffMs(retentionDays, nowMs);
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement("DELETE FROM deprecated_relays WHERE deprecated_at < ?")) {
            ps.setLong(1, cutoff);
            return ps.executeUpdate();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to sweep deprecated relays", e);
        }
    }

    private int countRows(String sql, long param) {
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            if (param >= 0L) {
                ps.setLong(1, param);
            }
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getInt(1) : 0;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to count relays", e);
        }
    }

    private Optional<RelayRecord> findRelay(Connection c, RelayKey key) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(
                "SELECT " + RELAY_COLUMNS + " FROM available_relays WHERE address=? AND port=?")) {
            ps.setString(1, key.address());
            ps.setInt(2, key.port());
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(readRelay(rs)) : Optional.empty();
            }
        }
    }

    private Optional<DeprecatedRecord> findDeprecated(Connection c, RelayKey key) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(
                "SELECT " + DEPRECATED_COLUMNS + " FROM deprecated_relays WHERE address=? AND port=?")) {
            ps.setString(1, key.address());
            ps.setInt(2, key.port());
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.of(new DeprecatedRecord(
                        rs.getString("address"),
                        rs.getInt("port"),
                        rs.getString("source"),
                        rs.getString("protocol"),
                        rs.getLong("failure_count"),
                        rs.getLong("created_at"),
                        rs.getLong("deprecated_at")
                ));
            }
        }
    }

    private static RelayRecord readRelay(ResultSet rs) throws SQLException {
        return new RelayRecord(
                rs.getString("address"),
                rs.getInt("port"),
                rs.getString("source"),
                rs.getLong("success_count"),
                rs.getLong("failure_count"),
                nullableLong(rs, "last_used_at"),
                nullableLong(rs, "last_checked_at"),
                rs.getLong("created_at"),
                rs.getLong("updated_at")
        );
    }

    private static Long nullableLong(ResultSet rs, String column) throws SQLException {
        long value = rs.getLong(column);
        return rs.wasNull() ? null : value;
    }
}
