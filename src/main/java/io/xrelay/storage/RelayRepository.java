package io.xrelay.storage;

import io.xrelay.model.DeprecatedRecord;
import io.xrelay.model.RawCandidate;
import io.xrelay.model.RelayKey;
import io.xrelay.model.RelayRecord;
import io.xrelay.model.StoreMode;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Storage contract shared by the volatile and durable relay stores. An address lives in at
 * most one of the available and deprecated sets; every transition between them is atomic.
 */
public interface RelayRepository {
    long DAY_MS = 24L * 60L * 60L * 1000L;
    int RECENT_DEPRECATION_DAYS = 7;

    StoreMode mode();

    /**
     * Inserts candidates that are neither already available nor deprecated. Existing records
     * keep their counters.
     *
     * @return number of newly inserted records
     */
    int upsertMany(List<RawCandidate> candidates, long nowMs);

    /**
     * Weighted sample without replacement; returns every record when fewer than {@code n} exist.
     */
    List<RelayRecord> getWeightedSample(int n);

    List<RelayRecord> listAvailable();

    Optional<RelayRecord> find(RelayKey key);

    /** @return false when the relay is no longer in the available set */
    boolean reportSuccess(RelayKey key, long nowMs);

    /**
     * Increments the failure counter and, once it reaches the configured threshold, moves the
     * record to the deprecated set within the same call.
     */
    FailureOutcome reportFailure(RelayKey key, long nowMs);

    void markChecked(RelayKey key, long nowMs);

    /**
     * Moves a relay straight to the deprecated set, keeping its original creation time when it
     * was available. {@code source} is used only when the relay is unknown.
     */
    DeprecatedRecord deprecate(RelayKey key, String source, long failureCount, long nowMs);

    boolean isDeprecated(RelayKey key);

    Set<RelayKey> deprecatedKeys();

    Optional<DeprecatedRecord> findDeprecated(RelayKey key);

    int count();

    int deprecatedCount();

    DeprecatedStats deprecatedStats(int retentionDays, long nowMs);

    /** Deletes deprecated records whose deprecation time is older than the retention window. */
    int sweepExpiredDeprecated(int retentionDays, long nowMs);

    default int sweepExpiredDeprecated(int retentionDays) {
        return sweepExpiredDeprecated(retentionDays, System.currentTimeMillis());
    }

    static long retentionCutoffMs(int retentionDays, long nowMs) {
        if (retentionDays < 0) {
            throw new IllegalArgumentException("retentionDays must be >= 0");
        }
        return nowMs - retentionDays * DAY_MS;
    }

    record FailureOutcome(RelayKey key, boolean found, long failureCount, boolean deprecated) {
        public static FailureOutcome missing(RelayKey key) {
            return new FailureOutcome(key, false, 0L, false);
        }
    }

    record DeprecatedStats(int total, int expired, int recent) {
    }
}
