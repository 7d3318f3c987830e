package io.xrelay.storage;

import io.xrelay.model.DeprecatedRecord;
import io.xrelay.model.RawCandidate;
import io.xrelay.model.RelayKey;
import io.xrelay.model.RelayRecord;
import io.xrelay.model.StoreMode;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.Set;

/**
 * Process-local relay store. All read-modify-write sequences run under one lock, so the store
 * is safe for concurrent dispatch threads inside a single process.
 */
public final class InMemoryRelayRepository implements RelayRepository {
    private final Object lock = new Object();
    private final Map<RelayKey, RelayRecord> available = new LinkedHashMap<>();
    private final Map<RelayKey, DeprecatedRecord> deprecated = new LinkedHashMap<>();
    private final int failureThreshold;
    private final int capacity;
    private final WeightedSampler sampler;

    public InMemoryRelayRepository(int failureThreshold) {
        this(failureThreshold, 0, new Random());
    }

    /**
     * @param capacity maximum available records; 0 means unbounded. When full, inserting a new
     *                 relay evicts the lowest-weight, least recently updated record.
     */
    public InMemoryRelayRepository(int failureThreshold, int capacity, Random random) {
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("failureThreshold must be >= 1");
        }
        this.failureThreshold = failureThreshold;
        this.capacity = Math.max(0, capacity);
        this.sampler = new WeightedSampler(random);
    }

    @Override
    public StoreMode mode() {
        return StoreMode.VOLATILE;
    }

    @Override
    public int upsertMany(List<RawCandidate> candidates, long nowMs) {
        if (candidates == null || candidates.isEmpty()) {
            return 0;
        }
        int inserted = 0;
        synchronized (lock) {
            for (RawCandidate candidate : candidates) {
                RelayKey key = candidate.key();
                if (available.containsKey(key) || deprecated.containsKey(key)) {
                    continue;
                }
                if (capacity > 0 && available.size() >= capacity) {
                    evictOne();
                }
                available.put(key, RelayRecord.fresh(candidate, nowMs));
                inserted++;
            }
        }
        return inserted;
    }

    private void evictOne() {
        available.values().stream()
                .min(Comparator.comparingDouble(RelayRecord::weight)
                        .thenComparingLong(RelayRecord::updatedAtMs))
                .map(RelayRecord::key)
                .ifPresent(available::remove);
    }

    @Override
    public List<RelayRecord> getWeightedSample(int n) {
        List<RelayRecord> snapshot;
        synchronized (lock) {
            snapshot = new ArrayList<>(available.values());
        }
        return sampler.sample(snapshot, RelayRecord::weight, n);
    }

    @Override
    public List<RelayRecord> listAvailable() {
        synchronized (lock) {
            return List.copyOf(available.values());
        }
    }

    @Override
    public Optional<RelayRecord> find(RelayKey key) {
        synchronized (lock) {
            return Optional.ofNullable(available.get(key));
        }
    }

    @Override
    public boolean reportSuccess(RelayKey key, long nowMs) {
        synchronized (lock) {
            RelayRecord current = available.get(key);
            if (current == null) {
                return false;
            }
            available.put(key, current.withSuccess(nowMs));
            return true;
        }
    }

    @Override
    public FailureOutcome reportFailure(RelayKey key, long nowMs) {
        synchronized (lock) {
            RelayRecord current = available.get(key);
            if (current == null) {
                return FailureOutcome.missing(key);
            }
            RelayRecord next = current.withFailure(nowMs);
            if (next.failureCount() >= failureThreshold) {
                available.remove(key);
                deprecated.put(key, new DeprecatedRecord(next.address(), next.port(), next.source(),
                        DeprecatedRecord.DEFAULT_PROTOCOL, next.failureCount(), next.createdAtMs(), nowMs));
                return new FailureOutcome(key, true, next.failureCount(), true);
            }
            available.put(key, next);
            return new FailureOutcome(key, true, next.failureCount(), false);
        }
    }

    @Override
    public void markChecked(RelayKey key, long nowMs) {
        synchronized (lock) {
            RelayRecord current = available.get(key);
            if (current != null) {
                available.put(key, current.withChecked(nowMs));
            }
        }
    }

    @Override
    public DeprecatedRecord deprecate(RelayKey key, String source, long failureCount, long nowMs) {
        synchronized (lock) {
            RelayRecord current = available.remove(key);
            DeprecatedRecord previous = deprecated.get(key);
            long createdAt = current != null ? current.createdAtMs()
                    : previous != null ? previous.createdAtMs() : nowMs;
            String resolvedSource = current != null ? current.source()
                    : previous != null ? previous.source() : source;
            DeprecatedRecord record = new DeprecatedRecord(key.address(), key.port(), resolvedSource,
                    DeprecatedRecord.DEFAULT_PROTOCOL, failureCount, createdAt, nowMs);
            deprecated.put(key, record);
            return record;
        }
    }

    @Override
    public boolean isDeprecated(RelayKey key) {
        synchronized (lock) {
            return deprecated.containsKey(key);
        }
    }

    @Override
    public Set<RelayKey> deprecatedKeys() {
        synchronized (lock) {
            return Set.copyOf(deprecated.keySet());
        }
    }

    @Override
    public Optional<DeprecatedRecord> findDeprecated(RelayKey key) {
        synchronized (lock) {
            return Optional.ofNullable(deprecated.get(key));
        }
    }

    @Override
    public int count() {
        synchronized (lock) {
            return available.size();
        }
    }

    @Override
    public int deprecatedCount() {
        synchronized (lock) {
            return deprecated.size();
        }
    }

    @Override
    public DeprecatedStats deprecatedStats(int retentionDays, long nowMs) {
        long expiredCutoff = RelayRepository.retentionCutoffMs(retentionDays, nowMs);
        long recentCutoff = RelayRepository.retentionCutoffMs(RECENT_DEPRECATION_DAYS, nowMs);
        synchronized (lock) {
            int expired = 0;
            int recent = 0;
            for (DeprecatedRecord record : deprecated.values()) {
                if (record.deprecatedAtMs() < expiredCutoff) {
                    expired++;
                }
                if (record.deprecatedAtMs() >= recentCutoff) {
                    recent++;
                }
            }
            return new DeprecatedStats(deprecated.size(), expired, recent);
        }
    }

    @Override
    public int sweepExpiredDeprecated(int retentionDays, long nowMs) {
        long cutoff = RelayRepository.retentionCutoffMs(retentionDays, nowMs);
        synchronized (lock) {
            int before = deprecated.size();
            deprecated.values().removeIf(record -> record.deprecatedAtMs() < cutoff);
            return before - deprecated.size();
        }
    }
}
