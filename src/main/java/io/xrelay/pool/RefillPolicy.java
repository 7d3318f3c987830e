package io.xrelay.pool;

import io.xrelay.config.PoolSettings;
import io.xrelay.model.StoreMode;

/**
 * When and how the pool is replenished. The volatile and durable stores use independent policies:
 * the volatile pool refills on count, first use and age and validates candidates up front; the
 * durable pool refills on count only and inserts candidates unvalidated.
 */
public record RefillPolicy(
        int minCount,
        boolean refillWhenUnpopulated,
        boolean refillOnInterval,
        long refreshIntervalMs,
        boolean validate,
        int validationCandidateLimit,
        int validationConcurrency,
        int validationMinSuccesses,
        int maxPoolSize
) {
    public RefillPolicy {
        if (minCount < 0) {
            throw new IllegalArgumentException("minCount must be >= 0");
        }
        if (validate && validationConcurrency < 1) {
            throw new IllegalArgumentException("validationConcurrency must be >= 1");
        }
    }

    public static RefillPolicy volatilePolicy(PoolSettings settings) {
        return new RefillPolicy(
                settings.volatileMinCount(),
                true,
                true,
                settings.candidateCacheMs(),
                true,
                settings.validationCandidateLimit(),
                settings.validationConcurrency(),
                settings.validationMinSuccesses(),
                settings.maxPoolSize()
        );
    }

    public static RefillPolicy durablePolicy(PoolSettings settings) {
        return new RefillPolicy(
                settings.durableMinCount(),
                false,
                false,
                settings.candidateCacheMs(),
                false,
                0,
                0,
                0,
                0
        );
    }

    public static RefillPolicy forMode(StoreMode mode, PoolSettings settings) {
        return mode == StoreMode.DURABLE ? durablePolicy(settings) : volatilePolicy(settings);
    }
}
