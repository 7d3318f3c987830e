package io.xrelay.dispatch;

import io.xrelay.config.PoolSettings;
import io.xrelay.model.StoreMode;

/**
 * Per-call dispatch rules.
 *
 * @param maxAttempts       relay deliveries the caller is willing to pay for
 * @param sampleSize        candidates drawn from the pool; may exceed {@code maxAttempts} so that
 *                          relays failing the reachability check can be skipped without using an attempt
 * @param reachabilityCheck probe each candidate before use and deprecate the unreachable ones
 */
public record DispatchPolicy(
        int maxAttempts,
        int sampleSize,
        boolean useFallback,
        DispatchMode mode,
        boolean reachabilityCheck,
        long relayTimeoutMs,
        long directTimeoutMs,
        long probeTimeoutMs
) {
    public DispatchPolicy {
        if (maxAttempts < 0) {
            throw new IllegalArgumentException("maxAttempts must be >= 0");
        }
        if (sampleSize < 0) {
            throw new IllegalArgumentException("sampleSize must be >= 0");
        }
        if (relayTimeoutMs <= 0L || directTimeoutMs <= 0L || probeTimeoutMs <= 0L) {
            throw new IllegalArgumentException("timeouts must be > 0");
        }
        mode = mode == null ? DispatchMode.SEQUENTIAL : mode;
    }

    public static DispatchPolicy volatilePolicy(PoolSettings settings) {
        return new DispatchPolicy(
                settings.maxAttempts(),
                settings.maxAttempts(),
                settings.useFallback(),
                DispatchMode.SEQUENTIAL,
                false,
                settings.relayTimeoutMs(),
                settings.directTimeoutMs(),
                settings.probeTimeoutMs()
        );
    }

    public static DispatchPolicy durablePolicy(PoolSettings settings) {
        return new DispatchPolicy(
                settings.maxAttempts(),
                Math.max(settings.maxAttempts(), settings.durableBatchSize()),
                settings.useFallback(),
                DispatchMode.SEQUENTIAL,
                settings.reachabilityCheck(),
                settings.relayTimeoutMs(),
                settings.directTimeoutMs(),
                settings.probeTimeoutMs()
        );
    }

    public static DispatchPolicy forMode(StoreMode mode, PoolSettings settings) {
        return mode == StoreMode.DURABLE ? durablePolicy(settings) : volatilePolicy(settings);
    }

    public DispatchPolicy withMode(DispatchMode next) {
        return new DispatchPolicy(maxAttempts, sampleSize, useFallback, next, reachabilityCheck,
                relayTimeoutMs, directTimeoutMs, probeTimeoutMs);
    }

    public DispatchPolicy withUseFallback(boolean next) {
        return new DispatchPolicy(maxAttempts, sampleSize, next, mode, reachabilityCheck,
                relayTimeoutMs, directTimeoutMs, probeTimeoutMs);
    }

    /** Sets the attempt budget; a sample tied to the budget follows it, a larger batch is kept. */
    public DispatchPolicy withMaxAttempts(int next) {
        int nextSample = sampleSize == maxAttempts ? next : Math.max(next, sampleSize);
        return new DispatchPolicy(next, nextSample, useFallback, mode, reachabilityCheck,
                relayTimeoutMs, directTimeoutMs, probeTimeoutMs);
    }

    public DispatchPolicy withReachabilityCheck(boolean next) {
        return new DispatchPolicy(maxAttempts, sampleSize, useFallback, mode, next,
                relayTimeoutMs, directTimeoutMs, probeTimeoutMs);
    }
}
