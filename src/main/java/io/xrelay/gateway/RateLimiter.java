package io.xrelay.gateway;

import java.util.HashMap;
import java.util.Map;
import java.util.function.LongSupplier;

/**
 * Fixed-window request counters, one global window and one window per client key.
 */
public final class RateLimiter {
    private final int globalLimit;
    private final int keyLimit;
    private final long windowMs;
    private final LongSupplier clock;
    private final Window global = new Window();
    private final Map<String, Window> byKey = new HashMap<>();

    public RateLimiter(int globalLimit, int keyLimit, long windowMs) {
        this(globalLimit, keyLimit, windowMs, System::currentTimeMillis);
    }

    public RateLimiter(int globalLimit, int keyLimit, long windowMs, LongSupplier clock) {
        if (globalLimit < 1 || keyLimit < 1) {
            throw new IllegalArgumentException("limits must be >= 1");
        }
        if (windowMs <= 0L) {
            throw new IllegalArgumentException("windowMs must be > 0");
        }
        this.globalLimit = globalLimit;
        this.keyLimit = keyLimit;
        this.windowMs = windowMs;
        this.clock = clock;
    }

    public synchronized Decision checkGlobal() {
        return global.hit(globalLimit, clock.getAsLong());
    }

    public synchronized Decision checkByKey(String key) {
        String k = key == null || key.isBlank() ? "unknown" : key;
        return byKey.computeIfAbsent(k, ignored -> new Window()).hit(keyLimit, clock.getAsLong());
    }

    /** Drops per-key windows that have already reset. */
    public synchronized int cleanupExpired() {
        long now = clock.getAsLong();
        int before = byKey.size();
        byKey.values().removeIf(w -> now > w.resetAtMs);
        return before - byKey.size();
    }

    public synchronized int trackedKeys() {
        return byKey.size();
    }

    private final class Window {
        private int count;
        private long resetAtMs;

        Decision hit(int limit, long now) {
            if (resetAtMs == 0L || now > resetAtMs) {
                count = 1;
                resetAtMs = now + windowMs;
                return new Decision(true, limit - 1, windowMs);
            }
            if (count >= limit) {
                return new Decision(false, 0, resetAtMs - now);
            }
            count++;
            return new Decision(true, limit - count, resetAtMs - now);
        }
    }

    public record Decision(boolean allowed, int remaining, long resetInMs) {
        /** Whole seconds until the window resets, rounded up. */
        public long retryAfterSeconds() {
            return (resetInMs + 999L) / 1000L;
        }
    }
}
