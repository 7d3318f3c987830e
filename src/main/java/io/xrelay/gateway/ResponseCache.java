package io.xrelay.gateway;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.LongSupplier;

/**
 * TTL and size bounded response store keyed by {@code METHOD:url}. Expired entries are dropped on
 * read; at capacity the oldest entry is evicted.
 */
public final class ResponseCache<V> {
    private final long ttlMs;
    private final int maxEntries;
    private final LongSupplier clock;
    private final Map<String, Entry<V>> entries = new LinkedHashMap<>();

    public ResponseCache(long ttlMs, int maxEntries) {
        this(ttlMs, maxEntries, System::currentTimeMillis);
    }

    public ResponseCache(long ttlMs, int maxEntries, LongSupplier clock) {
        if (maxEntries < 1) {
            throw new IllegalArgumentException("maxEntries must be >= 1");
        }
        this.ttlMs = Math.max(0L, ttlMs);
        this.maxEntries = maxEntries;
        this.clock = clock;
    }

    public static String key(String method, String url) {
        String m = method == null || method.isBlank() ? "GET" : method.trim().toUpperCase(Locale.ROOT);
        return m + ":" + url;
    }

    public synchronized Optional<V> get(String method, String url) {
        String key = key(method, url);
        Entry<V> entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (clock.getAsLong() - entry.storedAtMs() > ttlMs) {
            entries.remove(key);
            return Optional.empty();
        }
        return Optional.of(entry.value());
    }

    public synchronized void put(String method, String url, V value) {
        String key = key(method, url);
        entries.remove(key);
        if (entries.size() >= maxEntries) {
            Iterator<String> oldest = entries.keySet().iterator();
            oldest.next();
            oldest.remove();
        }
        entries.put(key, new Entry<>(value, clock.getAsLong()));
    }

    public synchronized int cleanupExpired() {
        long now = clock.getAsLong();
        int before = entries.size();
        entries.values().removeIf(e -> now - e.storedAtMs() > ttlMs);
        return before - entries.size();
    }

    public synchronized int size() {
        return entries.size();
    }

    public synchronized void clear() {
        entries.clear();
    }

    private record Entry<V>(V value, long storedAtMs) {
    }
}
