package io.xrelay.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.xrelay.feed.FeedFormat;
import io.xrelay.feed.RelaySource;
import io.xrelay.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Tunables for the relay pool, dispatch and gateway. Every field can be overridden from
 * {@code xrelay-settings.json}; absent or out-of-range values keep their defaults.
 */
public record PoolSettings(
        List<RelaySource> sources,
        long feedTimeoutMs,
        long candidateCacheMs,
        int volatileMinCount,
        int durableMinCount,
        int maxPoolSize,
        int validationCandidateLimit,
        int validationConcurrency,
        int validationMinSuccesses,
        long probeTimeoutMs,
        String probeUrl,
        int failureThreshold,
        int deprecatedRetentionDays,
        long cleanupIntervalMs,
        long relayTimeoutMs,
        long directTimeoutMs,
        int maxAttempts,
        int durableBatchSize,
        boolean useFallback,
        boolean reachabilityCheck,
        int globalRateLimit,
        int keyRateLimit,
        long rateWindowMs,
        long cacheTtlMs,
        int cacheMaxEntries,
        List<String> allowedDomains,
        List<String> apiKeys,
        long maxRequestBytes
) {
    public PoolSettings {
        sources = List.copyOf(sources);
        allowedDomains = List.copyOf(allowedDomains);
        apiKeys = List.copyOf(apiKeys);
    }

    public static PoolSettings defaults() {
        return new PoolSettings(
                RelaySource.defaults(),
                XRelayConfig.DEFAULT_FEED_TIMEOUT_MS,
                XRelayConfig.DEFAULT_CANDIDATE_CACHE_MS,
                XRelayConfig.DEFAULT_VOLATILE_MIN_COUNT,
                XRelayConfig.DEFAULT_DURABLE_MIN_COUNT,
                XRelayConfig.DEFAULT_MAX_POOL_SIZE,
                XRelayConfig.DEFAULT_VALIDATION_CANDIDATE_LIMIT,
                XRelayConfig.DEFAULT_VALIDATION_CONCURRENCY,
                XRelayConfig.DEFAULT_VALIDATION_MIN_SUCCESSES,
                XRelayConfig.DEFAULT_PROBE_TIMEOUT_MS,
                XRelayConfig.DEFAULT_PROBE_URL,
                XRelayConfig.DEFAULT_FAILURE_THRESHOLD,
                XRelayConfig.DEFAULT_DEPRECATED_RETENTION_DAYS,
                XRelayConfig.DEFAULT_CLEANUP_INTERVAL_MS,
                XRelayConfig.DEFAULT_RELAY_TIMEOUT_MS,
                XRelayConfig.DEFAULT_DIRECT_TIMEOUT_MS,
                XRelayConfig.DEFAULT_MAX_ATTEMPTS,
                XRelayConfig.DEFAULT_DURABLE_BATCH_SIZE,
                true,
                true,
                XRelayConfig.DEFAULT_GLOBAL_RATE_LIMIT,
                XRelayConfig.DEFAULT_KEY_RATE_LIMIT,
                XRelayConfig.DEFAULT_RATE_WINDOW_MS,
                XRelayConfig.DEFAULT_CACHE_TTL_MS,
                XRelayConfig.DEFAULT_CACHE_MAX_ENTRIES,
                List.of(),
                List.of(),
                XRelayConfig.DEFAULT_MAX_REQUEST_BYTES
        );
    }

    public static PoolSettings load(Path settingsFile) {
        PoolSettings defaults = defaults();
        if (settingsFile == null || !Files.isRegularFile(settingsFile)) {
            return defaults;
        }
        try {
            SettingsFile file = Jsons.mapper().readValue(settingsFile.toFile(), SettingsFile.class);
            return fromFile(file, defaults);
        } catch (IOException e) {
            throw new RuntimeException("Failed to load pool settings: " + settingsFile, e);
        }
    }

    static PoolSettings fromFile(SettingsFile file, PoolSettings defaults) {
        if (file == null) {
            return defaults;
        }
        List<RelaySource> sources = defaults.sources();
        if (file.sources() != null) {
            List<RelaySource> parsed = new ArrayList<>();
            for (SourceEntry entry : file.sources()) {
                if (entry == null || entry.name() == null || entry.name().isBlank()
                        || entry.url() == null || entry.url().isBlank()) {
                    continue;
                }
                parsed.add(new RelaySource(entry.name().trim(), entry.url().trim(), FeedFormat.fromString(entry.format())));
            }
            sources = parsed;
        }
        int validationConcurrency = sanitizeInt(file.validationConcurrency(), defaults.validationConcurrency(), 1);
        return new PoolSettings(
                sources,
                sanitizeLong(file.feedTimeoutMs(), defaults.feedTimeoutMs(), 100L),
                sanitizeLong(file.candidateCacheMs(), defaults.candidateCacheMs(), 0L),
                sanitizeInt(file.volatileMinCount(), defaults.volatileMinCount(), 1),
                sanitizeInt(file.durableMinCount(), defaults.durableMinCount(), 1),
                sanitizeInt(file.maxPoolSize(), defaults.maxPoolSize(), 1),
                sanitizeInt(file.validationCandidateLimit(), defaults.validationCandidateLimit(), 1),
                validationConcurrency,
                sanitizeInt(file.validationMinSuccesses(), defaults.validationMinSuccesses(), 1),
                sanitizeLong(file.probeTimeoutMs(), defaults.probeTimeoutMs(), 100L),
                sanitizeUrl(file.probeUrl(), defaults.probeUrl()),
                sanitizeInt(file.failureThreshold(), defaults.failureThreshold(), 1),
                sanitizeInt(file.deprecatedRetentionDays(), defaults.deprecatedRetentionDays(), 1),
                sanitizeLong(file.cleanupIntervalMs(), defaults.cleanupIntervalMs(), 1_000L),
                sanitizeLong(file.relayTimeoutMs(), defaults.relayTimeoutMs(), 100L),
                sanitizeLong(file.directTimeoutMs(), defaults.directTimeoutMs(), 100L),
                sanitizeInt(file.maxAttempts(), defaults.maxAttempts(), 1),
                sanitizeInt(file.durableBatchSize(), defaults.durableBatchSize(), 1),
                file.useFallback() == null ? defaults.useFallback() : file.useFallback(),
                file.reachabilityCheck() == null ? defaults.reachabilityCheck() : file.reachabilityCheck(),
                sanitizeInt(file.globalRateLimit(), defaults.globalRateLimit(), 1),
                sanitizeInt(file.keyRateLimit(), defaults.keyRateLimit(), 1),
                sanitizeLong(file.rateWindowMs(), defaults.rateWindowMs(), 1_000L),
                sanitizeLong(file.cacheTtlMs(), defaults.cacheTtlMs(), 0L),
                sanitizeInt(file.cacheMaxEntries(), defaults.cacheMaxEntries(), 1),
                sanitizeList(file.allowedDomains(), defaults.allowedDomains()),
                sanitizeList(file.apiKeys(), defaults.apiKeys()),
                sanitizeLong(file.maxRequestBytes(), defaults.maxRequestBytes(), 1_024L)
        );
    }

    private static int sanitizeInt(Integer value, int fallback, int min) {
        if (value == null) {
            return fallback;
        }
        return value < min ? fallback : value;
    }

    private static long sanitizeLong(Long value, long fallback, long min) {
        if (value == null) {
            return fallback;
        }
        return value < min ? fallback : value;
    }

    private static String sanitizeUrl(String value, String fallback) {
        if (value == null || value.isBlank()) {
            return fallback;
        }
        String v = value.trim();
        String lower = v.toLowerCase(Locale.ROOT);
        return lower.startsWith("http://") || lower.startsWith("https://") ? v : fallback;
    }

    private static List<String> sanitizeList(List<String> values, List<String> fallback) {
        if (values == null) {
            return fallback;
        }
        List<String> out = new ArrayList<>();
        for (String v : values) {
            if (v != null && !v.isBlank()) {
                out.add(v.trim());
            }
        }
        return out;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record SourceEntry(String name, String url, String format) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record SettingsFile(
            List<SourceEntry> sources,
            Long feedTimeoutMs,
            Long candidateCacheMs,
            Integer volatileMinCount,
            Integer durableMinCount,
            Integer maxPoolSize,
            Integer validationCandidateLimit,
            Integer validationConcurrency,
            Integer validationMinSuccesses,
            Long probeTimeoutMs,
            String probeUrl,
            Integer failureThreshold,
            Integer deprecatedRetentionDays,
            Long cleanupIntervalMs,
            Long relayTimeoutMs,
            Long directTimeoutMs,
            Integer maxAttempts,
            Integer durableBatchSize,
            Boolean useFallback,
            Boolean reachabilityCheck,
            Integer globalRateLimit,
            Integer keyRateLimit,
            Long rateWindowMs,
            Long cacheTtlMs,
            Integer cacheMaxEntries,
            List<String> allowedDomains,
            List<String> apiKeys,
            Long maxRequestBytes
    ) {
    }
}
