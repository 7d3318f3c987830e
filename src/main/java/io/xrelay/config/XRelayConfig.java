package io.xrelay.config;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Optional;

public final class XRelayConfig {
    public static final String DEFAULT_ROOT = "data";
    public static final String DATABASE_URL_ENV = "XRELAY_DATABASE_URL";
    public static final String SETTINGS_FILE = "xrelay-settings.json";

    public static final long DEFAULT_FEED_TIMEOUT_MS = 10_000L;
    public static final long DEFAULT_CANDIDATE_CACHE_MS = 5L * 60L * 1000L;
    public static final int DEFAULT_VOLATILE_MIN_COUNT = 3;
    public static final int DEFAULT_DURABLE_MIN_COUNT = 5;
    public static final int DEFAULT_MAX_POOL_SIZE = 10;
    public static final int DEFAULT_VALIDATION_CANDIDATE_LIMIT = 20;
    public static final int DEFAULT_VALIDATION_CONCURRENCY = 5;
    public static final int DEFAULT_VALIDATION_MIN_SUCCESSES = 3;
    public static final long DEFAULT_PROBE_TIMEOUT_MS = 2_000L;
    public static final String DEFAULT_PROBE_URL = "https://httpbin.org/ip";
    public static final int DEFAULT_FAILURE_THRESHOLD = 10;
    public static final int DEFAULT_DEPRECATED_RETENTION_DAYS = 30;
    public static final long DEFAULT_CLEANUP_INTERVAL_MS = 24L * 60L * 60L * 1000L;
    public static final long DEFAULT_RELAY_TIMEOUT_MS = 8_000L;
    public static final long DEFAULT_DIRECT_TIMEOUT_MS = 10_000L;
    public static final int DEFAULT_MAX_ATTEMPTS = 3;
    public static final int DEFAULT_DURABLE_BATCH_SIZE = 5;
    public static final int DEFAULT_GLOBAL_RATE_LIMIT = 10;
    public static final int DEFAULT_KEY_RATE_LIMIT = 5;
    public static final long DEFAULT_RATE_WINDOW_MS = 60_000L;
    public static final long DEFAULT_CACHE_TTL_MS = 5L * 60L * 1000L;
    public static final int DEFAULT_CACHE_MAX_ENTRIES = 100;
    public static final long DEFAULT_MAX_REQUEST_BYTES = 10L * 1024L * 1024L;

    private final Path rootDir;
    private final String databaseUrl;

    public XRelayConfig(Path rootDir, String databaseUrl) {
        this.rootDir = rootDir;
        this.databaseUrl = databaseUrl == null || databaseUrl.isBlank() ? null : databaseUrl.trim();
    }

    public static XRelayConfig fromRoot(String root) {
        return fromRoot(root, null);
    }

    public static XRelayConfig fromRoot(String root, String databaseUrl) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get(DEFAULT_ROOT)
                : Paths.get(root);
        return new XRelayConfig(resolved.toAbsolutePath().normalize(), databaseUrl);
    }

    /**
     * Resolves the JDBC URL from an explicit value first, then from {@value #DATABASE_URL_ENV}.
     */
    public static String resolveDatabaseUrl(String explicit) {
        if (explicit != null && !explicit.isBlank()) {
            return explicit.trim();
        }
        String env = System.getenv(DATABASE_URL_ENV);
        return env == null || env.isBlank() ? null : env.trim();
    }

    public Path rootDir() {
        return rootDir;
    }

    public Optional<String> databaseUrl() {
        return Optional.ofNullable(databaseUrl);
    }

    public boolean durableConfigured() {
        return databaseUrl != null;
    }

    public Path settingsFile() {
        return rootDir.resolve(SETTINGS_FILE);
    }

    public Path auditRoot() {
        return rootDir.resolve("audit");
    }

    public Path auditFile() {
        return auditRoot().resolve("audit.log");
    }

    public Path defaultDbFile() {
        return rootDir.resolve("xrelay.db");
    }
}
