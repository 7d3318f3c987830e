package io.xrelay.storage;

import io.xrelay.config.PoolSettings;
import io.xrelay.config.XRelayConfig;
import io.xrelay.observability.AuditLogger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Random;

/**
 * Chooses the relay store at startup. A configured JDBC URL selects the durable store; when that
 * backend cannot be initialized the process keeps running on the volatile store.
 */
public final class RelayRepositories {
    private static final Logger LOG = LoggerFactory.getLogger(RelayRepositories.class);

    private RelayRepositories() {
    }

    public static RelayRepository open(XRelayConfig config, PoolSettings settings, AuditLogger audit, Random random) {
        if (!config.durableConfigured()) {
            return volatileStore(settings, random);
        }
        String url = config.databaseUrl().orElseThrow();
        try {
            Database database = new Database(url);
            database.init();
            return new SqliteRelayRepository(database, settings.failureThreshold(), random);
        } catch (RuntimeException e) {
            String reason = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
            LOG.warn("Durable relay store unavailable, falling back to volatile store: {}", reason);
            if (audit != null) {
                Map<String, Object> details = new LinkedHashMap<>();
                details.put("reason", reason);
                details.put("fallback", "volatile");
                audit.log(AuditLogger.AuditEvent.of("store.degraded", "relay-store", "degraded", details));
            }
            return volatileStore(settings, random);
        }
    }

    private static RelayRepository volatileStore(PoolSettings settings, Random random) {
        return new InMemoryRelayRepository(settings.failureThreshold(), settings.maxPoolSize(), random);
    }
}
