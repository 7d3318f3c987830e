package io.xrelay.pool;

import io.xrelay.observability.AuditLogger;
import io.xrelay.storage.RelayRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.LongSupplier;

/**
 * Purges deprecated relays past the retention window. {@link #start()} runs one sweep right away
 * and then one per interval on a private daemon thread until {@link #stop()}.
 */
public final class DeprecatedSweeper {
    private static final Logger LOG = LoggerFactory.getLogger(DeprecatedSweeper.class);

    private final RelayRepository repository;
    private final int retentionDays;
    private final long intervalMs;
    private final AuditLogger audit;
    private final LongSupplier clock;
    private final AtomicReference<ScheduledExecutorService> scheduler = new AtomicReference<>();
    private final AtomicReference<SweepOutcome> lastOutcome = new AtomicReference<>();

    public DeprecatedSweeper(RelayRepository repository, int retentionDays, long intervalMs, AuditLogger audit) {
        this(repository, retentionDays, intervalMs, audit, System::currentTimeMillis);
    }

    public DeprecatedSweeper(RelayRepository repository, int retentionDays, long intervalMs,
                             AuditLogger audit, LongSupplier clock) {
        if (retentionDays < 0) {
            throw new IllegalArgumentException("retentionDays must be >= 0");
        }
        if (intervalMs <= 0L) {
            throw new IllegalArgumentException("intervalMs must be > 0");
        }
        this.repository = repository;
        this.retentionDays = retentionDays;
        this.intervalMs = intervalMs;
        this.audit = audit;
        this.clock = clock;
    }

    public void start() {
        ScheduledExecutorService executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "xrelay-deprecated-sweeper");
            t.setDaemon(true);
            return t;
        });
        if (!scheduler.compareAndSet(null, executor)) {
            executor.shutdownNow();
            return;
        }
        executor.scheduleAtFixedRate(this::sweepQuietly, 0L, intervalMs, TimeUnit.MILLISECONDS);
        LOG.info("Deprecated relay sweeper started, retention={}d interval={}ms", retentionDays, intervalMs);
    }

    public void stop() {
        ScheduledExecutorService executor = scheduler.getAndSet(null);
        if (executor == null) {
            return;
        }
        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                LOG.warn("Deprecated relay sweeper did not stop within 5s");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    public boolean isRunning() {
        return scheduler.get() != null;
    }

    public SweepOutcome lastOutcome() {
        return lastOutcome.get();
    }

    public SweepOutcome sweepNow() {
        return sweep(retentionDays, clock.getAsLong());
    }

    public SweepOutcome sweep(int days, long nowMs) {
        int deleted = repository.sweepExpiredDeprecated(days, nowMs);
        RelayRepository.DeprecatedStats stats = repository.deprecatedStats(days, nowMs);
        SweepOutcome outcome = new SweepOutcome(days, deleted, stats.total(), stats.recent(), nowMs, null);
        lastOutcome.set(outcome);
        LOG.info("Swept {} deprecated relays older than {} days, {} remain", deleted, days, stats.total());
        audit("ok", outcome);
        return outcome;
    }

    // Scheduled runs must not throw, or the executor silently cancels every later run.
    private void sweepQuietly() {
        long nowMs = clock.getAsLong();
        try {
            sweep(retentionDays, nowMs);
        } catch (RuntimeException e) {
            LOG.warn("Deprecated relay sweep failed: {}", e.getMessage(), e);
            SweepOutcome outcome = new SweepOutcome(retentionDays, 0, -1, -1, nowMs, e.getMessage());
            lastOutcome.set(outcome);
            audit("failed", outcome);
        }
    }

    private void audit(String result, SweepOutcome outcome) {
        if (audit == null) {
            return;
        }
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("retentionDays", outcome.retentionDays());
        details.put("deleted", outcome.deleted());
        details.put("remaining", outcome.remaining());
        if (outcome.error() != null) {
            details.put("error", outcome.error());
        }
        audit.log(AuditLogger.AuditEvent.of("deprecated.sweep", "deprecated-relays", result, details));
    }
}
