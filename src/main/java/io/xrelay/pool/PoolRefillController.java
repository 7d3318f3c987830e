package io.xrelay.pool;

import io.xrelay.model.RawCandidate;
import io.xrelay.model.RelayKey;
import io.xrelay.observability.AuditLogger;
import io.xrelay.probe.ProbeResult;
import io.xrelay.probe.RelayValidator;
import io.xrelay.storage.RelayRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Two-state refill machine (sufficient / refilling). Only one refill runs at a time; callers that
 * arrive while one is in flight get a skipped outcome instead of blocking. A failed refill leaves
 * the pool as it was and the next check simply triggers again.
 */
public final class PoolRefillController {
    private static final Logger LOG = LoggerFactory.getLogger(PoolRefillController.class);

    private final RelayRepository repository;
    private final Supplier<List<RawCandidate>> candidates;
    private final RelayValidator validator;
    private final RefillPolicy policy;
    private final AuditLogger audit;

    private final AtomicBoolean refilling = new AtomicBoolean(false);
    private final AtomicLong lastRefreshMs = new AtomicLong(0L);
    private final AtomicLong refreshCount = new AtomicLong(0L);

    public PoolRefillController(
            RelayRepository repository,
            Supplier<List<RawCandidate>> candidates,
            RelayValidator validator,
            RefillPolicy policy,
            AuditLogger audit
    ) {
        if (policy.validate() && validator == null) {
            throw new IllegalArgumentException("validator is required when the policy validates candidates");
        }
        this.repository = repository;
        this.candidates = candidates;
        this.validator = validator;
        this.policy = policy;
        this.audit = audit;
    }

    public RefillPolicy policy() {
        return policy;
    }

    public boolean isRefilling() {
        return refilling.get();
    }

    /** Epoch millis of the last completed refill, 0 when the pool was never populated here. */
    public long lastRefreshMs() {
        return lastRefreshMs.get();
    }

    public long refreshCount() {
        return refreshCount.get();
    }

    /**
     * @return the trigger that applies right now, or {@code null} when the pool is sufficient
     */
    public String refillReason(long nowMs) {
        int available = repository.count();
        if (available < policy.minCount()) {
            return "below-minimum";
        }
        long last = lastRefreshMs.get();
        if (policy.refillWhenUnpopulated() && last == 0L) {
            return "never-populated";
        }
        if (policy.refillOnInterval() && last > 0L && nowMs - last > policy.refreshIntervalMs()) {
            return "interval-elapsed";
        }
        return null;
    }

    public RefillOutcome ensureSufficient(long nowMs) {
        String reason = refillReason(nowMs);
        if (reason == null) {
            return RefillOutcome.skipped("sufficient", repository.count());
        }
        return refill(reason, nowMs);
    }

    /** Refills regardless of the triggers, unless a refill is already running. */
    public RefillOutcome forceRefill(long nowMs) {
        return refill("forced", nowMs);
    }

    private RefillOutcome refill(String reason, long nowMs) {
        if (!refilling.compareAndSet(false, true)) {
            return RefillOutcome.skipped("in-flight", repository.count());
        }
        try {
            RefillOutcome outcome = doRefill(reason, nowMs);
            LOG.info("Pool refill ({}) fetched={} skippedDeprecated={} validated={} inserted={} available={}",
                    reason, outcome.fetched(), outcome.skippedDeprecated(), outcome.validated(),
                    outcome.inserted(), outcome.availableAfter());
            auditRefill(outcome);
            return outcome;
        } catch (RuntimeException e) {
            LOG.warn("Pool refill ({}) failed: {}", reason, e.getMessage(), e);
            RefillOutcome outcome = new RefillOutcome(true, reason, 0, 0, 0, 0, safeCount(), e.getMessage());
            auditRefill(outcome);
            return outcome;
        } finally {
            refilling.set(false);
        }
    }

    private RefillOutcome doRefill(String reason, long nowMs) {
        List<RawCandidate> fetched = candidates.get();
        if (fetched == null || fetched.isEmpty()) {
            return new RefillOutcome(true, reason, 0, 0, 0, 0, repository.count(), "no candidates fetched");
        }
        Set<RelayKey> deprecated = repository.deprecatedKeys();
        List<RawCandidate> eligible = new ArrayList<>();
        for (RawCandidate candidate : fetched) {
            if (!deprecated.contains(candidate.key())) {
                eligible.add(candidate);
            }
        }
        int skippedDeprecated = fetched.size() - eligible.size();

        List<RawCandidate> toInsert = eligible;
        int validated = 0;
        if (policy.validate()) {
            List<RawCandidate> probeList = eligible.subList(0, Math.min(eligible.size(), policy.validationCandidateLimit()));
            List<ProbeResult> reachable = validator.validateBatch(probeList,
                    policy.validationConcurrency(), policy.validationMinSuccesses());
            validated = reachable.size();
            toInsert = new ArrayList<>();
            for (ProbeResult result : reachable) {
                if (toInsert.size() >= policy.maxPoolSize()) {
                    break;
                }
                toInsert.add(result.candidate());
            }
        }
        int inserted = repository.upsertMany(toInsert, nowMs);
        lastRefreshMs.set(nowMs);
        refreshCount.incrementAndGet();
        return new RefillOutcome(true, reason, fetched.size(), skippedDeprecated, validated, inserted,
                repository.count(), null);
    }

    private int safeCount() {
        try {
            return repository.count();
        } catch (RuntimeException e) {
            return -1;
        }
    }

    private void auditRefill(RefillOutcome outcome) {
        if (audit == null) {
            return;
        }
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("reason", outcome.reason());
        details.put("mode", repository.mode().label());
        details.put("fetched", outcome.fetched());
        details.put("skippedDeprecated", outcome.skippedDeprecated());
        details.put("validated", outcome.validated());
        details.put("inserted", outcome.inserted());
        details.put("available", outcome.availableAfter());
        if (outcome.error() != null) {
            details.put("error", outcome.error());
        }
        audit.log(AuditLogger.AuditEvent.of("pool.refill", "relay-pool",
                outcome.failed() ? "failed" : "ok", details));
    }
}
