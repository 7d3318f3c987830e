package io.xrelay.dispatch;

import io.xrelay.model.RelayHandle;
import io.xrelay.model.RelayRecord;
import io.xrelay.observability.AuditLogger;
import io.xrelay.probe.ProbeResult;
import io.xrelay.security.SensitiveDataMasker;
import io.xrelay.storage.RelayRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Queue;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.LongSupplier;

/**
 * Delivers requests through relays sampled from the repository, reporting every outcome back,
 * and falls back to a direct request when the relays are exhausted.
 */
public final class DispatchOrchestrator implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(DispatchOrchestrator.class);

    public static final String OUTCOME_RELAY = "relay";
    public static final String OUTCOME_FALLBACK = "fallback";
    public static final String OUTCOME_FAILED = "failed";

    private final RelayRepository repository;
    private final RelayTransport transport;
    private final AuditLogger audit;
    private final int failureThreshold;
    private final LongSupplier clock;
    private final ExecutorService attempts;
    private final Set<CompletableFuture<?>> pendingReports = ConcurrentHashMap.newKeySet();
    private final Map<String, AtomicLong> outcomeCounts = new ConcurrentHashMap<>();

    public DispatchOrchestrator(RelayRepository repository, RelayTransport transport, AuditLogger audit,
                                int failureThreshold) {
        this(repository, transport, audit, failureThreshold, System::currentTimeMillis);
    }

    public DispatchOrchestrator(RelayRepository repository, RelayTransport transport, AuditLogger audit,
                                int failureThreshold, LongSupplier clock) {
        this.repository = repository;
        this.transport = transport;
        this.audit = audit;
        this.failureThreshold = failureThreshold;
        this.clock = clock;
        this.attempts = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "xrelay-dispatch-attempt");
            t.setDaemon(true);
            return t;
        });
        for (String outcome : List.of(OUTCOME_RELAY, OUTCOME_FALLBACK, OUTCOME_FAILED)) {
            outcomeCounts.put(outcome, new AtomicLong());
        }
    }

    public DispatchResult dispatch(OutboundRequest request, DispatchPolicy policy) {
        List<RelayRecord> sampled = policy.sampleSize() == 0 ? List.of() : repository.getWeightedSample(policy.sampleSize());
        List<RelayHandle> candidates = new ArrayList<>();
        for (RelayRecord record : sampled) {
            candidates.add(record.handle());
        }
        DispatchResult result = policy.mode() == DispatchMode.PARALLEL
                ? parallel(request, policy, candidates)
                : sequential(request, policy, candidates);
        count(result);
        auditDispatch(request, policy, result);
        return result;
    }

    private DispatchResult sequential(OutboundRequest request, DispatchPolicy policy, List<RelayHandle> candidates) {
        int used = 0;
        for (RelayHandle relay : candidates) {
            if (used >= policy.maxAttempts()) {
                break;
            }
            if (policy.reachabilityCheck() && !reachable(relay, policy)) {
                continue;
            }
            used++;
            LOG.debug("Relay attempt {}/{} via {}", used, policy.maxAttempts(), relay.hostPort());
            DeliveryResult delivery = transport.sendViaRelay(request, relay, policy.relayTimeoutMs());
            if (delivery.success()) {
                repository.reportSuccess(relay.key(), clock.getAsLong());
                return DispatchResult.viaRelay(delivery, relay.hostPort(), used);
            }
            recordFailure(relay, delivery);
        }
        return fallback(request, policy, used);
    }

    /**
     * Runs up to {@code maxAttempts} workers at once, each delivering through one relay taken from
     * the shared candidate queue; a worker whose relay fails the reachability check takes the next
     * one without using its slot. Returns on the first success. Attempts still running at that
     * point keep going and their outcomes are recorded when they finish.
     */
    private DispatchResult parallel(OutboundRequest request, DispatchPolicy policy, List<RelayHandle> candidates) {
        int workers = Math.min(policy.maxAttempts(), candidates.size());
        if (workers == 0) {
            return fallback(request, policy, 0);
        }
        Queue<RelayHandle> queue = new ConcurrentLinkedQueue<>(candidates);
        CompletableFuture<Attempt> winner = new CompletableFuture<>();
        AtomicInteger remaining = new AtomicInteger(workers);
        AtomicInteger used = new AtomicInteger();
        for (int i = 0; i < workers; i++) {
            CompletableFuture<Void> task = CompletableFuture.runAsync(() -> {
                try {
                    attemptNext(request, policy, queue, winner, used);
                } finally {
                    if (remaining.decrementAndGet() == 0) {
                        winner.complete(null);
                    }
                }
            }, attempts);
            pendingReports.add(task);
            task.whenComplete((ignored, error) -> pendingReports.remove(task));
        }
        Attempt won = awaitWinner(winner);
        if (won != null) {
            return DispatchResult.viaRelay(won.delivery(), won.relay().hostPort(), used.get());
        }
        return fallback(request, policy, used.get());
    }

    private void attemptNext(OutboundRequest request, DispatchPolicy policy, Queue<RelayHandle> queue,
                             CompletableFuture<Attempt> winner, AtomicInteger used) {
        RelayHandle relay;
        while (!winner.isDone() && (relay = queue.poll()) != null) {
            try {
                if (policy.reachabilityCheck() && !reachable(relay, policy)) {
                    continue;
                }
                used.incrementAndGet();
                DeliveryResult delivery = transport.sendViaRelay(request, relay, policy.relayTimeoutMs());
                if (delivery.success()) {
                    repository.reportSuccess(relay.key(), clock.getAsLong());
                    winner.complete(new Attempt(relay, delivery));
                } else {
                    recordFailure(relay, delivery);
                }
            } catch (RuntimeException e) {
                LOG.warn("Parallel relay attempt via {} failed: {}", relay.hostPort(), e.getMessage(), e);
            }
            return;
        }
    }

    private Attempt awaitWinner(CompletableFuture<Attempt> winner) {
        try {
            return winner.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return null;
        } catch (ExecutionException e) {
            LOG.warn("Parallel dispatch ended abnormally: {}", e.getMessage());
            return null;
        }
    }

    private DispatchResult fallback(OutboundRequest request, DispatchPolicy policy, int used) {
        if (!policy.useFallback()) {
            return DispatchResult.exhausted(used);
        }
        LOG.debug("Relays exhausted after {} attempts, sending direct", used);
        DeliveryResult direct = transport.sendDirect(request, policy.directTimeoutMs());
        return DispatchResult.viaFallback(direct, used);
    }

    private boolean reachable(RelayHandle relay, DispatchPolicy policy) {
        ProbeResult probe = transport.checkReachable(relay, policy.probeTimeoutMs());
        if (probe.reachable()) {
            repository.markChecked(relay.key(), clock.getAsLong());
            return true;
        }
        repository.deprecate(relay.key(), relay.source(), failureThreshold, clock.getAsLong());
        LOG.warn("Relay {} unreachable ({}), deprecated", relay.hostPort(), probe.error());
        if (audit != null) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("relay", relay.hostPort());
            details.put("reason", probe.error());
            auditQuietly(AuditLogger.AuditEvent.of("relay.unreachable", relay.hostPort(), "deprecated", details));
        }
        return false;
    }

    /** Records a use-time success observed outside {@link #dispatch}. */
    public boolean reportSuccess(RelayHandle relay) {
        return repository.reportSuccess(relay.key(), clock.getAsLong());
    }

    /** Records a use-time failure observed outside {@link #dispatch}. */
    public RelayRepository.FailureOutcome reportFailure(RelayHandle relay, String reason) {
        return recordFailure(relay, DeliveryResult.failed(reason));
    }

    private RelayRepository.FailureOutcome recordFailure(RelayHandle relay, DeliveryResult delivery) {
        RelayRepository.FailureOutcome outcome = repository.reportFailure(relay.key(), clock.getAsLong());
        LOG.debug("Relay {} failed: {} (failures={})", relay.hostPort(), delivery.error(), outcome.failureCount());
        if (outcome.deprecated()) {
            LOG.info("Relay {} deprecated after {} failures", relay.hostPort(), outcome.failureCount());
            if (audit != null) {
                Map<String, Object> details = new LinkedHashMap<>();
                details.put("relay", relay.hostPort());
                details.put("failureCount", outcome.failureCount());
                details.put("lastError", delivery.error());
                auditQuietly(AuditLogger.AuditEvent.of("relay.deprecate", relay.hostPort(), "deprecated", details));
            }
        }
        return outcome;
    }

    private void count(DispatchResult result) {
        String outcome = !result.success() ? OUTCOME_FAILED : result.fallbackUsed() ? OUTCOME_FALLBACK : OUTCOME_RELAY;
        outcomeCounts.get(outcome).incrementAndGet();
    }

    private void auditDispatch(OutboundRequest request, DispatchPolicy policy, DispatchResult result) {
        if (audit == null) {
            return;
        }
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("method", request.method());
        details.put("url", SensitiveDataMasker.maskUrl(request.url()));
        details.put("mode", policy.mode().name().toLowerCase(Locale.ROOT));
        details.put("attempts", result.attempts());
        details.put("relayUsed", result.relayUsed());
        details.put("fallbackUsed", result.fallbackUsed());
        if (result.relayAddress() != null) {
            details.put("relay", result.relayAddress());
        }
        if (result.error() != null) {
            details.put("error", result.error());
        }
        auditQuietly(AuditLogger.AuditEvent.of("dispatch.complete", request.method() + " " + SensitiveDataMasker.maskUrl(request.url()),
                result.success() ? "ok" : "failed", details));
    }

    // Outcomes are recorded before events are written; a failed write is logged, not thrown.
    private void auditQuietly(AuditLogger.AuditEvent event) {
        try {
            audit.log(event);
        } catch (RuntimeException e) {
            LOG.warn("Audit write for {} failed: {}", event.action(), e.getMessage());
        }
    }

    public Map<String, Long> outcomeCounts() {
        Map<String, Long> out = new LinkedHashMap<>();
        for (String outcome : List.of(OUTCOME_RELAY, OUTCOME_FALLBACK, OUTCOME_FAILED)) {
            out.put(outcome, outcomeCounts.get(outcome).get());
        }
        return out;
    }

    /**
     * Waits for parallel attempts that outlived their dispatch call.
     *
     * @return true when nothing is left running
     */
    public boolean awaitPendingReports(long timeoutMs) {
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(timeoutMs);
        for (CompletableFuture<?> task : List.copyOf(pendingReports)) {
            long left = deadline - System.nanoTime();
            if (left <= 0L) {
                return allDone();
            }
            try {
                task.get(left, TimeUnit.NANOSECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            } catch (ExecutionException | TimeoutException e) {
                LOG.debug("Pending relay attempt did not finish cleanly: {}", e.getMessage());
            }
        }
        return allDone();
    }

    private boolean allDone() {
        for (CompletableFuture<?> task : List.copyOf(pendingReports)) {
            if (!task.isDone()) {
                return false;
            }
        }
        return true;
    }

    @Override
    public void close() {
        attempts.shutdown();
        try {
            if (!attempts.awaitTermination(5, TimeUnit.SECONDS)) {
                attempts.shutdownNow();
            }
        } catch (InterruptedException e) {
            attempts.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private record Attempt(RelayHandle relay, DeliveryResult delivery) {
    }
}
