package io.xrelay.runtime;

import io.xrelay.config.PoolSettings;
import io.xrelay.config.XRelayConfig;
import io.xrelay.dispatch.DispatchOrchestrator;
import io.xrelay.dispatch.DispatchPolicy;
import io.xrelay.dispatch.DispatchResult;
import io.xrelay.dispatch.HttpRelayTransport;
import io.xrelay.dispatch.OutboundRequest;
import io.xrelay.dispatch.RelayTransport;
import io.xrelay.feed.RelaySourceAggregator;
import io.xrelay.model.RawCandidate;
import io.xrelay.model.RelayHandle;
import io.xrelay.model.RelayRecord;
import io.xrelay.model.StoreMode;
import io.xrelay.observability.AuditLogger;
import io.xrelay.observability.PrometheusFormatter;
import io.xrelay.pool.DeprecatedSweeper;
import io.xrelay.pool.PoolRefillController;
import io.xrelay.pool.RefillOutcome;
import io.xrelay.pool.RefillPolicy;
import io.xrelay.pool.SweepOutcome;
import io.xrelay.probe.HttpRelayProbe;
import io.xrelay.probe.RelayClients;
import io.xrelay.probe.RelayProbe;
import io.xrelay.probe.RelayValidator;
import io.xrelay.storage.Database;
import io.xrelay.storage.RelayRepositories;
import io.xrelay.storage.RelayRepository;
import io.xrelay.storage.SqliteRelayRepository;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.function.LongSupplier;
import java.util.function.Supplier;

/**
 * Owns all pool state for one process: the relay store, the candidate cache, the refill state
 * machine, the dispatcher and the maintenance sweeper. Construct once, call {@link #init()}, pass
 * by reference.
 */
public final class XRelayRuntime implements AutoCloseable {
    private final XRelayConfig config;
    private final PoolSettings settings;
    private final Collaborators collaborators;
    private final AuditLogger auditLogger;
    private final RelaySourceAggregator aggregator;

    private RelayRepository repository;
    private PoolRefillController refillController;
    private DispatchOrchestrator orchestrator;
    private DeprecatedSweeper sweeper;

    public XRelayRuntime(XRelayConfig config) {
        this(config, PoolSettings.load(config.settingsFile()));
    }

    public XRelayRuntime(XRelayConfig config, PoolSettings settings) {
        this(config, settings, Collaborators.defaults(settings));
    }

    public XRelayRuntime(XRelayConfig config, PoolSettings settings, Collaborators collaborators) {
        this.config = config;
        this.settings = settings;
        this.collaborators = collaborators;
        this.auditLogger = new AuditLogger(config.auditFile());
        this.aggregator = new RelaySourceAggregator(settings.sources(), settings.feedTimeoutMs(), settings.candidateCacheMs());
    }

    public synchronized void init() {
        if (repository != null) {
            return;
        }
        repository = RelayRepositories.open(config, settings, auditLogger, collaborators.random());
        Supplier<List<RawCandidate>> candidates = collaborators.candidates() != null
                ? collaborators.candidates()
                : () -> aggregator.fetchCandidates(collaborators.clock().getAsLong());
        refillController = new PoolRefillController(
                repository,
                candidates,
                new RelayValidator(collaborators.probe()),
                RefillPolicy.forMode(repository.mode(), settings),
                auditLogger
        );
        orchestrator = new DispatchOrchestrator(repository, collaborators.transport(), auditLogger,
                settings.failureThreshold(), collaborators.clock());
        sweeper = new DeprecatedSweeper(repository, settings.deprecatedRetentionDays(), settings.cleanupIntervalMs(),
                auditLogger, collaborators.clock());
    }

    public XRelayConfig config() {
        return config;
    }

    public PoolSettings settings() {
        return settings;
    }

    public AuditLogger auditLogger() {
        return auditLogger;
    }

    public StoreMode mode() {
        return repository().mode();
    }

    public RelayRepository repository() {
        if (repository == null) {
            throw new IllegalStateException("Runtime not initialized, call init() first");
        }
        return repository;
    }

    public DispatchPolicy defaultPolicy() {
        return DispatchPolicy.forMode(mode(), settings);
    }

    public Optional<RelayHandle> getAvailableRelay() {
        List<RelayHandle> one = getRelayBatch(1);
        return one.isEmpty() ? Optional.empty() : Optional.of(one.get(0));
    }

    public List<RelayHandle> getRelayBatch(int n) {
        if (n < 0) {
            throw new IllegalArgumentException("n must be >= 0");
        }
        ensureSufficient();
        List<RelayHandle> out = new ArrayList<>();
        for (RelayRecord record : repository().getWeightedSample(n)) {
            out.add(record.handle());
        }
        return out;
    }

    public boolean reportSuccess(RelayHandle relay) {
        return orchestrator().reportSuccess(relay);
    }

    public RelayRepository.FailureOutcome reportFailure(RelayHandle relay) {
        return orchestrator().reportFailure(relay, "reported by caller");
    }

    public DispatchResult dispatch(OutboundRequest request) {
        return dispatch(request, defaultPolicy());
    }

    public DispatchResult dispatch(OutboundRequest request, DispatchPolicy policy) {
        ensureSufficient();
        return orchestrator().dispatch(request, policy);
    }

    public RefillOutcome ensureSufficient() {
        return refillController().ensureSufficient(collaborators.clock().getAsLong());
    }

    /**
     * @param force refill even when the pool looks sufficient, fetching feeds past the cache
     */
    public RefillOutcome refresh(boolean force) {
        if (!force) {
            return ensureSufficient();
        }
        aggregator.invalidate();
        return refillController().forceRefill(collaborators.clock().getAsLong());
    }

    public PoolStatus poolStatus() {
        RelayRepository repo = repository();
        return new PoolStatus(
                repo.count(),
                refillController().lastRefreshMs(),
                repo.mode().label(),
                repo.deprecatedCount(),
                refillController().refreshCount(),
                refillController().isRefilling(),
                orchestrator().outcomeCounts()
        );
    }

    public String metricsText() {
        return PrometheusFormatter.format(poolStatus());
    }

    public RelayRepository.DeprecatedStats deprecatedStats() {
        return repository().deprecatedStats(settings.deprecatedRetentionDays(), collaborators.clock().getAsLong());
    }

    public SweepOutcome sweep() {
        return sweep(settings.deprecatedRetentionDays());
    }

    public SweepOutcome sweep(int retentionDays) {
        return sweeper().sweep(retentionDays, collaborators.clock().getAsLong());
    }

    public void startMaintenance() {
        sweeper().start();
    }

    public void stopMaintenance() {
        if (sweeper != null) {
            sweeper.stop();
        }
    }

    public List<Database.SchemaMigrationRow> listSchemaMigrations(int limit) {
        RelayRepository repo = repository();
        if (repo instanceof SqliteRelayRepository) {
            return ((SqliteRelayRepository) repo).database().listSchemaMigrations(limit);
        }
        return List.of();
    }

    /** Waits for parallel relay attempts that were still running when their dispatch returned. */
    public boolean awaitPendingReports(long timeoutMs) {
        return orchestrator().awaitPendingReports(timeoutMs);
    }

    @Override
    public void close() {
        stopMaintenance();
        if (orchestrator != null) {
            orchestrator.close();
        }
    }

    private PoolRefillController refillController() {
        repository();
        return refillController;
    }

    private DispatchOrchestrator orchestrator() {
        repository();
        return orchestrator;
    }

    private DeprecatedSweeper sweeper() {
        repository();
        return sweeper;
    }

    /**
     * Network and randomness seams. {@code candidates} replaces the feed aggregator when non-null.
     */
    public record Collaborators(
            RelayProbe probe,
            RelayTransport transport,
            Supplier<List<RawCandidate>> candidates,
            Random random,
            LongSupplier clock
    ) {
        public static Collaborators defaults(PoolSettings settings) {
            RelayClients relayClients = new RelayClients();
            return new Collaborators(
                    new HttpRelayProbe(settings.probeUrl(), settings.probeTimeoutMs(), relayClients),
                    new HttpRelayTransport(settings.probeUrl(), relayClients),
                    null,
                    new Random(),
                    System::currentTimeMillis
            );
        }
    }

    public record PoolStatus(
            int availableCount,
            long lastRefreshTime,
            String mode,
            int deprecatedCount,
            long refreshTotal,
            boolean refilling,
            Map<String, Long> dispatchTotals
    ) {
    }
}
