package io.xrelay.dispatch;

import io.xrelay.config.PoolSettings;
import io.xrelay.model.RawCandidate;
import io.xrelay.model.RelayHandle;
import io.xrelay.model.RelayKey;
import io.xrelay.observability.AuditLogger;
import io.xrelay.storage.InMemoryRelayRepository;
import io.xrelay.storage.RelayRepository;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Random;
import java.util.stream.Stream;

final class DispatchOrchestratorTest {
    private static final long NOW = 1_760_000_000_000L;
    private static final OutboundRequest REQUEST = OutboundRequest.get("https://target.example/data?token=abc");

    @Test
    void allRelaysFailingFallsBackAndCountsEachFailure() {
        InMemoryRelayRepository repo = new InMemoryRelayRepository(10, 0, new Random(1L));
        repo.upsertMany(List.of(new RawCandidate("10.0.0.1", 80, "feed"), new RawCandidate("10.0.0.2", 80, "feed")), NOW);
        FakeRelayTransport transport = new FakeRelayTransport();

        try (DispatchOrchestrator orchestrator = new DispatchOrchestrator(repo, transport, null, 10, () -> NOW)) {
            DispatchResult result = orchestrator.dispatch(REQUEST, policy(3));
            Assertions.assertTrue(result.success());
            Assertions.assertTrue(result.fallbackUsed());
            Assertions.assertFalse(result.relayUsed());
            Assertions.assertNull(result.relayAddress());
            Assertions.assertEquals(2, result.attempts());
            Assertions.assertEquals(1, transport.directCalls.get());
            Assertions.assertEquals(1L, repo.find(new RelayKey("10.0.0.1", 80)).orElseThrow().failureCount());
            Assertions.assertEquals(1L, repo.find(new RelayKey("10.0.0.2", 80)).orElseThrow().failureCount());
            Assertions.assertEquals(1L, orchestrator.outcomeCounts().get(DispatchOrchestrator.OUTCOME_FALLBACK));
        }
    }

    @Test
    void failureAtThresholdDeprecatesDuringDispatch() {
        InMemoryRelayRepository repo = new InMemoryRelayRepository(10);
        repo.upsertMany(List.of(new RawCandidate("10.0.0.1", 80, "feed")), NOW);
        RelayKey key = new RelayKey("10.0.0.1", 80);
        for (int i = 0; i < 9; i++) {
            repo.reportFailure(key, NOW);
        }

        try (DispatchOrchestrator orchestrator = new DispatchOrchestrator(repo, new FakeRelayTransport(), null, 10, () -> NOW)) {
            orchestrator.dispatch(REQUEST, policy(3).withUseFallback(false));
        }
        Assertions.assertTrue(repo.find(key).isEmpty());
        Assertions.assertEquals(10L, repo.findDeprecated(key).orElseThrow().failureCount());
    }

    @Test
    void emptyPoolWithoutFallbackFailsWithoutNetwork() {
        InMemoryRelayRepository repo = new InMemoryRelayRepository(10);
        FakeRelayTransport transport = new FakeRelayTransport();

        try (DispatchOrchestrator orchestrator = new DispatchOrchestrator(repo, transport, null, 10)) {
            DispatchResult result = orchestrator.dispatch(REQUEST, policy(3).withUseFallback(false));
            Assertions.assertFalse(result.success());
            Assertions.assertFalse(result.fallbackUsed());
            Assertions.assertEquals("No relays available", result.error());
            Assertions.assertEquals(0, result.attempts());
            Assertions.assertEquals(1L, orchestrator.outcomeCounts().get(DispatchOrchestrator.OUTCOME_FAILED));
        }
        Assertions.assertEquals(0, transport.directCalls.get());
        Assertions.assertTrue(transport.relayCalls.isEmpty());
    }

    @Test
    void firstHealthyRelayWinsAndIsCredited() {
        InMemoryRelayRepository repo = new InMemoryRelayRepository(10, 0, new Random(2L));
        repo.upsertMany(List.of(new RawCandidate("10.0.0.1", 80, "feed")), NOW);
        FakeRelayTransport transport = new FakeRelayTransport().healthy("10.0.0.1:80");

        try (DispatchOrchestrator orchestrator = new DispatchOrchestrator(repo, transport, null, 10, () -> NOW + 5L)) {
            DispatchResult result = orchestrator.dispatch(REQUEST, policy(3));
            Assertions.assertTrue(result.success());
            Assertions.assertTrue(result.relayUsed());
            Assertions.assertEquals("10.0.0.1:80", result.relayAddress());
            Assertions.assertEquals(200, result.status());
            Assertions.assertEquals("via 10.0.0.1:80", result.body());
        }
        Assertions.assertEquals(1L, repo.find(new RelayKey("10.0.0.1", 80)).orElseThrow().successCount());
        Assertions.assertEquals(NOW + 5L, repo.find(new RelayKey("10.0.0.1", 80)).orElseThrow().lastUsedAtMs());
        Assertions.assertEquals(0, transport.directCalls.get());
    }

    @Test
    void failedFallbackIsTheCallerVisibleError() {
        InMemoryRelayRepository repo = new InMemoryRelayRepository(10);
        FakeRelayTransport transport = new FakeRelayTransport();
        transport.directSucceeds = false;

        try (DispatchOrchestrator orchestrator = new DispatchOrchestrator(repo, transport, null, 10)) {
            DispatchResult result = orchestrator.dispatch(REQUEST, policy(3));
            Assertions.assertFalse(result.success());
            Assertions.assertTrue(result.fallbackUsed());
            Assertions.assertTrue(result.error().startsWith("Relay attempts exhausted and direct request failed"));
        }
    }

    @Test
    void attemptBudgetLimitsSequentialTries() {
        InMemoryRelayRepository repo = new InMemoryRelayRepository(10, 0, new Random(3L));
        for (int i = 1; i <= 5; i++) {
            repo.upsertMany(List.of(new RawCandidate("10.0.0." + i, 80, "feed")), NOW);
        }
        FakeRelayTransport transport = new FakeRelayTransport();
        DispatchPolicy policy = new DispatchPolicy(2, 5, false, DispatchMode.SEQUENTIAL, false, 1_000L, 1_000L, 1_000L);

        try (DispatchOrchestrator orchestrator = new DispatchOrchestrator(repo, transport, null, 10)) {
            DispatchResult result = orchestrator.dispatch(REQUEST, policy);
            Assertions.assertEquals("All relay attempts failed", result.error());
            Assertions.assertEquals(2, result.attempts());
        }
        Assertions.assertEquals(2, transport.relayCalls.size());
    }

    @Test
    void unreachableRelaysAreDeprecatedWithoutUsingAnAttempt() throws Exception {
        Path root = Files.createTempDirectory("xrelay-test-dispatch-");
        try {
            AuditLogger audit = new AuditLogger(root.resolve("audit.log"));
            InMemoryRelayRepository repo = new InMemoryRelayRepository(10, 0, new Random(4L));
            repo.upsertMany(List.of(
                    new RawCandidate("10.0.0.1", 80, "feed"),
                    new RawCandidate("10.0.0.2", 80, "feed"),
                    new RawCandidate("10.0.0.3", 80, "feed")
            ), NOW);
            // Positive weights put the two dead relays ahead of the healthy one in the sample.
            repo.reportSuccess(new RelayKey("10.0.0.1", 80), NOW);
            repo.reportSuccess(new RelayKey("10.0.0.2", 80), NOW);
            FakeRelayTransport transport = new FakeRelayTransport()
                    .unreachable("10.0.0.1:80")
                    .unreachable("10.0.0.2:80")
                    .healthy("10.0.0.3:80");
            DispatchPolicy policy = new DispatchPolicy(1, 3, false, DispatchMode.SEQUENTIAL, true, 1_000L, 1_000L, 1_000L);

            try (DispatchOrchestrator orchestrator = new DispatchOrchestrator(repo, transport, audit, 10, () -> NOW)) {
                DispatchResult result = orchestrator.dispatch(REQUEST, policy);
                Assertions.assertTrue(result.success());
                Assertions.assertEquals("10.0.0.3:80", result.relayAddress());
                Assertions.assertEquals(1, result.attempts());
            }
            Assertions.assertEquals(List.of("10.0.0.3:80"), transport.relayCalls);
            Assertions.assertEquals(1, repo.count());
            Assertions.assertEquals(10L, repo.findDeprecated(new RelayKey("10.0.0.1", 80)).orElseThrow().failureCount());
            Assertions.assertEquals(NOW, repo.findDeprecated(new RelayKey("10.0.0.2", 80)).orElseThrow().createdAtMs());
            Assertions.assertEquals(NOW, repo.find(new RelayKey("10.0.0.3", 80)).orElseThrow().lastCheckedAtMs());

            String log = Files.readString(audit.auditFile(), StandardCharsets.UTF_8);
            Assertions.assertTrue(log.contains("\"action\":\"relay.unreachable\""));
            Assertions.assertTrue(log.contains("\"action\":\"dispatch.complete\""));
            Assertions.assertFalse(log.contains("token=abc"));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void parallelReturnsFastestSuccessAndRecordsStragglers() {
        InMemoryRelayRepository repo = new InMemoryRelayRepository(10, 0, new Random(5L));
        repo.upsertMany(List.of(
                new RawCandidate("10.0.0.1", 80, "feed"),
                new RawCandidate("10.0.0.2", 80, "feed"),
                new RawCandidate("10.0.0.3", 80, "feed")
        ), NOW);
        FakeRelayTransport transport = new FakeRelayTransport()
                .healthy("10.0.0.1:80")
                .delay("10.0.0.2:80", 300L)
                .delay("10.0.0.3:80", 300L);

        try (DispatchOrchestrator orchestrator = new DispatchOrchestrator(repo, transport, null, 10, () -> NOW)) {
            DispatchResult result = orchestrator.dispatch(REQUEST, policy(3).withMode(DispatchMode.PARALLEL));
            Assertions.assertTrue(result.success());
            Assertions.assertEquals("10.0.0.1:80", result.relayAddress());

            Assertions.assertTrue(orchestrator.awaitPendingReports(5_000L));
        }
        Assertions.assertEquals(1L, repo.find(new RelayKey("10.0.0.1", 80)).orElseThrow().successCount());
        Assertions.assertEquals(1L, repo.find(new RelayKey("10.0.0.2", 80)).orElseThrow().failureCount());
        Assertions.assertEquals(1L, repo.find(new RelayKey("10.0.0.3", 80)).orElseThrow().failureCount());
    }

    @Test
    void parallelFallsBackWhenEveryAttemptFails() {
        InMemoryRelayRepository repo = new InMemoryRelayRepository(10, 0, new Random(6L));
        repo.upsertMany(List.of(new RawCandidate("10.0.0.1", 80, "feed"), new RawCandidate("10.0.0.2", 80, "feed")), NOW);
        FakeRelayTransport transport = new FakeRelayTransport();

        try (DispatchOrchestrator orchestrator = new DispatchOrchestrator(repo, transport, null, 10, () -> NOW)) {
            DispatchResult result = orchestrator.dispatch(REQUEST, policy(3).withMode(DispatchMode.PARALLEL));
            Assertions.assertTrue(result.fallbackUsed());
            Assertions.assertEquals(2, result.attempts());
        }
        Assertions.assertEquals(1, transport.directCalls.get());
    }

    @Test
    void parallelLaunchesNoMoreDeliveriesThanTheAttemptBudget() {
        InMemoryRelayRepository repo = new InMemoryRelayRepository(10, 0, new Random(7L));
        for (int i = 1; i <= 5; i++) {
            repo.upsertMany(List.of(new RawCandidate("10.0.0." + i, 80, "feed")), NOW);
        }
        FakeRelayTransport transport = new FakeRelayTransport();
        DispatchPolicy policy = DispatchPolicy.durablePolicy(PoolSettings.defaults())
                .withMaxAttempts(1)
                .withMode(DispatchMode.PARALLEL);
        Assertions.assertEquals(5, policy.sampleSize());

        try (DispatchOrchestrator orchestrator = new DispatchOrchestrator(repo, transport, null, 10, () -> NOW)) {
            DispatchResult result = orchestrator.dispatch(REQUEST, policy);
            Assertions.assertTrue(result.fallbackUsed());
            Assertions.assertEquals(1, result.attempts());
            Assertions.assertTrue(orchestrator.awaitPendingReports(5_000L));
        }
        Assertions.assertEquals(1, transport.relayCalls.size());
        long failures = repo.getWeightedSample(5).stream().mapToLong(r -> r.failureCount()).sum();
        Assertions.assertEquals(1L, failures);
    }

    @Test
    void parallelSkipsUnreachableRelaysWithoutUsingASlot() {
        InMemoryRelayRepository repo = new InMemoryRelayRepository(10, 0, new Random(8L));
        repo.upsertMany(List.of(
                new RawCandidate("10.0.0.1", 80, "feed"),
                new RawCandidate("10.0.0.2", 80, "feed"),
                new RawCandidate("10.0.0.3", 80, "feed")
        ), NOW);
        repo.reportSuccess(new RelayKey("10.0.0.1", 80), NOW);
        repo.reportSuccess(new RelayKey("10.0.0.2", 80), NOW);
        FakeRelayTransport transport = new FakeRelayTransport()
                .unreachable("10.0.0.1:80")
                .unreachable("10.0.0.2:80")
                .healthy("10.0.0.3:80");
        DispatchPolicy policy = new DispatchPolicy(1, 3, false, DispatchMode.PARALLEL, true, 1_000L, 1_000L, 1_000L);

        try (DispatchOrchestrator orchestrator = new DispatchOrchestrator(repo, transport, null, 10, () -> NOW)) {
            DispatchResult result = orchestrator.dispatch(REQUEST, policy);
            Assertions.assertTrue(result.success());
            Assertions.assertEquals("10.0.0.3:80", result.relayAddress());
            Assertions.assertEquals(1, result.attempts());
        }
        Assertions.assertEquals(List.of("10.0.0.3:80"), transport.relayCalls);
        Assertions.assertEquals(3, transport.probeCalls.size());
        Assertions.assertEquals(1, repo.count());
    }

    @Test
    void unwritableAuditLogDoesNotFailDelivery() throws Exception {
        Path root = Files.createTempDirectory("xrelay-test-dispatch-");
        try {
            Path auditFile = root.resolve("audit.log");
            AuditLogger audit = new AuditLogger(auditFile);
            Files.delete(auditFile);
            Files.createDirectory(auditFile);
            InMemoryRelayRepository repo = new InMemoryRelayRepository(10);
            repo.upsertMany(List.of(new RawCandidate("10.0.0.1", 80, "feed")), NOW);
            FakeRelayTransport transport = new FakeRelayTransport().healthy("10.0.0.1:80");

            try (DispatchOrchestrator orchestrator = new DispatchOrchestrator(repo, transport, audit, 10, () -> NOW)) {
                DispatchResult result = orchestrator.dispatch(REQUEST, policy(3));
                Assertions.assertTrue(result.success());
                Assertions.assertEquals(1L, orchestrator.outcomeCounts().get(DispatchOrchestrator.OUTCOME_RELAY));
            }
            Assertions.assertEquals(1L, repo.find(new RelayKey("10.0.0.1", 80)).orElseThrow().successCount());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void externalReportsReachTheRepository() {
        InMemoryRelayRepository repo = new InMemoryRelayRepository(2);
        repo.upsertMany(List.of(new RawCandidate("10.0.0.1", 80, "feed")), NOW);
        RelayKey key = new RelayKey("10.0.0.1", 80);
        try (DispatchOrchestrator orchestrator = new DispatchOrchestrator(repo, new FakeRelayTransport(), null, 2)) {
            RelayHandle handle = repo.find(key).orElseThrow().handle();
            Assertions.assertTrue(orchestrator.reportSuccess(handle));
            Assertions.assertFalse(orchestrator.reportFailure(handle, "timeout").deprecated());
            RelayRepository.FailureOutcome second = orchestrator.reportFailure(handle, "timeout");
            Assertions.assertTrue(second.deprecated());
            Assertions.assertFalse(orchestrator.reportSuccess(handle));
        }
    }

    private static DispatchPolicy policy(int maxAttempts) {
        return DispatchPolicy.volatilePolicy(PoolSettings.defaults()).withMaxAttempts(maxAttempts);
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
