package io.xrelay.storage;

import io.xrelay.model.RawCandidate;
import io.xrelay.model.RelayKey;
import io.xrelay.model.StoreMode;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Random;

final class InMemoryRelayRepositoryTest extends RelayRepositoryContract {
    private InMemoryRelayRepository repo;

    @BeforeEach
    void setUp() {
        repo = new InMemoryRelayRepository(THRESHOLD, 0, new Random(5L));
    }

    @Override
    RelayRepository repository() {
        return repo;
    }

    @Test
    void reportsVolatileMode() {
        Assertions.assertEquals(StoreMode.VOLATILE, repo.mode());
    }

    @Test
    void capacityEvictsLowestWeightRelay() {
        InMemoryRelayRepository capped = new InMemoryRelayRepository(THRESHOLD, 2, new Random(5L));
        capped.upsertMany(List.of(
                new RawCandidate("10.0.0.1", 8080, "feed-a"),
                new RawCandidate("10.0.0.2", 8080, "feed-a")
        ), NOW);
        capped.reportSuccess(new RelayKey("10.0.0.1", 8080), NOW + 1L);

        Assertions.assertEquals(1, capped.upsertMany(List.of(new RawCandidate("10.0.0.3", 8080, "feed-a")), NOW + 2L));
        Assertions.assertEquals(2, capped.count());
        Assertions.assertTrue(capped.find(new RelayKey("10.0.0.1", 8080)).isPresent());
        Assertions.assertTrue(capped.find(new RelayKey("10.0.0.2", 8080)).isEmpty());
    }

    @Test
    void samplingFavoursTheHealthierRelayRoughlyNineToOne() {
        InMemoryRelayRepository weighted = new InMemoryRelayRepository(100, 0, new Random(99L));
        RelayKey strong = new RelayKey("10.0.0.1", 8080);
        RelayKey weak = new RelayKey("10.0.0.2", 8080);
        weighted.upsertMany(List.of(
                new RawCandidate(strong.address(), strong.port(), "feed-a"),
                new RawCandidate(weak.address(), weak.port(), "feed-a")
        ), NOW);
        // strong: 9/(9+0+1) = 0.9, weak: 1/(1+8+1) = 0.1
        for (int i = 0; i < 9; i++) {
            weighted.reportSuccess(strong, NOW);
        }
        weighted.reportSuccess(weak, NOW);
        for (int i = 0; i < 8; i++) {
            weighted.reportFailure(weak, NOW);
        }

        int strongPicks = 0;
        for (int i = 0; i < 1_000; i++) {
            if (weighted.getWeightedSample(1).get(0).key().equals(strong)) {
                strongPicks++;
            }
        }
        Assertions.assertTrue(strongPicks > 850 && strongPicks < 950, "strong picked " + strongPicks + " times");
    }

    @Test
    void rejectsThresholdBelowOne() {
        Assertions.assertThrows(IllegalArgumentException.class, () -> new InMemoryRelayRepository(0));
    }
}
