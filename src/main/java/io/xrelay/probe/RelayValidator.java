package io.xrelay.probe;

import io.xrelay.model.RawCandidate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Probes candidates in fixed-size concurrent batches. Batches run one after another and the run
 * stops as soon as enough reachable candidates have been found.
 */
public final class RelayValidator {
    private static final Logger LOG = LoggerFactory.getLogger(RelayValidator.class);

    private final RelayProbe probe;

    public RelayValidator(RelayProbe probe) {
        this.probe = probe;
    }

    /**
     * @return reachable candidates, fastest first; unreachable ones are dropped
     */
    public List<ProbeResult> validateBatch(List<RawCandidate> candidates, int maxConcurrency, int minSuccesses) {
        if (maxConcurrency < 1) {
            throw new IllegalArgumentException("maxConcurrency must be >= 1");
        }
        if (candidates == null || candidates.isEmpty()) {
            return List.of();
        }
        List<ProbeResult> reachable = new ArrayList<>();
        int probed = 0;
        ExecutorService pool = Executors.newFixedThreadPool(Math.min(maxConcurrency, candidates.size()));
        try {
            for (int start = 0; start < candidates.size(); start += maxConcurrency) {
                List<RawCandidate> batch = candidates.subList(start, Math.min(candidates.size(), start + maxConcurrency));
                List<CompletableFuture<ProbeResult>> futures = new ArrayList<>();
                for (RawCandidate candidate : batch) {
                    futures.add(CompletableFuture.supplyAsync(() -> safeProbe(candidate), pool));
                }
                for (CompletableFuture<ProbeResult> future : futures) {
                    ProbeResult result = future.join();
                    probed++;
                    if (result.reachable()) {
                        reachable.add(result);
                    } else {
                        LOG.debug("Candidate {}:{} unreachable: {}",
                                result.candidate().address(), result.candidate().port(), result.error());
                    }
                }
                if (reachable.size() >= minSuccesses) {
                    break;
                }
            }
        } finally {
            pool.shutdownNow();
        }
        reachable.sort(Comparator.comparingLong(ProbeResult::latencyMs));
        LOG.info("Validated {} of {} candidates, {} reachable", probed, candidates.size(), reachable.size());
        return reachable;
    }

    private ProbeResult safeProbe(RawCandidate candidate) {
        try {
            return probe.probe(candidate);
        } catch (RuntimeException e) {
            LOG.warn("Probe of {}:{} failed unexpectedly", candidate.address(), candidate.port(), e);
            return ProbeResult.unreachable(candidate, e.getMessage());
        }
    }
}
