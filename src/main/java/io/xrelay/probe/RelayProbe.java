package io.xrelay.probe;

import io.xrelay.model.RawCandidate;

/**
 * Single reachability check through a candidate relay. Implementations report failures as
 * {@link ProbeResult#unreachable} values and never throw for network errors.
 */
@FunctionalInterface
public interface RelayProbe {
    ProbeResult probe(RawCandidate candidate);
}
