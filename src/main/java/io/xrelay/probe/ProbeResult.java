package io.xrelay.probe;

import io.xrelay.model.RawCandidate;

public record ProbeResult(RawCandidate candidate, boolean reachable, long latencyMs, String error) {
    public static ProbeResult reachable(RawCandidate candidate, long latencyMs) {
        return new ProbeResult(candidate, true, Math.max(0L, latencyMs), null);
    }

    public static ProbeResult unreachable(RawCandidate candidate, String reason) {
        return new ProbeResult(candidate, false, -1L, reason == null ? "unknown" : reason);
    }
}
