package io.xrelay.model;

public record RelayRecord(
        String address,
        int port,
        String source,
        long successCount,
        long failureCount,
        Long lastUsedAtMs,
        Long lastCheckedAtMs,
        long createdAtMs,
        long updatedAtMs
) {
    public static RelayRecord fresh(RawCandidate candidate, long nowMs) {
        return new RelayRecord(candidate.key().address(), candidate.port(), candidate.source(),
                0L, 0L, null, null, nowMs, nowMs);
    }

    public RelayKey key() {
        return new RelayKey(address, port);
    }

    /**
     * Smoothed success rate {@code success / (success + failure + 1)}, always in [0, 1)
     * and 0 for a relay that has never been used.
     */
    public double weight() {
        return weightOf(successCount, failureCount);
    }

    public static double weightOf(long successCount, long failureCount) {
        long s = Math.max(0L, successCount);
        long f = Math.max(0L, failureCount);
        return (double) s / (double) (s + f + 1L);
    }

    public RelayHandle handle() {
        return new RelayHandle(address, port, source, createdAtMs);
    }

    public RelayRecord withSuccess(long nowMs) {
        return new RelayRecord(address, port, source, successCount + 1L, failureCount,
                nowMs, lastCheckedAtMs, createdAtMs, nowMs);
    }

    public RelayRecord withFailure(long nowMs) {
        return new RelayRecord(address, port, source, successCount, failureCount + 1L,
                lastUsedAtMs, lastCheckedAtMs, createdAtMs, nowMs);
    }

    public RelayRecord withChecked(long nowMs) {
        return new RelayRecord(address, port, source, successCount, failureCount,
                lastUsedAtMs, nowMs, createdAtMs, nowMs);
    }
}
