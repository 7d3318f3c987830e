package io.xrelay.pool;

public record SweepOutcome(int retentionDays, int deleted, int remaining, int recent, long sweptAtMs, String error) {
    public boolean failed() {
        return error != null;
    }
}
