package io.xrelay.pool;

public record RefillOutcome(
        boolean performed,
        String reason,
        int fetched,
        int skippedDeprecated,
        int validated,
        int inserted,
        int availableAfter,
        String error
) {
    public static RefillOutcome skipped(String reason, int available) {
        return new RefillOutcome(false, reason, 0, 0, 0, 0, available, null);
    }

    public boolean failed() {
        return error != null;
    }
}
