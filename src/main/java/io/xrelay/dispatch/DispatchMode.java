package io.xrelay.dispatch;

public enum DispatchMode {
    /** Try candidates one by one, in sampled order. */
    SEQUENTIAL,
    /** Fire every candidate at once and take the first success. */
    PARALLEL;

    public static DispatchMode fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return SEQUENTIAL;
        }
        for (DispatchMode value : values()) {
            if (value.name().equalsIgnoreCase(raw.trim())) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown dispatch mode: " + raw);
    }
}
