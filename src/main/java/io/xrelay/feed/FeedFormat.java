package io.xrelay.feed;

public enum FeedFormat {
    /** One {@code host:port} per line. */
    LINES,
    /** One JSON object {@code {"host": ..., "port": ..., "type": ...}} per line. */
    JSON_LINES;

    public static FeedFormat fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return LINES;
        }
        String normalized = raw.trim().replace('-', '_');
        for (FeedFormat value : values()) {
            if (value.name().equalsIgnoreCase(normalized)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown feed format: " + raw);
    }
}
