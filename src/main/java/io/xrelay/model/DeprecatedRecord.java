package io.xrelay.model;

public record DeprecatedRecord(
        String address,
        int port,
        String source,
        String protocol,
        long failureCount,
        long createdAtMs,
        long deprecatedAtMs
) {
    public static final String DEFAULT_PROTOCOL = "http";

    public RelayKey key() {
        return new RelayKey(address, port);
    }
}
