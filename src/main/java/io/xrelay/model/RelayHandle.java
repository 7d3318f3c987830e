package io.xrelay.model;

/**
 * Caller-facing reference to a relay picked from the pool. Outcomes are
 * reported back through the handle's {@link #key()}.
 */
public record RelayHandle(String address, int port, String source, long createdAtMs) {
    public RelayKey key() {
        return new RelayKey(address, port);
    }

    public String hostPort() {
        return address + ":" + port;
    }
}
