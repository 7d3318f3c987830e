package io.xrelay.model;

public record RawCandidate(String address, int port, String source) {
    public RelayKey key() {
        return new RelayKey(address, port);
    }
}
