package io.xrelay.model;

import java.util.Locale;

public record RelayKey(String address, int port) {
    public RelayKey {
        if (address == null || address.isBlank()) {
            throw new IllegalArgumentException("address must not be blank");
        }
        if (port < 1 || port > 65_535) {
            throw new IllegalArgumentException("port out of range: " + port);
        }
        address = address.trim().toLowerCase(Locale.ROOT);
    }

    public static RelayKey parse(String hostPort) {
        if (hostPort == null) {
            throw new IllegalArgumentException("host:port must not be null");
        }
        String value = hostPort.trim();
        int sep = value.lastIndexOf(':');
        if (sep <= 0 || sep == value.length() - 1) {
            throw new IllegalArgumentException("Invalid relay address: " + hostPort);
        }
        try {
            return new RelayKey(value.substring(0, sep), Integer.parseInt(value.substring(sep + 1).trim()));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid relay port: " + hostPort, e);
        }
    }

    @Override
    public String toString() {
        return address + ":" + port;
    }
}
