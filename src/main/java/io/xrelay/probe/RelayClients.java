package io.xrelay.probe;

import java.net.InetSocketAddress;
import java.net.ProxySelector;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reuses one {@link HttpClient} per relay and connect timeout. Clients cannot be closed on this
 * JDK, so the map is bounded and the least recently used client is dropped for collection.
 */
public final class RelayClients {
    public static final int DEFAULT_MAX_CLIENTS = 64;

    private final int maxClients;
    private final Map<String, HttpClient> clients;

    public RelayClients() {
        this(DEFAULT_MAX_CLIENTS);
    }

    public RelayClients(int maxClients) {
        if (maxClients < 1) {
            throw new IllegalArgumentException("maxClients must be >= 1");
        }
        this.maxClients = maxClients;
        this.clients = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, HttpClient> eldest) {
                return size() > RelayClients.this.maxClients;
            }
        };
    }

    public synchronized HttpClient forRelay(String address, int port, long connectTimeoutMs) {
        String key = address + ":" + port + "@" + connectTimeoutMs;
        return clients.computeIfAbsent(key, k -> HttpClient.newBuilder()
                .proxy(ProxySelector.of(new InetSocketAddress(address, port)))
                .connectTimeout(Duration.ofMillis(connectTimeoutMs))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build());
    }

    public synchronized int size() {
        return clients.size();
    }
}
