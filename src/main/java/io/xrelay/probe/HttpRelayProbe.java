package io.xrelay.probe;

import io.xrelay.model.RawCandidate;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Probes a relay by fetching a small, stable endpoint through it. Any non-2xx answer, timeout or
 * connection error marks the relay unreachable.
 */
public final class HttpRelayProbe implements RelayProbe {
    private final URI probeUri;
    private final long timeoutMs;
    private final RelayClients relayClients;

    public HttpRelayProbe(String probeUrl, long timeoutMs) {
        this(probeUrl, timeoutMs, new RelayClients());
    }

    public HttpRelayProbe(String probeUrl, long timeoutMs, RelayClients relayClients) {
        if (timeoutMs <= 0L) {
            throw new IllegalArgumentException("timeoutMs must be > 0");
        }
        this.probeUri = URI.create(probeUrl);
        this.timeoutMs = timeoutMs;
        this.relayClients = relayClients;
    }

    @Override
    public ProbeResult probe(RawCandidate candidate) {
        long started = System.nanoTime();
        HttpClient http = relayClients.forRelay(candidate.address(), candidate.port(), timeoutMs);
        HttpRequest request = HttpRequest.newBuilder(probeUri)
                .timeout(Duration.ofMillis(timeoutMs))
                .header("User-Agent", "xrelay-probe")
                .GET()
                .build();
        try {
            HttpResponse<Void> response = http.send(request, HttpResponse.BodyHandlers.discarding());
            long latency = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);
            if (response.statusCode() / 100 != 2) {
                return ProbeResult.unreachable(candidate, "HTTP " + response.statusCode());
            }
            return ProbeResult.reachable(candidate, latency);
        } catch (HttpTimeoutException e) {
            return ProbeResult.unreachable(candidate, "timeout");
        } catch (IOException e) {
            return ProbeResult.unreachable(candidate, e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ProbeResult.unreachable(candidate, "interrupted");
        }
    }
}
