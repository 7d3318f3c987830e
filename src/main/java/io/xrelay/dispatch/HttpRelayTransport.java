package io.xrelay.dispatch;

import io.xrelay.model.RawCandidate;
import io.xrelay.model.RelayHandle;
import io.xrelay.probe.ProbeResult;
import io.xrelay.probe.RelayClients;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;

/**
 * {@link RelayTransport} on {@link HttpClient}. Each relay gets its own cached client configured
 * with the relay as HTTP proxy; direct requests share one client.
 */
public final class HttpRelayTransport implements RelayTransport {
    // HttpClient rejects these as request headers.
    private static final Set<String> RESTRICTED_HEADERS = Set.of(
            "connection", "content-length", "expect", "host", "upgrade", "keep-alive", "transfer-encoding"
    );

    private final URI probeUri;
    private final RelayClients relayClients;
    private final HttpClient direct;

    public HttpRelayTransport(String probeUrl) {
        this(probeUrl, new RelayClients());
    }

    public HttpRelayTransport(String probeUrl, RelayClients relayClients) {
        this.probeUri = URI.create(probeUrl);
        this.relayClients = relayClients;
        this.direct = HttpClient.newBuilder()
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    @Override
    public DeliveryResult sendViaRelay(OutboundRequest request, RelayHandle relay, long timeoutMs) {
        return send(relayClient(relay, timeoutMs), request, timeoutMs);
    }

    @Override
    public DeliveryResult sendDirect(OutboundRequest request, long timeoutMs) {
        return send(direct, request, timeoutMs);
    }

    @Override
    public ProbeResult checkReachable(RelayHandle relay, long timeoutMs) {
        RawCandidate candidate = new RawCandidate(relay.address(), relay.port(), relay.source());
        long started = System.nanoTime();
        HttpRequest probe = HttpRequest.newBuilder(probeUri)
                .timeout(Duration.ofMillis(timeoutMs))
                .method("HEAD", HttpRequest.BodyPublishers.noBody())
                .build();
        try {
            HttpResponse<Void> response = relayClient(relay, timeoutMs).send(probe, HttpResponse.BodyHandlers.discarding());
            if (response.statusCode() / 100 != 2) {
                return ProbeResult.unreachable(candidate, "HTTP " + response.statusCode());
            }
            return ProbeResult.reachable(candidate, TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started));
        } catch (HttpTimeoutException e) {
            return ProbeResult.unreachable(candidate, "timeout");
        } catch (IOException e) {
            return ProbeResult.unreachable(candidate, describe(e));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ProbeResult.unreachable(candidate, "interrupted");
        }
    }

    private HttpClient relayClient(RelayHandle relay, long timeoutMs) {
        return relayClients.forRelay(relay.address(), relay.port(), timeoutMs);
    }

    private static DeliveryResult send(HttpClient client, OutboundRequest request, long timeoutMs) {
        HttpRequest httpRequest;
        try {
            httpRequest = buildRequest(request, timeoutMs);
        } catch (IllegalArgumentException e) {
            return DeliveryResult.failed("invalid request: " + e.getMessage());
        }
        try {
            HttpResponse<String> response = client.send(httpRequest, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
            Map<String, String> headers = flatten(response.headers().map());
            if (response.statusCode() / 100 != 2) {
                return DeliveryResult.rejected(response.statusCode(), response.body(), headers);
            }
            return DeliveryResult.ok(response.statusCode(), response.body(), headers);
        } catch (HttpTimeoutException e) {
            return DeliveryResult.failed("timeout after " + timeoutMs + "ms");
        } catch (IOException e) {
            return DeliveryResult.failed(describe(e));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return DeliveryResult.failed("interrupted");
        }
    }

    static HttpRequest buildRequest(OutboundRequest request, long timeoutMs) {
        HttpRequest.BodyPublisher publisher = request.sendsBody()
                ? HttpRequest.BodyPublishers.ofString(request.body(), StandardCharsets.UTF_8)
                : HttpRequest.BodyPublishers.noBody();
        HttpRequest.Builder builder = HttpRequest.newBuilder(URI.create(request.url()))
                .timeout(Duration.ofMillis(timeoutMs))
                .method(request.method(), publisher);
        for (Map.Entry<String, String> header : request.headers().entrySet()) {
            if (RESTRICTED_HEADERS.contains(header.getKey().toLowerCase(Locale.ROOT))) {
                continue;
            }
            builder.header(header.getKey(), header.getValue());
        }
        return builder.build();
    }

    private static Map<String, String> flatten(Map<String, List<String>> multi) {
        Map<String, String> out = new LinkedHashMap<>();
        for (Map.Entry<String, List<String>> entry : multi.entrySet()) {
            if (entry.getKey() == null || entry.getKey().startsWith(":") || entry.getValue().isEmpty()) {
                continue;
            }
            out.put(entry.getKey(), String.join(", ", entry.getValue()));
        }
        return out;
    }

    private static String describe(IOException e) {
        return e.getMessage() == null || e.getMessage().isBlank() ? e.getClass().getSimpleName() : e.getMessage();
    }
}
