package io.xrelay.gateway;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import io.xrelay.config.PoolSettings;
import io.xrelay.dispatch.DispatchMode;
import io.xrelay.dispatch.DispatchResult;
import io.xrelay.dispatch.OutboundRequest;
import io.xrelay.runtime.XRelayRuntime;
import io.xrelay.security.SensitiveDataMasker;
import io.xrelay.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * HTTP entry point: {@code POST /relay} forwards a JSON-described request through the pool,
 * {@code GET /status} reports the pool and {@code GET /metrics} exposes Prometheus text.
 */
public final class GatewayHandler {
    private static final Logger LOG = LoggerFactory.getLogger(GatewayHandler.class);
    static final String API_KEY_HEADER = "x-api-key";

    private final XRelayRuntime runtime;
    private final UrlValidator urlValidator;
    private final RateLimiter rateLimiter;
    private final ResponseCache<DispatchResult> cache;
    private final List<String> apiKeys;
    private final long maxRequestBytes;

    public GatewayHandler(XRelayRuntime runtime) {
        this(runtime, runtime.settings());
    }

    private GatewayHandler(XRelayRuntime runtime, PoolSettings settings) {
        this(runtime,
                new UrlValidator(settings.allowedDomains()),
                new RateLimiter(settings.globalRateLimit(), settings.keyRateLimit(), settings.rateWindowMs()),
                new ResponseCache<>(settings.cacheTtlMs(), settings.cacheMaxEntries()),
                settings.apiKeys(),
                settings.maxRequestBytes());
    }

    public GatewayHandler(
            XRelayRuntime runtime,
            UrlValidator urlValidator,
            RateLimiter rateLimiter,
            ResponseCache<DispatchResult> cache,
            List<String> apiKeys,
            long maxRequestBytes
    ) {
        this.runtime = runtime;
        this.urlValidator = urlValidator;
        this.rateLimiter = rateLimiter;
        this.cache = cache;
        this.apiKeys = List.copyOf(apiKeys);
        this.maxRequestBytes = maxRequestBytes;
    }

    public void install(HttpServer server) {
        server.createContext("/relay", exchange -> guarded(exchange, this::handleRelay));
        server.createContext("/status", exchange -> guarded(exchange, this::handleStatus));
        server.createContext("/metrics", exchange -> guarded(exchange, this::handleMetrics));
    }

    /** Housekeeping for the fixed windows and the response cache. */
    public void cleanupExpired() {
        int windows = rateLimiter.cleanupExpired();
        int entries = cache.cleanupExpired();
        LOG.debug("Gateway cleanup removed {} rate windows and {} cache entries", windows, entries);
    }

    private void guarded(HttpExchange exchange, ExchangeHandler handler) throws IOException {
        try {
            handler.handle(exchange);
        } catch (RuntimeException e) {
            LOG.warn("Gateway request {} {} failed", exchange.getRequestMethod(), exchange.getRequestURI().getPath(), e);
            writeJson(exchange, error("Internal server error", "INTERNAL_ERROR"), 500);
        } finally {
            exchange.close();
        }
    }

    void handleRelay(HttpExchange exchange) throws IOException {
        if (!authorized(exchange)) {
            writeJson(exchange, error("Unauthorized", "INVALID_API_KEY"), 401);
            return;
        }
        RateLimiter.Decision global = rateLimiter.checkGlobal();
        if (!global.allowed()) {
            writeRateLimited(exchange, "Rate limit exceeded. Please try again later.", "RATE_LIMIT_GLOBAL", global);
            return;
        }
        RateLimiter.Decision perClient = rateLimiter.checkByKey(clientKey(exchange));
        if (!perClient.allowed()) {
            writeRateLimited(exchange, "Rate limit exceeded for your IP.", "RATE_LIMIT_IP", perClient);
            return;
        }
        if (!"POST".equalsIgnoreCase(exchange.getRequestMethod())) {
            Map<String, Object> body = error("Method not allowed", "METHOD_NOT_ALLOWED");
            body.put("allowedMethods", List.of("POST"));
            exchange.getResponseHeaders().set("Allow", "POST");
            writeJson(exchange, body, 405);
            return;
        }
        byte[] raw = readLimited(exchange.getRequestBody(), maxRequestBytes);
        if (raw == null) {
            Map<String, Object> body = error("Request body too large", "REQUEST_TOO_LARGE");
            body.put("maxSize", maxRequestBytes);
            writeJson(exchange, body, 413);
            return;
        }
        JsonNode json;
        try {
            json = Jsons.mapper().readTree(new String(raw, StandardCharsets.UTF_8));
        } catch (JsonProcessingException e) {
            writeJson(exchange, error("Invalid JSON body", "INVALID_JSON"), 400);
            return;
        }
        if (json == null || !json.isObject()) {
            writeJson(exchange, error("Invalid JSON body", "INVALID_JSON"), 400);
            return;
        }
        String url = json.path("url").asText("").trim();
        if (url.isEmpty()) {
            writeJson(exchange, error("URL is required", "MISSING_URL"), 400);
            return;
        }
        UrlValidator.Validation validation = urlValidator.validate(url);
        if (!validation.valid()) {
            Map<String, Object> body = error("Invalid URL", "INVALID_URL");
            body.put("reason", validation.reason());
            writeJson(exchange, body, 400);
            return;
        }
        OutboundRequest request = new OutboundRequest(
                url,
                json.path("method").asText("GET"),
                headers(json.path("headers")),
                json.hasNonNull("body") ? json.path("body").asText() : null
        );
        boolean useCache = json.path("useCache").asBoolean(true);
        if (useCache) {
            Optional<DispatchResult> cached = cache.get(request.method(), request.url());
            if (cached.isPresent()) {
                LOG.debug("Cache hit for {} {}", request.method(), SensitiveDataMasker.maskUrl(request.url()));
                writeJson(exchange, cached.get(), 200);
                return;
            }
        }
        DispatchResult result = runtime.dispatch(request, runtime.defaultPolicy().withMode(DispatchMode.PARALLEL));
        if (useCache && result.success()) {
            cache.put(request.method(), request.url(), result);
        }
        writeJson(exchange, result, 200);
    }

    void handleStatus(HttpExchange exchange) throws IOException {
        if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
            writeJson(exchange, error("Method not allowed", "METHOD_NOT_ALLOWED"), 405);
            return;
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("pool", runtime.poolStatus());
        body.put("deprecated", runtime.deprecatedStats());
        body.put("cacheSize", cache.size());
        writeJson(exchange, body, 200);
    }

    void handleMetrics(HttpExchange exchange) throws IOException {
        if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
            writeJson(exchange, error("Method not allowed", "METHOD_NOT_ALLOWED"), 405);
            return;
        }
        byte[] bytes = runtime.metricsText().getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", "text/plain; version=0.0.4; charset=utf-8");
        exchange.sendResponseHeaders(200, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    private boolean authorized(HttpExchange exchange) {
        if (apiKeys.isEmpty()) {
            return true;
        }
        String presented = exchange.getRequestHeaders().getFirst(API_KEY_HEADER);
        return presented != null && apiKeys.contains(presented.trim());
    }

    static String clientKey(HttpExchange exchange) {
        String forwarded = exchange.getRequestHeaders().getFirst("x-forwarded-for");
        if (forwarded != null && !forwarded.isBlank()) {
            String first = forwarded.split(",")[0].trim();
            if (!first.isEmpty()) {
                return first;
            }
        }
        String realIp = exchange.getRequestHeaders().getFirst("x-real-ip");
        if (realIp != null && !realIp.isBlank()) {
            return realIp.trim();
        }
        InetSocketAddress remote = exchange.getRemoteAddress();
        if (remote == null) {
            return "unknown";
        }
        return remote.getAddress() == null ? remote.getHostString() : remote.getAddress().getHostAddress();
    }

    private static Map<String, String> headers(JsonNode node) {
        Map<String, String> out = new LinkedHashMap<>();
        if (node == null || !node.isObject()) {
            return out;
        }
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (!field.getValue().isNull()) {
                out.put(field.getKey(), field.getValue().asText());
            }
        }
        return out;
    }

    /** @return the body, or null when it exceeds {@code limit} bytes */
    private static byte[] readLimited(InputStream in, long limit) throws IOException {
        byte[] bytes = in.readNBytes((int) Math.min(Integer.MAX_VALUE - 8L, limit + 1L));
        return bytes.length > limit ? null : bytes;
    }

    private static void writeRateLimited(HttpExchange exchange, String message, String code,
                                         RateLimiter.Decision decision) throws IOException {
        Map<String, Object> body = error(message, code);
        body.put("retryAfter", decision.retryAfterSeconds());
        exchange.getResponseHeaders().set("Retry-After", Long.toString(decision.retryAfterSeconds()));
        writeJson(exchange, body, 429);
    }

    private static Map<String, Object> error(String message, String code) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", message);
        body.put("code", code);
        return body;
    }

    private static void writeJson(HttpExchange exchange, Object body, int status) throws IOException {
        byte[] bytes = Jsons.toCompactJson(body).getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", "application/json; charset=utf-8");
        exchange.getResponseHeaders().set("Cache-Control", "no-cache");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    @FunctionalInterface
    private interface ExchangeHandler {
        void handle(HttpExchange exchange) throws IOException;
    }
}
