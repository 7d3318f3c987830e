package io.xrelay.dispatch;

import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Request to deliver to a target URL. The body is sent only for methods that carry one.
 */
public record OutboundRequest(String url, String method, Map<String, String> headers, String body) {
    private static final Set<String> BODY_METHODS = Set.of("POST", "PUT", "PATCH");

    public OutboundRequest {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("url must not be blank");
        }
        url = url.trim();
        method = method == null || method.isBlank() ? "GET" : method.trim().toUpperCase(Locale.ROOT);
        headers = headers == null ? Map.of() : Map.copyOf(headers);
    }

    public static OutboundRequest get(String url) {
        return new OutboundRequest(url, "GET", Map.of(), null);
    }

    public boolean sendsBody() {
        return body != null && BODY_METHODS.contains(method);
    }

    public String cacheKey() {
        return method + ":" + url;
    }
}
