package io.xrelay.dispatch;

import java.util.Map;

/**
 * Outcome of one network delivery, through a relay or direct. Failures are values, not exceptions.
 */
public record DeliveryResult(boolean success, int status, String body, Map<String, String> headers, String error) {
    public DeliveryResult {
        headers = headers == null ? Map.of() : Map.copyOf(headers);
    }

    public static DeliveryResult ok(int status, String body, Map<String, String> headers) {
        return new DeliveryResult(true, status, body, headers, null);
    }

    public static DeliveryResult rejected(int status, String body, Map<String, String> headers) {
        return new DeliveryResult(false, status, body, headers, "HTTP " + status);
    }

    public static DeliveryResult failed(String reason) {
        return new DeliveryResult(false, 0, null, Map.of(), reason == null ? "unknown" : reason);
    }
}
