package io.xrelay.dispatch;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record DispatchResult(
        boolean success,
        Integer status,
        String body,
        Map<String, String> headers,
        boolean relayUsed,
        String relayAddress,
        boolean fallbackUsed,
        String error,
        int attempts
) {
    public static DispatchResult viaRelay(DeliveryResult delivery, String relayAddress, int attempts) {
        return new DispatchResult(true, delivery.status(), delivery.body(), delivery.headers(),
                true, relayAddress, false, null, attempts);
    }

    public static DispatchResult viaFallback(DeliveryResult delivery, int attempts) {
        Integer status = delivery.status() > 0 ? delivery.status() : null;
        String error = delivery.success() ? null : "Relay attempts exhausted and direct request failed: " + delivery.error();
        return new DispatchResult(delivery.success(), status, delivery.body(), delivery.headers(),
                false, null, true, error, attempts);
    }

    public static DispatchResult exhausted(int attempts) {
        String error = attempts == 0 ? "No relays available" : "All relay attempts failed";
        return new DispatchResult(false, null, null, Map.of(), false, null, false, error, attempts);
    }
}
