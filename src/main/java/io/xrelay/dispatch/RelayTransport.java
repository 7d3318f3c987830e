package io.xrelay.dispatch;

import io.xrelay.model.RelayHandle;
import io.xrelay.probe.ProbeResult;

/**
 * Network seam of the dispatcher. Implementations bound every call by the given timeout and
 * report failures as values.
 */
public interface RelayTransport {
    DeliveryResult sendViaRelay(OutboundRequest request, RelayHandle relay, long timeoutMs);

    DeliveryResult sendDirect(OutboundRequest request, long timeoutMs);

    /** Lightweight pre-use check that the relay answers at all. */
    ProbeResult checkReachable(RelayHandle relay, long timeoutMs);
}
