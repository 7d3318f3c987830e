package io.xrelay.observability;

import io.xrelay.runtime.XRelayRuntime;

import java.util.Map;

public final class PrometheusFormatter {
    private PrometheusFormatter() {
    }

    public static String format(XRelayRuntime.PoolStatus status) {
        StringBuilder sb = new StringBuilder();
        appendGauge(sb, "xrelay_pool_available", "Relays currently selectable", "mode", status.mode(), status.availableCount());
        appendGauge(sb, "xrelay_pool_deprecated", "Relays retired after repeated failures", null, null, status.deprecatedCount());
        appendGauge(sb, "xrelay_pool_refresh_total", "Completed pool refills", null, null, status.refreshTotal());
        appendGauge(sb, "xrelay_pool_last_refresh_ms", "Epoch millis of the last completed refill", null, null, status.lastRefreshTime());
        appendGauge(sb, "xrelay_pool_refilling", "Refill in flight (1=yes,0=no)", null, null, status.refilling() ? 1L : 0L);
        appendMapGauge(sb, "xrelay_dispatch_total", "Dispatches grouped by outcome", "outcome", status.dispatchTotals());
        return sb.toString();
    }

    private static void appendMapGauge(StringBuilder sb, String metric, String help, String label, Map<String, Long> values) {
        sb.append("# HELP ").append(metric).append(" ").append(help).append('\n');
        sb.append("# TYPE ").append(metric).append(" gauge").append('\n');
        for (Map.Entry<String, Long> e : values.entrySet()) {
            sb.append(metric).append('{')
                    .append(label).append("=\"").append(escapeLabel(e.getKey())).append("\"}")
                    .append(' ').append(e.getValue()).append('\n');
        }
    }

    private static void appendGauge(StringBuilder sb, String metric, String help, String label, String labelValue, long value) {
        sb.append("# HELP ").append(metric).append(" ").append(help).append('\n');
        sb.append("# TYPE ").append(metric).append(" gauge").append('\n');
        sb.append(metric);
        if (label != null && labelValue != null) {
            sb.append('{').append(label).append("=\"").append(escapeLabel(labelValue)).append("\"}");
        }
        sb.append(' ').append(value).append('\n');
    }

    private static String escapeLabel(String v) {
        return v.replace("\\", "\\\\").replace("\"", "\\\"");
    }
}
