package io.xrelay.feed;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import io.xrelay.model.RawCandidate;
import io.xrelay.util.Jsons;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Turns a feed body into candidates. Malformed lines are skipped; a feed never fails because
 * of a single bad entry.
 */
public final class FeedParser {
    private static final Set<String> RELAY_TYPES = Set.of("http", "https");

    private FeedParser() {
    }

    public static List<RawCandidate> parse(RelaySource source, String body) {
        if (body == null || body.isBlank()) {
            return List.of();
        }
        return source.format() == FeedFormat.JSON_LINES
                ? parseJsonLines(source.name(), body)
                : parseLines(source.name(), body);
    }

    static List<RawCandidate> parseLines(String sourceName, String body) {
        List<RawCandidate> out = new ArrayList<>();
        for (String raw : body.split("\\R")) {
            String line = raw.strip();
            if (line.isEmpty() || line.startsWith("#") || !line.contains(":")) {
                continue;
            }
            // Some lists append country or anonymity columns after the address.
            String token = line.split("\\s+", 2)[0];
            int scheme = token.indexOf("://");
            if (scheme >= 0) {
                token = token.substring(scheme + 3);
            }
            RawCandidate candidate = candidate(sourceName, token);
            if (candidate != null) {
                out.add(candidate);
            }
        }
        return out;
    }

    static List<RawCandidate> parseJsonLines(String sourceName, String body) {
        List<RawCandidate> out = new ArrayList<>();
        for (String raw : body.split("\\R")) {
            String line = raw.strip();
            if (line.isEmpty()) {
                continue;
            }
            JsonNode node;
            try {
                node = Jsons.mapper().readTree(line);
            } catch (JsonProcessingException e) {
                continue;
            }
            String host = node.path("host").asText("").trim();
            int port = node.path("port").asInt(0);
            String type = node.path("type").asText("").trim().toLowerCase(Locale.ROOT);
            if (host.isEmpty() || port < 1 || port > 65_535 || !RELAY_TYPES.contains(type)) {
                continue;
            }
            out.add(new RawCandidate(host, port, sourceName));
        }
        return out;
    }

    private static RawCandidate candidate(String sourceName, String hostPort) {
        int sep = hostPort.indexOf(':');
        if (sep <= 0 || sep == hostPort.length() - 1) {
            return null;
        }
        String host = hostPort.substring(0, sep).trim();
        String portText = hostPort.substring(sep + 1).trim();
        int slash = portText.indexOf('/');
        if (slash >= 0) {
            portText = portText.substring(0, slash);
        }
        try {
            int port = Integer.parseInt(portText);
            if (host.isEmpty() || port < 1 || port > 65_535) {
                return null;
            }
            return new RawCandidate(host, port, sourceName);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
