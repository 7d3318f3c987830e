package io.xrelay.observability;

import com.fasterxml.jackson.databind.JsonNode;
import io.xrelay.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

final class AuditLoggerTest {

    @Test
    void appendsOneMaskedJsonObjectPerLine() throws Exception {
        Path root = Files.createTempDirectory("xrelay-test-audit-");
        try {
            AuditLogger audit = new AuditLogger(root.resolve("audit").resolve("audit.log"));
            Map<String, Object> headers = new LinkedHashMap<>();
            headers.put("Authorization", "Bearer secret-value");
            headers.put("Accept", "application/json");
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("relay", "198.51.100.1:8080");
            details.put("headers", headers);
            details.put("apiKey", "k-123");

            audit.log(AuditLogger.AuditEvent.of("dispatch.complete", "GET https://a.example/", "ok", details));
            audit.log(AuditLogger.AuditEvent.of("pool.refill", "relay-pool", "ok", null));

            List<String> lines = Files.readAllLines(audit.auditFile(), StandardCharsets.UTF_8);
            Assertions.assertEquals(2, lines.size());
            JsonNode first = Jsons.mapper().readTree(lines.get(0));
            Assertions.assertEquals("dispatch.complete", first.path("action").asText());
            Assertions.assertEquals("198.51.100.1:8080", first.path("details").path("relay").asText());
            Assertions.assertEquals("***", first.path("details").path("headers").path("Authorization").asText());
            Assertions.assertEquals("application/json", first.path("details").path("headers").path("Accept").asText());
            Assertions.assertEquals("***", first.path("details").path("apiKey").asText());
            Assertions.assertFalse(lines.get(0).contains("secret-value"));
            Assertions.assertTrue(first.hasNonNull("timestamp"));
        } finally {
            deleteRecursively(root);
        }
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
