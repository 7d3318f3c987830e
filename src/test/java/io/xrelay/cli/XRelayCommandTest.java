package io.xrelay.cli;

import com.fasterxml.jackson.databind.JsonNode;
import io.xrelay.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

final class XRelayCommandTest {

    @Test
    void initStatusAndSweepWorkOffline() throws Exception {
        Path root = Files.createTempDirectory("xrelay-test-cli-");
        try {
            String db = "jdbc:sqlite:" + root.resolve("xrelay.db").toAbsolutePath();

            String init = run("--root", root.toString(), "--db", db, "init");
            Assertions.assertTrue(init.contains("store=durable"), init);

            JsonNode status = Jsons.mapper().readTree(run("--root", root.toString(), "--db", db, "status"));
            Assertions.assertEquals("durable", status.path("pool").path("mode").asText());
            Assertions.assertEquals(0, status.path("deprecated").path("total").asInt());

            JsonNode sweep = Jsons.mapper().readTree(run("--root", root.toString(), "--db", db, "sweep", "--retention-days", "10"));
            Assertions.assertEquals(10, sweep.path("retentionDays").asInt());
            Assertions.assertEquals(0, sweep.path("deleted").asInt());

            JsonNode migrations = Jsons.mapper().readTree(run("--root", root.toString(), "--db", db, "schema-migrations"));
            Assertions.assertEquals(2, migrations.size());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void unknownSubcommandIsAUsageError() {
        int code = new CommandLine(new XRelayCommand()).execute("explode");
        Assertions.assertNotEquals(0, code);
    }

    private static String run(String... args) {
        PrintStream original = System.out;
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        System.setOut(new PrintStream(buffer, true, StandardCharsets.UTF_8));
        try {
            int code = new CommandLine(new XRelayCommand()).execute(args);
            Assertions.assertEquals(0, code);
        } finally {
            System.setOut(original);
        }
        return buffer.toString(StandardCharsets.UTF_8);
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
