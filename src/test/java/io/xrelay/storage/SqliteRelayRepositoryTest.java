package io.xrelay.storage;

import io.xrelay.model.RawCandidate;
import io.xrelay.model.RelayKey;
import io.xrelay.model.StoreMode;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Random;
import java.util.stream.Stream;

final class SqliteRelayRepositoryTest extends RelayRepositoryContract {
    private Path root;
    private Database database;
    private SqliteRelayRepository repo;

    @BeforeEach
    void setUp() throws IOException {
        root = Files.createTempDirectory("xrelay-test-sqlite-");
        database = Database.sqliteFile(root.resolve("db").resolve("xrelay.db"));
        database.init();
        repo = new SqliteRelayRepository(database, THRESHOLD, new Random(5L));
    }

    @AfterEach
    void tearDown() throws IOException {
        deleteRecursively(root);
    }

    @Override
    RelayRepository repository() {
        return repo;
    }

    @Test
    void reportsDurableModeAndRecordsMigrations() {
        Assertions.assertEquals(StoreMode.DURABLE, repo.mode());
        List<Database.SchemaMigrationRow> rows = database.listSchemaMigrations(10);
        Assertions.assertEquals(2, rows.size());
        for (Database.SchemaMigrationRow row : rows) {
            Assertions.assertTrue(row.success());
        }
    }

    @Test
    void initIsIdempotent() {
        database.init();
        Assertions.assertEquals(2, database.listSchemaMigrations(10).size());
    }

    @Test
    void stateIsSharedBetweenInstancesOnTheSameFile() {
        repo.upsertMany(List.of(new RawCandidate("10.0.0.1", 8080, "feed-a")), NOW);
        SqliteRelayRepository other = new SqliteRelayRepository(database, THRESHOLD, new Random(9L));
        RelayKey key = new RelayKey("10.0.0.1", 8080);

        repo.reportFailure(key, NOW + 1L);
        other.reportFailure(key, NOW + 2L);
        RelayRepository.FailureOutcome third = other.reportFailure(key, NOW + 3L);

        Assertions.assertTrue(third.deprecated());
        Assertions.assertTrue(repo.isDeprecated(key));
        Assertions.assertEquals(0, repo.count());
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
