package pacer.adapter.out.ratelimit.sqlite;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.sql.DriverManager;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import pacer.core.exception.StoreDestroyedException;
import pacer.core.exception.TableNotFoundException;
import pacer.core.model.ratelimit.Cooldown;
import pacer.core.model.ratelimit.RequestRecord;
import pacer.core.model.ratelimit.SlotClaim;
import pacer.core.port.out.CooldownRepository;
import pacer.core.port.out.RateLimitRepository;
import pacer.core.port.out.RateLimitRepositoryContractTest;
import pacer.spi.StorageAdapterConfig;

@DisplayName("SqliteRateLimitRepository")
class SqliteRateLimitRepositoryTest extends RateLimitRepositoryContractTest {

    @TempDir
    Path tempDir;

    private SqliteDatabase database;

    @Override
    protected RateLimitRepository createRepository() {
        database = openWithSchema(tempDir.resolve("rate-limits.db"));
        return new SqliteRateLimitRepository(database);
    }

    @Override
    protected CooldownRepository createCooldownRepository() {
        return new SqliteCooldownRepository(database);
    }

    @AfterEach
    void closeDatabase() {
        if (database != null) {
            database.close();
        }
    }

    private static SqliteDatabase openWithSchema(Path path) {
        var opened = SqliteDatabase.open(path.toString(), Duration.ofSeconds(5));
        opened.execute(connection -> {
            SqliteSchema.create(connection);
            return null;
        });
        return opened;
    }

    @Nested
    @DisplayName("Missing tables")
    class MissingTableTests {

        @Test
        @DisplayName("should report a dropped records table by name")
        void shouldReportDroppedRecordsTable() {
            database.execute(connection -> {
                try (var statement = connection.createStatement()) {
                    statement.executeUpdate("DROP TABLE rate_limits");
                }
                return null;
            });

            var failure = assertThrows(
                    TableNotFoundException.class, () -> await(repository.countSince("a", null, now - 1000)));

            assertEquals("rate_limits", failure.tableName());
            assertTrue(failure.getMessage().contains("pacer.rate-limit.sqlite.create-schema"));
        }

        @Test
        @DisplayName("should report a dropped slots table on acquire")
        void shouldReportDroppedSlotsTable() {
            database.execute(connection -> {
                try (var statement = connection.createStatement()) {
                    statement.executeUpdate("DROP TABLE rate_limit_slots");
                }
                return null;
            });
            var claim = new SlotClaim("a", SlotClaim.DEFAULT_SCOPE, 0, now, now + 60_000);

            var failure = assertThrows(
                    TableNotFoundException.class,
                    () -> await(repository.claimSlot(claim, RequestRecord.create("a", now, null), CONFIG)));

            assertEquals("rate_limit_slots", failure.tableName());
            assertFalse(repository.isConditionalConflict(failure));
        }
    }

    @Nested
    @DisplayName("Persistence")
    class PersistenceTests {

        @Test
        @DisplayName("should keep records across database instances")
        void shouldKeepRecordsAcrossInstances() {
            var path = tempDir.resolve("shared.db");
            var first = openWithSchema(path);
            await(new SqliteRateLimitRepository(first).insert(RequestRecord.create("a", now, null), CONFIG));
            first.close();

            var second = openWithSchema(path);
            try {
                assertEquals(1L, await(new SqliteRateLimitRepository(second).countSince("a", null, now - 1000)));
            } finally {
                second.close();
            }
        }

        @Test
        @DisplayName("should fail with StoreDestroyedException once closed")
        void shouldFailOnceClosed() {
            repository.close();

            assertThrows(StoreDestroyedException.class, () -> await(repository.countSince("a", null, now)));
        }

        @Test
        @DisplayName("should not close a caller-owned connection")
        void shouldNotCloseWrappedConnection() throws Exception {
            try (var connection = DriverManager.getConnection("jdbc:sqlite::memory:")) {
                var wrapped = SqliteDatabase.wrap(connection);
                wrapped.execute(c -> {
                    SqliteSchema.create(c);
                    return null;
                });
                var wrappedRepository = new SqliteRateLimitRepository(wrapped);
                await(wrappedRepository.insert(RequestRecord.create("a", now, null), CONFIG));

                wrappedRepository.close();

                assertFalse(connection.isClosed());
            }
        }
    }

    @Nested
    @DisplayName("Statistics and cleanup")
    class StatisticsAndCleanupTests {

        @Test
        @DisplayName("should count stored records per resource")
        void shouldCountByResource() {
            await(repository.insert(RequestRecord.create("a", now, null), CONFIG));
            await(repository.insert(RequestRecord.create("a", now - 120_000, null), CONFIG));
            await(repository.insert(RequestRecord.create("b", now, null), CONFIG));

            assertEquals(Map.of("a", 2L, "b", 1L), await(repository.countByResource()));
            assertEquals(Set.of("a", "b"), await(repository.findResources()));
        }

        @Test
        @DisplayName("should delete old records and expired slots")
        void shouldDeleteOldRecordsAndExpiredSlots() {
            await(repository.claimSlot(
                    new SlotClaim("a", SlotClaim.DEFAULT_SCOPE, 0, now - 120_000, now - 60_000),
                    RequestRecord.create("a", now - 120_000, null),
                    CONFIG));
            await(repository.insert(RequestRecord.create("a", now, null), CONFIG));

            assertEquals(1L, await(repository.deleteOlderThan("a", now - 60_000)));
            assertEquals(1L, await(repository.deleteExpiredSlots(now)));
            assertEquals(1L, await(repository.countSince("a", null, 0)));
        }

        @Test
        @DisplayName("should delete expired cooldowns")
        void shouldDeleteExpiredCooldowns() {
            await(cooldownRepository.save(new Cooldown("expired", now - 1), now));
            await(cooldownRepository.save(new Cooldown("active", now + 60_000), now));

            assertEquals(1L, await(cooldownRepository.deleteExpired(now)));
            assertEquals(Optional.empty(), await(cooldownRepository.find("expired")));
        }
    }

    @Nested
    @DisplayName("SqliteRateLimitStoreProvider")
    class ProviderTests {

        @Test
        @DisplayName("should be unavailable without a database path")
        void shouldBeUnavailableWithoutDatabase() {
            StorageAdapterConfig empty = key -> Optional.empty();

            assertFalse(new SqliteRateLimitStoreProvider().isAvailable(empty));
        }

        @Test
        @DisplayName("should share one database between both repositories")
        void shouldShareDatabase() {
            var path = tempDir.resolve("provider.db").toString();
            StorageAdapterConfig config = key -> Optional.ofNullable(
                    Map.of(SqliteRateLimitStoreProvider.DATABASE, path).get(key));
            var provider = new SqliteRateLimitStoreProvider();

            assertTrue(provider.isAvailable(config));
            var records = provider.createRateLimitRepository(config);
            var cooldowns = provider.createCooldownRepository(config);
            try {
                await(records.insert(RequestRecord.create("a", now, null), CONFIG));
                await(cooldowns.save(new Cooldown("origin", now + 1000), now));

                assertEquals(1L, await(records.countSince("a", null, now - 1000)));
                assertTrue(await(cooldowns.find("origin")).isPresent());
            } finally {
                records.close();
            }

            var failure = assertThrows(RuntimeException.class, () -> await(cooldowns.find("origin")));
            assertInstanceOf(StoreDestroyedException.class, failure);
        }
    }
}
