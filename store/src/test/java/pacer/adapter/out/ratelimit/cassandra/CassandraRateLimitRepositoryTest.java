package pacer.adapter.out.ratelimit.cassandra;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.function.Supplier;

import com.datastax.oss.driver.api.core.ConsistencyLevel;
import com.datastax.oss.driver.api.core.CqlSession;
import com.datastax.oss.driver.api.core.cql.PreparedStatement;
import com.datastax.oss.driver.api.core.metadata.Node;
import com.datastax.oss.driver.api.core.servererrors.CASWriteUnknownException;
import com.datastax.oss.driver.api.core.servererrors.DefaultWriteType;
import com.datastax.oss.driver.api.core.servererrors.InvalidQueryException;
import com.datastax.oss.driver.api.core.servererrors.WriteTimeoutException;
import io.smallrye.mutiny.Uni;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import pacer.core.exception.SlotClaimConflictException;
import pacer.core.exception.StoreDestroyedException;
import pacer.core.exception.TableNotFoundException;
import pacer.core.model.ratelimit.Cooldown;
import pacer.core.model.ratelimit.Priority;
import pacer.core.model.ratelimit.RateLimitConfig;
import pacer.core.model.ratelimit.RequestRecord;
import pacer.core.model.ratelimit.SlotClaim;
import pacer.core.port.out.StoreCapability;

@ExtendWith(MockitoExtension.class)
@DisplayName("CassandraRateLimitRepository")
class CassandraRateLimitRepositoryTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);
    private static final RateLimitConfig CONFIG = new RateLimitConfig(5, 60_000L);
    private static final String TABLE = "rate_limit_items";

    @Mock
    private CqlSession session;

    @Mock
    private Node node;

    private CassandraQueries queries;
    private CassandraRateLimitRepository repository;
    private CassandraCooldownRepository cooldownRepository;

    @BeforeEach
    void setUp() {
        queries = new CassandraQueries(session, TABLE, false, Runnable::run);
        repository = new CassandraRateLimitRepository(queries);
        cooldownRepository = new CassandraCooldownRepository(queries);
    }

    private void tableIsMissing() {
        when(session.prepareAsync(anyString()))
                .thenAnswer(invocation -> CompletableFuture.<PreparedStatement>failedFuture(
                        new InvalidQueryException(node, "unconfigured table " + TABLE)));
    }

    private static <T> T await(Uni<T> uni) {
        return uni.await().atMost(TIMEOUT);
    }

    private static void assertTableNotFound(Supplier<Uni<?>> operation) {
        var failure = assertThrows(TableNotFoundException.class, () -> await(operation.get()));
        assertEquals(TABLE, failure.tableName());
        assertTrue(failure.getMessage().contains("pacer.rate-limit.cassandra.run-migrations=true"));
    }

    @Nested
    @DisplayName("Missing table")
    class MissingTableTests {

        @Test
        @DisplayName("should report the missing table from every record operation")
        void shouldReportMissingTableFromRecordOperations() {
            tableIsMissing();
            var now = System.currentTimeMillis();

            assertTableNotFound(() -> repository.insert(RequestRecord.create("a", now, null), CONFIG));
            assertTableNotFound(() -> repository.insert(RequestRecord.create("a", now, Priority.USER), CONFIG));
            assertTableNotFound(() -> repository.countSince("a", null, now));
            assertTableNotFound(() -> repository.countSince("a", Priority.BACKGROUND, now));
            assertTableNotFound(() -> repository.findOldestSince("a", null, now));
            assertTableNotFound(() -> repository.findRecentTimestamps("a", Priority.USER, now, 10));
            assertTableNotFound(() -> repository.claimSlot(
                    new SlotClaim("a", SlotClaim.DEFAULT_SCOPE, 0, now, now + 60_000),
                    RequestRecord.create("a", now, null),
                    CONFIG));
            assertTableNotFound(() -> repository.deleteResource("a"));
            assertTableNotFound(() -> repository.deleteAll());
        }

        @Test
        @DisplayName("should report the missing table from every cooldown operation")
        void shouldReportMissingTableFromCooldownOperations() {
            tableIsMissing();
            var now = System.currentTimeMillis();

            assertTableNotFound(() -> cooldownRepository.find("origin"));
            assertTableNotFound(() -> cooldownRepository.save(new Cooldown("origin", now + 1000), now));
            assertTableNotFound(() -> cooldownRepository.delete("origin"));
            assertTableNotFound(() -> cooldownRepository.deleteAll());
        }

        @Test
        @DisplayName("should not treat a missing table as a slot conflict")
        void shouldNotTreatMissingTableAsConflict() {
            tableIsMissing();
            var now = System.currentTimeMillis();

            var failure = assertThrows(TableNotFoundException.class, () -> await(repository.claimSlot(
                    new SlotClaim("a", SlotClaim.DEFAULT_SCOPE, 0, now, now + 60_000),
                    RequestRecord.create("a", now, null),
                    CONFIG)));

            assertFalse(repository.isConditionalConflict(failure));
        }

        @Test
        @DisplayName("should translate a missing keyspace to the configured table")
        void shouldTranslateMissingKeyspace() {
            var translated = CassandraErrors.translate(
                    new CompletionException(new InvalidQueryException(node, "Keyspace pacer does not exist")), TABLE);

            assertTrue(translated instanceof TableNotFoundException);
            assertEquals(TABLE, ((TableNotFoundException) translated).tableName());
        }

        @Test
        @DisplayName("should pass other errors through unchanged")
        void shouldPassOtherErrorsThrough() {
            var error = new InvalidQueryException(node, "Invalid STRING constant");

            assertEquals(error, CassandraErrors.translate(new CompletionException(error), TABLE));
        }
    }

    @Nested
    @DisplayName("Conditional conflicts")
    class ConflictTests {

        @Test
        @DisplayName("should treat held slots and unknown lightweight transaction outcomes as conflicts")
        void shouldTreatConflicts() {
            assertTrue(repository.isConditionalConflict(new SlotClaimConflictException("a", "default", 0)));
            assertTrue(repository.isConditionalConflict(
                    new CASWriteUnknownException(node, ConsistencyLevel.SERIAL, 0, 1)));
            assertTrue(repository.isConditionalConflict(new CompletionException(
                    new WriteTimeoutException(node, ConsistencyLevel.SERIAL, 0, 1, DefaultWriteType.CAS))));
        }

        @Test
        @DisplayName("should not treat ordinary write timeouts as conflicts")
        void shouldNotTreatSimpleWriteTimeoutAsConflict() {
            assertFalse(repository.isConditionalConflict(
                    new WriteTimeoutException(node, ConsistencyLevel.QUORUM, 0, 1, DefaultWriteType.SIMPLE)));
        }
    }

    @Nested
    @DisplayName("Capabilities")
    class CapabilityTests {

        @Test
        @DisplayName("should rely on native expiry instead of statistics and cleanup")
        void shouldDeclareNoCapabilities() {
            assertTrue(repository.capabilities().isEmpty());
            assertThrows(UnsupportedOperationException.class, () -> await(repository.countByResource()));
            assertThrows(UnsupportedOperationException.class, () -> await(repository.findResources()));
            assertThrows(UnsupportedOperationException.class, () -> await(repository.deleteOlderThan("a", 0)));
            assertThrows(UnsupportedOperationException.class, () -> await(repository.deleteExpiredSlots(0)));
            assertEquals(0L, await(cooldownRepository.deleteExpired(0)));
        }

        @Test
        @DisplayName("should not declare a capability the repository lacks")
        void shouldNotDeclareStatistics() {
            assertFalse(repository.capabilities().contains(StoreCapability.STATISTICS));
        }
    }

    @Nested
    @DisplayName("Lifecycle")
    class LifecycleTests {

        @Test
        @DisplayName("should fail after close without touching the session")
        void shouldFailAfterClose() {
            repository.close();

            assertThrows(StoreDestroyedException.class, () -> await(repository.countSince("a", null, 0)));
            verify(session, never()).prepareAsync(anyString());
            verify(session, never()).close();
        }
    }

    @Nested
    @DisplayName("Expiry")
    class ExpiryTests {

        @Test
        @DisplayName("should round window TTLs up to whole seconds")
        void shouldRoundWindowTtl() {
            assertEquals(1, CassandraRateLimitRepository.ttlSeconds(0));
            assertEquals(1, CassandraRateLimitRepository.ttlSeconds(1));
            assertEquals(2, CassandraRateLimitRepository.ttlSeconds(1001));
            assertEquals(60, CassandraRateLimitRepository.ttlSeconds(60_000));
        }

        @Test
        @DisplayName("should expire cooldowns with the remaining time")
        void shouldExpireCooldownsWithRemainingTime() {
            assertEquals(1, CassandraCooldownRepository.ttlSeconds(1000, 2000));
            assertEquals(30, CassandraCooldownRepository.ttlSeconds(30_000, 0));
            assertEquals(31, CassandraCooldownRepository.ttlSeconds(30_001, 0));
        }

        @Test
        @DisplayName("should name the priority index after the table")
        void shouldNameIndexTable() {
            assertEquals("rate_limit_items_by_priority", CassandraRateLimitRepository.indexTableOf(TABLE));
        }
    }
}
