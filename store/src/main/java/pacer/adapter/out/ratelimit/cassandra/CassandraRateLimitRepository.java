package pacer.adapter.out.ratelimit.cassandra;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import com.datastax.oss.driver.api.core.CqlSession;
import com.datastax.oss.driver.api.core.cql.AsyncResultSet;
import com.datastax.oss.driver.api.core.cql.BoundStatement;
import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import pacer.core.exception.SlotClaimConflictException;
import pacer.core.model.ratelimit.Priority;
import pacer.core.model.ratelimit.RateLimitConfig;
import pacer.core.model.ratelimit.RequestRecord;
import pacer.core.model.ratelimit.ResourceKeyCodec;
import pacer.core.model.ratelimit.SlotClaim;
import pacer.core.port.out.RateLimitRepository;
import pacer.core.port.out.StoreCapability;

/**
 * Cassandra implementation of RateLimitRepository.
 *
 * <p>Request records live in partition {@code RATELIMIT#{resource}} under sort key
 * {@code TS#{timestamp}#{uniqueId}}, mirrored into {@code {table}_by_priority} under
 * {@code RATELIMIT#{resource}#{priority}} for priority-scoped queries. Slot claims
 * live in partition {@code RATELIMIT_SLOT#{resource}} and are taken with lightweight
 * transactions: insert if absent, or replace an expired claim if its expiry is still
 * the one observed. Every row carries a TTL aligned to the window, so no explicit
 * cleanup is needed.
 */
public class CassandraRateLimitRepository implements RateLimitRepository {

    private static final Logger LOG = Logger.getLogger(CassandraRateLimitRepository.class);

    private final CassandraQueries queries;
    private final String table;
    private final String indexTable;

    public CassandraRateLimitRepository(CqlSession session, String table) {
        this(new CassandraQueries(session, table, false));
    }

    CassandraRateLimitRepository(CassandraQueries queries) {
        this.queries = queries;
        this.table = queries.table();
        this.indexTable = indexTableOf(queries.table());
    }

    static String indexTableOf(String table) {
        return table + "_by_priority";
    }

    @Override
    public Set<StoreCapability> capabilities() {
        return EnumSet.noneOf(StoreCapability.class);
    }

    @Override
    public Uni<Void> insert(RequestRecord record, RateLimitConfig config) {
        return recordStatements(record, ttlSeconds(config.windowMs()))
                .flatMap(statements -> statements.size() == 1
                        ? queries.execute(statements.get(0))
                        : queries.executeBatch(statements))
                .replaceWithVoid();
    }

    @Override
    public Uni<Long> countSince(String resource, Priority priority, long fromInclusive) {
        final var lowerBound = ResourceKeyCodec.recordSortLowerBound(fromInclusive);
        final Uni<AsyncResultSet> result = priority == null
                ? queries.execute(
                        "SELECT COUNT(*) FROM %s WHERE pk = ? AND sk >= ? AND sk < ?".formatted(table),
                        ResourceKeyCodec.partitionKey(resource),
                        lowerBound,
                        ResourceKeyCodec.RECORD_SORT_UPPER_BOUND)
                : queries.execute(
                        "SELECT COUNT(*) FROM %s WHERE gsi1pk = ? AND gsi1sk >= ? AND gsi1sk < ?".formatted(indexTable),
                        ResourceKeyCodec.priorityIndexKey(resource, priority),
                        lowerBound,
                        ResourceKeyCodec.RECORD_SORT_UPPER_BOUND);
        return result.map(rs -> {
            final var row = rs.one();
            return row == null ? 0L : row.getLong(0);
        });
    }

    @Override
    public Uni<Optional<Long>> findOldestSince(String resource, Priority priority, long fromInclusive) {
        return timestamps(resource, priority, fromInclusive, "ASC", 1)
                .map(oldest -> oldest.isEmpty() ? Optional.<Long>empty() : Optional.of(oldest.get(0)));
    }

    @Override
    public Uni<List<Long>> findRecentTimestamps(
            String resource, Priority priority, long fromInclusive, int maxResults) {
        return timestamps(resource, priority, fromInclusive, "DESC", maxResults).map(newestFirst -> {
            final List<Long> oldestFirst = new ArrayList<>(newestFirst);
            Collections.reverse(oldestFirst);
            return oldestFirst;
        });
    }

    @Override
    public Uni<Void> claimSlot(SlotClaim claim, RequestRecord record, RateLimitConfig config) {
        final var ttl = ttlSeconds(config.windowMs());
        final var partitionKey = ResourceKeyCodec.slotPartitionKey(claim.resource());
        final var sortKey = ResourceKeyCodec.slotSortKey(claim.scope(), claim.slotIndex());

        return queries.execute(
                        "INSERT INTO %s (pk, sk, claimed_at, expires_at) VALUES (?, ?, ?, ?) IF NOT EXISTS USING TTL ?"
                                .formatted(table),
                        partitionKey,
                        sortKey,
                        claim.claimedAt(),
                        claim.expiresAt(),
                        ttl)
                .flatMap(inserted -> {
                    if (inserted.wasApplied()) {
                        return Uni.createFrom().voidItem();
                    }
                    final var current = inserted.one();
                    if (current == null || current.isNull("expires_at") || current.getLong("expires_at") > claim.claimedAt()) {
                        return Uni.createFrom().<Void>failure(conflict(claim));
                    }
                    final var observedExpiry = current.getLong("expires_at");
                    return queries.execute(
                                    "UPDATE %s USING TTL ? SET claimed_at = ?, expires_at = ? WHERE pk = ? AND sk = ? IF expires_at = ?"
                                            .formatted(table),
                                    ttl,
                                    claim.claimedAt(),
                                    claim.expiresAt(),
                                    partitionKey,
                                    sortKey,
                                    observedExpiry)
                            .flatMap(replaced -> replaced.wasApplied()
                                    ? Uni.createFrom().voidItem()
                                    : Uni.createFrom().<Void>failure(conflict(claim)));
                })
                .flatMap(claimed -> insert(record, config));
    }

    @Override
    public boolean isConditionalConflict(Throwable failure) {
        return CassandraErrors.isConditionalConflict(failure);
    }

    @Override
    public Uni<Void> deleteResource(String resource) {
        return deletePartition(table, "pk", ResourceKeyCodec.partitionKey(resource))
                .flatMap(ignored -> deletePartition(table, "pk", ResourceKeyCodec.slotPartitionKey(resource)))
                .flatMap(ignored -> deletePartition(
                        indexTable, "gsi1pk", ResourceKeyCodec.priorityIndexKey(resource, Priority.USER)))
                .flatMap(ignored -> deletePartition(
                        indexTable, "gsi1pk", ResourceKeyCodec.priorityIndexKey(resource, Priority.BACKGROUND)));
    }

    @Override
    public Uni<Void> deleteAll() {
        return queries.fetchAll("SELECT DISTINCT pk FROM %s".formatted(table), row -> row.getString("pk"))
                .flatMap(partitions -> deletePartitions(
                        table,
                        "pk",
                        partitions.stream()
                                .filter(pk -> pk.startsWith(ResourceKeyCodec.RATE_LIMIT_PREFIX)
                                        || pk.startsWith(ResourceKeyCodec.SLOT_PREFIX))
                                .toList()))
                .flatMap(ignored -> queries.fetchAll(
                        "SELECT DISTINCT gsi1pk FROM %s".formatted(indexTable), row -> row.getString("gsi1pk")))
                .flatMap(partitions -> deletePartitions(indexTable, "gsi1pk", partitions));
    }

    @Override
    public Uni<Set<String>> findResources() {
        return unsupported(StoreCapability.STATISTICS);
    }

    @Override
    public Uni<Map<String, Long>> countByResource() {
        return unsupported(StoreCapability.STATISTICS);
    }

    @Override
    public Uni<Long> deleteOlderThan(String resource, long cutoff) {
        return unsupported(StoreCapability.EXPLICIT_CLEANUP);
    }

    @Override
    public Uni<Long> deleteExpiredSlots(long now) {
        return unsupported(StoreCapability.EXPLICIT_CLEANUP);
    }

    @Override
    public void close() {
        queries.close();
    }

    private Uni<List<BoundStatement>> recordStatements(RequestRecord record, int ttl) {
        final var sortKey = ResourceKeyCodec.recordSortKey(record.timestamp(), record.uniqueId());
        final var partitionKey = ResourceKeyCodec.partitionKey(record.resource());
        if (record.priority().isEmpty()) {
            return queries.bind(
                            "INSERT INTO %s (pk, sk, timestamp) VALUES (?, ?, ?) USING TTL ?".formatted(table),
                            partitionKey,
                            sortKey,
                            record.timestamp(),
                            ttl)
                    .map(List::of);
        }

        final var priority = record.priority().get();
        return Uni.combine()
                .all()
                .unis(
                        queries.bind(
                                "INSERT INTO %s (pk, sk, timestamp, priority) VALUES (?, ?, ?, ?) USING TTL ?"
                                        .formatted(table),
                                partitionKey,
                                sortKey,
                                record.timestamp(),
                                priority.value(),
                                ttl),
                        queries.bind(
                                "INSERT INTO %s (gsi1pk, gsi1sk, resource, timestamp) VALUES (?, ?, ?, ?) USING TTL ?"
                                        .formatted(indexTable),
                                ResourceKeyCodec.priorityIndexKey(record.resource(), priority),
                                sortKey,
                                record.resource(),
                                record.timestamp(),
                                ttl))
                .asTuple()
                .map(bound -> List.of(bound.getItem1(), bound.getItem2()));
    }

    private Uni<List<Long>> timestamps(
            String resource, Priority priority, long fromInclusive, String order, int maxResults) {
        final var lowerBound = ResourceKeyCodec.recordSortLowerBound(fromInclusive);
        final Uni<AsyncResultSet> result = priority == null
                ? queries.execute(
                        "SELECT timestamp FROM %s WHERE pk = ? AND sk >= ? AND sk < ? ORDER BY sk %s LIMIT ?"
                                .formatted(table, order),
                        ResourceKeyCodec.partitionKey(resource),
                        lowerBound,
                        ResourceKeyCodec.RECORD_SORT_UPPER_BOUND,
                        maxResults)
                : queries.execute(
                        "SELECT timestamp FROM %s WHERE gsi1pk = ? AND gsi1sk >= ? AND gsi1sk < ? ORDER BY gsi1sk %s LIMIT ?"
                                .formatted(indexTable, order),
                        ResourceKeyCodec.priorityIndexKey(resource, priority),
                        lowerBound,
                        ResourceKeyCodec.RECORD_SORT_UPPER_BOUND,
                        maxResults);
        return result.map(rs -> {
            final List<Long> timestamps = new ArrayList<>();
            rs.currentPage().forEach(row -> timestamps.add(row.getLong("timestamp")));
            return timestamps;
        });
    }

    private Uni<Void> deletePartition(String targetTable, String keyColumn, String partitionKey) {
        return queries.execute("DELETE FROM %s WHERE %s = ?".formatted(targetTable, keyColumn), partitionKey)
                .replaceWithVoid();
    }

    private Uni<Void> deletePartitions(String targetTable, String keyColumn, List<String> partitionKeys) {
        if (partitionKeys.isEmpty()) {
            return Uni.createFrom().voidItem();
        }
        LOG.debugf("Deleting %d partitions from %s", partitionKeys.size(), targetTable);
        return Multi.createFrom()
                .iterable(partitionKeys)
                .onItem()
                .transformToUniAndConcatenate(key -> deletePartition(targetTable, keyColumn, key))
                .collect()
                .last()
                .replaceWithVoid();
    }

    private static SlotClaimConflictException conflict(SlotClaim claim) {
        return new SlotClaimConflictException(claim.resource(), claim.scope(), claim.slotIndex());
    }

    private <T> Uni<T> unsupported(StoreCapability capability) {
        return Uni.createFrom()
                .failure(new UnsupportedOperationException("Cassandra rate limit storage does not support " + capability));
    }

    /**
     * Whole seconds covering the window, at least one.
     */
    static int ttlSeconds(long windowMs) {
        return (int) Math.max(1L, Math.min(Integer.MAX_VALUE, (windowMs + 999) / 1000));
    }
}
