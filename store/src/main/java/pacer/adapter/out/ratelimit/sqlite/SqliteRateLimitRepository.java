package pacer.adapter.out.ratelimit.sqlite;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import pacer.core.model.ratelimit.Priority;
import pacer.core.model.ratelimit.RateLimitConfig;
import pacer.core.model.ratelimit.RequestRecord;
import pacer.core.model.ratelimit.SlotClaim;
import pacer.core.port.out.RateLimitRepository;
import pacer.core.port.out.StoreCapability;

/**
 * SQLite implementation of RateLimitRepository.
 *
 * <p>Slot claims rely on the primary key of {@code rate_limit_slots}: an expired
 * claim is deleted and a new one inserted in the same transaction as the request
 * record, so a held slot fails the insert with a constraint violation.
 */
public class SqliteRateLimitRepository implements RateLimitRepository {

    private static final Logger LOG = Logger.getLogger(SqliteRateLimitRepository.class);

    static final int DELETE_BATCH_SIZE = 500;
    static final int MAX_DELETE_PAGES = 10_000;

    private final SqliteDatabase database;

    public SqliteRateLimitRepository(SqliteDatabase database) {
        this.database = database;
    }

    @Override
    public Set<StoreCapability> capabilities() {
        return EnumSet.of(StoreCapability.STATISTICS, StoreCapability.EXPLICIT_CLEANUP);
    }

    @Override
    public Uni<Void> insert(RequestRecord record, RateLimitConfig config) {
        return database.query(connection -> {
            insertRecord(connection, record);
            return null;
        });
    }

    @Override
    public Uni<Long> countSince(String resource, Priority priority, long fromInclusive) {
        return database.query(connection -> {
            final var sql = "SELECT COUNT(*) FROM rate_limits WHERE resource = ? AND timestamp >= ?"
                    + priorityFilter(priority);
            try (var statement = connection.prepareStatement(sql)) {
                bindWindow(statement, resource, fromInclusive, priority);
                try (var rs = statement.executeQuery()) {
                    return rs.next() ? rs.getLong(1) : 0L;
                }
            }
        });
    }

    @Override
    public Uni<Optional<Long>> findOldestSince(String resource, Priority priority, long fromInclusive) {
        return database.query(connection -> {
            final var sql = "SELECT MIN(timestamp) FROM rate_limits WHERE resource = ? AND timestamp >= ?"
                    + priorityFilter(priority);
            try (var statement = connection.prepareStatement(sql)) {
                bindWindow(statement, resource, fromInclusive, priority);
                try (var rs = statement.executeQuery()) {
                    if (!rs.next()) {
                        return Optional.<Long>empty();
                    }
                    final var oldest = rs.getLong(1);
                    return rs.wasNull() ? Optional.<Long>empty() : Optional.of(oldest);
                }
            }
        });
    }

    @Override
    public Uni<List<Long>> findRecentTimestamps(
            String resource, Priority priority, long fromInclusive, int maxResults) {
        return database.query(connection -> {
            final var sql = "SELECT timestamp FROM rate_limits WHERE resource = ? AND timestamp >= ?"
                    + priorityFilter(priority)
                    + " ORDER BY timestamp DESC LIMIT ?";
            try (var statement = connection.prepareStatement(sql)) {
                final var next = bindWindow(statement, resource, fromInclusive, priority);
                statement.setInt(next, maxResults);
                final List<Long> timestamps = new ArrayList<>();
                try (var rs = statement.executeQuery()) {
                    while (rs.next()) {
                        timestamps.add(rs.getLong(1));
                    }
                }
                Collections.reverse(timestamps);
                return timestamps;
            }
        });
    }

    @Override
    public Uni<Void> claimSlot(SlotClaim claim, RequestRecord record, RateLimitConfig config) {
        return database.transaction(connection -> {
            try (var release = connection.prepareStatement(
                    "DELETE FROM rate_limit_slots WHERE resource = ? AND scope = ? AND slot_index = ? AND expires_at <= ?")) {
                release.setString(1, claim.resource());
                release.setString(2, claim.scope());
                release.setInt(3, claim.slotIndex());
                release.setLong(4, claim.claimedAt());
                release.executeUpdate();
            }
            try (var insert = connection.prepareStatement(
                    """
                    INSERT INTO rate_limit_slots (resource, scope, slot_index, claimed_at, expires_at)
                    VALUES (?, ?, ?, ?, ?)
                    """)) {
                insert.setString(1, claim.resource());
                insert.setString(2, claim.scope());
                insert.setInt(3, claim.slotIndex());
                insert.setLong(4, claim.claimedAt());
                insert.setLong(5, claim.expiresAt());
                insert.executeUpdate();
            }
            insertRecord(connection, record);
            return null;
        });
    }

    @Override
    public boolean isConditionalConflict(Throwable failure) {
        return RateLimitRepository.super.isConditionalConflict(failure) || SqliteErrors.isConstraintViolation(failure);
    }

    @Override
    public Uni<Void> deleteResource(String resource) {
        return deletePaged("DELETE FROM rate_limits WHERE id IN (SELECT id FROM rate_limits WHERE resource = ? LIMIT ?)",
                        resource)
                .flatMap(records -> deletePaged(
                        "DELETE FROM rate_limit_slots WHERE rowid IN "
                                + "(SELECT rowid FROM rate_limit_slots WHERE resource = ? LIMIT ?)",
                        resource))
                .replaceWithVoid();
    }

    @Override
    public Uni<Void> deleteAll() {
        return deletePaged("DELETE FROM rate_limits WHERE id IN (SELECT id FROM rate_limits LIMIT ?)", null)
                .flatMap(records -> deletePaged(
                        "DELETE FROM rate_limit_slots WHERE rowid IN (SELECT rowid FROM rate_limit_slots LIMIT ?)",
                        null))
                .replaceWithVoid();
    }

    @Override
    public Uni<Set<String>> findResources() {
        return database.query(connection -> {
            final Set<String> resources = new LinkedHashSet<>();
            try (var statement = connection.prepareStatement("SELECT DISTINCT resource FROM rate_limits ORDER BY resource");
                    var rs = statement.executeQuery()) {
                while (rs.next()) {
                    resources.add(rs.getString(1));
                }
            }
            return resources;
        });
    }

    @Override
    public Uni<Map<String, Long>> countByResource() {
        return database.query(connection -> {
            final Map<String, Long> counts = new HashMap<>();
            try (var statement =
                            connection.prepareStatement("SELECT resource, COUNT(*) FROM rate_limits GROUP BY resource");
                    var rs = statement.executeQuery()) {
                while (rs.next()) {
                    counts.put(rs.getString(1), rs.getLong(2));
                }
            }
            return counts;
        });
    }

    @Override
    public Uni<Long> deleteOlderThan(String resource, long cutoff) {
        return database.query(connection -> {
            try (var statement =
                    connection.prepareStatement("DELETE FROM rate_limits WHERE resource = ? AND timestamp < ?")) {
                statement.setString(1, resource);
                statement.setLong(2, cutoff);
                return (long) statement.executeUpdate();
            }
        });
    }

    @Override
    public Uni<Long> deleteExpiredSlots(long now) {
        return database.query(connection -> {
            try (var statement = connection.prepareStatement("DELETE FROM rate_limit_slots WHERE expires_at <= ?")) {
                statement.setLong(1, now);
                return (long) statement.executeUpdate();
            }
        });
    }

    @Override
    public void close() {
        database.close();
    }

    /**
     * Repeat a bounded delete until a page comes back short.
     *
     * @param sql delete statement whose last parameter is the page size
     * @param resource first parameter, or null if the statement has none
     */
    private Uni<Long> deletePaged(String sql, String resource) {
        return Multi.createBy()
                .repeating()
                .uni(() -> database.query(connection -> deletePage(connection, sql, resource)))
                .whilst(deleted -> deleted == DELETE_BATCH_SIZE)
                .select()
                .first(MAX_DELETE_PAGES)
                .collect()
                .with(Collectors.summingLong(Integer::longValue))
                .invoke(total -> {
                    if (total >= (long) DELETE_BATCH_SIZE * MAX_DELETE_PAGES) {
                        LOG.warnf("Stopped paged delete after %d pages; rows may remain", MAX_DELETE_PAGES);
                    }
                });
    }

    private static int deletePage(Connection connection, String sql, String resource) throws SQLException {
        try (var statement = connection.prepareStatement(sql)) {
            int index = 1;
            if (resource != null) {
                statement.setString(index++, resource);
            }
            statement.setInt(index, DELETE_BATCH_SIZE);
            return statement.executeUpdate();
        }
    }

    private static void insertRecord(Connection connection, RequestRecord record) throws SQLException {
        try (var statement = connection.prepareStatement(
                "INSERT INTO rate_limits (resource, timestamp, priority, unique_id) VALUES (?, ?, ?, ?)")) {
            statement.setString(1, record.resource());
            statement.setLong(2, record.timestamp());
            statement.setString(3, record.priority().map(Priority::value).orElse(null));
            statement.setString(4, record.uniqueId());
            statement.executeUpdate();
        }
    }

    private static String priorityFilter(Priority priority) {
        return priority == null ? "" : " AND priority = ?";
    }

    /**
     * Bind resource, window start and optional priority.
     *
     * @return the next free parameter index
     */
    private static int bindWindow(PreparedStatement statement, String resource, long fromInclusive, Priority priority)
            throws SQLException {
        statement.setString(1, resource);
        statement.setLong(2, fromInclusive);
        if (priority == null) {
            return 3;
        }
        statement.setString(3, priority.value());
        return 4;
    }
}
