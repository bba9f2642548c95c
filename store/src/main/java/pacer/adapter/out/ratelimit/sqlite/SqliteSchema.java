package pacer.adapter.out.ratelimit.sqlite;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;

/**
 * Tables of the SQLite rate limit store.
 *
 * <p>SQLite has no native expiry, so old rows are removed by the store's cleanup pass.
 */
public final class SqliteSchema {

    public static final String RATE_LIMITS_TABLE = "rate_limits";
    public static final String SLOTS_TABLE = "rate_limit_slots";
    public static final String COOLDOWNS_TABLE = "rate_limit_cooldowns";

    private static final List<String> STATEMENTS = List.of(
            """
            CREATE TABLE IF NOT EXISTS rate_limits (
                id INTEGER PRIMARY KEY AUTOINCREMENT,
                resource TEXT NOT NULL,
                timestamp INTEGER NOT NULL,
                priority TEXT,
                unique_id TEXT NOT NULL UNIQUE
            )
            """,
            "CREATE INDEX IF NOT EXISTS idx_rate_limits_resource_timestamp ON rate_limits (resource, timestamp)",
            """
            CREATE INDEX IF NOT EXISTS idx_rate_limits_resource_priority_timestamp
                ON rate_limits (resource, priority, timestamp)
            """,
            """
            CREATE TABLE IF NOT EXISTS rate_limit_slots (
                resource TEXT NOT NULL,
                scope TEXT NOT NULL,
                slot_index INTEGER NOT NULL,
                claimed_at INTEGER NOT NULL,
                expires_at INTEGER NOT NULL,
                PRIMARY KEY (resource, scope, slot_index)
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS rate_limit_cooldowns (
                origin TEXT PRIMARY KEY,
                cooldown_until INTEGER NOT NULL
            )
            """);

    private SqliteSchema() {}

    /**
     * Create any missing table or index.
     */
    public static void create(Connection connection) throws SQLException {
        try (var statement = connection.createStatement()) {
            for (String ddl : STATEMENTS) {
                statement.execute(ddl);
            }
        }
    }
}
