package pacer.adapter.out.ratelimit.sqlite;

import java.time.Duration;

import org.jboss.logging.Logger;

import pacer.core.port.out.CooldownRepository;
import pacer.core.port.out.RateLimitRepository;
import pacer.spi.RateLimitStoreProvider;
import pacer.spi.StorageAdapterConfig;
import pacer.spi.StorageProviderException;

/**
 * SQLite rate limit store provider.
 *
 * <p>Configuration properties:
 * <ul>
 *   <li>pacer.rate-limit.sqlite.database - Database file path, or {@code :memory:} (required)</li>
 *   <li>pacer.rate-limit.sqlite.busy-timeout - Wait for locks held by other processes (default: PT5S)</li>
 *   <li>pacer.rate-limit.sqlite.create-schema - Create missing tables on startup (default: true)</li>
 * </ul>
 */
public class SqliteRateLimitStoreProvider implements RateLimitStoreProvider {

    private static final Logger LOG = Logger.getLogger(SqliteRateLimitStoreProvider.class);

    static final String DATABASE = "pacer.rate-limit.sqlite.database";
    static final String BUSY_TIMEOUT = "pacer.rate-limit.sqlite.busy-timeout";
    static final String CREATE_SCHEMA = "pacer.rate-limit.sqlite.create-schema";

    private SqliteDatabase database;

    @Override
    public String name() {
        return "sqlite";
    }

    @Override
    public String description() {
        return "SQLite file storage (single host, persisted)";
    }

    @Override
    public int priority() {
        return 5;
    }

    @Override
    public boolean isAvailable(StorageAdapterConfig config) {
        try {
            Class.forName("org.sqlite.JDBC");
        } catch (ClassNotFoundException e) {
            return false;
        }
        return config.get(DATABASE).isPresent();
    }

    @Override
    public RateLimitRepository createRateLimitRepository(StorageAdapterConfig config) {
        return new SqliteRateLimitRepository(database(config));
    }

    @Override
    public CooldownRepository createCooldownRepository(StorageAdapterConfig config) {
        return new SqliteCooldownRepository(database(config));
    }

    private synchronized SqliteDatabase database(StorageAdapterConfig config) {
        if (database != null && !database.isClosed()) {
            return database;
        }
        final var path = config.getRequired(DATABASE);
        final var busyTimeout = config.getDuration(BUSY_TIMEOUT).orElse(Duration.ofSeconds(5));
        final var opened = SqliteDatabase.open(path, busyTimeout);

        if (config.getBoolean(CREATE_SCHEMA).orElse(true)) {
            try {
                opened.execute(connection -> {
                    SqliteSchema.create(connection);
                    return null;
                });
            } catch (RuntimeException e) {
                opened.close();
                throw new StorageProviderException("Failed to create SQLite rate limit schema", e);
            }
            LOG.debugf("Ensured SQLite rate limit schema in %s", path);
        }

        this.database = opened;
        return opened;
    }
}
