package pacer.adapter.out.ratelimit.cassandra;

import java.net.InetSocketAddress;

import com.datastax.oss.driver.api.core.CqlSession;
import com.datastax.oss.driver.api.core.CqlSessionBuilder;
import org.jboss.logging.Logger;

import pacer.core.port.out.CooldownRepository;
import pacer.core.port.out.RateLimitRepository;
import pacer.spi.RateLimitStoreProvider;
import pacer.spi.StorageAdapterConfig;
import pacer.spi.StorageProviderException;

/**
 * Cassandra rate limit store provider.
 *
 * <p>Configuration properties:
 * <ul>
 *   <li>pacer.rate-limit.cassandra.contact-points - Comma-separated host:port pairs (required)</li>
 *   <li>pacer.rate-limit.cassandra.datacenter - Local datacenter name (default: datacenter1)</li>
 *   <li>pacer.rate-limit.cassandra.keyspace - Keyspace name (default: pacer)</li>
 *   <li>pacer.rate-limit.cassandra.table - Table name (default: rate_limit_items)</li>
 *   <li>pacer.rate-limit.cassandra.username - Username for authentication (optional)</li>
 *   <li>pacer.rate-limit.cassandra.password - Password for authentication (optional)</li>
 *   <li>pacer.rate-limit.cassandra.run-migrations - Create the keyspace and tables (default: false)</li>
 * </ul>
 */
public class CassandraRateLimitStoreProvider implements RateLimitStoreProvider {

    private static final Logger LOG = Logger.getLogger(CassandraRateLimitStoreProvider.class);

    static final String CONTACT_POINTS = "pacer.rate-limit.cassandra.contact-points";
    static final String DATACENTER = "pacer.rate-limit.cassandra.datacenter";
    static final String KEYSPACE = "pacer.rate-limit.cassandra.keyspace";
    static final String TABLE = "pacer.rate-limit.cassandra.table";
    static final String USERNAME = "pacer.rate-limit.cassandra.username";
    static final String PASSWORD = "pacer.rate-limit.cassandra.password";
    static final String RUN_MIGRATIONS = "pacer.rate-limit.cassandra.run-migrations";

    static final String DEFAULT_KEYSPACE = "pacer";
    static final String DEFAULT_TABLE = "rate_limit_items";

    private CassandraQueries queries;

    @Override
    public String name() {
        return "cassandra";
    }

    @Override
    public String description() {
        return "Apache Cassandra storage (shared across instances)";
    }

    @Override
    public int priority() {
        return 10;
    }

    @Override
    public boolean isAvailable(StorageAdapterConfig config) {
        try {
            Class.forName("com.datastax.oss.driver.api.core.CqlSession");
        } catch (ClassNotFoundException e) {
            return false;
        }
        return config.get(CONTACT_POINTS).isPresent();
    }

    @Override
    public RateLimitRepository createRateLimitRepository(StorageAdapterConfig config) {
        return new CassandraRateLimitRepository(queries(config));
    }

    @Override
    public CooldownRepository createCooldownRepository(StorageAdapterConfig config) {
        return new CassandraCooldownRepository(queries(config));
    }

    private synchronized CassandraQueries queries(StorageAdapterConfig config) {
        if (queries != null && !queries.isClosed()) {
            return queries;
        }
        final var keyspace = config.getOrDefault(KEYSPACE, DEFAULT_KEYSPACE);
        final var table = config.getOrDefault(TABLE, DEFAULT_TABLE);

        if (config.getBoolean(RUN_MIGRATIONS).orElse(false)) {
            runMigrations(config, keyspace, table);
        }

        this.queries = new CassandraQueries(buildSession(config, keyspace), table, true);
        LOG.infof("Using Cassandra rate limit table %s.%s", keyspace, table);
        return queries;
    }

    private void runMigrations(StorageAdapterConfig config, String keyspace, String table) {
        LOG.info("Running Cassandra rate limit migrations...");
        try (CqlSession noKeyspaceSession = buildSession(config, null)) {
            final var migrator = new CassandraSchemaMigrator(noKeyspaceSession, keyspace, table);
            migrator.createKeyspace();
            migrator.migrate();
        } catch (StorageProviderException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new StorageProviderException("Cassandra rate limit migrations failed", e);
        }
        LOG.info("Cassandra rate limit migrations completed");
    }

    private CqlSession buildSession(StorageAdapterConfig config, String keyspace) {
        final var contactPoints = config.getRequired(CONTACT_POINTS);
        final var datacenter = config.getOrDefault(DATACENTER, "datacenter1");

        final CqlSessionBuilder builder = CqlSession.builder().withLocalDatacenter(datacenter);
        if (keyspace != null) {
            builder.withKeyspace(keyspace);
        }

        for (String contactPoint : contactPoints.split(",")) {
            final var parts = contactPoint.trim().split(":");
            final var port = parts.length > 1 ? Integer.parseInt(parts[1]) : 9042;
            builder.addContactPoint(new InetSocketAddress(parts[0], port));
        }

        config.get(USERNAME).ifPresent(username -> {
            final var password = config.get(PASSWORD)
                    .orElseThrow(() ->
                            new StorageProviderException("Cassandra password required when username is specified"));
            builder.withAuthCredentials(username, password);
        });

        try {
            return builder.build();
        } catch (RuntimeException e) {
            throw new StorageProviderException("Failed to connect to Cassandra", e);
        }
    }
}
