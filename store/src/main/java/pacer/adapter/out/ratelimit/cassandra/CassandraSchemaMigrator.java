package pacer.adapter.out.ratelimit.cassandra;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import com.datastax.oss.driver.api.core.CqlSession;
import org.jboss.logging.Logger;

import pacer.spi.StorageProviderException;

/**
 * Applies the CQL migrations that create the rate limit keyspace and tables.
 *
 * <p>Migration files are read from the classpath at {@code db/cassandra/} and named
 * {@code V{version}__{description}.cql}. {@code ${keyspace}} and {@code ${table}}
 * placeholders are substituted before execution. Applied versions are tracked in
 * {@code pacer_schema_migrations} so each one runs once per keyspace.
 */
public class CassandraSchemaMigrator {

    private static final Logger LOG = Logger.getLogger(CassandraSchemaMigrator.class);
    private static final String MIGRATIONS_PATH = "db/cassandra/";
    private static final Pattern MIGRATION_PATTERN = Pattern.compile("V(\\d+)__.*\\.cql");
    private static final String KEYSPACE_MIGRATION = "V1__create_keyspace.cql";

    // Update when adding a migration
    static final List<String> MIGRATIONS = List.of(KEYSPACE_MIGRATION, "V2__create_rate_limit_tables.cql");

    private final CqlSession session;
    private final String keyspace;
    private final String table;

    public CassandraSchemaMigrator(CqlSession session, String keyspace, String table) {
        this.session = session;
        this.keyspace = keyspace;
        this.table = table;
    }

    /**
     * Create the keyspace. The session must not be bound to a keyspace.
     */
    public void createKeyspace() {
        LOG.infof("Ensuring keyspace %s exists", keyspace);
        for (String statement : statements(read(KEYSPACE_MIGRATION))) {
            session.execute(statement);
        }
    }

    /**
     * Apply every pending migration after the keyspace one.
     *
     * @return the number of migrations applied
     */
    public int migrate() {
        session.execute(
                """
                CREATE TABLE IF NOT EXISTS %s.pacer_schema_migrations (
                    version int PRIMARY KEY,
                    script_name text,
                    applied_at timestamp
                )
                """
                        .formatted(keyspace));

        final Set<Integer> applied = session
                .execute("SELECT version FROM %s.pacer_schema_migrations".formatted(keyspace))
                .all()
                .stream()
                .map(row -> row.getInt("version"))
                .collect(Collectors.toSet());

        int count = 0;
        for (String filename : MIGRATIONS) {
            final var version = versionOf(filename);
            if (version == 1 || applied.contains(version)) {
                continue;
            }
            apply(version, filename);
            count++;
        }

        if (count > 0) {
            LOG.infof("Applied %d Cassandra migration(s) to %s", count, keyspace);
        } else {
            LOG.debug("No pending Cassandra migrations");
        }
        return count;
    }

    private void apply(int version, String filename) {
        LOG.infof("Applying migration V%d: %s", version, filename);
        for (String statement : statements(read(filename))) {
            try {
                session.execute(statement);
            } catch (RuntimeException e) {
                throw new StorageProviderException("Migration failed: " + filename, e);
            }
        }
        session.execute(
                "INSERT INTO %s.pacer_schema_migrations (version, script_name, applied_at) VALUES (?, ?, ?)"
                        .formatted(keyspace),
                version,
                filename,
                Instant.now());
    }

    List<String> statements(String content) {
        final var substituted = content.replace("${keyspace}", keyspace).replace("${table}", table);
        final List<String> statements = new ArrayList<>();
        for (String raw : substituted.split(";")) {
            final var statement = stripComments(raw);
            if (statement.isEmpty() || statement.toUpperCase(Locale.ROOT).startsWith("USE ")) {
                continue;
            }
            statements.add(statement);
        }
        return statements;
    }

    private static String stripComments(String raw) {
        return raw.lines()
                .filter(line -> !line.trim().startsWith("--"))
                .collect(Collectors.joining("\n"))
                .trim();
    }

    static int versionOf(String filename) {
        final var matcher = MIGRATION_PATTERN.matcher(filename);
        if (!matcher.matches()) {
            throw new IllegalArgumentException("Not a migration file: " + filename);
        }
        return Integer.parseInt(matcher.group(1));
    }

    private String read(String filename) {
        final var path = MIGRATIONS_PATH + filename;
        try (InputStream is = getClass().getClassLoader().getResourceAsStream(path)) {
            if (is == null) {
                throw new StorageProviderException("Migration file not found: " + path);
            }
            return new String(is.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new StorageProviderException("Could not read migration " + path, e);
        }
    }
}
