package pacer.adapter.out.ratelimit.sqlite;

import java.util.Optional;

import io.smallrye.mutiny.Uni;

import pacer.core.model.ratelimit.Cooldown;
import pacer.core.port.out.CooldownRepository;

/**
 * SQLite implementation of CooldownRepository.
 */
public class SqliteCooldownRepository implements CooldownRepository {

    private final SqliteDatabase database;

    public SqliteCooldownRepository(SqliteDatabase database) {
        this.database = database;
    }

    @Override
    public Uni<Optional<Cooldown>> find(String origin) {
        return database.query(connection -> {
            try (var statement = connection.prepareStatement(
                    "SELECT cooldown_until FROM rate_limit_cooldowns WHERE origin = ?")) {
                statement.setString(1, origin);
                try (var rs = statement.executeQuery()) {
                    return rs.next() ? Optional.of(new Cooldown(origin, rs.getLong(1))) : Optional.<Cooldown>empty();
                }
            }
        });
    }

    @Override
    public Uni<Void> save(Cooldown cooldown, long now) {
        return database.query(connection -> {
            try (var statement = connection.prepareStatement(
                    """
                    INSERT INTO rate_limit_cooldowns (origin, cooldown_until) VALUES (?, ?)
                    ON CONFLICT (origin) DO UPDATE SET cooldown_until = excluded.cooldown_until
                    """)) {
                statement.setString(1, cooldown.origin());
                statement.setLong(2, cooldown.cooldownUntil());
                statement.executeUpdate();
            }
            return null;
        });
    }

    @Override
    public Uni<Void> delete(String origin) {
        return database.query(connection -> {
            try (var statement = connection.prepareStatement("DELETE FROM rate_limit_cooldowns WHERE origin = ?")) {
                statement.setString(1, origin);
                statement.executeUpdate();
            }
            return null;
        });
    }

    @Override
    public Uni<Void> deleteAll() {
        return database.query(connection -> {
            try (var statement = connection.createStatement()) {
                statement.executeUpdate("DELETE FROM rate_limit_cooldowns");
            }
            return null;
        });
    }

    @Override
    public Uni<Long> deleteExpired(long now) {
        return database.query(connection -> {
            try (var statement =
                    connection.prepareStatement("DELETE FROM rate_limit_cooldowns WHERE cooldown_until <= ?")) {
                statement.setLong(1, now);
                return (long) statement.executeUpdate();
            }
        });
    }

    @Override
    public void close() {
        database.close();
    }
}
