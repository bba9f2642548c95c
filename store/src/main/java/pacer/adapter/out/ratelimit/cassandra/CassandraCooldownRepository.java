package pacer.adapter.out.ratelimit.cassandra;

import java.util.Optional;

import com.datastax.oss.driver.api.core.CqlSession;
import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;

import pacer.core.model.ratelimit.Cooldown;
import pacer.core.model.ratelimit.ResourceKeyCodec;
import pacer.core.port.out.CooldownRepository;

/**
 * Cassandra implementation of CooldownRepository.
 *
 * <p>Cooldowns share the rate limit table under {@code COOLDOWN#{origin}} and expire
 * through a TTL set to the remaining cooldown.
 */
public class CassandraCooldownRepository implements CooldownRepository {

    private final CassandraQueries queries;
    private final String table;

    public CassandraCooldownRepository(CqlSession session, String table) {
        this(new CassandraQueries(session, table, false));
    }

    CassandraCooldownRepository(CassandraQueries queries) {
        this.queries = queries;
        this.table = queries.table();
    }

    @Override
    public Uni<Optional<Cooldown>> find(String origin) {
        final var key = ResourceKeyCodec.cooldownKey(origin);
        return queries.execute("SELECT cooldown_until FROM %s WHERE pk = ? AND sk = ?".formatted(table), key, key)
                .map(rs -> {
                    final var row = rs.one();
                    if (row == null || row.isNull("cooldown_until")) {
                        return Optional.empty();
                    }
                    return Optional.of(new Cooldown(origin, row.getLong("cooldown_until")));
                });
    }

    @Override
    public Uni<Void> save(Cooldown cooldown, long now) {
        final var key = ResourceKeyCodec.cooldownKey(cooldown.origin());
        return queries.execute(
                        "INSERT INTO %s (pk, sk, cooldown_until) VALUES (?, ?, ?) USING TTL ?".formatted(table),
                        key,
                        key,
                        cooldown.cooldownUntil(),
                        ttlSeconds(cooldown.cooldownUntil(), now))
                .replaceWithVoid();
    }

    @Override
    public Uni<Void> delete(String origin) {
        final var key = ResourceKeyCodec.cooldownKey(origin);
        return queries.execute("DELETE FROM %s WHERE pk = ? AND sk = ?".formatted(table), key, key)
                .replaceWithVoid();
    }

    @Override
    public Uni<Void> deleteAll() {
        return queries.fetchAll("SELECT DISTINCT pk FROM %s".formatted(table), row -> row.getString("pk"))
                .flatMap(partitions -> Multi.createFrom()
                        .iterable(partitions)
                        .select()
                        .where(pk -> pk.startsWith(ResourceKeyCodec.COOLDOWN_PREFIX))
                        .onItem()
                        .transformToUniAndConcatenate(
                                pk -> queries.execute("DELETE FROM %s WHERE pk = ?".formatted(table), pk))
                        .collect()
                        .last()
                        .replaceWithVoid());
    }

    /**
     * Expired cooldowns are removed by their TTL.
     */
    @Override
    public Uni<Long> deleteExpired(long now) {
        return Uni.createFrom().item(0L);
    }

    @Override
    public void close() {
        queries.close();
    }

    static int ttlSeconds(long cooldownUntil, long now) {
        final long remainingMs = Math.max(0L, cooldownUntil - now);
        return (int) Math.max(1L, Math.min(Integer.MAX_VALUE, (remainingMs + 999) / 1000));
    }
}
