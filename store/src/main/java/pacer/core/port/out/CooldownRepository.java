package pacer.core.port.out;

import java.util.Optional;

import io.smallrye.mutiny.Uni;

import pacer.core.model.ratelimit.Cooldown;

/**
 * Port for per-origin cooldown markers.
 *
 * <p>Implementations return stored cooldowns as is; expiry is decided by the caller.
 */
public interface CooldownRepository {

    Uni<Optional<Cooldown>> find(String origin);

    /**
     * Insert or overwrite a cooldown.
     *
     * @param cooldown the cooldown
     * @param now epoch milliseconds, used for storage-native expiry
     * @return completion
     */
    Uni<Void> save(Cooldown cooldown, long now);

    Uni<Void> delete(String origin);

    Uni<Void> deleteAll();

    /**
     * Delete cooldowns that ended at or before {@code now}.
     *
     * @return number of deleted cooldowns
     */
    Uni<Long> deleteExpired(long now);

    default void close() {}
}
