package pacer.adapter.out.ratelimit.memory;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import io.smallrye.mutiny.Uni;

import pacer.core.model.ratelimit.Cooldown;
import pacer.core.port.out.CooldownRepository;

/**
 * In-memory implementation of CooldownRepository.
 */
public class InMemoryCooldownRepository implements CooldownRepository {

    private final ConcurrentMap<String, Cooldown> cooldowns = new ConcurrentHashMap<>();

    @Override
    public Uni<Optional<Cooldown>> find(String origin) {
        return Uni.createFrom().item(() -> Optional.ofNullable(cooldowns.get(origin)));
    }

    @Override
    public Uni<Void> save(Cooldown cooldown, long now) {
        return Uni.createFrom().item(() -> {
            cooldowns.put(cooldown.origin(), cooldown);
            return null;
        });
    }

    @Override
    public Uni<Void> delete(String origin) {
        return Uni.createFrom().item(() -> {
            cooldowns.remove(origin);
            return null;
        });
    }

    @Override
    public Uni<Void> deleteAll() {
        return Uni.createFrom().item(() -> {
            cooldowns.clear();
            return null;
        });
    }

    @Override
    public Uni<Long> deleteExpired(long now) {
        return Uni.createFrom().item(() -> {
            final var before = cooldowns.size();
            cooldowns.values().removeIf(cooldown -> !cooldown.isActive(now));
            return (long) (before - cooldowns.size());
        });
    }
}
