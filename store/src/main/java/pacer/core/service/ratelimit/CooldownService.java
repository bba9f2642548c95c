package pacer.core.service.ratelimit;

import java.time.Clock;
import java.util.Optional;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import pacer.core.model.ratelimit.Cooldown;
import pacer.core.port.out.CooldownRepository;

/**
 * Per-origin cooldowns with expiry on read.
 */
public final class CooldownService {

    private static final Logger LOG = Logger.getLogger(CooldownService.class);

    private final CooldownRepository repository;
    private final Clock clock;

    public CooldownService(CooldownRepository repository, Clock clock) {
        this.repository = repository;
        this.clock = clock;
    }

    public Uni<Void> setCooldown(String origin, long cooldownUntil) {
        return repository.save(new Cooldown(origin, cooldownUntil), clock.millis());
    }

    /**
     * Active cooldown of an origin; an expired one is deleted and reported as absent.
     */
    public Uni<Optional<Long>> getCooldown(String origin) {
        return repository.find(origin).flatMap(stored -> {
            if (stored.isEmpty()) {
                return Uni.createFrom().item(Optional.<Long>empty());
            }
            final var cooldown = stored.get();
            if (cooldown.isActive(clock.millis())) {
                return Uni.createFrom().item(Optional.of(cooldown.cooldownUntil()));
            }
            LOG.debugf("Cooldown of %s expired, removing", origin);
            return repository.delete(origin).replaceWith(Optional.<Long>empty());
        });
    }

    public Uni<Void> clearCooldown(String origin) {
        return repository.delete(origin);
    }

    public Uni<Void> clearAll() {
        return repository.deleteAll();
    }

    public Uni<Long> deleteExpired() {
        return repository.deleteExpired(clock.millis());
    }

    void close() {
        repository.close();
    }
}
