package pacer.core.service.ratelimit;

import java.time.Clock;
import java.time.Duration;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import pacer.core.model.ratelimit.RateLimitStatus;
import pacer.core.model.ratelimit.RequestRecord;
import pacer.core.port.out.CooldownRepository;
import pacer.core.port.out.RateLimitRepository;

/**
 * Sliding window rate limit store over any {@link RateLimitRepository}.
 *
 * <p>Records are stored without a priority and all of them count toward the limit.
 */
public final class SlidingWindowRateLimitService extends AbstractRateLimitService {

    private static final Logger LOG = Logger.getLogger(SlidingWindowRateLimitService.class);

    public SlidingWindowRateLimitService(
            RateLimitRepository repository,
            CooldownRepository cooldownRepository,
            ResourceConfigRegistry configs,
            Duration cleanupInterval,
            Clock clock) {
        super(repository, cooldownRepository, configs, cleanupInterval, clock);
        LOG.infof(
                "Created sliding window rate limit store (default %d/%dms)",
                configs.defaultConfig().limit(), configs.defaultConfig().windowMs());
    }

    @Override
    public Uni<Boolean> canProceed(String resource) {
        return withResource(resource, () -> {
            final var config = configs.get(resource);
            if (config.blocksAll()) {
                return Uni.createFrom().item(false);
            }
            return counter.count(resource, null, config, clock.millis()).map(count -> count < config.limit());
        });
    }

    @Override
    public Uni<Boolean> acquire(String resource) {
        return withResource(resource, () -> {
            final var config = configs.get(resource);
            return acquirer.acquire(resource, null, config.limit(), config, clock.millis());
        });
    }

    @Override
    public Uni<Void> record(String resource) {
        return withResource(resource, () -> {
            final var config = configs.get(resource);
            return repository.insert(RequestRecord.create(resource, clock.millis(), null), config);
        });
    }

    @Override
    public Uni<RateLimitStatus> getStatus(String resource) {
        return withResource(resource, () -> {
            final var config = configs.get(resource);
            final var now = clock.millis();
            return counter.count(resource, null, config, now).map(count -> RateLimitStatus.of(config, count, now));
        });
    }

    @Override
    public Uni<Long> getWaitTime(String resource) {
        return withResource(resource, () -> {
            final var config = configs.get(resource);
            if (config.blocksAll()) {
                return Uni.createFrom().item(config.windowMs());
            }
            return counter.waitTime(resource, null, config, config.limit(), clock.millis());
        });
    }

    @Override
    public Uni<Void> reset(String resource) {
        return withResource(resource, () -> repository.deleteResource(resource));
    }
}
