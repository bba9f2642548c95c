package pacer.core.service.ratelimit;

import java.time.Clock;
import java.time.Duration;
import java.util.function.Supplier;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import pacer.core.config.AdaptiveConfig;
import pacer.core.model.ratelimit.CapacitySnapshot;
import pacer.core.model.ratelimit.Priority;
import pacer.core.model.ratelimit.RateLimitConfig;
import pacer.core.model.ratelimit.RateLimitStatus;
import pacer.core.model.ratelimit.RequestRecord;
import pacer.core.port.in.AdaptiveRateLimitStore;
import pacer.core.port.out.CooldownRepository;
import pacer.core.port.out.RateLimitRepository;

/**
 * Rate limit store splitting each resource's limit between user and background traffic.
 *
 * <p>Admission of a priority is checked against its own share of the limit and its own
 * slot scope. Activity metrics and capacity snapshots are cached by this instance only;
 * the stored records remain the source of truth.
 */
public final class AdaptiveRateLimitService extends AbstractRateLimitService implements AdaptiveRateLimitStore {

    private static final Logger LOG = Logger.getLogger(AdaptiveRateLimitService.class);

    static final Priority DEFAULT_PRIORITY = Priority.BACKGROUND;

    private final AdaptiveConfig adaptiveConfig;
    private final ActivityMetricsTracker tracker;
    private final AdaptiveCapacityCalculator calculator;

    public AdaptiveRateLimitService(
            RateLimitRepository repository,
            CooldownRepository cooldownRepository,
            ResourceConfigRegistry configs,
            AdaptiveConfig adaptiveConfig,
            Duration cleanupInterval,
            Clock clock) {
        super(repository, cooldownRepository, configs, cleanupInterval, clock);
        this.adaptiveConfig = adaptiveConfig;
        this.tracker = new ActivityMetricsTracker(repository, adaptiveConfig);
        this.calculator = new AdaptiveCapacityCalculator(adaptiveConfig, tracker);
        LOG.infof(
                "Created adaptive rate limit store (default %d/%dms, monitoring window %dms)",
                configs.defaultConfig().limit(),
                configs.defaultConfig().windowMs(),
                adaptiveConfig.monitoringWindowMs());
    }

    @Override
    public Uni<Boolean> canProceed(String resource) {
        return canProceed(resource, DEFAULT_PRIORITY);
    }

    @Override
    public Uni<Boolean> canProceed(String resource, Priority priority) {
        return withPriority(resource, priority, () -> {
            final var config = configs.get(resource);
            if (config.blocksAll()) {
                return Uni.createFrom().item(false);
            }
            final var now = clock.millis();
            return capacity(resource, config, now).flatMap(snapshot -> {
                final var effectiveLimit = AdaptiveCapacityCalculator.effectiveLimit(snapshot, priority);
                if (effectiveLimit <= 0) {
                    return Uni.createFrom().item(false);
                }
                return counter.count(resource, priority, config, now).map(count -> count < effectiveLimit);
            });
        });
    }

    @Override
    public Uni<Boolean> acquire(String resource) {
        return acquire(resource, DEFAULT_PRIORITY);
    }

    @Override
    public Uni<Boolean> acquire(String resource, Priority priority) {
        return withPriority(resource, priority, () -> {
            final var config = configs.get(resource);
            if (config.blocksAll()) {
                return Uni.createFrom().item(false);
            }
            final var now = clock.millis();
            return tracker.ensureLoaded(resource, now).flatMap(metrics -> {
                final var snapshot = calculator.snapshot(resource, config.limit(), metrics, now);
                final var effectiveLimit = AdaptiveCapacityCalculator.effectiveLimit(snapshot, priority);
                return acquirer.acquire(resource, priority, effectiveLimit, config, now)
                        .invoke(acquired -> {
                            if (acquired) {
                                tracker.record(metrics, priority, now);
                            }
                        });
            });
        });
    }

    @Override
    public Uni<Void> record(String resource) {
        return record(resource, DEFAULT_PRIORITY);
    }

    @Override
    public Uni<Void> record(String resource, Priority priority) {
        return withPriority(resource, priority, () -> {
            final var config = configs.get(resource);
            final var now = clock.millis();
            return tracker.ensureLoaded(resource, now).flatMap(metrics -> repository
                    .insert(RequestRecord.create(resource, now, priority), config)
                    .invoke(() -> tracker.record(metrics, priority, now)));
        });
    }

    @Override
    public Uni<RateLimitStatus> getStatus(String resource) {
        return getStatus(resource, DEFAULT_PRIORITY);
    }

    @Override
    public Uni<RateLimitStatus> getStatus(String resource, Priority priority) {
        return withPriority(resource, priority, () -> {
            final var config = configs.get(resource);
            final var now = clock.millis();
            return tracker.ensureLoaded(resource, now).flatMap(metrics -> {
                final var snapshot = calculator.snapshot(resource, config.limit(), metrics, now);
                final var recentUserActivity = tracker.recentUserRequests(metrics, now);
                return counter.count(resource, null, config, now)
                        .flatMap(total -> counter.count(resource, priority, config, now)
                                .map(count -> RateLimitStatus.of(config, total, now)
                                        .withAdaptive(snapshot, recentUserActivity, priority, count)));
            });
        });
    }

    @Override
    public Uni<Long> getWaitTime(String resource) {
        return getWaitTime(resource, DEFAULT_PRIORITY);
    }

    @Override
    public Uni<Long> getWaitTime(String resource, Priority priority) {
        return withPriority(resource, priority, () -> {
            final var config = configs.get(resource);
            if (config.blocksAll()) {
                return Uni.createFrom().item(config.windowMs());
            }
            final var now = clock.millis();
            return capacity(resource, config, now).flatMap(snapshot -> {
                if (snapshot.isPaused(priority)) {
                    return Uni.createFrom().item(adaptiveConfig.recalculationIntervalMs());
                }
                return counter.waitTime(resource, priority, config, snapshot.limitFor(priority), now);
            });
        });
    }

    @Override
    public Uni<Void> reset(String resource) {
        return withResource(resource, () -> repository.deleteResource(resource).invoke(() -> {
            tracker.forget(resource);
            calculator.invalidate(resource);
        }));
    }

    @Override
    protected void onClear() {
        tracker.clear();
        calculator.clear();
    }

    private Uni<CapacitySnapshot> capacity(String resource, RateLimitConfig config, long now) {
        return tracker.ensureLoaded(resource, now)
                .map(metrics -> calculator.snapshot(resource, config.limit(), metrics, now));
    }

    private <T> Uni<T> withPriority(String resource, Priority priority, Supplier<Uni<T>> operation) {
        return withResource(resource, () -> {
            if (priority == null) {
                throw new IllegalArgumentException("priority must not be null");
            }
            return operation.get();
        });
    }
}
