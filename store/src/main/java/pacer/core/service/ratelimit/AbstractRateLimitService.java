package pacer.core.service.ratelimit;

import java.time.Clock;
import java.time.Duration;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;
import java.util.stream.Collectors;

import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import pacer.core.exception.StoreDestroyedException;
import pacer.core.model.ratelimit.RateLimitConfig;
import pacer.core.model.ratelimit.RateLimitStats;
import pacer.core.model.ratelimit.ResourceKeyCodec;
import pacer.core.model.ratelimit.ResourceUsage;
import pacer.core.port.in.ManagedRateLimitStore;
import pacer.core.port.out.CooldownRepository;
import pacer.core.port.out.RateLimitRepository;
import pacer.core.port.out.StoreCapability;

/**
 * Lifecycle, validation, cooldowns and maintenance shared by both store variants.
 *
 * <p>Every public operation checks the destroyed flag and validates its key before
 * touching storage. Backends declaring {@link StoreCapability#EXPLICIT_CLEANUP} get a
 * daemon cleanup pass on the configured interval.
 */
abstract class AbstractRateLimitService implements ManagedRateLimitStore {

    private static final Logger LOG = Logger.getLogger(AbstractRateLimitService.class);
    private static final Duration CLEANUP_TIMEOUT = Duration.ofMinutes(1);

    protected final RateLimitRepository repository;
    protected final ResourceConfigRegistry configs;
    protected final SlidingWindowCounter counter;
    protected final AtomicSlotAcquirer acquirer;
    protected final Clock clock;

    private final CooldownService cooldowns;
    private final Set<StoreCapability> capabilities;
    private final AtomicBoolean destroyed = new AtomicBoolean();
    private final ScheduledExecutorService cleanupExecutor;

    protected AbstractRateLimitService(
            RateLimitRepository repository,
            CooldownRepository cooldownRepository,
            ResourceConfigRegistry configs,
            Duration cleanupInterval,
            Clock clock) {
        this.repository = repository;
        this.configs = configs;
        this.clock = clock;
        this.counter = new SlidingWindowCounter(repository);
        this.acquirer = new AtomicSlotAcquirer(repository, counter);
        this.cooldowns = new CooldownService(cooldownRepository, clock);

        final var declared = repository.capabilities();
        this.capabilities = declared.isEmpty() ? EnumSet.noneOf(StoreCapability.class) : EnumSet.copyOf(declared);
        this.cleanupExecutor = startCleanup(cleanupInterval);
    }

    @Override
    public void setResourceConfig(String resource, RateLimitConfig config) {
        ensureOpen();
        configs.set(ResourceKeyCodec.validateResource(resource), config);
    }

    @Override
    public RateLimitConfig getResourceConfig(String resource) {
        ensureOpen();
        return configs.get(ResourceKeyCodec.validateResource(resource));
    }

    @Override
    public Uni<Void> setCooldown(String origin, long cooldownUntil) {
        return withOrigin(origin, () -> cooldowns.setCooldown(origin, cooldownUntil));
    }

    @Override
    public Uni<Optional<Long>> getCooldown(String origin) {
        return withOrigin(origin, () -> cooldowns.getCooldown(origin));
    }

    @Override
    public Uni<Void> clearCooldown(String origin) {
        return withOrigin(origin, () -> cooldowns.clearCooldown(origin));
    }

    @Override
    public Uni<Void> clear() {
        return whenOpen(() -> repository.deleteAll().flatMap(ignored -> cooldowns.clearAll()).invoke(this::onClear));
    }

    @Override
    public Set<StoreCapability> capabilities() {
        return Set.copyOf(capabilities);
    }

    @Override
    public Uni<RateLimitStats> getStats() {
        return whenOpen(() -> {
            requireCapability(StoreCapability.STATISTICS);
            final var now = clock.millis();
            return repository.countByResource().flatMap(counts -> usages(counts.keySet(), now)
                    .map(usages -> new RateLimitStats(
                            counts.values().stream().mapToLong(Long::longValue).sum(),
                            counts.size(),
                            usages.stream()
                                    .filter(usage -> usage.requestCount() >= usage.limit())
                                    .map(ResourceUsage::resource)
                                    .toList())));
        });
    }

    @Override
    public Uni<List<ResourceUsage>> listResources() {
        return whenOpen(() -> {
            requireCapability(StoreCapability.STATISTICS);
            final var now = clock.millis();
            return repository.findResources().flatMap(resources -> usages(resources, now));
        });
    }

    @Override
    public Uni<Long> cleanup() {
        return whenOpen(this::runCleanup);
    }

    /**
     * Close the store. Later calls fail with {@link StoreDestroyedException}.
     */
    @Override
    public void close() {
        if (!destroyed.compareAndSet(false, true)) {
            return;
        }
        stopCleanup();
        onClear();
        repository.close();
        cooldowns.close();
        LOG.infof("Closed %s", getClass().getSimpleName());
    }

    public boolean isDestroyed() {
        return destroyed.get();
    }

    /**
     * Drop per-instance caches. Called on {@code clear()} and {@code close()}.
     */
    protected void onClear() {}

    protected final void ensureOpen() {
        if (destroyed.get()) {
            throw new StoreDestroyedException();
        }
    }

    /**
     * Run a resource operation after the lifecycle and key checks.
     *
     * <p>Check failures are returned as a failed {@link Uni} without invoking the operation.
     */
    protected final <T> Uni<T> withResource(String resource, Supplier<Uni<T>> operation) {
        try {
            ensureOpen();
            ResourceKeyCodec.validateResource(resource);
        } catch (RuntimeException e) {
            return Uni.createFrom().failure(e);
        }
        return Uni.createFrom().deferred(operation::get);
    }

    protected final <T> Uni<T> whenOpen(Supplier<Uni<T>> operation) {
        try {
            ensureOpen();
        } catch (StoreDestroyedException e) {
            return Uni.createFrom().failure(e);
        }
        return Uni.createFrom().deferred(operation::get);
    }

    private <T> Uni<T> withOrigin(String origin, Supplier<Uni<T>> operation) {
        try {
            ensureOpen();
            ResourceKeyCodec.validateOrigin(origin);
        } catch (RuntimeException e) {
            return Uni.createFrom().failure(e);
        }
        return Uni.createFrom().deferred(operation::get);
    }

    private Uni<List<ResourceUsage>> usages(Set<String> resources, long now) {
        return Multi.createFrom()
                .iterable(resources.stream().sorted(Comparator.naturalOrder()).toList())
                .onItem()
                .transformToUniAndConcatenate(resource -> {
                    final var config = configs.get(resource);
                    return counter.count(resource, null, config, now)
                            .map(count -> new ResourceUsage(resource, count, config.limit(), config.windowMs()));
                })
                .collect()
                .asList();
    }

    private Uni<Long> runCleanup() {
        if (!capabilities.contains(StoreCapability.EXPLICIT_CLEANUP)) {
            return Uni.createFrom().item(0L);
        }
        final var now = clock.millis();
        return repository
                .findResources()
                .onItem()
                .transformToMulti(resources -> Multi.createFrom().iterable(resources))
                .onItem()
                .transformToUniAndConcatenate(resource ->
                        repository.deleteOlderThan(resource, configs.get(resource).windowStart(now)))
                .collect()
                .with(Collectors.summingLong(Long::longValue))
                .flatMap(deleted -> repository
                        .deleteExpiredSlots(now)
                        .flatMap(slots -> cooldowns.deleteExpired())
                        .replaceWith(deleted));
    }

    private void requireCapability(StoreCapability capability) {
        if (!capabilities.contains(capability)) {
            throw new UnsupportedOperationException(
                    "%s does not support %s".formatted(repository.getClass().getSimpleName(), capability));
        }
    }

    private ScheduledExecutorService startCleanup(Duration interval) {
        if (!capabilities.contains(StoreCapability.EXPLICIT_CLEANUP)
                || interval == null
                || interval.isZero()
                || interval.isNegative()) {
            return null;
        }
        final var executor = Executors.newSingleThreadScheduledExecutor(r -> {
            var t = new Thread(r, "rate-limit-cleanup");
            t.setDaemon(true);
            return t;
        });
        final var millis = interval.toMillis();
        executor.scheduleAtFixedRate(this::scheduledCleanup, millis, millis, TimeUnit.MILLISECONDS);
        LOG.debugf("Scheduled rate limit cleanup every %s", interval);
        return executor;
    }

    private void scheduledCleanup() {
        if (destroyed.get()) {
            return;
        }
        try {
            final var deleted = runCleanup().await().atMost(CLEANUP_TIMEOUT);
            if (deleted > 0) {
                LOG.debugf("Cleanup removed %d expired request records", deleted);
            }
        } catch (RuntimeException e) {
            LOG.warnv(e, "Rate limit cleanup failed");
        }
    }

    private void stopCleanup() {
        if (cleanupExecutor == null) {
            return;
        }
        cleanupExecutor.shutdown();
        try {
            if (!cleanupExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                cleanupExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            cleanupExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
