package pacer.adapter.out.ratelimit;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.ServiceLoader;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Produces;
import jakarta.enterprise.inject.Typed;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import pacer.core.config.AdaptiveConfig;
import pacer.core.config.RateLimitingConfig;
import pacer.core.model.ratelimit.RateLimitConfig;
import pacer.core.model.ratelimit.ResourceKeyCodec;
import pacer.core.port.in.AdaptiveRateLimitStore;
import pacer.core.port.in.ManagedRateLimitStore;
import pacer.core.port.in.RateLimitMonitoring;
import pacer.core.port.in.RateLimitStore;
import pacer.core.port.out.CooldownRepository;
import pacer.core.port.out.RateLimitRepository;
import pacer.core.service.ratelimit.AdaptiveRateLimitService;
import pacer.core.service.ratelimit.ResourceConfigRegistry;
import pacer.core.service.ratelimit.SlidingWindowRateLimitService;
import pacer.spi.RateLimitStoreProvider;
import pacer.spi.StorageAdapterConfig;
import pacer.spi.StorageProviderException;

/**
 * CDI producer for the rate limit store.
 *
 * <p>Provider selection:
 * <ol>
 *   <li>If pacer.rate-limit.store.provider is set, use that provider</li>
 *   <li>Otherwise, select the highest priority available provider</li>
 * </ol>
 *
 * <p>The adaptive store is produced when pacer.rate-limit.adaptive.enabled is true.
 * One store instance backs the {@link RateLimitStore}, {@link RateLimitMonitoring}
 * and {@link AdaptiveRateLimitStore} beans. Keys under pacer.rate-limit.resources
 * must be valid resource keys.
 */
@ApplicationScoped
public class RateLimitStoreProviderLoader {

    private static final Logger LOG = Logger.getLogger(RateLimitStoreProviderLoader.class);

    private final RateLimitingConfig config;
    private final StorageAdapterConfig adapterConfig;
    private final List<RateLimitStoreProvider> providers;
    private final Clock clock;

    private ManagedRateLimitStore store;

    @Inject
    public RateLimitStoreProviderLoader(RateLimitingConfig config, StorageAdapterConfig adapterConfig) {
        this(config, adapterConfig, discoverProviders(), Clock.systemUTC());
    }

    RateLimitStoreProviderLoader(
            RateLimitingConfig config,
            StorageAdapterConfig adapterConfig,
            List<RateLimitStoreProvider> providers,
            Clock clock) {
        this.config = config;
        this.adapterConfig = adapterConfig;
        this.providers = List.copyOf(providers);
        this.clock = clock;
    }

    /**
     * Produces the rate limit store for CDI injection.
     *
     * <p>The bean types are restricted so that the adaptive and monitoring producers
     * below do not make {@code RateLimitStore} injection points ambiguous.
     *
     * @return the configured store
     */
    @Produces
    @ApplicationScoped
    @Typed(RateLimitStore.class)
    public RateLimitStore produceRateLimitStore() {
        return store();
    }

    /**
     * Produces the introspection view of the same store.
     *
     * @return the configured store
     */
    @Produces
    @ApplicationScoped
    @Typed(RateLimitMonitoring.class)
    public RateLimitMonitoring produceRateLimitMonitoring() {
        return store();
    }

    /**
     * Produces the priority-aware view of the same store.
     *
     * @return the configured store
     * @throws StorageProviderException if adaptive rate limiting is disabled
     */
    @Produces
    @ApplicationScoped
    @Typed(AdaptiveRateLimitStore.class)
    public AdaptiveRateLimitStore produceAdaptiveRateLimitStore() {
        if (store() instanceof AdaptiveRateLimitStore adaptive) {
            return adaptive;
        }
        throw new StorageProviderException(
                "Adaptive rate limiting is disabled; set pacer.rate-limit.adaptive.enabled=true");
    }

    /**
     * Closes the store, stopping its cleanup and releasing the backend connection.
     */
    void disposeRateLimitStore(@Disposes RateLimitStore store) {
        closeStore();
    }

    void disposeRateLimitMonitoring(@Disposes RateLimitMonitoring monitoring) {
        closeStore();
    }

    void disposeAdaptiveRateLimitStore(@Disposes AdaptiveRateLimitStore store) {
        closeStore();
    }

    synchronized ManagedRateLimitStore store() {
        if (store == null) {
            store = createStore();
        }
        return store;
    }

    private synchronized void closeStore() {
        if (store != null) {
            store.close();
        }
    }

    private ManagedRateLimitStore createStore() {
        final var provider = selectProvider();
        LOG.infof("Using rate limit store provider: %s (%s)", provider.name(), provider.description());

        final var registry = new ResourceConfigRegistry(
                RateLimitConfig.of(config.defaultLimit(), config.defaultWindow()), resourceConfigs());
        final RateLimitRepository repository = provider.createRateLimitRepository(adapterConfig);
        final CooldownRepository cooldownRepository = provider.createCooldownRepository(adapterConfig);

        if (config.adaptive().enabled()) {
            return new AdaptiveRateLimitService(
                    repository,
                    cooldownRepository,
                    registry,
                    AdaptiveConfig.from(config.adaptive()),
                    config.cleanupInterval(),
                    clock);
        }
        return new SlidingWindowRateLimitService(
                repository, cooldownRepository, registry, config.cleanupInterval(), clock);
    }

    RateLimitStoreProvider selectProvider() {
        if (providers.isEmpty()) {
            throw new StorageProviderException(
                    "No rate limit store providers found. Ensure a provider JAR is on the classpath.");
        }

        final var configured = config.store().provider().filter(name -> !name.isBlank());
        if (configured.isPresent()) {
            final var provider = providers.stream()
                    .filter(p -> p.name().equals(configured.get()))
                    .findFirst()
                    .orElseThrow(() -> new StorageProviderException("Configured rate limit store provider not found: "
                            + configured.get() + ". Available: "
                            + providers.stream().map(RateLimitStoreProvider::name).toList()));
            if (!provider.isAvailable(adapterConfig)) {
                throw new StorageProviderException(
                        "Configured rate limit store provider is not available: " + provider.name());
            }
            return provider;
        }

        return providers.stream()
                .filter(p -> p.isAvailable(adapterConfig))
                .max(Comparator.comparingInt(RateLimitStoreProvider::priority))
                .orElseThrow(() -> new StorageProviderException("No available rate limit store providers"));
    }

    private Map<String, RateLimitConfig> resourceConfigs() {
        final Map<String, RateLimitConfig> configs = new LinkedHashMap<>();
        config.resources().forEach((resource, limit) -> {
            ResourceKeyCodec.validateResource(resource);
            configs.put(resource, RateLimitConfig.of(limit.limit(), limit.window()));
        });
        return configs;
    }

    private static List<RateLimitStoreProvider> discoverProviders() {
        final List<RateLimitStoreProvider> found = new ArrayList<>();
        ServiceLoader.load(RateLimitStoreProvider.class).forEach(found::add);
        LOG.debugf(
                "Found %d rate limit store provider(s): %s",
                found.size(), found.stream().map(RateLimitStoreProvider::name).toList());
        return found;
    }
}
