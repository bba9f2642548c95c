package pacer.adapter.out.ratelimit.memory;

import pacer.core.port.out.CooldownRepository;
import pacer.core.port.out.RateLimitRepository;
import pacer.spi.RateLimitStoreProvider;
import pacer.spi.StorageAdapterConfig;

/**
 * In-memory rate limit store provider.
 *
 * <p>This provider is always available as a fallback. It has the lowest
 * priority (0), so persistent providers are preferred when configured.
 */
public final class InMemoryRateLimitStoreProvider implements RateLimitStoreProvider {

    private static final int PRIORITY = 0;
    private static final String NAME = "memory";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String description() {
        return "In-memory storage (single process, not persisted)";
    }

    @Override
    public int priority() {
        return PRIORITY;
    }

    @Override
    public boolean isAvailable(StorageAdapterConfig config) {
        return true;
    }

    @Override
    public RateLimitRepository createRateLimitRepository(StorageAdapterConfig config) {
        return new InMemoryRateLimitRepository();
    }

    @Override
    public CooldownRepository createCooldownRepository(StorageAdapterConfig config) {
        return new InMemoryCooldownRepository();
    }
}
