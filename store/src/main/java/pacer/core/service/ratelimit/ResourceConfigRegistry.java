package pacer.core.service.ratelimit;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import pacer.core.model.ratelimit.RateLimitConfig;

/**
 * Per-resource limits with a store-wide fallback.
 *
 * <p>Entries never expire; they are replaced by later assignments.
 */
public final class ResourceConfigRegistry {

    private final RateLimitConfig defaultConfig;
    private final ConcurrentMap<String, RateLimitConfig> configs = new ConcurrentHashMap<>();

    public ResourceConfigRegistry(RateLimitConfig defaultConfig) {
        this(defaultConfig, Map.of());
    }

    public ResourceConfigRegistry(RateLimitConfig defaultConfig, Map<String, RateLimitConfig> initialConfigs) {
        if (defaultConfig == null) {
            throw new IllegalArgumentException("defaultConfig must not be null");
        }
        this.defaultConfig = defaultConfig;
        this.configs.putAll(initialConfigs);
    }

    public void set(String resource, RateLimitConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config must not be null");
        }
        configs.put(resource, config);
    }

    public RateLimitConfig get(String resource) {
        return configs.getOrDefault(resource, defaultConfig);
    }

    public RateLimitConfig defaultConfig() {
        return defaultConfig;
    }
}
