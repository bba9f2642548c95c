package pacer.spi;

import java.time.Duration;
import java.util.Optional;

/**
 * Configuration access for rate limit store providers.
 *
 * <p>Providers read their backend settings through this interface instead of a
 * specific configuration framework. Only {@link #get(String)} must be implemented;
 * the typed accessors parse its value.
 */
public interface StorageAdapterConfig {

    /**
     * Get an optional configuration value.
     *
     * @param key the configuration key
     * @return the value if present
     */
    Optional<String> get(String key);

    /**
     * Get a required configuration value.
     *
     * @param key the configuration key
     * @return the value
     * @throws StorageProviderException if not configured
     */
    default String getRequired(String key) {
        return get(key).orElseThrow(() -> new StorageProviderException("Required configuration not found: " + key));
    }

    default String getOrDefault(String key, String defaultValue) {
        return get(key).orElse(defaultValue);
    }

    default Optional<Integer> getInt(String key) {
        return get(key).map(String::trim).map(Integer::valueOf);
    }

    default Optional<Boolean> getBoolean(String key) {
        return get(key).map(String::trim).map(Boolean::valueOf);
    }

    /**
     * Get a duration value in ISO-8601 format, e.g. {@code PT5S}.
     */
    default Optional<Duration> getDuration(String key) {
        return get(key).map(String::trim).map(Duration::parse);
    }
}
