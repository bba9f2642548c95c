package pacer.spi;

import pacer.core.port.out.CooldownRepository;
import pacer.core.port.out.RateLimitRepository;

/**
 * Service Provider Interface for rate limit storage backends.
 *
 * <p>Implementations are discovered via {@link java.util.ServiceLoader} and
 * selected by name or, when none is configured, by priority among the available ones.
 *
 * <p>Built-in providers:
 * <ul>
 *   <li>memory (priority 0) - Single process, always available</li>
 *   <li>sqlite (priority 5) - Single host, persisted to a database file</li>
 *   <li>cassandra (priority 10) - Shared by every instance of a fleet</li>
 * </ul>
 *
 * <p>To create a custom provider:
 * <ol>
 *   <li>Implement this interface</li>
 *   <li>Register in {@code META-INF/services/pacer.spi.RateLimitStoreProvider}</li>
 *   <li>Return appropriate priority</li>
 * </ol>
 *
 * <p>Both repositories of one provider share its connection. Closing either one
 * releases it.
 */
public interface RateLimitStoreProvider {

    /**
     * Return the name of this provider for logging and configuration.
     *
     * @return the provider name (e.g., "memory", "sqlite")
     */
    String name();

    /**
     * Human-readable description.
     */
    String description();

    /**
     * Return the priority of this provider. Higher values win.
     *
     * @return the provider priority
     */
    int priority();

    /**
     * Check if this provider can be used with the given configuration.
     *
     * <p>Providers check for their driver on the classpath and for the
     * settings they cannot default.
     *
     * @param config the adapter configuration
     * @return true if the provider can be used
     */
    boolean isAvailable(StorageAdapterConfig config);

    /**
     * Create the request record repository.
     *
     * @param config the adapter configuration
     * @return the repository
     * @throws StorageProviderException if the backend cannot be reached
     */
    RateLimitRepository createRateLimitRepository(StorageAdapterConfig config);

    /**
     * Create the cooldown repository.
     *
     * @param config the adapter configuration
     * @return the repository
     * @throws StorageProviderException if the backend cannot be reached
     */
    CooldownRepository createCooldownRepository(StorageAdapterConfig config);
}
